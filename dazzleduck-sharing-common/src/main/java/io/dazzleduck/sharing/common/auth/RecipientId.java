package io.dazzleduck.sharing.common.auth;

/**
 * Identity of the consumer of a request. Produced once per request by the authentication layer and
 * passed by parameter to every catalog and access-control call.
 */
public sealed interface RecipientId permits RecipientId.Named, RecipientId.Anonymous {

    static RecipientId named(String name) {
        return new Named(name);
    }

    static RecipientId anonymous() {
        return Anonymous.INSTANCE;
    }

    boolean isAnonymous();

    record Named(String name) implements RecipientId {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("recipient name must not be blank");
            }
        }

        @Override
        public boolean isAnonymous() {
            return false;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    enum Anonymous implements RecipientId {
        INSTANCE;

        @Override
        public boolean isAnonymous() {
            return true;
        }

        @Override
        public String toString() {
            return "anonymous";
        }
    }
}
