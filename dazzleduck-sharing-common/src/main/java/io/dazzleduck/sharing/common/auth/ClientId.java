package io.dazzleduck.sharing.common.auth;

import java.util.List;

/**
 * A grantable principal as stored by a catalog backend. Several recipients may map to one client
 * through the {@link #ANONYMOUS_PRINCIPAL}.
 */
public record ClientId(String id, String name) {

    /**
     * Name of the principal under which backends store grants issued to anonymous recipients.
     */
    public static final String ANONYMOUS_PRINCIPAL = "ANONYMOUS";

    /**
     * Principal names whose grants apply to the recipient, the recipient's own name first.
     */
    public static List<String> principalsOf(RecipientId recipient) {
        if (recipient instanceof RecipientId.Named named && !ANONYMOUS_PRINCIPAL.equals(named.name())) {
            return List.of(named.name(), ANONYMOUS_PRINCIPAL);
        }
        return List.of(ANONYMOUS_PRINCIPAL);
    }
}
