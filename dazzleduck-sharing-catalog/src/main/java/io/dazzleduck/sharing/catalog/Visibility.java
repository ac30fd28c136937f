package io.dazzleduck.sharing.catalog;

import io.dazzleduck.sharing.common.model.Schema;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;

/**
 * Decides which catalog entities a caller may see.
 */
public interface Visibility {

    Visibility ALL = new Visibility() {
        @Override
        public boolean canSee(Share share) {
            return true;
        }

        @Override
        public boolean canSee(Schema schema) {
            return true;
        }

        @Override
        public boolean canSee(Table table) {
            return true;
        }
    };

    boolean canSee(Share share);

    boolean canSee(Schema schema);

    boolean canSee(Table table);
}
