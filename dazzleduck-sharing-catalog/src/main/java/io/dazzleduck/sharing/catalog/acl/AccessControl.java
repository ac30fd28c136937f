package io.dazzleduck.sharing.catalog.acl;

import io.dazzleduck.sharing.catalog.Catalog;
import io.dazzleduck.sharing.common.ShareReader;
import io.dazzleduck.sharing.common.auth.RecipientId;

/**
 * Entry point of the access-control layer: hands out per-request views of a catalog.
 */
public class AccessControl {

    private final Catalog catalog;

    public AccessControl(Catalog catalog) {
        this.catalog = catalog;
    }

    public ShareReader readerFor(RecipientId recipient) {
        return new AccessControlledShareReader(catalog, recipient);
    }
}
