package io.dazzleduck.sharing.catalog.acl;

import io.dazzleduck.sharing.catalog.Catalog;
import io.dazzleduck.sharing.common.ShareReader;
import io.dazzleduck.sharing.common.auth.RecipientId;
import io.dazzleduck.sharing.common.model.Page;
import io.dazzleduck.sharing.common.model.Pagination;
import io.dazzleduck.sharing.common.model.Schema;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;
import io.dazzleduck.sharing.common.model.TableRef;
import io.dazzleduck.sharing.common.table.FileQuery;
import io.dazzleduck.sharing.common.table.TableFiles;
import io.dazzleduck.sharing.common.table.TableMetadata;
import io.dazzleduck.sharing.common.table.VersionSpec;

/**
 * The catalog as seen by one recipient. Grants are read from the catalog on first use and reused
 * for the rest of the request.
 */
public class AccessControlledShareReader implements ShareReader {

    private final Catalog catalog;
    private final RecipientId recipient;
    private Grants grants;

    AccessControlledShareReader(Catalog catalog, RecipientId recipient) {
        this.catalog = catalog;
        this.recipient = recipient;
    }

    private Grants grants() {
        if (grants == null) {
            grants = new Grants(catalog.grantsFor(recipient));
        }
        return grants;
    }

    @Override
    public Page<Share> listShares(Pagination pagination) {
        return catalog.listShares(pagination, grants());
    }

    @Override
    public Share getShare(String share) {
        return catalog.getShare(share, grants());
    }

    @Override
    public Page<Schema> listSchemas(String share, Pagination pagination) {
        return catalog.listSchemas(share, pagination, grants());
    }

    @Override
    public Page<Table> listTables(String share, String schema, Pagination pagination) {
        return catalog.listTables(share, schema, pagination, grants());
    }

    @Override
    public Page<Table> listAllTables(String share, Pagination pagination) {
        return catalog.listAllTables(share, pagination, grants());
    }

    @Override
    public Table getTable(TableRef table) {
        return catalog.getTable(table, grants());
    }

    @Override
    public TableMetadata getTableMetadata(TableRef table, VersionSpec version) {
        return catalog.getTableMetadata(table, version, grants());
    }

    @Override
    public long getTableVersion(TableRef table, VersionSpec version) {
        return catalog.getTableVersion(table, version, grants());
    }

    @Override
    public TableFiles getTableFileActions(TableRef table, FileQuery query) {
        return catalog.getTableFileActions(table, query, grants());
    }
}
