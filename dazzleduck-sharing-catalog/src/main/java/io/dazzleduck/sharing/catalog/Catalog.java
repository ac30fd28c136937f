package io.dazzleduck.sharing.catalog;

import io.dazzleduck.sharing.catalog.acl.Grant;
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

import java.util.List;

/**
 * A storage backend for shares, schemas, tables and grants.
 *
 * <p>Every operation takes the {@link Visibility} of the caller. Listings skip invisible entities
 * before paginating, so neither page sizes nor page tokens reveal them. Lookups of an invisible
 * entity, or of anything below it, raise
 * {@link io.dazzleduck.sharing.common.error.PermissionDeniedException}. The plain
 * {@link ShareReader} methods see everything.
 */
public interface Catalog extends ShareReader {

    Page<Share> listShares(Pagination pagination, Visibility visibility);

    Share getShare(String share, Visibility visibility);

    Page<Schema> listSchemas(String share, Pagination pagination, Visibility visibility);

    Page<Table> listTables(String share, String schema, Pagination pagination, Visibility visibility);

    Page<Table> listAllTables(String share, Pagination pagination, Visibility visibility);

    Table getTable(TableRef table, Visibility visibility);

    TableMetadata getTableMetadata(TableRef table, VersionSpec version, Visibility visibility);

    long getTableVersion(TableRef table, VersionSpec version, Visibility visibility);

    TableFiles getTableFileActions(TableRef table, FileQuery query, Visibility visibility);

    /**
     * Grants issued to the recipient, including those issued to the anonymous principal.
     */
    List<Grant> grantsFor(RecipientId recipient);

    /**
     * Cheap round trip to the backend, used by health checks.
     */
    void ping();

    @Override
    default Page<Share> listShares(Pagination pagination) {
        return listShares(pagination, Visibility.ALL);
    }

    @Override
    default Share getShare(String share) {
        return getShare(share, Visibility.ALL);
    }

    @Override
    default Page<Schema> listSchemas(String share, Pagination pagination) {
        return listSchemas(share, pagination, Visibility.ALL);
    }

    @Override
    default Page<Table> listTables(String share, String schema, Pagination pagination) {
        return listTables(share, schema, pagination, Visibility.ALL);
    }

    @Override
    default Page<Table> listAllTables(String share, Pagination pagination) {
        return listAllTables(share, pagination, Visibility.ALL);
    }

    @Override
    default Table getTable(TableRef table) {
        return getTable(table, Visibility.ALL);
    }

    @Override
    default TableMetadata getTableMetadata(TableRef table, VersionSpec version) {
        return getTableMetadata(table, version, Visibility.ALL);
    }

    @Override
    default long getTableVersion(TableRef table, VersionSpec version) {
        return getTableVersion(table, version, Visibility.ALL);
    }

    @Override
    default TableFiles getTableFileActions(TableRef table, FileQuery query) {
        return getTableFileActions(table, query, Visibility.ALL);
    }
}
