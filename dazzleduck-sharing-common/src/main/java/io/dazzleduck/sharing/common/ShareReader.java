package io.dazzleduck.sharing.common;

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
 * Read access to shares, schemas and tables and to the versioned contents of tables.
 *
 * <p>Listings are ordered by name and then id, all-tables listings by schema name, table name and
 * id. Missing entities raise {@link io.dazzleduck.sharing.common.error.NotFoundException}; entities
 * the caller may not see raise {@link io.dazzleduck.sharing.common.error.PermissionDeniedException}.
 * Malformed page tokens and versions raise {@link io.dazzleduck.sharing.common.error.BadRequestException}.
 */
public interface ShareReader {

    Page<Share> listShares(Pagination pagination);

    Share getShare(String share);

    Page<Schema> listSchemas(String share, Pagination pagination);

    Page<Table> listTables(String share, String schema, Pagination pagination);

    /**
     * Tables of every schema in the share.
     */
    Page<Table> listAllTables(String share, Pagination pagination);

    Table getTable(TableRef table);

    TableMetadata getTableMetadata(TableRef table, VersionSpec version);

    long getTableVersion(TableRef table, VersionSpec version);

    TableFiles getTableFileActions(TableRef table, FileQuery query);
}
