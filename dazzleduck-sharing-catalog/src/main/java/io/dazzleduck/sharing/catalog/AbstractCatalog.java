package io.dazzleduck.sharing.catalog;

import io.dazzleduck.sharing.common.error.NotFoundException;
import io.dazzleduck.sharing.common.error.PermissionDeniedException;
import io.dazzleduck.sharing.common.model.Page;
import io.dazzleduck.sharing.common.model.Pagination;
import io.dazzleduck.sharing.common.model.Schema;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;
import io.dazzleduck.sharing.common.model.TableRef;
import io.dazzleduck.sharing.common.pagination.ListScope;
import io.dazzleduck.sharing.common.pagination.PageLimits;
import io.dazzleduck.sharing.common.pagination.PageToken;
import io.dazzleduck.sharing.common.pagination.PageTokenCodec;
import io.dazzleduck.sharing.common.table.FileQuery;
import io.dazzleduck.sharing.common.table.TableFiles;
import io.dazzleduck.sharing.common.table.TableMetadata;
import io.dazzleduck.sharing.common.table.VersionSpec;
import io.dazzleduck.sharing.table.TableResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Lookup, visibility checks and pagination shared by all backends.
 *
 * <p>Backends provide ordered scans that return up to {@code limit} entities strictly after a
 * position, fewer only when the scan is exhausted. Each entity carries the token resuming right
 * after it. Page tokens handed to clients always point at the last entity returned to them.
 *
 * @param <P> the page token variant of the backend
 */
public abstract class AbstractCatalog<P extends PageToken> implements Catalog {

    @FunctionalInterface
    protected interface Scan<T, P extends PageToken> {
        List<Positioned<T, P>> scan(P after, int limit);
    }

    protected final TableResolver resolver;
    protected final PageLimits limits;
    private final Class<P> tokenType;

    protected AbstractCatalog(TableResolver resolver, PageLimits limits, Class<P> tokenType) {
        this.resolver = resolver;
        this.limits = limits;
        this.tokenType = tokenType;
    }

    /**
     * Identifies this catalog instance in page tokens.
     */
    protected abstract String instanceId();

    protected abstract Optional<Share> findShare(String name);

    protected abstract Optional<Schema> findSchema(Share share, String name);

    protected abstract Optional<Table> findTable(Schema schema, String name);

    protected abstract List<Positioned<Share, P>> scanShares(ListScope scope, P after, int limit);

    protected abstract List<Positioned<Schema, P>> scanSchemas(ListScope scope, Share share, P after, int limit);

    protected abstract List<Positioned<Table, P>> scanTables(ListScope scope, Schema schema, P after, int limit);

    /**
     * Tables of every schema of the share, ordered by schema name, table name and id.
     */
    protected abstract List<Positioned<Table, P>> scanAllTables(ListScope scope, Share share, P after, int limit);

    @Override
    public Page<Share> listShares(Pagination pagination, Visibility visibility) {
        var scope = ListScope.shares();
        return page(scope, pagination, (after, limit) -> scanShares(scope, after, limit), visibility::canSee);
    }

    @Override
    public Share getShare(String share, Visibility visibility) {
        var found = findShare(share).orElseThrow(() -> new NotFoundException("share " + share + " does not exist"));
        if (!visibility.canSee(found)) {
            throw new PermissionDeniedException("no access to share " + share);
        }
        return found;
    }

    @Override
    public Page<Schema> listSchemas(String share, Pagination pagination, Visibility visibility) {
        var scope = ListScope.schemas(share);
        var parent = getShare(share, visibility);
        return page(scope, pagination, (after, limit) -> scanSchemas(scope, parent, after, limit), visibility::canSee);
    }

    @Override
    public Page<Table> listTables(String share, String schema, Pagination pagination, Visibility visibility) {
        var scope = ListScope.tables(share, schema);
        var parent = getSchema(share, schema, visibility);
        return page(scope, pagination, (after, limit) -> scanTables(scope, parent, after, limit), visibility::canSee);
    }

    @Override
    public Page<Table> listAllTables(String share, Pagination pagination, Visibility visibility) {
        var scope = ListScope.allTables(share);
        var parent = getShare(share, visibility);
        return page(scope, pagination, (after, limit) -> scanAllTables(scope, parent, after, limit), visibility::canSee);
    }

    @Override
    public Table getTable(TableRef table, Visibility visibility) {
        var schema = getSchema(table.share(), table.schema(), visibility);
        var found = findTable(schema, table.table())
                .orElseThrow(() -> new NotFoundException("table " + table + " does not exist"));
        if (!visibility.canSee(found)) {
            throw new PermissionDeniedException("no access to table " + table);
        }
        return found;
    }

    @Override
    public TableMetadata getTableMetadata(TableRef table, VersionSpec version, Visibility visibility) {
        return withTable(table, visibility, t -> resolver.metadata(t, version));
    }

    @Override
    public long getTableVersion(TableRef table, VersionSpec version, Visibility visibility) {
        return withTable(table, visibility, t -> resolver.version(t, version));
    }

    @Override
    public TableFiles getTableFileActions(TableRef table, FileQuery query, Visibility visibility) {
        return withTable(table, visibility, t -> resolver.files(t, query));
    }

    /**
     * Looks up a table and resolves its contents. Backends that need the lookup and the log read to
     * observe one consistent view override this.
     */
    protected <T> T withTable(TableRef table, Visibility visibility, Function<Table, T> action) {
        return action.apply(getTable(table, visibility));
    }

    protected Schema getSchema(String share, String schema, Visibility visibility) {
        var parent = getShare(share, visibility);
        var found = findSchema(parent, schema)
                .orElseThrow(() -> new NotFoundException("schema " + share + "." + schema + " does not exist"));
        if (!visibility.canSee(found)) {
            throw new PermissionDeniedException("no access to schema " + share + "." + schema);
        }
        return found;
    }

    private <T> Page<T> page(ListScope scope, Pagination pagination, Scan<T, P> scan, Predicate<T> visible) {
        int limit = limits.resolve(pagination.maxResults());
        P from = PageTokenCodec.decode(pagination.pageToken(), tokenType, instanceId(), scope);
        var items = new ArrayList<T>(limit);
        P lastReturned = from;
        int batchSize = limit + 1;
        while (true) {
            var batch = scan.scan(from, batchSize);
            for (var entry : batch) {
                from = entry.position();
                if (!visible.test(entry.item())) {
                    continue;
                }
                if (items.size() == limit) {
                    return new Page<>(items, PageTokenCodec.encode(lastReturned));
                }
                items.add(entry.item());
                lastReturned = entry.position();
            }
            if (batch.size() < batchSize) {
                return Page.last(items);
            }
        }
    }
}
