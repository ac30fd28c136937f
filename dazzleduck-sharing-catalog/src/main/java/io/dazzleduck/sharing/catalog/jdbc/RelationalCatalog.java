package io.dazzleduck.sharing.catalog.jdbc;

import io.dazzleduck.sharing.catalog.AbstractCatalog;
import io.dazzleduck.sharing.catalog.Positioned;
import io.dazzleduck.sharing.catalog.Visibility;
import io.dazzleduck.sharing.catalog.acl.Grant;
import io.dazzleduck.sharing.common.auth.ClientId;
import io.dazzleduck.sharing.common.auth.RecipientId;
import io.dazzleduck.sharing.common.error.BadRequestException;
import io.dazzleduck.sharing.common.error.InternalException;
import io.dazzleduck.sharing.common.model.Schema;
import io.dazzleduck.sharing.common.model.Share;
import io.dazzleduck.sharing.common.model.Table;
import io.dazzleduck.sharing.common.model.TableRef;
import io.dazzleduck.sharing.common.pagination.ListScope;
import io.dazzleduck.sharing.common.pagination.PageLimits;
import io.dazzleduck.sharing.common.pagination.PageTokenCodec;
import io.dazzleduck.sharing.common.pagination.RelationalToken;
import io.dazzleduck.sharing.common.util.Retry;
import io.dazzleduck.sharing.table.TableResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.sql.DataSource;

/**
 * Catalog stored in a relational database, listed with keyset pagination.
 *
 * <p>Table reads run the table lookup and the log read inside one read-only transaction bound to
 * the calling thread, so the table cannot be re-pointed between the two.
 */
public class RelationalCatalog extends AbstractCatalog<RelationalToken> {

    private static final Logger logger = LoggerFactory.getLogger(RelationalCatalog.class);

    public static final String SCHEMA_RESOURCE = "schema.sql";

    private final DataSource dataSource;
    private final DatabaseDialect dialect;
    private final String instance;
    private final Retry retry;
    private final ThreadLocal<Connection> transaction = new ThreadLocal<>();

    @FunctionalInterface
    interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    /**
     * Marks a transient database failure that is worth another attempt.
     */
    static class TransientSqlException extends InternalException {
        TransientSqlException(SQLException cause) {
            super("catalog store is temporarily unavailable", cause);
        }
    }

    /**
     * @param source identifies the database, typically its url. Only a digest of it reaches page
     *               tokens and logs.
     */
    public RelationalCatalog(DataSource dataSource, DatabaseDialect dialect, String source, Retry retry,
                             TableResolver resolver, PageLimits limits) {
        super(resolver, limits, RelationalToken.class);
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.instance = PageTokenCodec.instanceId(source);
        this.retry = retry;
    }

    /**
     * Creates the catalog tables when they do not exist yet.
     */
    public void initializeSchema() {
        String ddl;
        try (InputStream in = RelationalCatalog.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing " + SCHEMA_RESOURCE);
            }
            ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("cannot read " + SCHEMA_RESOURCE, e);
        }
        execute("initialize schema", connection -> {
            try (var statement = connection.createStatement()) {
                for (var sql : ddl.split(";")) {
                    if (!sql.isBlank()) {
                        statement.execute(sql);
                    }
                }
            }
            return null;
        });
        logger.info("Catalog schema ready on {}", instance);
    }

    @Override
    protected String instanceId() {
        return instance;
    }

    @Override
    protected <T> T withTable(TableRef table, Visibility visibility, Function<Table, T> action) {
        return inReadTransaction(() -> super.withTable(table, visibility, action));
    }

    @Override
    protected Optional<Share> findShare(String name) {
        return execute("find share", connection -> {
            try (var statement = connection.prepareStatement(
                    "SELECT CAST(id AS VARCHAR) AS id, name FROM \"share\" WHERE name = ?")) {
                statement.setString(1, name);
                try (var rs = statement.executeQuery()) {
                    return rs.next() ? Optional.of(toShare(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    protected Optional<Schema> findSchema(Share share, String name) {
        return execute("find schema", connection -> {
            try (var statement = connection.prepareStatement(
                    "SELECT CAST(id AS VARCHAR) AS id, name FROM \"schema\" WHERE share_id = CAST(? AS UUID) AND name = ?")) {
                statement.setString(1, share.id());
                statement.setString(2, name);
                try (var rs = statement.executeQuery()) {
                    return rs.next() ? Optional.of(toSchema(share, rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    protected Optional<Table> findTable(Schema schema, String name) {
        return execute("find table", connection -> {
            try (var statement = connection.prepareStatement(
                    "SELECT CAST(id AS VARCHAR) AS id, name, storage_path, storage_format FROM \"table\" "
                            + "WHERE schema_id = CAST(? AS UUID) AND name = ?")) {
                statement.setString(1, schema.id());
                statement.setString(2, name);
                try (var rs = statement.executeQuery()) {
                    return rs.next() ? Optional.of(toTable(schema, rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    protected List<Positioned<Share, RelationalToken>> scanShares(ListScope scope, RelationalToken after, int limit) {
        var keys = keyset(after, 2);
        var sql = "SELECT CAST(id AS VARCHAR) AS id, name FROM \"share\""
                + (keys == null ? "" : " WHERE " + namedAfter("name", "id"))
                + " ORDER BY name" + dialect.collation() + ", id LIMIT ?";
        return execute("list shares", connection -> {
            try (var statement = connection.prepareStatement(sql)) {
                int i = bindNamedAfter(statement, 1, keys);
                statement.setInt(i, limit);
                var result = new ArrayList<Positioned<Share, RelationalToken>>(limit);
                try (var rs = statement.executeQuery()) {
                    while (rs.next()) {
                        var share = toShare(rs);
                        result.add(new Positioned<>(share, token(scope, share.name(), share.id())));
                    }
                }
                return result;
            }
        });
    }

    @Override
    protected List<Positioned<Schema, RelationalToken>> scanSchemas(ListScope scope, Share share, RelationalToken after, int limit) {
        var keys = keyset(after, 2);
        var sql = "SELECT CAST(id AS VARCHAR) AS id, name FROM \"schema\" WHERE share_id = CAST(? AS UUID)"
                + (keys == null ? "" : " AND " + namedAfter("name", "id"))
                + " ORDER BY name" + dialect.collation() + ", id LIMIT ?";
        return execute("list schemas", connection -> {
            try (var statement = connection.prepareStatement(sql)) {
                statement.setString(1, share.id());
                int i = bindNamedAfter(statement, 2, keys);
                statement.setInt(i, limit);
                var result = new ArrayList<Positioned<Schema, RelationalToken>>(limit);
                try (var rs = statement.executeQuery()) {
                    while (rs.next()) {
                        var schema = toSchema(share, rs);
                        result.add(new Positioned<>(schema, token(scope, schema.name(), schema.id())));
                    }
                }
                return result;
            }
        });
    }

    @Override
    protected List<Positioned<Table, RelationalToken>> scanTables(ListScope scope, Schema schema, RelationalToken after, int limit) {
        var keys = keyset(after, 2);
        var sql = "SELECT CAST(id AS VARCHAR) AS id, name, storage_path, storage_format FROM \"table\" "
                + "WHERE schema_id = CAST(? AS UUID)"
                + (keys == null ? "" : " AND " + namedAfter("name", "id"))
                + " ORDER BY name" + dialect.collation() + ", id LIMIT ?";
        return execute("list tables", connection -> {
            try (var statement = connection.prepareStatement(sql)) {
                statement.setString(1, schema.id());
                int i = bindNamedAfter(statement, 2, keys);
                statement.setInt(i, limit);
                var result = new ArrayList<Positioned<Table, RelationalToken>>(limit);
                try (var rs = statement.executeQuery()) {
                    while (rs.next()) {
                        var table = toTable(schema, rs);
                        result.add(new Positioned<>(table, token(scope, table.name(), table.id())));
                    }
                }
                return result;
            }
        });
    }

    @Override
    protected List<Positioned<Table, RelationalToken>> scanAllTables(ListScope scope, Share share, RelationalToken after, int limit) {
        var keys = keyset(after, 3);
        var collation = dialect.collation();
        var sql = "SELECT CAST(t.id AS VARCHAR) AS id, t.name, t.storage_path, t.storage_format, "
                + "CAST(sc.id AS VARCHAR) AS schema_id, sc.name AS schema_name "
                + "FROM \"table\" t JOIN \"schema\" sc ON sc.id = t.schema_id "
                + "WHERE sc.share_id = CAST(? AS UUID)"
                + (keys == null ? "" : " AND (sc.name" + collation + " > ? OR (sc.name = ? AND "
                + namedAfter("t.name", "t.id") + "))")
                + " ORDER BY sc.name" + collation + ", t.name" + collation + ", t.id LIMIT ?";
        return execute("list all tables", connection -> {
            try (var statement = connection.prepareStatement(sql)) {
                statement.setString(1, share.id());
                int i = 2;
                if (keys != null) {
                    statement.setString(i++, keys.get(0));
                    statement.setString(i++, keys.get(0));
                    i = bindNamedAfter(statement, i, keys.subList(1, 3));
                }
                statement.setInt(i, limit);
                var result = new ArrayList<Positioned<Table, RelationalToken>>(limit);
                try (var rs = statement.executeQuery()) {
                    while (rs.next()) {
                        var schema = new Schema(rs.getString("schema_id"), rs.getString("schema_name"), share.id(), share.name());
                        var table = toTable(schema, rs);
                        result.add(new Positioned<>(table, new RelationalToken(instance, scope.shape(),
                                List.of(schema.name(), table.name(), table.id()))));
                    }
                }
                return result;
            }
        });
    }

    @Override
    public List<Grant> grantsFor(RecipientId recipient) {
        var principals = ClientId.principalsOf(recipient);
        return execute("load grants", connection -> {
            var clients = clients(connection, principals);
            if (clients.isEmpty()) {
                return List.<Grant>of();
            }
            var ids = clients.stream().map(ClientId::id).collect(Collectors.toList());
            var in = placeholders(ids.size(), "CAST(? AS UUID)");
            var grants = new ArrayList<Grant>();
            try (var statement = connection.prepareStatement(
                    "SELECT CAST(a.share_id AS VARCHAR) FROM \"share_acl\" a "
                            + "WHERE a.client_id IN (" + in + ")")) {
                bindAll(statement, ids);
                try (var rs = statement.executeQuery()) {
                    while (rs.next()) {
                        grants.add(Grant.share(rs.getString(1)));
                    }
                }
            }
            try (var statement = connection.prepareStatement(
                    "SELECT CAST(sc.share_id AS VARCHAR), CAST(sc.id AS VARCHAR) FROM \"schema_acl\" a "
                            + "JOIN \"schema\" sc ON sc.id = a.schema_id WHERE a.client_id IN (" + in + ")")) {
                bindAll(statement, ids);
                try (var rs = statement.executeQuery()) {
                    while (rs.next()) {
                        grants.add(Grant.schema(rs.getString(1), rs.getString(2)));
                    }
                }
            }
            try (var statement = connection.prepareStatement(
                    "SELECT CAST(sc.share_id AS VARCHAR), CAST(sc.id AS VARCHAR), CAST(t.id AS VARCHAR) FROM \"table_acl\" a "
                            + "JOIN \"table\" t ON t.id = a.table_id "
                            + "JOIN \"schema\" sc ON sc.id = t.schema_id WHERE a.client_id IN (" + in + ")")) {
                bindAll(statement, ids);
                try (var rs = statement.executeQuery()) {
                    while (rs.next()) {
                        grants.add(Grant.table(rs.getString(1), rs.getString(2), rs.getString(3)));
                    }
                }
            }
            logger.debug("Loaded {} grants of clients {}", grants.size(),
                    clients.stream().map(ClientId::name).collect(Collectors.toList()));
            return grants;
        });
    }

    /**
     * Clients registered under the given principal names. Names without a client row have no grants.
     */
    List<ClientId> clients(Connection connection, List<String> principals) throws SQLException {
        var clients = new ArrayList<ClientId>(principals.size());
        try (var statement = connection.prepareStatement(
                "SELECT CAST(id AS VARCHAR), name FROM \"client\" WHERE name IN (" + placeholders(principals.size(), "?") + ")")) {
            bindAll(statement, principals);
            try (var rs = statement.executeQuery()) {
                while (rs.next()) {
                    clients.add(new ClientId(rs.getString(1), rs.getString(2)));
                }
            }
        }
        return clients;
    }

    @Override
    public void ping() {
        execute("ping", connection -> {
            try (var statement = connection.createStatement(); var rs = statement.executeQuery("SELECT 1")) {
                return rs.next();
            }
        });
    }

    private String namedAfter(String nameColumn, String idColumn) {
        return "(" + nameColumn + dialect.collation() + " > ? OR (" + nameColumn + " = ? AND "
                + idColumn + " > CAST(? AS UUID)))";
    }

    private static int bindNamedAfter(PreparedStatement statement, int index, List<String> keys) throws SQLException {
        if (keys == null) {
            return index;
        }
        statement.setString(index++, keys.get(0));
        statement.setString(index++, keys.get(0));
        statement.setString(index++, keys.get(1));
        return index;
    }

    private static void bindAll(PreparedStatement statement, List<String> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            statement.setString(i + 1, values.get(i));
        }
    }

    private static String placeholders(int count, String placeholder) {
        return String.join(", ", Collections.nCopies(count, placeholder));
    }

    /**
     * Sort key of the last returned row; its last element is always an id.
     */
    private static List<String> keyset(RelationalToken token, int size) {
        if (token == null) {
            return null;
        }
        var after = token.after();
        if (after == null || after.size() != size || after.contains(null)) {
            throw new BadRequestException("page token does not belong to this listing");
        }
        try {
            UUID.fromString(after.get(size - 1));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("page token does not belong to this listing", e);
        }
        return after;
    }

    private RelationalToken token(ListScope scope, String name, String id) {
        return new RelationalToken(instance, scope.shape(), List.of(name, id));
    }

    private static Share toShare(ResultSet rs) throws SQLException {
        return new Share(rs.getString("id"), rs.getString("name"));
    }

    private static Schema toSchema(Share share, ResultSet rs) throws SQLException {
        return new Schema(rs.getString("id"), rs.getString("name"), share.id(), share.name());
    }

    private static Table toTable(Schema schema, ResultSet rs) throws SQLException {
        var format = rs.getString("storage_format");
        return new Table(rs.getString("id"), rs.getString("name"), schema.id(), schema.name(),
                schema.shareId(), schema.shareName(), rs.getString("storage_path"),
                format == null ? Table.DEFAULT_FORMAT : format);
    }

    private <T> T execute(String operation, SqlWork<T> work) {
        var bound = transaction.get();
        if (bound != null) {
            return run(operation, work, bound);
        }
        return retry.call(operation, () -> {
            try (var connection = dataSource.getConnection()) {
                return run(operation, work, connection);
            } catch (SQLException e) {
                throw translate(operation, e);
            }
        }, TransientSqlException.class::isInstance);
    }

    private <T> T run(String operation, SqlWork<T> work, Connection connection) {
        try {
            return work.run(connection);
        } catch (SQLException e) {
            throw translate(operation, e);
        }
    }

    private <T> T inReadTransaction(Supplier<T> body) {
        if (transaction.get() != null) {
            return body.get();
        }
        return retry.call("read transaction", () -> {
            try (var connection = dataSource.getConnection()) {
                dialect.beginRead(connection);
                transaction.set(connection);
                try {
                    var result = body.get();
                    connection.commit();
                    return result;
                } catch (RuntimeException e) {
                    connection.rollback();
                    throw e;
                } finally {
                    transaction.remove();
                    dialect.endRead(connection);
                }
            } catch (SQLException e) {
                throw translate("read transaction", e);
            }
        }, TransientSqlException.class::isInstance);
    }

    private InternalException translate(String operation, SQLException e) {
        if (dialect.isRetryable(e)) {
            logger.warn("{} failed on {} with SQLState {}, will retry", operation, instance, e.getSQLState());
            return new TransientSqlException(e);
        }
        logger.atError().setCause(e).log("{} failed on {}", operation, instance);
        return new InternalException("catalog store query failed", e);
    }
}
