package io.dazzleduck.sharing.catalog.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Locale;
import javax.sql.DataSource;

/**
 * Differences between the databases the relational catalog runs on.
 */
public enum DatabaseDialect {

    POSTGRES(" COLLATE \"C\"") {
        @Override
        void beginRead(Connection connection) throws SQLException {
            connection.setReadOnly(true);
            connection.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
            connection.setAutoCommit(false);
        }

        @Override
        void endRead(Connection connection) throws SQLException {
            connection.setAutoCommit(true);
            connection.setReadOnly(false);
            connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
        }
    },

    // Transactions are snapshot isolated already; read-only and isolation switches are unsupported.
    DUCKDB("") {
        @Override
        void beginRead(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
        }

        @Override
        void endRead(Connection connection) throws SQLException {
            connection.setAutoCommit(true);
        }
    };

    /** SQLState class of connection exceptions, including resets and refused connections. */
    private static final String CONNECTION_EXCEPTION_CLASS = "08";

    /** Serialization failure, and the Postgres deadlock error. */
    private static final String SERIALIZATION_FAILURE_SQL_STATE = "40001";
    private static final String DEADLOCK_SQL_STATE_POSTGRES = "40P01";

    /** Postgres "too many connections", and server shutdown or restart. */
    private static final String TOO_MANY_CONNECTIONS_SQL_STATE = "53300";
    private static final String ADMIN_SHUTDOWN_SQL_STATE = "57P01";
    private static final String CRASH_SHUTDOWN_SQL_STATE = "57P02";
    private static final String CANNOT_CONNECT_NOW_SQL_STATE = "57P03";

    private final String collation;

    DatabaseDialect(String collation) {
        this.collation = collation;
    }

    /**
     * Suffix that makes comparisons and ordering of a text column byte-wise.
     */
    String collation() {
        return collation;
    }

    /**
     * Whether the failed statement or transaction may succeed when run again on a fresh connection.
     * Drivers such as PgJDBC report every failure with one exception type, so the SQLState decides.
     */
    boolean isRetryable(SQLException e) {
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return true;
        }
        var state = e.getSQLState();
        if (state == null) {
            return false;
        }
        if (state.startsWith(CONNECTION_EXCEPTION_CLASS)) {
            return true;
        }
        switch (state) {
            case SERIALIZATION_FAILURE_SQL_STATE:
            case DEADLOCK_SQL_STATE_POSTGRES:
            case TOO_MANY_CONNECTIONS_SQL_STATE:
            case ADMIN_SHUTDOWN_SQL_STATE:
            case CRASH_SHUTDOWN_SQL_STATE:
            case CANNOT_CONNECT_NOW_SQL_STATE:
                return true;
            default:
                return false;
        }
    }

    abstract void beginRead(Connection connection) throws SQLException;

    abstract void endRead(Connection connection) throws SQLException;

    public static DatabaseDialect detect(DataSource dataSource) throws SQLException {
        try (var connection = dataSource.getConnection()) {
            var productName = connection.getMetaData().getDatabaseProductName().toLowerCase(Locale.ROOT);
            switch (productName) {
                case "postgresql":
                    return POSTGRES;
                case "duckdb":
                    return DUCKDB;
                default:
                    throw new IllegalStateException("Unsupported database product '" + productName + "'");
            }
        }
    }
}
