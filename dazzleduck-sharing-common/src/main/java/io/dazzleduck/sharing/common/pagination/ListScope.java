package io.dazzleduck.sharing.common.pagination;

/**
 * The shape of a listing query. Page tokens are only valid for the scope that issued them.
 */
public record ListScope(Kind kind, String share, String schema) {

    public enum Kind {
        SHARES, SCHEMAS, TABLES, ALL_TABLES
    }

    public static ListScope shares() {
        return new ListScope(Kind.SHARES, null, null);
    }

    public static ListScope schemas(String share) {
        return new ListScope(Kind.SCHEMAS, share, null);
    }

    public static ListScope tables(String share, String schema) {
        return new ListScope(Kind.TABLES, share, schema);
    }

    public static ListScope allTables(String share) {
        return new ListScope(Kind.ALL_TABLES, share, null);
    }

    public String shape() {
        return switch (kind) {
            case SHARES -> "shares";
            case SCHEMAS -> "schemas/" + share;
            case TABLES -> "tables/" + share + "/" + schema;
            case ALL_TABLES -> "all-tables/" + share;
        };
    }
}
