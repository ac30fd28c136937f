package io.dazzleduck.sharing.catalog.acl;

/**
 * Read access to one share, schema or table. Schema and table grants carry the ids of their
 * enclosing entities.
 */
public record Grant(GrantLevel level, String shareId, String schemaId, String tableId) {

    public static Grant share(String shareId) {
        return new Grant(GrantLevel.SHARE, shareId, null, null);
    }

    public static Grant schema(String shareId, String schemaId) {
        return new Grant(GrantLevel.SCHEMA, shareId, schemaId, null);
    }

    public static Grant table(String shareId, String schemaId, String tableId) {
        return new Grant(GrantLevel.TABLE, shareId, schemaId, tableId);
    }
}
