package io.dazzleduck.sharing.common.model;

/**
 * A shared table. {@code storagePath} is the root of the table's transaction log, interpreted only by
 * the log reader.
 */
public record Table(String id,
                    String name,
                    String schemaId,
                    String schemaName,
                    String shareId,
                    String shareName,
                    String storagePath,
                    String storageFormat) implements CatalogEntity {

    public static final String DEFAULT_FORMAT = "delta";

    public TableRef ref() {
        return new TableRef(shareName, schemaName, name);
    }
}
