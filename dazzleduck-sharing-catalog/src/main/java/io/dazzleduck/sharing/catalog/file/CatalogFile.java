package io.dazzleduck.sharing.catalog.file;

import java.util.List;

/**
 * Declarative catalog layout. Ids are optional; {@code recipients} lists the principals granted
 * access at each level. A share without a recipients list is public.
 */
public record CatalogFile(List<ShareEntry> shares) {

    public record ShareEntry(String name, String id, List<String> recipients, List<SchemaEntry> schemas) {
    }

    public record SchemaEntry(String name, String id, List<String> recipients, List<TableEntry> tables) {
    }

    public record TableEntry(String name, String id, String location, String format, List<String> recipients) {
    }
}
