package io.dazzleduck.sharing.common.table;

import java.util.List;
import java.util.Map;

/**
 * Table metadata as exposed to recipients. {@code name} and {@code description} may be null.
 */
public record MetadataDescriptor(String id,
                                 String name,
                                 String description,
                                 String format,
                                 String schemaString,
                                 List<String> partitionColumns,
                                 Map<String, String> configuration) {

    public MetadataDescriptor {
        partitionColumns = List.copyOf(partitionColumns);
        configuration = Map.copyOf(configuration);
    }
}
