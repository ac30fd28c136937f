package io.dazzleduck.sharing.table.log;

import java.util.Map;

/**
 * An add-file entry of a snapshot. {@code path} is either relative to the table root or an absolute URI.
 */
public record LogFile(String path, long size, long modificationTime, Map<String, String> partitionValues, String stats) {

    public LogFile {
        partitionValues = partitionValues == null ? Map.of() : Map.copyOf(partitionValues);
    }
}
