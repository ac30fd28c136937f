package io.dazzleduck.sharing.common.table;

import java.util.List;

/**
 * The resolved file set of a table snapshot. {@code truncated} is set when the snapshot held more
 * files than the configured cap and only the first {@code files.size()} are returned.
 */
public record TableFiles(long version,
                         TableProtocol protocol,
                         MetadataDescriptor metadata,
                         List<FileAction> files,
                         boolean truncated) {

    public TableFiles {
        files = List.copyOf(files);
    }

    public TableMetadata tableMetadata() {
        return new TableMetadata(version, protocol, metadata);
    }
}
