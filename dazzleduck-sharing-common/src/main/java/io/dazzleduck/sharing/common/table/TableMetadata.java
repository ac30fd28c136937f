package io.dazzleduck.sharing.common.table;

public record TableMetadata(long version, TableProtocol protocol, MetadataDescriptor metadata) {
}
