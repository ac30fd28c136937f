package io.dazzleduck.sharing.common.table;

public record TableProtocol(int minReaderVersion) {
}
