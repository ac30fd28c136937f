package io.dazzleduck.sharing.common.table;

import java.util.Map;

/**
 * One data file of a table snapshot, reachable through a pre-signed {@code url} until
 * {@code expirationTimestamp} (epoch millis). {@code stats} is the raw statistics JSON when the
 * log carries it.
 */
public record FileAction(String url,
                         String id,
                         Map<String, String> partitionValues,
                         long size,
                         String stats,
                         Long version,
                         Long timestamp,
                         Long expirationTimestamp) {
}
