package io.dazzleduck.sharing.common.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Wraps the key-value store's native continuation key (the primary key of the last returned item).
 */
public record KeyValueToken(@JsonProperty("i") String instance,
                            @JsonProperty("s") String scope,
                            @JsonProperty("k") Map<String, String> key) implements PageToken {

    public static final String ID = "kv";

    public KeyValueToken {
        key = key == null ? null : Map.copyOf(key);
    }
}
