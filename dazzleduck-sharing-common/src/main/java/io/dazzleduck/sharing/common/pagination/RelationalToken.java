package io.dazzleduck.sharing.common.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Keyset position: the sort key columns of the last returned row.
 */
public record RelationalToken(@JsonProperty("i") String instance,
                              @JsonProperty("s") String scope,
                              @JsonProperty("a") List<String> after) implements PageToken {

    public static final String ID = "sql";

    public RelationalToken {
        after = after == null ? null : List.copyOf(after);
    }
}
