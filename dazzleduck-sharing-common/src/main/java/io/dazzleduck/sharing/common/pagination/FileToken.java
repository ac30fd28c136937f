package io.dazzleduck.sharing.common.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Offset into the sorted listing of one loaded catalog file, identified by its content fingerprint.
 */
public record FileToken(@JsonProperty("i") String instance,
                        @JsonProperty("s") String scope,
                        @JsonProperty("o") int offset) implements PageToken {

    public static final String ID = "file";
}
