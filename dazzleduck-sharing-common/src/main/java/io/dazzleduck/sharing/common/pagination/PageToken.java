package io.dazzleduck.sharing.common.pagination;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Continuation cursor of a listing. One variant per catalog backend, distinguished by the
 * {@code t} property of the serialized form. Every variant records the catalog instance and the
 * listing shape it was issued for.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "t")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FileToken.class, name = FileToken.ID),
        @JsonSubTypes.Type(value = KeyValueToken.class, name = KeyValueToken.ID),
        @JsonSubTypes.Type(value = RelationalToken.class, name = RelationalToken.ID)
})
public sealed interface PageToken permits FileToken, KeyValueToken, RelationalToken {

    String instance();

    String scope();
}
