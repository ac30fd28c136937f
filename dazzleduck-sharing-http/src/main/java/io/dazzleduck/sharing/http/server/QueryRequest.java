package io.dazzleduck.sharing.http.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of a table query. Hints only narrow the result when the server chooses to honor them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryRequest(List<String> predicateHints,
                           String jsonPredicateHints,
                           Long limitHint,
                           Long version,
                           String timestamp) {

    public static final QueryRequest EMPTY = new QueryRequest(null, null, null, null, null);
}
