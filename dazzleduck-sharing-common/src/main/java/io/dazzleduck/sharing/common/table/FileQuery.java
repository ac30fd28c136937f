package io.dazzleduck.sharing.common.table;

import java.util.List;

/**
 * Parameters of a table data query. Predicate and limit hints are advisory; the server may
 * return more files than they would select.
 */
public record FileQuery(VersionSpec version, List<String> predicateHints, Long limitHint) {

    public FileQuery {
        predicateHints = predicateHints == null ? List.of() : List.copyOf(predicateHints);
    }

    public static FileQuery latest() {
        return new FileQuery(VersionSpec.latest(), List.of(), null);
    }
}
