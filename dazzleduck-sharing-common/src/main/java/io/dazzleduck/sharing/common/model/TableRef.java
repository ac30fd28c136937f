package io.dazzleduck.sharing.common.model;

public record TableRef(String share, String schema, String table) {

    @Override
    public String toString() {
        return share + "." + schema + "." + table;
    }
}
