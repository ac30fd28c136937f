package io.dazzleduck.sharing.catalog.acl;

public enum GrantLevel {
    SHARE, SCHEMA, TABLE
}
