package io.dazzleduck.sharing.common.model;

public record Schema(String id, String name, String shareId, String shareName) implements CatalogEntity {
}
