package io.dazzleduck.sharing.common.model;

public record Share(String id, String name) implements CatalogEntity {
}
