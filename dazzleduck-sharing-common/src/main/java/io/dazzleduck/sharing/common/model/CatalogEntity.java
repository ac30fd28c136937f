package io.dazzleduck.sharing.common.model;

import java.util.Comparator;

public interface CatalogEntity {

    Comparator<CatalogEntity> NAME_ORDER = Comparator.comparing(CatalogEntity::name)
            .thenComparing(CatalogEntity::id);

    String id();

    String name();
}
