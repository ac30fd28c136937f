package io.dazzleduck.sharing.catalog.file;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.catalog.Catalog;
import io.dazzleduck.sharing.catalog.CatalogFactory;
import io.dazzleduck.sharing.common.pagination.PageLimits;
import io.dazzleduck.sharing.table.TableResolver;

import java.nio.file.Path;

public class FileCatalogFactory implements CatalogFactory {

    public static final String PATH_KEY = "path";

    private Config config;

    @Override
    public void setConfig(Config config) {
        this.config = config;
    }

    @Override
    public Catalog create(TableResolver resolver, PageLimits limits) throws Exception {
        return FileCatalog.load(Path.of(config.getString(PATH_KEY)), resolver, limits);
    }
}
