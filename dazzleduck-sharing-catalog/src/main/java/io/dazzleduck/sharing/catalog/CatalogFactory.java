package io.dazzleduck.sharing.catalog;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.common.ConfigBasedProvider;
import io.dazzleduck.sharing.common.ConfigConstants;
import io.dazzleduck.sharing.common.pagination.PageLimits;
import io.dazzleduck.sharing.table.TableResolver;
import io.dazzleduck.sharing.catalog.file.FileCatalogFactory;

/**
 * Builds the catalog backend named by {@code catalog.class}; the file catalog when absent.
 */
public interface CatalogFactory extends ConfigBasedProvider {

    Catalog create(TableResolver resolver, PageLimits limits) throws Exception;

    static Catalog load(Config config, TableResolver resolver, PageLimits limits) throws Exception {
        var factory = ConfigBasedProvider.load(config, ConfigConstants.CATALOG_KEY, new FileCatalogFactory(), CatalogFactory.class);
        return factory.create(resolver, limits);
    }
}
