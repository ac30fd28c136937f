package io.dazzleduck.sharing.catalog.jdbc;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.catalog.Catalog;
import io.dazzleduck.sharing.catalog.CatalogFactory;
import io.dazzleduck.sharing.common.pagination.PageLimits;
import io.dazzleduck.sharing.common.util.Retry;
import io.dazzleduck.sharing.table.TableResolver;
import org.postgresql.ds.PGSimpleDataSource;

/**
 * PostgreSQL-backed catalog. Credentials may also be given in the url, which page tokens only
 * carry as a digest.
 */
public class RelationalCatalogFactory implements CatalogFactory {

    public static final String URL_KEY = "url";
    public static final String USER_KEY = "user";
    public static final String PASSWORD_KEY = "password";
    public static final String INITIALIZE_SCHEMA_KEY = "initialize_schema";

    private Config config;

    @Override
    public void setConfig(Config config) {
        this.config = config;
    }

    @Override
    public Catalog create(TableResolver resolver, PageLimits limits) throws Exception {
        var url = config.getString(URL_KEY);
        var dataSource = new PGSimpleDataSource();
        dataSource.setURL(url);
        if (config.hasPath(USER_KEY)) {
            dataSource.setUser(config.getString(USER_KEY));
        }
        if (config.hasPath(PASSWORD_KEY)) {
            dataSource.setPassword(config.getString(PASSWORD_KEY));
        }
        var catalog = new RelationalCatalog(dataSource, DatabaseDialect.detect(dataSource), url,
                Retry.load(config), resolver, limits);
        if (config.hasPath(INITIALIZE_SCHEMA_KEY) && config.getBoolean(INITIALIZE_SCHEMA_KEY)) {
            catalog.initializeSchema();
        }
        return catalog;
    }
}
