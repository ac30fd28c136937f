package io.dazzleduck.sharing.catalog.kv;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.catalog.Catalog;
import io.dazzleduck.sharing.catalog.CatalogFactory;
import io.dazzleduck.sharing.common.ConfigConstants;
import io.dazzleduck.sharing.common.pagination.PageLimits;
import io.dazzleduck.sharing.common.util.Retry;
import io.dazzleduck.sharing.table.TableResolver;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URI;

public class KeyValueCatalogFactory implements CatalogFactory {

    public static final String TABLE_NAME_KEY = "table_name";
    public static final String PARTITION_KEY_KEY = "partition_key";
    public static final String SORT_KEY_KEY = "sort_key";

    private Config config;

    @Override
    public void setConfig(Config config) {
        this.config = config;
    }

    @Override
    public Catalog create(TableResolver resolver, PageLimits limits) {
        var builder = DynamoDbClient.builder()
                .region(Region.of(config.hasPath(ConfigConstants.REGION_KEY)
                        ? config.getString(ConfigConstants.REGION_KEY) : "us-east-1"));
        if (config.hasPath(ConfigConstants.ENDPOINT_KEY)) {
            builder.endpointOverride(URI.create(config.getString(ConfigConstants.ENDPOINT_KEY)));
        }
        var pk = config.hasPath(PARTITION_KEY_KEY) ? config.getString(PARTITION_KEY_KEY) : "PK";
        var sk = config.hasPath(SORT_KEY_KEY) ? config.getString(SORT_KEY_KEY) : "SK";
        return new KeyValueCatalog(builder.build(), config.getString(TABLE_NAME_KEY), pk, sk,
                Retry.load(config), resolver, limits);
    }
}
