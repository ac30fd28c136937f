package io.dazzleduck.sharing.common;

public class ConfigConstants {

    public static final String CONFIG_PATH = "dazzleduck_sharing";

    public static final String HTTP_KEY = "http";
    public static final String PORT_KEY = "port";
    public static final String HOST_KEY = "host";
    public static final String AUTHENTICATION_KEY = "authentication";
    public static final String ALLOW_ORIGIN_KEY = "allow-origin";
    public static final String SECRET_KEY_KEY = "secret_key";

    public static final String CATALOG_KEY = "catalog";

    public static final String PAGINATION_KEY = "pagination";
    public static final String DEFAULT_MAX_RESULTS_KEY = "default_max_results";
    public static final String MAX_RESULTS_CEILING_KEY = "max_results_ceiling";

    public static final String TABLE_KEY = "table";
    public static final String MAX_FILES_KEY = "max_files";
    public static final String URL_EXPIRATION_KEY = "url_expiration";

    public static final String RETRY_KEY = "retry";
    public static final String MAX_ATTEMPTS_KEY = "max_attempts";
    public static final String INITIAL_BACKOFF_KEY = "initial_backoff";
    public static final String MAX_BACKOFF_KEY = "max_backoff";

    public static final String S3_KEY = "s3";
    public static final String REGION_KEY = "region";
    public static final String ENDPOINT_KEY = "endpoint";

    public static final String METRICS_KEY = "metrics";
    public static final String ENABLED_KEY = "enabled";
}
