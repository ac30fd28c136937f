package io.dazzleduck.sharing.http.server;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.catalog.Catalog;
import io.dazzleduck.sharing.catalog.CatalogFactory;
import io.dazzleduck.sharing.catalog.acl.AccessControl;
import io.dazzleduck.sharing.common.ConfigConstants;
import io.dazzleduck.sharing.common.auth.SigningKeys;
import io.dazzleduck.sharing.common.pagination.PageLimits;
import io.dazzleduck.sharing.common.util.ConfigUtils;
import io.dazzleduck.sharing.http.MicroMeterSharingRecorder;
import io.dazzleduck.sharing.http.SharingRecorder;
import io.dazzleduck.sharing.table.TableResolver;
import io.dazzleduck.sharing.table.log.TableLogReader;
import io.helidon.common.LogConfig;
import io.helidon.webserver.Routing;
import io.helidon.webserver.WebServer;
import io.helidon.webserver.cors.CorsSupport;
import io.helidon.webserver.cors.CrossOriginConfig;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * The application main class.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static final String SHARES_PATH = "/shares";
    public static final String HEALTH_PATH = "/health";

    public static void main(String[] args) throws Exception {
        start(ConfigUtils.loadAppConfig(args));
    }

    public static WebServer start(Config appConfig) throws Exception {
        return start(appConfig, TableResolver.load(appConfig));
    }

    /**
     * Starts the server with a table log reader other than the Delta kernel one.
     */
    public static WebServer start(Config appConfig, TableLogReader logReader) throws Exception {
        return start(appConfig, TableResolver.load(appConfig, logReader));
    }

    private static WebServer start(Config appConfig, TableResolver resolver) throws Exception {
        LogConfig.configureRuntime();
        var httpConfig = appConfig.getConfig(ConfigConstants.HTTP_KEY);
        var port = httpConfig.getInt(ConfigConstants.PORT_KEY);
        var host = httpConfig.getString(ConfigConstants.HOST_KEY);
        var auth = httpConfig.hasPath(ConfigConstants.AUTHENTICATION_KEY)
                ? httpConfig.getString(ConfigConstants.AUTHENTICATION_KEY) : "none";

        Catalog catalog = CatalogFactory.load(appConfig, resolver, PageLimits.load(appConfig));
        var accessControl = new AccessControl(catalog);
        var recorder = recorder(appConfig);

        var paths = List.of(SHARES_PATH);
        RecipientFilter recipientFilter;
        if ("jwt".equals(auth)) {
            var secretKey = SigningKeys.fromBase64String(appConfig.getString(ConfigConstants.SECRET_KEY_KEY));
            recipientFilter = RecipientFilter.jwt(paths, secretKey);
        } else if ("none".equals(auth)) {
            recipientFilter = RecipientFilter.anonymous(paths);
        } else {
            throw new IllegalArgumentException("Unsupported authentication mode: " + auth);
        }

        var cors = CorsSupport.builder()
                .addCrossOrigin(CrossOriginConfig.builder()
                        .allowOrigins(appConfig.hasPath(ConfigConstants.ALLOW_ORIGIN_KEY)
                                ? appConfig.getString(ConfigConstants.ALLOW_ORIGIN_KEY) : "*")
                        .allowMethods("GET", "POST")
                        .allowHeaders("Content-Type", "Authorization")
                        .build())
                .build();

        var routing = Routing.builder()
                .any(recipientFilter)
                .register(SHARES_PATH, cors, new ShareService(accessControl, recorder), new TableService(accessControl, recorder))
                .register(HEALTH_PATH, new HealthCheckService(catalog))
                .build();

        var server = WebServer.builder()
                .addRouting(routing)
                .host(host)
                .port(port)
                .build()
                .start()
                .await();
        logger.info("Sharing server is up: Listening on URL: http://{}:{}", host, server.port());
        return server;
    }

    static SharingRecorder recorder(Config appConfig) {
        var enabled = appConfig.hasPath(ConfigConstants.METRICS_KEY)
                && appConfig.getConfig(ConfigConstants.METRICS_KEY).getBoolean(ConfigConstants.ENABLED_KEY);
        if (enabled) {
            return new MicroMeterSharingRecorder(Metrics.globalRegistry, UUID.randomUUID().toString());
        }
        return new NOOPSharingRecorder();
    }
}
