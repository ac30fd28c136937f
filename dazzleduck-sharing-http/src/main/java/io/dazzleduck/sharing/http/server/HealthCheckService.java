package io.dazzleduck.sharing.http.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dazzleduck.sharing.catalog.Catalog;
import io.helidon.webserver.Routing;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;
import io.helidon.webserver.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class HealthCheckService implements Service {

    private static final Logger logger = LoggerFactory.getLogger(HealthCheckService.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Instant startTime = Instant.now();
    private final AtomicLong requestCount = new AtomicLong();
    private final Catalog catalog;

    public HealthCheckService(Catalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void update(Routing.Rules rules) {
        rules.get("/", this::health);
    }

    private void health(ServerRequest req, ServerResponse res) {
        requestCount.incrementAndGet();

        boolean catalogUp;
        String catalogError = null;
        try {
            catalog.ping();
            catalogUp = true;
        } catch (RuntimeException e) {
            catalogUp = false;
            catalogError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            logger.atWarn().setCause(e).log("Catalog health check failed");
        }

        Map<String, Object> body = Map.of(
                "status", catalogUp ? "UP" : "DEGRADED",
                "uptime_seconds", Instant.now().getEpochSecond() - startTime.getEpochSecond(),
                "catalog", catalogUp ? Map.of("status", "UP") : Map.of("status", "DOWN", "error", catalogError),
                "metrics", Map.of("requests_total", requestCount.get()),
                "timestamp", Instant.now().toString()
        );

        try {
            res.status(catalogUp ? 200 : 503);
            res.headers().add("Content-Type", ProtocolResponses.JSON_CONTENT_TYPE);
            res.send(MAPPER.writeValueAsString(body));
        } catch (Exception e) {
            logger.atError().setCause(e).log("Health response serialization failed");
            res.status(500);
            res.send("{\"status\":\"ERROR\"}");
        }
    }
}
