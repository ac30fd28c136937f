package io.dazzleduck.sharing.http.server;

import io.dazzleduck.sharing.common.ConfigConstants;
import io.dazzleduck.sharing.common.auth.SigningKeys;
import io.dazzleduck.sharing.common.util.ConfigUtils;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class HttpServerJwtTest extends HttpServerTestBase {

    private static SecretKey secretKey;

    @BeforeAll
    public static void setup() throws Exception {
        initClient();
        initPort();
        startServer("--conf", "dazzleduck_sharing.http.authentication=jwt");
        secretKey = SigningKeys.fromBase64String(ConfigUtils.loadAppConfig(new String[0]).getString(ConfigConstants.SECRET_KEY_KEY));
    }

    @AfterAll
    public static void cleanup() {
        stopServer();
    }

    private static String token(String recipient) {
        return Jwts.builder()
                .subject(recipient)
                .issuedAt(new Date())
                .expiration(Date.from(Instant.now().plus(1, ChronoUnit.HOURS)))
                .signWith(secretKey)
                .compact();
    }

    @Test
    public void testMissingToken() throws Exception {
        var response = get("/shares");
        assertEquals(401, response.statusCode());
        assertEquals("UNAUTHENTICATED", json(response).get("errorCode").asText());
    }

    @Test
    public void testTokenSignedWithAnotherKey() throws Exception {
        var forged = Jwts.builder().subject("r1").signWith(Jwts.SIG.HS256.key().build()).compact();
        assertEquals(401, get("/shares", forged).statusCode());
    }

    @Test
    public void testExpiredToken() throws Exception {
        var expired = Jwts.builder()
                .subject("r1")
                .expiration(Date.from(Instant.now().minus(1, ChronoUnit.HOURS)))
                .signWith(secretKey)
                .compact();
        assertEquals(401, get("/shares", expired).statusCode());
    }

    @Test
    public void testHealthNeedsNoToken() throws Exception {
        assertEquals(200, get("/health").statusCode());
    }

    @Test
    public void testRecipientSeesGrantedAndPublicShares() throws Exception {
        assertEquals(List.of("alpha", "open"), drain("/shares", 1, token("r1")));
        assertEquals(List.of("beta", "open"), drain("/shares", 10, token("r2")));
        assertEquals(List.of("open"), drain("/shares", 10, token("r9")));
    }

    @Test
    public void testOtherRecipientsShareIsNotFound() throws Exception {
        var r1 = token("r1");
        var denied = get("/shares/beta/schemas", r1);
        var missing = get("/shares/gamma/schemas", r1);
        assertEquals(404, denied.statusCode());
        assertEquals(missing.body(), denied.body());
        assertEquals(200, get("/shares/beta/schemas", token("r2")).statusCode());
    }

    @Test
    public void testQueryGrantedTable() throws Exception {
        var response = post("/shares/alpha/schemas/sales/tables/orders/query", "{}", token("r1"));
        assertEquals(200, response.statusCode());
        assertEquals(4, ndjson(response).size());
        assertEquals(404, post("/shares/alpha/schemas/sales/tables/orders/query", "{}", token("r2")).statusCode());
    }
}
