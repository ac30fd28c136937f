package io.dazzleduck.sharing.http.server;

import io.dazzleduck.sharing.common.auth.RecipientId;
import io.helidon.webserver.Handler;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.util.List;

/**
 * Attaches the {@link RecipientId} of the caller to requests on the given paths. With a secret key
 * the caller must present a bearer JWT whose subject names the recipient; without one every caller
 * is anonymous.
 */
public class RecipientFilter implements Handler {

    public static final String RECIPIENT_KEY = "recipient";
    private static final Logger logger = LoggerFactory.getLogger(RecipientFilter.class);
    private static final String BEARER = "Bearer ";

    private final List<String> paths;
    private final JwtParser jwtParser;

    private RecipientFilter(List<String> paths, JwtParser jwtParser) {
        this.paths = paths;
        this.jwtParser = jwtParser;
    }

    public static RecipientFilter jwt(List<String> paths, SecretKey secretKey) {
        return new RecipientFilter(paths, Jwts.parser().verifyWith(secretKey).build());
    }

    public static RecipientFilter anonymous(List<String> paths) {
        return new RecipientFilter(paths, null);
    }

    @Override
    public void accept(ServerRequest req, ServerResponse res) {
        var path = req.path().toString();
        if (paths.stream().noneMatch(path::startsWith) || "OPTIONS".equalsIgnoreCase(req.method().name())) {
            req.next();
            return;
        }
        if (jwtParser == null) {
            req.context().register(RECIPIENT_KEY, RecipientId.anonymous());
            req.next();
            return;
        }
        try {
            req.context().register(RECIPIENT_KEY, authenticate(req.headers().first("Authorization").orElse(null)));
            req.next();
        } catch (UnauthorizedException e) {
            res.status(e.status);
            res.headers().add("Content-Type", ProtocolResponses.JSON_CONTENT_TYPE);
            res.send(ProtocolResponses.error(e));
        }
    }

    RecipientId authenticate(String header) {
        if (header == null || !header.startsWith(BEARER) || header.length() == BEARER.length()) {
            throw new UnauthorizedException("missing bearer token");
        }
        try {
            var subject = jwtParser.parseSignedClaims(header.substring(BEARER.length())).getPayload().getSubject();
            if (subject == null || subject.isBlank()) {
                throw new UnauthorizedException("token has no subject");
            }
            return RecipientId.named(subject);
        } catch (JwtException | IllegalArgumentException e) {
            logger.debug("Rejected bearer token: {}", e.getMessage());
            throw new UnauthorizedException("invalid bearer token");
        }
    }
}
