package io.dazzleduck.sharing.http.server;

import io.dazzleduck.sharing.common.auth.RecipientId;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RecipientFilterTest {

    private static final SecretKey KEY = Jwts.SIG.HS256.key().build();
    private final RecipientFilter filter = RecipientFilter.jwt(List.of(Main.SHARES_PATH), KEY);

    @Test
    public void testSubjectBecomesRecipient() {
        var token = Jwts.builder().subject("acme").signWith(KEY).compact();
        assertEquals(RecipientId.named("acme"), filter.authenticate("Bearer " + token));
    }

    @Test
    public void testMalformedHeaders() {
        assertThrows(UnauthorizedException.class, () -> filter.authenticate(null));
        assertThrows(UnauthorizedException.class, () -> filter.authenticate(""));
        assertThrows(UnauthorizedException.class, () -> filter.authenticate("Bearer "));
        assertThrows(UnauthorizedException.class, () -> filter.authenticate("Basic YWRtaW46YWRtaW4="));
        assertThrows(UnauthorizedException.class, () -> filter.authenticate("Bearer not.a.jwt"));
    }

    @Test
    public void testTokenWithoutSubject() {
        var token = Jwts.builder().claim("org", "123").signWith(KEY).compact();
        var e = assertThrows(UnauthorizedException.class, () -> filter.authenticate("Bearer " + token));
        assertEquals(401, e.status);
    }

    @Test
    public void testUnsignedToken() {
        var token = Jwts.builder().subject("acme").compact();
        assertThrows(UnauthorizedException.class, () -> filter.authenticate("Bearer " + token));
    }
}
