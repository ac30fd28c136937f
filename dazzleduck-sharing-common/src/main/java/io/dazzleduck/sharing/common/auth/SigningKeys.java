package io.dazzleduck.sharing.common.auth;

import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;

import javax.crypto.SecretKey;

/**
 * HMAC keys for bearer tokens, configured as base64 text.
 */
public final class SigningKeys {

    private SigningKeys() {
    }

    /**
     * @throws IllegalArgumentException if the text is not base64 or decodes to fewer than 256 bits
     */
    public static SecretKey fromBase64String(String base64Key) {
        try {
            return Keys.hmacShaKeyFor(Decoders.BASE64.decode(base64Key));
        } catch (DecodingException | WeakKeyException e) {
            throw new IllegalArgumentException("secret_key must be a base64 encoded key of at least 256 bits", e);
        }
    }
}
