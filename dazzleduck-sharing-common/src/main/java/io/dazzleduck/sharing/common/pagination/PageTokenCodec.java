package io.dazzleduck.sharing.common.pagination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dazzleduck.sharing.common.error.BadRequestException;
import io.dazzleduck.sharing.common.error.InternalException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Serializes {@link PageToken}s to opaque url-safe strings and back.
 */
public final class PageTokenCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private PageTokenCodec() {
    }

    /**
     * Instance id to put in tokens for a catalog identified by {@code source}. Tokens reach
     * clients, so a store address or anything else that may carry credentials only enters
     * them as a digest.
     */
    public static String instanceId(String source) {
        return instanceId(source.getBytes(StandardCharsets.UTF_8));
    }

    public static String instanceId(byte[] source) {
        try {
            var digest = MessageDigest.getInstance("SHA-256").digest(source);
            return HexFormat.of().formatHex(digest, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String encode(PageToken token) {
        try {
            return ENCODER.encodeToString(MAPPER.writeValueAsBytes(token));
        } catch (JsonProcessingException e) {
            throw new InternalException("cannot encode page token", e);
        }
    }

    public static PageToken decode(String token) {
        byte[] bytes;
        try {
            bytes = DECODER.decode(token);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("invalid page token", e);
        }
        try {
            var decoded = MAPPER.readValue(new String(bytes, StandardCharsets.UTF_8), PageToken.class);
            if (decoded == null) {
                throw new BadRequestException("invalid page token");
            }
            return decoded;
        } catch (JsonProcessingException e) {
            throw new BadRequestException("invalid page token", e);
        }
    }

    /**
     * Decodes a token and checks it was issued by the given catalog instance for the given listing.
     *
     * @return the token, or null when {@code token} is null
     */
    public static <T extends PageToken> T decode(String token, Class<T> type, String instance, ListScope scope) {
        if (token == null) {
            return null;
        }
        var decoded = decode(token);
        if (!type.isInstance(decoded)) {
            throw new BadRequestException("page token was issued by a different catalog");
        }
        if (!instance.equals(decoded.instance())) {
            throw new BadRequestException("page token was issued by a different catalog instance");
        }
        if (!scope.shape().equals(decoded.scope())) {
            throw new BadRequestException("page token does not belong to this listing");
        }
        return type.cast(decoded);
    }
}
