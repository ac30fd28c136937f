package io.dazzleduck.sharing.table.signer;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.common.ConfigConstants;

import java.net.URI;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Signers keyed by URL scheme. Schemes without a registered signer fall back to the default signer.
 */
public class SignerRegistry {

    private final Map<String, UrlSigner> signers = new HashMap<>();
    private final UrlSigner fallback;

    public SignerRegistry(UrlSigner fallback) {
        this.fallback = fallback;
    }

    public static SignerRegistry load(Config config) {
        var registry = new SignerRegistry(new NoopSigner());
        if (config.hasPath(ConfigConstants.S3_KEY)) {
            var s3 = S3UrlSigner.load(config.getConfig(ConfigConstants.S3_KEY));
            registry.register("s3", s3);
            registry.register("s3a", s3);
        }
        return registry;
    }

    public SignerRegistry register(String scheme, UrlSigner signer) {
        signers.put(scheme.toLowerCase(Locale.ROOT), signer);
        return this;
    }

    public UrlSigner signerFor(URI location) {
        var scheme = location.getScheme();
        if (scheme == null) {
            return fallback;
        }
        return signers.getOrDefault(scheme.toLowerCase(Locale.ROOT), fallback);
    }
}
