package io.dazzleduck.sharing.table.signer;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

/**
 * Returns locations unchanged. Used for storage that recipients can read directly, such as local files in tests.
 */
public class NoopSigner implements UrlSigner {

    private final Clock clock;

    public NoopSigner() {
        this(Clock.systemUTC());
    }

    public NoopSigner(Clock clock) {
        this.clock = clock;
    }

    @Override
    public SignedUrl sign(URI location, Duration expiration) {
        return new SignedUrl(location.toString(), clock.instant().plus(expiration));
    }
}
