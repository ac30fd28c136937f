package io.dazzleduck.sharing.table.signer;

import java.net.URI;
import java.time.Duration;

/**
 * Mints a time-limited URL granting read access to one object of a storage location.
 */
public interface UrlSigner {

    SignedUrl sign(URI location, Duration expiration);
}
