package io.dazzleduck.sharing.table.signer;

import java.time.Instant;

public record SignedUrl(String url, Instant expiration) {
}
