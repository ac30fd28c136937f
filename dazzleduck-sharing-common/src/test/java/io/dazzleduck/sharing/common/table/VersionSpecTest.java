package io.dazzleduck.sharing.common.table;

import io.dazzleduck.sharing.common.error.BadRequestException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class VersionSpecTest {

    @Test
    public void testOf() {
        assertEquals(VersionSpec.latest(), VersionSpec.of(null, null));
        assertEquals(new VersionSpec.AtVersion(3), VersionSpec.of(3L, null));
        assertEquals(new VersionSpec.AtTimestamp(Instant.parse("2024-01-02T03:04:05Z")),
                VersionSpec.of(null, "2024-01-02T03:04:05Z"));
    }

    @Test
    public void testInvalid() {
        assertThrows(BadRequestException.class, () -> VersionSpec.of(1L, "2024-01-02T03:04:05Z"));
        assertThrows(BadRequestException.class, () -> VersionSpec.of(-1L, null));
        assertThrows(BadRequestException.class, () -> VersionSpec.of(null, "yesterday"));
    }
}
