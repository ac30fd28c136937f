package io.dazzleduck.sharing.common.table;

import io.dazzleduck.sharing.common.error.BadRequestException;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Which snapshot of a table a request refers to.
 */
public sealed interface VersionSpec permits VersionSpec.Latest, VersionSpec.AtVersion, VersionSpec.AtTimestamp {

    static VersionSpec latest() {
        return Latest.INSTANCE;
    }

    static VersionSpec version(long version) {
        if (version < 0) {
            throw new BadRequestException("version must be non-negative: " + version);
        }
        return new AtVersion(version);
    }

    static VersionSpec timestamp(Instant timestamp) {
        return new AtTimestamp(timestamp);
    }

    /**
     * Combines the optional version and timestamp request parameters, at most one of which may be set.
     */
    static VersionSpec of(Long version, String timestamp) {
        if (version != null && timestamp != null) {
            throw new BadRequestException("version and timestamp cannot both be specified");
        }
        if (version != null) {
            return version(version);
        }
        if (timestamp != null) {
            return timestamp(parseTimestamp(timestamp));
        }
        return latest();
    }

    static Instant parseTimestamp(String timestamp) {
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            throw new BadRequestException("invalid timestamp: " + timestamp, e);
        }
    }

    enum Latest implements VersionSpec {
        INSTANCE
    }

    record AtVersion(long version) implements VersionSpec {
    }

    record AtTimestamp(Instant timestamp) implements VersionSpec {
    }
}
