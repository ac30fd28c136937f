package io.dazzleduck.sharing.http.server;

import io.dazzleduck.sharing.common.error.NotFoundException;
import io.dazzleduck.sharing.common.table.MetadataDescriptor;
import io.dazzleduck.sharing.common.table.TableProtocol;
import io.dazzleduck.sharing.common.table.VersionSpec;
import io.dazzleduck.sharing.table.log.FileListing;
import io.dazzleduck.sharing.table.log.LogFile;
import io.dazzleduck.sharing.table.log.TableLogReader;
import io.dazzleduck.sharing.table.log.TableSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tables with a fixed number of partitioned files and versions 0 to {@link #LATEST_VERSION}.
 * Timestamps before {@link #CREATED_AT} have no snapshot.
 */
class InMemoryLogReader implements TableLogReader {

    static final long LATEST_VERSION = 2;
    static final Instant CREATED_AT = Instant.parse("2024-01-01T00:00:00Z");
    static final String SCHEMA_STRING = "{\"type\":\"struct\",\"fields\":[{\"name\":\"id\",\"type\":\"long\",\"nullable\":true,\"metadata\":{}},"
            + "{\"name\":\"dt\",\"type\":\"string\",\"nullable\":true,\"metadata\":{}}]}";

    private final Map<String, Integer> tables = new ConcurrentHashMap<>();

    InMemoryLogReader table(String location, int files) {
        tables.put(location, files);
        return this;
    }

    @Override
    public TableSnapshot snapshot(String location, VersionSpec version) {
        var fileCount = tables.get(location);
        if (fileCount == null) {
            throw new NotFoundException("no table at " + location);
        }
        long resolved = LATEST_VERSION;
        if (version instanceof VersionSpec.AtVersion at) {
            if (at.version() > LATEST_VERSION) {
                throw new NotFoundException("no version " + at.version() + " of " + location);
            }
            resolved = at.version();
        } else if (version instanceof VersionSpec.AtTimestamp ts && ts.timestamp().isBefore(CREATED_AT)) {
            throw new NotFoundException("no snapshot of " + location + " at " + ts.timestamp());
        }
        return new Snapshot(location, resolved, fileCount);
    }

    private record Snapshot(String location, long version, int fileCount) implements TableSnapshot {

        @Override
        public TableProtocol protocol() {
            return new TableProtocol(1);
        }

        @Override
        public MetadataDescriptor metadata() {
            return new MetadataDescriptor("meta-" + location.hashCode(), null, null, "parquet", SCHEMA_STRING,
                    List.of("dt"), Map.of());
        }

        @Override
        public FileListing files(int maxFiles) {
            var files = new ArrayList<LogFile>();
            for (int i = 0; i < Math.min(fileCount, maxFiles); i++) {
                var dt = "2024-01-0" + (i + 1);
                files.add(new LogFile("dt=" + dt + "/part-0000" + i + ".parquet", 100 + i, 0, Map.of("dt", dt),
                        i == 0 ? "{\"numRecords\":10}" : null));
            }
            return new FileListing(files, fileCount > maxFiles);
        }
    }
}
