package io.dazzleduck.sharing.table.log;

import io.dazzleduck.sharing.common.error.BadRequestException;
import io.dazzleduck.sharing.common.error.InternalException;
import io.dazzleduck.sharing.common.error.NotFoundException;
import io.dazzleduck.sharing.common.table.MetadataDescriptor;
import io.dazzleduck.sharing.common.table.TableProtocol;
import io.dazzleduck.sharing.common.table.VersionSpec;
import io.delta.kernel.Snapshot;
import io.delta.kernel.Table;
import io.delta.kernel.data.FilteredColumnarBatch;
import io.delta.kernel.data.Row;
import io.delta.kernel.defaults.engine.DefaultEngine;
import io.delta.kernel.engine.Engine;
import io.delta.kernel.exceptions.KernelException;
import io.delta.kernel.exceptions.TableNotFoundException;
import io.delta.kernel.internal.InternalScanFileUtils;
import io.delta.kernel.internal.SnapshotImpl;
import io.delta.kernel.internal.util.VectorUtils;
import io.delta.kernel.utils.CloseableIterator;
import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TableLogReader} over Delta tables, backed by the Delta Kernel default engine.
 */
public class DeltaKernelLogReader implements TableLogReader {

    private static final Logger logger = LoggerFactory.getLogger(DeltaKernelLogReader.class);

    // Kernel raises a plain KernelException for a version or timestamp outside the log; only its message tells.
    private static final List<String> OUT_OF_RANGE_MESSAGES = List.of(
            "Cannot load table version",
            "The provided timestamp");

    private final Engine engine;

    public DeltaKernelLogReader() {
        this(DefaultEngine.create(new Configuration()));
    }

    public DeltaKernelLogReader(Engine engine) {
        this.engine = engine;
    }

    @Override
    public TableSnapshot snapshot(String location, VersionSpec version) {
        var table = Table.forPath(engine, location);
        KernelSnapshot snapshot;
        try {
            Snapshot loaded;
            if (version instanceof VersionSpec.AtVersion atVersion) {
                loaded = table.getSnapshotAsOfVersion(engine, atVersion.version());
            } else if (version instanceof VersionSpec.AtTimestamp atTimestamp) {
                loaded = table.getSnapshotAsOfTimestamp(engine, atTimestamp.timestamp().toEpochMilli());
            } else {
                loaded = table.getLatestSnapshot(engine);
            }
            snapshot = new KernelSnapshot((SnapshotImpl) loaded);
        } catch (TableNotFoundException e) {
            throw new NotFoundException("no table at " + location, e);
        } catch (KernelException e) {
            if (isOutOfRange(e)) {
                throw new NotFoundException("no snapshot of " + location + " for " + version + ": " + e.getMessage(), e);
            }
            logger.atError().setCause(e).log("Cannot read log of {}", location);
            throw new InternalException("cannot read log of " + location, e);
        } catch (UncheckedIOException e) {
            throw new TransientLogException("failed to read log of " + location, e);
        }
        logger.debug("Resolved {} of {} to version {}", version, location, snapshot.version());
        return snapshot;
    }

    static boolean isOutOfRange(KernelException e) {
        var message = e.getMessage();
        return message != null && OUT_OF_RANGE_MESSAGES.stream().anyMatch(message::contains);
    }

    private class KernelSnapshot implements TableSnapshot {
        private final SnapshotImpl snapshot;
        private final long version;

        KernelSnapshot(SnapshotImpl snapshot) {
            this.snapshot = snapshot;
            this.version = snapshot.getVersion(engine);
        }

        @Override
        public long version() {
            return version;
        }

        @Override
        public TableProtocol protocol() {
            return new TableProtocol(snapshot.getProtocol().getMinReaderVersion());
        }

        @Override
        public MetadataDescriptor metadata() {
            var metadata = snapshot.getMetadata();
            List<String> partitionColumns = VectorUtils.toJavaList(metadata.getPartitionColumns());
            return new MetadataDescriptor(metadata.getId(),
                    metadata.getName().orElse(null),
                    metadata.getDescription().orElse(null),
                    metadata.getFormat().getProvider(),
                    metadata.getSchemaString(),
                    partitionColumns,
                    metadata.getConfiguration());
        }

        @Override
        public FileListing files(int maxFiles) {
            if (maxFiles < 0) {
                throw new BadRequestException("maxFiles must not be negative");
            }
            var result = new ArrayList<LogFile>();
            var scan = snapshot.getScanBuilder(engine).build();
            try (CloseableIterator<FilteredColumnarBatch> batches = scan.getScanFiles(engine)) {
                while (batches.hasNext()) {
                    try (CloseableIterator<Row> rows = batches.next().getRows()) {
                        while (rows.hasNext()) {
                            var row = rows.next();
                            if (result.size() == maxFiles) {
                                return new FileListing(result, true);
                            }
                            var status = InternalScanFileUtils.getAddFileStatus(row);
                            result.add(new LogFile(status.getPath(), status.getSize(), status.getModificationTime(),
                                    InternalScanFileUtils.getPartitionValues(row), null));
                        }
                    }
                }
            } catch (IOException | UncheckedIOException e) {
                throw new TransientLogException("failed to list files of version " + version, e);
            } catch (KernelException e) {
                throw new InternalException("cannot list files of version " + version + ": " + e.getMessage(), e);
            }
            return new FileListing(result, false);
        }
    }
}
