package io.dazzleduck.sharing.table;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.common.ConfigConstants;
import io.dazzleduck.sharing.common.error.InternalException;
import io.dazzleduck.sharing.common.error.NotFoundException;
import io.dazzleduck.sharing.common.error.SharingException;
import io.dazzleduck.sharing.common.model.Table;
import io.dazzleduck.sharing.common.table.FileAction;
import io.dazzleduck.sharing.common.table.FileQuery;
import io.dazzleduck.sharing.common.table.TableFiles;
import io.dazzleduck.sharing.common.table.TableMetadata;
import io.dazzleduck.sharing.common.table.VersionSpec;
import io.dazzleduck.sharing.common.util.Retry;
import io.dazzleduck.sharing.table.log.DeltaKernelLogReader;
import io.dazzleduck.sharing.table.log.LogFile;
import io.dazzleduck.sharing.table.log.TableLogReader;
import io.dazzleduck.sharing.table.log.TableSnapshot;
import io.dazzleduck.sharing.table.log.TransientLogException;
import io.dazzleduck.sharing.table.signer.SignerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;

/**
 * Turns a table and a requested version into a bounded list of pre-signed file actions.
 *
 * <p>The log reader's snapshot is the only consistency boundary: version, metadata and files all
 * come from the same snapshot. At most {@code maxFiles} actions are returned; when the snapshot
 * holds more, the result is flagged as truncated.
 */
public class TableResolver {

    private static final Logger logger = LoggerFactory.getLogger(TableResolver.class);

    public static final int DEFAULT_MAX_FILES = 1000;
    public static final Duration DEFAULT_URL_EXPIRATION = Duration.ofHours(1);

    private final TableLogReader logReader;
    private final SignerRegistry signers;
    private final int maxFiles;
    private final Duration urlExpiration;
    private final Retry retry;

    public TableResolver(TableLogReader logReader, SignerRegistry signers, int maxFiles, Duration urlExpiration, Retry retry) {
        if (maxFiles < 1) {
            throw new IllegalArgumentException("maxFiles must be positive");
        }
        this.logReader = logReader;
        this.signers = signers;
        this.maxFiles = maxFiles;
        this.urlExpiration = urlExpiration;
        this.retry = retry;
    }

    public static TableResolver load(Config config) {
        return load(config, new DeltaKernelLogReader());
    }

    public static TableResolver load(Config config, TableLogReader logReader) {
        int maxFiles = DEFAULT_MAX_FILES;
        Duration expiration = DEFAULT_URL_EXPIRATION;
        Retry retry = Retry.DEFAULT;
        if (config.hasPath(ConfigConstants.TABLE_KEY)) {
            var tableConfig = config.getConfig(ConfigConstants.TABLE_KEY);
            if (tableConfig.hasPath(ConfigConstants.MAX_FILES_KEY)) {
                maxFiles = tableConfig.getInt(ConfigConstants.MAX_FILES_KEY);
            }
            if (tableConfig.hasPath(ConfigConstants.URL_EXPIRATION_KEY)) {
                expiration = tableConfig.getDuration(ConfigConstants.URL_EXPIRATION_KEY);
            }
            retry = Retry.load(tableConfig);
        }
        return new TableResolver(logReader, SignerRegistry.load(config), maxFiles, expiration, retry);
    }

    public long version(Table table, VersionSpec version) {
        return snapshot(table, version).version();
    }

    public TableMetadata metadata(Table table, VersionSpec version) {
        var snapshot = snapshot(table, version);
        return new TableMetadata(snapshot.version(), snapshot.protocol(), snapshot.metadata());
    }

    public TableFiles files(Table table, FileQuery query) {
        var snapshot = snapshot(table, query.version());
        var listing = retry.call("list files of " + table.ref(), () -> snapshot.files(maxFiles), TableResolver::isTransient);
        var root = StoragePaths.root(table.storagePath());
        var actions = new ArrayList<FileAction>(listing.files().size());
        for (var file : listing.files()) {
            actions.add(sign(root, file));
        }
        if (listing.truncated()) {
            logger.info("Truncated files of {} at version {} to {}", table.ref(), snapshot.version(), maxFiles);
        }
        return new TableFiles(snapshot.version(), snapshot.protocol(), snapshot.metadata(), actions, listing.truncated());
    }

    private TableSnapshot snapshot(Table table, VersionSpec version) {
        if (table.storagePath() == null || table.storagePath().isBlank()) {
            throw new NotFoundException("table " + table.ref() + " has no storage location");
        }
        if (table.storageFormat() != null && !Table.DEFAULT_FORMAT.equalsIgnoreCase(table.storageFormat())) {
            throw new InternalException("unsupported storage format " + table.storageFormat() + " for " + table.ref());
        }
        return retry.call("read log of " + table.ref(), () -> logReader.snapshot(table.storagePath(), version), TableResolver::isTransient);
    }

    private FileAction sign(URI root, LogFile file) {
        var location = StoragePaths.resolve(root, file.path());
        try {
            var signed = signers.signerFor(location).sign(location, urlExpiration);
            return new FileAction(signed.url(), fileId(file.path()), file.partitionValues(), file.size(), file.stats(),
                    null, null, signed.expiration().toEpochMilli());
        } catch (SharingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InternalException("failed to sign " + location, e);
        }
    }

    static boolean isTransient(RuntimeException e) {
        return e instanceof TransientLogException;
    }

    static String fileId(String path) {
        try {
            var digest = MessageDigest.getInstance("MD5").digest(path.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
