package io.dazzleduck.sharing.table.log;

import io.dazzleduck.sharing.common.table.VersionSpec;

/**
 * Reads snapshots of a table's transaction log.
 *
 * <p>Throws {@link io.dazzleduck.sharing.common.error.NotFoundException} when there is no table at
 * the location or no snapshot for the requested version, and
 * {@link TransientLogException} for I/O failures worth retrying.
 */
public interface TableLogReader {

    TableSnapshot snapshot(String location, VersionSpec version);
}
