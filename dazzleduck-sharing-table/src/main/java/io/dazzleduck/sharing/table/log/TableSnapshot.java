package io.dazzleduck.sharing.table.log;

import io.dazzleduck.sharing.common.table.MetadataDescriptor;
import io.dazzleduck.sharing.common.table.TableProtocol;

/**
 * An immutable view of a table's log at one version.
 */
public interface TableSnapshot {

    long version();

    TableProtocol protocol();

    MetadataDescriptor metadata();

    /**
     * Lists at most {@code maxFiles} add-files of this snapshot, flagging whether more exist.
     */
    FileListing files(int maxFiles);
}
