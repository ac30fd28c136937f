package io.dazzleduck.sharing.table.log;

import java.util.List;

public record FileListing(List<LogFile> files, boolean truncated) {

    public FileListing {
        files = List.copyOf(files);
    }
}
