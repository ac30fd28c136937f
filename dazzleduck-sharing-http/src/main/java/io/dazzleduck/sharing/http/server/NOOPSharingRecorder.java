package io.dazzleduck.sharing.http.server;

import io.dazzleduck.sharing.http.SharingRecorder;

public class NOOPSharingRecorder implements SharingRecorder {

    @Override
    public void recordRequest(String operation) {
    }

    @Override
    public void recordError(String operation, int status) {
    }

    @Override
    public void recordTruncated(String operation) {
    }

    @Override
    public void recordFilesServed(long count) {
    }
}
