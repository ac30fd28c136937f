package io.dazzleduck.sharing.http;

public interface SharingRecorder {

    /**
     * A request for {@code operation} reached its handler.
     */
    void recordRequest(String operation);

    void recordError(String operation, int status);

    /**
     * A query response stopped at the file cap.
     */
    void recordTruncated(String operation);

    void recordFilesServed(long count);
}
