package io.dazzleduck.sharing.http;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public class MicroMeterSharingRecorder implements SharingRecorder {

    private final MeterRegistry registry;
    private final String serverId;
    private final Counter filesServedCounter;

    public MicroMeterSharingRecorder(MeterRegistry registry, String serverId) {
        this.registry = registry;
        this.serverId = serverId;
        this.filesServedCounter = counter("files_served");
    }

    private Counter counter(String name, String... tags) {
        return Counter.builder("dazzleduck.sharing." + name + ".count")
                .tag("server", serverId)
                .tags(tags)
                .register(registry);
    }

    @Override
    public void recordRequest(String operation) {
        counter("request", "operation", operation).increment();
    }

    @Override
    public void recordError(String operation, int status) {
        counter("error", "operation", operation, "status", Integer.toString(status)).increment();
    }

    @Override
    public void recordTruncated(String operation) {
        counter("truncated", "operation", operation).increment();
    }

    @Override
    public void recordFilesServed(long count) {
        filesServedCounter.increment(count);
    }
}
