package io.dazzleduck.sharing.common.util;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RetryTest {

    private static class Throttled extends RuntimeException {
    }

    private final Retry retry = new Retry(3, Duration.ofMillis(1), Duration.ofMillis(2));

    @Test
    public void testTransientFailureIsRetried() {
        var calls = new AtomicInteger();
        var result = retry.call("list", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new Throttled();
            }
            return "ok";
        }, e -> e instanceof Throttled);
        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    public void testAttemptsAreBounded() {
        var calls = new AtomicInteger();
        assertThrows(Throttled.class, () -> retry.call("list", () -> {
            calls.incrementAndGet();
            throw new Throttled();
        }, e -> e instanceof Throttled));
        assertEquals(3, calls.get());
    }

    @Test
    public void testNonTransientFailurePropagatesImmediately() {
        var calls = new AtomicInteger();
        assertThrows(IllegalStateException.class, () -> retry.call("list", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bad query");
        }, e -> e instanceof Throttled));
        assertEquals(1, calls.get());
    }

    @Test
    public void testLoad() {
        var config = ConfigFactory.parseString("retry { max_attempts = 5, initial_backoff = 10ms, max_backoff = 1s }");
        assertEquals(new Retry(5, Duration.ofMillis(10), Duration.ofSeconds(1)), Retry.load(config));
        assertEquals(Retry.DEFAULT, Retry.load(ConfigFactory.empty()));
    }
}
