package io.dazzleduck.sharing.common.util;

import com.typesafe.config.Config;
import io.dazzleduck.sharing.common.ConfigConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for transient backend failures. Failures that the
 * {@code retryable} predicate rejects propagate on the first attempt.
 */
public record Retry(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    private static final Logger logger = LoggerFactory.getLogger(Retry.class);

    public static final Retry DEFAULT = new Retry(3, Duration.ofMillis(100), Duration.ofSeconds(2));

    public Retry {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static Retry load(Config config) {
        if (!config.hasPath(ConfigConstants.RETRY_KEY)) {
            return DEFAULT;
        }
        var retry = config.getConfig(ConfigConstants.RETRY_KEY);
        return new Retry(retry.getInt(ConfigConstants.MAX_ATTEMPTS_KEY),
                retry.getDuration(ConfigConstants.INITIAL_BACKOFF_KEY),
                retry.getDuration(ConfigConstants.MAX_BACKOFF_KEY));
    }

    public <T> T call(String operation, Supplier<T> action, Predicate<? super RuntimeException> retryable) {
        var backoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                logger.atWarn().setCause(e).log("{} failed on attempt {} of {}, retrying in {}", operation, attempt, maxAttempts, backoff);
                sleep(backoff);
                backoff = backoff.multipliedBy(2);
                if (backoff.compareTo(maxBackoff) > 0) {
                    backoff = maxBackoff;
                }
            }
        }
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while backing off", e);
        }
    }
}
