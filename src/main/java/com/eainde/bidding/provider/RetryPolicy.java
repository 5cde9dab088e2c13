package com.eainde.bidding.provider;

import com.eainde.bidding.config.PipelineProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: attempt {@code n} waits {@code baseDelay * 2^(n-1)},
 * capped at {@code maxDelay}, then shifted by up to {@code jitter} of itself in either direction.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double jitter) {

    private static final double DEFAULT_JITTER = 0.2;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1]");
        }
    }

    public static RetryPolicy from(PipelineProperties props) {
        return new RetryPolicy(props.getPerCallMaxRetries(), props.getRetryBaseDelay(),
                props.getRetryMaxDelay(), DEFAULT_JITTER);
    }

    public static RetryPolicy noRetries() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 0.0);
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration delayFor(int attempt) {
        long base = baseDelay.toMillis();
        if (base == 0) {
            return Duration.ZERO;
        }
        int exponent = Math.min(attempt - 1, 30);
        long delay = Math.min(base << exponent, maxDelay.toMillis());
        if (delay <= 0) {
            delay = maxDelay.toMillis();
        }
        if (jitter > 0) {
            double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
            delay = Math.round(delay * factor);
        }
        return Duration.ofMillis(Math.max(0, delay));
    }
}
