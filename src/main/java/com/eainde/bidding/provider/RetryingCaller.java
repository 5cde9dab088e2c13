package com.eainde.bidding.provider;

import com.eainde.bidding.error.PermanentProviderException;
import com.eainde.bidding.error.TransientProviderException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Runs provider calls with bounded retries.
 *
 * <p>{@link TransientProviderException}s are retried up to the policy's limit with
 * exponential backoff. {@link PermanentProviderException}s and any other runtime failure
 * propagate immediately. An interrupt, whether already pending or arriving during a
 * backoff sleep, aborts with {@link CancellationException} and keeps the interrupt flag set.</p>
 */
@Slf4j
public class RetryingCaller {

    private final RetryPolicy policy;

    public RetryingCaller(RetryPolicy policy) {
        this.policy = policy;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> T call(String operation, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            attempt++;
            abortIfInterrupted(operation);
            try {
                return action.get();
            } catch (PermanentProviderException e) {
                log.error("{} failed permanently on attempt {}: {}", operation, attempt, e.getMessage());
                throw e;
            } catch (TransientProviderException e) {
                if (attempt > policy.maxRetries()) {
                    log.warn("{} failed after {} attempt(s), giving up: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                Duration delay = policy.delayFor(attempt);
                log.warn("Attempt {}/{} of {} failed, retrying in {} ms: {}",
                        attempt, policy.maxRetries() + 1, operation, delay.toMillis(), e.getMessage());
                sleep(delay, operation);
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private static void abortIfInterrupted(String operation) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException(operation + " cancelled");
        }
    }

    private static void sleep(Duration delay, String operation) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException(operation + " cancelled during backoff");
            cancelled.initCause(e);
            throw cancelled;
        }
    }
}
