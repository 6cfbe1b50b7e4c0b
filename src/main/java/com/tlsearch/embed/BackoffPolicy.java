package com.tlsearch.embed;

import java.io.IOException;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tlsearch.runtime.Sleeper;

/**
 * Bounded exponential backoff. The delay before retry {@code n} is {@code min(base * 2^(n-1), cap)};
 * nothing is slept after the final attempt.
 */
public final class BackoffPolicy {
    private static final Logger log = LoggerFactory.getLogger(BackoffPolicy.class);

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Predicate<? super IOException> retryable;
    private final Sleeper sleeper;

    public BackoffPolicy(int maxAttempts,
            long baseDelayMs,
            long maxDelayMs,
            Predicate<? super IOException> retryable,
            Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    /**
     * Retries transport failures and provider errors flagged as retryable (5xx, 429).
     */
    public static BackoffPolicy forProvider(int maxAttempts, long baseDelayMs, long maxDelayMs, Sleeper sleeper) {
        return new BackoffPolicy(maxAttempts, baseDelayMs, maxDelayMs, BackoffPolicy::isRetryableProviderFailure, sleeper);
    }

    public static boolean isRetryableProviderFailure(IOException failure) {
        if (failure instanceof VectorProviderException providerFailure) {
            return providerFailure.retryable();
        }
        return true;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        int shift = Math.min(attempt - 1, 30);
        long delay = baseDelayMs << shift;
        if (delay < 0 || (baseDelayMs != 0 && delay >> shift != baseDelayMs)) {
            return maxDelayMs;
        }
        return Math.min(delay, maxDelayMs);
    }

    /**
     * Runs {@code call} until it succeeds, fails with a non-retryable error, or attempts run out.
     * The failure of the last attempt is rethrown unchanged.
     */
    public <T> T execute(String operation, Attempt<T> call) throws IOException, InterruptedException {
        for (int attempt = 1;; attempt++) {
            try {
                return call.run(attempt);
            } catch (IOException e) {
                if (!retryable.test(e)) {
                    log.warn("{}.failed attempt={} retryable=false reason={}", operation, attempt, e.getMessage());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("{}.exhausted attempts={} reason={}", operation, attempt, e.getMessage());
                    throw e;
                }
                long delay = delayForAttempt(attempt);
                log.warn("{}.retry attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, delay, e.getMessage());
                sleeper.sleep(delay);
            }
        }
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attempt) throws IOException;
    }
}
