package io.querygate.executor;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

public record RetryPolicy(int maxRetries, Set<String> retryableSignals, Duration callTimeout) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(30);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative: " + maxRetries);
        }
        retryableSignals = retryableSignals == null
                ? Set.of(BackendException.TRANSIENT_ERROR, BackendException.TIMEOUT)
                : Set.copyOf(retryableSignals);
        if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
            callTimeout = DEFAULT_CALL_TIMEOUT;
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, null, DEFAULT_CALL_TIMEOUT);
    }

    public RetryPolicy withMaxRetries(int value) {
        return new RetryPolicy(value, retryableSignals, callTimeout);
    }

    public boolean isRetryable(String signal) {
        return signal != null && retryableSignals.contains(signal.toLowerCase(Locale.ROOT));
    }
}
