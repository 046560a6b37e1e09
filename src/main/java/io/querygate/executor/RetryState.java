package io.querygate.executor;

/**
 * Attempt bookkeeping for one step. Moves from {@code RUNNING} to exactly one terminal phase; the
 * retry count never exceeds the policy bound.
 */
final class RetryState {
    enum Phase {
        RUNNING,
        SUCCEEDED,
        FAILED
    }

    private final RetryPolicy policy;
    private Phase phase = Phase.RUNNING;
    private int retries;
    private String lastError;

    RetryState(RetryPolicy policy) {
        this.policy = policy;
    }

    void succeeded() {
        requireRunning();
        phase = Phase.SUCCEEDED;
    }

    /** Records a failed attempt; returns true when another attempt should follow. */
    boolean failed(BackendException error) {
        requireRunning();
        lastError = error.getMessage();
        if (policy.isRetryable(error.signal()) && retries < policy.maxRetries()) {
            retries++;
            return true;
        }
        phase = Phase.FAILED;
        return false;
    }

    Phase phase() {
        return phase;
    }

    int retries() {
        return retries;
    }

    String lastError() {
        return lastError;
    }

    private void requireRunning() {
        if (phase != Phase.RUNNING) {
            throw new IllegalStateException("retry state already terminal: " + phase);
        }
    }
}
