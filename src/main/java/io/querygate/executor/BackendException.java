package io.querygate.executor;

import java.util.Locale;

public final class BackendException extends RuntimeException {
    public static final String TRANSIENT_ERROR = "transient_error";
    public static final String TIMEOUT = "timeout";
    /** Timed-out call that kept running after cancellation; never retried. */
    public static final String TIMEOUT_ABANDONED = "timeout_abandoned";

    private final String signal;

    public BackendException(String signal) {
        super(normalize(signal));
        this.signal = normalize(signal);
    }

    public BackendException(String signal, String detail, Throwable cause) {
        super(detail == null || detail.isBlank() ? normalize(signal) : normalize(signal) + ": " + detail, cause);
        this.signal = normalize(signal);
    }

    public String signal() {
        return signal;
    }

    private static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "backend_error";
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }
}
