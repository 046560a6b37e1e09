package io.querygate.executor;

/**
 * Warehouse seam. Implementations signal failures with {@link BackendException}; the signal decides
 * whether the call is retried.
 */
@FunctionalInterface
public interface QueryBackend {
    QueryResult execute(String stepName, String sql) throws BackendException;
}
