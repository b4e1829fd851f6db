package io.kyhttp.core;

/**
 * Callback invoked before every attempt of a request.
 *
 * <p>Exceptions thrown by the hook are not caught; they abort the attempt
 * (or the batch round) that invoked it.
 */
@FunctionalInterface
public interface BeforeHook {
    void beforeRequest(RequestSpec request);
}
