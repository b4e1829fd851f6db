package io.kyhttp.core;

/**
 * Callback invoked with the response of every attempt, accepted or not.
 *
 * <p>Exceptions thrown by the hook are not caught; they abort the attempt
 * (or the batch round) that invoked it.
 */
@FunctionalInterface
public interface AfterHook {
    void afterResponse(Response response);
}
