package io.kyhttp.client;

import io.kyhttp.core.Response;

/**
 * Attempt counter and state of one request for the duration of one execution.
 *
 * <p>A record is owned by exactly one executor at a time and is never stored
 * on the {@link io.kyhttp.core.RequestSpec}; it is not thread-safe.
 */
public final class AttemptRecord {

    private final int maxAttempts;
    private int attempts;
    private AttemptState state = AttemptState.PENDING;

    public AttemptRecord(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Moves to {@link AttemptState#IN_FLIGHT} and counts the attempt.
     *
     * @return the 1-based number of the attempt being started
     */
    public int begin() {
        if (state != AttemptState.PENDING) {
            throw new IllegalStateException("Cannot begin an attempt in state " + state);
        }
        state = AttemptState.IN_FLIGHT;
        return ++attempts;
    }

    /**
     * Classifies the response of the attempt in flight. Transport failures and
     * 5xx statuses are rejected; a rejected attempt goes back to
     * {@link AttemptState#PENDING} while attempts remain.
     *
     * @return the new state
     */
    public AttemptState complete(Response response) {
        if (state != AttemptState.IN_FLIGHT) {
            throw new IllegalStateException("No attempt in flight (state " + state + ")");
        }
        if (response.isAccepted()) {
            state = AttemptState.ACCEPTED;
        } else if (attempts < maxAttempts) {
            state = AttemptState.PENDING;
        } else {
            state = AttemptState.EXHAUSTED;
        }
        return state;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public AttemptState state() {
        return state;
    }

    @Override
    public String toString() {
        return "AttemptRecord[" + attempts + "/" + maxAttempts + ", " + state + "]";
    }
}
