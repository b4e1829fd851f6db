package io.kyhttp.client;

/**
 * Lifecycle of a request inside one execution.
 *
 * <pre>
 * PENDING --begin--&gt; IN_FLIGHT --accepted--&gt; ACCEPTED
 *                        |--rejected, budget left--&gt; PENDING
 *                        |--rejected, budget spent--&gt; EXHAUSTED
 * </pre>
 */
public enum AttemptState {
    PENDING,
    IN_FLIGHT,
    ACCEPTED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == EXHAUSTED;
    }
}
