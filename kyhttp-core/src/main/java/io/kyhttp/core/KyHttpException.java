package io.kyhttp.core;

/**
 * Base class for kyhttp runtime errors.
 *
 * <p>Transport failures are reported separately by the transport layer and are
 * retried; the subclasses here describe outcomes the caller has to handle.
 */
public abstract class KyHttpException extends RuntimeException {

    protected KyHttpException(String message) {
        super(message);
    }

    protected KyHttpException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised by a single send when no attempt was accepted.
     *
     * <p>Batch execution never raises this; it returns the last response instead.
     */
    public static class RetriesExhausted extends KyHttpException {
        private final int retries;
        private final int attempts;
        private final Response lastResponse;

        public RetriesExhausted(int retries, int attempts, Response lastResponse) {
            super("Request failed after " + retries + " retries",
                    lastResponse == null ? null : lastResponse.transportError().orElse(null));
            this.retries = retries;
            this.attempts = attempts;
            this.lastResponse = lastResponse;
        }

        /**
         * The configured retry budget.
         */
        public int retries() {
            return retries;
        }

        public int attempts() {
            return attempts;
        }

        /**
         * Response of the final rejected attempt.
         */
        public Response lastResponse() {
            return lastResponse;
        }
    }

    /**
     * Raised when a request cannot be built (missing or relative URL, body that
     * cannot be encoded).
     */
    public static class InvalidRequest extends KyHttpException {
        public InvalidRequest(String message) {
            super(message);
        }

        public InvalidRequest(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the calling thread is interrupted while a request or a batch
     * round is in progress. The interrupt flag is restored before throwing.
     */
    public static class Interrupted extends KyHttpException {
        public Interrupted(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
