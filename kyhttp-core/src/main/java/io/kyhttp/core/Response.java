package io.kyhttp.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one attempt.
 *
 * <p>When the transport failed, {@code status} is {@code 0}, the body is empty
 * and {@link #transportError()} holds the cause. The body is copied on the
 * way in and on the way out; equality compares its content.
 *
 * @param request the spec this response answers
 * @param attempt 1-based attempt number that produced it
 * @param status the HTTP status code, or 0 on transport failure
 * @param headers response headers
 * @param body response body, never null
 * @param error the transport failure, or null
 */
public record Response(
        RequestSpec request,
        int attempt,
        int status,
        Map<String, ? extends Iterable<String>> headers,
        byte[] body,
        Exception error
) {
    public Response {
        Objects.requireNonNull(request, "request");
        if (headers == null) {
            headers = Map.<String, Iterable<String>>of();
        }
        body = body == null ? new byte[0] : body.clone();
    }

    public static Response failed(RequestSpec request, int attempt, Exception error) {
        return new Response(request, attempt, 0, Map.of(), new byte[0], Objects.requireNonNull(error, "error"));
    }

    /**
     * Returns a copy of the body.
     */
    @Override
    public byte[] body() {
        return body.clone();
    }

    public Optional<Exception> transportError() {
        return Optional.ofNullable(error);
    }

    public boolean isTransportError() {
        return error != null;
    }

    public boolean isServerError() {
        return status >= 500;
    }

    /**
     * An attempt is accepted when the transport succeeded and the status is
     * below 500. Client errors (4xx) are accepted: they are final answers.
     */
    public boolean isAccepted() {
        return error == null && status < 500;
    }

    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Response other)) return false;
        return attempt == other.attempt
                && status == other.status
                && request.equals(other.request)
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body)
                && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(request, attempt, status, headers, error);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "Response[" + request + ", attempt=" + attempt + ", status=" + status
                + (error == null ? "" : ", error=" + error) + "]";
    }
}
