package io.kyhttp.client;

import io.kyhttp.core.KyHttpException;
import io.kyhttp.core.RequestSpec;
import io.kyhttp.core.Response;
import io.kyhttp.http.spi.HttpClientAdapter;
import io.kyhttp.http.spi.HttpClientException;
import io.kyhttp.http.spi.HttpClientRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Sends one request on the calling thread, retrying rejected attempts.
 *
 * <p>An attempt is accepted when the transport succeeds and the status is below
 * 500. Every attempt runs the before hook, one blocking transport call and the
 * after hook, in that order. The first accepted response is returned; when the
 * budget of {@code retry + 1} attempts is spent,
 * {@link KyHttpException.RetriesExhausted} is thrown.
 */
public final class SingleRequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(SingleRequestExecutor.class);

    private final HttpClientAdapter transport;

    public SingleRequestExecutor(HttpClientAdapter transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public Response send(RequestSpec spec) {
        Objects.requireNonNull(spec, "spec");
        HttpClientRequest request = Exchanges.toHttpRequest(spec);
        AttemptRecord record = new AttemptRecord(spec.maxAttempts());

        Response last = null;
        while (record.state() == AttemptState.PENDING) {
            HookInvoker.invokeBefore(spec);
            int attempt = record.begin();
            last = execute(spec, request, attempt);
            HookInvoker.invokeAfter(last);

            AttemptState next = record.complete(last);
            log.debug("{} attempt {}/{}: status={} -> {}", spec, attempt, record.maxAttempts(), last.status(), next);
        }

        if (record.state() == AttemptState.ACCEPTED) {
            return last;
        }
        log.warn("{} failed after {} attempts (last status={})", spec, record.attempts(), last.status(),
                last.transportError().orElse(null));
        throw new KyHttpException.RetriesExhausted(spec.retry(), record.attempts(), last);
    }

    private Response execute(RequestSpec spec, HttpClientRequest request, int attempt) {
        try {
            return Exchanges.toResponse(spec, attempt, transport.send(request));
        } catch (HttpClientException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new KyHttpException.Interrupted("Interrupted while sending " + spec, e);
            }
            return Response.failed(spec, attempt, e);
        }
    }
}
