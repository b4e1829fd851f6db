package io.kyhttp.client;

import io.kyhttp.core.KyHttpException;
import io.kyhttp.core.RequestSpec;
import io.kyhttp.core.Response;
import io.kyhttp.http.spi.HttpClientAdapter;
import io.kyhttp.http.spi.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs every request of a {@link BatchQueue} concurrently, in rounds.
 *
 * <p>Each round submits all pending requests at once through
 * {@link HttpClientAdapter#sendAsync}, then the coordinating thread polls the
 * round in bounded waits until no call is in flight. After that barrier the
 * after hooks run and every request is triaged: a rejected one (5xx or
 * transport failure) with attempts left moves to the next round; all others
 * are final. Rounds repeat until nothing is pending.
 *
 * <p>Unlike {@link SingleRequestExecutor}, an exhausted request does not throw:
 * its last rejected response is returned like any other.
 *
 * <p>Responses are returned in round order; within a round, in the order the
 * requests were submitted. So a request that needed retries appears after
 * siblings that succeeded earlier. Use {@link Response#request()} to match
 * responses to requests.
 *
 * <p>No timeout is applied: a call that never completes blocks its round.
 */
public final class BatchExecutor {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    private final HttpClientAdapter transport;
    private final Duration pollInterval;

    public BatchExecutor(HttpClientAdapter transport) {
        this(transport, DEFAULT_POLL_INTERVAL);
    }

    public BatchExecutor(HttpClientAdapter transport, Duration pollInterval) {
        this.transport = Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.pollInterval = pollInterval;
    }

    /**
     * Drains the queue and runs it to completion.
     *
     * @return the final response of every queued request
     */
    public List<Response> runBatch(BatchQueue queue) {
        return run(queue).responses();
    }

    /**
     * Same as {@link #runBatch(BatchQueue)}, also reporting how many rounds ran.
     */
    public BatchOutcome run(BatchQueue queue) {
        Objects.requireNonNull(queue, "queue");
        List<BatchQueue.QueuedRequest> pending = queue.drain();
        List<Response> responses = new ArrayList<>(pending.size());
        int rounds = 0;

        while (!pending.isEmpty()) {
            rounds++;
            log.debug("Batch round {}: {} request(s)", rounds, pending.size());
            InFlightRound round = submit(pending);
            awaitRound(round, rounds);
            pending = triage(pending, round, responses);
        }

        log.debug("Batch finished: {} response(s) in {} round(s)", responses.size(), rounds);
        return new BatchOutcome(List.copyOf(responses), rounds);
    }

    private InFlightRound submit(List<BatchQueue.QueuedRequest> pending) {
        InFlightRound round = new InFlightRound(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            RequestSpec spec = pending.get(i).spec();
            HookInvoker.invokeBefore(spec);
            int attempt = pending.get(i).record().begin();
            round.submit(i, spec, attempt, sendAsync(spec));
        }
        return round;
    }

    private CompletableFuture<HttpClientResponse> sendAsync(RequestSpec spec) {
        try {
            return transport.sendAsync(Exchanges.toHttpRequest(spec));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void awaitRound(InFlightRound round, int number) {
        try {
            while (round.remaining() > 0) {
                if (!round.await(pollInterval)) {
                    log.trace("Batch round {}: {} call(s) still in flight", number, round.remaining());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KyHttpException.Interrupted("Interrupted while waiting for batch round " + number, e);
        }
    }

    private static List<BatchQueue.QueuedRequest> triage(
            List<BatchQueue.QueuedRequest> pending, InFlightRound round, List<Response> responses) {
        List<BatchQueue.QueuedRequest> next = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            BatchQueue.QueuedRequest entry = pending.get(i);
            Response response = round.response(i);
            HookInvoker.invokeAfter(response);

            AttemptState state = entry.record().complete(response);
            if (state == AttemptState.PENDING) {
                log.debug("{} attempt {} rejected (status={}), retrying", entry.spec(), response.attempt(), response.status());
                next.add(entry);
            } else {
                if (state == AttemptState.EXHAUSTED) {
                    log.debug("{} exhausted after {} attempt(s), returning status={}", entry.spec(),
                            response.attempt(), response.status());
                }
                responses.add(response);
            }
        }
        return next;
    }

    /**
     * Result of one batch run.
     *
     * @param responses final responses, in round order
     * @param rounds number of rounds executed
     */
    public record BatchOutcome(List<Response> responses, int rounds) {
    }
}
