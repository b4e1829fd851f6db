package io.kyhttp.client;

import io.kyhttp.core.RequestSpec;
import io.kyhttp.core.Response;
import io.kyhttp.http.spi.HttpClientResponse;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * The calls of one batch round, tracked until all of them complete.
 *
 * <p>Slots are fixed at construction; the round is closed to new calls once
 * every slot has been submitted. Transport callbacks only store the response
 * and count down, so hooks and triage stay on the coordinating thread.
 */
final class InFlightRound {

    private final AtomicReferenceArray<Response> responses;
    private final CountDownLatch remaining;

    InFlightRound(int size) {
        this.responses = new AtomicReferenceArray<>(size);
        this.remaining = new CountDownLatch(size);
    }

    void submit(int slot, RequestSpec spec, int attempt, CompletableFuture<HttpClientResponse> call) {
        call.whenComplete((response, error) -> {
            Response r;
            try {
                r = error != null
                        ? Exchanges.failed(spec, attempt, error)
                        : Exchanges.toResponse(spec, attempt, response);
            } catch (RuntimeException e) {
                r = Exchanges.failed(spec, attempt, e);
            }
            if (responses.compareAndSet(slot, null, r)) {
                remaining.countDown();
            }
        });
    }

    /**
     * Number of calls still in flight.
     */
    long remaining() {
        return remaining.getCount();
    }

    /**
     * Blocks for at most {@code timeout} waiting for the round to finish.
     *
     * @return true if no call remains in flight
     */
    boolean await(Duration timeout) throws InterruptedException {
        return remaining.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    Response response(int slot) {
        Response r = responses.get(slot);
        if (r == null) {
            throw new IllegalStateException("Call " + slot + " has not completed");
        }
        return r;
    }
}
