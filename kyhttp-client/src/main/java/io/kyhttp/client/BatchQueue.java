package io.kyhttp.client;

import io.kyhttp.core.RequestSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Requests accumulated for one batch run.
 *
 * <p>The queue is append-only until a {@link BatchExecutor} drains it; draining
 * empties it and hands its entries to the run. The same {@link RequestSpec} may
 * be added several times; each occurrence is executed and counted separately.
 *
 * <p>Not thread-safe. A queue must not be modified while a batch run is
 * draining it.
 */
public final class BatchQueue {

    private List<QueuedRequest> entries = new ArrayList<>();

    public BatchQueue add(RequestSpec spec) {
        Objects.requireNonNull(spec, "spec");
        entries.add(new QueuedRequest(spec, new AttemptRecord(spec.maxAttempts())));
        return this;
    }

    public BatchQueue addAll(Iterable<RequestSpec> specs) {
        for (RequestSpec spec : specs) {
            add(spec);
        }
        return this;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Removes every entry without running it.
     */
    public void clear() {
        entries = new ArrayList<>();
    }

    List<QueuedRequest> drain() {
        List<QueuedRequest> drained = entries;
        entries = new ArrayList<>();
        return drained;
    }

    /**
     * A queued spec paired with the attempt record of this occurrence.
     */
    record QueuedRequest(RequestSpec spec, AttemptRecord record) {
    }
}
