package dev.agentlink.protocol;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A request awaiting its response. The slot is written once, by whoever gets there first: the
 * reader delivering the response, the caller giving up, or teardown.
 */
public final class PendingCall {

    private final long id;
    private final CompletableFuture<Envelope> slot = new CompletableFuture<>();

    PendingCall(long id) {
        this.id = id;
    }

    public long id() {
        return id;
    }

    String key() {
        return Long.toString(id);
    }

    boolean complete(Envelope response) {
        return slot.complete(response);
    }

    boolean fail(Throwable reason) {
        return slot.completeExceptionally(reason);
    }

    public boolean isDone() {
        return slot.isDone();
    }

    /**
     * Blocks until the response arrives, the call is failed, or the timeout elapses.
     *
     * @throws ExecutionException when the call was failed; the cause is the failure reason
     */
    public Envelope await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        return slot.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
