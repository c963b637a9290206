package dev.agentlink.protocol;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps request ids to the calls awaiting them. Many callers may register concurrently while a
 * single reader resolves; ids are allocated from a monotonic counter and never reused for the
 * lifetime of the table.
 */
public final class CorrelationTable {

    private final AtomicLong nextId = new AtomicLong();
    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();

    private volatile Throwable closedReason;

    /**
     * Allocates a fresh id with an empty slot. Once the table has been cancelled, the returned
     * call is already failed with the cancellation reason and is not tracked.
     */
    public PendingCall register() {
        PendingCall call = new PendingCall(nextId.incrementAndGet());
        pending.put(call.key(), call);
        Throwable reason = closedReason;
        if (reason != null) {
            pending.remove(call.key());
            call.fail(reason);
        }
        return call;
    }

    /**
     * Fulfils the call registered under {@code id}.
     *
     * @return {@code false} when no call is waiting for that id (late, duplicate or unknown)
     */
    public boolean resolve(Object id, Envelope response) {
        if (id == null) {
            return false;
        }
        PendingCall call = pending.remove(id.toString());
        return call != null && call.complete(response);
    }

    /**
     * Drops the call registered under {@code id} without completing it.
     */
    public boolean remove(Object id) {
        return id != null && pending.remove(id.toString()) != null;
    }

    /**
     * Fails every outstanding call and every call registered afterwards.
     *
     * @return number of calls that were outstanding
     */
    public int cancelAll(Throwable reason) {
        closedReason = reason;
        int cancelled = 0;
        for (String key : pending.keySet()) {
            PendingCall call = pending.remove(key);
            if (call != null && call.fail(reason)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public int size() {
        return pending.size();
    }

    public boolean isClosed() {
        return closedReason != null;
    }
}
