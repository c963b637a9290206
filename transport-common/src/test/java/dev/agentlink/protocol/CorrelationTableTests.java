package dev.agentlink.protocol;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(10)
class CorrelationTableTests {

    private final CorrelationTable table = new CorrelationTable();

    @Test
    void idsAreUniqueAndMonotonic() {
        PendingCall first = table.register();
        PendingCall second = table.register();

        assertThat(first.id()).isEqualTo(1L);
        assertThat(second.id()).isEqualTo(2L);
        assertThat(table.size()).isEqualTo(2);
    }

    @Test
    void resolveFulfilsTheMatchingCallOnly() throws Exception {
        PendingCall first = table.register();
        PendingCall second = table.register();

        Envelope response = Envelope.success(second.id(), Json.object().put("n", 2));
        assertThat(table.resolve(second.id(), response)).isTrue();

        assertThat(second.await(Duration.ofSeconds(1))).isSameAs(response);
        assertThat(first.isDone()).isFalse();
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    void stringFormOfTheIdResolvesTheSameCall() {
        PendingCall call = table.register();

        assertThat(table.resolve(String.valueOf(call.id()), Envelope.success(call.id(), null))).isTrue();
        assertThat(call.isDone()).isTrue();
    }

    @Test
    void unknownOrDuplicateIdsAreIgnored() {
        PendingCall call = table.register();
        Envelope response = Envelope.success(call.id(), null);

        assertThat(table.resolve(99L, response)).isFalse();
        assertThat(table.resolve(null, response)).isFalse();
        assertThat(table.resolve(call.id(), response)).isTrue();
        assertThat(table.resolve(call.id(), response)).isFalse();

        PendingCall next = table.register();
        assertThat(next.id()).isEqualTo(2L);
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    void removedCallIsNoLongerResolvable() {
        PendingCall call = table.register();

        assertThat(table.remove(call.id())).isTrue();
        assertThat(table.resolve(call.id(), Envelope.success(call.id(), null))).isFalse();
        assertThat(call.isDone()).isFalse();
        assertThat(table.size()).isZero();
    }

    @Test
    void awaitTimesOutWhenNothingArrives() {
        PendingCall call = table.register();

        assertThatThrownBy(() -> call.await(Duration.ofMillis(50))).isInstanceOf(TimeoutException.class);
    }

    @Test
    void cancelAllFailsOutstandingAndLaterCalls() {
        PendingCall first = table.register();
        PendingCall second = table.register();
        IllegalStateException reason = new IllegalStateException("closed");

        assertThat(table.cancelAll(reason)).isEqualTo(2);
        assertThat(table.isClosed()).isTrue();
        assertThat(table.size()).isZero();

        assertThatThrownBy(() -> first.await(Duration.ofSeconds(1))).isInstanceOf(ExecutionException.class)
            .hasCause(reason);
        assertThatThrownBy(() -> second.await(Duration.ofSeconds(1))).hasCause(reason);

        PendingCall late = table.register();
        assertThat(late.isDone()).isTrue();
        assertThat(table.size()).isZero();
    }

    @Test
    void concurrentRegistrationsResolvedInPermutedOrder() throws Exception {
        int callers = 32;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch registered = new CountDownLatch(callers);
            List<PendingCall> calls = Collections.synchronizedList(new ArrayList<>());
            List<Future<Long>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    PendingCall call = table.register();
                    calls.add(call);
                    registered.countDown();
                    long echoed = call.await(Duration.ofSeconds(5)).result().path("echo").asLong();
                    return echoed == call.id() ? echoed : -echoed;
                }));
            }
            assertThat(registered.await(5, TimeUnit.SECONDS)).isTrue();

            List<PendingCall> shuffled = new ArrayList<>(calls);
            Collections.shuffle(shuffled);
            for (PendingCall call : shuffled) {
                table.resolve(call.id(), Envelope.success(call.id(), Json.object().put("echo", call.id())));
            }

            Set<Long> seen = new HashSet<>();
            for (int i = 0; i < callers; i++) {
                seen.add(results.get(i).get(5, TimeUnit.SECONDS));
            }
            Set<Long> expected = new HashSet<>();
            calls.forEach(call -> expected.add(call.id()));
            assertThat(seen).isEqualTo(expected).hasSize(callers);
            assertThat(table.size()).isZero();
        }
        finally {
            pool.shutdownNow();
        }
    }

}
