package com.finbrain.infrastructure.ai.resilience;

import com.finbrain.domain.inference.model.GateStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestGateTest {

    private final RequestGate gate = new RequestGate(3);

    @Test
    @DisplayName("A fourth caller times out while three permits are held")
    void fourthCallerTimesOut() {
        RequestGate.Permit a = gate.acquire(Duration.ofMillis(10));
        RequestGate.Permit b = gate.acquire(Duration.ofMillis(10));
        RequestGate.Permit c = gate.acquire(Duration.ofMillis(10));

        assertThatThrownBy(() -> gate.acquire(Duration.ofMillis(50)))
                .isInstanceOf(GateTimeoutException.class);

        GateStats stats = gate.stats();
        assertThat(stats.active()).isEqualTo(3);
        assertThat(stats.available()).isZero();
        assertThat(stats.timeouts()).isEqualTo(1);

        a.close();
        b.close();
        c.close();
    }

    @Test
    @DisplayName("Releasing a permit unblocks a waiting caller")
    void releaseUnblocksWaiter() throws Exception {
        RequestGate.Permit a = gate.acquire(Duration.ZERO);
        gate.acquire(Duration.ZERO);
        gate.acquire(Duration.ZERO);

        CompletableFuture<RequestGate.Permit> waiter =
                CompletableFuture.supplyAsync(() -> gate.acquire(Duration.ofSeconds(5)));
        a.close();

        RequestGate.Permit admitted = waiter.get(5, TimeUnit.SECONDS);
        assertThat(admitted.isReleased()).isFalse();
        assertThat(gate.stats().active()).isEqualTo(3);
    }

    @Test
    @DisplayName("Closing a permit twice releases one slot only")
    void closeIsIdempotent() {
        try (RequestGate.Permit permit = gate.acquire(Duration.ZERO)) {
            permit.close();
            assertThat(permit.isReleased()).isTrue();
        }

        GateStats stats = gate.stats();
        assertThat(stats.available()).isEqualTo(3);
        assertThat(stats.processed()).isEqualTo(1);
        assertThat(stats.active()).isZero();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new RequestGate(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
