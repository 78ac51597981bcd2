package com.ddosshield.core.state;

import com.ddosshield.core.metrics.InMemoryShieldMetrics;
import com.ddosshield.core.metrics.MetricNames;
import com.ddosshield.core.model.MitigationState;
import com.ddosshield.core.model.SourceIdentity;
import com.ddosshield.core.model.SourceState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.ddosshield.core.TestFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SourceStateStore}.
 */
class SourceStateStoreTest {

    private static final SourceIdentity A = SourceIdentity.of("198.51.100.1");
    private static final SourceIdentity B = SourceIdentity.of("198.51.100.2");
    private static final SourceIdentity C = SourceIdentity.of("198.51.100.3");

    private InMemoryShieldMetrics metrics;
    private List<SourceIdentity> evicted;
    private SourceStateStore store;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryShieldMetrics();
        evicted = new ArrayList<>();
        store = new SourceStateStore(4, 100, metrics, (component, identity, capacity) -> evicted.add(identity));
    }

    private static SourceState to(SourceState s, MitigationState next) {
        return s.toBuilder().transitionTo(next, T0).build();
    }

    @Test
    @DisplayName("Unknown sources are reported as absent, then initialized on first write")
    void shouldInitializeOnFirstWrite() {
        assertThat(store.get(A)).isEmpty();

        StateChange change = store.compareAndTransition(A, T0, s -> s);

        assertThat(change.previous().getState()).isEqualTo(MitigationState.OBSERVING);
        assertThat(change.isTransition()).isFalse();
        assertThat(store.get(A)).contains(change.current());
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("A generation guarded update is skipped once the state has moved on")
    void shouldRejectStaleGeneration() {
        long generation = store.getOrInit(A, T0).getGeneration();
        store.compareAndTransition(A, T0, s -> to(s, MitigationState.SUSPICIOUS));

        assertThat(store.compareAndTransition(A, generation, s -> to(s, MitigationState.BLOCKED))).isEmpty();
        assertThat(store.get(A).map(SourceState::getState)).contains(MitigationState.SUSPICIOUS);
    }

    @Test
    @DisplayName("Updates of existing entries never create new ones")
    void shouldNotCreateOnConditionalUpdate() {
        assertThat(store.transitionIfPresent(A, s -> to(s, MitigationState.BLOCKED))).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Idle eviction keeps blocked and recovering sources")
    void shouldEvictOnlyUntimedIdleSources() {
        store.compareAndTransition(A, T0, s -> s);
        store.compareAndTransition(B, T0, s -> to(s, MitigationState.BLOCKED));
        store.compareAndTransition(C, T0.plusSeconds(500), s -> s);

        List<SourceState> removed = store.evictIdle(T0.plusSeconds(100));

        assertThat(removed).extracting(SourceState::getIdentity).containsExactly(A);
        assertThat(store.get(A)).isEmpty();
        assertThat(store.get(B)).isPresent();
        assertThat(store.get(C)).isPresent();
        assertThat(metrics.count(MetricNames.STATE_IDLE_EVICTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("At capacity the least recently used untimed source makes room")
    void shouldEvictLeastRecentlyUsedAtCapacity() {
        store = new SourceStateStore(1, 2, metrics, (component, identity, capacity) -> evicted.add(identity));
        store.compareAndTransition(A, T0, s -> to(s, MitigationState.BLOCKED));
        store.compareAndTransition(B, T0, s -> s);

        store.compareAndTransition(C, T0, s -> s);

        assertThat(evicted).containsExactly(B);
        assertThat(store.get(A)).isPresent();
        assertThat(store.get(C)).isPresent();
        assertThat(metrics.count(MetricNames.STATE_EVICTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("Snapshot filters and orders by identity")
    void shouldSnapshotInIdentityOrder() {
        store.compareAndTransition(C, T0, s -> to(s, MitigationState.BLOCKED));
        store.compareAndTransition(A, T0, s -> to(s, MitigationState.BLOCKED));
        store.compareAndTransition(B, T0, s -> s);

        assertThat(store.snapshot(s -> s.getState() == MitigationState.BLOCKED))
                .extracting(SourceState::getIdentity)
                .containsExactly(A, C);
    }

    @Test
    @DisplayName("Concurrent updates of one source are applied atomically")
    void shouldSerializeConcurrentUpdates() throws InterruptedException {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                for (int i = 0; i < perThread; i++) {
                    store.compareAndTransition(A, T0,
                            s -> s.toBuilder().cleanStreak(s.getCleanStreak() + 1).build());
                }
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdownNow();
        assertThat(store.get(A).map(SourceState::getCleanStreak)).contains(threads * perThread);
    }
}
