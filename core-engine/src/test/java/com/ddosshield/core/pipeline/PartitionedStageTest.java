package com.ddosshield.core.pipeline;

import com.ddosshield.core.metrics.InMemoryShieldMetrics;
import com.ddosshield.core.metrics.MetricNames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PartitionedStage}.
 */
class PartitionedStageTest {

    private final InMemoryShieldMetrics metrics = new InMemoryShieldMetrics();

    @Test
    @DisplayName("Items with the same key are handled in submission order")
    void shouldPreserveOrderPerKey() throws InterruptedException {
        Map<String, List<Integer>> seen = new ConcurrentHashMap<>();
        PartitionedStage<String> stage = new PartitionedStage<>("test", 4, 16, item -> item.split(":")[0],
                item -> {
                    String[] parts = item.split(":");
                    seen.computeIfAbsent(parts[0], k -> new CopyOnWriteArrayList<>())
                            .add(Integer.parseInt(parts[1]));
                }, metrics);
        stage.start();

        for (int i = 0; i < 200; i++) {
            stage.put("key" + (i % 5) + ":" + i);
        }
        stage.close();

        assertThat(seen).hasSize(5);
        seen.values().forEach(values -> assertThat(values).isSorted().hasSize(40));
    }

    @Test
    @DisplayName("A failing item is counted and the worker keeps going")
    void shouldSurviveHandlerFailure() throws InterruptedException {
        List<Integer> handled = new CopyOnWriteArrayList<>();
        PartitionedStage<Integer> stage = new PartitionedStage<>("test", 1, 16, Function.identity(), item -> {
            if (item == 2) {
                throw new IllegalStateException("boom");
            }
            handled.add(item);
        }, metrics);
        stage.start();

        for (int i = 1; i <= 3; i++) {
            stage.put(i);
        }
        stage.close();

        assertThat(handled).containsExactly(1, 3);
        assertThat(metrics.count(MetricNames.STAGE_ERRORS)).isEqualTo(1);
    }

    @Test
    @DisplayName("Offering to a full partition fails fast")
    void shouldRejectWhenFull() {
        List<Integer> ignored = new ArrayList<>();
        PartitionedStage<Integer> stage = new PartitionedStage<>("test", 1, 2, Function.identity(), ignored::add,
                metrics);

        assertThat(IntStream.range(0, 3).mapToObj(stage::offer).toList()).containsExactly(true, true, false);
        assertThat(stage.queued()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should refuse to start twice")
    void shouldStartOnce() {
        PartitionedStage<Integer> stage = new PartitionedStage<>("test", 1, 1, Function.identity(), i -> {
        }, metrics);
        stage.start();
        try {
            assertThatThrownBy(stage::start).isInstanceOf(IllegalStateException.class);
        } finally {
            stage.close();
        }
    }
}
