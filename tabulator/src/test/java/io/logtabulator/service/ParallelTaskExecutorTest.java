package io.logtabulator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ParallelTaskExecutorTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void runsEveryTaskOnABoundedPool() {
        ParallelTaskExecutor executor = new ParallelTaskExecutor(3);
        Set<Integer> seen = ConcurrentHashMap.newKeySet();
        Set<String> threads = ConcurrentHashMap.newKeySet();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();

        executor.executeParallel("parse", (Integer n) -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            seen.add(n);
            threads.add(Thread.currentThread().getName());
            sleep(5);
            running.decrementAndGet();
        }, IntStream.rangeClosed(1, 20).boxed().toList());

        assertThat(seen).hasSize(20);
        assertThat(maxRunning.get()).isBetween(1, 3);
        assertThat(threads).hasSizeLessThanOrEqualTo(3).allMatch(name -> name.startsWith("parse-"));
    }

    @Test
    void firstFailureFailsTheStage() {
        ParallelTaskExecutor executor = new ParallelTaskExecutor(2);

        assertThatThrownBy(() -> executor.executeParallel("tabularize", (Integer n) -> {
            if (n == 3) {
                throw new IllegalStateException("chunk 3 is broken");
            }
        }, List.of(1, 2, 3, 4)))
                .isInstanceOf(PipelineException.class)
                .hasMessageContaining("tabularize")
                .hasMessageContaining("chunk 3 is broken")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void copiesCallerMdcIntoWorkers() {
        ParallelTaskExecutor executor = new ParallelTaskExecutor(2);
        Map<Integer, String> sources = new ConcurrentHashMap<>();
        MDC.put("source", "app.log");

        executor.executeParallel("parse", (Integer n) -> sources.put(n, MDC.get("source")), List.of(1, 2, 3));

        assertThat(sources).containsOnly(
                Map.entry(1, "app.log"), Map.entry(2, "app.log"), Map.entry(3, "app.log"));
    }

    @Test
    void emptyParameterListIsANoOp() {
        new ParallelTaskExecutor(1).executeParallel("parse", (String s) -> {
            throw new AssertionError("must not run");
        }, List.of());
    }

    @Test
    void rejectsNonPositiveThreadCount() {
        assertThatThrownBy(() -> new ParallelTaskExecutor(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
