package io.logtabulator.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs one task per parameter on a bounded pool and blocks until all of them are done.
 * <p>
 * The first failing task fails the whole call: outstanding tasks are cancelled and the failure is rethrown
 * as a {@link PipelineException}. The caller's MDC is copied into the worker threads.
 */
@Slf4j
public class ParallelTaskExecutor {

    private static final long TERMINATION_TIMEOUT_SECONDS = 30;

    private final int maxThreads;

    public ParallelTaskExecutor(int maxThreads) {
        if (maxThreads <= 0) {
            throw new IllegalArgumentException("Max threads must be positive: " + maxThreads);
        }
        this.maxThreads = maxThreads;
    }

    public <P> void executeParallel(String stageName, Consumer<P> task, List<P> paramsList) {
        if (paramsList.isEmpty()) {
            log.debug("(parallel executor) Nothing to run for stage {}", stageName);
            return;
        }
        int poolSize = Math.min(maxThreads, paramsList.size());
        log.debug("(parallel executor) Running {} tasks of stage {} on {} threads", paramsList.size(), stageName, poolSize);

        ExecutorService pool = Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory(stageName + "-"));
        CompletionService<P> completion = new ExecutorCompletionService<>(pool);
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        List<Future<P>> futures = new ArrayList<>(paramsList.size());
        try {
            for (P params : paramsList) {
                futures.add(completion.submit(() -> {
                    runWithMdc(parentMdc, () -> task.accept(params));
                    return params;
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                Future<P> done = completion.take();
                try {
                    P params = done.get();
                    log.debug("(parallel executor) Task {}/{} of stage {} done: {}", i + 1, futures.size(), stageName, params);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    throw new PipelineException("Task of stage " + stageName + " failed: " + cause.getMessage(), cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while waiting for stage " + stageName, e);
        } finally {
            futures.forEach(future -> future.cancel(true));
            shutdown(pool, stageName);
        }
    }

    private static void runWithMdc(Map<String, String> mdc, Runnable command) {
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            command.run();
        } finally {
            MDC.clear();
        }
    }

    private static void shutdown(ExecutorService pool, String stageName) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("(parallel executor) Workers of stage {} did not stop within {}s", stageName,
                        TERMINATION_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
