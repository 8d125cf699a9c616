package com.di.plumeflux.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Propagates SLF4J MDC (the {@code unitKey} set by the orchestrator) to worker threads so that
 * calibration and flux logs carry the unit they belong to.
 * <p>
 * MDC is thread-local; without propagation, logs from the worker pool lose the unit key.
 * <ul>
 *   <li>Wrap one task: {@code executor.execute(MdcPropagation.wrapRunnable(() -> doWork()));}</li>
 *   <li>Or wrap the pool once: {@code ExecutorService workers = MdcPropagation.wrapExecutor(pool);}</li>
 *   <li>Run with a given key on the current thread: {@code MdcPropagation.runWithUnitKey(key, task);}</li>
 * </ul>
 */
public final class MdcPropagation {

    public static final String UNIT_KEY = "unitKey";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of the task
     * on whichever thread runs it, clearing it in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /** Runs {@code task} on the current thread with {@code unitKey} in MDC. */
    public static void runWithUnitKey(String unitKey, Runnable task) {
        runWithMdcContext(Map.of(UNIT_KEY, unitKey), task);
    }

    private static void runWithMdcContext(Map<String, String> contextMap, Runnable task) {
        setMdc(contextMap);
        try {
            task.run();
        } finally {
            clearMdc(contextMap);
        }
    }

    /**
     * Returns an executor that wraps every submitted task with MDC propagation from the submitting thread.
     */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /** Copy of the current thread's MDC; never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
