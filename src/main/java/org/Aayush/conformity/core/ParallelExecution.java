package org.Aayush.conformity.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fork/join of independent conformity tasks on a bounded, call-scoped pool.
 *
 * <p>Tasks never share mutable state; {@link ExecutorService#invokeAll} is the only barrier.
 * Results keep task order.</p>
 */
final class ParallelExecution {

    private ParallelExecution() {
    }

    /**
     * Runs tasks and returns their results in task order.
     *
     * @param tasks independent tasks.
     * @param parallelism requested workers; {@code <= 1} runs on the calling thread.
     * @param threadPrefix worker thread name prefix.
     * @throws RuntimeException the first task failure as thrown by the task, checked failures
     * wrapped as {@code DC_EXECUTION_FAILED}, or {@code DC_INTERRUPTED}.
     */
    static <T> List<T> invokeAll(List<? extends Callable<T>> tasks, int parallelism, String threadPrefix) {
        if (parallelism <= 1 || tasks.size() <= 1) {
            return runSequential(tasks);
        }
        int workers = Math.min(parallelism, tasks.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, namedDaemonThreads(threadPrefix));
        try {
            List<Future<T>> futures = executor.invokeAll(tasks);
            List<T> results = new ArrayList<>(futures.size());
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw ConformityException.execution(
                    ConformityCore.REASON_INTERRUPTED,
                    "interrupted while waiting for " + threadPrefix + " workers",
                    ex
            );
        } catch (ExecutionException ex) {
            throw unwrap(ex.getCause(), threadPrefix);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Fails fast when the calling thread was asked to stop.
     */
    static void checkInterrupted(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw ConformityException.execution(
                    ConformityCore.REASON_INTERRUPTED,
                    "interrupted during " + stage
            );
        }
    }

    private static <T> List<T> runSequential(List<? extends Callable<T>> tasks) {
        List<T> results = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            try {
                results.add(task.call());
            } catch (RuntimeException ex) {
                throw ex;
            } catch (Exception ex) {
                throw ConformityException.execution(
                        ConformityCore.REASON_EXECUTION_FAILED,
                        "conformity task failed: " + ex.getMessage(),
                        ex
                );
            }
        }
        return results;
    }

    private static RuntimeException unwrap(Throwable cause, String threadPrefix) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return ConformityException.execution(
                ConformityCore.REASON_EXECUTION_FAILED,
                threadPrefix + " worker failed: " + (cause == null ? "unknown cause" : cause.getMessage()),
                cause
        );
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
