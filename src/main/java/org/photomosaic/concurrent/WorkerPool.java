package org.photomosaic.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool running independent units of CPU-bound work up to a single barrier.
 * <p>
 * {@link #runAll(List)} never cancels siblings: every task runs to completion, then the
 * first failure is rethrown with the others attached as suppressed exceptions.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final ExecutorService executor;
    private final int threads;

    public WorkerPool(String name, int threads) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be non-empty");
        }
        this.threads = threads <= 0 ? defaultSize() : threads;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(this.threads, r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @return the available hardware parallelism (at least 1)
     */
    public static int defaultSize() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public int threads() {
        return threads;
    }

    /**
     * Runs every task and waits for all of them.
     *
     * @throws RuntimeException the first task failure, with later ones suppressed
     */
    public void runAll(List<? extends Runnable> tasks) {
        List<Future<?>> futures = new ArrayList<>(tasks.size());
        for (Runnable task : tasks) {
            futures.add(executor.submit(task));
        }

        Throwable first = null;
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    // keep waiting, partial results are never handed out
                    interrupted = true;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    if (first == null) {
                        first = cause;
                    } else {
                        first.addSuppressed(cause);
                    }
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        if (first != null) {
            logger.debug("{} of {} tasks failed", 1 + first.getSuppressed().length, tasks.size());
            if (first instanceof RuntimeException re) throw re;
            if (first instanceof Error err) throw err;
            throw new IllegalStateException("Worker failed", first);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
