package com.example.cloudbeatsbackup.application.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs one task per item with bounded parallelism.
 *
 * <p>Failures stay with their item: any {@link Throwable} a task throws is recorded at that item's index and
 * the remaining items keep running. Once the cancel signal is raised no further item is started; items
 * already running are allowed to finish.
 */
@Component
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    static final String THREAD_PREFIX = "tag-reader-";

    @SuppressWarnings("unchecked")
    public <T, R> PoolResult<R> process(List<T> items, int concurrency, ItemTask<T, R> task,
                                        ProgressListener progress, BooleanSupplier cancelSignal) {
        int total = items.size();
        R[] results = (R[]) new Object[total];
        Throwable[] errors = new Throwable[total];
        boolean[] attempted = new boolean[total];
        if (total == 0) {
            return new PoolResult<>(results, errors, attempted, false);
        }

        int workers = Math.max(1, Math.min(concurrency, total));
        Semaphore slots = new Semaphore(workers);
        ExecutorService executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory(THREAD_PREFIX));
        Object progressLock = new Object();
        int[] completed = new int[1];
        List<Future<?>> futures = new ArrayList<>(total);
        boolean cancelled = false;
        boolean interrupted = false;

        try {
            for (int i = 0; i < total; i++) {
                if (cancelSignal.getAsBoolean()) {
                    cancelled = true;
                    break;
                }
                try {
                    slots.acquire();
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancelled = true;
                    break;
                }
                if (cancelSignal.getAsBoolean()) {
                    slots.release();
                    cancelled = true;
                    break;
                }

                final int index = i;
                final T item = items.get(i);
                attempted[index] = true;
                futures.add(executor.submit(() -> {
                    try {
                        results[index] = task.apply(item);
                    } catch (Throwable t) {
                        errors[index] = t;
                    } finally {
                        synchronized (progressLock) {
                            completed[0]++;
                            notifyProgress(progress, completed[0], total);
                        }
                        slots.release();
                    }
                }));
            }

            for (Future<?> future : futures) {
                interrupted |= awaitUninterruptibly(future);
            }
        } finally {
            executor.shutdown();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        if (cancelled) {
            log.info("WORKER_POOL_CANCELLED started={} total={}", futures.size(), total);
        }
        return new PoolResult<>(results, errors, attempted, cancelled);
    }

    private void notifyProgress(ProgressListener progress, int completed, int total) {
        if (progress == null) {
            return;
        }
        try {
            progress.onProgress(completed, total);
        } catch (RuntimeException e) {
            log.debug("Progress listener failed", e);
        }
    }

    /**
     * @return true if the calling thread was interrupted while waiting
     */
    private boolean awaitUninterruptibly(Future<?> future) {
        boolean interrupted = false;
        while (true) {
            try {
                future.get();
                return interrupted;
            } catch (InterruptedException e) {
                interrupted = true;
            } catch (ExecutionException e) {
                // Tasks record their own failures; this only surfaces errors thrown by the bookkeeping.
                log.warn("Worker task ended abnormally", e.getCause());
                return interrupted;
            }
        }
    }

    @FunctionalInterface
    public interface ItemTask<T, R> {

        R apply(T item) throws Exception;
    }

    @FunctionalInterface
    public interface ProgressListener {

        void onProgress(int completed, int total);
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
