package com.example.cloudbeatsbackup.common.util;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single cancellation signal for a run. Remote calls register an abort action for the request in flight;
 * backoff sleeps wake up as soon as the run is cancelled; the worker pool polls it before each submission.
 */
@Component
public class RunCancellation implements BooleanSupplier {

    private static final Logger log = LoggerFactory.getLogger(RunCancellation.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Set<Runnable> abortActions = new CopyOnWriteArraySet<>();

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        log.info("RUN_CANCEL_REQUESTED inFlightCalls={}", abortActions.size());
        for (Runnable action : abortActions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.debug("Abort action failed", e);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    @Override
    public boolean getAsBoolean() {
        return isCancelled();
    }

    /**
     * Registers an action run on cancellation. Runs it immediately when the run is already cancelled.
     * Close the returned handle once the guarded operation is over.
     */
    public Registration onCancel(Runnable action) {
        abortActions.add(action);
        if (isCancelled()) {
            action.run();
        }
        return () -> abortActions.remove(action);
    }

    /**
     * Sleeps for the given duration unless the run gets cancelled first.
     *
     * @return true if the full duration elapsed, false if the run was cancelled or the thread interrupted
     */
    public boolean sleep(Duration duration) {
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
