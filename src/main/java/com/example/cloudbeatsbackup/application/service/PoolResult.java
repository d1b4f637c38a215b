package com.example.cloudbeatsbackup.application.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link WorkerPool#process}. Index {@code i} of every list refers to input item {@code i}.
 */
public class PoolResult<R> {

    private final List<R> results;
    private final List<Throwable> errors;
    private final List<Boolean> attempted;
    private final boolean cancelled;

    PoolResult(R[] results, Throwable[] errors, boolean[] attempted, boolean cancelled) {
        List<Boolean> attemptedList = new ArrayList<>(attempted.length);
        for (boolean value : attempted) {
            attemptedList.add(value);
        }
        this.results = Collections.unmodifiableList(Arrays.asList(results));
        this.errors = Collections.unmodifiableList(Arrays.asList(errors));
        this.attempted = Collections.unmodifiableList(attemptedList);
        this.cancelled = cancelled;
    }

    public int size() {
        return results.size();
    }

    /**
     * Null for items that failed or were never started.
     */
    public List<R> getResults() {
        return results;
    }

    public List<Throwable> getErrors() {
        return errors;
    }

    public boolean isAttempted(int index) {
        return attempted.get(index);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public int attemptedCount() {
        int count = 0;
        for (Boolean value : attempted) {
            if (value) {
                count++;
            }
        }
        return count;
    }

    public int failedCount() {
        int count = 0;
        for (Throwable error : errors) {
            if (error != null) {
                count++;
            }
        }
        return count;
    }
}
