package com.example.cloudbeatsbackup.application.service;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs tag extraction progress at percentage milestones, with throughput and a rough ETA.
 * Callers must serialize {@link #onProgress(int, int)}; {@link WorkerPool} does.
 */
public class ExtractionProgressReporter implements WorkerPool.ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(ExtractionProgressReporter.class);

    private final long startTimeMs;
    private final int stepPct;
    private int lastMilestonePct;
    private int lastCompleted;

    public ExtractionProgressReporter(int stepPct) {
        this.startTimeMs = System.currentTimeMillis();
        this.stepPct = stepPct > 0 ? Math.min(stepPct, 100) : 10;
    }

    @Override
    public void onProgress(int completed, int total) {
        if (total <= 0 || completed <= lastCompleted) {
            return;
        }
        lastCompleted = completed;
        int pct = (int) (completed * 100L / total);
        log.debug("TAG_READ_PROGRESS {}/{}", completed, total);

        int currentBucket = pct / stepPct;
        if (currentBucket > lastMilestonePct / stepPct || completed == total) {
            long elapsed = System.currentTimeMillis() - startTimeMs;
            log.info("TAG_READ_MILESTONE {}% | files={}/{} speed={} ETA={} elapsed={}",
                    pct, completed, total, formatSpeed(completed, elapsed),
                    formatEta(completed, total, elapsed), formatElapsed(elapsed));
            lastMilestonePct = pct;
        }
    }

    public int getLastCompleted() {
        return lastCompleted;
    }

    private String formatSpeed(int completed, long elapsedMs) {
        if (elapsedMs <= 0) {
            return "N/A";
        }
        return String.format(Locale.ROOT, "%.1f files/s", completed * 1000.0 / elapsedMs);
    }

    private String formatEta(int completed, int total, long elapsedMs) {
        if (completed >= total) {
            return "0s";
        }
        if (completed <= 0 || elapsedMs <= 0) {
            return "N/A";
        }
        long remainingMs = (long) ((total - completed) * ((double) elapsedMs / completed));
        return formatElapsed(remainingMs);
    }

    static String formatElapsed(long elapsedMs) {
        if (elapsedMs < 1000) {
            return elapsedMs + "ms";
        }
        long seconds = elapsedMs / 1000;
        long minutes = seconds / 60;
        long remainSeconds = seconds % 60;
        if (minutes <= 0) {
            return seconds + "s";
        }
        long hours = minutes / 60;
        long remainMinutes = minutes % 60;
        if (hours <= 0) {
            return minutes + "m" + remainSeconds + "s";
        }
        return hours + "h" + remainMinutes + "m" + remainSeconds + "s";
    }
}
