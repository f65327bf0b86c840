package com.agenthost.common.infra;

/**
 * Minimal delayed-task seam so timers can be driven deterministically in tests.
 */
public interface TaskScheduler {

    /**
     * Run {@code task} once after {@code delayMs}.
     */
    Cancellable schedule(Runnable task, long delayMs);

    /**
     * Run {@code task} every {@code periodMs}, first run after one period.
     */
    Cancellable scheduleAtFixedRate(Runnable task, long periodMs);

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
