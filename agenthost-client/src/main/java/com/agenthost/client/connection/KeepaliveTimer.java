package com.agenthost.client.connection;

import com.agenthost.common.infra.TaskScheduler;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically runs a ping action while started.
 */
@Slf4j
class KeepaliveTimer {

    private final TaskScheduler scheduler;
    private final long intervalMs;
    private final Runnable pingAction;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile TaskScheduler.Cancellable scheduledTask;

    KeepaliveTimer(TaskScheduler scheduler, long intervalMs, Runnable pingAction) {
        this.scheduler = scheduler;
        this.intervalMs = Math.max(1000, intervalMs);
        this.pingAction = pingAction;
    }

    void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Keepalive already running");
            return;
        }
        scheduledTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs);
    }

    void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        TaskScheduler.Cancellable task = scheduledTask;
        if (task != null) {
            task.cancel();
        }
        scheduledTask = null;
    }

    boolean isRunning() {
        return running.get();
    }

    long getIntervalMs() {
        return intervalMs;
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        try {
            pingAction.run();
        } catch (Exception e) {
            log.warn("Keepalive ping failed: {}", e.getMessage());
        }
    }
}
