package io.fetch4j.config;

import io.fetch4j.FetchScheduler;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the {@link FetchScheduler} once the context is refreshed and stops it on shutdown.
 *
 * <p>Runs in the last phase, so every other bean (the Mongo template included) is up before jobs are reloaded.
 * A failed start leaves the lifecycle not running.
 */
public class FetchLifecycle implements SmartLifecycle {
    private final FetchScheduler scheduler;
    private volatile boolean running = false;

    public FetchLifecycle(FetchScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            scheduler.stop();
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
