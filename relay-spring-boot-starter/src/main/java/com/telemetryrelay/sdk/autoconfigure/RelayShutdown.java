package com.telemetryrelay.sdk.autoconfigure;

import com.telemetryrelay.sdk.client.TelemetryRelay;
import org.springframework.context.SmartLifecycle;

/**
 * Stops the relay in the last lifecycle phase, after the web server has
 * stopped accepting records, so the memory tier is flushed to disk.
 */
final class RelayShutdown implements SmartLifecycle {
    private final TelemetryRelay telemetryRelay;
    private volatile boolean running = true;

    RelayShutdown(TelemetryRelay telemetryRelay) {
        this.telemetryRelay = telemetryRelay;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        if (running) {
            running = false;
            telemetryRelay.shutdown();
        }
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
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
