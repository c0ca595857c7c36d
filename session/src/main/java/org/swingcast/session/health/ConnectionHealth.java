package org.swingcast.session.health;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Frame-delivery bookkeeping for the track monitor. Frames are recorded from the capture
 * thread; everything else is touched only by the monitor.
 */
public final class ConnectionHealth {

    private volatile long lastFrameMillis;
    private final AtomicLong frames = new AtomicLong();
    private int consecutiveStallCount;
    private long restartCooldownUntil;
    private boolean captureActive;

    void recordFrame(long nowMillis) {
        lastFrameMillis = nowMillis;
        frames.incrementAndGet();
    }

    void captureStarted(long nowMillis) {
        lastFrameMillis = nowMillis;
        captureActive = true;
    }

    void captureStopped() {
        captureActive = false;
    }

    void stallDetected() {
        consecutiveStallCount++;
    }

    void clearStalls() {
        consecutiveStallCount = 0;
    }

    void restarted(long nowMillis, long cooldownUntil) {
        lastFrameMillis = nowMillis;
        restartCooldownUntil = cooldownUntil;
    }

    public long lastFrameMillis() {
        return lastFrameMillis;
    }

    public long frameCount() {
        return frames.get();
    }

    public int consecutiveStallCount() {
        return consecutiveStallCount;
    }

    public long restartCooldownUntil() {
        return restartCooldownUntil;
    }

    public boolean captureActive() {
        return captureActive;
    }
}
