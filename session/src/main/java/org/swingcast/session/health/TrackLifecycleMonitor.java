package org.swingcast.session.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.swingcast.common.SessionConfig;
import org.swingcast.session.NegotiationController;
import org.swingcast.session.NegotiationState;
import org.swingcast.session.SessionExecutor;
import org.swingcast.session.SessionListener;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Watchdog over the capture pipeline. On every tick it checks when the last frame arrived,
 * whether the track ended and whether it was disabled behind the user's back.
 *
 * <p>A stall restarts capture and asks the controller to renegotiate, but only while the
 * controller is IDLE or STABLE; otherwise the stall is left for the next tick. After a
 * restart no further restart happens for one stall threshold.
 */
public final class TrackLifecycleMonitor {

    private static final Logger log = LoggerFactory.getLogger(TrackLifecycleMonitor.class);
    private static final long FRAME_LOG_EVERY = 30;

    private final CaptureSource capture;
    private final NegotiationController controller;
    private final SessionExecutor executor;
    private final Clock clock;
    private final SessionListener listener;
    private final Duration interval;
    private final long stallThresholdMillis;
    private final ConnectionHealth health = new ConnectionHealth();

    private volatile boolean userEnabled = true;
    private SessionExecutor.ScheduledTask tick;

    public TrackLifecycleMonitor(CaptureSource capture, NegotiationController controller, SessionExecutor executor,
                                 Clock clock, SessionConfig config, SessionListener listener) {
        this.capture = Objects.requireNonNull(capture, "capture");
        this.controller = Objects.requireNonNull(controller, "controller");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener != null ? listener : SessionListener.NONE;
        this.interval = config.healthCheckInterval();
        this.stallThresholdMillis = config.stallThreshold().toMillis();
    }

    /** Starts capture on the calling thread, then schedules the periodic check. */
    public synchronized void start() {
        if (tick != null) throw new IllegalStateException("Monitor already started");
        capture.setFrameListener(this::onFrame);
        capture.start();
        health.captureStarted(clock.millis());
        tick = executor.scheduleAtFixedRate(this::checkHealth, interval, interval);
        log.info("track monitor started (every {} ms, stall after {} ms)", interval.toMillis(), stallThresholdMillis);
    }

    public synchronized void stop() {
        if (tick == null) return;
        tick.cancel();
        tick = null;
        executor.execute(() -> {
            health.captureStopped();
            capture.stop();
        });
        log.info("track monitor stopped after {} frame(s)", health.frameCount());
    }

    /** Records the user's choice; the monitor only re-enables a track the user left enabled. */
    public void setUserEnabled(boolean enabled) {
        userEnabled = enabled;
        executor.execute(() -> capture.setEnabled(enabled));
    }

    public ConnectionHealth health() {
        return health;
    }

    private void onFrame() {
        health.recordFrame(clock.millis());
        long n = health.frameCount();
        if (n % FRAME_LOG_EVERY == 0) log.trace("{} frames captured", n);
    }

    void checkHealth() {
        if (!health.captureActive()) return;
        long now = clock.millis();
        long sinceFrame = now - health.lastFrameMillis();
        boolean ended = capture.readyState() == TrackReadyState.ENDED;

        if (ended || sinceFrame > stallThresholdMillis) {
            String reason = ended ? "track ended" : "no frames for " + sinceFrame + " ms";
            health.stallDetected();
            NegotiationState negotiation = controller.state();
            if (!negotiation.isSettled()) {
                log.info("stall ({}) deferred, negotiation is {}", reason, negotiation);
                return;
            }
            if (now < health.restartCooldownUntil()) {
                log.debug("stall ({}) within restart cooldown", reason);
                return;
            }
            restartCapture(reason, now);
            return;
        }

        health.clearStalls();
        if (userEnabled && !capture.isEnabled()) {
            log.warn("track disabled without user action, re-enabling");
            capture.setEnabled(true);
        }
    }

    private void restartCapture(String reason, long now) {
        log.warn("capture stalled ({}), restarting (stall #{})", reason, health.consecutiveStallCount());
        health.restarted(now, now + stallThresholdMillis);
        try {
            capture.stop();
            capture.start();
        } catch (RuntimeException e) {
            log.error("capture restart failed, next attempt after cooldown", e);
            return;
        }
        listener.onCaptureRestarted(reason);
        controller.requestRenegotiation("capture restarted: " + reason);
    }
}
