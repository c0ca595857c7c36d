package org.swingcast.session.health;

/**
 * The local capture pipeline feeding the outgoing track. The frame listener is called on the
 * capture thread once per delivered frame.
 */
public interface CaptureSource {

    void start();

    void stop();

    boolean isEnabled();

    void setEnabled(boolean enabled);

    TrackReadyState readyState();

    void setFrameListener(Runnable onFrame);
}
