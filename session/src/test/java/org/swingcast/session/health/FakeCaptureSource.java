package org.swingcast.session.health;

final class FakeCaptureSource implements CaptureSource {
  int starts;
  int stops;
  boolean enabled = true;
  TrackReadyState readyState = TrackReadyState.LIVE;
  private Runnable onFrame = () -> { };

  @Override
  public void start() {
    starts++;
    readyState = TrackReadyState.LIVE;
  }

  @Override
  public void stop() {
    stops++;
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }

  @Override
  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  @Override
  public TrackReadyState readyState() {
    return readyState;
  }

  @Override
  public void setFrameListener(Runnable onFrame) {
    this.onFrame = onFrame;
  }

  void frame() {
    onFrame.run();
  }
}
