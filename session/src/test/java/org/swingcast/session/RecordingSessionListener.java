package org.swingcast.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.swingcast.common.SignalMessage;

public final class RecordingSessionListener implements SessionListener {
  public final List<NegotiationState> states = new ArrayList<>();
  public final List<String> dropped = new ArrayList<>();
  public final List<Duration> restartsScheduled = new ArrayList<>();
  public final List<String> renegotiationRequests = new ArrayList<>();
  public final List<String> captureRestarts = new ArrayList<>();
  public final List<SignalMessage.Type> sent = new ArrayList<>();

  @Override
  public void onStateChanged(NegotiationState from, NegotiationState to) {
    states.add(to);
  }

  @Override
  public void onMessageSent(SignalMessage.Type type) {
    sent.add(type);
  }

  @Override
  public void onMessageDropped(String reason) {
    dropped.add(reason);
  }

  @Override
  public void onRestartScheduled(Duration delay) {
    restartsScheduled.add(delay);
  }

  @Override
  public void onRenegotiationRequested(String reason) {
    renegotiationRequests.add(reason);
  }

  @Override
  public void onCaptureRestarted(String reason) {
    captureRestarts.add(reason);
  }
}
