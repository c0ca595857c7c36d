package org.swingcast.session.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.swingcast.common.SessionConfig;
import org.swingcast.session.FakeMediaSession;
import org.swingcast.session.ManualSessionExecutor;
import org.swingcast.session.NegotiationController;
import org.swingcast.session.NegotiationState;
import org.swingcast.session.PeerRole;
import org.swingcast.session.RecordingSessionListener;
import org.swingcast.session.RecordingSignalSender;

class TrackLifecycleMonitorTest {
  private static final Duration TICK = Duration.ofSeconds(5);

  private final ManualSessionExecutor executor = new ManualSessionExecutor();
  private final FakeMediaSession media = new FakeMediaSession();
  private final FakeCaptureSource capture = new FakeCaptureSource();
  private final RecordingSessionListener events = new RecordingSessionListener();
  private final SessionConfig config = config();

  @Test
  void stallRestartsCaptureOnceAndSecondStallDuringNegotiationIsDeferred() {
    NegotiationController controller = stableInitiator();
    media.holdOffers = true;
    TrackLifecycleMonitor monitor = monitor(controller);
    monitor.start();

    executor.advance(TICK);
    assertEquals(0, events.captureRestarts.size());

    executor.advance(TICK);
    assertEquals(1, events.captureRestarts.size());
    assertEquals(1, capture.stops);
    assertEquals(2, capture.starts);
    assertEquals(1, events.renegotiationRequests.size());
    assertEquals(NegotiationState.LOCAL_OFFER_PENDING, controller.state());

    executor.advance(TICK.multipliedBy(2));

    assertEquals(1, events.captureRestarts.size());
    assertEquals(2, capture.starts);
    assertEquals(1, events.renegotiationRequests.size());
    assertEquals(1, monitor.health().consecutiveStallCount());
  }

  @Test
  void flowingFramesNeverTriggerRestart() {
    TrackLifecycleMonitor monitor = monitor(stableInitiator());
    monitor.start();

    for (int i = 0; i < 30; i++) {
      capture.frame();
      executor.advance(Duration.ofSeconds(1));
    }

    assertTrue(events.captureRestarts.isEmpty());
    assertEquals(30, monitor.health().frameCount());
    assertEquals(1, capture.starts);
  }

  @Test
  void endedTrackIsRestartedButNotAgainWithinCooldown() {
    NegotiationController responder = new NegotiationController(PeerRole.RESPONDER, media,
        new RecordingSignalSender(), executor, config, events);
    TrackLifecycleMonitor monitor = monitor(responder);
    monitor.start();

    capture.frame();
    capture.readyState = TrackReadyState.ENDED;
    executor.advance(TICK);
    assertEquals(1, events.captureRestarts.size());

    capture.readyState = TrackReadyState.ENDED;
    executor.advance(TICK);
    assertEquals(1, events.captureRestarts.size());

    executor.advance(TICK);
    assertEquals(2, events.captureRestarts.size());
  }

  @Test
  void disabledTrackIsReEnabledUnlessUserDisabledIt() {
    TrackLifecycleMonitor monitor = monitor(stableInitiator());
    monitor.start();

    capture.enabled = false;
    capture.frame();
    executor.advance(TICK);
    assertTrue(capture.enabled);

    monitor.setUserEnabled(false);
    capture.frame();
    executor.advance(TICK);
    assertFalse(capture.enabled);
  }

  @Test
  void stopStopsCaptureAndChecks() {
    TrackLifecycleMonitor monitor = monitor(stableInitiator());
    monitor.start();
    assertThrows(IllegalStateException.class, monitor::start);

    monitor.stop();
    executor.advance(TICK.multipliedBy(4));

    assertEquals(1, capture.stops);
    assertTrue(events.captureRestarts.isEmpty());
    assertFalse(monitor.health().captureActive());
  }

  private TrackLifecycleMonitor monitor(NegotiationController controller) {
    return new TrackLifecycleMonitor(capture, controller, executor, executor.clock(), config, events);
  }

  private NegotiationController stableInitiator() {
    NegotiationController initiator = new NegotiationController(PeerRole.INITIATOR, media,
        new RecordingSignalSender(), executor, config, events);
    initiator.createOffer();
    executor.runPending();
    initiator.onAnswerReceived(FakeMediaSession.VIDEO_SDP);
    executor.runPending();
    assertEquals(NegotiationState.STABLE, initiator.state());
    return initiator;
  }

  private static SessionConfig config() {
    Properties p = new Properties();
    p.setProperty("swingcast.display-name", "monitor-test");
    return SessionConfig.fromProperties(p);
  }
}
