package org.swingcast.session;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.swingcast.common.SignalCodec;
import org.swingcast.common.SignalFormatException;
import org.swingcast.common.SignalMessage;
import org.swingcast.session.media.IceCandidate;
import org.swingcast.session.media.SessionDescription;

class NegotiationRoundTripTest {

  private final ManualSessionExecutor executor = new ManualSessionExecutor();
  private final FakeMediaSession initiatorMedia = new FakeMediaSession();
  private final FakeMediaSession responderMedia = new FakeMediaSession();
  private final List<SignalMessage> wire = new ArrayList<>();
  private NegotiationController initiator;
  private NegotiationController responder;

  @Test
  void offerAndAnswerDriveBothSidesToStable() {
    wireUp();

    initiator.createOffer();
    executor.runPending();

    assertEquals(NegotiationState.STABLE, initiator.state());
    assertEquals(NegotiationState.STABLE, responder.state());
    assertEquals(initiatorMedia.localDescriptions.get(0).sdp(), responderMedia.remoteDescriptions.get(0).sdp());
    assertEquals(SessionDescription.Type.ANSWER, initiatorMedia.remoteDescriptions.get(0).type());
    assertEquals(responderMedia.localDescriptions.get(0).sdp(), initiatorMedia.remoteDescriptions.get(0).sdp());
    assertEquals(List.of(SignalMessage.Type.OFFER, SignalMessage.Type.ANSWER), types());
  }

  @Test
  void candidateSentBeforeTheOfferIsAppliedAfterIt() {
    wireUp();
    IceCandidate early = new IceCandidate("candidate:1 1 udp 2122260223 192.168.0.5 51000 typ host", "0", 0);

    initiatorMedia.emitCandidate(early);
    initiator.createOffer();
    executor.runPending();

    assertEquals(List.of(SignalMessage.Type.CANDIDATE, SignalMessage.Type.OFFER, SignalMessage.Type.ANSWER), types());
    assertEquals(List.of(early), responderMedia.addedCandidates);
    assertEquals(NegotiationState.STABLE, responder.state());
  }

  @Test
  void restartOfferIsAnsweredFromStable() {
    wireUp();
    initiator.createOffer();
    executor.runPending();

    initiator.requestRenegotiation("capture restarted");
    executor.runPending();

    assertEquals(NegotiationState.STABLE, initiator.state());
    assertEquals(NegotiationState.STABLE, responder.state());
    assertEquals(List.of(false, true), initiatorMedia.offersCreated);
    assertEquals(2, responderMedia.remoteDescriptions.size());
  }

  private void wireUp() {
    SessionListener none = SessionListener.NONE;
    initiator = new NegotiationController(PeerRole.INITIATOR, initiatorMedia,
        m -> deliver(m, () -> responder), executor, NegotiationControllerTest.config(), none);
    responder = new NegotiationController(PeerRole.RESPONDER, responderMedia,
        m -> deliver(m, () -> initiator), executor, NegotiationControllerTest.config(), none);
  }

  private void deliver(SignalMessage message, Supplier<NegotiationController> to) {
    wire.add(message);
    try {
      to.get().onSignal(SignalCodec.decode(SignalCodec.encode(message)));
    } catch (SignalFormatException e) {
      throw new AssertionError(e);
    }
  }

  private List<SignalMessage.Type> types() {
    List<SignalMessage.Type> out = new ArrayList<>();
    for (SignalMessage m : wire) out.add(m.type());
    return out;
  }
}
