package org.swingcast.session;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.swingcast.session.media.IceCandidate;
import org.swingcast.session.media.MediaConnectionState;
import org.swingcast.session.media.MediaSession;
import org.swingcast.session.media.SessionDescription;

/** In-memory media session. Operations complete immediately unless told to hold or fail. */
public final class FakeMediaSession implements MediaSession {
  public static final String VIDEO_SDP = "v=0\r\nm=video 9 UDP/TLS/RTP/SAVPF 96\r\n";

  public final List<String> calls = new ArrayList<>();
  public final List<Boolean> offersCreated = new ArrayList<>();
  public final List<SessionDescription> localDescriptions = new ArrayList<>();
  public final List<SessionDescription> remoteDescriptions = new ArrayList<>();
  public final List<IceCandidate> addedCandidates = new ArrayList<>();
  public final List<CompletableFuture<SessionDescription>> heldOffers = new ArrayList<>();

  public boolean sendableTrack = true;
  public boolean holdOffers;
  public boolean failCreateOffer;
  public boolean failSetRemote;
  public boolean closed;

  private MediaSession.Observer observer;
  private int counter;

  @Override
  public CompletableFuture<SessionDescription> createLocalOffer(boolean iceRestart) {
    calls.add("createOffer");
    offersCreated.add(iceRestart);
    if (failCreateOffer) return CompletableFuture.failedFuture(new IllegalStateException("offer failed"));
    SessionDescription offer = SessionDescription.offer(VIDEO_SDP + "a=offer-" + (++counter) + "\r\n");
    if (holdOffers) {
      CompletableFuture<SessionDescription> held = new CompletableFuture<>();
      heldOffers.add(held);
      return held;
    }
    return CompletableFuture.completedFuture(offer);
  }

  @Override
  public CompletableFuture<SessionDescription> createLocalAnswer() {
    calls.add("createAnswer");
    return CompletableFuture.completedFuture(SessionDescription.answer(VIDEO_SDP + "a=answer-" + (++counter) + "\r\n"));
  }

  @Override
  public CompletableFuture<Void> setLocalDescription(SessionDescription description) {
    calls.add("setLocal:" + description.type());
    localDescriptions.add(description);
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
    calls.add("setRemote:" + description.type());
    if (failSetRemote) return CompletableFuture.failedFuture(new IllegalStateException("bad description"));
    remoteDescriptions.add(description);
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<Void> addIceCandidate(IceCandidate candidate) {
    calls.add("addCandidate:" + candidate.sdp());
    addedCandidates.add(candidate);
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public boolean hasSendableTrack() {
    return sendableTrack;
  }

  @Override
  public void setObserver(MediaSession.Observer observer) {
    this.observer = observer;
  }

  @Override
  public void close() {
    closed = true;
  }

  public MediaSession.Observer observer() {
    return observer;
  }

  public void emitCandidate(IceCandidate candidate) {
    observer.onIceCandidateGenerated(candidate);
  }

  public void emitConnectionState(MediaConnectionState state) {
    observer.onConnectionStateChanged(state);
  }

  public void emitRenegotiationNeeded() {
    observer.onRenegotiationNeeded();
  }
}
