package org.swingcast.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.swingcast.common.SessionConfig;
import org.swingcast.common.SignalMessage;
import org.swingcast.session.media.IceCandidate;
import org.swingcast.session.media.MediaConnectionState;
import org.swingcast.session.media.MediaSession;
import org.swingcast.session.media.SessionDescription;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Offer/answer state machine for one side of the session.
 *
 * <p>Every public method only enqueues work on the {@link SessionExecutor}; all state lives on
 * that executor. Media session operations are asynchronous: while one is outstanding the
 * controller is "in flight" and a second attempt at a transition is dropped. Results and
 * media callbacks carry the epoch they were started in and are discarded once
 * {@link #reset()} has moved to a newer one.
 */
public final class NegotiationController {

    private static final Logger log = LoggerFactory.getLogger(NegotiationController.class);

    private final PeerRole role;
    private final MediaSession media;
    private final SignalSender signals;
    private final SessionExecutor executor;
    private final SessionListener listener;
    private final Duration restartCooldown;
    private final String requiredMediaMarker;
    private final PendingCandidateBuffer pending = new PendingCandidateBuffer();

    private volatile NegotiationState state = NegotiationState.IDLE;

    // executor-confined
    private int epoch;
    private boolean inFlight;
    private boolean remoteDescriptionSet;
    private boolean closed;
    private NegotiationState lastSettled = NegotiationState.IDLE;
    private SessionExecutor.ScheduledTask restartTask;

    public NegotiationController(PeerRole role, MediaSession media, SignalSender signals,
                                 SessionExecutor executor, SessionConfig config, SessionListener listener) {
        this.role = Objects.requireNonNull(role, "role");
        this.media = Objects.requireNonNull(media, "media");
        this.signals = Objects.requireNonNull(signals, "signals");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.listener = listener != null ? listener : SessionListener.NONE;
        this.restartCooldown = config.iceRestartCooldown();
        this.requiredMediaMarker = config.requiredMediaMarker();
        media.setObserver(new EpochObserver(0));
    }

    public PeerRole role() {
        return role;
    }

    public NegotiationState state() {
        return state;
    }

    /** Starts a fresh offer. Initiator only; a no-op unless the state is IDLE or STABLE. */
    public void createOffer() {
        executor.execute(() -> startOffer(false, "offer requested"));
    }

    public void onSignal(SignalMessage message) {
        switch (message.type()) {
            case OFFER -> onOfferReceived(message.sdp());
            case ANSWER -> onAnswerReceived(message.sdp());
            case CANDIDATE -> onCandidateReceived(IceCandidate.from(message));
        }
    }

    public void onOfferReceived(String sdp) {
        executor.execute(() -> handleOffer(sdp));
    }

    public void onAnswerReceived(String sdp) {
        executor.execute(() -> handleAnswer(sdp));
    }

    public void onCandidateReceived(IceCandidate candidate) {
        executor.execute(() -> handleRemoteCandidate(candidate));
    }

    public void onLocalCandidateGenerated(IceCandidate candidate) {
        executor.execute(() -> handleLocalCandidate(candidate));
    }

    public void onConnectionStateChanged(MediaConnectionState newState) {
        executor.execute(() -> handleConnectionState(newState));
    }

    public void onRenegotiationNeeded() {
        executor.execute(this::handleRenegotiationNeeded);
    }

    /**
     * Asks for a new negotiation round, e.g. after the capture pipeline was restarted.
     * From IDLE this is a plain offer; from STABLE or AWAITING_ANSWER it is an ICE-restart
     * offer. Ignored in every other state, on the responder and while no track is sendable.
     */
    public void requestRenegotiation(String reason) {
        executor.execute(() -> handleRenegotiationRequest(reason));
    }

    /** Tears down the current epoch: buffered candidates and a pending restart are discarded, state is IDLE. */
    public void reset() {
        executor.execute(this::doReset);
    }

    /** Resets, closes the media session and ignores every later call. */
    public void close() {
        executor.execute(() -> {
            if (closed) return;
            doReset();
            closed = true;
            media.close();
            log.info("negotiation closed");
        });
    }

    private void startOffer(boolean iceRestart, String reason) {
        if (closed) return;
        if (role != PeerRole.INITIATOR) {
            drop("responder does not create offers (" + reason + ")");
            return;
        }
        if (!mayOffer(iceRestart)) {
            drop("offer refused in state " + state + " (" + reason + ")");
            return;
        }
        if (!media.hasSendableTrack()) {
            awaitTrack(reason);
            return;
        }

        NegotiationState fallback = state.isSettled() ? state : lastSettled;
        int e = epoch;
        inFlight = true;
        setState(NegotiationState.LOCAL_OFFER_PENDING);
        log.info("creating {} ({})", iceRestart ? "ICE-restart offer" : "offer", reason);

        async(e, () -> media.createLocalOffer(iceRestart), (offer, err) -> {
            if (err != null) {
                offerFailed("create offer", err, fallback);
                return;
            }
            async(e, () -> media.setLocalDescription(offer), (ignored, err2) -> {
                if (err2 != null) {
                    offerFailed("apply local offer", err2, fallback);
                    return;
                }
                inFlight = false;
                send(SignalMessage.offer(offer.sdp()));
                setState(NegotiationState.AWAITING_ANSWER);
            });
        });
    }

    private boolean mayOffer(boolean iceRestart) {
        if (inFlight) return false;
        if (state.isSettled()) return true;
        // a restart may supersede an offer that was never answered
        return iceRestart && (state == NegotiationState.RENEGOTIATING
                || state == NegotiationState.FAILED
                || state == NegotiationState.AWAITING_ANSWER);
    }

    private void handleOffer(String sdp) {
        if (closed) return;
        if (role != PeerRole.RESPONDER) {
            drop("initiator ignores incoming offers");
            return;
        }
        if (sdp == null || !sdp.contains(requiredMediaMarker)) {
            drop("offer without " + requiredMediaMarker);
            return;
        }
        if (inFlight || !(state.isSettled() || state == NegotiationState.FAILED)) {
            drop("offer received in state " + state);
            return;
        }

        int e = epoch;
        inFlight = true;
        setState(NegotiationState.REMOTE_OFFER_RECEIVED);

        async(e, () -> media.setRemoteDescription(SessionDescription.offer(sdp)), (ignored, err) -> {
            if (err != null) {
                negotiationFailed("apply remote offer", err);
                return;
            }
            remoteDescriptionSet = true;
            drainPending(e);
            setState(NegotiationState.LOCAL_ANSWER_PENDING);

            async(e, media::createLocalAnswer, (answer, err2) -> {
                if (err2 != null) {
                    negotiationFailed("create answer", err2);
                    return;
                }
                async(e, () -> media.setLocalDescription(answer), (ignored2, err3) -> {
                    if (err3 != null) {
                        negotiationFailed("apply local answer", err3);
                        return;
                    }
                    inFlight = false;
                    send(SignalMessage.answer(answer.sdp()));
                    settle();
                });
            });
        });
    }

    private void handleAnswer(String sdp) {
        if (closed) return;
        if (state != NegotiationState.AWAITING_ANSWER || inFlight) {
            drop("answer received in state " + state);
            return;
        }
        int e = epoch;
        inFlight = true;
        async(e, () -> media.setRemoteDescription(SessionDescription.answer(sdp)), (ignored, err) -> {
            if (err != null) {
                negotiationFailed("apply remote answer", err);
                return;
            }
            remoteDescriptionSet = true;
            drainPending(e);
            inFlight = false;
            settle();
        });
    }

    private void handleRemoteCandidate(IceCandidate candidate) {
        if (closed) return;
        if (!remoteDescriptionSet) {
            pending.add(candidate);
            log.debug("buffered remote candidate ({} pending)", pending.size());
            return;
        }
        applyCandidate(epoch, candidate);
    }

    private void handleLocalCandidate(IceCandidate candidate) {
        if (closed) return;
        send(candidate.toMessage());
    }

    private void handleConnectionState(MediaConnectionState newState) {
        if (closed) return;
        log.info("media connection {}", newState);
        listener.onMediaConnectionStateChanged(newState);
        if (newState != MediaConnectionState.FAILED || role != PeerRole.INITIATOR) return;
        if (state == NegotiationState.STABLE) setState(NegotiationState.RENEGOTIATING);
        scheduleRestart();
    }

    private void handleRenegotiationNeeded() {
        if (closed || role != PeerRole.INITIATOR) return;
        if (state != NegotiationState.STABLE) {
            log.debug("renegotiation-needed ignored in state {}", state);
            return;
        }
        startOffer(false, "renegotiation needed");
    }

    private void handleRenegotiationRequest(String reason) {
        if (closed) return;
        if (role != PeerRole.INITIATOR) {
            drop("responder does not renegotiate (" + reason + ")");
            return;
        }
        // an unanswered offer is superseded, e.g. when the peer came back without answering
        if (inFlight || !(state.isSettled() || state == NegotiationState.AWAITING_ANSWER)) {
            drop("renegotiation refused in state " + state + " (" + reason + ")");
            return;
        }
        if (!media.hasSendableTrack()) {
            awaitTrack(reason);
            return;
        }
        listener.onRenegotiationRequested(reason);
        if (state == NegotiationState.IDLE) {
            startOffer(false, reason);
        } else {
            setState(NegotiationState.RENEGOTIATING);
            startOffer(true, reason);
        }
    }

    private void scheduleRestart() {
        if (closed || role != PeerRole.INITIATOR) return;
        if (restartTask != null) {
            log.debug("ICE restart already scheduled");
            return;
        }
        int e = epoch;
        restartTask = executor.schedule(() -> {
            if (e != epoch || closed) return;
            restartTask = null;
            startOffer(true, "ICE restart");
        }, restartCooldown);
        log.info("ICE restart in {} ms", restartCooldown.toMillis());
        listener.onRestartScheduled(restartCooldown);
    }

    private void doReset() {
        if (closed) return;
        epoch++;
        pending.clear();
        inFlight = false;
        remoteDescriptionSet = false;
        lastSettled = NegotiationState.IDLE;
        if (restartTask != null) {
            restartTask.cancel();
            restartTask = null;
        }
        setState(NegotiationState.IDLE);
        media.setObserver(new EpochObserver(epoch));
        log.info("negotiation reset, epoch {}", epoch);
    }

    /**
     * Nothing to offer yet. A restart that cannot proceed falls back to the last settled state,
     * so the next request (or the track monitor) can start over once a track is live.
     */
    private void awaitTrack(String reason) {
        if (state.isSettled()) {
            log.debug("no sendable track yet, not offering ({})", reason);
            return;
        }
        log.info("no sendable track, back to {} ({})", lastSettled, reason);
        setState(lastSettled);
    }

    private void drainPending(int e) {
        List<IceCandidate> early = pending.drain();
        if (!early.isEmpty()) log.debug("applying {} buffered candidate(s)", early.size());
        for (IceCandidate c : early) applyCandidate(e, c);
    }

    private void applyCandidate(int e, IceCandidate candidate) {
        async(e, () -> media.addIceCandidate(candidate), (ignored, err) -> {
            if (err != null) log.warn("remote candidate rejected: {}", describe(err));
        });
    }

    private void settle() {
        lastSettled = NegotiationState.STABLE;
        setState(NegotiationState.STABLE);
    }

    private void offerFailed(String what, Throwable err, NegotiationState fallback) {
        log.warn("{} failed, back to {}: {}", what, fallback, describe(err));
        inFlight = false;
        setState(fallback);
    }

    private void negotiationFailed(String what, Throwable err) {
        log.warn("{} failed: {}", what, describe(err));
        inFlight = false;
        setState(NegotiationState.FAILED);
        scheduleRestart();
    }

    private void send(SignalMessage message) {
        try {
            signals.send(message);
            listener.onMessageSent(message.type());
        } catch (RuntimeException e) {
            log.warn("sending {} failed", message.type().wireName(), e);
        }
    }

    private void drop(String reason) {
        log.info("dropped: {}", reason);
        listener.onMessageDropped(reason);
    }

    private void setState(NegotiationState to) {
        NegotiationState from = state;
        if (from == to) return;
        state = to;
        log.debug("{} -> {}", from, to);
        listener.onStateChanged(from, to);
    }

    /** Runs {@code op} and hands its outcome back to the executor, unless the epoch moved on meanwhile. */
    private <T> void async(int e, Supplier<CompletableFuture<T>> op, BiConsumer<T, Throwable> then) {
        CompletableFuture<T> f;
        try {
            f = Objects.requireNonNull(op.get(), "media session returned no future");
        } catch (RuntimeException ex) {
            f = CompletableFuture.failedFuture(ex);
        }
        f.whenComplete((value, err) -> executor.execute(() -> {
            if (e != epoch || closed) {
                log.debug("discarding result from epoch {} (now {})", e, epoch);
                return;
            }
            then.accept(value, unwrap(err));
        }));
    }

    private static Throwable unwrap(Throwable err) {
        if (err instanceof CompletionException && err.getCause() != null) return err.getCause();
        return err;
    }

    private static String describe(Throwable err) {
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }

    private final class EpochObserver implements MediaSession.Observer {
        private final int observerEpoch;

        EpochObserver(int observerEpoch) {
            this.observerEpoch = observerEpoch;
        }

        @Override
        public void onIceCandidateGenerated(IceCandidate candidate) {
            inEpoch(() -> handleLocalCandidate(candidate));
        }

        @Override
        public void onConnectionStateChanged(MediaConnectionState newState) {
            inEpoch(() -> handleConnectionState(newState));
        }

        @Override
        public void onRenegotiationNeeded() {
            inEpoch(NegotiationController.this::handleRenegotiationNeeded);
        }

        private void inEpoch(Runnable r) {
            executor.execute(() -> {
                if (observerEpoch != epoch) return;
                r.run();
            });
        }
    }
}
