package org.swingcast.receiver;

import dev.onvoid.webrtc.media.MediaStreamTrack;
import dev.onvoid.webrtc.media.video.VideoTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.swingcast.common.SessionConfig;
import org.swingcast.session.NegotiationController;
import org.swingcast.session.NegotiationState;
import org.swingcast.session.PeerRole;
import org.swingcast.session.PeerSession;
import org.swingcast.session.SessionListener;
import org.swingcast.session.SingleThreadSessionExecutor;
import org.swingcast.session.media.MediaConnectionState;
import org.swingcast.transport.LanMessageChannel;
import org.swingcast.transport.discovery.DiscoveryRole;
import org.swingcast.transport.discovery.PeerDiscovery;
import org.swingcast.webrtc.FixedRtcConfigProvider;
import org.swingcast.webrtc.WebRtcMediaSession;

import java.util.Scanner;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Viewer side: scans for a sender, answers its offers and counts the video frames that
 * arrive. A small console reports status and can reset the negotiation.
 */
public class ReceiverApp {

    private static final Logger log = LoggerFactory.getLogger(ReceiverApp.class);

    private final SessionConfig config;
    private final SingleThreadSessionExecutor executor = new SingleThreadSessionExecutor("receiver-session");
    private final AtomicLong remoteFrames = new AtomicLong();
    private final LanMessageChannel channel;
    private final WebRtcMediaSession media;
    private final NegotiationController controller;
    private final PeerSession session;

    ReceiverApp(SessionConfig config) {
        this.config = config;
        this.channel = new LanMessageChannel(config, PeerDiscovery.forConfig(config));
        this.media = new WebRtcMediaSession(FixedRtcConfigProvider.from(config));
        SessionListener events = consoleEvents();
        this.controller = new NegotiationController(PeerRole.RESPONDER, media, PeerSession.sender(channel),
                executor, config, events);
        this.session = new PeerSession(controller, events);
    }

    public static void main(String[] args) {
        ReceiverApp app = new ReceiverApp(SessionConfig.load());
        try {
            app.start();
        } catch (RuntimeException e) {
            log.error("startup failed", e);
            System.out.println("[Receiver] fatal error: " + e.getMessage());
            System.exit(1);
        }

        System.out.println("Receiver CLI. Type 'help' for commands.");
        Scanner sc = new Scanner(System.in);
        while (true) {
            System.out.print("> ");
            String line = sc.hasNextLine() ? sc.nextLine().trim() : null;
            if (line == null) break;
            if (line.isEmpty()) continue;
            if (!app.handleCommand(line)) break;
        }

        app.stop();
        System.out.println("[Receiver] stopped");
    }

    void start() {
        media.setRemoteTrackListener(this::onRemoteTrack);
        media.start();
        channel.setListener(session);
        channel.start(DiscoveryRole.SCANNING);
        System.out.println("[Receiver] " + config.displayName() + " looking for " + config.serviceType() + " peers");
    }

    void stop() {
        session.close();
        executor.shutdown();
        channel.stop();
    }

    private boolean handleCommand(String line) {
        switch (line) {
            case "help" -> printHelp();
            case "status" -> printStatus();
            case "reset" -> {
                controller.reset();
                System.out.println("Negotiation reset, waiting for a new offer.");
            }
            case "quit", "exit" -> {
                System.out.println("Bye.");
                return false;
            }
            default -> System.out.println("Unknown command. Type 'help'.");
        }
        return true;
    }

    private static void printHelp() {
        System.out.println("""
                Commands:
                  status               - show peer, negotiation and frame counters
                  reset                - drop the current negotiation and wait for a new offer
                  quit/exit            - exit receiver
                """);
    }

    private void printStatus() {
        System.out.printf("  peer:        %s (%s)%n",
                session.canonicalPeer() != null ? session.canonicalPeer() : "-", session.connectionState());
        System.out.printf("  negotiation: %s%n", controller.state());
        System.out.printf("  outbox:      %d pending, %d failed sends%n", channel.pendingCount(), channel.failedSendCount());
        System.out.printf("  frames:      %d received%n", remoteFrames.get());
    }

    private void onRemoteTrack(MediaStreamTrack track) {
        if (!(track instanceof VideoTrack)) return;
        VideoTrack video = (VideoTrack) track;
        if (!video.isEnabled()) video.setEnabled(true);
        video.addSink(frame -> {
            long n = remoteFrames.incrementAndGet();
            if (n == 1) {
                System.out.printf("[Receiver] first frame %dx%d%n", frame.buffer.getWidth(), frame.buffer.getHeight());
            }
            frame.release();
        });
    }

    private static SessionListener consoleEvents() {
        return new SessionListener() {
            @Override
            public void onStateChanged(NegotiationState from, NegotiationState to) {
                if (to == NegotiationState.STABLE || to == NegotiationState.FAILED) {
                    System.out.println("[Receiver] negotiation " + to);
                }
            }

            @Override
            public void onMediaConnectionStateChanged(MediaConnectionState state) {
                System.out.println("[Receiver] media " + state);
            }
        };
    }
}
