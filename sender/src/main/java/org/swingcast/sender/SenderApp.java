package org.swingcast.sender;

import dev.onvoid.webrtc.media.video.VideoCaptureCapability;
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
import org.swingcast.session.health.TrackLifecycleMonitor;
import org.swingcast.session.media.MediaConnectionState;
import org.swingcast.transport.LanMessageChannel;
import org.swingcast.transport.discovery.DiscoveryRole;
import org.swingcast.transport.discovery.PeerDiscovery;
import org.swingcast.webrtc.DeviceCaptureSource;
import org.swingcast.webrtc.FixedRtcConfigProvider;
import org.swingcast.webrtc.WebRtcMediaSession;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Camera side: announces itself on the LAN, captures video and drives negotiation as the
 * initiator. Runs until the JVM is asked to exit.
 */
public class SenderApp {

    private static final Logger log = LoggerFactory.getLogger(SenderApp.class);
    private static final VideoCaptureCapability CAPTURE = new VideoCaptureCapability(1280, 720, 30);

    public static void main(String[] args) {
        SessionConfig config = SessionConfig.load();
        System.out.println("[Sender] peer name " + config.displayName() + ", service " + config.serviceType());

        SingleThreadSessionExecutor executor = new SingleThreadSessionExecutor("sender-session");
        LanMessageChannel channel = new LanMessageChannel(config, PeerDiscovery.forConfig(config));
        WebRtcMediaSession media = new WebRtcMediaSession(FixedRtcConfigProvider.from(config));
        media.start();

        SessionListener events = consoleEvents();
        NegotiationController controller = new NegotiationController(PeerRole.INITIATOR, media,
                PeerSession.sender(channel), executor, config, events);
        PeerSession session = new PeerSession(controller, events);
        channel.setListener(session);

        AtomicBoolean firstTrack = new AtomicBoolean(true);
        DeviceCaptureSource capture = new DeviceCaptureSource(media::factory, System.getProperty("swingcast.capture.device"),
                CAPTURE, track -> onTrack(track, media, controller, firstTrack));
        TrackLifecycleMonitor monitor = new TrackLifecycleMonitor(capture, controller, executor,
                Clock.systemUTC(), config, events);

        CountDownLatch stopped = new CountDownLatch(1);
        installShutdownHook(stopped, monitor, session, channel, executor);

        try {
            channel.start(DiscoveryRole.ANNOUNCING);
            monitor.start();
        } catch (RuntimeException e) {
            log.error("startup failed", e);
            System.out.println("[Sender] fatal error: " + e.getMessage());
            System.exit(1);
        }

        System.out.println("[Sender] streaming on port " + channel.boundPort() + ". Press Ctrl+C to exit");
        try {
            stopped.await();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        System.out.println("[Sender] stopped");
    }

    // the first live track triggers the initial offer; later tracks replace it in place
    private static void onTrack(VideoTrack track, WebRtcMediaSession media, NegotiationController controller,
                                AtomicBoolean firstTrack) {
        media.attachTrack(track);
        if (firstTrack.compareAndSet(true, false)) controller.createOffer();
    }

    private static SessionListener consoleEvents() {
        return new SessionListener() {
            @Override
            public void onStateChanged(NegotiationState from, NegotiationState to) {
                if (to == NegotiationState.STABLE || to == NegotiationState.FAILED) {
                    System.out.println("[Sender] negotiation " + to);
                }
            }

            @Override
            public void onMediaConnectionStateChanged(MediaConnectionState state) {
                System.out.println("[Sender] media " + state);
            }

            @Override
            public void onCaptureRestarted(String reason) {
                System.out.println("[Sender] capture restarted: " + reason);
            }
        };
    }

    private static void installShutdownHook(CountDownLatch stopped, TrackLifecycleMonitor monitor, PeerSession session,
                                            LanMessageChannel channel, SingleThreadSessionExecutor executor) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            monitor.stop();
            session.close();
            executor.shutdown();
            channel.stop();
            stopped.countDown();
        }, "sender-shutdown"));
    }
}
