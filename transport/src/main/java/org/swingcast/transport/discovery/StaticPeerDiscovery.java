package org.swingcast.transport.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Discovery for networks without broadcast: the peer address is configured
 * ({@code swingcast.peer.address}) and reported to the scanner on every tick.
 */
public final class StaticPeerDiscovery implements PeerDiscovery {

    private static final Logger log = LoggerFactory.getLogger(StaticPeerDiscovery.class);

    private final String host;
    private final int port;
    private final Duration interval;
    private ScheduledExecutorService scheduler;

    public StaticPeerDiscovery(String host, int port, Duration interval) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    @Override
    public void startAnnouncing(int channelPort) {
        log.info("static discovery: waiting for {} to dial port {}", host, channelPort);
    }

    @Override
    public synchronized void startScanning(Consumer<DiscoveredPeer> onFound) {
        if (scheduler != null) throw new IllegalStateException("Discovery already running");
        DiscoveredPeer peer = new DiscoveredPeer(null, host, port);
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "discovery-static");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                onFound.accept(peer);
            } catch (RuntimeException e) {
                log.warn("peer callback failed for {}", peer.label(), e);
            }
        }, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("static discovery: dialing {}:{}", host, port);
    }

    @Override
    public synchronized void stop() {
        if (scheduler == null) return;
        scheduler.shutdownNow();
        scheduler = null;
    }
}
