package org.swingcast.transport.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.swingcast.common.SessionConfig;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * LAN discovery by UDP broadcast. The announcing side broadcasts an {@link Announcement}
 * every {@code discovery.interval-ms}; the scanning side listens on the discovery port and
 * reports every announcement for the configured service type that is not its own.
 *
 * <p>Socket errors are logged and retried after {@code channel.retry-delay-ms}.
 */
public final class UdpPeerDiscovery implements PeerDiscovery {

    private static final Logger log = LoggerFactory.getLogger(UdpPeerDiscovery.class);
    private static final int BUFFER_SIZE = 1024;
    private static final int RECEIVE_TIMEOUT_MS = 500;

    private final SessionConfig config;

    private volatile boolean running;
    private volatile DatagramSocket socket;
    private ScheduledExecutorService scheduler;
    private Thread listenerThread;

    public UdpPeerDiscovery(SessionConfig config) {
        this.config = config;
    }

    @Override
    public synchronized void startAnnouncing(int channelPort) {
        ensureNotRunning();
        running = true;
        byte[] payload = new Announcement(config.serviceType(), config.displayName(), channelPort).toBytes();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "discovery-announcer");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> announce(payload), 0,
                config.announceInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("announcing {} as {} (channel port {}) on udp/{}", config.serviceType(), config.displayName(),
                channelPort, config.discoveryPort());
    }

    @Override
    public synchronized void startScanning(Consumer<DiscoveredPeer> onFound) {
        ensureNotRunning();
        running = true;
        listenerThread = new Thread(() -> listen(onFound), "discovery-listener");
        listenerThread.setDaemon(true);
        listenerThread.start();
        log.info("scanning for {} on udp/{}", config.serviceType(), config.discoveryPort());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;
        if (scheduler != null) scheduler.shutdownNow();
        closeSocket();
        if (listenerThread != null) {
            try {
                listenerThread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        scheduler = null;
        listenerThread = null;
        log.info("discovery stopped");
    }

    private void announce(byte[] payload) {
        if (!running) return;
        try {
            DatagramSocket s = socket;
            if (s == null || s.isClosed()) {
                s = new DatagramSocket();
                s.setBroadcast(true);
                socket = s;
            }
            InetAddress target = InetAddress.getByName(config.broadcastAddress());
            s.send(new DatagramPacket(payload, payload.length, target, config.discoveryPort()));
            log.trace("announcement sent to {}:{}", config.broadcastAddress(), config.discoveryPort());
        } catch (IOException e) {
            // next tick retries with a fresh socket
            log.warn("announcement failed: {}", e.getMessage());
            closeSocket();
        }
    }

    private void listen(Consumer<DiscoveredPeer> onFound) {
        byte[] buffer = new byte[BUFFER_SIZE];
        while (running) {
            try {
                DatagramSocket s = socket;
                if (s == null || s.isClosed()) {
                    s = openListenSocket();
                    socket = s;
                }
                DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
                s.receive(packet);
                handle(packet, onFound);
            } catch (SocketTimeoutException e) {
                // receive timeout, check running and keep listening
            } catch (IOException e) {
                if (!running) break;
                log.warn("discovery socket error, retrying in {} ms: {}", config.retryDelay().toMillis(), e.getMessage());
                closeSocket();
                if (!sleep(config.retryDelay().toMillis())) break;
            }
        }
    }

    private void handle(DatagramPacket packet, Consumer<DiscoveredPeer> onFound) {
        Optional<Announcement> parsed = Announcement.parse(packet.getData(), packet.getOffset(), packet.getLength());
        if (parsed.isEmpty()) {
            log.debug("ignoring malformed datagram from {}", packet.getAddress());
            return;
        }
        Announcement a = parsed.get();
        if (!config.serviceType().equals(a.service()) || config.displayName().equals(a.peer())) return;
        String host = packet.getAddress().getHostAddress();
        log.debug("announcement from {} at {}:{}", a.peer(), host, a.port());
        try {
            onFound.accept(new DiscoveredPeer(a.peer(), host, a.port()));
        } catch (RuntimeException e) {
            log.warn("peer callback failed for {}", a.peer(), e);
        }
    }

    private DatagramSocket openListenSocket() throws IOException {
        DatagramSocket s = new DatagramSocket(null);
        s.setReuseAddress(true);
        s.setBroadcast(true);
        s.setSoTimeout(RECEIVE_TIMEOUT_MS);
        s.bind(new InetSocketAddress(config.discoveryPort()));
        return s;
    }

    private void closeSocket() {
        DatagramSocket s = socket;
        socket = null;
        if (s != null && !s.isClosed()) s.close();
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void ensureNotRunning() {
        if (running) throw new IllegalStateException("Discovery already running");
    }
}
