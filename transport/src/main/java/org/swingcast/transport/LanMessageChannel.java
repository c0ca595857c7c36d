package org.swingcast.transport;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.netty.handler.ssl.util.SelfSignedCertificate;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.swingcast.common.SessionConfig;
import org.swingcast.transport.discovery.DiscoveredPeer;
import org.swingcast.transport.discovery.DiscoveryRole;
import org.swingcast.transport.discovery.PeerDiscovery;

import javax.net.ssl.SSLException;
import java.net.InetSocketAddress;
import java.security.cert.CertificateException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MessageChannel} over a TCP connection on the local network.
 *
 * <p>The announcing side listens and advertises its port through {@link PeerDiscovery};
 * the scanning side dials the first peer discovery reports and dials again whenever the
 * connection is lost. Both sides open with a HELLO frame carrying their display name; a
 * connection counts as {@link ConnectionState#CONNECTED} once that frame arrives.
 *
 * <p>The first peer to connect becomes canonical and is the only target of
 * {@link #send(byte[])}. Later peers are accepted and reported to the listener but never
 * written to. When the canonical peer drops, sends are buffered until a peer with the
 * same name comes back. A new connection from the canonical peer's name replaces the old
 * one, which covers a peer that returns before its half-open connection timed out.
 *
 * <p>Idle connections exchange PING frames; a connection that stays silent for three
 * keepalive intervals is closed.
 */
public final class LanMessageChannel implements MessageChannel {

    private static final Logger log = LoggerFactory.getLogger(LanMessageChannel.class);
    private static final AttributeKey<PeerId> PEER = AttributeKey.valueOf("swingcast.peer");
    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final int MISSED_KEEPALIVES = 3;

    private static final Listener NO_LISTENER = new Listener() {
        @Override
        public void onConnectionStateChanged(PeerId peer, ConnectionState state) {
        }

        @Override
        public void onMessageReceived(PeerId peer, byte[] payload) {
        }
    };

    private final SessionConfig config;
    private final PeerDiscovery discovery;
    private final Outbox outbox = new Outbox();
    private final Object sendLock = new Object();
    private final Set<Channel> openChannels = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean connectInFlight = new AtomicBoolean(false);
    private final AtomicLong failedSends = new AtomicLong();

    private volatile Listener listener = NO_LISTENER;
    private volatile DiscoveryRole role;
    private volatile int boundPort = -1;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel server;
    private Bootstrap client;

    // guarded by sendLock
    private PeerId canonicalPeer;
    private Channel canonicalChannel;

    public LanMessageChannel(SessionConfig config, PeerDiscovery discovery) {
        this.config = Objects.requireNonNull(config, "config");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener != null ? listener : NO_LISTENER;
    }

    @Override
    public synchronized void start(DiscoveryRole role) {
        if (!started.compareAndSet(false, true)) throw new IllegalStateException("Channel already started");
        this.role = Objects.requireNonNull(role, "role");
        worker = new MultiThreadIoEventLoopGroup(NioIoHandler.newFactory());
        try {
            if (role == DiscoveryRole.ANNOUNCING) startServer();
            else startClient();
        } catch (RuntimeException e) {
            shutdownGroups();
            started.set(false);
            throw e;
        }
        log.info("channel started as {} (peer name {}, encrypted={})", role, config.displayName(), config.encrypted());
    }

    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) return;
        discovery.stop();
        for (Channel ch : openChannels) ch.close();
        if (server != null) server.close().syncUninterruptibly();
        shutdownGroups();
        synchronized (sendLock) {
            canonicalChannel = null;
        }
        server = null;
        client = null;
        log.info("channel stopped, {} message(s) left in outbox", outbox.size());
    }

    @Override
    public void send(byte[] payload) {
        if (payload == null) {
            log.warn("ignoring null payload");
            return;
        }
        synchronized (sendLock) {
            Channel ch = canonicalChannel;
            if (ch != null && ch.isActive()) {
                write(ch, payload);
                return;
            }
            outbox.enqueue(payload);
        }
        log.debug("not connected, buffered message (outbox size {})", outbox.size());
    }

    @Override
    public boolean isConnected() {
        synchronized (sendLock) {
            return canonicalChannel != null && canonicalChannel.isActive();
        }
    }

    @Override
    public int pendingCount() {
        return outbox.size();
    }

    @Override
    public long failedSendCount() {
        return failedSends.get();
    }

    public PeerId canonicalPeer() {
        synchronized (sendLock) {
            return canonicalPeer;
        }
    }

    /** Listening port on the announcing side, {@code -1} otherwise. */
    public int boundPort() {
        return boundPort;
    }

    private void startServer() {
        SslContext ssl = config.encrypted() ? serverSsl() : null;
        boss = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (ssl != null) ch.pipeline().addLast("tls", ssl.newHandler(ch.alloc()));
                        initPipeline(ch);
                    }
                });
        try {
            server = b.bind(config.channelPort()).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while binding port " + config.channelPort(), e);
        } catch (Exception e) {
            throw new TransportException("Failed to bind port " + config.channelPort() + ": " + e.getMessage(), e);
        }
        boundPort = ((InetSocketAddress) server.localAddress()).getPort();
        discovery.startAnnouncing(boundPort);
        log.info("listening on port {}", boundPort);
    }

    private void startClient() {
        SslContext ssl = config.encrypted() ? clientSsl() : null;
        client = new Bootstrap()
                .group(worker)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (ssl != null) ch.pipeline().addLast("tls", ssl.newHandler(ch.alloc()));
                        initPipeline(ch);
                    }
                });
        discovery.startScanning(this::onPeerDiscovered);
    }

    private void initPipeline(SocketChannel ch) {
        ChannelPipeline p = ch.pipeline();
        long keepalive = config.keepaliveInterval().toMillis();
        p.addLast("idle", new IdleStateHandler(keepalive * MISSED_KEEPALIVES, keepalive, 0, TimeUnit.MILLISECONDS));
        p.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(config.maxFrameBytes(), 0, 4, 0, 4));
        p.addLast("framePrepender", new LengthFieldPrepender(4));
        p.addLast("frameCodec", new FrameCodec());
        p.addLast("peer", new PeerHandler());
        openChannels.add(ch);
    }

    private void onPeerDiscovered(DiscoveredPeer found) {
        Bootstrap b = client;
        if (!started.get() || b == null) return;
        synchronized (sendLock) {
            if (canonicalChannel != null) return;
        }
        if (!connectInFlight.compareAndSet(false, true)) return;

        PeerId target = new PeerId(found.label());
        log.info("found {} at {}:{}, connecting", found.label(), found.host(), found.port());
        listener.onConnectionStateChanged(target, ConnectionState.CONNECTING);
        try {
            b.connect(found.host(), found.port()).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    connectInFlight.set(false);
                    log.warn("connect to {} failed, waiting for next discovery: {}", found.label(),
                            f.cause() != null ? f.cause().getMessage() : "unknown");
                    listener.onConnectionStateChanged(target, ConnectionState.NOT_CONNECTED);
                }
            });
        } catch (RejectedExecutionException e) {
            connectInFlight.set(false);
            log.debug("connect skipped, channel shutting down");
        }
    }

    private void onHello(Channel ch, String name) {
        if (name == null || name.isBlank()) {
            log.warn("HELLO without peer name from {}, closing", ch.remoteAddress());
            ch.close();
            return;
        }
        if (ch.attr(PEER).get() != null) {
            log.debug("duplicate HELLO from {}", ch.attr(PEER).get());
            return;
        }
        PeerId peer = new PeerId(name);
        ch.attr(PEER).set(peer);

        boolean canonical;
        PeerId current;
        Channel replaced = null;
        int flushed = 0;
        synchronized (sendLock) {
            canonical = canonicalPeer == null || canonicalPeer.equals(peer);
            if (canonical) {
                if (canonicalChannel != null && canonicalChannel != ch) replaced = canonicalChannel;
                canonicalPeer = peer;
                canonicalChannel = ch;
                flushed = outbox.drainTo(payload -> write(ch, payload));
            }
            current = canonicalPeer;
        }

        if (replaced != null) {
            log.info("peer {} reconnected from {}, dropping its previous connection", peer, ch.remoteAddress());
            listener.onConnectionStateChanged(peer, ConnectionState.NOT_CONNECTED);
            replaced.close();
        }

        if (role == DiscoveryRole.SCANNING) {
            connectInFlight.set(false);
            if (!canonical) {
                log.warn("dialed {} but {} is the canonical peer, disconnecting", peer, current);
                ch.close();
                return;
            }
        }

        if (canonical) {
            log.info("peer {} connected, flushed {} buffered message(s)", peer, flushed);
        } else {
            log.warn("additional peer {} connected, {} stays canonical", peer, current);
        }
        listener.onConnectionStateChanged(peer, ConnectionState.CONNECTED);
    }

    private void onDisconnected(Channel ch) {
        openChannels.remove(ch);
        if (role == DiscoveryRole.SCANNING) connectInFlight.set(false);
        PeerId peer = ch.attr(PEER).get();
        if (peer == null) return;

        boolean wasCanonical;
        PeerId current;
        synchronized (sendLock) {
            wasCanonical = ch == canonicalChannel;
            if (wasCanonical) canonicalChannel = null;
            current = canonicalPeer;
        }
        if (!wasCanonical && peer.equals(current)) return;

        if (wasCanonical) log.info("peer {} disconnected, buffering until it returns", peer);
        else log.info("additional peer {} disconnected", peer);
        listener.onConnectionStateChanged(peer, ConnectionState.NOT_CONNECTED);
    }

    private void write(Channel ch, byte[] payload) {
        try {
            ch.eventLoop().execute(() -> ch.writeAndFlush(ChannelFrame.message(payload)).addListener(f -> {
                if (!f.isSuccess()) {
                    long n = failedSends.incrementAndGet();
                    log.warn("send failed ({} so far): {}", n, f.cause() != null ? f.cause().getMessage() : "unknown");
                }
            }));
        } catch (RejectedExecutionException e) {
            long n = failedSends.incrementAndGet();
            log.warn("send failed ({} so far): event loop shut down", n);
        }
    }

    private void shutdownGroups() {
        if (boss != null) boss.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        if (worker != null) worker.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        boss = null;
        worker = null;
    }

    private static SslContext serverSsl() {
        try {
            SelfSignedCertificate cert = new SelfSignedCertificate();
            return SslContextBuilder.forServer(cert.certificate(), cert.privateKey()).build();
        } catch (CertificateException | SSLException e) {
            throw new TransportException("Failed to set up TLS: " + e.getMessage(), e);
        }
    }

    private static SslContext clientSsl() {
        try {
            // peers are not authenticated, the certificate only keys the encryption
            return SslContextBuilder.forClient().trustManager(InsecureTrustManagerFactory.INSTANCE).build();
        } catch (SSLException e) {
            throw new TransportException("Failed to set up TLS: " + e.getMessage(), e);
        }
    }

    private final class PeerHandler extends SimpleChannelInboundHandler<ChannelFrame> {

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            ctx.writeAndFlush(ChannelFrame.hello(config.displayName()));
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ChannelFrame frame) {
            switch (frame.cmd) {
                case HELLO -> onHello(ctx.channel(), frame.peer);
                case MESSAGE -> {
                    PeerId peer = ctx.channel().attr(PEER).get();
                    if (peer == null) {
                        log.warn("message before HELLO from {}, dropped", ctx.channel().remoteAddress());
                        return;
                    }
                    listener.onMessageReceived(peer, frame.payload != null ? frame.payload : new byte[0]);
                }
                case PING -> log.trace("ping from {}", ctx.channel().remoteAddress());
            }
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) {
            if (!(evt instanceof IdleStateEvent)) {
                ctx.fireUserEventTriggered(evt);
                return;
            }
            IdleState idle = ((IdleStateEvent) evt).state();
            if (idle == IdleState.WRITER_IDLE) {
                ctx.writeAndFlush(ChannelFrame.ping());
            } else if (idle == IdleState.READER_IDLE) {
                log.warn("connection {} silent for {} keepalive intervals, closing",
                        ctx.channel().remoteAddress(), MISSED_KEEPALIVES);
                ctx.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            onDisconnected(ctx.channel());
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.warn("connection {} error: {}", ctx.channel().remoteAddress(), cause.getMessage());
            ctx.close();
        }
    }
}
