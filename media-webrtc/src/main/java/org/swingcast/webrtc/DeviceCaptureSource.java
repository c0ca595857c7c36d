package org.swingcast.webrtc;

import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.media.MediaDevices;
import dev.onvoid.webrtc.media.MediaStreamTrackState;
import dev.onvoid.webrtc.media.video.VideoCaptureCapability;
import dev.onvoid.webrtc.media.video.VideoDevice;
import dev.onvoid.webrtc.media.video.VideoDeviceSource;
import dev.onvoid.webrtc.media.video.VideoTrack;
import dev.onvoid.webrtc.media.video.VideoTrackSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.swingcast.session.health.CaptureSource;
import org.swingcast.session.health.TrackReadyState;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Camera capture through webrtc-java. Every {@link #start()} opens the device and creates a
 * fresh track, which is handed to {@code onTrack} so it can be attached to the peer connection.
 */
public final class DeviceCaptureSource implements CaptureSource {

    private static final Logger log = LoggerFactory.getLogger(DeviceCaptureSource.class);

    private final Supplier<PeerConnectionFactory> factory;
    private final String deviceName;
    private final VideoCaptureCapability capability;
    private final Consumer<VideoTrack> onTrack;
    private final VideoTrackSink sink = frame -> {
        notifyFrame();
        frame.release();
    };

    private volatile Runnable onFrame = () -> { };
    private VideoDeviceSource source;
    private VideoTrack track;
    private int generation;

    /**
     * @param deviceName camera name, or {@code null} for the first device found
     */
    public DeviceCaptureSource(Supplier<PeerConnectionFactory> factory, String deviceName,
                               VideoCaptureCapability capability, Consumer<VideoTrack> onTrack) {
        this.factory = factory;
        this.deviceName = deviceName;
        this.capability = capability;
        this.onTrack = onTrack;
    }

    @Override
    public synchronized void start() {
        if (source != null) throw new IllegalStateException("Capture already started");
        VideoDevice device = pickDevice();
        VideoDeviceSource s = new VideoDeviceSource();
        s.setVideoCaptureDevice(device);
        s.setVideoCaptureCapability(capability);
        s.start();
        source = s;

        // the previous track, if any, is disposed once the new one has replaced it
        VideoTrack t = factory.get().createVideoTrack("video" + (generation++), s);
        t.addSink(sink);
        track = t;
        log.info("capture started on {} ({}x{}@{})", device.getName(),
                capability.width, capability.height, capability.frameRate);
        onTrack.accept(t);
    }

    @Override
    public synchronized void stop() {
        if (track != null) track.removeSink(sink);
        if (source != null) {
            try {
                source.stop();
            } finally {
                source.dispose();
                source = null;
            }
            log.info("capture stopped");
        }
    }

    @Override
    public synchronized boolean isEnabled() {
        return track != null && track.isEnabled();
    }

    @Override
    public synchronized void setEnabled(boolean enabled) {
        if (track != null) track.setEnabled(enabled);
    }

    @Override
    public synchronized TrackReadyState readyState() {
        if (source == null || track == null || track.getState() == MediaStreamTrackState.ENDED) {
            return TrackReadyState.ENDED;
        }
        return TrackReadyState.LIVE;
    }

    @Override
    public void setFrameListener(Runnable onFrame) {
        this.onFrame = onFrame != null ? onFrame : () -> { };
    }

    private void notifyFrame() {
        onFrame.run();
    }

    private VideoDevice pickDevice() {
        List<VideoDevice> devices = MediaDevices.getVideoCaptureDevices();
        if (devices.isEmpty()) throw new IllegalStateException("No video capture device found");
        if (deviceName == null || deviceName.isBlank()) return devices.get(0);
        for (VideoDevice d : devices) {
            if (d.getName().equalsIgnoreCase(deviceName)) return d;
        }
        throw new IllegalStateException("Video capture device not found: " + deviceName);
    }
}
