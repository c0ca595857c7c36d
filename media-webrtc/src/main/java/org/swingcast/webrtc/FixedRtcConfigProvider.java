package org.swingcast.webrtc;

import dev.onvoid.webrtc.RTCBundlePolicy;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCIceServer;
import dev.onvoid.webrtc.RTCIceTransportPolicy;
import org.swingcast.common.SessionConfig;

import java.util.List;

/** ICE configuration from a fixed list of STUN urls; no credentials. */
public class FixedRtcConfigProvider implements RtcConfigProvider {

    private final List<String> urls;
    private final RTCIceTransportPolicy policy;

    public FixedRtcConfigProvider(List<String> urls, RTCIceTransportPolicy policy) {
        this.urls = List.copyOf(urls);
        this.policy = policy;
    }

    public static FixedRtcConfigProvider from(SessionConfig config) {
        return new FixedRtcConfigProvider(config.iceServers(), RTCIceTransportPolicy.ALL);
    }

    @Override
    public RTCConfiguration get() {
        RTCConfiguration cfg = new RTCConfiguration();
        cfg.iceTransportPolicy = policy;
        cfg.bundlePolicy = RTCBundlePolicy.BALANCED;

        for (String url : urls) {
            RTCIceServer srv = new RTCIceServer();
            srv.urls.add(url);
            cfg.iceServers.add(srv);
        }
        return cfg;
    }
}
