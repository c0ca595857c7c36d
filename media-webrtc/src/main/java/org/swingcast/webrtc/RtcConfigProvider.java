package org.swingcast.webrtc;

import dev.onvoid.webrtc.RTCConfiguration;

public interface RtcConfigProvider {
    RTCConfiguration get();
}
