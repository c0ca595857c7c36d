package org.swingcast.session.health;

public enum TrackReadyState {
    LIVE,
    ENDED
}
