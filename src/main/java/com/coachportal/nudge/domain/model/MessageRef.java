package com.coachportal.nudge.domain.model;

import java.util.Objects;

/**
 * Identity of a posted chat message: the channel it lives in and the
 * platform timestamp that names it inside that channel.
 */
public record MessageRef(String channelId, String ts) {
    public MessageRef {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(ts, "ts");
    }
}
