package com.example.syncroom.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "syncroom")
public class SyncRoomProperties {

    /** Period of the ambient position broadcast per room. */
    private Duration heartbeatInterval = Duration.ofSeconds(5);

    /** How long an empty, non-permanent room survives. */
    private Duration roomTtl = Duration.ofMinutes(5);

    private Duration cleanupInterval = Duration.ofSeconds(60);

    /**
     * A play/pause that leaves the playing flag unchanged and lands within this distance of the
     * current position does not move the timeline anchor.
     */
    private double positionToleranceSeconds = 0.25;

    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

    public Duration getRoomTtl() { return roomTtl; }
    public void setRoomTtl(Duration roomTtl) { this.roomTtl = roomTtl; }

    public Duration getCleanupInterval() { return cleanupInterval; }
    public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }

    public double getPositionToleranceSeconds() { return positionToleranceSeconds; }
    public void setPositionToleranceSeconds(double positionToleranceSeconds) { this.positionToleranceSeconds = positionToleranceSeconds; }
}
