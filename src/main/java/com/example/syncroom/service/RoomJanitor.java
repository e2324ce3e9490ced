package com.example.syncroom.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RoomJanitor {
    private static final Logger log = LoggerFactory.getLogger(RoomJanitor.class);

    private final RoomClockCoordinator coordinator;

    public RoomJanitor(RoomClockCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(fixedDelayString = "${syncroom.cleanup-interval:PT60S}",
            initialDelayString = "${syncroom.cleanup-interval:PT60S}")
    public void sweep() {
        try {
            int evicted = coordinator.evictStaleRooms();
            if (evicted > 0) log.info("janitor sweep done. evicted={}", evicted);
        } catch (Exception e) {
            log.warn("janitor sweep failed: {}", e.toString());
        }
    }
}
