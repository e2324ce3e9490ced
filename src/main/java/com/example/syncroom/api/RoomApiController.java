package com.example.syncroom.api;

import com.example.syncroom.model.RoomSnapshot;
import com.example.syncroom.model.RoomSummary;
import com.example.syncroom.service.RoomClockCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/rooms")
public class RoomApiController {

    private final RoomClockCoordinator coordinator;

    public RoomApiController(RoomClockCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Rooms that have someone connected or something queued.
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<RoomSummary> list() {
        return coordinator.activeRooms();
    }

    /**
     * Current state of one room, position extrapolated to the time of the request.
     */
    @GetMapping(value = "/{roomId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public RoomSnapshot get(@PathVariable String roomId) {
        RoomSnapshot snapshot = coordinator.snapshot(roomId);
        if (snapshot == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "room not found: " + roomId);
        }
        return snapshot;
    }
}
