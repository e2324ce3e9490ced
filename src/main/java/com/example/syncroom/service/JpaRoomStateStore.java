package com.example.syncroom.service;

import com.example.syncroom.model.Member;
import com.example.syncroom.model.Role;
import com.example.syncroom.model.RoomItem;
import com.example.syncroom.model.RoomSnapshot;
import com.example.syncroom.persistence.RoomStateEntity;
import com.example.syncroom.persistence.RoomStateRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Service
public class JpaRoomStateStore implements RoomStateStore {
    private static final Logger log = LoggerFactory.getLogger(JpaRoomStateStore.class);

    private final RoomStateRepository repository;
    private final ObjectMapper om = new ObjectMapper();

    public JpaRoomStateStore(RoomStateRepository repository) {
        this.repository = repository;
    }

    /** Flushed inside the call so a constraint violation is caught here, not at commit. */
    @Override
    public void save(RoomSnapshot s) {
        try {
            Map<String, String> roles = new LinkedHashMap<>();
            for (Map.Entry<String, Role> e : s.getRoles().entrySet()) {
                roles.put(e.getKey(), e.getValue().getWireName());
            }
            repository.saveAndFlush(new RoomStateEntity(
                    s.getRoomId(),
                    s.isPlaying(),
                    s.getPosition(),
                    s.getPlayingIndex(),
                    s.getCurrentItem() == null ? null : om.writeValueAsString(s.getCurrentItem()),
                    om.writeValueAsString(s.getQueue()),
                    om.writeValueAsString(roles),
                    s.isPermanent(),
                    s.getTakenAtEpochMs()
            ));
        } catch (Exception e) {
            log.warn("room state save failed. roomId={} cause={}", s.getRoomId(), e.toString());
        }
    }

    @Override
    public void delete(String roomId) {
        try {
            if (repository.existsById(roomId)) repository.deleteById(roomId);
        } catch (Exception e) {
            log.warn("room state delete failed. roomId={} cause={}", roomId, e.toString());
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<RoomSnapshot> loadAll() {
        List<RoomSnapshot> out = new ArrayList<>();
        List<RoomStateEntity> rows;
        try {
            rows = repository.findAllLatestFirst();
        } catch (Exception e) {
            log.warn("room state load failed: {}", e.toString());
            return out;
        }
        for (RoomStateEntity e : rows) {
            try {
                out.add(toSnapshot(e));
            } catch (Exception ex) {
                log.warn("skipping unreadable room state. roomId={} cause={}", e.getRoomId(), ex.toString());
            }
        }
        return out;
    }

    private RoomSnapshot toSnapshot(RoomStateEntity e) throws Exception {
        RoomItem current = e.getCurrentItemJson() == null ? null : om.readValue(e.getCurrentItemJson(), RoomItem.class);
        List<RoomItem> queue = e.getQueueJson() == null
                ? new ArrayList<>()
                : om.readValue(e.getQueueJson(), new TypeReference<List<RoomItem>>() {});
        Map<String, String> rawRoles = e.getRolesJson() == null
                ? new LinkedHashMap<>()
                : om.readValue(e.getRolesJson(), new TypeReference<LinkedHashMap<String, String>>() {});
        Map<String, Role> roles = new LinkedHashMap<>();
        for (Map.Entry<String, String> r : rawRoles.entrySet()) {
            Role role = Role.fromWire(r.getValue());
            if (role != null) roles.put(r.getKey(), role);
        }
        return new RoomSnapshot(e.getRoomId(), e.isPlaying(), e.getPosition(), e.getSavedAtEpochMs(),
                current, queue, e.getPlayingIndex(), roles, Collections.<Member>emptyList(),
                e.isPermanent(), e.getSavedAtEpochMs());
    }
}
