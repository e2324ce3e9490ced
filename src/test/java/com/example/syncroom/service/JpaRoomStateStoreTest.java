package com.example.syncroom.service;

import com.example.syncroom.model.Member;
import com.example.syncroom.model.Role;
import com.example.syncroom.model.RoomItem;
import com.example.syncroom.model.RoomSnapshot;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.junit4.SpringRunner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

@RunWith(SpringRunner.class)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class JpaRoomStateStoreTest {

    @Autowired
    private JpaRoomStateStore store;

    private static RoomSnapshot snapshot(String roomId, double position, long at) {
        Map<String, Role> roles = new LinkedHashMap<>();
        roles.put("alice", Role.ADMIN);
        RoomItem item = new RoomItem("i1", "https://v.test/1", "one", false);
        List<RoomItem> queue = new ArrayList<>();
        queue.add(item);
        return new RoomSnapshot(roomId, true, position, at, item, queue, 0, roles,
                Collections.<Member>emptyList(), false, at);
    }

    private RoomSnapshot stored(String roomId) {
        for (RoomSnapshot s : store.loadAll()) {
            if (roomId.equals(s.getRoomId())) return s;
        }
        return null;
    }

    @Test
    public void savedRoomIsLoadedBack() {
        store.save(snapshot("jpa-roundtrip", 12.5, 1_000L));

        RoomSnapshot s = stored("jpa-roundtrip");

        assertNotNull(s);
        assertTrue(s.isPlaying());
        assertEquals(12.5, s.getPosition(), 1e-9);
        assertEquals("i1", s.getCurrentItem().getId());
        assertEquals(Role.ADMIN, s.getRoles().get("alice"));
    }

    @Test
    public void racingFirstSavesNeverThrow() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int round = 0; round < 20; round++) {
                String roomId = "jpa-race-" + round;
                CountDownLatch start = new CountDownLatch(1);
                List<Future<?>> saves = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    double position = i;
                    saves.add(pool.submit(() -> {
                        start.await();
                        store.save(snapshot(roomId, position, 2_000L));
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : saves) {
                    f.get(10, TimeUnit.SECONDS);
                }
                assertNotNull(stored(roomId));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void deleteOfMissingRoomIsQuiet() {
        store.delete("jpa-never-saved");

        assertNull(stored("jpa-never-saved"));
    }
}
