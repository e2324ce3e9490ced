package com.example.syncroom.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface RoomStateRepository extends JpaRepository<RoomStateEntity, String> {

    @Query("select r from RoomStateEntity r order by r.savedAtEpochMs desc")
    List<RoomStateEntity> findAllLatestFirst();
}
