package com.acks.repository;

import com.acks.model.MapRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for persisted maps.
 */
@Repository
public interface MapRecordRepository extends JpaRepository<MapRecord, String> {

    @Query("SELECT m.id FROM MapRecord m ORDER BY m.name")
    List<String> findAllIds();
}
