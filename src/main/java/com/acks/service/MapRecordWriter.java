package com.acks.service;

import com.acks.exception.ConcurrencyConflictException;
import com.acks.model.DungeonMap;
import com.acks.model.MapRecord;
import com.acks.repository.MapRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Transactional access to the {@code maps} table. Each write replaces one row, so a map is
 * either fully at its old revision or fully at its new one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Transactional
public class MapRecordWriter {

    private final MapRecordRepository mapRecordRepository;
    private final MapCodec mapCodec;

    @Transactional(readOnly = true)
    public Optional<DungeonMap> read(String mapId) {
        return mapRecordRepository.findById(mapId)
                .map(record -> {
                    DungeonMap map = mapCodec.fromJson(record.getMapJson());
                    map.setRevision(record.getRevision());
                    return map;
                });
    }

    @Transactional(readOnly = true)
    public List<String> listIds() {
        return mapRecordRepository.findAllIds();
    }

    /**
     * Replace the stored map.
     *
     * @param expectedRevision revision the caller believes is stored, 0 for a map never stored
     * @throws ConcurrencyConflictException if the stored revision differs
     */
    public void write(DungeonMap map, long expectedRevision) {
        MapRecord record = mapRecordRepository.findById(map.getId()).orElse(null);
        long storedRevision = record == null ? 0 : record.getRevision();
        if (storedRevision != expectedRevision) {
            throw new ConcurrencyConflictException("Map " + map.getId() + " is at revision "
                    + storedRevision + ", expected " + expectedRevision);
        }
        if (record == null) {
            record = MapRecord.builder().id(map.getId()).build();
        }
        record.setName(map.getName());
        record.setRevision(map.getRevision());
        record.setMapJson(mapCodec.toJson(map));
        mapRecordRepository.saveAndFlush(record);
        log.debug("Wrote map {} at revision {}", map.getId(), map.getRevision());
    }

    public boolean delete(String mapId) {
        if (!mapRecordRepository.existsById(mapId)) {
            return false;
        }
        mapRecordRepository.deleteById(mapId);
        return true;
    }
}
