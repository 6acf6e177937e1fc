package com.acks.service;

import com.acks.exception.CampaignException;
import com.acks.exception.ConcurrencyConflictException;
import com.acks.exception.NotFoundException;
import com.acks.exception.PersistenceFailureException;
import com.acks.exception.ValidationException;
import com.acks.model.DungeonMap;
import com.acks.model.FightRef;
import com.acks.model.Room;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Registry of the maps currently held in memory, backed by {@link MapRecordWriter}.
 *
 * <p>Maps are loaded on first use and stay loaded until {@link #unloadMap(String)} or shutdown.
 * Each map id gets one registry entry with its own read/write lock, created before the map is
 * read from storage; loading, saving and every other change (including its database write)
 * happen under that entry's write lock, so the entry can never fall behind the stored row. One
 * map never waits on another. Live {@link Room} objects are never modified once published;
 * a change always swaps in a new room, which lets fight commits detect a concurrent edit by
 * identity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoomGraphStore {

    private final MapRecordWriter mapRecordWriter;
    private final MapCodec mapCodec;

    private final ConcurrentHashMap<String, LoadedMap> loadedMaps = new ConcurrentHashMap<>();

    /**
     * A room as it was when checked out, plus a private working copy to mutate.
     */
    public record RoomCheckout(String mapId, long revision, Room base, Room working) {
    }

    /** Registry entry; {@link #map} stays null until the first load or save under the write lock. */
    static final class LoadedMap {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        volatile DungeonMap map;
        long persistedRevision;

        boolean isLoaded() {
            return map != null;
        }

        boolean isDirty() {
            return map != null && map.getRevision() != persistedRevision;
        }
    }

    public DungeonMap loadMap(String mapId) {
        return read(mapId, mapCodec::copy);
    }

    public List<String> listMapIds() {
        Set<String> ids = new TreeSet<>(mapRecordWriter.listIds());
        loadedMaps.forEach((id, loaded) -> {
            if (loaded.isLoaded()) {
                ids.add(id);
            }
        });
        return new ArrayList<>(ids);
    }

    public boolean exists(String mapId) {
        LoadedMap loaded = loadedMaps.get(mapId);
        return (loaded != null && loaded.isLoaded()) || mapRecordWriter.read(mapId).isPresent();
    }

    public Room getRoom(String mapId, String roomId) {
        return read(mapId, map -> mapCodec.copy(map.requireRoom(roomId)));
    }

    /**
     * Apply {@code reader} to the live map under its read lock. The function must not keep or
     * modify what it is given.
     */
    public <T> T read(String mapId, Function<DungeonMap, T> reader) {
        LoadedMap loaded = acquire(mapId);
        loaded.lock.readLock().lock();
        try {
            return reader.apply(loaded.map);
        } finally {
            loaded.lock.readLock().unlock();
        }
    }

    /**
     * Atomically replace a whole map.
     *
     * @param map the new content; its revision must equal the stored one (0 for a new map)
     * @return a copy of the map as stored, at its new revision
     */
    public DungeonMap saveMap(DungeonMap map) {
        validateMap(map);
        DungeonMap incoming = mapCodec.copy(map);
        String mapId = incoming.getId();
        while (true) {
            LoadedMap loaded = loadedMaps.computeIfAbsent(mapId, id -> new LoadedMap());
            loaded.lock.writeLock().lock();
            try {
                if (loadedMaps.get(mapId) != loaded) {
                    continue;
                }
                boolean wasLoaded = loaded.isLoaded();
                long current;
                long persisted;
                if (wasLoaded) {
                    current = loaded.map.getRevision();
                    persisted = loaded.persistedRevision;
                } else {
                    current = mapRecordWriter.read(mapId).map(DungeonMap::getRevision).orElse(0L);
                    persisted = current;
                }
                try {
                    requireRevision(mapId, current, map.getRevision());
                    incoming.setRevision(current + 1);
                    persist(incoming, persisted);
                } catch (CampaignException e) {
                    if (!wasLoaded && !loaded.isLoaded()) {
                        loadedMaps.remove(mapId, loaded);
                    }
                    throw e;
                }
                loaded.map = incoming;
                loaded.persistedRevision = incoming.getRevision();
                log.info("Saved map {} at revision {}", mapId, incoming.getRevision());
                return mapCodec.copy(incoming);
            } finally {
                loaded.lock.writeLock().unlock();
            }
        }
    }

    /**
     * Store a new, empty map.
     */
    public DungeonMap createMap(String mapId, String name, String summary) {
        FightRef.requireValidId("map", mapId);
        if (exists(mapId)) {
            throw new ConcurrencyConflictException("Map already exists: " + mapId);
        }
        return saveMap(DungeonMap.builder().id(mapId).name(name).summary(summary).build());
    }

    public void deleteMap(String mapId) {
        LoadedMap loaded = loadedMaps.computeIfAbsent(mapId, id -> new LoadedMap());
        loaded.lock.writeLock().lock();
        try {
            loadedMaps.remove(mapId, loaded);
            boolean deleted;
            try {
                deleted = mapRecordWriter.delete(mapId);
            } catch (RuntimeException e) {
                throw new PersistenceFailureException("Could not delete map " + mapId, e);
            }
            if (!deleted && !loaded.isLoaded()) {
                throw NotFoundException.of("Map", mapId);
            }
            log.info("Deleted map {}", mapId);
        } finally {
            loaded.lock.writeLock().unlock();
        }
    }

    /**
     * Insert or replace a room. The room's embedded fight is replaced too.
     *
     * @param expectedRevision the map revision the edit was based on
     */
    public DungeonMap putRoom(String mapId, Room room, long expectedRevision) {
        FightRef.requireValidId("room", room.getId());
        Room copy = mapCodec.copy(room);
        return write(mapId, expectedRevision, map -> map.putRoom(copy));
    }

    public DungeonMap deleteRoom(String mapId, String roomId, long expectedRevision) {
        return write(mapId, expectedRevision, map -> {
            map.requireRoom(roomId);
            map.getRooms().remove(roomId);
            for (Room other : List.copyOf(map.getRooms().values())) {
                if (other.getConnections().containsKey(roomId)) {
                    Room edited = mapCodec.copy(other);
                    edited.getConnections().remove(roomId);
                    map.putRoom(edited);
                }
            }
        });
    }

    /**
     * Mark a room as discovered by the given characters. Discovery is frequent and cheap to
     * lose, so it is written by the next flush rather than immediately.
     *
     * @return the new map revision, or the current one if nothing changed
     */
    public long revealRoom(String mapId, String roomId, Collection<String> characterIds) {
        LoadedMap loaded = acquire(mapId);
        loaded.lock.writeLock().lock();
        try {
            Room live = loaded.map.requireRoom(roomId);
            if (live.getDiscoveredBy().containsAll(characterIds)) {
                return loaded.map.getRevision();
            }
            Room revealed = mapCodec.copy(live);
            revealed.getDiscoveredBy().addAll(characterIds);
            loaded.map.putRoom(revealed);
            loaded.map.setRevision(loaded.map.getRevision() + 1);
            log.debug("Room {}/{} revealed to {}", mapId, roomId, characterIds);
            return loaded.map.getRevision();
        } finally {
            loaded.lock.writeLock().unlock();
        }
    }

    /**
     * Take a room out for modification. Pair with {@link #commitRoom(RoomCheckout)}.
     */
    public RoomCheckout checkout(String mapId, String roomId) {
        return read(mapId, map -> {
            Room live = map.requireRoom(roomId);
            return new RoomCheckout(mapId, map.getRevision(), live, mapCodec.copy(live));
        });
    }

    /**
     * Swap a checked-out room's working copy in and persist the map. Fails without change when
     * the room was replaced since the checkout, or when the write fails.
     *
     * @return the new map revision
     */
    public long commitRoom(RoomCheckout checkout) {
        LoadedMap loaded = acquire(checkout.mapId());
        loaded.lock.writeLock().lock();
        try {
            DungeonMap map = loaded.map;
            String roomId = checkout.base().getId();
            if (map.getRooms().get(roomId) != checkout.base()) {
                throw new ConcurrencyConflictException("Room " + checkout.mapId() + "/" + roomId
                        + " was changed by another edit");
            }
            Room committed = mapCodec.copy(checkout.working());
            long previousRevision = map.getRevision();
            map.putRoom(committed);
            map.setRevision(previousRevision + 1);
            try {
                persist(map, loaded.persistedRevision);
            } catch (CampaignException e) {
                map.putRoom(checkout.base());
                map.setRevision(previousRevision);
                throw e;
            }
            loaded.persistedRevision = map.getRevision();
            return map.getRevision();
        } finally {
            loaded.lock.writeLock().unlock();
        }
    }

    @Scheduled(fixedDelayString = "${campaign.maps.flush-interval-ms:30000}")
    public void flushDirty() {
        for (LoadedMap loaded : loadedMaps.values()) {
            flush(loaded);
        }
    }

    public void unloadMap(String mapId) {
        LoadedMap loaded = loadedMaps.get(mapId);
        if (loaded != null && loaded.isLoaded()) {
            flush(loaded);
            loadedMaps.remove(mapId, loaded);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Flushing {} loaded map(s) before shutdown", loadedMaps.size());
        flushDirty();
        loadedMaps.clear();
    }

    private boolean flush(LoadedMap loaded) {
        loaded.lock.writeLock().lock();
        try {
            if (!loaded.isDirty()) {
                return true;
            }
            persist(loaded.map, loaded.persistedRevision);
            loaded.persistedRevision = loaded.map.getRevision();
            log.debug("Flushed map {} at revision {}", loaded.map.getId(), loaded.persistedRevision);
            return true;
        } catch (CampaignException e) {
            log.error("Could not flush map {}: {}", loaded.map.getId(), e.getMessage(), e);
            return false;
        } finally {
            loaded.lock.writeLock().unlock();
        }
    }

    private DungeonMap write(String mapId, long expectedRevision, Consumer<DungeonMap> edit) {
        LoadedMap loaded = acquire(mapId);
        loaded.lock.writeLock().lock();
        try {
            requireRevision(mapId, loaded.map.getRevision(), expectedRevision);
            DungeonMap edited = shallowCopy(loaded.map);
            edit.accept(edited);
            edited.setRevision(loaded.map.getRevision() + 1);
            persist(edited, loaded.persistedRevision);
            loaded.map = edited;
            loaded.persistedRevision = edited.getRevision();
            return mapCodec.copy(edited);
        } finally {
            loaded.lock.writeLock().unlock();
        }
    }

    private void persist(DungeonMap map, long expectedStoredRevision) {
        try {
            mapRecordWriter.write(map, expectedStoredRevision);
        } catch (CampaignException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Persisting map {} failed", map.getId(), e);
            throw new PersistenceFailureException("Could not persist map " + map.getId(), e);
        }
    }

    /**
     * The registry entry of a map, loading it under the entry's write lock if needed. An entry
     * dropped from the registry while waiting for its lock is abandoned and the lookup retried.
     */
    private LoadedMap acquire(String mapId) {
        while (true) {
            LoadedMap loaded = loadedMaps.computeIfAbsent(mapId, id -> new LoadedMap());
            if (loaded.isLoaded()) {
                return loaded;
            }
            loaded.lock.writeLock().lock();
            try {
                if (loadedMaps.get(mapId) != loaded) {
                    continue;
                }
                if (!loaded.isLoaded()) {
                    Optional<DungeonMap> stored = mapRecordWriter.read(mapId);
                    if (stored.isEmpty()) {
                        loadedMaps.remove(mapId, loaded);
                        throw NotFoundException.of("Map", mapId);
                    }
                    DungeonMap map = stored.get();
                    loaded.persistedRevision = map.getRevision();
                    loaded.map = map;
                    log.info("Loaded map {} ({} rooms) at revision {}", mapId, map.getRooms().size(), map.getRevision());
                }
                return loaded;
            } finally {
                loaded.lock.writeLock().unlock();
            }
        }
    }

    /** Copies the room index only; untouched rooms keep their identity. */
    private static DungeonMap shallowCopy(DungeonMap map) {
        return DungeonMap.builder()
                .id(map.getId())
                .name(map.getName())
                .summary(map.getSummary())
                .revision(map.getRevision())
                .rooms(new TreeMap<>(map.getRooms()))
                .build();
    }

    private static void requireRevision(String mapId, long current, long expected) {
        if (current != expected) {
            throw new ConcurrencyConflictException("Map " + mapId + " is at revision " + current
                    + " but the edit was based on revision " + expected);
        }
    }

    private static void validateMap(DungeonMap map) {
        if (map == null) {
            throw new ValidationException("Map is required");
        }
        FightRef.requireValidId("map", map.getId());
        if (map.getName() == null || map.getName().isBlank()) {
            throw new ValidationException("Map name is required");
        }
        map.getRooms().forEach((key, room) -> {
            FightRef.requireValidId("room", key);
            if (!key.equals(room.getId())) {
                throw new ValidationException("Room key " + key + " does not match room id " + room.getId());
            }
        });
    }
}
