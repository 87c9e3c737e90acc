package me.golemcore.soundboard.domain.repository;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.soundboard.domain.exception.NotFoundException;
import me.golemcore.soundboard.domain.exception.ValidationException;
import me.golemcore.soundboard.domain.model.DomainEvent;
import me.golemcore.soundboard.domain.model.EventPayload;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.model.EventType;
import me.golemcore.soundboard.domain.model.Sound;
import me.golemcore.soundboard.domain.model.SoundSummary;
import me.golemcore.soundboard.infrastructure.event.EventBus;
import me.golemcore.soundboard.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

/**
 * Typed access to the sound library persisted through {@link StoragePort}.
 *
 * <p>
 * Names are unique ignoring case. Every successful mutation publishes exactly
 * one event, strictly after the storage transaction committed and before the
 * next write can start:
 * {@link EventType#SOUND_UPLOADED}, {@link EventType#SOUND_RENAMED} or
 * {@link EventType#SOUND_DELETED}. Rejected mutations leave storage untouched
 * and publish nothing.
 */
@Service
@Slf4j
public class SoundRepository {

    public static final int MAX_NAME_LENGTH = 255;

    private static final String SUMMARY_COLUMNS = "id, name, OCTET_LENGTH(payload) AS size_bytes, created_at";
    private static final String FULL_COLUMNS = "id, name, payload, created_at";

    private final StoragePort storage;
    private final EventBus eventBus;
    private final Clock clock;
    private final Random random;

    @Autowired
    public SoundRepository(StoragePort storage, EventBus eventBus, Clock clock) {
        this(storage, eventBus, clock, new Random());
    }

    SoundRepository(StoragePort storage, EventBus eventBus, Clock clock, Random random) {
        this.storage = storage;
        this.eventBus = eventBus;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Store a new sound.
     *
     * @throws ValidationException
     *             if the name is invalid, already used (ignoring case), or the
     *             payload is empty
     */
    public Sound create(String name, byte[] payload, EventSource source) {
        String normalized = normalizeName(name);
        if (payload == null || payload.length == 0) {
            throw new ValidationException("Sound payload is empty");
        }
        byte[] data = payload.clone();
        Instant createdAt = Instant.ofEpochMilli(clock.instant().toEpochMilli());

        Sound sound = storage.write(conn -> {
            if (findIdByName(conn, normalized).isPresent()) {
                throw duplicateName(normalized);
            }
            int id = SqlSupport.insertReturningKey(conn,
                    "INSERT INTO sounds (name, name_key, payload, created_at) VALUES (?, ?, ?, ?)",
                    normalized, nameKey(normalized), data, createdAt.toEpochMilli());
            return Sound.builder()
                    .id(id)
                    .name(normalized)
                    .data(data)
                    .createdAt(createdAt)
                    .build();
        }, created -> publish(EventType.SOUND_UPLOADED,
                new EventPayload.SoundUploaded(created.getId(), created.getName()), source));

        log.info("[Sounds] Created #{} '{}' ({} bytes) via {}", sound.getId(), sound.getName(), data.length,
                source.tag());
        return sound;
    }

    /**
     * Change the name of a sound. The payload and id are preserved.
     *
     * @throws NotFoundException
     *             if no sound has this id
     * @throws ValidationException
     *             if the new name is invalid or used by another sound
     */
    public SoundSummary rename(int id, String newName, EventSource source) {
        String normalized = normalizeName(newName);

        RenameResult result = storage.write(conn -> {
            SoundSummary current = findSummary(conn, id).orElseThrow(() -> NotFoundException.sound(id));
            Optional<Integer> owner = findIdByName(conn, normalized);
            if (owner.isPresent() && owner.get() != id) {
                throw duplicateName(normalized);
            }
            SqlSupport.update(conn, "UPDATE sounds SET name = ?, name_key = ? WHERE id = ?",
                    normalized, nameKey(normalized), id);
            return new RenameResult(current.name(),
                    new SoundSummary(id, normalized, current.sizeBytes(), current.createdAt()));
        }, renamed -> publish(EventType.SOUND_RENAMED,
                new EventPayload.SoundRenamed(id, renamed.oldName(), normalized), source));

        log.info("[Sounds] Renamed #{} '{}' -> '{}' via {}", id, result.oldName(), normalized, source.tag());
        return result.renamed();
    }

    /**
     * Remove a sound.
     *
     * @throws NotFoundException
     *             if no sound has this id
     */
    public SoundSummary delete(int id, EventSource source) {
        SoundSummary deleted = storage.write(conn -> {
            SoundSummary current = findSummary(conn, id).orElseThrow(() -> NotFoundException.sound(id));
            SqlSupport.update(conn, "DELETE FROM sounds WHERE id = ?", id);
            return current;
        }, removed -> publish(EventType.SOUND_DELETED, new EventPayload.SoundDeleted(id, removed.name()), source));

        log.info("[Sounds] Deleted #{} '{}' via {}", id, deleted.name(), source.tag());
        return deleted;
    }

    /**
     * Load a sound including its payload.
     *
     * @throws NotFoundException
     *             if no sound has this id
     */
    public Sound get(int id) {
        return storage.read(conn -> SqlSupport.queryOne(conn,
                "SELECT " + FULL_COLUMNS + " FROM sounds WHERE id = ?", SoundRepository::mapSound, id))
                .orElseThrow(() -> NotFoundException.sound(id));
    }

    /**
     * Load a sound without its payload.
     *
     * @throws NotFoundException
     *             if no sound has this id
     */
    public SoundSummary getSummary(int id) {
        return storage.read(conn -> findSummary(conn, id))
                .orElseThrow(() -> NotFoundException.sound(id));
    }

    /**
     * Find a sound by name, ignoring case.
     */
    public Optional<Sound> findByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = nameKey(name.trim());
        return storage.read(conn -> SqlSupport.queryOne(conn,
                "SELECT " + FULL_COLUMNS + " FROM sounds WHERE name_key = ?", SoundRepository::mapSound, key));
    }

    /**
     * All sounds without payloads, ordered by name ignoring case.
     */
    public List<SoundSummary> list() {
        return storage.read(conn -> SqlSupport.query(conn,
                "SELECT " + SUMMARY_COLUMNS + " FROM sounds ORDER BY name_key", SoundRepository::mapSummary));
    }

    public int count() {
        return storage.read(SoundRepository::countRows);
    }

    /**
     * Pick a sound uniformly at random.
     *
     * @return the sound, or empty when the library has no sounds
     */
    public Optional<Sound> randomPick() {
        return storage.read(conn -> {
            int count = countRows(conn);
            if (count == 0) {
                return Optional.<Sound>empty();
            }
            int offset = random.nextInt(count);
            return SqlSupport.queryOne(conn,
                    "SELECT " + FULL_COLUMNS + " FROM sounds ORDER BY id LIMIT 1 OFFSET ?",
                    SoundRepository::mapSound, offset);
        });
    }

    static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Sound name must not be blank");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Sound name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private static String nameKey(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static ValidationException duplicateName(String name) {
        return new ValidationException("A sound named '" + name + "' already exists");
    }

    private void publish(EventType type, EventPayload payload, EventSource source) {
        eventBus.publish(DomainEvent.of(type, payload, source, clock.instant()));
    }

    private static int countRows(Connection conn) throws SQLException {
        return SqlSupport.queryOne(conn, "SELECT COUNT(*) FROM sounds", rs -> rs.getInt(1)).orElse(0);
    }

    private static Optional<Integer> findIdByName(Connection conn, String name) throws SQLException {
        return SqlSupport.queryOne(conn, "SELECT id FROM sounds WHERE name_key = ?",
                rs -> rs.getInt(1), nameKey(name));
    }

    private static Optional<SoundSummary> findSummary(Connection conn, int id) throws SQLException {
        return SqlSupport.queryOne(conn, "SELECT " + SUMMARY_COLUMNS + " FROM sounds WHERE id = ?",
                SoundRepository::mapSummary, id);
    }

    private static Sound mapSound(ResultSet rs) throws SQLException {
        return Sound.builder()
                .id(rs.getInt("id"))
                .name(rs.getString("name"))
                .data(rs.getBytes("payload"))
                .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                .build();
    }

    private static SoundSummary mapSummary(ResultSet rs) throws SQLException {
        return new SoundSummary(
                rs.getInt("id"),
                rs.getString("name"),
                rs.getLong("size_bytes"),
                Instant.ofEpochMilli(rs.getLong("created_at")));
    }

    private record RenameResult(String oldName, SoundSummary renamed) {
    }
}
