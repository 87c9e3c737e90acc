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

import me.golemcore.soundboard.domain.exception.ValidationException;
import me.golemcore.soundboard.domain.model.DomainEvent;
import me.golemcore.soundboard.domain.model.EventPayload;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.model.EventType;
import me.golemcore.soundboard.infrastructure.config.SoundboardProperties;
import me.golemcore.soundboard.infrastructure.event.EventBus;
import me.golemcore.soundboard.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;

/**
 * Typed access to the persisted settings.
 *
 * <p>
 * Entries are seeded from {@link SoundboardProperties} on first run and never
 * deleted. Rejected values leave the stored value unchanged and publish
 * nothing. Change events are published inside the storage writer section, so
 * subscribers see them in the order the values were committed.
 */
@Service
@Slf4j
public class ConfigRepository {

    static final String KEY_INTERVAL = "interval";
    static final String KEY_VOLUME = "volume";
    static final String KEY_NOTIFY_CHANNEL = "notify_channel";

    public static final int MIN_INTERVAL = 30;
    public static final int MAX_INTERVAL = 3600;
    public static final int MIN_VOLUME = 0;
    public static final int MAX_VOLUME = 100;

    private static final int MAX_CHANNEL_ID_LENGTH = 64;
    private static final String UPSERT = "MERGE INTO config (config_key, config_value) KEY (config_key) VALUES (?, ?)";

    private final StoragePort storage;
    private final EventBus eventBus;
    private final Clock clock;
    private final SoundboardProperties properties;

    public ConfigRepository(StoragePort storage, EventBus eventBus, Clock clock, SoundboardProperties properties) {
        this.storage = storage;
        this.eventBus = eventBus;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Insert the configured defaults for keys that are not stored yet. Existing
     * values are never overwritten.
     */
    public void seedDefaults() {
        String notifyChannel = normalizeChannel(properties.getNotifyChannelId());
        int seeded = storage.write(conn -> {
            int inserted = 0;
            inserted += insertIfMissing(conn, KEY_INTERVAL,
                    String.valueOf(properties.getPlayback().getDefaultInterval()));
            inserted += insertIfMissing(conn, KEY_VOLUME,
                    String.valueOf(properties.getPlayback().getDefaultVolume()));
            inserted += insertIfMissing(conn, KEY_NOTIFY_CHANNEL, notifyChannel);
            return inserted;
        });
        if (seeded > 0) {
            log.info("[Config] Seeded {} default setting(s)", seeded);
        }
    }

    public int getInterval() {
        return readInt(KEY_INTERVAL, properties.getPlayback().getDefaultInterval());
    }

    /**
     * @return the previous interval
     * @throws ValidationException
     *             if {@code seconds} is outside [30, 3600]
     */
    public int setInterval(int seconds, EventSource source) {
        if (seconds < MIN_INTERVAL || seconds > MAX_INTERVAL) {
            throw new ValidationException(
                    "Interval must be between " + MIN_INTERVAL + " and " + MAX_INTERVAL + " seconds");
        }
        int old = storage.write(conn -> {
            int previous = parseInt(KEY_INTERVAL, readValue(conn, KEY_INTERVAL),
                    properties.getPlayback().getDefaultInterval());
            SqlSupport.update(conn, UPSERT, KEY_INTERVAL, String.valueOf(seconds));
            return previous;
        }, previous -> publish(EventType.INTERVAL_CHANGED, new EventPayload.IntervalChanged(previous, seconds),
                source));
        log.info("[Config] Interval {}s -> {}s via {}", old, seconds, source.tag());
        return old;
    }

    public int getVolume() {
        return readInt(KEY_VOLUME, properties.getPlayback().getDefaultVolume());
    }

    /**
     * @return the previous volume
     * @throws ValidationException
     *             if {@code percent} is outside [0, 100]
     */
    public int setVolume(int percent, EventSource source) {
        if (percent < MIN_VOLUME || percent > MAX_VOLUME) {
            throw new ValidationException("Volume must be between " + MIN_VOLUME + " and " + MAX_VOLUME);
        }
        int old = storage.write(conn -> {
            int previous = parseInt(KEY_VOLUME, readValue(conn, KEY_VOLUME),
                    properties.getPlayback().getDefaultVolume());
            SqlSupport.update(conn, UPSERT, KEY_VOLUME, String.valueOf(percent));
            return previous;
        }, previous -> publish(EventType.VOLUME_CHANGED, new EventPayload.VolumeChanged(previous, percent),
                source));
        log.info("[Config] Volume {}% -> {}% via {}", old, percent, source.tag());
        return old;
    }

    public Optional<String> getNotifyChannel() {
        return storage.read(conn -> readValue(conn, KEY_NOTIFY_CHANNEL))
                .filter(value -> !value.isBlank());
    }

    /**
     * Set the notification channel. A {@code null} or blank id clears it.
     *
     * @return the previous channel, if any
     */
    public Optional<String> setNotifyChannel(String channelId, EventSource source) {
        String normalized = normalizeChannel(channelId);
        if (normalized != null && normalized.length() > MAX_CHANNEL_ID_LENGTH) {
            throw new ValidationException("Channel id must be at most " + MAX_CHANNEL_ID_LENGTH + " characters");
        }
        Optional<String> old = storage.write(conn -> {
            Optional<String> previous = readValue(conn, KEY_NOTIFY_CHANNEL).filter(value -> !value.isBlank());
            SqlSupport.update(conn, UPSERT, KEY_NOTIFY_CHANNEL, normalized);
            return previous;
        }, previous -> publish(EventType.NOTIFY_CHANNEL_CHANGED,
                new EventPayload.NotifyChannelChanged(previous.orElse(null), normalized), source));
        log.info("[Config] Notify channel {} -> {} via {}", old.orElse("none"),
                normalized != null ? normalized : "none", source.tag());
        return old;
    }

    private int readInt(String key, int fallback) {
        Optional<String> raw = storage.read(conn -> readValue(conn, key));
        return parseInt(key, raw, fallback);
    }

    private static int parseInt(String key, Optional<String> raw, int fallback) {
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException e) {
            log.warn("[Config] Stored value for '{}' is not a number: '{}', using {}", key, raw.get(), fallback);
            return fallback;
        }
    }

    private static Optional<String> readValue(Connection conn, String key) throws SQLException {
        return SqlSupport.queryOne(conn, "SELECT config_value FROM config WHERE config_key = ?",
                rs -> Optional.ofNullable(rs.getString(1)), key)
                .flatMap(value -> value);
    }

    private static int insertIfMissing(Connection conn, String key, String value) throws SQLException {
        boolean present = SqlSupport.queryOne(conn, "SELECT 1 FROM config WHERE config_key = ?",
                rs -> Boolean.TRUE, key).isPresent();
        if (present) {
            return 0;
        }
        return SqlSupport.update(conn, "INSERT INTO config (config_key, config_value) VALUES (?, ?)", key, value);
    }

    private static String normalizeChannel(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            return null;
        }
        return channelId.trim();
    }

    private void publish(EventType type, EventPayload payload, EventSource source) {
        eventBus.publish(DomainEvent.of(type, payload, source, clock.instant()));
    }
}
