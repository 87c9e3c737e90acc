package me.golemcore.soundboard.domain.model;

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

/**
 * Typed payload carried by a {@link DomainEvent}. One record per
 * {@link EventType}.
 */
public interface EventPayload {

    /**
     * A sound was added to the library.
     */
    record SoundUploaded(int id, String name) implements EventPayload {
    }

    /**
     * A sound was removed from the library.
     */
    record SoundDeleted(int id, String name) implements EventPayload {
    }

    /**
     * A sound changed its name; the payload bytes are untouched.
     */
    record SoundRenamed(int id, String oldName, String newName) implements EventPayload {
    }

    /**
     * Playback interval changed, values in seconds.
     */
    record IntervalChanged(int oldSeconds, int newSeconds) implements EventPayload {
    }

    /**
     * Playback volume changed, values in percent.
     */
    record VolumeChanged(int oldPercent, int newPercent) implements EventPayload {
    }

    /**
     * Notification channel changed. Either side is {@code null} when no channel
     * is configured.
     */
    record NotifyChannelChanged(String oldChannelId, String newChannelId) implements EventPayload {
    }

    /**
     * Lifecycle signal without domain data.
     */
    record SystemSignal(String detail) implements EventPayload {
    }
}
