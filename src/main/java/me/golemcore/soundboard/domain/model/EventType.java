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

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed catalogue of events published on the
 * {@link me.golemcore.soundboard.infrastructure.event.EventBus}. Each type is
 * bound to exactly one payload shape, checked when a {@link DomainEvent} is
 * constructed.
 */
public enum EventType {

    SOUND_UPLOADED(EventPayload.SoundUploaded.class),
    SOUND_DELETED(EventPayload.SoundDeleted.class),
    SOUND_RENAMED(EventPayload.SoundRenamed.class),

    INTERVAL_CHANGED(EventPayload.IntervalChanged.class),
    VOLUME_CHANGED(EventPayload.VolumeChanged.class),
    NOTIFY_CHANNEL_CHANGED(EventPayload.NotifyChannelChanged.class),

    BOT_READY(EventPayload.SystemSignal.class),
    SHUTDOWN(EventPayload.SystemSignal.class);

    private final Class<? extends EventPayload> payloadType;

    EventType(Class<? extends EventPayload> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends EventPayload> getPayloadType() {
        return payloadType;
    }

    /**
     * Event types describing library or settings mutations, i.e. everything that
     * is announced in the notification channel.
     */
    public static Set<EventType> domainEvents() {
        return EnumSet.of(SOUND_UPLOADED, SOUND_DELETED, SOUND_RENAMED,
                INTERVAL_CHANGED, VOLUME_CHANGED, NOTIFY_CHANNEL_CHANGED);
    }
}
