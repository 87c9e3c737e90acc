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

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable in-process event. Events are never persisted; they live only for
 * the duration of dispatch.
 *
 * @param type
 *            event tag
 * @param payload
 *            payload whose class must match {@link EventType#getPayloadType()}
 * @param source
 *            entry point that caused the event
 * @param timestamp
 *            creation time
 */
public record DomainEvent(EventType type, EventPayload payload, EventSource source, Instant timestamp) {

    public DomainEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!type.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Event " + type + " requires payload "
                    + type.getPayloadType().getSimpleName() + " but got " + payload.getClass().getSimpleName());
        }
    }

    public static DomainEvent of(EventType type, EventPayload payload, EventSource source, Instant timestamp) {
        return new DomainEvent(type, payload, source, timestamp);
    }

    /**
     * Returns the payload cast to the expected record type.
     */
    public <T extends EventPayload> T payloadAs(Class<T> payloadClass) {
        return payloadClass.cast(payload);
    }
}
