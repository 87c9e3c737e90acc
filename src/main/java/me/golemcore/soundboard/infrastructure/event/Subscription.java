package me.golemcore.soundboard.infrastructure.event;

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

import me.golemcore.soundboard.domain.model.EventType;

import java.util.Set;

/**
 * Handle for a registered subscriber.
 */
public interface Subscription {

    String name();

    Set<EventType> eventTypes();

    /**
     * Unregisters the subscriber. Events already queued are still delivered, then
     * the worker exits.
     */
    void cancel();
}
