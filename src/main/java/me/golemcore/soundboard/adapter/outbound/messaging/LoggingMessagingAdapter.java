package me.golemcore.soundboard.adapter.outbound.messaging;

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

import me.golemcore.soundboard.port.outbound.MessagingPort;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Messaging adapter used when no bot token is configured. Messages are written
 * to the log instead of being posted.
 */
@Slf4j
public class LoggingMessagingAdapter implements MessagingPort {

    @Override
    public CompletableFuture<Void> sendMessage(String channelId, String text) {
        log.info("[Notify] (no bot token) #{}: {}", channelId, text);
        return CompletableFuture.completedFuture(null);
    }
}
