package me.golemcore.soundboard.port.outbound;

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

import me.golemcore.soundboard.domain.model.VoiceChannel;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the voice transport of the chat platform.
 *
 * <p>
 * The gateway owns voice sessions; at most one session exists per guild.
 * Callers look up the active session instead of keeping their own reference.
 */
public interface VoiceGatewayPort {

    /**
     * Voice channels of the guild with their current member counts (bots
     * excluded).
     */
    List<VoiceChannel> listVoiceChannels(String guildId);

    /**
     * Currently open session in the guild, if any.
     */
    Optional<VoiceSession> getActiveSession(String guildId);

    /**
     * Open a session on the given channel. Completes exceptionally with
     * {@link me.golemcore.soundboard.domain.exception.VoiceConnectionException}
     * when the connection cannot be established.
     */
    CompletableFuture<VoiceSession> connect(String guildId, VoiceChannel channel);
}
