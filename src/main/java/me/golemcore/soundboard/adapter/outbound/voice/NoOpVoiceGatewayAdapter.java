package me.golemcore.soundboard.adapter.outbound.voice;

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

import me.golemcore.soundboard.domain.exception.VoiceConnectionException;
import me.golemcore.soundboard.domain.model.VoiceChannel;
import me.golemcore.soundboard.port.outbound.VoiceGatewayPort;
import me.golemcore.soundboard.port.outbound.VoiceSession;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Voice gateway used when no voice transport is configured.
 *
 * <p>
 * Reports no voice channels, so every playback cycle is skipped. A real
 * transport replaces this adapter by declaring its own
 * {@link VoiceGatewayPort} bean.
 */
@Slf4j
public class NoOpVoiceGatewayAdapter implements VoiceGatewayPort {

    @Override
    public List<VoiceChannel> listVoiceChannels(String guildId) {
        log.debug("[Voice] No voice transport configured, guild {} has no channels", guildId);
        return Collections.emptyList();
    }

    @Override
    public Optional<VoiceSession> getActiveSession(String guildId) {
        return Optional.empty();
    }

    @Override
    public CompletableFuture<VoiceSession> connect(String guildId, VoiceChannel channel) {
        return CompletableFuture.failedFuture(
                new VoiceConnectionException("No voice transport configured"));
    }
}
