package me.golemcore.soundboard.infrastructure.config;

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

import me.golemcore.soundboard.adapter.outbound.messaging.DiscordMessagingAdapter;
import me.golemcore.soundboard.adapter.outbound.messaging.LoggingMessagingAdapter;
import me.golemcore.soundboard.adapter.outbound.voice.NoOpVoiceGatewayAdapter;
import me.golemcore.soundboard.port.outbound.MessagingPort;
import me.golemcore.soundboard.port.outbound.VoiceGatewayPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the chat and voice transport adapters.
 *
 * <p>
 * Messages go through the Discord REST API when {@code soundboard.discord.token}
 * is set and to the log otherwise. Voice falls back to
 * {@link NoOpVoiceGatewayAdapter} unless another {@link VoiceGatewayPort} bean
 * is present.
 */
@Configuration
@Slf4j
public class TransportConfig {

    @Bean
    public MessagingPort messagingPort(SoundboardProperties properties) {
        SoundboardProperties.DiscordProperties discord = properties.getDiscord();
        if (discord.getToken() == null || discord.getToken().isBlank()) {
            log.warn("[Notify] No bot token configured, notifications will only be logged");
            return new LoggingMessagingAdapter();
        }
        log.info("[Notify] Using Discord REST API at {}", discord.getApiBaseUrl());
        return new DiscordMessagingAdapter(discord.getApiBaseUrl(), discord.getToken());
    }

    @Bean
    @ConditionalOnMissingBean(VoiceGatewayPort.class)
    public VoiceGatewayPort voiceGatewayPort() {
        log.warn("[Voice] No voice transport configured, playback cycles will be skipped");
        return new NoOpVoiceGatewayAdapter();
    }
}
