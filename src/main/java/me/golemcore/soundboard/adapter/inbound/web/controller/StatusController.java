package me.golemcore.soundboard.adapter.inbound.web.controller;

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

import me.golemcore.soundboard.adapter.inbound.web.dto.StatusResponse;
import me.golemcore.soundboard.domain.repository.SoundRepository;
import me.golemcore.soundboard.infrastructure.config.SoundboardProperties;
import me.golemcore.soundboard.playback.PlaybackScheduler;
import me.golemcore.soundboard.port.outbound.VoiceGatewayPort;
import me.golemcore.soundboard.port.outbound.VoiceSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Playback status endpoint.
 */
@RestController
@RequestMapping("/api/status")
public class StatusController {

    private final PlaybackScheduler playbackScheduler;
    private final SoundRepository soundRepository;
    private final VoiceGatewayPort voiceGateway;
    private final String guildId;

    public StatusController(PlaybackScheduler playbackScheduler, SoundRepository soundRepository,
            VoiceGatewayPort voiceGateway, SoundboardProperties properties) {
        this.playbackScheduler = playbackScheduler;
        this.soundRepository = soundRepository;
        this.voiceGateway = voiceGateway;
        this.guildId = properties.getGuildId();
    }

    @GetMapping
    public Mono<ResponseEntity<StatusResponse>> status() {
        return Mono.fromCallable(() -> StatusResponse.builder()
                .running(playbackScheduler.isRunning())
                .state(playbackScheduler.getState().name())
                .secondsUntilNextTick(playbackScheduler.getTimeUntilNextTick()
                        .map(Duration::toSeconds)
                        .orElse(null))
                .soundCount(soundRepository.count())
                .voiceChannelId(voiceGateway.getActiveSession(guildId)
                        .filter(VoiceSession::isConnected)
                        .map(VoiceSession::channelId)
                        .orElse(null))
                .build())
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
