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

import lombok.RequiredArgsConstructor;
import me.golemcore.soundboard.adapter.inbound.web.dto.IntervalRequest;
import me.golemcore.soundboard.adapter.inbound.web.dto.NotifyChannelRequest;
import me.golemcore.soundboard.adapter.inbound.web.dto.SettingsResponse;
import me.golemcore.soundboard.adapter.inbound.web.dto.VolumeRequest;
import me.golemcore.soundboard.domain.exception.ValidationException;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.repository.ConfigRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Playback settings endpoints. Every update responds with the full settings
 * after the change.
 */
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final ConfigRepository configRepository;

    @GetMapping
    public Mono<ResponseEntity<SettingsResponse>> getSettings() {
        return Mono.fromCallable(this::currentSettings)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PutMapping("/interval")
    public Mono<ResponseEntity<SettingsResponse>> updateInterval(@RequestBody IntervalRequest request) {
        return Mono.fromCallable(() -> {
            if (request.getSeconds() == null) {
                throw new ValidationException("seconds is required");
            }
            configRepository.setInterval(request.getSeconds(), EventSource.WEB);
            return currentSettings();
        }).subscribeOn(Schedulers.boundedElastic()).map(ResponseEntity::ok);
    }

    @PutMapping("/volume")
    public Mono<ResponseEntity<SettingsResponse>> updateVolume(@RequestBody VolumeRequest request) {
        return Mono.fromCallable(() -> {
            if (request.getPercent() == null) {
                throw new ValidationException("percent is required");
            }
            configRepository.setVolume(request.getPercent(), EventSource.WEB);
            return currentSettings();
        }).subscribeOn(Schedulers.boundedElastic()).map(ResponseEntity::ok);
    }

    @PutMapping("/notify-channel")
    public Mono<ResponseEntity<SettingsResponse>> updateNotifyChannel(@RequestBody NotifyChannelRequest request) {
        return Mono.fromCallable(() -> {
            configRepository.setNotifyChannel(request.getChannelId(), EventSource.WEB);
            return currentSettings();
        }).subscribeOn(Schedulers.boundedElastic()).map(ResponseEntity::ok);
    }

    private SettingsResponse currentSettings() {
        return SettingsResponse.builder()
                .interval(configRepository.getInterval())
                .volume(configRepository.getVolume())
                .notifyChannelId(configRepository.getNotifyChannel().orElse(null))
                .build();
    }
}
