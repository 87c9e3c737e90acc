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

import me.golemcore.soundboard.domain.model.DomainEvent;
import me.golemcore.soundboard.domain.model.EventPayload;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.model.EventType;
import me.golemcore.soundboard.domain.repository.ConfigRepository;
import me.golemcore.soundboard.domain.repository.SoundRepository;
import me.golemcore.soundboard.infrastructure.event.EventBus;
import me.golemcore.soundboard.notification.NotificationDispatcher;
import me.golemcore.soundboard.playback.PlaybackScheduler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Spring configuration that brings the soundboard up on application startup
 * and takes it down in order on shutdown.
 *
 * <p>
 * Startup:
 * <ul>
 * <li>Seeds missing settings with the configured defaults</li>
 * <li>Registers the notification dispatcher on the event bus</li>
 * <li>Starts the playback scheduler</li>
 * <li>Publishes {@link EventType#BOT_READY}</li>
 * </ul>
 *
 * <p>
 * Shutdown publishes {@link EventType#SHUTDOWN}, stops the scheduler and then
 * drains the event bus so queued notifications still go out.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final SoundboardProperties properties;
    private final EventBus eventBus;
    private final SoundRepository soundRepository;
    private final ConfigRepository configRepository;
    private final PlaybackScheduler playbackScheduler;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("Soundboard starting for guild {}", properties.getGuildId());
        configRepository.seedDefaults();
        log.info("Interval: {}s, volume: {}%, notify channel: {}",
                configRepository.getInterval(), configRepository.getVolume(),
                configRepository.getNotifyChannel().orElse("none"));
        log.info("Sounds in library: {}", soundRepository.count());
        SoundboardProperties.WebProperties web = properties.getWeb();
        log.info("Web API: http://{}:{}{}/api", web.getHost(), web.getPort(), web.getRootPath());

        notificationDispatcher.start();
        playbackScheduler.start();

        eventBus.publish(DomainEvent.of(EventType.BOT_READY, new EventPayload.SystemSignal("startup"),
                EventSource.SYSTEM, clock.instant()));
        log.info("Soundboard started successfully");
    }

    @PreDestroy
    public void shutdown() {
        log.info("Soundboard shutting down");
        eventBus.publish(DomainEvent.of(EventType.SHUTDOWN, new EventPayload.SystemSignal("context closed"),
                EventSource.SYSTEM, clock.instant()));
        playbackScheduler.stop();
        eventBus.shutdown(properties.getEvents().getDrainTimeout());
    }
}
