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

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Centralized configuration properties for the soundboard, bound from
 * application.properties and the environment.
 *
 * <p>
 * All configuration is organized under the {@code soundboard.*} prefix:
 * <ul>
 * <li>{@link DiscordProperties} - bot credentials and REST endpoint</li>
 * <li>{@link StorageProperties} - database location</li>
 * <li>{@link WebProperties} - HTTP bind address and root path</li>
 * <li>{@link PlaybackProperties} - defaults and limits for playback
 * cycles</li>
 * <li>{@link EventsProperties} - event bus sizing</li>
 * <li>{@link NotificationProperties} - delivery retry policy</li>
 * </ul>
 *
 * <p>
 * Values are validated at startup; an invalid default interval or volume
 * prevents the application context from starting.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "soundboard")
@Validated
@Data
public class SoundboardProperties {

    @NotBlank
    private String guildId;

    private String notifyChannelId = "";
    private String language = "en";

    @Valid
    private DiscordProperties discord = new DiscordProperties();
    @Valid
    private StorageProperties storage = new StorageProperties();
    @Valid
    private WebProperties web = new WebProperties();
    @Valid
    private PlaybackProperties playback = new PlaybackProperties();
    @Valid
    private EventsProperties events = new EventsProperties();
    @Valid
    private NotificationProperties notification = new NotificationProperties();

    @Data
    public static class DiscordProperties {
        private String token = "";
        private String apiBaseUrl = "https://discord.com/api/v10";
    }

    @Data
    public static class StorageProperties {
        @NotBlank
        private String path = "${user.home}/.soundboard/soundboard";
    }

    @Data
    public static class WebProperties {
        private String host = "0.0.0.0";
        @Min(1)
        @Max(65535)
        private int port = 8000;
        private String rootPath = "";
    }

    @Data
    public static class PlaybackProperties {
        @Min(30)
        @Max(3600)
        private int defaultInterval = 30;
        @Min(0)
        @Max(100)
        private int defaultVolume = 100;
        @NotNull
        private Duration maxDuration = Duration.ofMinutes(5);
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(15);
        /**
         * Consecutive cycles without listeners after which the voice session is
         * closed. Zero keeps the session open indefinitely.
         */
        @Min(0)
        private int leaveAfterEmptyCycles = 0;
    }

    @Data
    public static class EventsProperties {
        @Min(1)
        private int queueCapacity = 1024;
        @NotNull
        private Duration drainTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class NotificationProperties {
        @Min(1)
        private int maxAttempts = 4;
        @NotNull
        private Duration firstBackoff = Duration.ofSeconds(1);
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(10);
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }
}
