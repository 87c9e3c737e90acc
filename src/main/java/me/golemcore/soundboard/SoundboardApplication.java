package me.golemcore.soundboard;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the soundboard bot.
 *
 * <p>
 * Periodically joins the most populated voice channel of a guild and plays a
 * random sound from a managed library. The library and the playback settings
 * are changed through text commands and a REST API; every change is announced
 * in a notification channel.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters) around an in-process event bus:
 *
 * <pre>
 * Input Layer        → CommandRouter, REST controllers
 * Domain Layer       → SoundRepository, ConfigRepository, EventBus
 * Services           → PlaybackScheduler, NotificationDispatcher
 * Infrastructure     → H2 storage, Discord messaging, voice gateway
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code soundboard.*} prefix, overridable from the environment.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SoundboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(SoundboardApplication.class, args);
    }

}
