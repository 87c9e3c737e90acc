package me.golemcore.soundboard.notification;

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
import me.golemcore.soundboard.domain.model.EventType;
import me.golemcore.soundboard.domain.repository.ConfigRepository;
import me.golemcore.soundboard.infrastructure.config.SoundboardProperties;
import me.golemcore.soundboard.infrastructure.event.EventBus;
import me.golemcore.soundboard.infrastructure.event.Subscription;
import me.golemcore.soundboard.infrastructure.i18n.MessageService;
import me.golemcore.soundboard.port.outbound.MessagingPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.Optional;

/**
 * Posts a short message to the notification channel for every library and
 * settings change.
 *
 * <p>
 * Runs as a single event bus subscriber for all domain event types, so
 * notifications leave in the order the changes were made. Each delivery is
 * attempted up to {@code soundboard.notification.max-attempts} times with
 * exponential backoff; after that the notification is dropped and logged.
 * Nothing is sent while no notification channel is configured.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class NotificationDispatcher {

    private final EventBus eventBus;
    private final ConfigRepository configRepository;
    private final MessagingPort messagingPort;
    private final MessageService messageService;
    private final SoundboardProperties.NotificationProperties settings;

    private volatile Subscription subscription;

    public NotificationDispatcher(EventBus eventBus, ConfigRepository configRepository,
            MessagingPort messagingPort, MessageService messageService, SoundboardProperties properties) {
        this.eventBus = eventBus;
        this.configRepository = configRepository;
        this.messagingPort = messagingPort;
        this.messageService = messageService;
        this.settings = properties.getNotification();
    }

    /**
     * Registers the dispatcher on the event bus. Calling it twice does nothing.
     */
    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = eventBus.subscribe("notification-dispatcher", EventType.domainEvents(), this::onEvent);
        log.info("[Notify] Listening for {} event types", subscription.eventTypes().size());
    }

    public synchronized void stop() {
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    void onEvent(DomainEvent event) {
        Optional<String> channel = configRepository.getNotifyChannel();
        if (channel.isEmpty()) {
            log.debug("[Notify] No notification channel configured, skipping {}", event.type());
            return;
        }
        Optional<String> text = format(event);
        if (text.isEmpty()) {
            return;
        }
        deliver(channel.get(), text.get(), event.type());
    }

    /**
     * Localized notification text for a domain event, or empty for event types
     * that are not announced.
     */
    Optional<String> format(DomainEvent event) {
        String source = event.source().tag();
        EventPayload payload = event.payload();
        if (payload instanceof EventPayload.SoundUploaded uploaded) {
            return Optional.of(messageService.getMessage("notify.sound.uploaded", uploaded.name(), source));
        }
        if (payload instanceof EventPayload.SoundDeleted deleted) {
            return Optional.of(messageService.getMessage("notify.sound.deleted", deleted.name(), source));
        }
        if (payload instanceof EventPayload.SoundRenamed renamed) {
            return Optional.of(messageService.getMessage("notify.sound.renamed",
                    renamed.oldName(), renamed.newName(), source));
        }
        if (payload instanceof EventPayload.IntervalChanged interval) {
            return Optional.of(messageService.getMessage("notify.interval.changed",
                    String.valueOf(interval.oldSeconds()), String.valueOf(interval.newSeconds()), source));
        }
        if (payload instanceof EventPayload.VolumeChanged volume) {
            return Optional.of(messageService.getMessage("notify.volume.changed",
                    String.valueOf(volume.oldPercent()), String.valueOf(volume.newPercent()), source));
        }
        if (payload instanceof EventPayload.NotifyChannelChanged) {
            return Optional.of(messageService.getMessage("notify.channel.changed", source));
        }
        return Optional.empty();
    }

    private void deliver(String channelId, String text, EventType type) {
        try {
            Mono.fromFuture(() -> messagingPort.sendMessage(channelId, text))
                    .timeout(getRequestTimeout())
                    .retryWhen(buildRetry()
                            .doBeforeRetry(signal -> log.debug("[Notify] Retrying {} to channel {} (attempt {}): {}",
                                    type, channelId, signal.totalRetries() + 2, signal.failure().getMessage())))
                    .block();
            log.info("[Notify] Delivered {} to channel {}", type, channelId);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.isRetryExhausted(e) && e.getCause() != null ? e.getCause() : e;
            log.error("[Notify] Dropping {} for channel {} after {} attempt(s): {}",
                    type, channelId, settings.getMaxAttempts(), cause.getMessage());
        }
    }

    protected RetryBackoffSpec buildRetry() {
        return Retry.backoff(settings.getMaxAttempts() - 1L, settings.getFirstBackoff())
                .maxBackoff(settings.getMaxBackoff());
    }

    protected Duration getRequestTimeout() {
        return settings.getTimeout();
    }
}
