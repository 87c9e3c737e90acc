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

import me.golemcore.soundboard.domain.exception.DeliveryException;
import me.golemcore.soundboard.port.outbound.MessagingPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Posts channel messages through the Discord REST API using {@link WebClient}.
 *
 * <p>
 * Each call is a single attempt; retry and timeout policy belong to the
 * caller. HTTP and connection errors complete the future with
 * {@link DeliveryException}.
 */
@Slf4j
public class DiscordMessagingAdapter implements MessagingPort {

    static final int MAX_MESSAGE_LENGTH = 2000;

    private final WebClient webClient;

    public DiscordMessagingAdapter(String apiBaseUrl, String botToken) {
        this(WebClient.builder()
                .baseUrl(apiBaseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + botToken)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024))
                .build());
    }

    DiscordMessagingAdapter(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public CompletableFuture<Void> sendMessage(String channelId, String text) {
        return webClient.post()
                .uri("/channels/{channelId}/messages", channelId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("content", truncate(text)))
                .retrieve()
                .toBodilessEntity()
                .doOnSuccess(response -> log.debug("[Notify] Message posted to channel {}", channelId))
                .onErrorMap(WebClientResponseException.class, e -> new DeliveryException(
                        "Discord rejected message to channel " + channelId + ": HTTP " + e.getStatusCode().value(),
                        e))
                .onErrorMap(WebClientRequestException.class, e -> new DeliveryException(
                        "Discord unreachable: " + e.getMessage(), e))
                .then()
                .toFuture();
    }

    static String truncate(String text) {
        if (text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
    }
}
