package me.golemcore.soundboard.infrastructure.config;

import me.golemcore.soundboard.adapter.outbound.messaging.DiscordMessagingAdapter;
import me.golemcore.soundboard.adapter.outbound.messaging.LoggingMessagingAdapter;
import me.golemcore.soundboard.adapter.outbound.voice.NoOpVoiceGatewayAdapter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class TransportConfigTest {

    private final TransportConfig config = new TransportConfig();

    @Test
    void shouldLogMessagesWithoutToken() {
        SoundboardProperties properties = new SoundboardProperties();

        assertInstanceOf(LoggingMessagingAdapter.class, config.messagingPort(properties));
        assertDoesNotThrow(() -> config.messagingPort(properties).sendMessage("1", "hello").join());
    }

    @Test
    void shouldUseDiscordWhenTokenConfigured() {
        SoundboardProperties properties = new SoundboardProperties();
        properties.getDiscord().setToken("token");

        assertInstanceOf(DiscordMessagingAdapter.class, config.messagingPort(properties));
    }

    @Test
    void shouldFallBackToNoOpVoiceGateway() {
        assertInstanceOf(NoOpVoiceGatewayAdapter.class, config.voiceGatewayPort());
    }
}
