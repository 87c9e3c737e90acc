package me.golemcore.soundboard.infrastructure.i18n;

import me.golemcore.soundboard.infrastructure.config.SoundboardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageServiceTest {

    private static final String KEY_LIST_EMPTY = "command.list.empty";

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService("en");
    }

    @Test
    void shouldReturnEnglishMessageByDefault() {
        assertEquals("🔇 No sounds available. Upload some sounds via the web interface!",
                messageService.getMessage(KEY_LIST_EMPTY));
    }

    @Test
    void shouldFormatMessageWithParameters() {
        assertEquals("⏱️ Interval changed from **30** to **90** seconds",
                messageService.getMessage("command.interval.changed", "30", "90"));
    }

    @Test
    void shouldReturnKeyWhenMessageNotFound() {
        assertEquals("nonexistent.key", messageService.getMessage("nonexistent.key"));
    }

    @Test
    void shouldSwitchToRussian() {
        String english = messageService.getMessage(KEY_LIST_EMPTY);

        messageService.setLanguage("ru");

        assertEquals("ru", messageService.getLanguage());
        assertNotEquals(english, messageService.getMessage(KEY_LIST_EMPTY));
        assertTrue(messageService.getMessage("command.ping.reply", "alice").contains("alice"));
    }

    @Test
    void shouldFallBackToEnglishForUnsupportedLanguage() {
        messageService.setLanguage("de");

        assertEquals("en", messageService.getLanguage());
    }

    @Test
    void shouldTakeLanguageFromProperties() {
        SoundboardProperties properties = new SoundboardProperties();
        properties.setLanguage("ru");

        assertEquals("ru", new MessageService(properties).getLanguage());
    }

    @Test
    void shouldHaveEveryEnglishKeyInRussian() {
        MessageService russian = new MessageService("ru");
        String[] keys = { "notify.sound.uploaded", "notify.sound.deleted", "notify.sound.renamed",
                "notify.interval.changed", "notify.volume.changed", "notify.channel.changed",
                "command.status.title", "command.nextsound.in", "command.error.unknown" };

        for (String key : keys) {
            assertNotEquals(key, russian.getMessage(key), key);
        }
    }
}
