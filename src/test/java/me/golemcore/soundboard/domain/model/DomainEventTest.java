package me.golemcore.soundboard.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DomainEventTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldRejectPayloadOfWrongShape() {
        EventPayload payload = new EventPayload.VolumeChanged(10, 20);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> DomainEvent.of(EventType.INTERVAL_CHANGED, payload, EventSource.WEB, NOW));

        assertTrue(error.getMessage().contains("IntervalChanged"));
    }

    @Test
    void shouldRejectMissingFields() {
        EventPayload payload = new EventPayload.SoundUploaded(1, "a");

        assertThrows(NullPointerException.class, () -> DomainEvent.of(EventType.SOUND_UPLOADED, payload, null, NOW));
        assertThrows(NullPointerException.class,
                () -> DomainEvent.of(EventType.SOUND_UPLOADED, payload, EventSource.WEB, null));
        assertThrows(NullPointerException.class,
                () -> DomainEvent.of(EventType.SOUND_UPLOADED, null, EventSource.WEB, NOW));
    }

    @Test
    void shouldExposeTypedPayload() {
        DomainEvent event = DomainEvent.of(EventType.SOUND_RENAMED,
                new EventPayload.SoundRenamed(3, "old", "new"), EventSource.COMMAND, NOW);

        EventPayload.SoundRenamed renamed = event.payloadAs(EventPayload.SoundRenamed.class);

        assertEquals("old", renamed.oldName());
        assertEquals("new", renamed.newName());
        assertEquals("command", event.source().tag());
    }

    @Test
    void domainEventsShouldExcludeSystemSignals() {
        assertTrue(EventType.domainEvents().contains(EventType.NOTIFY_CHANNEL_CHANGED));
        assertFalse(EventType.domainEvents().contains(EventType.SHUTDOWN));
        assertFalse(EventType.domainEvents().contains(EventType.BOT_READY));
        assertEquals(6, EventType.domainEvents().size());
    }
}
