package me.golemcore.soundboard.domain.repository;

import me.golemcore.soundboard.adapter.outbound.storage.JdbcStorageAdapter;
import me.golemcore.soundboard.domain.exception.NotFoundException;
import me.golemcore.soundboard.domain.exception.ValidationException;
import me.golemcore.soundboard.domain.model.DomainEvent;
import me.golemcore.soundboard.domain.model.EventPayload;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.model.EventType;
import me.golemcore.soundboard.domain.model.Sound;
import me.golemcore.soundboard.domain.model.SoundSummary;
import me.golemcore.soundboard.infrastructure.event.EventBus;
import me.golemcore.soundboard.testsupport.InMemoryStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.ArgumentMatchers.any;

class SoundRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final byte[] AUDIO = { 1, 2, 3, 4 };

    private JdbcStorageAdapter storage;
    private EventBus eventBus;
    private SoundRepository repository;

    @BeforeEach
    void setUp() {
        storage = InMemoryStorage.create();
        eventBus = mock(EventBus.class);
        repository = new SoundRepository(storage, eventBus, Clock.fixed(NOW, ZoneOffset.UTC), new Random(42));
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    @Test
    void shouldCreateSoundAndPublishUploadedEvent() {
        Sound sound = repository.create("  airhorn.mp3 ", AUDIO, EventSource.WEB);

        assertEquals("airhorn.mp3", sound.getName());
        assertEquals(NOW, sound.getCreatedAt());
        assertArrayEquals(AUDIO, repository.get(sound.getId()).getData());

        DomainEvent event = captureSingleEvent();
        assertEquals(EventType.SOUND_UPLOADED, event.type());
        assertEquals(EventSource.WEB, event.source());
        assertEquals(new EventPayload.SoundUploaded(sound.getId(), "airhorn.mp3"), event.payload());
    }

    @Test
    void shouldRejectDuplicateNameIgnoringCase() {
        repository.create("Boom.wav", AUDIO, EventSource.WEB);

        ValidationException error = assertThrows(ValidationException.class,
                () -> repository.create("boom.WAV", AUDIO, EventSource.COMMAND));

        assertTrue(error.getMessage().contains("already exists"));
        assertEquals(1, repository.count());
        verify(eventBus, times(1)).publish(any(DomainEvent.class));
    }

    @Test
    void shouldRejectBlankOrOversizedNamesWithoutPublishing() {
        assertThrows(ValidationException.class, () -> repository.create("   ", AUDIO, EventSource.WEB));
        assertThrows(ValidationException.class, () -> repository.create("x".repeat(256), AUDIO, EventSource.WEB));
        assertThrows(ValidationException.class, () -> repository.create("empty", new byte[0], EventSource.WEB));

        assertEquals(0, repository.count());
        verify(eventBus, never()).publish(any(DomainEvent.class));
    }

    @Test
    void shouldRenameAndPublishOldAndNewName() {
        Sound sound = repository.create("old.mp3", AUDIO, EventSource.WEB);

        SoundSummary renamed = repository.rename(sound.getId(), "new.mp3", EventSource.COMMAND);

        assertEquals("new.mp3", renamed.name());
        assertEquals(AUDIO.length, renamed.sizeBytes());
        assertArrayEquals(AUDIO, repository.get(sound.getId()).getData());
        assertTrue(repository.findByName("NEW.MP3").isPresent());
        assertTrue(repository.findByName("old.mp3").isEmpty());

        ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(eventBus, times(2)).publish(captor.capture());
        DomainEvent event = captor.getAllValues().get(1);
        assertEquals(EventType.SOUND_RENAMED, event.type());
        assertEquals(new EventPayload.SoundRenamed(sound.getId(), "old.mp3", "new.mp3"), event.payload());
        assertEquals(EventSource.COMMAND, event.source());
    }

    @Test
    void shouldAllowRenamingToDifferentCasingOfOwnName() {
        Sound sound = repository.create("loud.mp3", AUDIO, EventSource.WEB);

        SoundSummary renamed = repository.rename(sound.getId(), "LOUD.mp3", EventSource.WEB);

        assertEquals("LOUD.mp3", renamed.name());
    }

    @Test
    void shouldRejectRenameCollidingWithAnotherSound() {
        Sound first = repository.create("a.mp3", AUDIO, EventSource.WEB);
        repository.create("b.mp3", AUDIO, EventSource.WEB);

        assertThrows(ValidationException.class, () -> repository.rename(first.getId(), "B.MP3", EventSource.WEB));

        assertEquals("a.mp3", repository.get(first.getId()).getName());
        verify(eventBus, times(2)).publish(any(DomainEvent.class));
    }

    @Test
    void shouldReportNotFoundForUnknownIds() {
        assertThrows(NotFoundException.class, () -> repository.get(99));
        assertThrows(NotFoundException.class, () -> repository.rename(99, "x", EventSource.WEB));
        assertThrows(NotFoundException.class, () -> repository.delete(99, EventSource.WEB));
        verify(eventBus, never()).publish(any(DomainEvent.class));
    }

    @Test
    void shouldDeleteAndPublishDeletedEvent() {
        Sound sound = repository.create("gone.mp3", AUDIO, EventSource.WEB);

        repository.delete(sound.getId(), EventSource.WEB);

        assertThrows(NotFoundException.class, () -> repository.get(sound.getId()));
        ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(eventBus, times(2)).publish(captor.capture());
        assertEquals(new EventPayload.SoundDeleted(sound.getId(), "gone.mp3"), captor.getValue().payload());
    }

    @Test
    void shouldListSummariesOrderedByNameIgnoringCase() {
        repository.create("charlie", new byte[] { 1 }, EventSource.WEB);
        repository.create("Alpha", new byte[] { 1, 2 }, EventSource.WEB);
        repository.create("bravo", new byte[] { 1, 2, 3 }, EventSource.WEB);

        List<SoundSummary> sounds = repository.list();

        assertEquals(List.of("Alpha", "bravo", "charlie"), sounds.stream().map(SoundSummary::name).toList());
        assertEquals(2, sounds.get(0).sizeBytes());
    }

    @Test
    void shouldReturnSummaryWithSizeOfStoredPayload() {
        Sound sound = repository.create("siren.ogg", new byte[] { 1, 2, 3, 4, 5 }, EventSource.WEB);

        SoundSummary summary = repository.getSummary(sound.getId());

        assertEquals(sound.getId(), summary.id());
        assertEquals("siren.ogg", summary.name());
        assertEquals(5, summary.sizeBytes());
        assertEquals(sound.getCreatedAt(), summary.createdAt());
        assertThrows(NotFoundException.class, () -> repository.getSummary(99));
    }

    @Test
    void randomPickShouldReturnEmptyForEmptyLibrary() {
        assertTrue(repository.randomPick().isEmpty());
    }

    @Test
    void randomPickShouldCoverEverySound() {
        repository.create("one", AUDIO, EventSource.WEB);
        repository.create("two", AUDIO, EventSource.WEB);
        repository.create("three", AUDIO, EventSource.WEB);

        Map<String, Integer> hits = new HashMap<>();
        for (int i = 0; i < 300; i++) {
            Optional<Sound> pick = repository.randomPick();
            assertTrue(pick.isPresent());
            hits.merge(pick.get().getName(), 1, Integer::sum);
        }

        assertEquals(3, hits.size());
        hits.values().forEach(count -> assertTrue(count > 50, "uneven pick distribution: " + hits));
    }

    @Test
    void findByNameShouldIgnoreBlankInput() {
        assertFalse(repository.findByName(" ").isPresent());
        assertFalse(repository.findByName(null).isPresent());
    }

    private DomainEvent captureSingleEvent() {
        ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(eventBus).publish(captor.capture());
        return captor.getValue();
    }
}
