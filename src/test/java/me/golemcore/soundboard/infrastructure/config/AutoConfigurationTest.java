package me.golemcore.soundboard.infrastructure.config;

import me.golemcore.soundboard.domain.model.DomainEvent;
import me.golemcore.soundboard.domain.model.EventType;
import me.golemcore.soundboard.domain.repository.ConfigRepository;
import me.golemcore.soundboard.domain.repository.SoundRepository;
import me.golemcore.soundboard.infrastructure.event.EventBus;
import me.golemcore.soundboard.notification.NotificationDispatcher;
import me.golemcore.soundboard.playback.PlaybackScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    @Mock
    private EventBus eventBus;
    @Mock
    private SoundRepository soundRepository;
    @Mock
    private ConfigRepository configRepository;
    @Mock
    private PlaybackScheduler playbackScheduler;
    @Mock
    private NotificationDispatcher notificationDispatcher;

    private SoundboardProperties properties;
    private AutoConfiguration autoConfiguration;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new SoundboardProperties();
        properties.setGuildId("guild-1");
        when(configRepository.getNotifyChannel()).thenReturn(Optional.empty());
        autoConfiguration = new AutoConfiguration(properties, eventBus, soundRepository, configRepository,
                playbackScheduler, notificationDispatcher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void initShouldSeedThenStartServicesThenAnnounceReady() {
        autoConfiguration.init();

        InOrder order = inOrder(configRepository, notificationDispatcher, playbackScheduler, eventBus);
        order.verify(configRepository).seedDefaults();
        order.verify(notificationDispatcher).start();
        order.verify(playbackScheduler).start();
        ArgumentCaptor<DomainEvent> event = ArgumentCaptor.forClass(DomainEvent.class);
        order.verify(eventBus).publish(event.capture());
        assertEquals(EventType.BOT_READY, event.getValue().type());
        assertEquals(NOW, event.getValue().timestamp());
    }

    @Test
    void shutdownShouldAnnounceThenStopSchedulerThenDrainBus() {
        autoConfiguration.shutdown();

        InOrder order = inOrder(eventBus, playbackScheduler);
        ArgumentCaptor<DomainEvent> event = ArgumentCaptor.forClass(DomainEvent.class);
        order.verify(eventBus).publish(event.capture());
        order.verify(playbackScheduler).stop();
        order.verify(eventBus).shutdown(properties.getEvents().getDrainTimeout());
        assertEquals(EventType.SHUTDOWN, event.getValue().type());
    }

    @Test
    void shouldProvideClockAndObjectMapper() {
        assertNotNull(AutoConfiguration.clock());
        assertNotNull(AutoConfiguration.objectMapper());
        verify(eventBus, never()).publish(any());
    }
}
