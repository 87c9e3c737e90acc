package me.golemcore.soundboard.adapter.inbound.web.controller;

import me.golemcore.soundboard.adapter.inbound.web.dto.IntervalRequest;
import me.golemcore.soundboard.adapter.inbound.web.dto.NotifyChannelRequest;
import me.golemcore.soundboard.adapter.inbound.web.dto.VolumeRequest;
import me.golemcore.soundboard.domain.exception.ValidationException;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.repository.ConfigRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SettingsControllerTest {

    private ConfigRepository configRepository;
    private SettingsController controller;

    @BeforeEach
    void setUp() {
        configRepository = mock(ConfigRepository.class);
        controller = new SettingsController(configRepository);
        when(configRepository.getInterval()).thenReturn(30);
        when(configRepository.getVolume()).thenReturn(100);
        when(configRepository.getNotifyChannel()).thenReturn(Optional.empty());
    }

    @Test
    void shouldReturnCurrentSettings() {
        StepVerifier.create(controller.getSettings())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(30, response.getBody().getInterval());
                    assertEquals(100, response.getBody().getVolume());
                    assertNull(response.getBody().getNotifyChannelId());
                })
                .verifyComplete();
    }

    @Test
    void shouldUpdateIntervalWithWebSource() {
        when(configRepository.getInterval()).thenReturn(600);

        StepVerifier.create(controller.updateInterval(new IntervalRequest(600)))
                .assertNext(response -> assertEquals(600, response.getBody().getInterval()))
                .verifyComplete();

        verify(configRepository).setInterval(600, EventSource.WEB);
    }

    @Test
    void shouldRejectMissingInterval() {
        StepVerifier.create(controller.updateInterval(new IntervalRequest(null)))
                .expectError(ValidationException.class)
                .verify();

        verify(configRepository, never()).setInterval(anyInt(), any());
    }

    @Test
    void shouldPropagateOutOfRangeVolume() {
        when(configRepository.setVolume(101, EventSource.WEB))
                .thenThrow(new ValidationException("Volume must be between 0 and 100"));

        StepVerifier.create(controller.updateVolume(new VolumeRequest(101)))
                .expectErrorMessage("Volume must be between 0 and 100")
                .verify();
    }

    @Test
    void shouldUpdateVolume() {
        when(configRepository.getVolume()).thenReturn(25);

        StepVerifier.create(controller.updateVolume(new VolumeRequest(25)))
                .assertNext(response -> assertEquals(25, response.getBody().getVolume()))
                .verifyComplete();

        verify(configRepository).setVolume(25, EventSource.WEB);
    }

    @Test
    void shouldSetAndClearNotifyChannel() {
        when(configRepository.getNotifyChannel()).thenReturn(Optional.of("777"));

        StepVerifier.create(controller.updateNotifyChannel(new NotifyChannelRequest("777")))
                .assertNext(response -> assertEquals("777", response.getBody().getNotifyChannelId()))
                .verifyComplete();
        verify(configRepository).setNotifyChannel("777", EventSource.WEB);

        when(configRepository.getNotifyChannel()).thenReturn(Optional.empty());
        StepVerifier.create(controller.updateNotifyChannel(new NotifyChannelRequest(null)))
                .assertNext(response -> assertNull(response.getBody().getNotifyChannelId()))
                .verifyComplete();
        verify(configRepository).setNotifyChannel(null, EventSource.WEB);
    }
}
