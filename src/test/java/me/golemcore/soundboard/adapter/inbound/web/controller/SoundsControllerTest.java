package me.golemcore.soundboard.adapter.inbound.web.controller;

import me.golemcore.soundboard.adapter.inbound.web.dto.RenameSoundRequest;
import me.golemcore.soundboard.adapter.inbound.web.dto.SoundDto;
import me.golemcore.soundboard.domain.exception.NotFoundException;
import me.golemcore.soundboard.domain.exception.ValidationException;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.model.Sound;
import me.golemcore.soundboard.domain.model.SoundSummary;
import me.golemcore.soundboard.domain.repository.SoundRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SoundsControllerTest {

    private static final Instant CREATED = Instant.parse("2026-02-01T10:00:00Z");
    private static final byte[] AUDIO = "ID3-fake-mp3".getBytes(StandardCharsets.UTF_8);

    private SoundRepository soundRepository;
    private SoundsController controller;

    @BeforeEach
    void setUp() {
        soundRepository = mock(SoundRepository.class);
        controller = new SoundsController(soundRepository);
    }

    @Test
    void shouldListSoundsWithoutPayloads() {
        when(soundRepository.list()).thenReturn(List.of(
                new SoundSummary(1, "airhorn.mp3", 1024, CREATED),
                new SoundSummary(2, "bell.ogg", 2048, CREATED)));

        StepVerifier.create(controller.list())
                .assertNext(response -> {
                    assertStatus(response, HttpStatus.OK);
                    List<SoundDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(2, body.size());
                    assertEquals("airhorn.mp3", body.get(0).getName());
                    assertEquals(2048L, body.get(1).getSizeBytes());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnSingleSound() {
        when(soundRepository.getSummary(1)).thenReturn(new SoundSummary(1, "airhorn.mp3", AUDIO.length, CREATED));

        StepVerifier.create(controller.get(1))
                .assertNext(response -> {
                    assertStatus(response, HttpStatus.OK);
                    assertEquals(AUDIO.length, response.getBody().getSizeBytes());
                    assertEquals(CREATED, response.getBody().getCreatedAt());
                })
                .verifyComplete();
        verify(soundRepository, never()).get(1);
    }

    @Test
    void shouldPropagateNotFound() {
        when(soundRepository.getSummary(99)).thenThrow(NotFoundException.sound(99));

        StepVerifier.create(controller.get(99))
                .expectError(NotFoundException.class)
                .verify();
    }

    @Test
    void shouldServeAudioAsAttachment() {
        when(soundRepository.get(1)).thenReturn(sound(1, "airhorn.mp3"));

        StepVerifier.create(controller.audio(1))
                .assertNext(response -> {
                    assertStatus(response, HttpStatus.OK);
                    assertEquals(MediaType.APPLICATION_OCTET_STREAM, response.getHeaders().getContentType());
                    String disposition = response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION);
                    assertNotNull(disposition);
                    assertTrue(disposition.startsWith("attachment"));
                    assertTrue(disposition.contains("airhorn.mp3"));
                    assertArrayEquals(AUDIO, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldUploadUsingExplicitName() {
        FilePart file = filePart("upload.mp3", AUDIO);
        when(soundRepository.create("Air Horn", AUDIO, EventSource.WEB)).thenReturn(sound(5, "Air Horn"));

        StepVerifier.create(controller.upload(file, "Air Horn"))
                .assertNext(response -> {
                    assertStatus(response, HttpStatus.CREATED);
                    assertEquals(5, response.getBody().getId());
                    assertEquals("Air Horn", response.getBody().getName());
                })
                .verifyComplete();
    }

    @Test
    void shouldFallBackToFilenameWhenNameMissing() {
        FilePart file = filePart("bell.ogg", AUDIO);
        when(soundRepository.create("bell.ogg", AUDIO, EventSource.WEB)).thenReturn(sound(6, "bell.ogg"));

        StepVerifier.create(controller.upload(file, "  "))
                .assertNext(response -> assertEquals("bell.ogg", response.getBody().getName()))
                .verifyComplete();
    }

    @Test
    void shouldPassEmptyPayloadToRepository() {
        FilePart file = mock(FilePart.class);
        when(file.filename()).thenReturn("empty.mp3");
        when(file.content()).thenReturn(Flux.empty());
        when(soundRepository.create(anyString(), any(byte[].class), eq(EventSource.WEB)))
                .thenThrow(new ValidationException("Sound payload is empty"));

        StepVerifier.create(controller.upload(file, null))
                .expectError(ValidationException.class)
                .verify();

        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);
        verify(soundRepository).create(eq("empty.mp3"), captor.capture(), eq(EventSource.WEB));
        assertEquals(0, captor.getValue().length);
    }

    @Test
    void shouldRejectOversizedUpload() {
        FilePart file = filePart("huge.wav", new byte[SoundsController.MAX_UPLOAD_BYTES + 1]);

        StepVerifier.create(controller.upload(file, null))
                .expectError(ValidationException.class)
                .verify();

        verify(soundRepository, never()).create(anyString(), any(byte[].class), any());
    }

    @Test
    void shouldRenameSound() {
        when(soundRepository.rename(3, "new name", EventSource.WEB))
                .thenReturn(new SoundSummary(3, "new name", 10, CREATED));

        StepVerifier.create(controller.rename(3, new RenameSoundRequest("new name")))
                .assertNext(response -> {
                    assertStatus(response, HttpStatus.OK);
                    assertEquals("new name", response.getBody().getName());
                })
                .verifyComplete();
    }

    @Test
    void shouldDeleteSound() {
        when(soundRepository.delete(3, EventSource.WEB)).thenReturn(new SoundSummary(3, "bell", 10, CREATED));

        StepVerifier.create(controller.delete(3))
                .assertNext(response -> assertStatus(response, HttpStatus.NO_CONTENT))
                .verifyComplete();

        verify(soundRepository).delete(3, EventSource.WEB);
    }

    private static FilePart filePart(String filename, byte[] bytes) {
        FilePart file = mock(FilePart.class);
        DataBuffer buffer = DefaultDataBufferFactory.sharedInstance.wrap(bytes);
        when(file.filename()).thenReturn(filename);
        when(file.content()).thenReturn(Flux.just(buffer));
        return file;
    }

    private static Sound sound(int id, String name) {
        return Sound.builder()
                .id(id)
                .name(name)
                .data(AUDIO)
                .createdAt(CREATED)
                .build();
    }

    private static void assertStatus(ResponseEntity<?> response, HttpStatus expected) {
        assertEquals(expected, response.getStatusCode());
    }
}
