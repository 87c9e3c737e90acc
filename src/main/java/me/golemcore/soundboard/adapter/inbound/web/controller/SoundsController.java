package me.golemcore.soundboard.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.soundboard.adapter.inbound.web.dto.RenameSoundRequest;
import me.golemcore.soundboard.adapter.inbound.web.dto.SoundDto;
import me.golemcore.soundboard.domain.exception.ValidationException;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.model.Sound;
import me.golemcore.soundboard.domain.repository.SoundRepository;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Sound library endpoints. Mutations are tagged with source {@code web}; unknown
 * ids answer 404 through {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/sounds")
@RequiredArgsConstructor
public class SoundsController {

    static final int MAX_UPLOAD_BYTES = 25 * 1024 * 1024;

    private final SoundRepository soundRepository;

    @GetMapping
    public Mono<ResponseEntity<List<SoundDto>>> list() {
        return Mono.fromCallable(() -> soundRepository.list().stream().map(SoundDto::from).toList())
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SoundDto>> get(@PathVariable int id) {
        return Mono.fromCallable(() -> SoundDto.from(soundRepository.getSummary(id)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}/audio")
    public Mono<ResponseEntity<byte[]>> audio(@PathVariable int id) {
        return Mono.fromCallable(() -> soundRepository.get(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(sound -> ResponseEntity.ok()
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                .filename(sound.getName())
                                .build()
                                .toString())
                        .body(sound.getData()));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<SoundDto>> upload(@RequestPart("file") FilePart file,
            @RequestPart(name = "name", required = false) String name) {
        String soundName = name != null && !name.isBlank() ? name : file.filename();
        return DataBufferUtils.join(file.content(), MAX_UPLOAD_BYTES)
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .onErrorMap(DataBufferLimitException.class,
                        e -> new ValidationException("Sound file exceeds " + MAX_UPLOAD_BYTES + " bytes"))
                .defaultIfEmpty(new byte[0])
                .publishOn(Schedulers.boundedElastic())
                .map(bytes -> soundRepository.create(soundName, bytes, EventSource.WEB))
                .map(Sound::toSummary)
                .map(summary -> ResponseEntity.status(HttpStatus.CREATED).body(SoundDto.from(summary)));
    }

    @PutMapping("/{id}/name")
    public Mono<ResponseEntity<SoundDto>> rename(@PathVariable int id, @RequestBody RenameSoundRequest request) {
        return Mono.fromCallable(() -> soundRepository.rename(id, request.getName(), EventSource.WEB))
                .subscribeOn(Schedulers.boundedElastic())
                .map(summary -> ResponseEntity.ok(SoundDto.from(summary)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable int id) {
        return Mono.fromCallable(() -> soundRepository.delete(id, EventSource.WEB))
                .subscribeOn(Schedulers.boundedElastic())
                .map(deleted -> ResponseEntity.noContent().<Void>build());
    }
}
