package me.golemcore.soundboard.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Sound stored in the library. The audio payload is written once on upload and
 * never replaced; renaming only touches {@link #name}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Sound {

    private int id;
    private String name;

    @ToString.Exclude
    private byte[] data;

    private Instant createdAt;

    public SoundSummary toSummary() {
        return new SoundSummary(id, name, data != null ? data.length : 0, createdAt);
    }
}
