package me.golemcore.soundboard.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Connection to one voice channel of one guild.
 */
public interface VoiceSession {

    String channelId();

    boolean isConnected();

    /**
     * Move the session to another channel of the same guild.
     */
    CompletableFuture<Void> moveTo(String channelId);

    /**
     * Stream an encoded audio payload.
     *
     * @param audio
     *            payload as stored in the library
     * @param volumePercent
     *            playback volume in [0, 100]
     * @return future completed when playback finishes
     */
    CompletableFuture<Void> play(byte[] audio, int volumePercent);

    void stopPlayback();

    CompletableFuture<Void> disconnect();
}
