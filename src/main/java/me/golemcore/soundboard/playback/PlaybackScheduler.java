package me.golemcore.soundboard.playback;

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

import me.golemcore.soundboard.domain.exception.VoiceConnectionException;
import me.golemcore.soundboard.domain.model.DomainEvent;
import me.golemcore.soundboard.domain.model.EventPayload;
import me.golemcore.soundboard.domain.model.EventType;
import me.golemcore.soundboard.domain.model.PlaybackState;
import me.golemcore.soundboard.domain.model.Sound;
import me.golemcore.soundboard.domain.model.VoiceChannel;
import me.golemcore.soundboard.domain.repository.ConfigRepository;
import me.golemcore.soundboard.domain.repository.SoundRepository;
import me.golemcore.soundboard.infrastructure.config.SoundboardProperties;
import me.golemcore.soundboard.infrastructure.event.EventBus;
import me.golemcore.soundboard.infrastructure.event.Subscription;
import me.golemcore.soundboard.port.outbound.VoiceGatewayPort;
import me.golemcore.soundboard.port.outbound.VoiceSession;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically plays a random sound in the most populated voice channel of the
 * configured guild.
 *
 * <p>
 * Each cycle walks {@code IDLE -> SELECTING_CHANNEL -> CONNECTING -> PLAYING -> IDLE};
 * any failure returns to {@code IDLE}, is logged and never stops the timer.
 *
 * <p>
 * Threads:
 * <ul>
 * <li>{@code playback-timer} arms one pending wait at a time. Every armed wait
 * carries a generation number; changing the interval bumps the generation and
 * rearms, and a wait that fires with a stale generation is ignored.</li>
 * <li>{@code playback-cycle} runs the cycle. Only one cycle is in flight; a
 * tick arriving meanwhile is dropped.</li>
 * </ul>
 *
 * <p>
 * The voice session belongs to the {@link VoiceGatewayPort}; the scheduler
 * looks up the active session of the guild on every cycle and stays connected
 * between cycles unless {@code leave-after-empty-cycles} is set.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class PlaybackScheduler {

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration TEARDOWN_WAIT = STOP_TIMEOUT.multipliedBy(3);

    /**
     * How a single cycle ended.
     */
    public enum CycleOutcome {
        NO_LISTENERS, CONNECTION_FAILED, EMPTY_LIBRARY, PLAYED, PLAYBACK_TIMED_OUT, FAILED
    }

    private final SoundRepository soundRepository;
    private final ConfigRepository configRepository;
    private final VoiceGatewayPort voiceGateway;
    private final EventBus eventBus;
    private final Clock clock;
    private final String guildId;
    private final Duration maxDuration;
    private final Duration connectTimeout;
    private final int leaveAfterEmptyCycles;

    private final AtomicReference<PlaybackState> state = new AtomicReference<>(PlaybackState.IDLE);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger emptyCycles = new AtomicInteger();
    private final Object timerLock = new Object();

    private ScheduledExecutorService timer;
    private ExecutorService cycleExecutor;
    private ScheduledFuture<?> pendingTick;
    private volatile Future<?> currentCycle;
    private volatile Instant nextTickAt;
    private volatile int intervalSeconds;
    private volatile Subscription subscription;
    private volatile CountDownLatch teardownDone = new CountDownLatch(0);

    public PlaybackScheduler(SoundRepository soundRepository, ConfigRepository configRepository,
            VoiceGatewayPort voiceGateway, EventBus eventBus, SoundboardProperties properties, Clock clock) {
        this.soundRepository = soundRepository;
        this.configRepository = configRepository;
        this.voiceGateway = voiceGateway;
        this.eventBus = eventBus;
        this.clock = clock;
        this.guildId = properties.getGuildId();
        this.maxDuration = properties.getPlayback().getMaxDuration();
        this.connectTimeout = properties.getPlayback().getConnectTimeout();
        this.leaveAfterEmptyCycles = properties.getPlayback().getLeaveAfterEmptyCycles();
    }

    /**
     * Subscribes to interval changes and shutdown, then arms the first wait with
     * the stored interval. Calling it on a running scheduler does nothing.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        teardownDone = new CountDownLatch(1);
        executing.set(false);
        emptyCycles.set(0);
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "playback-timer");
            t.setDaemon(true);
            return t;
        });
        cycleExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "playback-cycle");
            t.setDaemon(true);
            return t;
        });
        subscription = eventBus.subscribe("playback-scheduler",
                EnumSet.of(EventType.INTERVAL_CHANGED, EventType.SHUTDOWN), this::onEvent);

        int interval = configRepository.getInterval();
        arm(interval);
        log.info("[Playback] Started for guild {} with interval {}s", guildId, interval);
    }

    /**
     * Cancels the pending wait, interrupts an in-flight cycle, stops playback and
     * disconnects the voice session. Safe to call more than once and from
     * several threads: the teardown runs once, and a caller that arrives while
     * it is in progress returns only after it finished.
     */
    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            awaitTeardown();
            return;
        }
        try {
            tearDown();
        } finally {
            teardownDone.countDown();
        }
    }

    private void awaitTeardown() {
        try {
            if (!teardownDone.await(TEARDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Playback] Teardown still running after {}", TEARDOWN_WAIT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void tearDown() {
        Subscription current = subscription;
        subscription = null;
        if (current != null) {
            current.cancel();
        }

        synchronized (timerLock) {
            generation.incrementAndGet();
            if (pendingTick != null) {
                pendingTick.cancel(false);
                pendingTick = null;
            }
            nextTickAt = null;
        }
        timer.shutdownNow();

        Future<?> cycle = currentCycle;
        if (cycle != null) {
            cycle.cancel(true);
        }
        cycleExecutor.shutdownNow();
        try {
            if (!cycleExecutor.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Playback] Cycle did not finish within {}", STOP_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        disconnectActiveSession();
        state.set(PlaybackState.IDLE);
        log.info("[Playback] Stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public PlaybackState getState() {
        return state.get();
    }

    /**
     * Time left until the pending wait fires, or empty when the scheduler is not
     * running.
     */
    public Optional<Duration> getTimeUntilNextTick() {
        Instant at = nextTickAt;
        if (at == null) {
            return Optional.empty();
        }
        Duration remaining = Duration.between(clock.instant(), at);
        return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
    }

    /**
     * Starts a cycle on the cycle thread unless one is already running.
     *
     * @return {@code true} if a cycle was started
     */
    public boolean triggerCycle() {
        if (!running.get()) {
            return false;
        }
        if (!executing.compareAndSet(false, true)) {
            log.warn("[Playback] Tick dropped: previous cycle still in progress");
            return false;
        }
        try {
            currentCycle = cycleExecutor.submit(() -> {
                try {
                    runCycle();
                } finally {
                    executing.set(false);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            executing.set(false);
            log.debug("[Playback] Cycle rejected, scheduler is stopping");
            return false;
        }
    }

    long currentGeneration() {
        return generation.get();
    }

    void onEvent(DomainEvent event) {
        switch (event.type()) {
        case INTERVAL_CHANGED -> {
            EventPayload.IntervalChanged change = event.payloadAs(EventPayload.IntervalChanged.class);
            log.info("[Playback] Interval changed {}s -> {}s, rearming", change.oldSeconds(), change.newSeconds());
            arm(change.newSeconds());
        }
        case SHUTDOWN -> stop();
        default -> log.debug("[Playback] Ignoring {}", event.type());
        }
    }

    void onTimer(long firedGeneration) {
        synchronized (timerLock) {
            if (!running.get() || firedGeneration != generation.get()) {
                log.debug("[Playback] Ignoring stale tick (generation {})", firedGeneration);
                return;
            }
        }
        try {
            triggerCycle();
        } finally {
            arm(intervalSeconds);
        }
    }

    private void arm(int seconds) {
        synchronized (timerLock) {
            if (!running.get()) {
                return;
            }
            intervalSeconds = seconds;
            long armedGeneration = generation.incrementAndGet();
            if (pendingTick != null) {
                pendingTick.cancel(false);
            }
            nextTickAt = clock.instant().plusSeconds(seconds);
            try {
                pendingTick = timer.schedule(() -> onTimer(armedGeneration), seconds, TimeUnit.SECONDS);
            } catch (RejectedExecutionException e) {
                nextTickAt = null;
                log.debug("[Playback] Timer is shut down, not rearming");
            }
        }
    }

    /**
     * Runs one cycle on the calling thread. Never throws; the scheduler is always
     * back in {@link PlaybackState#IDLE} when this returns.
     */
    CycleOutcome runCycle() {
        try {
            return doCycle();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Playback] Cycle interrupted");
            return CycleOutcome.FAILED;
        } catch (Exception e) {
            log.error("[Playback] Cycle failed: {}", e.getMessage(), e);
            return CycleOutcome.FAILED;
        } finally {
            state.set(PlaybackState.IDLE);
        }
    }

    private CycleOutcome doCycle() throws InterruptedException {
        state.set(PlaybackState.SELECTING_CHANNEL);
        Optional<VoiceChannel> target = selectChannel(voiceGateway.listVoiceChannels(guildId));
        if (target.isEmpty()) {
            log.debug("[Playback] No populated voice channel in guild {}", guildId);
            onEmptyCycle();
            return CycleOutcome.NO_LISTENERS;
        }
        emptyCycles.set(0);
        VoiceChannel channel = target.get();

        state.set(PlaybackState.CONNECTING);
        VoiceSession session;
        try {
            session = ensureSession(channel);
        } catch (VoiceConnectionException e) {
            log.warn("[Playback] Could not join '{}': {}", channel.name(), e.getMessage());
            return CycleOutcome.CONNECTION_FAILED;
        }

        int volume = configRepository.getVolume();
        Optional<Sound> picked = soundRepository.randomPick();
        if (picked.isEmpty()) {
            log.info("[Playback] Library is empty, nothing to play");
            return CycleOutcome.EMPTY_LIBRARY;
        }

        state.set(PlaybackState.PLAYING);
        return play(session, channel, picked.get(), volume);
    }

    /**
     * Channel with the strictly greatest member count; the first one wins a tie.
     * Channels without members are never chosen.
     */
    static Optional<VoiceChannel> selectChannel(List<VoiceChannel> channels) {
        VoiceChannel best = null;
        for (VoiceChannel channel : channels) {
            if (channel.memberCount() > 0 && (best == null || channel.memberCount() > best.memberCount())) {
                best = channel;
            }
        }
        return Optional.ofNullable(best);
    }

    private VoiceSession ensureSession(VoiceChannel channel) throws InterruptedException {
        Optional<VoiceSession> active = voiceGateway.getActiveSession(guildId).filter(VoiceSession::isConnected);
        if (active.isPresent()) {
            VoiceSession session = active.get();
            if (channel.id().equals(session.channelId())) {
                return session;
            }
            log.info("[Playback] Moving to '{}' ({} members)", channel.name(), channel.memberCount());
            awaitVoice(session.moveTo(channel.id()), "move to " + channel.name());
            return session;
        }
        log.info("[Playback] Joining '{}' ({} members)", channel.name(), channel.memberCount());
        return awaitVoice(voiceGateway.connect(guildId, channel), "connect to " + channel.name());
    }

    private <T> T awaitVoice(CompletableFuture<T> future, String action) throws InterruptedException {
        try {
            return future.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new VoiceConnectionException("Timed out after " + connectTimeout + " trying to " + action);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof VoiceConnectionException vce) {
                throw vce;
            }
            throw new VoiceConnectionException("Failed to " + action + ": " + cause.getMessage(), cause);
        }
    }

    private CycleOutcome play(VoiceSession session, VoiceChannel channel, Sound sound, int volume)
            throws InterruptedException {
        log.info("[Playback] Playing '{}' in '{}' at {}%", sound.getName(), channel.name(), volume);
        CompletableFuture<Void> playback = session.play(sound.getData(), volume);
        try {
            playback.get(maxDuration.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("[Playback] Finished '{}'", sound.getName());
            return CycleOutcome.PLAYED;
        } catch (TimeoutException e) {
            session.stopPlayback();
            playback.cancel(true);
            log.warn("[Playback] '{}' exceeded {}, stopped", sound.getName(), maxDuration);
            return CycleOutcome.PLAYBACK_TIMED_OUT;
        } catch (ExecutionException e) {
            log.error("[Playback] Playing '{}' failed: {}", sound.getName(), e.getCause().getMessage());
            return CycleOutcome.FAILED;
        } catch (InterruptedException e) {
            session.stopPlayback();
            throw e;
        }
    }

    private void onEmptyCycle() {
        if (leaveAfterEmptyCycles <= 0) {
            return;
        }
        int count = emptyCycles.incrementAndGet();
        if (count >= leaveAfterEmptyCycles) {
            emptyCycles.set(0);
            if (voiceGateway.getActiveSession(guildId).isPresent()) {
                log.info("[Playback] No listeners for {} cycle(s), leaving voice", count);
                disconnectActiveSession();
            }
        }
    }

    private void disconnectActiveSession() {
        try {
            Optional<VoiceSession> active = voiceGateway.getActiveSession(guildId);
            if (active.isEmpty()) {
                return;
            }
            VoiceSession session = active.get();
            session.stopPlayback();
            session.disconnect().get(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Playback] Disconnected from voice");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Playback] Interrupted while disconnecting");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Playback] Disconnect failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[Playback] Disconnect failed: {}", e.getMessage());
        }
    }
}
