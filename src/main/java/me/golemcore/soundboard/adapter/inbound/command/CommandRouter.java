package me.golemcore.soundboard.adapter.inbound.command;

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

import me.golemcore.soundboard.domain.exception.SoundboardException;
import me.golemcore.soundboard.domain.model.EventSource;
import me.golemcore.soundboard.domain.model.SoundSummary;
import me.golemcore.soundboard.domain.repository.ConfigRepository;
import me.golemcore.soundboard.domain.repository.SoundRepository;
import me.golemcore.soundboard.infrastructure.config.SoundboardProperties;
import me.golemcore.soundboard.infrastructure.i18n.MessageService;
import me.golemcore.soundboard.playback.PlaybackScheduler;
import me.golemcore.soundboard.port.inbound.CommandPort;
import me.golemcore.soundboard.port.outbound.VoiceGatewayPort;
import me.golemcore.soundboard.port.outbound.VoiceSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes text commands to the repositories and the playback scheduler.
 *
 * <ul>
 * <li>ping - Check that the bot is alive
 * <li>help - Show available commands
 * <li>list - Show the sound library
 * <li>status - Scheduler state, settings and voice connection
 * <li>nextsound - Time until the next cycle
 * <li>volume [0-100] - Show or set the volume
 * <li>interval [30-3600] - Show or set the interval
 * <li>rename &lt;id&gt; &lt;name&gt; - Rename a sound
 * <li>delete &lt;id&gt; - Delete a sound
 * <li>notify [channelId|off] - Show, set or disable the notification channel
 * </ul>
 *
 * <p>
 * Mutations are tagged with source {@code command}. Validation and lookup
 * errors are returned as failed results, never thrown.
 *
 * @see CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    static final int LIST_LIMIT = 45;

    private static final String CMD_PING = "ping";
    private static final String CMD_HELP = "help";
    private static final String CMD_LIST = "list";
    private static final String CMD_STATUS = "status";
    private static final String CMD_NEXTSOUND = "nextsound";
    private static final String CMD_VOLUME = "volume";
    private static final String CMD_INTERVAL = "interval";
    private static final String CMD_RENAME = "rename";
    private static final String CMD_DELETE = "delete";
    private static final String CMD_NOTIFY = "notify";
    private static final String NOTIFY_OFF = "off";
    private static final String MSG_USAGE = "command.error.usage";

    private static final List<CommandUsage> DEFINITIONS = List.of(
            new CommandUsage(CMD_PING, CMD_PING, "command.ping.description"),
            new CommandUsage(CMD_HELP, CMD_HELP, "command.help.description"),
            new CommandUsage(CMD_LIST, CMD_LIST, "command.list.description"),
            new CommandUsage(CMD_STATUS, CMD_STATUS, "command.status.description"),
            new CommandUsage(CMD_NEXTSOUND, CMD_NEXTSOUND, "command.nextsound.description"),
            new CommandUsage(CMD_VOLUME, "volume [0-100]", "command.volume.description"),
            new CommandUsage(CMD_INTERVAL, "interval [30-3600]", "command.interval.description"),
            new CommandUsage(CMD_RENAME, "rename <id> <name>", "command.rename.description"),
            new CommandUsage(CMD_DELETE, "delete <id>", "command.delete.description"),
            new CommandUsage(CMD_NOTIFY, "notify [channelId|off]", "command.notify.description"));

    private static final Set<String> KNOWN_COMMAND_SET = Set.of(
            CMD_PING, CMD_HELP, CMD_LIST, CMD_STATUS, CMD_NEXTSOUND,
            CMD_VOLUME, CMD_INTERVAL, CMD_RENAME, CMD_DELETE, CMD_NOTIFY);

    private final SoundRepository soundRepository;
    private final ConfigRepository configRepository;
    private final PlaybackScheduler playbackScheduler;
    private final VoiceGatewayPort voiceGateway;
    private final MessageService messageService;
    private final String guildId;

    public CommandRouter(SoundRepository soundRepository, ConfigRepository configRepository,
            PlaybackScheduler playbackScheduler, VoiceGatewayPort voiceGateway,
            MessageService messageService, SoundboardProperties properties) {
        this.soundRepository = soundRepository;
        this.configRepository = configRepository;
        this.playbackScheduler = playbackScheduler;
        this.voiceGateway = voiceGateway;
        this.messageService = messageService;
        this.guildId = properties.getGuildId();
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMAND_SET);
    }

    @Override
    public CompletableFuture<CommandReply> execute(CommandRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String command = request.command();
            List<String> args = request.args();
            String name = command.toLowerCase(Locale.ROOT);
            log.debug("[Command] Executing {} {}", name, args);
            if (!hasCommand(name)) {
                return CommandReply.error(msg("command.error.unknown", command));
            }
            try {
                return switch (name) {
                case CMD_PING -> handlePing(request.sender());
                case CMD_HELP -> handleHelp();
                case CMD_LIST -> handleList();
                case CMD_STATUS -> handleStatus();
                case CMD_NEXTSOUND -> handleNextSound();
                case CMD_VOLUME -> handleVolume(args);
                case CMD_INTERVAL -> handleInterval(args);
                case CMD_RENAME -> handleRename(args);
                case CMD_DELETE -> handleDelete(args);
                case CMD_NOTIFY -> handleNotify(args);
                default -> CommandReply.error(msg("command.error.unknown", command));
                };
            } catch (SoundboardException e) {
                log.info("[Command] {} rejected: {}", name, e.getMessage());
                return CommandReply.error(msg("command.error.failed", e.getMessage()));
            }
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return command != null && KNOWN_COMMAND_SET.contains(command.toLowerCase(Locale.ROOT));
    }

    @Override
    public List<CommandUsage> listCommands() {
        return DEFINITIONS.stream()
                .map(def -> new CommandUsage(def.name(), def.usage(), msg(def.description())))
                .toList();
    }

    private CommandReply handlePing(String sender) {
        String senderName = sender != null && !sender.isBlank() ? sender : "friend";
        return CommandReply.ok(msg("command.ping.reply", senderName));
    }

    private CommandReply handleHelp() {
        StringBuilder sb = new StringBuilder(msg("command.help.header"));
        for (CommandUsage def : listCommands()) {
            sb.append("\n• `").append(def.usage()).append("` - ").append(def.description());
        }
        return CommandReply.ok(sb.toString());
    }

    private CommandReply handleList() {
        List<SoundSummary> sounds = soundRepository.list();
        if (sounds.isEmpty()) {
            return CommandReply.ok(msg("command.list.empty"), sounds);
        }
        StringBuilder sb = new StringBuilder(msg("command.list.header", String.valueOf(sounds.size())));
        sounds.stream()
                .limit(LIST_LIMIT)
                .forEach(sound -> sb.append("\n• `").append(sound.name()).append('`'));
        if (sounds.size() > LIST_LIMIT) {
            sb.append('\n').append(msg("command.list.more", String.valueOf(sounds.size() - LIST_LIMIT)));
        }
        return CommandReply.ok(sb.toString(), sounds);
    }

    private CommandReply handleStatus() {
        StringBuilder sb = new StringBuilder(msg("command.status.title")).append('\n');
        sb.append(playbackScheduler.isRunning()
                ? msg("command.status.service.active")
                : msg("command.status.service.stopped")).append('\n');
        sb.append(msg("command.status.state", playbackScheduler.getState().name())).append('\n');

        Optional<VoiceSession> session = voiceGateway.getActiveSession(guildId)
                .filter(VoiceSession::isConnected);
        sb.append(session.map(s -> msg("command.status.voice.connected", s.channelId()))
                .orElseGet(() -> msg("command.status.voice.disconnected"))).append('\n');

        sb.append(msg("command.status.interval", String.valueOf(configRepository.getInterval()))).append('\n');
        sb.append(msg("command.status.volume", String.valueOf(configRepository.getVolume()))).append('\n');
        sb.append(msg("command.status.sounds", String.valueOf(soundRepository.count())));
        playbackScheduler.getTimeUntilNextTick()
                .ifPresent(left -> sb.append('\n')
                        .append(msg("command.status.next", String.valueOf(left.toSeconds()))));
        return CommandReply.ok(sb.toString());
    }

    private CommandReply handleNextSound() {
        Optional<Duration> left = playbackScheduler.getTimeUntilNextTick();
        if (left.isEmpty()) {
            return CommandReply.ok(msg("command.nextsound.stopped"));
        }
        long seconds = left.get().toSeconds();
        if (seconds == 0) {
            return CommandReply.ok(msg("command.nextsound.now"));
        }
        return CommandReply.ok(msg("command.nextsound.in", String.valueOf(seconds)));
    }

    private CommandReply handleVolume(List<String> args) {
        if (args.isEmpty()) {
            return CommandReply.ok(msg("command.volume.current", String.valueOf(configRepository.getVolume())));
        }
        Optional<Integer> level = parseInt(args.get(0));
        if (level.isEmpty()) {
            return CommandReply.error(msg("command.error.number", args.get(0)));
        }
        int percent = level.get();
        int old = configRepository.setVolume(percent, EventSource.COMMAND);
        return CommandReply.ok(msg("command.volume.changed", volumeEmoji(percent),
                String.valueOf(old), String.valueOf(percent)));
    }

    private CommandReply handleInterval(List<String> args) {
        if (args.isEmpty()) {
            return CommandReply.ok(
                    msg("command.interval.current", String.valueOf(configRepository.getInterval())));
        }
        Optional<Integer> seconds = parseInt(args.get(0));
        if (seconds.isEmpty()) {
            return CommandReply.error(msg("command.error.number", args.get(0)));
        }
        int old = configRepository.setInterval(seconds.get(), EventSource.COMMAND);
        return CommandReply.ok(msg("command.interval.changed",
                String.valueOf(old), String.valueOf(seconds.get())));
    }

    private CommandReply handleRename(List<String> args) {
        if (args.size() < 2) {
            return CommandReply.error(msg(MSG_USAGE, "rename <id> <name>"));
        }
        Optional<Integer> id = parseInt(args.get(0));
        if (id.isEmpty()) {
            return CommandReply.error(msg("command.error.number", args.get(0)));
        }
        String newName = String.join(" ", args.subList(1, args.size()));
        String oldName = soundRepository.get(id.get()).getName();
        SoundSummary renamed = soundRepository.rename(id.get(), newName, EventSource.COMMAND);
        return CommandReply.ok(msg("command.rename.done", oldName, renamed.name()), renamed);
    }

    private CommandReply handleDelete(List<String> args) {
        if (args.size() != 1) {
            return CommandReply.error(msg(MSG_USAGE, "delete <id>"));
        }
        Optional<Integer> id = parseInt(args.get(0));
        if (id.isEmpty()) {
            return CommandReply.error(msg("command.error.number", args.get(0)));
        }
        SoundSummary deleted = soundRepository.delete(id.get(), EventSource.COMMAND);
        return CommandReply.ok(msg("command.delete.done", deleted.name()), deleted);
    }

    private CommandReply handleNotify(List<String> args) {
        if (args.isEmpty()) {
            return CommandReply.ok(configRepository.getNotifyChannel()
                    .map(channel -> msg("command.notify.current", channel))
                    .orElseGet(() -> msg("command.notify.none")));
        }
        String value = args.get(0);
        if (NOTIFY_OFF.equalsIgnoreCase(value)) {
            configRepository.setNotifyChannel(null, EventSource.COMMAND);
            return CommandReply.ok(msg("command.notify.cleared"));
        }
        configRepository.setNotifyChannel(value, EventSource.COMMAND);
        return CommandReply.ok(msg("command.notify.set", value.trim()));
    }

    static String volumeEmoji(int percent) {
        if (percent == 0) {
            return "🔇";
        }
        if (percent < 33) {
            return "🔈";
        }
        if (percent < 66) {
            return "🔉";
        }
        return "🔊";
    }

    private static Optional<Integer> parseInt(String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
