package me.golemcore.soundboard.port.inbound;

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

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Chat command entry point. A chat adapter strips its prefix, turns the rest
 * of the message into a {@link CommandRequest} and posts the localized
 * {@link CommandReply} back to the channel.
 */
public interface CommandPort {

    CompletableFuture<CommandReply> execute(CommandRequest request);

    boolean hasCommand(String command);

    /**
     * Commands in help order, descriptions already localized.
     */
    List<CommandUsage> listCommands();

    /**
     * One command invocation. {@code sender} is the display name of the chat
     * user and may be {@code null}.
     */
    record CommandRequest(String command, List<String> args, String sender) {

        public CommandRequest {
            command = command == null ? "" : command;
            args = args == null ? List.of() : List.copyOf(args);
        }

        /**
         * Splits a message body such as {@code rename 4 big horn} on whitespace.
         */
        public static CommandRequest parse(String text, String sender) {
            String trimmed = text == null ? "" : text.trim();
            if (trimmed.isEmpty()) {
                return new CommandRequest("", List.of(), sender);
            }
            String[] tokens = trimmed.split("\\s+");
            return new CommandRequest(tokens[0], Arrays.asList(tokens).subList(1, tokens.length), sender);
        }
    }

    /**
     * Reply text for the channel. {@code payload} carries the affected sound or
     * sound list for callers that need more than text.
     */
    record CommandReply(boolean success, String text, Object payload) {

        public static CommandReply ok(String text) {
            return new CommandReply(true, text, null);
        }

        public static CommandReply ok(String text, Object payload) {
            return new CommandReply(true, text, payload);
        }

        public static CommandReply error(String text) {
            return new CommandReply(false, text, null);
        }
    }

    record CommandUsage(String name, String usage, String description) {
    }
}
