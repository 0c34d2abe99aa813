package me.golemcore.slackops.port.inbound;

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

import me.golemcore.slackops.domain.model.ChatEvent;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Handles one invocation of a registered command.
 *
 * <p>
 * Invoked on the command-handler pool, never on the dispatch loop. Handlers
 * must not block on I/O for long: return a stage that completes when the work
 * is done. A handler that throws or returns a failed stage gets its error
 * logged and reported to the originating channel; other handlers and the loop
 * are not affected.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * @param context
     *            access to sending, roster lookups and correlation
     * @param event
     *            the message that triggered the command
     * @param args
     *            whitespace-separated tokens following the command
     */
    CompletionStage<Void> handle(CommandContext context, ChatEvent event, List<String> args);
}
