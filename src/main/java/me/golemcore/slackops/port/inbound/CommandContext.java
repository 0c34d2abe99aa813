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

import me.golemcore.slackops.domain.correlation.CallbackRegistration;
import me.golemcore.slackops.domain.correlation.EventCallback;
import me.golemcore.slackops.domain.correlation.Waiter;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.model.CorrelationKey;

import java.util.concurrent.CompletableFuture;

/**
 * What a command handler can do besides reading its event.
 */
public interface CommandContext {

    /**
     * Posts a message to a channel over the outbound connection.
     */
    CompletableFuture<Void> send(String channelId, String text);

    /**
     * Posts a message to the channel the event came from.
     */
    default CompletableFuture<Void> reply(ChatEvent event, String text) {
        return send(event.getChannel(), text);
    }

    boolean isAdmin(String userId);

    boolean isAuthorized(String userId);

    /**
     * Registers a single-shot waiter resolved by the next event covered by
     * {@code key}. There is no implicit timeout: cancel the waiter if it is no
     * longer needed.
     */
    Waiter awaitEvent(CorrelationKey key);

    /**
     * Registers a persistent callback invoked for every event covered by
     * {@code key} until the registration is cancelled.
     */
    CallbackRegistration registerCallback(CorrelationKey key, EventCallback callback);

    /**
     * Command registration, e.g. to add follow-up commands at runtime.
     */
    CommandPort commands();
}
