package me.golemcore.slackops.domain.service;

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
import me.golemcore.slackops.domain.correlation.CallbackRegistration;
import me.golemcore.slackops.domain.correlation.CorrelationTable;
import me.golemcore.slackops.domain.correlation.EventCallback;
import me.golemcore.slackops.domain.correlation.Waiter;
import me.golemcore.slackops.domain.model.CorrelationKey;
import me.golemcore.slackops.port.inbound.CommandContext;
import me.golemcore.slackops.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * The {@link CommandContext} handed to every command handler.
 */
@Component
@RequiredArgsConstructor
public class DefaultCommandContext implements CommandContext {

    private final ChatSender chatSender;
    private final AuthorizationService authorizationService;
    private final CorrelationTable correlationTable;
    private final CommandRegistry commandRegistry;

    @Override
    public CompletableFuture<Void> send(String channelId, String text) {
        return chatSender.send(channelId, text);
    }

    @Override
    public boolean isAdmin(String userId) {
        return authorizationService.isAdmin(userId);
    }

    @Override
    public boolean isAuthorized(String userId) {
        return authorizationService.isAuthorized(userId);
    }

    @Override
    public Waiter awaitEvent(CorrelationKey key) {
        return correlationTable.registerWaiter(key);
    }

    @Override
    public CallbackRegistration registerCallback(CorrelationKey key, EventCallback callback) {
        return correlationTable.registerCallback(key, callback);
    }

    @Override
    public CommandPort commands() {
        return commandRegistry;
    }
}
