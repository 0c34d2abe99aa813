package me.golemcore.slackops.commands;

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

import me.golemcore.slackops.domain.component.CommandComponent;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.model.CommandType;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import me.golemcore.slackops.infrastructure.i18n.MessageService;
import me.golemcore.slackops.port.inbound.CommandContext;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Tells the caller whether they are on the admin roster and currently
 * authorized.
 */
@Component
public class WhoAmICommand implements CommandComponent {

    private final BotProperties properties;
    private final MessageService messageService;

    public WhoAmICommand(BotProperties properties, MessageService messageService) {
        this.properties = properties;
        this.messageService = messageService;
    }

    @Override
    public String getName() {
        return properties.getCommands().getPrefix() + "whoami";
    }

    @Override
    public CommandType getType() {
        return CommandType.USER;
    }

    @Override
    public CompletionStage<Void> handle(CommandContext context, ChatEvent event, List<String> args) {
        String user = event.getUser();
        String key;
        if (!context.isAdmin(user)) {
            key = "whoami.user";
        } else if (context.isAuthorized(user)) {
            key = "whoami.admin.authorized";
        } else {
            key = "whoami.admin.unauthorized";
        }
        return context.reply(event, messageService.getMessage(key, user));
    }
}
