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

import me.golemcore.slackops.domain.model.CommandType;

import java.util.List;

/**
 * Port for registering chat commands and their handlers.
 *
 * <p>
 * Command tokens start with the configured sentinel (default {@code $}).
 * {@code $auth} and {@code $deauth} are reserved for the authorization state
 * machine and cannot be registered.
 */
public interface CommandPort {

    /**
     * Registers a command that requires an admin sender in the authorized state.
     *
     * @throws me.golemcore.slackops.domain.exception.InvalidHandlerException
     *             if the token or handler is rejected
     */
    void registerAdminCommand(String command, CommandHandler handler);

    /**
     * Registers a command open to every user.
     *
     * @throws me.golemcore.slackops.domain.exception.InvalidHandlerException
     *             if the token or handler is rejected
     */
    void registerUserCommand(String command, CommandHandler handler);

    /**
     * Removes a command. Returns false if it was not registered.
     */
    boolean unregister(String command);

    boolean hasCommand(String command);

    List<CommandDefinition> listCommands();

    /**
     * A registered command's token and class.
     */
    record CommandDefinition(
            String name,
            CommandType type
    ) {}
}
