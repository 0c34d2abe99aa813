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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.slackops.domain.exception.InvalidHandlerException;
import me.golemcore.slackops.domain.model.CommandType;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import me.golemcore.slackops.port.inbound.CommandHandler;
import me.golemcore.slackops.port.inbound.CommandPort;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Command token to class and handler.
 *
 * <p>
 * Filled at startup and read by the dispatch loop on every message. Backed by a
 * concurrent map so runtime registration from a handler thread does not
 * corrupt lookups in progress. Registering an existing token replaces it.
 */
@Service
@Slf4j
public class CommandRegistry implements CommandPort {

    public static final String AUTH_COMMAND = "auth";
    public static final String DEAUTH_COMMAND = "deauth";

    private final Map<String, RegisteredCommand> commands = new ConcurrentHashMap<>();
    private final String prefix;
    private final Set<String> reserved;

    public CommandRegistry(BotProperties properties) {
        this.prefix = properties.getCommands().getPrefix();
        this.reserved = Set.of(prefix + AUTH_COMMAND, prefix + DEAUTH_COMMAND);
    }

    public String getPrefix() {
        return prefix;
    }

    public String authToken() {
        return prefix + AUTH_COMMAND;
    }

    public String deauthToken() {
        return prefix + DEAUTH_COMMAND;
    }

    public boolean isReserved(String command) {
        return reserved.contains(command);
    }

    public boolean isSentinelPrefixed(String token) {
        return token != null && token.startsWith(prefix);
    }

    @Override
    public void registerAdminCommand(String command, CommandHandler handler) {
        register(command, CommandType.ADMIN, handler);
    }

    @Override
    public void registerUserCommand(String command, CommandHandler handler) {
        register(command, CommandType.USER, handler);
    }

    @Override
    public boolean unregister(String command) {
        boolean removed = command != null && commands.remove(command) != null;
        if (removed) {
            log.info("[Commands] Unregistered {}", command);
        }
        return removed;
    }

    @Override
    public boolean hasCommand(String command) {
        return command != null && commands.containsKey(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return commands.values().stream()
                .map(registered -> new CommandDefinition(registered.name(), registered.type()))
                .sorted(Comparator.comparing(CommandDefinition::name))
                .toList();
    }

    public Optional<RegisteredCommand> find(String command) {
        return command != null ? Optional.ofNullable(commands.get(command)) : Optional.empty();
    }

    private void register(String command, CommandType type, CommandHandler handler) {
        validate(command, handler);
        RegisteredCommand previous = commands.put(command, new RegisteredCommand(command, type, handler));
        if (previous != null) {
            log.info("[Commands] Replaced {} ({} -> {})", command, previous.type(), type);
        } else {
            log.info("[Commands] Registered {} ({})", command, type);
        }
    }

    private void validate(String command, CommandHandler handler) {
        if (handler == null) {
            throw new InvalidHandlerException("Command handler must not be null: " + command);
        }
        if (command == null || command.isBlank()) {
            throw new InvalidHandlerException("Command token must not be blank");
        }
        if (!command.startsWith(prefix) || command.length() == prefix.length()) {
            throw new InvalidHandlerException("Command token must start with '" + prefix + "': " + command);
        }
        if (command.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidHandlerException("Command token must not contain whitespace: " + command);
        }
        if (isReserved(command)) {
            throw new InvalidHandlerException("Command token is reserved: " + command);
        }
    }

    /**
     * A command as stored in the registry.
     */
    public record RegisteredCommand(
            String name,
            CommandType type,
            CommandHandler handler
    ) {}
}
