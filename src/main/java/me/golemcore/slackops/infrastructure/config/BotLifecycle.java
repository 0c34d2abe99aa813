package me.golemcore.slackops.infrastructure.config;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.slackops.adapter.inbound.slack.SlackIngressBridge;
import me.golemcore.slackops.domain.component.CommandComponent;
import me.golemcore.slackops.domain.loop.DispatchLoop;
import me.golemcore.slackops.domain.model.CommandType;
import me.golemcore.slackops.domain.service.AuthorizationService;
import me.golemcore.slackops.domain.service.ChatSender;
import me.golemcore.slackops.domain.service.CommandRegistry;
import me.golemcore.slackops.port.outbound.DirectoryPort;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Brings the bot up once the context is ready.
 *
 * <p>
 * Startup order:
 * <ol>
 * <li>resolve {@code bot.admins} to Slack user ids and load the roster</li>
 * <li>register every enabled {@link CommandComponent}</li>
 * <li>open the outbound connection, start the dispatch loop, then open the
 * ingress connection</li>
 * </ol>
 * A directory or handshake failure aborts startup. When the dispatch loop
 * terminates the application context is closed.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class BotLifecycle {

    private final BotProperties properties;
    private final DirectoryPort directory;
    private final AuthorizationService authorizationService;
    private final CommandRegistry commandRegistry;
    private final List<CommandComponent> commandComponents;
    private final ChatSender chatSender;
    private final DispatchLoop dispatchLoop;
    private final SlackIngressBridge ingressBridge;
    private final ConfigurableApplicationContext applicationContext;

    public BotLifecycle(BotProperties properties, DirectoryPort directory,
            AuthorizationService authorizationService, CommandRegistry commandRegistry,
            List<CommandComponent> commandComponents, ChatSender chatSender, DispatchLoop dispatchLoop,
            SlackIngressBridge ingressBridge, ConfigurableApplicationContext applicationContext) {
        this.properties = properties;
        this.directory = directory;
        this.authorizationService = authorizationService;
        this.commandRegistry = commandRegistry;
        this.commandComponents = commandComponents;
        this.chatSender = chatSender;
        this.dispatchLoop = dispatchLoop;
        this.ingressBridge = ingressBridge;
        this.applicationContext = applicationContext;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Slack ops bot starting, command prefix '{}'", commandRegistry.getPrefix());

        loadAdminRoster();
        registerCommands();

        chatSender.start();
        dispatchLoop.start().whenComplete((ignored, error) -> closeContext());
        ingressBridge.start();

        log.info("Slack ops bot started with {} command(s)", commandRegistry.listCommands().size());
    }

    @PreDestroy
    public void stop() {
        ingressBridge.stop();
        dispatchLoop.stop();
    }

    void loadAdminRoster() {
        List<String> admins = properties.getAdmins();
        if (admins.isEmpty()) {
            log.warn("[Auth] No admins configured (bot.admins); admin commands are unavailable");
        }
        Map<String, String> roster = directory.resolveAdminRoster(admins);
        authorizationService.loadRoster(roster);
        log.info("[Auth] Admin roster: {} user(s)", roster.size());
    }

    void registerCommands() {
        for (CommandComponent component : commandComponents) {
            if (!component.isEnabled()) {
                log.debug("Command {} disabled", component.getName());
                continue;
            }
            if (component.getType() == CommandType.ADMIN) {
                commandRegistry.registerAdminCommand(component.getName(), component);
            } else {
                commandRegistry.registerUserCommand(component.getName(), component);
            }
        }
    }

    private void closeContext() {
        if (!applicationContext.isActive()) {
            return;
        }
        Thread closer = new Thread(applicationContext::close, "context-close");
        closer.start();
    }
}
