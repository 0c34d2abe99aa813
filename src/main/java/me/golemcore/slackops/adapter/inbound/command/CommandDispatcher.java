package me.golemcore.slackops.adapter.inbound.command;

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
import me.golemcore.slackops.domain.loop.LoopSignal;
import me.golemcore.slackops.domain.model.ChallengeOutcome;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.model.CommandType;
import me.golemcore.slackops.domain.service.AuthorizationChallenge;
import me.golemcore.slackops.domain.service.AuthorizationService;
import me.golemcore.slackops.domain.service.ChatSender;
import me.golemcore.slackops.domain.service.CommandRegistry;
import me.golemcore.slackops.infrastructure.i18n.MessageService;
import me.golemcore.slackops.port.inbound.CommandContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Classifies chat messages as commands and routes them.
 *
 * <p>
 * Called on the dispatch loop for every event, after the correlation table has
 * seen it. The first whitespace-separated token of a message is the command,
 * the rest are its arguments:
 *
 * <ul>
 * <li>{@code $auth} / {@code $deauth} - admin roster check, then the
 * authorization state machine</li>
 * <li>admin command - roster and authorization checks, idle timer refresh,
 * handler</li>
 * <li>user command - handler, no checks</li>
 * <li>other sentinel-prefixed token - "Unknown command" reply</li>
 * <li>anything else - not a command, ignored</li>
 * </ul>
 *
 * <p>
 * Handlers run on the command-handler pool; the dispatcher does not wait for
 * them. A failing handler is logged and reported to its channel.
 *
 * @see me.golemcore.slackops.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandDispatcher {

    private final CommandRegistry commandRegistry;
    private final AuthorizationService authorizationService;
    private final AuthorizationChallenge authorizationChallenge;
    private final ChatSender chatSender;
    private final MessageService messageService;
    private final CommandContext commandContext;
    private final ExecutorService handlerExecutor;

    public CommandDispatcher(CommandRegistry commandRegistry, AuthorizationService authorizationService,
            AuthorizationChallenge authorizationChallenge, ChatSender chatSender, MessageService messageService,
            CommandContext commandContext,
            @Qualifier("commandHandlerExecutor") ExecutorService handlerExecutor) {
        this.commandRegistry = commandRegistry;
        this.authorizationService = authorizationService;
        this.authorizationChallenge = authorizationChallenge;
        this.chatSender = chatSender;
        this.messageService = messageService;
        this.commandContext = commandContext;
        this.handlerExecutor = handlerExecutor;
    }

    /**
     * Classifies and routes one event.
     *
     * @throws me.golemcore.slackops.domain.exception.MalformedEventException
     *             if a message lacks user, channel or text
     */
    public void dispatch(ChatEvent event) {
        if (!event.isMessage()) {
            log.trace("[Dispatch] Ignoring event type={}", event.getType());
            return;
        }
        event.requireMessageFields();

        List<String> tokens = tokenize(event.getText());
        if (tokens.isEmpty()) {
            return;
        }
        String command = tokens.get(0);
        List<String> args = Collections.unmodifiableList(new ArrayList<>(tokens.subList(1, tokens.size())));
        String userId = event.getUser();

        if (command.equals(commandRegistry.authToken())) {
            handleAuth(event);
            return;
        }
        if (command.equals(commandRegistry.deauthToken())) {
            handleDeauth(event);
            return;
        }

        Optional<CommandRegistry.RegisteredCommand> registered = commandRegistry.find(command);
        if (registered.isPresent()) {
            CommandRegistry.RegisteredCommand target = registered.get();
            if (target.type() == CommandType.ADMIN) {
                if (!authorizationService.isAdmin(userId)) {
                    log.warn("[Dispatch] {} denied for non-admin {}", command, userId);
                    reply(event, "command.not-permitted");
                    return;
                }
                if (!authorizationService.isAuthorized(userId)) {
                    log.info("[Dispatch] {} denied for unauthorized admin {}", command, userId);
                    reply(event, "command.not-authorized", commandRegistry.authToken());
                    return;
                }
            }
            authorizationService.refresh(userId, event.getChannel());
            invoke(target, event, args);
            return;
        }

        if (commandRegistry.isSentinelPrefixed(command)) {
            log.debug("[Dispatch] Unknown command {} from {}", command, userId);
            reply(event, "command.unknown", command);
        }
    }

    /**
     * Applies the outcome of an {@code $auth} challenge.
     */
    public void onChallengeCompleted(LoopSignal.ChallengeCompleted signal) {
        boolean succeeded = signal.outcome() == ChallengeOutcome.SUCCEEDED;
        boolean authorized = authorizationService.completeChallenge(signal.userId(), succeeded, signal.channelId());
        switch (signal.outcome()) {
        case SUCCEEDED -> {
            if (authorized) {
                chatSender.send(signal.channelId(), messageService.getMessage("auth.succeeded"));
            }
        }
        case FAILED -> chatSender.send(signal.channelId(), messageService.getMessage("auth.failed"));
        case TIMED_OUT -> chatSender.send(signal.channelId(), messageService.getMessage("auth.timed-out"));
        case ABORTED -> log.debug("[Auth] Challenge for {} aborted, error already reported", signal.userId());
        }
    }

    /**
     * Applies an idle timer firing; notifies the channel if it revoked access.
     */
    public void onAuthorizationExpired(LoopSignal.AuthorizationExpired signal) {
        authorizationService.expire(signal.userId(), signal.generation())
                .ifPresent(channelId -> chatSender.send(channelId,
                        messageService.getMessage("auth.expired", commandRegistry.authToken())));
    }

    CompletableFuture<Void> invoke(CommandRegistry.RegisteredCommand command, ChatEvent event, List<String> args) {
        log.info("[Dispatch] {} from {} in {} args={}", command.name(), event.getUser(), event.getChannel(), args);
        return CompletableFuture
                .supplyAsync(() -> runHandler(command, event, args), handlerExecutor)
                .thenCompose(Function.identity())
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        log.error("[Dispatch] Handler for {} failed: {}", command.name(), cause.getMessage(), cause);
                        reply(event, "command.failed", command.name(), String.valueOf(cause.getMessage()));
                    }
                });
    }

    static List<String> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        return Arrays.stream(text.split("\\s+"))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    private CompletionStage<Void> runHandler(CommandRegistry.RegisteredCommand command, ChatEvent event,
            List<String> args) {
        CompletionStage<Void> stage = command.handler().handle(commandContext, event, args);
        return stage != null ? stage : CompletableFuture.completedFuture(null);
    }

    private void handleAuth(ChatEvent event) {
        String userId = event.getUser();
        if (!authorizationService.isAdmin(userId)) {
            log.warn("[Dispatch] {} denied for non-admin {}", commandRegistry.authToken(), userId);
            reply(event, "command.not-permitted");
            return;
        }
        if (!authorizationService.beginChallenge(userId)) {
            log.debug("[Dispatch] {} ignored for {}: already authorized or challenge pending",
                    commandRegistry.authToken(), userId);
            return;
        }
        authorizationChallenge.start(event);
    }

    private void handleDeauth(ChatEvent event) {
        String userId = event.getUser();
        if (!authorizationService.isAdmin(userId)) {
            log.warn("[Dispatch] {} denied for non-admin {}", commandRegistry.deauthToken(), userId);
            reply(event, "command.not-permitted");
            return;
        }
        if (authorizationService.revoke(userId)) {
            reply(event, "auth.revoked");
        } else {
            log.debug("[Dispatch] {} ignored for {}: not authorized", commandRegistry.deauthToken(), userId);
        }
    }

    private void reply(ChatEvent event, String key, Object... args) {
        chatSender.send(event.getChannel(), messageService.getMessage(key, args));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
