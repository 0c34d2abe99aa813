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
import me.golemcore.slackops.domain.correlation.CorrelationTable;
import me.golemcore.slackops.domain.correlation.Waiter;
import me.golemcore.slackops.domain.loop.DispatchQueue;
import me.golemcore.slackops.domain.loop.LoopSignal;
import me.golemcore.slackops.domain.model.ChallengeOutcome;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.model.CorrelationKey;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import me.golemcore.slackops.infrastructure.i18n.MessageService;
import me.golemcore.slackops.port.outbound.DirectoryPort;
import me.golemcore.slackops.port.outbound.OneTimeCodePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the {@code $auth} challenge for an admin user.
 *
 * <p>
 * Steps, all off the dispatch loop:
 * <ol>
 * <li>tell the requesting channel a code is on its way</li>
 * <li>register a waiter on {@code {user: <id>}}</li>
 * <li>look up the user's email and mail a fresh one-time code</li>
 * <li>wait for the user's next message and compare its text with the code</li>
 * </ol>
 *
 * <p>
 * The outcome is posted to the dispatch loop as
 * {@link LoopSignal.ChallengeCompleted} at the head of the queue; the loop
 * performs the state transition before it takes the next event. The wait has no timeout unless
 * {@code bot.auth.challenge-timeout} is set. If the directory or the mailer
 * fails, the waiter is cancelled and the error is reported to the channel.
 */
@Service
@Slf4j
public class AuthorizationChallenge {

    private final DirectoryPort directoryPort;
    private final OneTimeCodePort oneTimeCodePort;
    private final CorrelationTable correlationTable;
    private final ChatSender chatSender;
    private final MessageService messageService;
    private final OneTimeCodeGenerator codeGenerator;
    private final DispatchQueue dispatchQueue;
    private final ExecutorService executor;
    private final Duration challengeTimeout;

    public AuthorizationChallenge(DirectoryPort directoryPort, OneTimeCodePort oneTimeCodePort,
            CorrelationTable correlationTable, ChatSender chatSender, MessageService messageService,
            OneTimeCodeGenerator codeGenerator, DispatchQueue dispatchQueue, BotProperties properties,
            @Qualifier("commandHandlerExecutor") ExecutorService executor) {
        this.directoryPort = directoryPort;
        this.oneTimeCodePort = oneTimeCodePort;
        this.correlationTable = correlationTable;
        this.chatSender = chatSender;
        this.messageService = messageService;
        this.codeGenerator = codeGenerator;
        this.dispatchQueue = dispatchQueue;
        this.executor = executor;
        this.challengeTimeout = properties.getAuth().getChallengeTimeout();
    }

    /**
     * Starts a challenge for the sender of {@code request}.
     *
     * @return the outcome, also posted to the dispatch loop
     */
    public CompletableFuture<ChallengeOutcome> start(ChatEvent request) {
        String userId = request.getUser();
        String channelId = request.getChannel();
        log.info("[Auth] Challenge started for {}", userId);

        return CompletableFuture.supplyAsync(() -> issue(userId, channelId), executor)
                .thenCompose(this::awaitReply)
                .exceptionally(error -> {
                    Throwable cause = unwrap(error);
                    log.error("[Auth] Challenge for {} aborted: {}", userId, cause.getMessage(), cause);
                    chatSender.send(channelId, messageService.getMessage("auth.challenge.error", cause.getMessage()));
                    return ChallengeOutcome.ABORTED;
                })
                .whenComplete((outcome, ignored) -> {
                    log.info("[Auth] Challenge for {} finished: {}", userId, outcome);
                    dispatchQueue.postFirst(new LoopSignal.ChallengeCompleted(userId, channelId, outcome));
                });
    }

    private PendingChallenge issue(String userId, String channelId) {
        chatSender.send(channelId, messageService.getMessage("auth.challenge.sent"));

        Waiter waiter = correlationTable.registerWaiter(CorrelationKey.of(Map.of(ChatEvent.FIELD_USER, userId)));
        try {
            String email = directoryPort.resolveEmail(userId);
            String code = codeGenerator.generate();
            oneTimeCodePort.sendOneTimeCode(email, code);
            log.debug("[Auth] One-time code mailed for {}", userId);
            return new PendingChallenge(waiter, code);
        } catch (RuntimeException e) {
            waiter.cancel();
            throw e;
        }
    }

    private CompletableFuture<ChallengeOutcome> awaitReply(PendingChallenge challenge) {
        CompletableFuture<ChatEvent> reply = challenge.waiter().result();
        if (challengeTimeout != null) {
            reply = reply.orTimeout(challengeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return reply.handle((event, error) -> {
            if (error == null) {
                return challenge.code().equals(event.getText())
                        ? ChallengeOutcome.SUCCEEDED
                        : ChallengeOutcome.FAILED;
            }
            challenge.waiter().cancel();
            if (unwrap(error) instanceof TimeoutException) {
                return ChallengeOutcome.TIMED_OUT;
            }
            throw new CompletionException(unwrap(error));
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record PendingChallenge(Waiter waiter, String code) {
    }
}
