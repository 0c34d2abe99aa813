package me.golemcore.slackops.domain.loop;

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
import me.golemcore.slackops.adapter.inbound.command.CommandDispatcher;
import me.golemcore.slackops.domain.correlation.CorrelationTable;
import me.golemcore.slackops.domain.exception.MalformedEventException;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.service.AuthorizationService;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * The dispatch loop: drains the {@link DispatchQueue} on a single thread.
 *
 * <p>
 * For each inbound event the correlation table runs first, so pending waiters
 * resolve before the same event is classified and routed. Authorization
 * signals (timer expiry, challenge completion) are applied here as well, which
 * makes this thread the only writer of authorization state.
 *
 * <p>
 * The loop ends when it takes the {@code shutdown} sentinel event. A failure
 * while processing one signal is logged and never ends the loop.
 */
@Component
@Slf4j
public class DispatchLoop {

    private final DispatchQueue dispatchQueue;
    private final CorrelationTable correlationTable;
    private final CommandDispatcher commandDispatcher;
    private final AuthorizationService authorizationService;
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private volatile Thread loopThread;

    public DispatchLoop(DispatchQueue dispatchQueue, CorrelationTable correlationTable,
            CommandDispatcher commandDispatcher, AuthorizationService authorizationService) {
        this.dispatchQueue = dispatchQueue;
        this.correlationTable = correlationTable;
        this.commandDispatcher = commandDispatcher;
        this.authorizationService = authorizationService;
    }

    /**
     * Starts the loop thread.
     *
     * @return completes when the loop has stopped
     */
    public synchronized CompletableFuture<Void> start() {
        if (loopThread != null) {
            return termination;
        }
        Thread thread = new Thread(this::run, "dispatch-loop");
        loopThread = thread;
        thread.start();
        log.info("[Dispatch] Loop started");
        return termination;
    }

    /**
     * Asks the loop to stop after the signals already queued.
     */
    public void stop() {
        dispatchQueue.post(new LoopSignal.Inbound(ChatEvent.shutdown()));
    }

    public CompletableFuture<Void> getTermination() {
        return termination;
    }

    void run() {
        try {
            while (true) {
                LoopSignal signal = dispatchQueue.take();
                if (!process(signal)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Dispatch] Loop interrupted");
        } finally {
            authorizationService.cancelAllTimers();
            log.info("[Dispatch] Loop stopped");
            termination.complete(null);
        }
    }

    /**
     * Processes one signal on the calling thread.
     *
     * @return false if the signal was the shutdown sentinel
     */
    boolean process(LoopSignal signal) {
        try {
            if (signal instanceof LoopSignal.Inbound inbound) {
                ChatEvent event = inbound.event();
                if (event.isShutdown()) {
                    log.info("[Dispatch] Shutdown sentinel received");
                    return false;
                }
                log.debug("[Dispatch] Event: {}", event);
                correlationTable.onEvent(event);
                commandDispatcher.dispatch(event);
            } else if (signal instanceof LoopSignal.AuthorizationExpired expired) {
                commandDispatcher.onAuthorizationExpired(expired);
            } else if (signal instanceof LoopSignal.ChallengeCompleted completed) {
                commandDispatcher.onChallengeCompleted(completed);
            } else {
                log.warn("[Dispatch] Unknown signal: {}", signal);
            }
        } catch (MalformedEventException e) {
            log.warn("[Dispatch] Skipping malformed event: {}", e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - must not kill the loop thread
            log.error("[Dispatch] Failed to process {}: {}", signal, e.getMessage(), e);
        }
        return true;
    }
}
