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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.slackops.domain.exception.SessionException;
import me.golemcore.slackops.domain.exception.TransportException;
import me.golemcore.slackops.port.outbound.ChatConnection;
import me.golemcore.slackops.port.outbound.ChatPlatformPort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Sends chat messages over a connection of its own.
 *
 * <p>
 * The outbound connection is separate from the one the ingress bridge reads,
 * and all sends go through a single {@code slack-sender} thread, so a slow send
 * never holds up the read loop or the dispatch loop. The connection is reopened
 * on the next send if the platform dropped it.
 */
@Service
@Slf4j
public class ChatSender {

    private final ChatPlatformPort platform;
    private final ExecutorService sendExecutor;
    private final Object connectionLock = new Object();

    private ChatConnection connection;

    public ChatSender(ChatPlatformPort platform) {
        this.platform = platform;
        this.sendExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "slack-sender");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Opens the outbound connection.
     *
     * @throws me.golemcore.slackops.domain.exception.SessionException
     *             if the platform handshake fails
     */
    public void start() {
        synchronized (connectionLock) {
            ensureConnection();
        }
        log.info("[Sender] Outbound connection ready");
    }

    /**
     * Posts {@code text} to {@code channelId}. The future fails with
     * {@link TransportException} if the message could not be sent.
     */
    public CompletableFuture<Void> send(String channelId, String text) {
        return CompletableFuture.runAsync(() -> {
            synchronized (connectionLock) {
                try {
                    ensureConnection().send(channelId, text);
                } catch (SessionException e) {
                    throw new TransportException("Outbound connection unavailable: " + e.getMessage(), e);
                }
            }
        }, sendExecutor).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("[Sender] Failed to send to {}: {}", channelId, error.getMessage());
            }
        });
    }

    @PreDestroy
    public void stop() {
        synchronized (connectionLock) {
            if (connection != null) {
                connection.close();
                connection = null;
            }
        }
        sendExecutor.shutdown();
        try {
            if (!sendExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                sendExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sendExecutor.shutdownNow();
        }
    }

    private ChatConnection ensureConnection() {
        if (connection == null || !connection.isOpen()) {
            if (connection != null) {
                log.warn("[Sender] Outbound connection lost, reconnecting");
            }
            connection = platform.openConnection();
        }
        return connection;
    }
}
