package me.golemcore.slackops.adapter.inbound.slack;

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
import me.golemcore.slackops.domain.exception.SlackOpsException;
import me.golemcore.slackops.domain.loop.DispatchQueue;
import me.golemcore.slackops.domain.loop.LoopSignal;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.port.outbound.ChatConnection;
import me.golemcore.slackops.port.outbound.ChatPlatformPort;
import org.springframework.stereotype.Component;

/**
 * Reads events from a dedicated chat connection and feeds them into the
 * dispatch queue.
 *
 * <p>
 * Only plain {@code message} events are forwarded; edits, joins and other
 * subtypes are dropped here. When the stream ends, for whatever reason, the
 * shutdown sentinel is posted so the dispatch loop terminates.
 */
@Component
@Slf4j
public class SlackIngressBridge {

    private static final String FIELD_SUBTYPE = "subtype";

    private final ChatPlatformPort chatPlatform;
    private final DispatchQueue dispatchQueue;

    private volatile ChatConnection connection;
    private volatile boolean running;
    private Thread readerThread;

    public SlackIngressBridge(ChatPlatformPort chatPlatform, DispatchQueue dispatchQueue) {
        this.chatPlatform = chatPlatform;
        this.dispatchQueue = dispatchQueue;
    }

    /**
     * Opens the ingress connection and starts the reader thread.
     *
     * @throws me.golemcore.slackops.domain.exception.SessionException
     *             if the handshake fails
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        connection = chatPlatform.openConnection();
        running = true;
        readerThread = new Thread(this::pump, "slack-ingress");
        readerThread.setDaemon(true);
        readerThread.start();
        log.info("[Ingress] Started");
    }

    public synchronized void stop() {
        running = false;
        ChatConnection current = connection;
        if (current != null) {
            current.close();
        }
        if (readerThread != null) {
            readerThread.interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    void pump() {
        try {
            while (running) {
                ChatEvent event = connection.receive();
                if (event == null) {
                    log.info("[Ingress] Connection closed");
                    break;
                }
                if (shouldForward(event)) {
                    dispatchQueue.post(new LoopSignal.Inbound(event));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[Ingress] Interrupted");
        } catch (SlackOpsException e) {
            log.error("[Ingress] Event stream failed: {}", e.getMessage(), e);
        } finally {
            running = false;
            dispatchQueue.post(new LoopSignal.Inbound(ChatEvent.shutdown()));
        }
    }

    static boolean shouldForward(ChatEvent event) {
        return event.isMessage() && event.get(FIELD_SUBTYPE) == null;
    }
}
