package me.golemcore.slackops.adapter.outbound.slack;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.slackops.domain.exception.MalformedEventException;
import me.golemcore.slackops.domain.exception.SessionException;
import me.golemcore.slackops.domain.exception.TransportException;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.port.outbound.ChatConnection;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One Slack RTM WebSocket.
 *
 * <p>
 * OkHttp delivers frames on its own reader thread; they are decoded and queued
 * here, and {@link #receive()} hands them out one at a time in arrival order.
 * The first frame must be {@code {"type": "hello"}}. Frames without a
 * {@code type} (send acknowledgements) are dropped.
 */
@Slf4j
class SlackRtmConnection extends WebSocketListener implements ChatConnection {

    private static final int NORMAL_CLOSURE = 1000;
    private static final TypeReference<Map<String, Object>> FRAME_TYPE = new TypeReference<>() {
    };
    private static final Frame END = new Frame(null);

    private final ObjectMapper objectMapper;
    private final BlockingQueue<Frame> frames = new LinkedBlockingQueue<>();
    private final CompletableFuture<Void> hello = new CompletableFuture<>();
    private final AtomicLong nextFrameId = new AtomicLong(1);

    private volatile WebSocket webSocket;
    private volatile boolean open = true;
    private volatile Throwable failure;

    SlackRtmConnection(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    void attach(WebSocket webSocket) {
        this.webSocket = webSocket;
    }

    /**
     * Waits for the hello frame.
     *
     * @throws SessionException
     *             if it does not arrive in time or another frame comes first
     */
    void awaitHello(Duration timeout) {
        try {
            hello.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionException("Interrupted while waiting for Slack hello", e);
        } catch (TimeoutException e) {
            throw new SessionException("Did not receive hello message from Slack within " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SessionException sessionError) {
                throw sessionError;
            }
            throw new SessionException("Slack RTM handshake failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void onMessage(WebSocket socket, String text) {
        Map<String, Object> fields;
        try {
            fields = objectMapper.readValue(text, FRAME_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[Slack] Dropping undecodable frame: {}", e.getOriginalMessage());
            return;
        }

        if (!hello.isDone()) {
            if ("hello".equals(fields.get(ChatEvent.FIELD_TYPE))) {
                hello.complete(null);
            } else {
                hello.completeExceptionally(new SessionException("Did not receive hello message from Slack"));
            }
            return;
        }

        if (fields.get(ChatEvent.FIELD_TYPE) == null) {
            log.trace("[Slack] Ack frame: {}", fields);
            return;
        }
        try {
            frames.add(new Frame(ChatEvent.of(fields)));
        } catch (MalformedEventException e) {
            log.warn("[Slack] Dropping frame: {}", e.getMessage());
        }
    }

    @Override
    public void onClosing(WebSocket socket, int code, String reason) {
        log.info("[Slack] RTM closing: {} {}", code, reason);
        socket.close(NORMAL_CLOSURE, null);
    }

    @Override
    public void onClosed(WebSocket socket, int code, String reason) {
        open = false;
        hello.completeExceptionally(new SessionException("Connection closed before hello: " + code));
        frames.add(END);
    }

    @Override
    public void onFailure(WebSocket socket, Throwable t, Response response) {
        if (open) {
            log.error("[Slack] RTM connection failed: {}", t.getMessage(), t);
            failure = t;
        } else {
            log.debug("[Slack] RTM connection failed after close: {}", t.getMessage());
        }
        open = false;
        hello.completeExceptionally(t);
        frames.add(END);
    }

    @Override
    public ChatEvent receive() throws InterruptedException {
        Frame frame = frames.take();
        if (frame == END) {
            frames.add(END);
            Throwable error = failure;
            if (error != null) {
                throw new TransportException("Slack RTM stream failed: " + error.getMessage(), error);
            }
            return null;
        }
        return frame.event();
    }

    @Override
    public void send(String channelId, String text) {
        WebSocket socket = webSocket;
        if (socket == null || !open) {
            throw new TransportException("Slack RTM connection is closed");
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("id", nextFrameId.getAndIncrement());
        frame.put(ChatEvent.FIELD_TYPE, ChatEvent.TYPE_MESSAGE);
        frame.put(ChatEvent.FIELD_CHANNEL, channelId);
        frame.put(ChatEvent.FIELD_TEXT, text);
        try {
            if (!socket.send(objectMapper.writeValueAsString(frame))) {
                throw new TransportException("Slack RTM refused frame for channel " + channelId);
            }
        } catch (JsonProcessingException e) {
            throw new TransportException("Cannot encode message for channel " + channelId, e);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "bye");
        }
        frames.add(END);
    }

    private record Frame(ChatEvent event) {
    }
}
