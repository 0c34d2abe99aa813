package me.golemcore.slackops.port.outbound;

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

import me.golemcore.slackops.domain.model.ChatEvent;

/**
 * A live real-time connection to the chat platform.
 */
public interface ChatConnection extends AutoCloseable {

    /**
     * Blocks until the next event arrives.
     *
     * @return the event, or {@code null} once the connection is closed
     * @throws InterruptedException
     *             if the reading thread is interrupted
     * @throws me.golemcore.slackops.domain.exception.TransportException
     *             if the stream failed
     */
    ChatEvent receive() throws InterruptedException;

    /**
     * Posts a text message to a channel.
     *
     * @throws me.golemcore.slackops.domain.exception.TransportException
     *             if the frame could not be queued for sending
     */
    void send(String channelId, String text);

    boolean isOpen();

    @Override
    void close();
}
