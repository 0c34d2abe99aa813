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

/**
 * Opens connections to the chat platform's real-time messaging endpoint.
 *
 * <p>
 * Each call establishes an independent connection. The bot opens one to
 * receive and another to send, so slow sends never contend with the ingress
 * read loop.
 */
public interface ChatPlatformPort {

    /**
     * Performs the platform handshake and returns a ready connection.
     *
     * @throws me.golemcore.slackops.domain.exception.SessionException
     *             if the endpoint cannot be obtained or the platform does not
     *             send its ready signal
     */
    ChatConnection openConnection();
}
