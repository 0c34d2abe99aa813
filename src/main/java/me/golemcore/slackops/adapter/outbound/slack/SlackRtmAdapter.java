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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.slackops.domain.exception.SessionException;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import me.golemcore.slackops.port.outbound.ChatConnection;
import me.golemcore.slackops.port.outbound.ChatPlatformPort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Slack Real Time Messaging implementation of {@link ChatPlatformPort}.
 *
 * <p>
 * {@code rtm.connect} returns a single-use WebSocket URL; the socket is opened
 * with the shared OkHttp client and must greet with a hello frame within
 * {@code bot.slack.handshake-timeout}.
 */
@Component
@Slf4j
public class SlackRtmAdapter implements ChatPlatformPort {

    private final SlackApiClient apiClient;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    public SlackRtmAdapter(SlackApiClient apiClient, OkHttpClient httpClient, ObjectMapper objectMapper,
            BotProperties properties) {
        this.apiClient = apiClient;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public ChatConnection openConnection() {
        String url = fetchWebSocketUrl();

        SlackRtmConnection connection = new SlackRtmConnection(objectMapper);
        connection.attach(httpClient.newWebSocket(new Request.Builder().url(url).build(), connection));
        try {
            connection.awaitHello(properties.getSlack().getHandshakeTimeout());
        } catch (SessionException e) {
            connection.close();
            throw e;
        }
        log.info("[Slack] RTM session established");
        return connection;
    }

    private String fetchWebSocketUrl() {
        String token = properties.getSlack().getToken();
        if (token == null || token.isBlank()) {
            throw new SessionException("Slack token not configured (bot.slack.token)");
        }
        JsonNode response;
        try {
            response = apiClient.call("rtm.connect", Map.of());
        } catch (IOException e) {
            throw new SessionException("Unable to retrieve WebSocket URL for Slack RTM session", e);
        }
        if (!response.path("ok").asBoolean(false) || !response.hasNonNull("url")) {
            throw new SessionException("Unable to retrieve WebSocket URL for Slack RTM session: "
                    + SlackApiClient.errorOf(response));
        }
        return response.get("url").asText();
    }
}
