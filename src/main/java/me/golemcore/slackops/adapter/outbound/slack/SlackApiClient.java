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
import me.golemcore.slackops.infrastructure.config.BotProperties;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Minimal Slack Web API client.
 *
 * <p>
 * Methods are called with an HTTP POST of form parameters and the bot token as
 * a bearer credential. Slack reports application errors with HTTP 200 and
 * {@code "ok": false}; callers decide how to map that.
 */
@Component
@Slf4j
public class SlackApiClient {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    public SlackApiClient(OkHttpClient httpClient, ObjectMapper objectMapper, BotProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Invokes a Web API method.
     *
     * @return the parsed response body
     * @throws IOException
     *             on network failure, a non-2xx status or an unreadable body
     */
    public JsonNode call(String method, Map<String, String> params) throws IOException {
        FormBody.Builder form = new FormBody.Builder();
        params.forEach(form::add);

        Request request = new Request.Builder()
                .url(apiUrl(method))
                .header("Authorization", "Bearer " + properties.getSlack().getToken())
                .post(form.build())
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Slack " + method + " failed: HTTP " + response.code());
            }
            JsonNode json = objectMapper.readTree(body.string());
            log.debug("[Slack] {} ok={}", method, json.path("ok").asBoolean(false));
            return json;
        }
    }

    /**
     * Slack's {@code error} field, or {@code unknown_error}.
     */
    public static String errorOf(JsonNode response) {
        return response.path("error").asText("unknown_error");
    }

    private String apiUrl(String method) {
        String base = properties.getSlack().getApiBaseUrl();
        return base.endsWith("/") ? base + method : base + "/" + method;
    }
}
