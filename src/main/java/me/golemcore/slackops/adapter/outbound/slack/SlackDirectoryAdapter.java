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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.slackops.domain.exception.DirectoryException;
import me.golemcore.slackops.port.outbound.DirectoryPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Slack {@code users.list} implementation of {@link DirectoryPort}.
 *
 * <p>
 * Follows {@code response_metadata.next_cursor} until the full member list is
 * read. Emails are matched case-insensitively.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackDirectoryAdapter implements DirectoryPort {

    private static final String PAGE_LIMIT = "200";

    private final SlackApiClient apiClient;

    @Override
    public Map<String, String> resolveAdminRoster(Collection<String> emails) {
        Set<String> wanted = emails.stream()
                .map(email -> email.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        Map<String, String> roster = new LinkedHashMap<>();
        for (JsonNode member : listMembers()) {
            String email = emailOf(member);
            if (email != null && wanted.contains(email.toLowerCase(Locale.ROOT))) {
                roster.put(member.path("id").asText(), email);
            }
        }
        if (roster.size() < wanted.size()) {
            log.warn("[Slack] {} of {} admin email(s) have no Slack user", wanted.size() - roster.size(),
                    wanted.size());
        }
        return roster;
    }

    @Override
    public String resolveEmail(String userId) {
        for (JsonNode member : listMembers()) {
            if (userId.equals(member.path("id").asText())) {
                String email = emailOf(member);
                if (email == null) {
                    throw new DirectoryException("Slack user " + userId + " has no email");
                }
                return email;
            }
        }
        throw new DirectoryException("Unable to find email for user ID " + userId);
    }

    private List<JsonNode> listMembers() {
        List<JsonNode> members = new ArrayList<>();
        String cursor = "";
        do {
            Map<String, String> params = new HashMap<>();
            params.put("limit", PAGE_LIMIT);
            if (!cursor.isEmpty()) {
                params.put("cursor", cursor);
            }
            JsonNode response;
            try {
                response = apiClient.call("users.list", params);
            } catch (IOException e) {
                throw new DirectoryException("Unable to retrieve Slack user list", e);
            }
            if (!response.path("ok").asBoolean(false)) {
                throw new DirectoryException("Unable to retrieve Slack user list: " + SlackApiClient.errorOf(response));
            }
            response.path("members").forEach(members::add);
            cursor = response.path("response_metadata").path("next_cursor").asText("");
        } while (!cursor.isEmpty());
        return members;
    }

    private static String emailOf(JsonNode member) {
        JsonNode email = member.path("profile").path("email");
        return email.isTextual() ? email.asText() : null;
    }
}
