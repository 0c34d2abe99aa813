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

import java.util.Collection;
import java.util.Map;

/**
 * Resolves chat-platform user ids and emails.
 */
public interface DirectoryPort {

    /**
     * Maps the given admin emails to platform user ids. Emails without a
     * matching user are left out.
     *
     * @return user id to email
     * @throws me.golemcore.slackops.domain.exception.DirectoryException
     *             if the user list cannot be fetched
     */
    Map<String, String> resolveAdminRoster(Collection<String> emails);

    /**
     * @throws me.golemcore.slackops.domain.exception.DirectoryException
     *             if the user list cannot be fetched or the id is unknown
     */
    String resolveEmail(String userId);
}
