package me.golemcore.slackops.domain.component;

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

import me.golemcore.slackops.domain.model.CommandType;
import me.golemcore.slackops.port.inbound.CommandHandler;

/**
 * A built-in command discovered as a Spring bean and registered at startup.
 * Components that return {@code false} from {@link #isEnabled()} are skipped.
 */
public interface CommandComponent extends CommandHandler {

    /**
     * Command token including the sentinel prefix, e.g. {@code "$power"}.
     */
    String getName();

    CommandType getType();

    default boolean isEnabled() {
        return true;
    }
}
