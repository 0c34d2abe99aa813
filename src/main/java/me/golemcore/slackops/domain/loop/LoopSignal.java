package me.golemcore.slackops.domain.loop;

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

import me.golemcore.slackops.domain.model.ChallengeOutcome;
import me.golemcore.slackops.domain.model.ChatEvent;

/**
 * Work item for the dispatch loop. Inbound events and every trigger that
 * changes authorization state arrive through the same queue, so that state is
 * only ever touched by the loop thread.
 */
public interface LoopSignal {

    /**
     * An event read from the stream, in arrival order.
     */
    record Inbound(ChatEvent event) implements LoopSignal {
    }

    /**
     * An idle timer fired. Dropped if {@code generation} is no longer the
     * user's current timer generation.
     */
    record AuthorizationExpired(String userId, long generation) implements LoopSignal {
    }

    /**
     * An {@code $auth} challenge finished.
     */
    record ChallengeCompleted(String userId, String channelId, ChallengeOutcome outcome) implements LoopSignal {
    }
}
