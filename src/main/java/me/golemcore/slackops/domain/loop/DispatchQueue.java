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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;

/**
 * Ordered hand-off channel between the ingress reader (and timers) and the
 * dispatch loop.
 *
 * <p>
 * Unbounded: posting never blocks the reader. A backlog above
 * {@code bot.dispatch.backlog-warn-threshold} is logged since it means the loop
 * is not keeping up and memory grows with it.
 *
 * <p>
 * {@link #postFirst(LoopSignal)} puts a signal ahead of everything already
 * queued. Challenge outcomes use it: a reply that completes a challenge must
 * change authorization state before the loop takes the next event.
 */
@Component
@Slf4j
public class DispatchQueue {

    private final BlockingDeque<LoopSignal> queue = new LinkedBlockingDeque<>();
    private final int backlogWarnThreshold;

    public DispatchQueue(BotProperties properties) {
        this.backlogWarnThreshold = properties.getDispatch().getBacklogWarnThreshold();
    }

    public void post(LoopSignal signal) {
        Objects.requireNonNull(signal, "signal");
        queue.addLast(signal);
        warnOnBacklog();
    }

    public void postFirst(LoopSignal signal) {
        Objects.requireNonNull(signal, "signal");
        queue.addFirst(signal);
        warnOnBacklog();
    }

    public LoopSignal take() throws InterruptedException {
        return queue.takeFirst();
    }

    public int size() {
        return queue.size();
    }

    private void warnOnBacklog() {
        int backlog = queue.size();
        if (backlogWarnThreshold > 0 && backlog > 0 && backlog % backlogWarnThreshold == 0) {
            log.warn("[Dispatch] Backlog reached {} signals", backlog);
        }
    }
}
