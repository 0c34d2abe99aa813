package me.golemcore.slackops.domain.correlation;

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
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.model.CorrelationKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of outstanding waiters and persistent callbacks, indexed by
 * {@link CorrelationKey}.
 *
 * <p>
 * {@link #onEvent(ChatEvent)} is called by the dispatch loop for every inbound
 * event before the event is classified as a command. Every waiter bucket whose
 * key is covered by the event's key is removed from the table and each of its
 * waiters is resolved with the event; matching callbacks are invoked and stay
 * registered.
 *
 * <p>
 * The scan and the bucket removal happen under one lock, so a registration
 * racing with a scan is either seen by that scan or left for the next event.
 * Waiters are resolved and callbacks invoked after the lock is released.
 *
 * <p>
 * Waiters have no implicit timeout: one that never matches stays here until
 * its owner cancels it.
 */
@Component
@Slf4j
public class CorrelationTable {

    private final Object lock = new Object();
    private final Map<CorrelationKey, List<Waiter>> waiters = new LinkedHashMap<>();
    private final Map<CorrelationKey, List<CallbackRegistration>> callbacks = new LinkedHashMap<>();

    public Waiter registerWaiter(CorrelationKey key) {
        Objects.requireNonNull(key, "key");
        Waiter waiter = new Waiter(key, this::removeWaiter);
        synchronized (lock) {
            waiters.computeIfAbsent(key, k -> new ArrayList<>()).add(waiter);
        }
        log.debug("[Correlation] Waiter registered: {}", key);
        return waiter;
    }

    public CallbackRegistration registerCallback(CorrelationKey key, EventCallback callback) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(callback, "callback");
        CallbackRegistration registration = new CallbackRegistration(key, callback, this::removeCallback);
        synchronized (lock) {
            callbacks.computeIfAbsent(key, k -> new ArrayList<>()).add(registration);
        }
        log.debug("[Correlation] Callback registered: {}", key);
        return registration;
    }

    /**
     * Resolves the waiters and invokes the callbacks matching this event.
     *
     * @return number of waiters resolved
     */
    public int onEvent(ChatEvent event) {
        CorrelationKey eventKey = CorrelationKey.forEvent(event);
        List<Waiter> matchedWaiters = new ArrayList<>();
        List<CallbackRegistration> matchedCallbacks = new ArrayList<>();

        synchronized (lock) {
            Iterator<Map.Entry<CorrelationKey, List<Waiter>>> it = waiters.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<CorrelationKey, List<Waiter>> bucket = it.next();
                if (bucket.getKey().isCoveredBy(eventKey)) {
                    matchedWaiters.addAll(bucket.getValue());
                    it.remove();
                }
            }
            for (Map.Entry<CorrelationKey, List<CallbackRegistration>> bucket : callbacks.entrySet()) {
                if (bucket.getKey().isCoveredBy(eventKey)) {
                    matchedCallbacks.addAll(bucket.getValue());
                }
            }
        }

        int resolved = 0;
        for (Waiter waiter : matchedWaiters) {
            if (waiter.resolve(event)) {
                resolved++;
            }
        }
        if (resolved > 0) {
            log.debug("[Correlation] Resolved {} waiter(s) with event type={}", resolved, event.getType());
        }

        for (CallbackRegistration registration : matchedCallbacks) {
            if (!registration.isActive()) {
                continue;
            }
            try {
                registration.getCallback().onEvent(event);
            } catch (RuntimeException e) {
                log.error("[Correlation] Callback for {} failed", registration.getKey(), e);
            }
        }
        return resolved;
    }

    public int pendingWaiterCount() {
        synchronized (lock) {
            return waiters.values().stream().mapToInt(List::size).sum();
        }
    }

    public int callbackCount() {
        synchronized (lock) {
            return callbacks.values().stream().mapToInt(List::size).sum();
        }
    }

    private void removeWaiter(Waiter waiter) {
        synchronized (lock) {
            removeFromBucket(waiters, waiter.getKey(), waiter);
        }
        log.debug("[Correlation] Waiter cancelled: {}", waiter.getKey());
    }

    private void removeCallback(CallbackRegistration registration) {
        synchronized (lock) {
            removeFromBucket(callbacks, registration.getKey(), registration);
        }
        log.debug("[Correlation] Callback cancelled: {}", registration.getKey());
    }

    private static <T> void removeFromBucket(Map<CorrelationKey, List<T>> table, CorrelationKey key, T item) {
        List<T> bucket = table.get(key);
        if (bucket == null) {
            return;
        }
        bucket.remove(item);
        if (bucket.isEmpty()) {
            table.remove(key);
        }
    }
}
