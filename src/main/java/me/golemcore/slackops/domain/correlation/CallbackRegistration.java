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

import me.golemcore.slackops.domain.model.CorrelationKey;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handle for a persistent callback; {@link #cancel()} stops further
 * invocations.
 */
public final class CallbackRegistration {

    private final CorrelationKey key;
    private final EventCallback callback;
    private final Consumer<CallbackRegistration> onCancel;
    private final AtomicBoolean active = new AtomicBoolean(true);

    CallbackRegistration(CorrelationKey key, EventCallback callback, Consumer<CallbackRegistration> onCancel) {
        this.key = key;
        this.callback = callback;
        this.onCancel = onCancel;
    }

    public CorrelationKey getKey() {
        return key;
    }

    EventCallback getCallback() {
        return callback;
    }

    public boolean isActive() {
        return active.get();
    }

    public boolean cancel() {
        if (active.compareAndSet(true, false)) {
            onCancel.accept(this);
            return true;
        }
        return false;
    }
}
