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

import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.model.CorrelationKey;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Single-shot, cancellable wait for the first event covered by a key.
 *
 * <p>
 * A waiter resolves at most once. Once cancelled it is removed from its table
 * and never resolves; cancelling after resolution is a no-op.
 */
public final class Waiter {

    private final CorrelationKey key;
    private final CompletableFuture<ChatEvent> future = new CompletableFuture<>();
    private final Consumer<Waiter> onCancel;

    Waiter(CorrelationKey key, Consumer<Waiter> onCancel) {
        this.key = key;
        this.onCancel = onCancel;
    }

    public CorrelationKey getKey() {
        return key;
    }

    /**
     * Future completed with the matching event, or cancelled along with this
     * waiter. Cancelling the returned future itself does not cancel the waiter;
     * use {@link #cancel()}.
     */
    public CompletableFuture<ChatEvent> result() {
        return future.copy();
    }

    /**
     * @return true if this call cancelled the waiter, false if it had already
     *         resolved or been cancelled
     */
    public boolean cancel() {
        boolean cancelled = future.cancel(false);
        if (cancelled) {
            onCancel.accept(this);
        }
        return cancelled;
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }

    boolean resolve(ChatEvent event) {
        return future.complete(event);
    }

    @Override
    public String toString() {
        return "Waiter" + key.canonicalForm();
    }
}
