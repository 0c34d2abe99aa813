package me.golemcore.slackops.domain.model;

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

import lombok.Getter;
import lombok.Setter;

import java.util.concurrent.ScheduledFuture;

/**
 * Authorization record of one admin user.
 *
 * <p>
 * Mutated only on the dispatch loop. {@code idleTimer} is non-null iff the
 * state is {@link AuthorizationState#AUTHORIZED}; {@code timerGeneration}
 * increases every time a timer is armed or cancelled so that an expiry fired by
 * a superseded timer can be recognised and dropped.
 */
@Getter
@Setter
public class AdminAuthorization {

    private final String userId;
    private final String email;

    private volatile AuthorizationState state = AuthorizationState.UNAUTHORIZED;
    private volatile boolean challengePending;
    private ScheduledFuture<?> idleTimer;
    private long timerGeneration;
    private String notifyChannel;

    public AdminAuthorization(String userId, String email) {
        this.userId = userId;
        this.email = email;
    }

    public boolean isAuthorized() {
        return state == AuthorizationState.AUTHORIZED;
    }
}
