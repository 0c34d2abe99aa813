package me.golemcore.slackops.domain.service;

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
import me.golemcore.slackops.domain.loop.DispatchQueue;
import me.golemcore.slackops.domain.loop.LoopSignal;
import me.golemcore.slackops.domain.model.AdminAuthorization;
import me.golemcore.slackops.domain.model.AuthorizationState;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-admin authorization state machine with idle expiry.
 *
 * <p>
 * States are {@link AuthorizationState#UNAUTHORIZED} and
 * {@link AuthorizationState#AUTHORIZED}. Every transition method is meant to be
 * called from the dispatch loop only; {@link #isAdmin(String)} and
 * {@link #isAuthorized(String)} may be read from any thread.
 *
 * <p>
 * Timer discipline: arming a timer always cancels the previous one first, and
 * every arm or cancel bumps the user's timer generation. A timer firing only
 * posts {@link LoopSignal.AuthorizationExpired} with the generation it was
 * armed under; {@link #expire(String, long)} ignores stale generations, so a
 * timer that fired just before a {@code $deauth} or a refresh cannot revoke the
 * newer state.
 */
@Service
@Slf4j
public class AuthorizationService {

    private final Map<String, AdminAuthorization> roster = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timerScheduler;
    private final DispatchQueue dispatchQueue;
    private final Duration idleTimeout;

    public AuthorizationService(BotProperties properties,
            @Qualifier("authTimerScheduler") ScheduledExecutorService timerScheduler,
            DispatchQueue dispatchQueue) {
        this.timerScheduler = timerScheduler;
        this.dispatchQueue = dispatchQueue;
        this.idleTimeout = properties.getAuth().getIdleTimeout();
    }

    /**
     * Replaces the roster with the given admins, all unauthorized.
     */
    public void loadRoster(Map<String, String> adminEmailsById) {
        roster.values().forEach(this::cancelTimer);
        roster.clear();
        adminEmailsById.forEach((userId, email) -> roster.put(userId, new AdminAuthorization(userId, email)));
        log.info("[Auth] Admin roster loaded: {} user(s)", roster.size());
    }

    public boolean isAdmin(String userId) {
        return userId != null && roster.containsKey(userId);
    }

    public boolean isAuthorized(String userId) {
        AdminAuthorization admin = userId != null ? roster.get(userId) : null;
        return admin != null && admin.isAuthorized();
    }

    public Optional<AdminAuthorization> find(String userId) {
        return Optional.ofNullable(userId != null ? roster.get(userId) : null);
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    /**
     * Marks a challenge as in progress.
     *
     * @return false if the user is not an admin, is already authorized, or
     *         already has a challenge pending
     */
    public boolean beginChallenge(String userId) {
        AdminAuthorization admin = roster.get(userId);
        if (admin == null || admin.isAuthorized() || admin.isChallengePending()) {
            return false;
        }
        admin.setChallengePending(true);
        return true;
    }

    /**
     * Ends the pending challenge; on success moves the user to
     * {@link AuthorizationState#AUTHORIZED} and arms the idle timer.
     *
     * @return true if the user is now authorized
     */
    public boolean completeChallenge(String userId, boolean succeeded, String channelId) {
        AdminAuthorization admin = roster.get(userId);
        if (admin == null) {
            return false;
        }
        admin.setChallengePending(false);
        if (!succeeded) {
            return false;
        }
        admin.setState(AuthorizationState.AUTHORIZED);
        admin.setNotifyChannel(channelId);
        armTimer(admin);
        log.info("[Auth] User {} authorized for {}", userId, idleTimeout);
        return true;
    }

    /**
     * {@code $deauth}: cancels the timer and returns to unauthorized.
     *
     * @return false if the user was not authorized (no-op)
     */
    public boolean revoke(String userId) {
        AdminAuthorization admin = roster.get(userId);
        if (admin == null || !admin.isAuthorized()) {
            return false;
        }
        cancelTimer(admin);
        admin.setState(AuthorizationState.UNAUTHORIZED);
        log.info("[Auth] User {} deauthorized", userId);
        return true;
    }

    /**
     * Activity by an authorized admin: re-arms the idle timer.
     *
     * @return false if the user is not authorized
     */
    public boolean refresh(String userId, String channelId) {
        AdminAuthorization admin = roster.get(userId);
        if (admin == null || !admin.isAuthorized()) {
            return false;
        }
        if (channelId != null) {
            admin.setNotifyChannel(channelId);
        }
        armTimer(admin);
        log.debug("[Auth] Idle timer refreshed for {}", userId);
        return true;
    }

    /**
     * Handles a timer firing.
     *
     * @return the channel to notify if the user was moved to unauthorized;
     *         empty for a stale or unknown timer
     */
    public Optional<String> expire(String userId, long generation) {
        AdminAuthorization admin = roster.get(userId);
        if (admin == null || !admin.isAuthorized() || admin.getTimerGeneration() != generation) {
            log.debug("[Auth] Ignoring stale idle timer for {} (generation {})", userId, generation);
            return Optional.empty();
        }
        admin.setIdleTimer(null);
        admin.setTimerGeneration(admin.getTimerGeneration() + 1);
        admin.setState(AuthorizationState.UNAUTHORIZED);
        log.info("[Auth] Authorization of {} expired after {} idle", userId, idleTimeout);
        return Optional.ofNullable(admin.getNotifyChannel());
    }

    /**
     * Time left before the user's authorization expires.
     */
    public Optional<Duration> remainingIdleTime(String userId) {
        AdminAuthorization admin = roster.get(userId);
        if (admin == null || admin.getIdleTimer() == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(admin.getIdleTimer().getDelay(TimeUnit.MILLISECONDS)));
    }

    /**
     * Cancels every live timer, e.g. on shutdown.
     */
    public void cancelAllTimers() {
        roster.values().forEach(this::cancelTimer);
    }

    private void armTimer(AdminAuthorization admin) {
        cancelTimer(admin);
        long generation = admin.getTimerGeneration();
        String userId = admin.getUserId();
        ScheduledFuture<?> timer = timerScheduler.schedule(
                () -> dispatchQueue.post(new LoopSignal.AuthorizationExpired(userId, generation)),
                idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
        admin.setIdleTimer(timer);
    }

    private void cancelTimer(AdminAuthorization admin) {
        ScheduledFuture<?> timer = admin.getIdleTimer();
        if (timer != null) {
            timer.cancel(false);
            admin.setIdleTimer(null);
        }
        admin.setTimerGeneration(admin.getTimerGeneration() + 1);
    }
}
