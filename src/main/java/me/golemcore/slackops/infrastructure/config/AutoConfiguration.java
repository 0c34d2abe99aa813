package me.golemcore.slackops.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans: JSON mapper and the executors the engine runs
 * on.
 *
 * <ul>
 * <li>{@code commandHandlerExecutor} - command handlers and {@code $auth}
 * challenges, sized by {@code bot.dispatch.handler-threads}</li>
 * <li>{@code authTimerScheduler} - idle-expiry timers; a firing only posts a
 * signal to the dispatch loop</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class AutoConfiguration {

    private final BotProperties properties;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService commandHandlerExecutor() {
        int threads = Math.max(1, properties.getDispatch().getHandlerThreads());
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("command-handler-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService authTimerScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedDaemonThreads("auth-idle-timer-"));
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
