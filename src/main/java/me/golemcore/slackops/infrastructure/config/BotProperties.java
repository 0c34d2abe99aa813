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

import lombok.Data;
import me.golemcore.slackops.infrastructure.mail.MailSecurity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link SlackProperties} - RTM token, Web API base URL, handshake
 * timeout</li>
 * <li>{@code admins} - emails of the users treated as admins</li>
 * <li>{@link AuthProperties} - idle expiry and challenge settings</li>
 * <li>{@link CommandsProperties} - command sentinel and built-in commands</li>
 * <li>{@link MailProperties} - SMTP account that sends one-time codes</li>
 * <li>{@link DispatchProperties} - handler pool and backlog warnings</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private SlackProperties slack = new SlackProperties();
    private List<String> admins = new ArrayList<>();
    private AuthProperties auth = new AuthProperties();
    private CommandsProperties commands = new CommandsProperties();
    private MailProperties mail = new MailProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class SlackProperties {
        private String token;
        private String apiBaseUrl = "https://slack.com/api";
        private Duration handshakeTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class AuthProperties {
        private Duration idleTimeout = Duration.ofSeconds(300);
        /**
         * Unset means the challenge waits for the reply indefinitely.
         */
        private Duration challengeTimeout;
        private int tokenBytes = 32;
    }

    @Data
    public static class CommandsProperties {
        private String prefix = "$";
        private PowerCommandProperties power = new PowerCommandProperties();
    }

    @Data
    public static class PowerCommandProperties {
        private String macAddress;
        private String broadcastAddress = "255.255.255.255";
        private int port = 9;
    }

    @Data
    public static class MailProperties {
        private String host = "smtp.gmail.com";
        private int port = 587;
        private String username;
        private String password;
        private String from;
        private MailSecurity security = MailSecurity.STARTTLS;
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
    }

    @Data
    public static class DispatchProperties {
        private int handlerThreads = 4;
        private int backlogWarnThreshold = 1000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private long pingInterval = 30000;
    }
}
