package me.golemcore.slackops.infrastructure.mail;

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

import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import me.golemcore.slackops.infrastructure.config.BotProperties;

import java.util.Properties;

/**
 * Builds Jakarta Mail SMTP sessions with the configured security mode (SSL,
 * STARTTLS, or plaintext).
 *
 * <p>
 * Not a Spring bean; used directly by the one-time code mailer.
 */
public final class MailSessionFactory {

    private static final String MAIL_PREFIX = "mail.";
    private static final String TRUE_VALUE = "true";

    private MailSessionFactory() {
    }

    /**
     * Creates a session for the account described by {@code config}.
     */
    public static Session createSmtpSession(BotProperties.MailProperties config) {
        Properties props = new Properties();
        MailSecurity security = config.getSecurity();
        String protocol = (security == MailSecurity.SSL) ? "smtps" : "smtp";
        String prefix = MAIL_PREFIX + protocol + ".";

        props.put("mail.transport.protocol", protocol);
        props.put(prefix + "host", config.getHost());
        props.put(prefix + "port", String.valueOf(config.getPort()));
        props.put(prefix + "auth", TRUE_VALUE);
        props.put(prefix + "connectiontimeout", String.valueOf(config.getConnectTimeout()));
        props.put(prefix + "timeout", String.valueOf(config.getReadTimeout()));

        if (security == MailSecurity.SSL) {
            props.put(MAIL_PREFIX + "smtps.ssl.enable", TRUE_VALUE);
        } else if (security == MailSecurity.STARTTLS) {
            props.put(MAIL_PREFIX + "smtp.starttls.enable", TRUE_VALUE);
            props.put(MAIL_PREFIX + "smtp.starttls.required", TRUE_VALUE);
        }

        return Session.getInstance(props, createAuthenticator(config.getUsername(), config.getPassword()));
    }

    private static Authenticator createAuthenticator(String username, String password) {
        return new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        };
    }
}
