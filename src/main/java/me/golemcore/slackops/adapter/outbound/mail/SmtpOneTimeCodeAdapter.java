package me.golemcore.slackops.adapter.outbound.mail;

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

import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.slackops.domain.exception.DeliveryException;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import me.golemcore.slackops.infrastructure.i18n.MessageService;
import me.golemcore.slackops.infrastructure.mail.MailSessionFactory;
import me.golemcore.slackops.port.outbound.OneTimeCodePort;
import org.springframework.stereotype.Component;

import java.util.Date;

/**
 * Emails one-time authorization codes over SMTP.
 *
 * <p>
 * The code itself is never logged.
 */
@Component
@Slf4j
@SuppressWarnings("PMD.ReplaceJavaUtilDate") // jakarta.mail.internet.MimeMessage.setSentDate requires java.util.Date
public class SmtpOneTimeCodeAdapter implements OneTimeCodePort {

    private final BotProperties properties;
    private final MessageService messageService;

    public SmtpOneTimeCodeAdapter(BotProperties properties, MessageService messageService) {
        this.properties = properties;
        this.messageService = messageService;
    }

    @Override
    public void sendOneTimeCode(String email, String code) {
        BotProperties.MailProperties config = properties.getMail();
        if (config.getUsername() == null || config.getUsername().isBlank()) {
            throw new DeliveryException("SMTP account not configured (bot.mail.username)");
        }

        try {
            Session session = MailSessionFactory.createSmtpSession(config);
            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(senderOf(config)));
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(email));
            message.setSubject(messageService.getMessage("mail.code.subject"), "UTF-8");
            message.setContent(messageService.getMessage("mail.code.body", code), "text/plain; charset=UTF-8");
            message.setSentDate(new Date());

            deliver(message);
            log.info("[SMTP] One-time code sent to {}", email);
        } catch (AuthenticationFailedException e) {
            log.error("[SMTP] Authentication failed for {}", config.getUsername(), e);
            throw new DeliveryException("SMTP authentication failed", e);
        } catch (MessagingException e) {
            log.error("[SMTP] Messaging error: {}", e.getMessage(), e);
            throw new DeliveryException("Unable to send authorization email: " + e.getMessage(), e);
        }
    }

    protected void deliver(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }

    private static String senderOf(BotProperties.MailProperties config) {
        String from = config.getFrom();
        return from != null && !from.isBlank() ? from : config.getUsername();
    }
}
