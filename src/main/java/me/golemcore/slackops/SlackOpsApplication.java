package me.golemcore.slackops;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Slack operations bot.
 *
 * <p>
 * Listens on a Slack RTM connection, dispatches {@code $}-prefixed commands
 * to registered handlers and gates admin commands behind an emailed one-time
 * code.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → SlackIngressBridge, CommandDispatcher
 * Domain Layer       → DispatchLoop, CorrelationTable, AuthorizationService
 * Infrastructure     → Slack RTM / Web API, SMTP
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SlackOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlackOpsApplication.class, args);
    }

}
