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

import me.golemcore.slackops.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates one-time authorization codes: {@code bot.auth.token-bytes} bytes of
 * {@link SecureRandom} output as lowercase hex (64 characters by default).
 */
@Service
public class OneTimeCodeGenerator {

    private static final int MIN_TOKEN_BYTES = 16;

    private final SecureRandom random = new SecureRandom();
    private final int tokenBytes;

    public OneTimeCodeGenerator(BotProperties properties) {
        this.tokenBytes = Math.max(MIN_TOKEN_BYTES, properties.getAuth().getTokenBytes());
    }

    public String generate() {
        byte[] bytes = new byte[tokenBytes];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
