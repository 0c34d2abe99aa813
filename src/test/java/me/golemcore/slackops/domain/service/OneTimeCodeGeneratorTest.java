package me.golemcore.slackops.domain.service;

import me.golemcore.slackops.infrastructure.config.BotProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OneTimeCodeGeneratorTest {

    @Test
    void shouldGenerate256BitHexCodeByDefault() {
        OneTimeCodeGenerator generator = new OneTimeCodeGenerator(new BotProperties());

        String code = generator.generate();

        assertEquals(64, code.length());
        assertTrue(code.matches("[0-9a-f]+"));
    }

    @Test
    void shouldGenerateDistinctCodes() {
        OneTimeCodeGenerator generator = new OneTimeCodeGenerator(new BotProperties());

        assertNotEquals(generator.generate(), generator.generate());
    }

    @Test
    void shouldNotGoBelowMinimumLength() {
        BotProperties properties = new BotProperties();
        properties.getAuth().setTokenBytes(4);

        String code = new OneTimeCodeGenerator(properties).generate();

        assertEquals(32, code.length());
    }
}
