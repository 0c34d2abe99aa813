package me.golemcore.slackops.infrastructure.http;

import me.golemcore.slackops.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeoutsAndPingInterval() {
        // Arrange
        BotProperties properties = new BotProperties();
        properties.getHttp().setConnectTimeout(1500);
        properties.getHttp().setReadTimeout(2500);
        properties.getHttp().setWriteTimeout(3500);
        properties.getHttp().setPingInterval(4500);

        // Act
        OkHttpClient client = new OkHttpConfig().slackHttpClient(properties);

        // Assert
        assertEquals(1500, client.connectTimeoutMillis());
        assertEquals(2500, client.readTimeoutMillis());
        assertEquals(3500, client.writeTimeoutMillis());
        assertEquals(4500, client.pingIntervalMillis());
    }
}
