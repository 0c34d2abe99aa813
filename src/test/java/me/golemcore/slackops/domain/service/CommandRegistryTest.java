package me.golemcore.slackops.domain.service;

import me.golemcore.slackops.domain.exception.InvalidHandlerException;
import me.golemcore.slackops.domain.model.CommandType;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import me.golemcore.slackops.port.inbound.CommandHandler;
import me.golemcore.slackops.port.inbound.CommandPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class CommandRegistryTest {

    private static final CommandHandler NOOP = (context, event, args) -> CompletableFuture.completedFuture(null);

    private CommandRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CommandRegistry(new BotProperties());
    }

    @Test
    void shouldRegisterAdminAndUserCommands() {
        registry.registerAdminCommand("$restart", NOOP);
        registry.registerUserCommand("$ping", NOOP);

        assertTrue(registry.hasCommand("$restart"));
        assertEquals(CommandType.ADMIN, registry.find("$restart").orElseThrow().type());
        assertEquals(CommandType.USER, registry.find("$ping").orElseThrow().type());
        assertEquals(List.of(
                new CommandPort.CommandDefinition("$ping", CommandType.USER),
                new CommandPort.CommandDefinition("$restart", CommandType.ADMIN)),
                registry.listCommands());
    }

    @Test
    void shouldReplaceExistingRegistration() {
        CommandHandler replacement = (context, event, args) -> CompletableFuture.completedFuture(null);
        registry.registerUserCommand("$status", NOOP);

        registry.registerAdminCommand("$status", replacement);

        CommandRegistry.RegisteredCommand registered = registry.find("$status").orElseThrow();
        assertEquals(CommandType.ADMIN, registered.type());
        assertSame(replacement, registered.handler());
        assertEquals(1, registry.listCommands().size());
    }

    @Test
    void shouldRejectReservedTokens() {
        assertThrows(InvalidHandlerException.class, () -> registry.registerAdminCommand("$auth", NOOP));
        assertThrows(InvalidHandlerException.class, () -> registry.registerUserCommand("$deauth", NOOP));
    }

    @Test
    void shouldRejectInvalidTokens() {
        assertThrows(InvalidHandlerException.class, () -> registry.registerUserCommand("ping", NOOP));
        assertThrows(InvalidHandlerException.class, () -> registry.registerUserCommand("$", NOOP));
        assertThrows(InvalidHandlerException.class, () -> registry.registerUserCommand("$do it", NOOP));
        assertThrows(InvalidHandlerException.class, () -> registry.registerUserCommand(" ", NOOP));
        assertThrows(InvalidHandlerException.class, () -> registry.registerUserCommand("$ping", null));
    }

    @Test
    void shouldUnregisterCommand() {
        registry.registerUserCommand("$ping", NOOP);

        assertTrue(registry.unregister("$ping"));
        assertFalse(registry.unregister("$ping"));
        assertFalse(registry.hasCommand("$ping"));
    }

    @Test
    void shouldHonorConfiguredPrefix() {
        BotProperties properties = new BotProperties();
        properties.getCommands().setPrefix("!");
        CommandRegistry bangRegistry = new CommandRegistry(properties);

        bangRegistry.registerUserCommand("!ping", NOOP);

        assertEquals("!auth", bangRegistry.authToken());
        assertTrue(bangRegistry.isSentinelPrefixed("!foo"));
        assertFalse(bangRegistry.isSentinelPrefixed("$foo"));
        assertThrows(InvalidHandlerException.class, () -> bangRegistry.registerUserCommand("$ping", NOOP));
    }
}
