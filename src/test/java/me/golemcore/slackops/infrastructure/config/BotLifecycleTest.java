package me.golemcore.slackops.infrastructure.config;

import me.golemcore.slackops.adapter.inbound.slack.SlackIngressBridge;
import me.golemcore.slackops.domain.component.CommandComponent;
import me.golemcore.slackops.domain.exception.DirectoryException;
import me.golemcore.slackops.domain.loop.DispatchLoop;
import me.golemcore.slackops.domain.model.CommandType;
import me.golemcore.slackops.domain.service.AuthorizationService;
import me.golemcore.slackops.domain.service.ChatSender;
import me.golemcore.slackops.domain.service.CommandRegistry;
import me.golemcore.slackops.port.outbound.DirectoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BotLifecycleTest {

    private BotProperties properties;
    private DirectoryPort directory;
    private AuthorizationService authorizationService;
    private CommandRegistry registry;
    private ChatSender chatSender;
    private DispatchLoop dispatchLoop;
    private SlackIngressBridge ingressBridge;
    private ConfigurableApplicationContext applicationContext;
    private CompletableFuture<Void> termination;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.setAdmins(List.of("admin@example.com"));
        directory = mock(DirectoryPort.class);
        when(directory.resolveAdminRoster(List.of("admin@example.com")))
                .thenReturn(Map.of("U_ADMIN", "admin@example.com"));
        authorizationService = mock(AuthorizationService.class);
        registry = new CommandRegistry(properties);
        chatSender = mock(ChatSender.class);
        dispatchLoop = mock(DispatchLoop.class);
        termination = new CompletableFuture<>();
        when(dispatchLoop.start()).thenReturn(termination);
        ingressBridge = mock(SlackIngressBridge.class);
        applicationContext = mock(ConfigurableApplicationContext.class);
    }

    private CommandComponent component(String name, CommandType type, boolean enabled) {
        CommandComponent component = mock(CommandComponent.class);
        when(component.getName()).thenReturn(name);
        when(component.getType()).thenReturn(type);
        when(component.isEnabled()).thenReturn(enabled);
        return component;
    }

    private BotLifecycle createLifecycle(List<CommandComponent> components) {
        return new BotLifecycle(properties, directory, authorizationService, registry, components, chatSender,
                dispatchLoop, ingressBridge, applicationContext);
    }

    @Test
    void shouldLoadRosterRegisterCommandsAndStartInOrder() {
        // Arrange
        BotLifecycle lifecycle = createLifecycle(List.of(
                component("$power", CommandType.ADMIN, false),
                component("$whoami", CommandType.USER, true)));

        // Act
        lifecycle.start();

        // Assert
        verify(authorizationService).loadRoster(Map.of("U_ADMIN", "admin@example.com"));
        assertTrue(registry.hasCommand("$whoami"));
        assertFalse(registry.hasCommand("$power"));
        InOrder inOrder = inOrder(chatSender, dispatchLoop, ingressBridge);
        inOrder.verify(chatSender).start();
        inOrder.verify(dispatchLoop).start();
        inOrder.verify(ingressBridge).start();
    }

    @Test
    void shouldAbortStartupWhenDirectoryFails() {
        when(directory.resolveAdminRoster(List.of("admin@example.com")))
                .thenThrow(new DirectoryException("invalid_auth"));
        BotLifecycle lifecycle = createLifecycle(List.of());

        assertThrows(DirectoryException.class, lifecycle::start);
        verifyNoInteractions(chatSender, dispatchLoop, ingressBridge);
    }

    @Test
    void shouldCloseContextWhenLoopTerminates() {
        when(applicationContext.isActive()).thenReturn(true);
        createLifecycle(List.of()).start();

        termination.complete(null);

        verify(applicationContext, timeout(1000)).close();
    }

    @Test
    void shouldStopIngressAndLoop() {
        createLifecycle(List.of()).stop();

        verify(ingressBridge).stop();
        verify(dispatchLoop).stop();
    }
}
