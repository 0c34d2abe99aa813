package me.golemcore.slackops.domain.loop;

import me.golemcore.slackops.adapter.inbound.command.CommandDispatcher;
import me.golemcore.slackops.domain.correlation.CorrelationTable;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.service.AuthorizationChallenge;
import me.golemcore.slackops.domain.service.AuthorizationService;
import me.golemcore.slackops.domain.service.ChatSender;
import me.golemcore.slackops.domain.service.CommandRegistry;
import me.golemcore.slackops.domain.service.DefaultCommandContext;
import me.golemcore.slackops.domain.service.OneTimeCodeGenerator;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import me.golemcore.slackops.infrastructure.i18n.MessageService;
import me.golemcore.slackops.port.inbound.CommandHandler;
import me.golemcore.slackops.port.outbound.DirectoryPort;
import me.golemcore.slackops.port.outbound.OneTimeCodePort;
import me.golemcore.slackops.testsupport.DirectExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Drives the dispatch loop through a full {@code $auth} round trip with only
 * the platform, directory, mailer and timer scheduler mocked.
 */
class AuthorizationFlowTest {

    private static final String ADMIN = "U_ADMIN";
    private static final String EMAIL = "admin@example.com";
    private static final String CHANNEL = "C_OPS";
    private static final String CODE = "c0ffee";
    private static final long IDLE_MILLIS = 300_000L;

    private DispatchQueue dispatchQueue;
    private DispatchLoop loop;
    private ScheduledExecutorService scheduler;
    private OneTimeCodePort oneTimeCodePort;
    private CommandHandler restartHandler;
    private final List<String> replies = new ArrayList<>();

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        ExecutorService executor = new DirectExecutorService();
        MessageService messageService = new MessageService();

        dispatchQueue = new DispatchQueue(properties);
        CorrelationTable correlationTable = new CorrelationTable();
        CommandRegistry registry = new CommandRegistry(properties);

        scheduler = mock(ScheduledExecutorService.class);
        doReturn(mock(ScheduledFuture.class)).when(scheduler)
                .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        AuthorizationService authorizationService = new AuthorizationService(properties, scheduler, dispatchQueue);
        authorizationService.loadRoster(Map.of(ADMIN, EMAIL));

        ChatSender chatSender = mock(ChatSender.class);
        when(chatSender.send(anyString(), anyString())).thenAnswer(invocation -> {
            replies.add(invocation.getArgument(1));
            return CompletableFuture.completedFuture(null);
        });

        DirectoryPort directoryPort = mock(DirectoryPort.class);
        when(directoryPort.resolveEmail(ADMIN)).thenReturn(EMAIL);
        oneTimeCodePort = mock(OneTimeCodePort.class);
        OneTimeCodeGenerator codeGenerator = mock(OneTimeCodeGenerator.class);
        when(codeGenerator.generate()).thenReturn(CODE);

        AuthorizationChallenge challenge = new AuthorizationChallenge(directoryPort, oneTimeCodePort,
                correlationTable, chatSender, messageService, codeGenerator, dispatchQueue, properties, executor);
        DefaultCommandContext context = new DefaultCommandContext(chatSender, authorizationService,
                correlationTable, registry);
        CommandDispatcher dispatcher = new CommandDispatcher(registry, authorizationService, challenge, chatSender,
                messageService, context, executor);
        loop = new DispatchLoop(dispatchQueue, correlationTable, dispatcher, authorizationService);

        restartHandler = mock(CommandHandler.class);
        when(restartHandler.handle(any(), any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        registry.registerAdminCommand("$restart", restartHandler);
    }

    private void receive(String text) throws InterruptedException {
        dispatchQueue.post(new LoopSignal.Inbound(ChatEvent.message(ADMIN, CHANNEL, text)));
        drain();
    }

    private void drain() throws InterruptedException {
        while (dispatchQueue.size() > 0) {
            assertTrue(loop.process(dispatchQueue.take()));
        }
    }

    @Test
    void shouldAuthorizeAdminAndRunCommand() throws Exception {
        // Act
        receive("$auth");
        receive(CODE);
        receive("$restart");

        // Assert
        verify(oneTimeCodePort).sendOneTimeCode(EMAIL, CODE);
        assertEquals(List.of(
                "Sending authorization token to your email address. Please send the token as your next message.",
                "Authorization succeeded."), replies);
        verify(restartHandler).handle(any(), any(), eq(List.of()));
        verify(scheduler, times(2)).schedule(any(Runnable.class), eq(IDLE_MILLIS), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldApplyChallengeOutcomeBeforeCommandQueuedBehindCode() throws Exception {
        // Arrange
        receive("$auth");
        dispatchQueue.post(new LoopSignal.Inbound(ChatEvent.message(ADMIN, CHANNEL, CODE)));
        dispatchQueue.post(new LoopSignal.Inbound(ChatEvent.message(ADMIN, CHANNEL, "$restart")));

        // Act
        drain();

        // Assert
        assertEquals(List.of(
                "Sending authorization token to your email address. Please send the token as your next message.",
                "Authorization succeeded."), replies);
        verify(restartHandler).handle(any(), any(), eq(List.of()));
    }

    @Test
    void shouldRejectWrongCode() throws Exception {
        receive("$auth");
        receive("not-the-code");
        receive("$restart");

        assertEquals(List.of(
                "Sending authorization token to your email address. Please send the token as your next message.",
                "Authorization failed.",
                "You are not authorized to use this command. Use $auth first."), replies);
        verifyNoInteractions(restartHandler);
    }

    @Test
    void shouldExpireAfterIdleTimeout() throws Exception {
        // Arrange
        receive("$auth");
        receive(CODE);
        ArgumentCaptor<Runnable> timer = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(timer.capture(), anyLong(), any(TimeUnit.class));
        replies.clear();

        // Act
        timer.getValue().run();
        drain();
        receive("$restart");

        // Assert
        assertEquals(List.of(
                "Your authorization expired. Use $auth to authorize again.",
                "You are not authorized to use this command. Use $auth first."), replies);
        verifyNoInteractions(restartHandler);
    }

    @Test
    void shouldDeauthorizeOnRequest() throws Exception {
        receive("$auth");
        receive(CODE);
        replies.clear();

        receive("$deauth");
        receive("$restart");

        assertEquals(List.of(
                "Authorization revoked.",
                "You are not authorized to use this command. Use $auth first."), replies);
    }
}
