package me.golemcore.slackops.domain.service;

import me.golemcore.slackops.domain.correlation.CorrelationTable;
import me.golemcore.slackops.domain.exception.DeliveryException;
import me.golemcore.slackops.domain.exception.DirectoryException;
import me.golemcore.slackops.domain.loop.DispatchQueue;
import me.golemcore.slackops.domain.loop.LoopSignal;
import me.golemcore.slackops.domain.model.ChallengeOutcome;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import me.golemcore.slackops.infrastructure.i18n.MessageService;
import me.golemcore.slackops.port.outbound.DirectoryPort;
import me.golemcore.slackops.port.outbound.OneTimeCodePort;
import me.golemcore.slackops.testsupport.DirectExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AuthorizationChallengeTest {

    private static final String ADMIN = "U_ADMIN";
    private static final String CHANNEL = "C1";
    private static final String EMAIL = "admin@example.com";
    private static final String CODE = "0123456789abcdef";
    private static final String SENT_TEXT = "Sending authorization token to your email address. "
            + "Please send the token as your next message.";

    private DirectoryPort directoryPort;
    private OneTimeCodePort oneTimeCodePort;
    private CorrelationTable correlationTable;
    private ChatSender chatSender;
    private OneTimeCodeGenerator codeGenerator;
    private DispatchQueue dispatchQueue;
    private BotProperties properties;

    @BeforeEach
    void setUp() {
        directoryPort = mock(DirectoryPort.class);
        oneTimeCodePort = mock(OneTimeCodePort.class);
        correlationTable = new CorrelationTable();
        chatSender = mock(ChatSender.class);
        when(chatSender.send(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        codeGenerator = mock(OneTimeCodeGenerator.class);
        when(codeGenerator.generate()).thenReturn(CODE);
        dispatchQueue = mock(DispatchQueue.class);
        properties = new BotProperties();

        when(directoryPort.resolveEmail(ADMIN)).thenReturn(EMAIL);
    }

    private AuthorizationChallenge createChallenge() {
        return new AuthorizationChallenge(directoryPort, oneTimeCodePort, correlationTable, chatSender,
                new MessageService(), codeGenerator, dispatchQueue, properties, new DirectExecutorService());
    }

    @Test
    void shouldSucceedWhenReplyMatchesCode() throws Exception {
        // Arrange
        CompletableFuture<ChallengeOutcome> outcome = createChallenge().start(
                ChatEvent.message(ADMIN, CHANNEL, "$auth"));

        // Act
        correlationTable.onEvent(ChatEvent.message(ADMIN, CHANNEL, CODE));

        // Assert
        assertEquals(ChallengeOutcome.SUCCEEDED, outcome.get(1, TimeUnit.SECONDS));
        verify(oneTimeCodePort).sendOneTimeCode(EMAIL, CODE);
        verify(dispatchQueue).postFirst(new LoopSignal.ChallengeCompleted(ADMIN, CHANNEL, ChallengeOutcome.SUCCEEDED));
    }

    @Test
    void shouldFailWhenReplyDiffers() throws Exception {
        CompletableFuture<ChallengeOutcome> outcome = createChallenge().start(
                ChatEvent.message(ADMIN, CHANNEL, "$auth"));

        correlationTable.onEvent(ChatEvent.message(ADMIN, "D_DIRECT", CODE + " "));

        assertEquals(ChallengeOutcome.FAILED, outcome.get(1, TimeUnit.SECONDS));
        verify(dispatchQueue).postFirst(new LoopSignal.ChallengeCompleted(ADMIN, CHANNEL, ChallengeOutcome.FAILED));
    }

    @Test
    void shouldIgnoreMessagesFromOtherUsers() {
        CompletableFuture<ChallengeOutcome> outcome = createChallenge().start(
                ChatEvent.message(ADMIN, CHANNEL, "$auth"));

        correlationTable.onEvent(ChatEvent.message("U_OTHER", CHANNEL, CODE));

        assertFalse(outcome.isDone());
        assertEquals(1, correlationTable.pendingWaiterCount());
    }

    @Test
    void shouldAnnounceBeforeMailingCode() {
        createChallenge().start(ChatEvent.message(ADMIN, CHANNEL, "$auth"));

        InOrder inOrder = inOrder(chatSender, oneTimeCodePort);
        inOrder.verify(chatSender).send(CHANNEL, SENT_TEXT);
        inOrder.verify(oneTimeCodePort).sendOneTimeCode(EMAIL, CODE);
    }

    @Test
    void shouldAbortAndCancelWaiterWhenDirectoryFails() throws Exception {
        // Arrange
        when(directoryPort.resolveEmail(ADMIN)).thenThrow(new DirectoryException("Unable to find email"));

        // Act
        ChallengeOutcome outcome = createChallenge().start(ChatEvent.message(ADMIN, CHANNEL, "$auth"))
                .get(1, TimeUnit.SECONDS);

        // Assert
        assertEquals(ChallengeOutcome.ABORTED, outcome);
        assertEquals(0, correlationTable.pendingWaiterCount());
        verify(chatSender).send(CHANNEL, "Authorization aborted: Unable to find email");
        verify(dispatchQueue).postFirst(new LoopSignal.ChallengeCompleted(ADMIN, CHANNEL, ChallengeOutcome.ABORTED));
        verifyNoInteractions(oneTimeCodePort);
    }

    @Test
    void shouldAbortWhenMailDeliveryFails() throws Exception {
        doThrow(new DeliveryException("SMTP authentication failed"))
                .when(oneTimeCodePort).sendOneTimeCode(EMAIL, CODE);

        ChallengeOutcome outcome = createChallenge().start(ChatEvent.message(ADMIN, CHANNEL, "$auth"))
                .get(1, TimeUnit.SECONDS);

        assertEquals(ChallengeOutcome.ABORTED, outcome);
        assertEquals(0, correlationTable.pendingWaiterCount());
        verify(chatSender).send(CHANNEL, "Authorization aborted: SMTP authentication failed");
    }

    @Test
    void shouldTimeOutWhenChallengeTimeoutConfigured() throws Exception {
        properties.getAuth().setChallengeTimeout(Duration.ofMillis(50));

        ChallengeOutcome outcome = createChallenge().start(ChatEvent.message(ADMIN, CHANNEL, "$auth"))
                .get(2, TimeUnit.SECONDS);

        assertEquals(ChallengeOutcome.TIMED_OUT, outcome);
        assertEquals(0, correlationTable.pendingWaiterCount());
        verify(dispatchQueue).postFirst(new LoopSignal.ChallengeCompleted(ADMIN, CHANNEL, ChallengeOutcome.TIMED_OUT));
    }
}
