package me.golemcore.slackops.domain.correlation;

import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.model.CorrelationKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationTableTest {

    private static final String USER = "U123";
    private static final String CHANNEL = "C1";

    private CorrelationTable table;

    @BeforeEach
    void setUp() {
        table = new CorrelationTable();
    }

    @Test
    void shouldResolveWaiterWithFirstCoveringEvent() throws Exception {
        // Arrange
        Waiter waiter = table.registerWaiter(CorrelationKey.of(Map.of("user", USER)));
        ChatEvent event = ChatEvent.message(USER, CHANNEL, "abc");

        // Act
        int resolved = table.onEvent(event);

        // Assert
        assertEquals(1, resolved);
        assertEquals(event, waiter.result().get());
        assertEquals(0, table.pendingWaiterCount());
    }

    @Test
    void shouldLeaveWaiterPendingForNonMatchingEvent() {
        Waiter waiter = table.registerWaiter(CorrelationKey.of(Map.of("user", USER)));

        int resolved = table.onEvent(ChatEvent.message("U999", CHANNEL, "abc"));

        assertEquals(0, resolved);
        assertFalse(waiter.isDone());
        assertEquals(1, table.pendingWaiterCount());
    }

    @Test
    void shouldResolveAllWaitersInMatchingBucket() throws Exception {
        CorrelationKey key = CorrelationKey.of(Map.of("user", USER));
        Waiter first = table.registerWaiter(key);
        Waiter second = table.registerWaiter(key);
        ChatEvent event = ChatEvent.message(USER, CHANNEL, "abc");

        int resolved = table.onEvent(event);

        assertEquals(2, resolved);
        assertEquals(event, first.result().get());
        assertEquals(event, second.result().get());
    }

    @Test
    void shouldResolveWildcardWaiterWithAnyEvent() {
        Waiter waiter = table.registerWaiter(CorrelationKey.wildcard());

        table.onEvent(ChatEvent.of(Map.of("type", "user_typing", "user", USER)));

        assertTrue(waiter.isDone());
    }

    @Test
    void shouldNotResolveWaiterAfterSecondEvent() throws Exception {
        Waiter waiter = table.registerWaiter(CorrelationKey.of(Map.of("user", USER)));
        ChatEvent first = ChatEvent.message(USER, CHANNEL, "one");

        table.onEvent(first);
        int resolved = table.onEvent(ChatEvent.message(USER, CHANNEL, "two"));

        assertEquals(0, resolved);
        assertEquals(first, waiter.result().get());
    }

    @Test
    void shouldRemoveCancelledWaiter() {
        Waiter waiter = table.registerWaiter(CorrelationKey.of(Map.of("user", USER)));

        waiter.cancel();
        int resolved = table.onEvent(ChatEvent.message(USER, CHANNEL, "abc"));

        assertEquals(0, resolved);
        assertEquals(0, table.pendingWaiterCount());
        assertTrue(waiter.isCancelled());
    }

    @Test
    void shouldInvokeCallbackForEveryMatchingEvent() {
        // Arrange
        List<ChatEvent> seen = new ArrayList<>();
        table.registerCallback(CorrelationKey.of(Map.of("channel", CHANNEL)), seen::add);

        // Act
        table.onEvent(ChatEvent.message(USER, CHANNEL, "one"));
        table.onEvent(ChatEvent.message(USER, "C2", "other"));
        table.onEvent(ChatEvent.message(USER, CHANNEL, "two"));

        // Assert
        assertEquals(2, seen.size());
        assertEquals(1, table.callbackCount());
    }

    @Test
    void shouldStopInvokingCancelledCallback() {
        List<ChatEvent> seen = new ArrayList<>();
        CallbackRegistration registration = table.registerCallback(CorrelationKey.wildcard(), seen::add);

        table.onEvent(ChatEvent.message(USER, CHANNEL, "one"));
        assertTrue(registration.cancel());
        table.onEvent(ChatEvent.message(USER, CHANNEL, "two"));

        assertEquals(1, seen.size());
        assertEquals(0, table.callbackCount());
        assertFalse(registration.cancel());
    }

    @Test
    void shouldContinueAfterFailingCallback() {
        List<ChatEvent> seen = new ArrayList<>();
        table.registerCallback(CorrelationKey.wildcard(), event -> {
            throw new IllegalStateException("boom");
        });
        table.registerCallback(CorrelationKey.wildcard(), seen::add);
        Waiter waiter = table.registerWaiter(CorrelationKey.wildcard());

        assertDoesNotThrow(() -> table.onEvent(ChatEvent.message(USER, CHANNEL, "x")));

        assertEquals(1, seen.size());
        assertTrue(waiter.isDone());
    }
}
