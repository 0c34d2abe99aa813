package me.golemcore.slackops.domain.correlation;

import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.model.CorrelationKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class WaiterTest {

    private static final CorrelationKey KEY = CorrelationKey.of(Map.of("user", "U1"));

    @Test
    void shouldResolveOnlyOnce() throws Exception {
        Waiter waiter = new Waiter(KEY, w -> {
        });
        ChatEvent first = ChatEvent.message("U1", "C1", "first");
        ChatEvent second = ChatEvent.message("U1", "C1", "second");

        assertTrue(waiter.resolve(first));
        assertFalse(waiter.resolve(second));
        assertEquals(first, waiter.result().get());
    }

    @Test
    void shouldNotifyOwnerOnCancel() {
        List<Waiter> cancelled = new ArrayList<>();
        Waiter waiter = new Waiter(KEY, cancelled::add);

        assertTrue(waiter.cancel());
        assertFalse(waiter.cancel());

        assertEquals(List.of(waiter), cancelled);
        assertTrue(waiter.isCancelled());
        assertTrue(waiter.result().isCancelled());
    }

    @Test
    void shouldIgnoreCancelAfterResolution() {
        List<Waiter> cancelled = new ArrayList<>();
        Waiter waiter = new Waiter(KEY, cancelled::add);
        waiter.resolve(ChatEvent.message("U1", "C1", "hi"));

        assertFalse(waiter.cancel());
        assertTrue(cancelled.isEmpty());
        assertFalse(waiter.isCancelled());
    }

    @Test
    void shouldNotCancelWaiterWhenResultCopyIsCancelled() {
        Waiter waiter = new Waiter(KEY, w -> {
        });
        CompletableFuture<ChatEvent> result = waiter.result();

        result.cancel(false);

        assertFalse(waiter.isDone());
        assertTrue(waiter.resolve(ChatEvent.message("U1", "C1", "hi")));
    }
}
