package me.golemcore.slackops.domain.loop;

import me.golemcore.slackops.domain.model.ChallengeOutcome;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DispatchQueueTest {

    private DispatchQueue queue;

    @BeforeEach
    void setUp() {
        queue = new DispatchQueue(new BotProperties());
    }

    @Test
    void shouldKeepPostedSignalsInOrder() throws Exception {
        LoopSignal first = new LoopSignal.Inbound(ChatEvent.message("U1", "C1", "one"));
        LoopSignal second = new LoopSignal.AuthorizationExpired("U1", 3);

        queue.post(first);
        queue.post(second);

        assertEquals(2, queue.size());
        assertEquals(first, queue.take());
        assertEquals(second, queue.take());
    }

    @Test
    void shouldTakePostFirstSignalAheadOfQueuedEvents() throws Exception {
        // Arrange
        LoopSignal queued = new LoopSignal.Inbound(ChatEvent.message("U1", "C1", "$restart"));
        LoopSignal outcome = new LoopSignal.ChallengeCompleted("U1", "C1", ChallengeOutcome.SUCCEEDED);
        queue.post(queued);

        // Act
        queue.postFirst(outcome);

        // Assert
        assertEquals(outcome, queue.take());
        assertEquals(queued, queue.take());
        assertEquals(0, queue.size());
    }

    @Test
    void shouldRejectNullSignal() {
        assertThrows(NullPointerException.class, () -> queue.post(null));
        assertThrows(NullPointerException.class, () -> queue.postFirst(null));
    }
}
