package com.taskpilot.stream;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RunChannelTest {

    @Test
    void testReplayAfterEvictionStartsAtOldestRetained() {
        RunChannel channel = new RunChannel("r1", 3);
        for (int i = 0; i < 5; i++) {
            channel.record(StreamEventType.TOKEN, Map.of("text", "t" + i));
        }

        assertEquals(List.of(3L, 4L, 5L), channel.replay(0).stream().map(StreamEvent::id).toList());
        assertEquals(List.of(5L), channel.replay(4).stream().map(StreamEvent::id).toList());
    }

    @Test
    void testCancelIsRecordedOnce() {
        RunChannel channel = new RunChannel("r1", 10);

        StreamEvent first = channel.cancel();
        assertNotNull(first);
        assertEquals(StreamEventType.RUN_CANCEL, first.type());
        assertNull(channel.cancel());
        assertNull(channel.record(StreamEventType.PROGRESS, Map.of()));
        assertNotNull(channel.record(StreamEventType.ERROR, Map.of("message", "boom")));
        assertTrue(channel.isCancelled());
        assertTrue(channel.isCompleted());
    }

    @Test
    void testExpiresOnlyWhenCompletedAndUnobserved() {
        RunChannel channel = new RunChannel("r1", 10);
        WebSocketSession session = mock(WebSocketSession.class);
        Instant later = Instant.now().plusSeconds(60);

        channel.subscribe(session, 0);
        assertFalse(channel.expired(later));

        channel.record(StreamEventType.RUN_COMPLETE, Map.of("status", "COMPLETED"));
        assertFalse(channel.expired(later));

        channel.unsubscribe(session);
        assertTrue(channel.expired(later));
        assertFalse(channel.expired(Instant.now().minusSeconds(60)));
    }

    @Test
    void testSubscribeReturnsEventsAfterSince() {
        RunChannel channel = new RunChannel("r1", 10);
        channel.record(StreamEventType.STATUS, Map.of("message", "Queued"));
        channel.record(StreamEventType.TOKEN, Map.of("text", "a"));

        List<StreamEvent> replay = channel.subscribe(mock(WebSocketSession.class), 1);

        assertEquals(1, replay.size());
        assertEquals(StreamEventType.TOKEN, replay.get(0).type());
        assertEquals(1, channel.subscribers().size());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RunChannel("r1", 0));
    }
}
