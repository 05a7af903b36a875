package com.taskpilot.stream;

import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event log and subscribers of one run. Ids start at 1 and grow by one per recorded event;
 * only the newest {@code capacity} events stay available for replay. Once cancelled, the
 * channel records terminal events only.
 */
class RunChannel {

    private final String runId;
    private final int capacity;
    private final Deque<StreamEvent> retained = new ArrayDeque<>();
    private final Set<WebSocketSession> subscribers = ConcurrentHashMap.newKeySet();
    private long nextId = 1;
    private volatile boolean cancelled;
    @Nullable
    private volatile Instant completedAt;
    private volatile Instant lastActivity = Instant.now();

    RunChannel(String runId, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Replay capacity must be positive: " + capacity);
        }
        this.runId = runId;
        this.capacity = capacity;
    }

    String runId() {
        return runId;
    }

    /**
     * @return the recorded event, or null when the channel is cancelled and the type is not terminal
     */
    @Nullable
    synchronized StreamEvent record(String type, Object data) {
        if (cancelled && !StreamEventType.isTerminal(type)) {
            return null;
        }
        StreamEvent event = new StreamEvent(nextId++, Instant.now(), type, data);
        if (retained.size() == capacity) {
            retained.pollFirst();
        }
        retained.addLast(event);
        lastActivity = event.timestamp();
        if (StreamEventType.completesRun(type)) {
            completedAt = lastActivity;
        }
        return event;
    }

    /**
     * @return the cancel event, or null if the channel was already cancelled
     */
    @Nullable
    synchronized StreamEvent cancel() {
        if (cancelled) {
            return null;
        }
        cancelled = true;
        return record(StreamEventType.RUN_CANCEL, Map.of());
    }

    /**
     * Adds the session and returns the retained events after {@code sinceId}. Holding the
     * recording lock keeps the replay and the live feed from skipping an event.
     */
    synchronized List<StreamEvent> subscribe(WebSocketSession session, long sinceId) {
        subscribers.add(session);
        return replay(sinceId);
    }

    void unsubscribe(WebSocketSession session) {
        subscribers.remove(session);
        lastActivity = Instant.now();
    }

    synchronized List<StreamEvent> replay(long sinceId) {
        List<StreamEvent> events = new ArrayList<>();
        for (StreamEvent event : retained) {
            if (event.id() > sinceId) {
                events.add(event);
            }
        }
        return events;
    }

    Set<WebSocketSession> subscribers() {
        return subscribers;
    }

    boolean isCancelled() {
        return cancelled;
    }

    boolean isCompleted() {
        return completedAt != null;
    }

    /**
     * A channel can be dropped once its run completed, nobody listens any more and nothing
     * happened since {@code cutoff}.
     */
    boolean expired(Instant cutoff) {
        return completedAt != null && subscribers.isEmpty() && lastActivity.isBefore(cutoff);
    }
}
