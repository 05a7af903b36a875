package com.taskpilot.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Buffers run events and pushes them to every WebSocket subscribed to the run.
 * Late subscribers replay the buffer from the id they last saw.
 */
@Component
@Slf4j
public class TaskStreamHub {

    static final int MAX_BUFFER_SIZE = 2000;
    private static final Duration RETENTION = Duration.ofMinutes(30);
    private static final String RUN_ID_ATTRIBUTE = "runId";

    private final ObjectMapper objectMapper;
    private final Map<String, RunChannel> runs = new ConcurrentHashMap<>();

    public TaskStreamHub(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String createRun() {
        removeExpiredRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new RunChannel(runId, MAX_BUFFER_SIZE));
        return runId;
    }

    public boolean exists(String runId) {
        return runs.containsKey(runId);
    }

    public void registerSession(String runId, WebSocketSession session, long sinceId) throws IOException {
        RunChannel channel = runs.get(runId);
        if (channel == null) {
            log.debug("Closing stream session {} for unknown run {}", session.getId(), runId);
            session.close();
            return;
        }
        session.getAttributes().put(RUN_ID_ATTRIBUTE, runId);
        for (StreamEvent event : channel.subscribe(session, sinceId)) {
            send(session, event);
        }
    }

    public void removeSession(WebSocketSession session) {
        Object runId = session.getAttributes().get(RUN_ID_ATTRIBUTE);
        RunChannel channel = runId == null ? null : runs.get(runId.toString());
        if (channel != null) {
            channel.unsubscribe(session);
        }
        removeExpiredRuns();
    }

    public void emit(String runId, String type, Object data) {
        RunChannel channel = runs.get(runId);
        if (channel != null) {
            publish(channel, channel.record(type, data));
        }
    }

    public boolean cancelRun(String runId) {
        RunChannel channel = runs.get(runId);
        if (channel == null) {
            return false;
        }
        publish(channel, channel.cancel());
        return true;
    }

    public boolean isCancelled(String runId) {
        RunChannel channel = runs.get(runId);
        return channel != null && channel.isCancelled();
    }

    List<StreamEvent> events(String runId) {
        RunChannel channel = runs.get(runId);
        return channel == null ? List.of() : channel.replay(0);
    }

    private void publish(RunChannel channel, @Nullable StreamEvent event) {
        if (event != null) {
            channel.subscribers().forEach(session -> send(session, event));
        }
    }

    private void send(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to send {} event to session {}: {}", event.type(), session.getId(), ex.getMessage());
        }
    }

    private void removeExpiredRuns() {
        Instant cutoff = Instant.now().minus(RETENTION);
        runs.values().removeIf(channel -> channel.expired(cutoff));
    }
}
