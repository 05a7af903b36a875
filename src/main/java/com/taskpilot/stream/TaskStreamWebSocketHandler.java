package com.taskpilot.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * Server-push endpoint: {@code /ws/stream?runId=...&since=...}. Incoming messages are ignored.
 */
@Component
@Slf4j
public class TaskStreamWebSocketHandler extends TextWebSocketHandler {

    private final TaskStreamHub hub;

    public TaskStreamWebSocketHandler(TaskStreamHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        String runId = uri == null ? null : queryParam(uri, "runId");
        if (runId == null || runId.isBlank()) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        hub.registerSession(runId, session, since(queryParam(uri, "since")));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.trace("Ignoring client message on stream session {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.removeSession(session);
    }

    private static String queryParam(URI uri, String name) {
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(name);
    }

    static long since(String value) {
        if (value == null || value.isBlank()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(value.trim()));
        } catch (NumberFormatException ex) {
            log.debug("Invalid since parameter {}", value);
            return 0L;
        }
    }
}
