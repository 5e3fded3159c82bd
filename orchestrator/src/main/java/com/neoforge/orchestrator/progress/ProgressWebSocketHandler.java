package com.neoforge.orchestrator.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes the progress snapshot to every connected dashboard on a fixed delay.
 *
 * The broadcast only reads {@link ProgressSink#snapshot(int)}; it never blocks
 * the pipeline. A session whose send fails is closed and dropped.
 */
@Component
public class ProgressWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ProgressWebSocketHandler.class);

    private final Set<WebSocketSession> sessions = new CopyOnWriteArraySet<>();
    private final ProgressSink progress;
    private final ObjectMapper objectMapper;
    private final int          pushedLogLines;

    public ProgressWebSocketHandler(ProgressSink progress,
                                    ObjectMapper objectMapper,
                                    @Value("${neoforge.progress.pushed-log-lines:5}") int pushedLogLines) {
        this.progress       = progress;
        this.objectMapper   = objectMapper;
        this.pushedLogLines = pushedLogLines;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.info("Progress observer connected: {} ({} open)", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        log.info("Progress observer disconnected: {} ({})", session.getId(), status);
    }

    @Scheduled(fixedDelayString = "${neoforge.progress.broadcast-interval-ms:500}")
    public void broadcast() {
        if (sessions.isEmpty()) {
            return;
        }
        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(progress.snapshot(pushedLogLines)));
        } catch (JsonProcessingException e) {
            log.error("Could not serialise progress snapshot", e);
            return;
        }
        for (WebSocketSession session : sessions) {
            send(session, message);
        }
    }

    int openSessions() {
        return sessions.size();
    }

    private void send(WebSocketSession session, TextMessage message) {
        try {
            synchronized (session) {
                session.sendMessage(message);
            }
        } catch (IOException | IllegalStateException e) {
            log.warn("Dropping progress observer {}: {}", session.getId(), e.getMessage());
            sessions.remove(session);
            closeQuietly(session);
        }
    }

    private static void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException e) {
            log.debug("Close of session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
