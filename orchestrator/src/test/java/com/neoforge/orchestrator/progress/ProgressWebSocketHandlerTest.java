package com.neoforge.orchestrator.progress;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ProgressWebSocketHandlerTest {

    @Mock WebSocketSession healthy;
    @Mock WebSocketSession broken;

    final ObjectMapper json = new ObjectMapper();

    ProgressSink             progress;
    ProgressWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        progress = new ProgressSink();
        handler  = new ProgressWebSocketHandler(progress, json, 2);
    }

    @Test
    void broadcast_sendsLatestSnapshotWithConfiguredTail() throws Exception {
        progress.update("Team Lead", "Using tool: write_file", "one");
        progress.update("Team Lead", "Using tool: write_file", "two");
        progress.update("Team Lead", "Using tool: write_file", "three");
        handler.afterConnectionEstablished(healthy);

        handler.broadcast();

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(healthy).sendMessage(sent.capture());
        JsonNode body = json.readTree(sent.getValue().getPayload());
        assertThat(body.get("agent").asText()).isEqualTo("Team Lead");
        assertThat(body.get("logs")).extracting(JsonNode::asText).containsExactly("two", "three");
    }

    @Test
    void broadcast_failingSession_isDroppedAndOthersStillServed() throws Exception {
        doThrow(new IOException("broken pipe")).when(broken).sendMessage(any());
        handler.afterConnectionEstablished(healthy);
        handler.afterConnectionEstablished(broken);

        handler.broadcast();

        verify(healthy).sendMessage(any());
        verify(broken).close(CloseStatus.SERVER_ERROR);
        assertThat(handler.openSessions()).isEqualTo(1);
    }

    @Test
    void broadcast_noObservers_doesNothing() {
        handler.broadcast();

        verifyNoInteractions(healthy, broken);
    }

    @Test
    void afterConnectionClosed_stopsPushingToThatSession() throws Exception {
        handler.afterConnectionEstablished(healthy);
        handler.afterConnectionClosed(healthy, CloseStatus.NORMAL);

        handler.broadcast();

        verify(healthy, never()).sendMessage(any());
        assertThat(handler.openSessions()).isZero();
    }
}
