package com.phillippitts.callcopilot.presentation.websocket;

import com.phillippitts.callcopilot.service.orchestration.CarrierConnection;
import com.phillippitts.callcopilot.service.orchestration.SessionOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CarrierWebSocketHandlerTest {

    private SessionOrchestrator orchestrator;
    private CarrierWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        orchestrator = mock(SessionOrchestrator.class);
        handler = new CarrierWebSocketHandler(orchestrator);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
    }

    @Test
    void forwardsTextFramesWithConnectionId() throws Exception {
        handler.handleMessage(session, new TextMessage("{\"event\":\"connected\"}"));

        ArgumentCaptor<CarrierConnection> connection = ArgumentCaptor.forClass(CarrierConnection.class);
        verify(orchestrator).onFrame(connection.capture(), eq("{\"event\":\"connected\"}"));
        assertThat(connection.getValue().id()).isEqualTo("ws-1");
    }

    @Test
    void notifiesDisconnect() {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        verify(orchestrator).onDisconnect(any(CarrierConnection.class));
    }

    @Test
    void closeUsesServerErrorWithReason() throws IOException {
        when(session.isOpen()).thenReturn(true);

        new CarrierWebSocketHandler.SocketConnection(session).close("transcription pipeline unavailable");

        verify(session).close(CloseStatus.SERVER_ERROR.withReason("transcription pipeline unavailable"));
    }

    @Test
    void closeSkipsClosedSocketAndSwallowsIoErrors() throws IOException {
        when(session.isOpen()).thenReturn(false);
        new CarrierWebSocketHandler.SocketConnection(session).close("x");
        verify(session, never()).close(any(CloseStatus.class));

        when(session.isOpen()).thenReturn(true);
        doThrow(new IOException("broken pipe")).when(session).close(any(CloseStatus.class));
        assertThatCode(() -> new CarrierWebSocketHandler.SocketConnection(session).close("x"))
                .doesNotThrowAnyException();
    }
}
