package com.phillippitts.callcopilot.presentation.websocket;

import com.phillippitts.callcopilot.service.orchestration.CarrierConnection;
import com.phillippitts.callcopilot.service.orchestration.SessionOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Feeds carrier text frames to the {@link SessionOrchestrator}. The container delivers
 * messages for one socket serially, so frames reach the orchestrator in arrival order.
 */
@Component
public class CarrierWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(CarrierWebSocketHandler.class);

    private final SessionOrchestrator orchestrator;

    public CarrierWebSocketHandler(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        LOG.info("Carrier connection opened: id={}, remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        orchestrator.onFrame(new SocketConnection(session), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on carrier connection {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        LOG.info("Carrier connection closed: id={}, status={}", session.getId(), status);
        orchestrator.onDisconnect(new SocketConnection(session));
    }

    /**
     * Adapts a Spring {@link WebSocketSession} to the orchestrator's connection view.
     */
    static final class SocketConnection implements CarrierConnection {

        private final WebSocketSession session;

        SocketConnection(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public String id() {
            return session.getId();
        }

        @Override
        public void close(String reason) {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.SERVER_ERROR.withReason(reason));
            } catch (IOException e) {
                LOG.warn("Failed to close carrier connection {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
