package com.phillippitts.callcopilot.presentation.controller;

import com.phillippitts.callcopilot.config.WebSocketConfig;
import com.phillippitts.callcopilot.service.session.SessionRegistry;
import com.phillippitts.callcopilot.service.session.StreamSession;
import com.phillippitts.callcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service descriptor and live-session listing.
 */
@RestController
class StatusController {

    private static final Logger LOG = LogManager.getLogger(StatusController.class);

    static final String SERVICE_NAME = "call-copilot";
    static final String VERSION = "0.1.0";

    private final SessionRegistry registry;

    StatusController(SessionRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("version", VERSION);
        body.put("status", "running");
        body.put("endpoints", Map.of(
                "health", "/actuator/health",
                "websocket", WebSocketConfig.INGEST_PATH,
                "sessions", "/sessions"));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/sessions")
    ResponseEntity<Map<String, Object>> sessions() {
        List<Map<String, Object>> summaries = registry.activeSessions().stream()
                .map(StatusController::summarize)
                .toList();
        LOG.debug("Listing {} sessions", summaries.size());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", summaries.size());
        body.put("sessions", summaries);
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> summarize(StreamSession session) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("streamId", session.getStreamId());
        summary.put("callId", session.getCallId());
        summary.put("tenantId", session.getTenantId());
        summary.put("state", session.getState().name());
        summary.put("from", LogSanitizer.maskPhone(session.getFromNumber()));
        summary.put("sampleRateHz", session.getSampleRateHz());
        summary.put("framesReceived", session.getInboundSeq());
        summary.put("segmentsForwarded", session.getOutboundSeq());
        summary.put("startedAt", session.getCreatedAt().toString());
        return summary;
    }
}
