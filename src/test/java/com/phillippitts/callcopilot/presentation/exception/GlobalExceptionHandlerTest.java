package com.phillippitts.callcopilot.presentation.exception;

import com.phillippitts.callcopilot.exception.CircuitOpenException;
import com.phillippitts.callcopilot.exception.ConfigurationException;
import com.phillippitts.callcopilot.exception.UpstreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void configurationErrorReturns503() {
        ConfigurationException ex = new ConfigurationException("Missing API key", "copilot.providers.gemini-api-key");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleConfiguration(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("ConfigurationException");
        assertThat(response.getBody().message()).isEqualTo("Service misconfigured");
    }

    @Test
    void doesNotLeakPropertyNames() {
        ConfigurationException ex = new ConfigurationException("Missing API key", "copilot.providers.gemini-api-key");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleConfiguration(ex);

        assertThat(response.getBody().toString()).doesNotContain("gemini-api-key");
    }

    @Test
    void retryableUpstreamFailureReturns503() {
        UpstreamException ex = new UpstreamException("Frontend unavailable", "frontend", 503, true);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleUpstream(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).contains("retry");
    }

    @Test
    void permanentUpstreamFailureReturns502() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleUpstream(new CircuitOpenException("kb"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().errorCode()).isEqualTo("CircuitOpenException");
    }

    @Test
    void unexpectedErrorReturns500WithTimestamp() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().message()).doesNotContain("boom");
        assertThat(response.getBody().timestamp()).isNotNull();
    }
}
