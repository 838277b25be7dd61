package com.phillippitts.callcopilot.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Case-management (frontend) API location and endpoint paths.
 */
@ConfigurationProperties(prefix = "copilot.frontend")
@Validated
public class FrontendProperties {

    @NotBlank
    private String baseUrl = "http://localhost:3000";

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Author recorded on generated call notes. */
    @NotBlank
    private String author = "pipecat-copilot";

    private String transcriptPath = "/api/calls/ingest-transcript";
    private String intentPath = "/api/calls/intent";
    private String kbSuggestionsPath = "/api/calls/kb-suggestions";
    private String dispositionPath = "/api/calls/auto_notes";
    private String kbSearchPath = "/api/kb/search";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getTranscriptPath() {
        return transcriptPath;
    }

    public void setTranscriptPath(String transcriptPath) {
        this.transcriptPath = transcriptPath;
    }

    public String getIntentPath() {
        return intentPath;
    }

    public void setIntentPath(String intentPath) {
        this.intentPath = intentPath;
    }

    public String getKbSuggestionsPath() {
        return kbSuggestionsPath;
    }

    public void setKbSuggestionsPath(String kbSuggestionsPath) {
        this.kbSuggestionsPath = kbSuggestionsPath;
    }

    public String getDispositionPath() {
        return dispositionPath;
    }

    public void setDispositionPath(String dispositionPath) {
        this.dispositionPath = dispositionPath;
    }

    public String getKbSearchPath() {
        return kbSearchPath;
    }

    public void setKbSearchPath(String kbSearchPath) {
        this.kbSearchPath = kbSearchPath;
    }
}
