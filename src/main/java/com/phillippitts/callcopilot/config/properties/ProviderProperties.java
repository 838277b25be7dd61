package com.phillippitts.callcopilot.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Selects one implementation per external capability and carries its credentials.
 *
 * <p>API keys are read from the environment (see application.properties) and checked at
 * startup by {@code ProviderCredentialsValidator}.
 */
@ConfigurationProperties(prefix = "copilot.providers")
@Validated
public class ProviderProperties {

    /** Streaming transcription provider. */
    public enum Stt { DEEPGRAM, ELEVENLABS, OPENAI, MOCK }

    /** LLM used for intent classification and call summaries. */
    public enum Llm { GEMINI, OPENAI, MOCK }

    /** Knowledge-base search adapter. */
    public enum Kb { API, NONE }

    /** Case-management sink. */
    public enum CaseManagement { HTTP, LOGGING }

    @NotNull
    private Stt stt = Stt.DEEPGRAM;

    @NotNull
    private Llm llm = Llm.GEMINI;

    @NotNull
    private Kb kb = Kb.API;

    @NotNull
    private CaseManagement caseManagement = CaseManagement.HTTP;

    private String deepgramApiKey;
    private String deepgramModel = "nova-2";
    private String deepgramUrl = "wss://api.deepgram.com/v1/listen";

    private String elevenlabsApiKey;
    private String elevenlabsModel = "scribe_v2_realtime";
    private String elevenlabsLanguage = "en";
    private String elevenlabsUrl = "wss://api.elevenlabs.io/v1/speech-to-text/realtime";

    private String geminiApiKey;
    private String geminiModel = "gemini-2.0-flash";
    private String geminiBaseUrl = "https://generativelanguage.googleapis.com/v1beta";

    private String openaiApiKey;
    private String openaiModel = "gpt-4o-mini";
    private String openaiBaseUrl = "https://api.openai.com/v1";

    /** Whisper transcription: uses the OpenAI key and base URL above. */
    private String openaiSttModel = "whisper-1";
    @NotNull
    private Duration openaiSttSegment = Duration.ofSeconds(5);
    /** Segments whose peak PCM16 sample stays below this are not uploaded. */
    @PositiveOrZero
    private int openaiSttSilencePeak = 500;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double llmTemperature = 0.3;

    /** Mock STT only: emit one final segment every N audio frames. */
    private int mockFramesPerSegment = 50;

    public Stt getStt() {
        return stt;
    }

    public void setStt(Stt stt) {
        this.stt = stt;
    }

    public Llm getLlm() {
        return llm;
    }

    public void setLlm(Llm llm) {
        this.llm = llm;
    }

    public Kb getKb() {
        return kb;
    }

    public void setKb(Kb kb) {
        this.kb = kb;
    }

    public CaseManagement getCaseManagement() {
        return caseManagement;
    }

    public void setCaseManagement(CaseManagement caseManagement) {
        this.caseManagement = caseManagement;
    }

    public String getDeepgramApiKey() {
        return deepgramApiKey;
    }

    public void setDeepgramApiKey(String deepgramApiKey) {
        this.deepgramApiKey = deepgramApiKey;
    }

    public String getDeepgramModel() {
        return deepgramModel;
    }

    public void setDeepgramModel(String deepgramModel) {
        this.deepgramModel = deepgramModel;
    }

    public String getDeepgramUrl() {
        return deepgramUrl;
    }

    public void setDeepgramUrl(String deepgramUrl) {
        this.deepgramUrl = deepgramUrl;
    }

    public String getElevenlabsApiKey() {
        return elevenlabsApiKey;
    }

    public void setElevenlabsApiKey(String elevenlabsApiKey) {
        this.elevenlabsApiKey = elevenlabsApiKey;
    }

    public String getElevenlabsModel() {
        return elevenlabsModel;
    }

    public void setElevenlabsModel(String elevenlabsModel) {
        this.elevenlabsModel = elevenlabsModel;
    }

    public String getElevenlabsLanguage() {
        return elevenlabsLanguage;
    }

    public void setElevenlabsLanguage(String elevenlabsLanguage) {
        this.elevenlabsLanguage = elevenlabsLanguage;
    }

    public String getElevenlabsUrl() {
        return elevenlabsUrl;
    }

    public void setElevenlabsUrl(String elevenlabsUrl) {
        this.elevenlabsUrl = elevenlabsUrl;
    }

    public String getGeminiApiKey() {
        return geminiApiKey;
    }

    public void setGeminiApiKey(String geminiApiKey) {
        this.geminiApiKey = geminiApiKey;
    }

    public String getGeminiModel() {
        return geminiModel;
    }

    public void setGeminiModel(String geminiModel) {
        this.geminiModel = geminiModel;
    }

    public String getGeminiBaseUrl() {
        return geminiBaseUrl;
    }

    public void setGeminiBaseUrl(String geminiBaseUrl) {
        this.geminiBaseUrl = geminiBaseUrl;
    }

    public String getOpenaiApiKey() {
        return openaiApiKey;
    }

    public void setOpenaiApiKey(String openaiApiKey) {
        this.openaiApiKey = openaiApiKey;
    }

    public String getOpenaiModel() {
        return openaiModel;
    }

    public void setOpenaiModel(String openaiModel) {
        this.openaiModel = openaiModel;
    }

    public String getOpenaiBaseUrl() {
        return openaiBaseUrl;
    }

    public void setOpenaiBaseUrl(String openaiBaseUrl) {
        this.openaiBaseUrl = openaiBaseUrl;
    }

    public String getOpenaiSttModel() {
        return openaiSttModel;
    }

    public void setOpenaiSttModel(String openaiSttModel) {
        this.openaiSttModel = openaiSttModel;
    }

    public Duration getOpenaiSttSegment() {
        return openaiSttSegment;
    }

    public void setOpenaiSttSegment(Duration openaiSttSegment) {
        this.openaiSttSegment = openaiSttSegment;
    }

    public int getOpenaiSttSilencePeak() {
        return openaiSttSilencePeak;
    }

    public void setOpenaiSttSilencePeak(int openaiSttSilencePeak) {
        this.openaiSttSilencePeak = openaiSttSilencePeak;
    }

    public double getLlmTemperature() {
        return llmTemperature;
    }

    public void setLlmTemperature(double llmTemperature) {
        this.llmTemperature = llmTemperature;
    }

    public int getMockFramesPerSegment() {
        return mockFramesPerSegment;
    }

    public void setMockFramesPerSegment(int mockFramesPerSegment) {
        this.mockFramesPerSegment = mockFramesPerSegment;
    }
}
