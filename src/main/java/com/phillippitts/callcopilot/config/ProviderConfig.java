package com.phillippitts.callcopilot.config;

import com.phillippitts.callcopilot.config.properties.FrontendProperties;
import com.phillippitts.callcopilot.config.properties.ProviderProperties;
import com.phillippitts.callcopilot.service.casemanagement.CaseManagementClient;
import com.phillippitts.callcopilot.service.casemanagement.HttpCaseManagementClient;
import com.phillippitts.callcopilot.service.casemanagement.LoggingCaseManagementClient;
import com.phillippitts.callcopilot.service.disposition.CallSummarizer;
import com.phillippitts.callcopilot.service.disposition.ExtractiveCallSummarizer;
import com.phillippitts.callcopilot.service.disposition.LlmCallSummarizer;
import com.phillippitts.callcopilot.service.http.JsonHttpClient;
import com.phillippitts.callcopilot.service.intent.IntentClassifier;
import com.phillippitts.callcopilot.service.intent.KeywordIntentClassifier;
import com.phillippitts.callcopilot.service.intent.LlmIntentClassifier;
import com.phillippitts.callcopilot.service.kb.ApiKnowledgeBaseSearch;
import com.phillippitts.callcopilot.service.kb.DisabledKnowledgeBaseSearch;
import com.phillippitts.callcopilot.service.kb.KnowledgeBaseSearch;
import com.phillippitts.callcopilot.service.llm.ChatModel;
import com.phillippitts.callcopilot.service.llm.GeminiChatModel;
import com.phillippitts.callcopilot.service.llm.OpenAiChatModel;
import com.phillippitts.callcopilot.service.pipeline.TranscriptionProvider;
import com.phillippitts.callcopilot.service.pipeline.deepgram.DeepgramTranscriptionProvider;
import com.phillippitts.callcopilot.service.pipeline.elevenlabs.ElevenLabsTranscriptionProvider;
import com.phillippitts.callcopilot.service.pipeline.mock.MockTranscriptionProvider;
import com.phillippitts.callcopilot.service.pipeline.openai.OpenAiWhisperTranscriptionProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * Selects one implementation per external capability from {@code copilot.providers.*}.
 * Selection happens once at startup; nothing is switched per call.
 */
@Configuration
public class ProviderConfig {

    private static final Logger LOG = LogManager.getLogger(ProviderConfig.class);

    private final ProviderProperties providers;
    private final FrontendProperties frontend;

    public ProviderConfig(ProviderProperties providers, FrontendProperties frontend) {
        this.providers = providers;
        this.frontend = frontend;
    }

    /**
     * Client for the frontend, KB and LLM REST calls. Separate from the pipeline pool so a
     * slow transcription provider cannot starve fan-out requests.
     */
    @Bean
    public JsonHttpClient jsonHttpClient() {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(frontend.getConnectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        return new JsonHttpClient(httpClient, frontend.getRequestTimeout());
    }

    @Bean
    public TranscriptionProvider transcriptionProvider() {
        TranscriptionProvider provider = switch (providers.getStt()) {
            case DEEPGRAM -> new DeepgramTranscriptionProvider(providers);
            case ELEVENLABS -> new ElevenLabsTranscriptionProvider(providers);
            case OPENAI -> new OpenAiWhisperTranscriptionProvider(providers);
            case MOCK -> new MockTranscriptionProvider(providers.getMockFramesPerSegment());
        };
        LOG.info("Transcription provider: {}", provider.name());
        return provider;
    }

    // Only called when llm is not MOCK.
    private ChatModel chatModel(JsonHttpClient http) {
        return switch (providers.getLlm()) {
            case GEMINI -> new GeminiChatModel(http, providers.getGeminiBaseUrl(), providers.getGeminiModel(),
                    providers.getGeminiApiKey(), providers.getLlmTemperature());
            case OPENAI -> new OpenAiChatModel(http, providers.getOpenaiBaseUrl(), providers.getOpenaiModel(),
                    providers.getOpenaiApiKey(), providers.getLlmTemperature());
            case MOCK -> throw new IllegalStateException("No chat model for llm=mock");
        };
    }

    @Bean
    public IntentClassifier intentClassifier(JsonHttpClient http) {
        if (providers.getLlm() == ProviderProperties.Llm.MOCK) {
            LOG.info("Intent classifier: keyword rules");
            return new KeywordIntentClassifier();
        }
        ChatModel model = chatModel(http);
        LOG.info("Intent classifier: {}", model.describe());
        return new LlmIntentClassifier(model);
    }

    @Bean
    public CallSummarizer callSummarizer(JsonHttpClient http, IntentClassifier intentClassifier) {
        if (providers.getLlm() == ProviderProperties.Llm.MOCK) {
            LOG.info("Call summarizer: extractive");
            return new ExtractiveCallSummarizer(intentClassifier);
        }
        ChatModel model = chatModel(http);
        LOG.info("Call summarizer: {}", model.describe());
        return new LlmCallSummarizer(model);
    }

    @Bean
    public KnowledgeBaseSearch knowledgeBaseSearch(JsonHttpClient http) {
        LOG.info("Knowledge base adapter: {}", providers.getKb());
        return switch (providers.getKb()) {
            case API -> new ApiKnowledgeBaseSearch(http, frontend);
            case NONE -> new DisabledKnowledgeBaseSearch();
        };
    }

    @Bean
    public CaseManagementClient caseManagementClient(JsonHttpClient http) {
        LOG.info("Case management client: {} ({})", providers.getCaseManagement(), frontend.getBaseUrl());
        return switch (providers.getCaseManagement()) {
            case HTTP -> new HttpCaseManagementClient(http, frontend);
            case LOGGING -> new LoggingCaseManagementClient();
        };
    }
}
