package com.phillippitts.callcopilot.config;

import com.phillippitts.callcopilot.config.properties.ProviderProperties;
import com.phillippitts.callcopilot.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

/**
 * Fails startup with an actionable message when a selected provider has no credentials.
 */
@Component
class ProviderCredentialsValidator {

    private final ProviderProperties props;

    ProviderCredentialsValidator(ProviderProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        switch (props.getStt()) {
            case DEEPGRAM -> requireKey(props.getDeepgramApiKey(), "copilot.providers.deepgram-api-key",
                    "DEEPGRAM_API_KEY");
            case ELEVENLABS -> requireKey(props.getElevenlabsApiKey(), "copilot.providers.elevenlabs-api-key",
                    "ELEVENLABS_API_KEY");
            case OPENAI -> requireKey(props.getOpenaiApiKey(), "copilot.providers.openai-api-key", "OPENAI_API_KEY");
            case MOCK -> {
                // no credentials
            }
        }
        switch (props.getLlm()) {
            case GEMINI -> requireKey(props.getGeminiApiKey(), "copilot.providers.gemini-api-key", "GEMINI_API_KEY");
            case OPENAI -> requireKey(props.getOpenaiApiKey(), "copilot.providers.openai-api-key", "OPENAI_API_KEY");
            case MOCK -> {
                // no credentials
            }
        }
    }

    private static void requireKey(String value, String property, String envVar) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing API key: set " + envVar
                    + " or choose a mock provider (copilot.providers.*=mock)", property);
        }
    }
}
