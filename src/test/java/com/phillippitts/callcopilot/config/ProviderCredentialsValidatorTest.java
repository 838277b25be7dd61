package com.phillippitts.callcopilot.config;

import com.phillippitts.callcopilot.config.properties.ProviderProperties;
import com.phillippitts.callcopilot.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderCredentialsValidatorTest {

    private static ProviderProperties props(ProviderProperties.Stt stt, ProviderProperties.Llm llm) {
        ProviderProperties props = new ProviderProperties();
        props.setStt(stt);
        props.setLlm(llm);
        return props;
    }

    @Test
    void mockProvidersNeedNoKeys() {
        ProviderProperties props = props(ProviderProperties.Stt.MOCK, ProviderProperties.Llm.MOCK);

        assertThatCode(() -> new ProviderCredentialsValidator(props).validate()).doesNotThrowAnyException();
    }

    @Test
    void deepgramWithoutKeyFailsWithActionableMessage() {
        ProviderProperties props = props(ProviderProperties.Stt.DEEPGRAM, ProviderProperties.Llm.MOCK);

        assertThatThrownBy(() -> new ProviderCredentialsValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("DEEPGRAM_API_KEY")
                .hasMessageContaining("copilot.providers.deepgram-api-key");
    }

    @Test
    void blankGeminiKeyIsRejected() {
        ProviderProperties props = props(ProviderProperties.Stt.MOCK, ProviderProperties.Llm.GEMINI);
        props.setGeminiApiKey("   ");

        assertThatThrownBy(() -> new ProviderCredentialsValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void openAiKeyOnlyRequiredWhenSelected() {
        ProviderProperties props = props(ProviderProperties.Stt.DEEPGRAM, ProviderProperties.Llm.OPENAI);
        props.setDeepgramApiKey("dg-key");

        assertThatThrownBy(() -> new ProviderCredentialsValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("OPENAI_API_KEY");

        props.setOpenaiApiKey("sk-test");
        assertThatCode(() -> new ProviderCredentialsValidator(props).validate()).doesNotThrowAnyException();
    }

    @Test
    void elevenLabsSttRequiresItsOwnKey() {
        ProviderProperties props = props(ProviderProperties.Stt.ELEVENLABS, ProviderProperties.Llm.MOCK);
        props.setDeepgramApiKey("dg-key");

        assertThatThrownBy(() -> new ProviderCredentialsValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("ELEVENLABS_API_KEY")
                .hasMessageContaining("copilot.providers.elevenlabs-api-key");

        props.setElevenlabsApiKey("xi-key");
        assertThatCode(() -> new ProviderCredentialsValidator(props).validate()).doesNotThrowAnyException();
    }

    @Test
    void openAiSttRequiresOpenAiKey() {
        ProviderProperties props = props(ProviderProperties.Stt.OPENAI, ProviderProperties.Llm.MOCK);

        assertThatThrownBy(() -> new ProviderCredentialsValidator(props).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("OPENAI_API_KEY");
    }
}
