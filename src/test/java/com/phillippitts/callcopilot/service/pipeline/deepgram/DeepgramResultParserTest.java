package com.phillippitts.callcopilot.service.pipeline.deepgram;

import com.phillippitts.callcopilot.config.properties.ProviderProperties;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSegment;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DeepgramResultParserTest {

    private static String result(String transcript, boolean isFinal, double confidence) {
        return "{\"type\":\"Results\",\"is_final\":" + isFinal + ",\"speech_final\":false,"
                + "\"channel\":{\"alternatives\":[{\"transcript\":\"" + transcript + "\","
                + "\"confidence\":" + confidence + ",\"words\":[]}]}}";
    }

    @Test
    void parsesFinalResult() {
        Optional<TranscriptSegment> segment = DeepgramResultParser.parse(result("block my card", true, 0.93));

        assertThat(segment).isPresent();
        assertThat(segment.get().text()).isEqualTo("block my card");
        assertThat(segment.get().isFinal()).isTrue();
        assertThat(segment.get().confidence()).isEqualTo(0.93);
    }

    @Test
    void parsesInterimResult() {
        Optional<TranscriptSegment> segment = DeepgramResultParser.parse(result("block my", false, 0.5));

        assertThat(segment).hasValueSatisfying(s -> assertThat(s.isFinal()).isFalse());
    }

    @Test
    void ignoresEmptyTranscriptAndNonResultMessages() {
        assertThat(DeepgramResultParser.parse(result("  ", true, 0.0))).isEmpty();
        assertThat(DeepgramResultParser.parse("{\"type\":\"Metadata\",\"request_id\":\"x\"}")).isEmpty();
        assertThat(DeepgramResultParser.parse("{\"type\":\"UtteranceEnd\"}")).isEmpty();
        assertThat(DeepgramResultParser.parse("{\"type\":\"Results\",\"channel\":{\"alternatives\":[]}}")).isEmpty();
    }

    @Test
    void ignoresMalformedJson() {
        assertThat(DeepgramResultParser.parse("{oops")).isEmpty();
        assertThat(DeepgramResultParser.parse(null)).isEmpty();
    }

    @Test
    void buildsListenUriForSampleRate() {
        ProviderProperties properties = new ProviderProperties();
        DeepgramTranscriptionProvider provider = new DeepgramTranscriptionProvider(properties);

        String uri = provider.listenUri(16000).toString();

        assertThat(uri).startsWith("wss://api.deepgram.com/v1/listen?model=nova-2");
        assertThat(uri).contains("encoding=linear16", "sample_rate=16000", "interim_results=true");
    }
}
