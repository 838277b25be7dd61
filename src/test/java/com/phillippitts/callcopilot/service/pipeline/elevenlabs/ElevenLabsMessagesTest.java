package com.phillippitts.callcopilot.service.pipeline.elevenlabs;

import com.phillippitts.callcopilot.config.properties.ProviderProperties;
import com.phillippitts.callcopilot.service.pipeline.TranscriptSegment;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ElevenLabsMessagesTest {

    @Test
    void partialTranscriptBecomesPartialSegment() {
        Optional<TranscriptSegment> segment = ElevenLabsMessages.parse(
                "{\"message_type\":\"partial_transcript\",\"text\":\"block my\"}");

        assertThat(segment).hasValueSatisfying(s -> {
            assertThat(s.text()).isEqualTo("block my");
            assertThat(s.isFinal()).isFalse();
        });
    }

    @Test
    void committedTranscriptBecomesFinalSegment() {
        Optional<TranscriptSegment> segment = ElevenLabsMessages.parse(
                "{\"message_type\":\"committed_transcript\",\"text\":\" block my card \"}");

        assertThat(segment).hasValueSatisfying(s -> {
            assertThat(s.text()).isEqualTo("block my card");
            assertThat(s.isFinal()).isTrue();
            assertThat(s.confidence()).isEqualTo(1.0);
        });
    }

    @Test
    void sessionErrorAndTimestampMessagesProduceNothing() {
        assertThat(ElevenLabsMessages.parse("{\"message_type\":\"session_started\",\"session_id\":\"s1\"}"))
                .isEmpty();
        assertThat(ElevenLabsMessages.parse("{\"message_type\":\"auth_error\",\"error\":\"bad key\"}")).isEmpty();
        assertThat(ElevenLabsMessages.parse(
                "{\"message_type\":\"committed_transcript_with_timestamps\",\"text\":\"block my card\"}")).isEmpty();
        assertThat(ElevenLabsMessages.parse("{\"message_type\":\"committed_transcript\",\"text\":\"  \"}")).isEmpty();
    }

    @Test
    void ignoresMalformedJson() {
        assertThat(ElevenLabsMessages.parse("{oops")).isEmpty();
        assertThat(ElevenLabsMessages.parse(null)).isEmpty();
    }

    @Test
    void audioChunkCarriesBase64PcmAndCommitFlag() {
        JSONObject chunk = new JSONObject(ElevenLabsMessages.audioChunk(new byte[] {1, 2, 3, 4}, 8000, false));
        JSONObject commit = new JSONObject(ElevenLabsMessages.audioChunk(new byte[0], 8000, true));

        assertThat(chunk.getString("message_type")).isEqualTo("input_audio_chunk");
        assertThat(Base64.getDecoder().decode(chunk.getString("audio_base_64"))).containsExactly(1, 2, 3, 4);
        assertThat(chunk.getBoolean("commit")).isFalse();
        assertThat(chunk.getInt("sample_rate")).isEqualTo(8000);
        assertThat(commit.getBoolean("commit")).isTrue();
        assertThat(commit.getString("audio_base_64")).isEmpty();
    }

    @Test
    void buildsRealtimeUriForSampleRate() {
        ElevenLabsTranscriptionProvider provider = new ElevenLabsTranscriptionProvider(new ProviderProperties());

        String uri = provider.realtimeUri(16000).toString();

        assertThat(uri).startsWith("wss://api.elevenlabs.io/v1/speech-to-text/realtime?model_id=scribe_v2_realtime");
        assertThat(uri).contains("language_code=en", "audio_format=pcm_16000", "commit_strategy=vad");
    }
}
