package ai.imaginecalendar.voiceworker.service.handler;

import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.model.payload.VoiceMessageReceived;
import ai.imaginecalendar.voiceworker.service.exception.PayloadValidationException;
import ai.imaginecalendar.voiceworker.support.PipelineFixtures;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class WebhookReceivedHandlerTest {

    private final Instant now = Instant.parse("2026-10-18T09:00:00Z");

    @Test
    void handle_MessageWithMediaId_ShouldPassPayloadThrough() {
        VoiceMessageReceived message = VoiceMessageReceived.builder().mediaId("media-77").build();
        JobRecord job = PipelineFixtures.job("job-1", Stage.WEBHOOK_RECEIVED, message, now);

        StageResult result = new WebhookReceivedHandler().handle(job);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPayload()).isSameAs(message);
        assertThat(result.getRoute()).isNull();
    }

    @Test
    void handle_MessageWithoutAudio_ShouldRejectAsValidation() {
        JobRecord job = PipelineFixtures.job("job-1", Stage.WEBHOOK_RECEIVED,
                VoiceMessageReceived.builder().senderPhone("+27820000000").build(), now);

        assertThatThrownBy(() -> new WebhookReceivedHandler().handle(job))
                .isInstanceOf(PayloadValidationException.class)
                .hasMessageContaining("msg-job-1");
    }
}
