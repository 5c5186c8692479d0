package ai.imaginecalendar.voiceworker.service.handler;

import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.model.payload.VoiceMessageReceived;
import ai.imaginecalendar.voiceworker.service.exception.PayloadValidationException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry stage: checks that the inbound message points at some audio
 */
@Slf4j
@Component
public class WebhookReceivedHandler implements StageHandler {

    @Override
    public Stage stage() {
        return Stage.WEBHOOK_RECEIVED;
    }

    @Override
    public StageResult handle(JobRecord job) {
        VoiceMessageReceived message = (VoiceMessageReceived) job.getPayload();
        if (!message.hasAudioReference()) {
            throw new PayloadValidationException(
                    "Voice message " + job.getMessageId() + " has neither an audio URL nor a media id");
        }

        log.debug("Accepted voice message {} for job {}", job.getMessageId(), job.getJobId());
        return StageResult.success(message);
    }
}
