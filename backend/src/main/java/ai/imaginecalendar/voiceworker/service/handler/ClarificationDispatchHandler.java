package ai.imaginecalendar.voiceworker.service.handler;

import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.service.exception.PermanentStageException;
import ai.imaginecalendar.voiceworker.service.interfaces.ClarificationNotifier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Sends the clarification question; the job then waits at clarification_response
 */
@Slf4j
@Component
public class ClarificationDispatchHandler implements StageHandler {

    private final ObjectProvider<ClarificationNotifier> notifier;

    @Autowired
    public ClarificationDispatchHandler(ObjectProvider<ClarificationNotifier> notifier) {
        this.notifier = notifier;
    }

    @Override
    public Stage stage() {
        return Stage.CLARIFICATION_DISPATCH;
    }

    @Override
    public StageResult handle(JobRecord job) {
        ClarificationNotifier channel = notifier.getIfAvailable();
        if (channel == null) {
            throw new PermanentStageException("No clarification channel configured");
        }

        channel.sendQuestion(job);
        log.info("Sent clarification question for job {} (message {})", job.getJobId(), job.getMessageId());
        return StageResult.success(job.getPayload());
    }
}
