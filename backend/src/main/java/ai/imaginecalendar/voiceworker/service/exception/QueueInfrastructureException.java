package ai.imaginecalendar.voiceworker.service.exception;

import ai.imaginecalendar.voiceworker.model.ErrorCategory;

/**
 * The queue store itself is unreachable. Escalated to process-level alerting
 * rather than counted against a job.
 */
public class QueueInfrastructureException extends PipelineException {

    public QueueInfrastructureException(String message, Throwable cause) {
        super(ErrorCategory.INFRASTRUCTURE, message, cause);
    }
}
