package ai.imaginecalendar.voiceworker.service.exception;

import ai.imaginecalendar.voiceworker.model.ErrorCategory;

/**
 * External dependency failed in a way that may succeed later (timeout, 5xx, rate limit)
 */
public class TransientStageException extends PipelineException {

    public TransientStageException(String message) {
        super(ErrorCategory.TRANSIENT, message);
    }

    public TransientStageException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT, message, cause);
    }
}
