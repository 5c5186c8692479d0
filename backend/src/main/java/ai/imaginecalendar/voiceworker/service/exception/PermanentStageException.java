package ai.imaginecalendar.voiceworker.service.exception;

import ai.imaginecalendar.voiceworker.model.ErrorCategory;

/**
 * Handler signalled that retrying cannot help, e.g. "calendar event already deleted"
 */
public class PermanentStageException extends PipelineException {

    public PermanentStageException(String message) {
        super(ErrorCategory.PERMANENT, message);
    }

    public PermanentStageException(String message, Throwable cause) {
        super(ErrorCategory.PERMANENT, message, cause);
    }
}
