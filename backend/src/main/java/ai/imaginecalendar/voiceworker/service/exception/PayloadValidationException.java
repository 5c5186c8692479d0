package ai.imaginecalendar.voiceworker.service.exception;

import ai.imaginecalendar.voiceworker.model.ErrorCategory;

/**
 * Malformed or unexpected payload. Never retried.
 */
public class PayloadValidationException extends PipelineException {

    public PayloadValidationException(String message) {
        super(ErrorCategory.VALIDATION, message);
    }

    public PayloadValidationException(String message, Throwable cause) {
        super(ErrorCategory.VALIDATION, message, cause);
    }
}
