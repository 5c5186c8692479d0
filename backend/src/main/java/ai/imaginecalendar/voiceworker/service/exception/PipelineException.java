package ai.imaginecalendar.voiceworker.service.exception;

import ai.imaginecalendar.voiceworker.model.ErrorCategory;

/**
 * Base class for failures raised while driving a job through the pipeline.
 * The category decides whether the failed attempt is retried.
 */
public abstract class PipelineException extends RuntimeException {

    private final ErrorCategory category;

    protected PipelineException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected PipelineException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
