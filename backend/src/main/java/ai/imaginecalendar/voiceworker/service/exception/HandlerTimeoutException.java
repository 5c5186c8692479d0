package ai.imaginecalendar.voiceworker.service.exception;

import ai.imaginecalendar.voiceworker.model.Stage;

import java.time.Duration;

/**
 * A stage handler ran past its deadline. Counts as a failed, retryable attempt.
 */
public class HandlerTimeoutException extends TransientStageException {

    public HandlerTimeoutException(Stage stage, Duration deadline) {
        super(String.format("Handler for stage %s exceeded deadline of %dms",
                stage.getValue(), deadline.toMillis()));
    }
}
