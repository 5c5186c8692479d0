package ai.imaginecalendar.voiceworker.service.exception;

import java.time.Duration;

/**
 * Recorded against a job whose previous owner never acknowledged it
 * before the visibility lock ran out.
 */
public class LockExpiredException extends TransientStageException {

    public LockExpiredException(String jobId, Duration lockDuration) {
        super(String.format("Job %s was not acknowledged within the %ds visibility lock",
                jobId, lockDuration.getSeconds()));
    }
}
