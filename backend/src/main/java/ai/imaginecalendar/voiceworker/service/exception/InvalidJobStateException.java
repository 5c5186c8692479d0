package ai.imaginecalendar.voiceworker.service.exception;

/**
 * Operation is not allowed for the job's current status
 */
public class InvalidJobStateException extends RuntimeException {

    public InvalidJobStateException(String message) {
        super(message);
    }
}
