package ai.imaginecalendar.voiceworker.service.exception;

/**
 * Thrown for a stage identifier that is not part of the registry
 */
public class UnknownStageException extends RuntimeException {

    private final String stageId;

    public UnknownStageException(String stageId) {
        super("Unknown pipeline stage: " + stageId);
        this.stageId = stageId;
    }

    public String getStageId() {
        return stageId;
    }
}
