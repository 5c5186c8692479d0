package ai.imaginecalendar.voiceworker.model;

/**
 * Where a job currently lives
 */
public enum JobStatus {
    QUEUED("queued"),
    PROCESSING("processing"),
    AWAITING_INPUT("awaiting_input"),
    COMPLETED("completed"),
    DEAD_LETTERED("dead_lettered"),
    EXPIRED("expired");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD_LETTERED || this == EXPIRED;
    }
}
