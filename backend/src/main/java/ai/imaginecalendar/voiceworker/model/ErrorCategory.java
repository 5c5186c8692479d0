package ai.imaginecalendar.voiceworker.model;

/**
 * Failure taxonomy used to route a failed attempt
 */
public enum ErrorCategory {
    /** Malformed payload, dead-lettered immediately */
    VALIDATION(false),
    /** External dependency timeout or 5xx, retried per policy */
    TRANSIENT(true),
    /** Handler signalled a non-retryable failure, dead-lettered immediately */
    PERMANENT(false),
    /** Queue store unreachable, escalated instead of retried */
    INFRASTRUCTURE(true);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
