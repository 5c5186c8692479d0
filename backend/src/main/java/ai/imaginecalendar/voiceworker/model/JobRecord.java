package ai.imaginecalendar.voiceworker.model;

import ai.imaginecalendar.voiceworker.model.payload.StagePayload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One unit of pipeline work: a voice message at one stage.
 *
 * <p>Records are immutable. Every mutation goes through
 * {@link ai.imaginecalendar.voiceworker.service.JobLifecycleService} and yields a new
 * value; holders of an older value must treat it as stale.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class JobRecord {

    /**
     * Unique job identifier (UUID), stable across the stages of one message
     */
    String jobId;

    /**
     * Correlates all work for one voice message
     */
    String messageId;

    Stage stage;

    JobStatus status;

    /**
     * Failed attempts at the current stage
     */
    int attemptCount;

    int maxAttempts;

    StagePayload payload;

    /**
     * Error of the most recent failed attempt, null after a successful advance
     */
    String lastError;

    Instant createdAt;

    Instant updatedAt;

    /**
     * Set when the job was handed out again because its visibility lock expired
     */
    boolean redelivered;

    /**
     * When the job started waiting for a clarification reply
     */
    Instant awaitingSince;

    Instant reminderSentAt;

    /**
     * Claim issued by the queue on dequeue. Lock-scoped queue operations only
     * succeed while the stored lock still carries this token.
     */
    String lockToken;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
