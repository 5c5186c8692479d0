package ai.imaginecalendar.voiceworker.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A job frozen at the time of its final failure.
 * Read-only once written; the entry id is the job id.
 */
@Value
@Builder
@Jacksonized
public class DeadLetterEntry {

    String entryId;

    JobRecord job;

    ErrorCategory errorCategory;

    String errorClass;

    String errorMessage;

    /**
     * Why the job was not retried, e.g. "max attempts (3) exhausted"
     */
    String reason;

    Instant failedAt;
}
