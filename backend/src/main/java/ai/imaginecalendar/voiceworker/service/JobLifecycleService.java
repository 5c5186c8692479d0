package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.JobStatus;
import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.model.payload.ClarificationAnswered;
import ai.imaginecalendar.voiceworker.model.payload.ClarificationRequested;
import ai.imaginecalendar.voiceworker.model.payload.StagePayload;
import ai.imaginecalendar.voiceworker.model.payload.VoiceMessageReceived;
import ai.imaginecalendar.voiceworker.service.exception.InvalidJobStateException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates job records and derives their successors.
 *
 * <p>All methods are pure with respect to storage: they return a new
 * {@link JobRecord} and never touch the queue.
 */
@Slf4j
@Service
public class JobLifecycleService {

    private final StageRegistry stageRegistry;
    private final Clock clock;
    private final int maxAttempts;

    @Autowired
    public JobLifecycleService(StageRegistry stageRegistry, PipelineProperties properties, Clock clock) {
        this.stageRegistry = stageRegistry;
        this.clock = clock;
        this.maxAttempts = properties.getRetry().getMaxAttempts();
    }

    public JobRecord create(String messageId, VoiceMessageReceived payload) {
        Instant now = clock.instant();
        JobRecord job = JobRecord.builder()
                .jobId(UUID.randomUUID().toString())
                .messageId(messageId)
                .stage(Stage.WEBHOOK_RECEIVED)
                .status(JobStatus.QUEUED)
                .attemptCount(0)
                .maxAttempts(maxAttempts)
                .payload(payload)
                .createdAt(now)
                .updatedAt(now)
                .build();

        log.debug("Created job {} for message {}", job.getJobId(), messageId);
        return job;
    }

    /**
     * Moves the job to its default next stage with the payload unchanged
     */
    public JobRecord advance(JobRecord job) {
        return advance(job, job.getPayload(), null);
    }

    /**
     * Moves the job past its current stage.
     *
     * @param produced payload the handler produced
     * @param route explicit branch requested by the handler, may be null
     * @return the record at the next stage, or a COMPLETED record if the pipeline is done
     */
    public JobRecord advance(JobRecord job, StagePayload produced, Stage route) {
        Optional<Stage> next = stageRegistry.resolveNext(job.getStage(), produced, route);
        JobRecord.JobRecordBuilder builder = job.toBuilder()
                .payload(produced)
                .attemptCount(0)
                .lastError(null)
                .redelivered(false)
                .updatedAt(clock.instant());

        if (next.isEmpty()) {
            return builder.status(JobStatus.COMPLETED).build();
        }
        return builder.stage(next.get()).status(JobStatus.QUEUED).build();
    }

    /**
     * Counts one failed attempt; the stage stays where it is
     */
    public JobRecord recordFailure(JobRecord job, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return job.toBuilder()
                .attemptCount(job.getAttemptCount() + 1)
                .lastError(message)
                .redelivered(false)
                .updatedAt(clock.instant())
                .build();
    }

    public JobRecord awaitInput(JobRecord job) {
        Instant now = clock.instant();
        return job.toBuilder()
                .status(JobStatus.AWAITING_INPUT)
                .awaitingSince(now)
                .reminderSentAt(null)
                .updatedAt(now)
                .build();
    }

    public JobRecord markReminderSent(JobRecord job) {
        Instant now = clock.instant();
        return job.toBuilder().reminderSentAt(now).updatedAt(now).build();
    }

    /**
     * Takes a job out of AWAITING_INPUT along the clarification round trip.
     *
     * @throws InvalidJobStateException if the job is not waiting for a reply
     */
    public JobRecord resumeWithReply(JobRecord job, String reply) {
        if (job.getStatus() != JobStatus.AWAITING_INPUT
                || !(job.getPayload() instanceof ClarificationRequested)) {
            throw new InvalidJobStateException(String.format(
                    "Job %s is %s at %s and not awaiting a clarification reply",
                    job.getJobId(), job.getStatus(), job.getStage().getValue()));
        }

        ClarificationAnswered answered = ClarificationAnswered.builder()
                .request((ClarificationRequested) job.getPayload())
                .reply(reply)
                .build();

        return job.toBuilder()
                .stage(StageRegistry.CLARIFICATION_ROUND_TRIP.getTo())
                .status(JobStatus.QUEUED)
                .payload(answered)
                .attemptCount(0)
                .lastError(null)
                .awaitingSince(null)
                .reminderSentAt(null)
                .updatedAt(clock.instant())
                .build();
    }

    public JobRecord markDeadLettered(JobRecord job) {
        return job.toBuilder().status(JobStatus.DEAD_LETTERED).lockToken(null).updatedAt(clock.instant()).build();
    }

    public JobRecord markExpired(JobRecord job) {
        return job.toBuilder()
                .status(JobStatus.EXPIRED)
                .lastError("Clarification reply not received in time")
                .updatedAt(clock.instant())
                .build();
    }

    /**
     * Prepares a dead-lettered job for a fresh run at its frozen stage
     */
    public JobRecord resetForRequeue(JobRecord job) {
        return job.toBuilder()
                .status(JobStatus.QUEUED)
                .attemptCount(0)
                .maxAttempts(maxAttempts)
                .lastError(null)
                .redelivered(false)
                .updatedAt(clock.instant())
                .build();
    }
}
