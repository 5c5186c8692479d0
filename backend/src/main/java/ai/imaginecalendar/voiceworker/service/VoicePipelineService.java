package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.model.DeadLetterEntry;
import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.QueueStats;
import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.model.payload.VoiceMessageReceived;
import ai.imaginecalendar.voiceworker.service.exception.InvalidJobStateException;
import ai.imaginecalendar.voiceworker.service.exception.JobNotFoundException;
import ai.imaginecalendar.voiceworker.service.exception.PayloadValidationException;
import ai.imaginecalendar.voiceworker.service.queue.JobQueue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry points used by the messaging integration: ingest a voice message,
 * feed back a clarification reply, look up a job.
 */
@Slf4j
@Service
public class VoicePipelineService {

    private final JobQueue jobQueue;
    private final JobLifecycleService lifecycle;
    private final DeadLetterQueueService deadLetterQueue;
    private final PipelineMetricsService metrics;
    private final Clock clock;

    @Autowired
    public VoicePipelineService(JobQueue jobQueue,
                                JobLifecycleService lifecycle,
                                DeadLetterQueueService deadLetterQueue,
                                PipelineMetricsService metrics,
                                Clock clock) {
        this.jobQueue = jobQueue;
        this.lifecycle = lifecycle;
        this.deadLetterQueue = deadLetterQueue;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Creates a job for the message at webhook_received.
     * While a non-terminal job exists for the same message its id is returned
     * and nothing is enqueued.
     *
     * @return id of the job handling the message
     */
    public String ingest(String messageId, VoiceMessageReceived source) {
        if (messageId == null || messageId.isBlank()) {
            throw new PayloadValidationException("Message id is required");
        }
        if (source == null) {
            throw new PayloadValidationException("Source payload is required for message " + messageId);
        }

        Optional<String> existing = findActiveJob(messageId);
        if (existing.isPresent()) {
            log.info("Message {} is already handled by job {}", messageId, existing.get());
            return existing.get();
        }

        JobRecord job = lifecycle.create(messageId, source);
        if (!jobQueue.claimMessage(messageId, job.getJobId())) {
            // lost a race against a concurrent ingest of the same message
            String winner = jobQueue.activeJobForMessage(messageId).orElse(job.getJobId());
            log.info("Message {} was claimed concurrently by job {}", messageId, winner);
            return winner;
        }

        jobQueue.enqueue(job, clock.instant());
        metrics.recordIngested();
        log.info("Ingested message {} as job {}", messageId, job.getJobId());
        return job.getJobId();
    }

    /**
     * Feeds the user's reply into a job waiting at clarification_response.
     * The job re-enters intent_request with a fresh attempt budget.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws InvalidJobStateException if the job is not awaiting a reply
     */
    public JobRecord resumeWithClarification(String jobId, String reply) {
        if (reply == null || reply.isBlank()) {
            throw new PayloadValidationException("Clarification reply for job " + jobId + " is empty");
        }
        JobRecord job = jobQueue.find(jobId)
                .orElseThrow(() -> new JobNotFoundException("Job " + jobId + " not found"));

        JobRecord resumed = lifecycle.resumeWithReply(job, reply);
        if (!jobQueue.unpark(resumed)) {
            throw new InvalidJobStateException("Job " + jobId + " is no longer awaiting a clarification reply");
        }

        log.info("Job {} (message {}) resumed with clarification reply", jobId, job.getMessageId());
        return resumed;
    }

    /**
     * Current record of the job, including dead-lettered jobs
     */
    public Optional<JobRecord> getJob(String jobId) {
        Optional<JobRecord> job = jobQueue.find(jobId);
        if (job.isPresent()) {
            return job;
        }
        return deadLetterQueue.inspect(jobId).map(DeadLetterEntry::getJob);
    }

    public QueueStats getQueueStats() {
        Map<Stage, Long> depth = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.values()) {
            depth.put(stage, jobQueue.depth(stage));
        }
        return QueueStats.builder()
                .depthByStage(depth)
                .inFlight(jobQueue.inFlightCount())
                .awaitingInput(jobQueue.parkedCount())
                .deadLettered(deadLetterQueue.size())
                .timestamp(clock.instant())
                .build();
    }

    private Optional<String> findActiveJob(String messageId) {
        Optional<String> boundJobId = jobQueue.activeJobForMessage(messageId);
        if (boundJobId.isEmpty()) {
            return Optional.empty();
        }

        Optional<JobRecord> bound = jobQueue.find(boundJobId.get());
        if (bound.isEmpty() || !bound.get().isTerminal()) {
            // a missing record means a concurrent ingest bound the message and has not enqueued yet
            return boundJobId;
        }

        // binding outlived its job
        jobQueue.releaseMessage(messageId, boundJobId.get());
        return Optional.empty();
    }
}
