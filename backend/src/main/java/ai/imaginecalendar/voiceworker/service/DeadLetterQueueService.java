package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.model.DeadLetterEntry;
import ai.imaginecalendar.voiceworker.model.DeadLetterFilter;
import ai.imaginecalendar.voiceworker.model.ErrorCategory;
import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.service.exception.InvalidJobStateException;
import ai.imaginecalendar.voiceworker.service.exception.JobNotFoundException;
import ai.imaginecalendar.voiceworker.service.queue.DeadLetterStore;
import ai.imaginecalendar.voiceworker.service.queue.JobQueue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Dead letter queue for jobs that exhausted their attempts or failed
 * with a non-retryable error.
 *
 * <p>Entries leave the DLQ only through operator action: {@link #requeue},
 * {@link #delete} or {@link #purgeOlderThan}. The optional scheduled purge
 * is the operator's retention setting applied on a timer.
 */
@Slf4j
@Service
public class DeadLetterQueueService {

    private final DeadLetterStore store;
    private final JobQueue jobQueue;
    private final JobLifecycleService lifecycle;
    private final RetryPolicy retryPolicy;
    private final ErrorClassificationService errorClassificationService;
    private final PipelineMetricsService metrics;
    private final Clock clock;
    private final Duration retention;

    @Autowired
    public DeadLetterQueueService(DeadLetterStore store,
                                  JobQueue jobQueue,
                                  JobLifecycleService lifecycle,
                                  RetryPolicy retryPolicy,
                                  ErrorClassificationService errorClassificationService,
                                  PipelineMetricsService metrics,
                                  PipelineProperties properties,
                                  Clock clock) {
        this.store = store;
        this.jobQueue = jobQueue;
        this.lifecycle = lifecycle;
        this.retryPolicy = retryPolicy;
        this.errorClassificationService = errorClassificationService;
        this.metrics = metrics;
        this.clock = clock;
        this.retention = properties.getDlq().getRetention();
    }

    /**
     * Freezes the job into a dead letter entry and removes it from the primary queue.
     * Calling it again for the same job returns the existing entry unchanged.
     *
     * @throws IllegalStateException if the error is retryable and the job has attempts left
     */
    public DeadLetterEntry moveToDLQ(JobRecord job, Throwable error) {
        Optional<DeadLetterEntry> existing = store.get(job.getJobId());
        if (existing.isPresent()) {
            log.debug("Job {} is already dead-lettered", job.getJobId());
            return existing.get();
        }

        ErrorCategory category = errorClassificationService.classify(error);
        boolean retryable = retryPolicy.isRetryable(category);
        if (retryable && retryPolicy.shouldRetry(job)) {
            throw new IllegalStateException(String.format(
                    "Job %s still has attempts left (%d/%d) for a retryable %s error",
                    job.getJobId(), job.getAttemptCount(), job.getMaxAttempts(), category));
        }

        String reason = retryable
                ? String.format("max attempts (%d) exhausted", job.getMaxAttempts())
                : "non-retryable " + category.name().toLowerCase() + " error";

        DeadLetterEntry entry = DeadLetterEntry.builder()
                .entryId(job.getJobId())
                .job(lifecycle.markDeadLettered(job))
                .errorCategory(category)
                .errorClass(error.getClass().getName())
                .errorMessage(error.getMessage())
                .reason(reason)
                .failedAt(clock.instant())
                .build();

        if (!store.putIfAbsent(entry)) {
            return store.get(job.getJobId()).orElse(entry);
        }
        jobQueue.remove(job.getJobId());
        jobQueue.releaseMessage(job.getMessageId(), job.getJobId());
        metrics.recordDeadLetter(job.getStage(), category);

        log.warn("Job {} (message {}) dead-lettered at stage {} after {} attempt(s): {} - {}",
                job.getJobId(), job.getMessageId(), job.getStage().getValue(),
                job.getAttemptCount(), reason, error.getMessage());
        return entry;
    }

    /**
     * Entries matching the filter, newest first, at most {@code filter.limit}
     */
    public List<DeadLetterEntry> listDLQ(DeadLetterFilter filter) {
        return store.listNewestFirst().stream()
                .filter(filter::matches)
                .limit(Math.max(filter.getLimit(), 0))
                .collect(Collectors.toList());
    }

    public Optional<DeadLetterEntry> inspect(String entryId) {
        return store.get(entryId);
    }

    /**
     * Puts a dead-lettered job back at its frozen stage with a fresh attempt budget.
     *
     * @throws JobNotFoundException if there is no such entry
     * @throws InvalidJobStateException if another job is already active for the same message
     */
    public JobRecord requeue(String entryId) {
        DeadLetterEntry entry = store.get(entryId)
                .orElseThrow(() -> new JobNotFoundException("No dead letter entry " + entryId));

        JobRecord job = lifecycle.resetForRequeue(entry.getJob());
        if (!jobQueue.claimMessage(job.getMessageId(), job.getJobId())) {
            String active = jobQueue.activeJobForMessage(job.getMessageId()).orElse(null);
            if (!job.getJobId().equals(active)) {
                throw new InvalidJobStateException(String.format(
                        "Message %s already has active job %s", job.getMessageId(), active));
            }
        }

        jobQueue.enqueue(job, clock.instant());
        store.delete(entryId);

        log.info("Requeued job {} (message {}) from DLQ at stage {}",
                job.getJobId(), job.getMessageId(), job.getStage().getValue());
        return job;
    }

    public boolean delete(String entryId) {
        boolean deleted = store.delete(entryId);
        if (deleted) {
            log.info("Deleted dead letter entry {}", entryId);
        }
        return deleted;
    }

    /**
     * Deletes entries that failed more than {@code age} ago.
     *
     * @return number of entries removed
     */
    public int purgeOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int purged = 0;
        for (String entryId : store.idsFailedBefore(cutoff)) {
            if (store.delete(entryId)) {
                purged++;
            }
        }
        if (purged > 0) {
            log.info("Purged {} dead letter entries older than {}", purged, age);
        }
        return purged;
    }

    public long size() {
        return store.size();
    }

    @Scheduled(fixedDelayString = "${pipeline.dlq.cleanup-interval:PT1H}",
            initialDelayString = "${pipeline.dlq.cleanup-interval:PT1H}")
    public void purgeExpiredEntries() {
        if (retention == null) {
            return;
        }
        try {
            purgeOlderThan(retention);
        } catch (Exception e) {
            log.error("Dead letter retention purge failed: {}", e.getMessage(), e);
        }
    }
}
