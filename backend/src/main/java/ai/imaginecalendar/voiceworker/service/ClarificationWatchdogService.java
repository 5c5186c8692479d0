package ai.imaginecalendar.voiceworker.service;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.JobStatus;
import ai.imaginecalendar.voiceworker.service.interfaces.ClarificationNotifier;
import ai.imaginecalendar.voiceworker.service.queue.JobQueue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Watches jobs waiting for a clarification reply: one reminder shortly
 * before the deadline, expiry once it passes.
 */
@Slf4j
@Service
public class ClarificationWatchdogService {

    private final JobQueue jobQueue;
    private final JobLifecycleService lifecycle;
    private final PipelineMetricsService metrics;
    private final ObjectProvider<ClarificationNotifier> notifier;
    private final Clock clock;
    private final Duration timeout;
    private final Duration reminderAfter;

    @Autowired
    public ClarificationWatchdogService(JobQueue jobQueue,
                                        JobLifecycleService lifecycle,
                                        PipelineMetricsService metrics,
                                        ObjectProvider<ClarificationNotifier> notifier,
                                        PipelineProperties properties,
                                        Clock clock) {
        this.jobQueue = jobQueue;
        this.lifecycle = lifecycle;
        this.metrics = metrics;
        this.notifier = notifier;
        this.clock = clock;
        this.timeout = properties.getClarification().getTimeout();
        this.reminderAfter = timeout.minus(properties.getClarification().getReminderBefore());
    }

    @Scheduled(fixedDelayString = "${pipeline.clarification.check-interval:PT60S}",
            initialDelayString = "${pipeline.clarification.check-interval:PT60S}")
    public void scheduledCheck() {
        try {
            checkAwaitingJobs();
        } catch (Exception e) {
            log.error("Clarification watchdog run failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return number of jobs expired in this run
     */
    public int checkAwaitingJobs() {
        Instant now = clock.instant();
        int expired = 0;

        for (JobRecord job : jobQueue.parked()) {
            if (job.getStatus() != JobStatus.AWAITING_INPUT || job.getAwaitingSince() == null) {
                continue;
            }
            Duration waited = Duration.between(job.getAwaitingSince(), now);

            if (waited.compareTo(timeout) >= 0) {
                if (expire(job)) {
                    expired++;
                }
            } else if (waited.compareTo(reminderAfter) >= 0 && job.getReminderSentAt() == null) {
                remind(job);
            }
        }
        return expired;
    }

    private boolean expire(JobRecord job) {
        JobRecord expired = lifecycle.markExpired(job);
        if (!jobQueue.archiveParked(expired)) {
            log.debug("Job {} left the awaiting set before it could expire", job.getJobId());
            return false;
        }
        jobQueue.releaseMessage(job.getMessageId(), job.getJobId());
        metrics.recordExpired();
        log.warn("Job {} (message {}) expired waiting for a clarification reply",
                job.getJobId(), job.getMessageId());

        ClarificationNotifier channel = notifier.getIfAvailable();
        if (channel != null) {
            try {
                channel.sendTimeout(expired);
            } catch (Exception e) {
                log.warn("Failed to send timeout notice for job {}: {}", job.getJobId(), e.getMessage());
            }
        }
        return true;
    }

    private void remind(JobRecord job) {
        ClarificationNotifier channel = notifier.getIfAvailable();
        if (channel == null) {
            return;
        }
        try {
            channel.sendReminder(job);
            if (jobQueue.updateParked(lifecycle.markReminderSent(job))) {
                log.info("Sent clarification reminder for job {} (message {})", job.getJobId(), job.getMessageId());
            } else {
                log.debug("Job {} was resumed or expired while its reminder was sent", job.getJobId());
            }
        } catch (Exception e) {
            log.warn("Failed to send clarification reminder for job {}: {}", job.getJobId(), e.getMessage());
        }
    }
}
