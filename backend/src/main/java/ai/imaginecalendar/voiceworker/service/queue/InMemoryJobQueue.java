package ai.imaginecalendar.voiceworker.service.queue;

import ai.imaginecalendar.voiceworker.config.PipelineProperties;
import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.JobStatus;
import ai.imaginecalendar.voiceworker.model.Stage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Single-process queue used when Redis is disabled (local development and tests).
 * Same contract as the Redis store; all state is lost on restart.
 * Every public method is synchronized, which makes each queue move atomic.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "false")
public class InMemoryJobQueue implements JobQueue {

    private final Clock clock;
    private final Duration completedRetention;

    private final Map<String, JobRecord> records = new HashMap<>();
    private final Map<Stage, Map<String, QueuedEntry>> stageQueues = new EnumMap<>(Stage.class);
    private final Map<String, Lock> inFlight = new HashMap<>();
    private final Map<String, Instant> awaiting = new LinkedHashMap<>();
    private final Map<String, Instant> archived = new HashMap<>();
    private final Map<String, String> messageIndex = new HashMap<>();
    private long sequence;

    @Autowired
    public InMemoryJobQueue(PipelineProperties properties, Clock clock) {
        this.clock = clock;
        this.completedRetention = properties.getQueue().getCompletedRetention();
        for (Stage stage : Stage.values()) {
            stageQueues.put(stage, new HashMap<>());
        }
        log.info("Using in-memory job queue (Redis disabled)");
    }

    @Override
    public synchronized void enqueue(JobRecord job, Instant notBefore) {
        records.put(job.getJobId(), job.toBuilder().lockToken(null).build());
        stageQueues.get(job.getStage()).put(job.getJobId(), new QueuedEntry(job.getJobId(), notBefore, sequence++));
    }

    @Override
    public synchronized Optional<JobRecord> dequeue(Collection<Stage> eligibleStages, Duration lockDuration) {
        Instant now = clock.instant();
        while (true) {
            Stage bestStage = null;
            QueuedEntry best = null;
            for (Stage stage : eligibleStages) {
                for (QueuedEntry entry : stageQueues.get(stage).values()) {
                    if (entry.notBefore.isAfter(now)) {
                        continue;
                    }
                    if (best == null || entry.compareTo(best) < 0) {
                        best = entry;
                        bestStage = stage;
                    }
                }
            }
            if (best == null) {
                return Optional.empty();
            }

            stageQueues.get(bestStage).remove(best.jobId);
            JobRecord record = records.get(best.jobId);
            if (record == null || record.getStage() != bestStage || record.isTerminal()) {
                log.debug("Discarding stale queue entry {} at stage {}", best.jobId, bestStage.getValue());
                continue;
            }

            String token = UUID.randomUUID().toString();
            JobRecord claimed = record.toBuilder()
                    .status(JobStatus.PROCESSING)
                    .lockToken(token)
                    .updatedAt(now)
                    .build();
            records.put(claimed.getJobId(), claimed);
            inFlight.put(claimed.getJobId(), new Lock(token, now.plus(lockDuration)));
            return Optional.of(claimed);
        }
    }

    @Override
    public synchronized boolean holdsLock(JobRecord claimed) {
        Lock lock = inFlight.get(claimed.getJobId());
        return lock != null && Objects.equals(lock.token, claimed.getLockToken());
    }

    @Override
    public synchronized boolean ack(JobRecord claimed) {
        if (!holdsLock(claimed)) {
            return false;
        }
        inFlight.remove(claimed.getJobId());
        return true;
    }

    @Override
    public synchronized boolean update(JobRecord claimed) {
        if (!holdsLock(claimed)) {
            return false;
        }
        records.put(claimed.getJobId(), claimed);
        return true;
    }

    @Override
    public synchronized boolean release(JobRecord claimed, Instant notBefore) {
        if (!ack(claimed)) {
            return false;
        }
        enqueue(claimed.toBuilder().status(JobStatus.QUEUED).build(), notBefore);
        return true;
    }

    @Override
    public synchronized boolean park(JobRecord claimed) {
        if (!ack(claimed)) {
            return false;
        }
        records.put(claimed.getJobId(), claimed.toBuilder().lockToken(null).build());
        awaiting.put(claimed.getJobId(),
                claimed.getAwaitingSince() != null ? claimed.getAwaitingSince() : clock.instant());
        return true;
    }

    @Override
    public synchronized boolean complete(JobRecord claimed) {
        if (!ack(claimed)) {
            return false;
        }
        archive(claimed);
        return true;
    }

    @Override
    public synchronized int releaseExpiredLocks(Instant now) {
        evictExpiredArchive(now);

        int released = 0;
        Iterator<Map.Entry<String, Lock>> it = inFlight.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Lock> lock = it.next();
            if (lock.getValue().expiresAt.isAfter(now)) {
                continue;
            }
            it.remove();
            JobRecord record = records.get(lock.getKey());
            if (record == null) {
                continue;
            }
            JobRecord redelivered = record.toBuilder()
                    .status(JobStatus.QUEUED)
                    .redelivered(true)
                    .updatedAt(now)
                    .build();
            enqueue(redelivered, now);
            released++;
        }
        return released;
    }

    @Override
    public synchronized long depth(Stage stage) {
        return stageQueues.get(stage).size();
    }

    @Override
    public synchronized long inFlightCount() {
        return inFlight.size();
    }

    @Override
    public synchronized boolean updateParked(JobRecord job) {
        if (!awaiting.containsKey(job.getJobId())) {
            return false;
        }
        records.put(job.getJobId(), job);
        return true;
    }

    @Override
    public synchronized boolean unpark(JobRecord job) {
        if (awaiting.remove(job.getJobId()) == null) {
            return false;
        }
        enqueue(job, clock.instant());
        return true;
    }

    @Override
    public synchronized boolean archiveParked(JobRecord job) {
        if (awaiting.remove(job.getJobId()) == null) {
            return false;
        }
        archive(job);
        return true;
    }

    @Override
    public synchronized List<JobRecord> parked() {
        return awaiting.entrySet().stream()
                .sorted(Map.Entry.comparingByValue())
                .map(e -> records.get(e.getKey()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long parkedCount() {
        return awaiting.size();
    }

    @Override
    public synchronized void remove(String jobId) {
        records.remove(jobId);
        for (Map<String, QueuedEntry> queue : stageQueues.values()) {
            queue.remove(jobId);
        }
        inFlight.remove(jobId);
        awaiting.remove(jobId);
        archived.remove(jobId);
    }

    @Override
    public synchronized Optional<JobRecord> find(String jobId) {
        Instant expiry = archived.get(jobId);
        if (expiry != null && !expiry.isAfter(clock.instant())) {
            archived.remove(jobId);
            records.remove(jobId);
        }
        return Optional.ofNullable(records.get(jobId));
    }

    @Override
    public synchronized boolean claimMessage(String messageId, String jobId) {
        return messageIndex.putIfAbsent(messageId, jobId) == null;
    }

    @Override
    public synchronized Optional<String> activeJobForMessage(String messageId) {
        return Optional.ofNullable(messageIndex.get(messageId));
    }

    @Override
    public synchronized void releaseMessage(String messageId, String jobId) {
        messageIndex.remove(messageId, jobId);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Ids of jobs in a stage queue, earliest first; used by diagnostics and tests
     */
    public synchronized List<String> queuedIds(Stage stage) {
        List<QueuedEntry> entries = new ArrayList<>(stageQueues.get(stage).values());
        entries.sort(Comparator.naturalOrder());
        return entries.stream().map(e -> e.jobId).collect(Collectors.toList());
    }

    public synchronized boolean isInFlight(String jobId) {
        return inFlight.containsKey(jobId);
    }

    /**
     * Records currently held, archived ones included
     */
    public synchronized int storedRecordCount() {
        return records.size();
    }

    private void archive(JobRecord job) {
        Instant now = clock.instant();
        evictExpiredArchive(now);
        records.put(job.getJobId(), job.toBuilder().lockToken(null).build());
        archived.put(job.getJobId(), now.plus(completedRetention));
    }

    private void evictExpiredArchive(Instant now) {
        Iterator<Map.Entry<String, Instant>> it = archived.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Instant> entry = it.next();
            if (!entry.getValue().isAfter(now)) {
                records.remove(entry.getKey());
                it.remove();
            }
        }
    }

    private static final class Lock {
        private final String token;
        private final Instant expiresAt;

        private Lock(String token, Instant expiresAt) {
            this.token = token;
            this.expiresAt = expiresAt;
        }
    }

    private static final class QueuedEntry implements Comparable<QueuedEntry> {
        private final String jobId;
        private final Instant notBefore;
        private final long seq;

        private QueuedEntry(String jobId, Instant notBefore, long seq) {
            this.jobId = jobId;
            this.notBefore = notBefore;
            this.seq = seq;
        }

        @Override
        public int compareTo(QueuedEntry other) {
            int byTime = notBefore.compareTo(other.notBefore);
            return byTime != 0 ? byTime : Long.compare(seq, other.seq);
        }
    }
}
