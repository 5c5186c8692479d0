package ai.imaginecalendar.voiceworker.service.queue;

import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.JobStatus;
import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.support.MutableClock;
import ai.imaginecalendar.voiceworker.support.PipelineFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class InMemoryJobQueueTest {

    private static final Set<Stage> ALL = EnumSet.allOf(Stage.class);
    private static final Duration LOCK = Duration.ofSeconds(60);

    private MutableClock clock;
    private InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-10-18T09:00:00Z");
        queue = new InMemoryJobQueue(PipelineFixtures.properties(), clock);
    }

    private JobRecord transcriptionJob(String id) {
        return PipelineFixtures.job(id, Stage.TRANSCRIPTION, PipelineFixtures.audio(), clock.instant());
    }

    private JobRecord parkedClarificationJob(String id) {
        queue.enqueue(PipelineFixtures.job(id, Stage.CLARIFICATION_RESPONSE,
                PipelineFixtures.clarification(), clock.instant()), clock.instant());
        JobRecord claimed = queue.dequeue(ALL, LOCK).orElseThrow();
        JobRecord awaiting = claimed.toBuilder()
                .status(JobStatus.AWAITING_INPUT)
                .awaitingSince(clock.instant())
                .build();
        assertThat(queue.park(awaiting)).isTrue();
        return queue.find(id).orElseThrow();
    }

    @Test
    void dequeue_SameNotBefore_ShouldBeFifo() {
        // Given
        queue.enqueue(transcriptionJob("a"), clock.instant());
        queue.enqueue(transcriptionJob("b"), clock.instant());
        queue.enqueue(transcriptionJob("c"), clock.instant());

        // When / Then
        assertThat(queue.dequeue(ALL, LOCK)).map(JobRecord::getJobId).contains("a");
        assertThat(queue.dequeue(ALL, LOCK)).map(JobRecord::getJobId).contains("b");
        assertThat(queue.dequeue(ALL, LOCK)).map(JobRecord::getJobId).contains("c");
        assertThat(queue.dequeue(ALL, LOCK)).isEmpty();
    }

    @Test
    void dequeue_NotBeforeInFuture_ShouldHideJobUntilDue() {
        // Given
        queue.enqueue(transcriptionJob("later"), clock.instant().plusSeconds(10));

        // When
        Optional<JobRecord> early = queue.dequeue(ALL, LOCK);
        clock.advance(Duration.ofSeconds(10));
        Optional<JobRecord> due = queue.dequeue(ALL, LOCK);

        // Then
        assertThat(early).isEmpty();
        assertThat(due).map(JobRecord::getJobId).contains("later");
        assertThat(queue.depth(Stage.TRANSCRIPTION)).isZero();
    }

    @Test
    void dequeue_ShouldPreferEarliestNotBeforeAcrossStages() {
        Instant now = clock.instant();
        queue.enqueue(transcriptionJob("t"), now.minusSeconds(1));
        queue.enqueue(PipelineFixtures.job("w", Stage.WEBHOOK_RECEIVED, PipelineFixtures.voiceMessage(), now),
                now.minusSeconds(5));

        assertThat(queue.dequeue(ALL, LOCK)).map(JobRecord::getJobId).contains("w");
    }

    @Test
    void dequeue_IneligibleStage_ShouldBeSkipped() {
        queue.enqueue(transcriptionJob("t"), clock.instant());

        assertThat(queue.dequeue(EnumSet.of(Stage.EVENT_CREATE), LOCK)).isEmpty();
        assertThat(queue.depth(Stage.TRANSCRIPTION)).isEqualTo(1);
    }

    @Test
    void dequeue_ClaimedJob_ShouldBeProcessingAndInvisible() {
        queue.enqueue(transcriptionJob("a"), clock.instant());

        JobRecord claimed = queue.dequeue(ALL, LOCK).orElseThrow();

        assertThat(claimed.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(claimed.getLockToken()).isNotBlank();
        assertThat(queue.holdsLock(claimed)).isTrue();
        assertThat(queue.isInFlight("a")).isTrue();
        assertThat(queue.inFlightCount()).isEqualTo(1);
        assertThat(queue.dequeue(ALL, LOCK)).isEmpty();
    }

    @Test
    void dequeue_EntryForOlderStage_ShouldBeDiscardedAsStale() {
        // Given: a queue entry left behind after the record moved on
        JobRecord job = transcriptionJob("a");
        queue.enqueue(job, clock.instant());
        queue.enqueue(job.toBuilder().stage(Stage.INTENT_ANALYSIS).payload(PipelineFixtures.transcript()).build(),
                clock.instant());

        // When
        Optional<JobRecord> claimed = queue.dequeue(ALL, LOCK);

        // Then
        assertThat(claimed).map(JobRecord::getStage).contains(Stage.INTENT_ANALYSIS);
        assertThat(queue.depth(Stage.TRANSCRIPTION)).isZero();
        assertThat(queue.dequeue(ALL, LOCK)).isEmpty();
    }

    @Test
    void releaseExpiredLocks_ShouldRequeueAsRedeliveredWithSameAttemptCount() {
        // Given
        queue.enqueue(transcriptionJob("a").toBuilder().attemptCount(1).build(), clock.instant());
        queue.dequeue(ALL, LOCK);

        // When
        int beforeExpiry = queue.releaseExpiredLocks(clock.instant().plusSeconds(30));
        int afterExpiry = queue.releaseExpiredLocks(clock.instant().plusSeconds(61));

        // Then
        assertThat(beforeExpiry).isZero();
        assertThat(afterExpiry).isEqualTo(1);
        assertThat(queue.isInFlight("a")).isFalse();
        assertThat(queue.queuedIds(Stage.TRANSCRIPTION)).containsExactly("a");

        JobRecord record = queue.find("a").orElseThrow();
        assertThat(record.isRedelivered()).isTrue();
        assertThat(record.getAttemptCount()).isEqualTo(1);
        assertThat(record.getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void ack_AfterLockReleased_ShouldReturnFalse() {
        queue.enqueue(transcriptionJob("a"), clock.instant());
        JobRecord claimed = queue.dequeue(ALL, LOCK).orElseThrow();
        queue.releaseExpiredLocks(clock.instant().plus(LOCK));

        assertThat(queue.ack(claimed)).isFalse();
    }

    @Test
    void ack_StaleOwnerAfterRedelivery_ShouldLeaveNewOwnersLockInPlace() {
        // Given: worker 1 loses its lock and worker 2 claims the job again
        queue.enqueue(transcriptionJob("a"), clock.instant());
        JobRecord firstClaim = queue.dequeue(ALL, LOCK).orElseThrow();
        clock.advance(Duration.ofSeconds(61));
        queue.releaseExpiredLocks(clock.instant());
        JobRecord secondClaim = queue.dequeue(ALL, LOCK).orElseThrow();

        // When
        boolean staleAck = queue.ack(firstClaim);

        // Then
        assertThat(staleAck).isFalse();
        assertThat(queue.isInFlight("a")).isTrue();
        assertThat(queue.holdsLock(secondClaim)).isTrue();
        assertThat(queue.holdsLock(firstClaim)).isFalse();
    }

    @Test
    void release_StaleOwner_ShouldNotMoveJobBack() {
        // Given: the new owner already handed the job on to the next stage
        queue.enqueue(transcriptionJob("a"), clock.instant());
        JobRecord firstClaim = queue.dequeue(ALL, LOCK).orElseThrow();
        clock.advance(Duration.ofSeconds(61));
        queue.releaseExpiredLocks(clock.instant());
        JobRecord secondClaim = queue.dequeue(ALL, LOCK).orElseThrow();
        queue.release(secondClaim.toBuilder().stage(Stage.INTENT_ANALYSIS)
                .payload(PipelineFixtures.transcript()).build(), clock.instant());

        // When
        boolean released = queue.release(firstClaim.toBuilder().attemptCount(1).build(), clock.instant());
        boolean updated = queue.update(firstClaim.toBuilder().attemptCount(1).build());
        boolean completed = queue.complete(firstClaim.toBuilder().status(JobStatus.COMPLETED).build());

        // Then
        assertThat(released).isFalse();
        assertThat(updated).isFalse();
        assertThat(completed).isFalse();
        assertThat(queue.depth(Stage.TRANSCRIPTION)).isZero();
        assertThat(queue.find("a")).map(JobRecord::getStage).contains(Stage.INTENT_ANALYSIS);
        assertThat(queue.queuedIds(Stage.INTENT_ANALYSIS)).containsExactly("a");
    }

    @Test
    void release_ShouldReleaseLockAndScheduleRetry() {
        queue.enqueue(transcriptionJob("a"), clock.instant());
        JobRecord claimed = queue.dequeue(ALL, LOCK).orElseThrow();

        boolean released = queue.release(claimed.toBuilder().attemptCount(1).build(), clock.instant().plusSeconds(5));

        assertThat(released).isTrue();
        assertThat(queue.isInFlight("a")).isFalse();
        assertThat(queue.find("a")).map(JobRecord::getLockToken).isEmpty();
        assertThat(queue.find("a")).map(JobRecord::getStatus).contains(JobStatus.QUEUED);
        assertThat(queue.dequeue(ALL, LOCK)).isEmpty();
        clock.advance(Duration.ofSeconds(5));
        assertThat(queue.dequeue(ALL, LOCK)).map(JobRecord::getAttemptCount).contains(1);
    }

    @Test
    void parkAndUnpark_ShouldMoveJobOutOfAndBackIntoItsQueue() {
        JobRecord parked = parkedClarificationJob("c");

        assertThat(queue.parkedCount()).isEqualTo(1);
        assertThat(queue.inFlightCount()).isZero();
        assertThat(queue.parked()).extracting(JobRecord::getJobId).containsExactly("c");

        boolean unparked = queue.unpark(parked.toBuilder().stage(Stage.INTENT_REQUEST).status(JobStatus.QUEUED).build());
        assertThat(unparked).isTrue();
        assertThat(queue.parkedCount()).isZero();
        assertThat(queue.queuedIds(Stage.INTENT_REQUEST)).containsExactly("c");
    }

    @Test
    void updateParked_AfterUnpark_ShouldNotOverwriteResumedRecord() {
        // Given: a snapshot taken while parked, then the job is resumed
        JobRecord snapshot = parkedClarificationJob("c");
        queue.unpark(snapshot.toBuilder().stage(Stage.INTENT_REQUEST).status(JobStatus.QUEUED).build());

        // When
        boolean updated = queue.updateParked(snapshot.toBuilder().reminderSentAt(clock.instant()).build());
        boolean archived = queue.archiveParked(snapshot.toBuilder().status(JobStatus.EXPIRED).build());

        // Then
        assertThat(updated).isFalse();
        assertThat(archived).isFalse();
        assertThat(queue.find("c")).map(JobRecord::getStatus).contains(JobStatus.QUEUED);
        assertThat(queue.queuedIds(Stage.INTENT_REQUEST)).containsExactly("c");
    }

    @Test
    void unpark_AfterArchiveParked_ShouldBeRefused() {
        JobRecord snapshot = parkedClarificationJob("c");
        queue.archiveParked(snapshot.toBuilder().status(JobStatus.EXPIRED).build());

        boolean unparked = queue.unpark(snapshot.toBuilder().stage(Stage.INTENT_REQUEST).status(JobStatus.QUEUED).build());

        assertThat(unparked).isFalse();
        assertThat(queue.find("c")).map(JobRecord::getStatus).contains(JobStatus.EXPIRED);
        assertThat(queue.depth(Stage.INTENT_REQUEST)).isZero();
    }

    @Test
    void complete_ShouldKeepRecordUntilRetentionPasses() {
        queue.enqueue(transcriptionJob("a"), clock.instant());
        JobRecord claimed = queue.dequeue(ALL, LOCK).orElseThrow();

        assertThat(queue.complete(claimed.toBuilder().status(JobStatus.COMPLETED).build())).isTrue();
        assertThat(queue.find("a")).isPresent();
        assertThat(queue.inFlightCount()).isZero();

        clock.advance(Duration.ofHours(1));
        assertThat(queue.find("a")).isEmpty();
    }

    @Test
    void releaseExpiredLocks_ShouldEvictArchivedRecordsNobodyLooksUp() {
        // Given
        for (String id : List.of("a", "b", "c")) {
            queue.enqueue(transcriptionJob(id), clock.instant());
            JobRecord claimed = queue.dequeue(ALL, LOCK).orElseThrow();
            queue.complete(claimed.toBuilder().status(JobStatus.COMPLETED).build());
        }
        assertThat(queue.storedRecordCount()).isEqualTo(3);

        // When
        clock.advance(Duration.ofHours(1));
        queue.releaseExpiredLocks(clock.instant());

        // Then
        assertThat(queue.storedRecordCount()).isZero();
    }

    @Test
    void dequeue_ConcurrentWorkers_ShouldClaimEveryJobExactlyOnce() throws Exception {
        // Given
        int jobs = 500;
        int workers = 8;
        IntStream.range(0, jobs).forEach(i -> queue.enqueue(transcriptionJob("job-" + i), clock.instant()));
        Map<String, AtomicInteger> claims = new ConcurrentHashMap<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(workers);

        // When
        List<Future<?>> futures = IntStream.range(0, workers)
                .mapToObj(w -> executor.submit(() -> {
                    start.await();
                    Optional<JobRecord> next;
                    while ((next = queue.dequeue(ALL, LOCK)).isPresent()) {
                        claims.computeIfAbsent(next.get().getJobId(), id -> new AtomicInteger()).incrementAndGet();
                        queue.ack(next.get());
                    }
                    return null;
                }))
                .collect(Collectors.toList());
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(claims).hasSize(jobs);
        assertThat(claims.values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
        assertThat(queue.inFlightCount()).isZero();
    }

    @Test
    void claimMessage_SecondClaim_ShouldFailUntilReleased() {
        assertThat(queue.claimMessage("msg-1", "job-1")).isTrue();
        assertThat(queue.claimMessage("msg-1", "job-2")).isFalse();
        assertThat(queue.activeJobForMessage("msg-1")).contains("job-1");

        // releasing with a different job id leaves the binding alone
        queue.releaseMessage("msg-1", "job-2");
        assertThat(queue.activeJobForMessage("msg-1")).contains("job-1");

        queue.releaseMessage("msg-1", "job-1");
        assertThat(queue.claimMessage("msg-1", "job-2")).isTrue();
    }

    @Test
    void remove_ShouldDropJobEverywhere() {
        queue.enqueue(transcriptionJob("a"), clock.instant());
        queue.dequeue(ALL, LOCK);

        queue.remove("a");

        assertThat(queue.isInFlight("a")).isFalse();
        assertThat(queue.find("a")).isEmpty();
        assertThat(queue.releaseExpiredLocks(clock.instant().plus(LOCK))).isZero();
    }
}
