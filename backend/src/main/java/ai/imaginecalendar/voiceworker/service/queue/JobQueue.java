package ai.imaginecalendar.voiceworker.service.queue;

import ai.imaginecalendar.voiceworker.model.JobRecord;
import ai.imaginecalendar.voiceworker.model.Stage;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-stage job queue with visibility locks.
 *
 * <p>A job id lives in exactly one place at a time: a stage queue, the
 * in-flight set, the awaiting-input set or the completed archive. The
 * dead letter store owns everything else.
 *
 * <p>Every move between those places is a single atomic step. Operations on a
 * claimed job are scoped to the lock token handed out by {@link #dequeue}: once
 * the lock has expired and been released, a late call from the former owner is
 * refused and changes nothing. Operations on a parked job only apply while the
 * job is still parked.
 *
 * <p>Implementations signal an unreachable store with
 * {@link ai.imaginecalendar.voiceworker.service.exception.QueueInfrastructureException}.
 */
public interface JobQueue {

    /**
     * Stores an unclaimed record and makes it visible to dequeue at {@code notBefore}
     */
    void enqueue(JobRecord job, Instant notBefore);

    /**
     * Claims the ready job with the earliest not-before time among the eligible
     * stages and hides it from other workers until the lock expires.
     * Never blocks.
     *
     * @return the claimed job with status PROCESSING and a fresh lock token,
     *         or empty if nothing is ready
     */
    Optional<JobRecord> dequeue(Collection<Stage> eligibleStages, Duration lockDuration);

    /**
     * @return true while the lock issued with {@code claimed} is still in place
     */
    boolean holdsLock(JobRecord claimed);

    /**
     * Releases the lock of a job whose outcome has been stored elsewhere.
     *
     * @return false if the caller no longer held the lock
     */
    boolean ack(JobRecord claimed);

    /**
     * Stores the record, still locked, e.g. to persist a counted attempt before the handler runs.
     *
     * @return false if the caller no longer held the lock; nothing is written then
     */
    boolean update(JobRecord claimed);

    /**
     * Stores the record in the queue of its (possibly new) stage, visible at
     * {@code notBefore}, and releases the lock. Used both for retries and for
     * handing a job on to its next stage.
     *
     * @return false if the caller no longer held the lock; nothing is written then
     */
    boolean release(JobRecord claimed, Instant notBefore);

    /**
     * Moves a claimed job into the awaiting-input set and releases the lock
     *
     * @return false if the caller no longer held the lock; nothing is written then
     */
    boolean park(JobRecord claimed);

    /**
     * Archives a claimed job that reached a terminal state and releases the lock
     *
     * @return false if the caller no longer held the lock; nothing is written then
     */
    boolean complete(JobRecord claimed);

    /**
     * Returns every job whose lock expired before {@code now} to its stage queue.
     * The attempt count is left untouched and the record is flagged as redelivered.
     *
     * @return number of jobs made visible again
     */
    int releaseExpiredLocks(Instant now);

    /**
     * Jobs waiting at a stage, including those not yet due
     */
    long depth(Stage stage);

    long inFlightCount();

    /**
     * Overwrites a parked job's record.
     *
     * @return false if the job is no longer parked
     */
    boolean updateParked(JobRecord job);

    /**
     * Moves a parked job back into its stage queue, ready immediately
     *
     * @return false if the job is no longer parked
     */
    boolean unpark(JobRecord job);

    /**
     * Archives a parked job that reached a terminal state
     *
     * @return false if the job is no longer parked
     */
    boolean archiveParked(JobRecord job);

    /**
     * Parked jobs, oldest first
     */
    List<JobRecord> parked();

    long parkedCount();

    /**
     * Drops the job from every queue, set and lock and deletes its record
     */
    void remove(String jobId);

    Optional<JobRecord> find(String jobId);

    /**
     * Binds a message id to a job id if the message has no active job yet.
     *
     * @return true if the binding was created
     */
    boolean claimMessage(String messageId, String jobId);

    /**
     * Job currently bound to the message, if any
     */
    Optional<String> activeJobForMessage(String messageId);

    /**
     * Removes the message binding if it still points to {@code jobId}
     */
    void releaseMessage(String messageId, String jobId);

    /**
     * Cheap connectivity probe used by health checks
     */
    boolean isAvailable();
}
