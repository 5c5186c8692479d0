package ai.imaginecalendar.voiceworker.service.queue;

import ai.imaginecalendar.voiceworker.model.DeadLetterEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for dead letter entries, keyed by entry id
 */
public interface DeadLetterStore {

    /**
     * Stores the entry unless one with the same id exists.
     *
     * @return true if the entry was written
     */
    boolean putIfAbsent(DeadLetterEntry entry);

    Optional<DeadLetterEntry> get(String entryId);

    /**
     * All entries, newest failure first
     */
    List<DeadLetterEntry> listNewestFirst();

    boolean delete(String entryId);

    /**
     * Ids of entries that failed before {@code cutoff}
     */
    List<String> idsFailedBefore(Instant cutoff);

    long size();
}
