package ai.imaginecalendar.voiceworker.service.interfaces;

import ai.imaginecalendar.voiceworker.model.JobRecord;

/**
 * Outbound channel to the user for the clarification round trip.
 * Supplied by the messaging integration.
 */
public interface ClarificationNotifier {

    /**
     * Sends the clarification question carried by the job's payload
     */
    void sendQuestion(JobRecord job);

    void sendReminder(JobRecord job);

    /**
     * Tells the user the request was dropped because no reply arrived
     */
    void sendTimeout(JobRecord job);
}
