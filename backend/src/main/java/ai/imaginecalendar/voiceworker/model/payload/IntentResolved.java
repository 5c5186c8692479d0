package ai.imaginecalendar.voiceworker.model.payload;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class IntentResolved extends StagePayload {

    @NonNull
    IntentAnalyzed analysis;

    @NonNull
    CalendarAction action;

    /**
     * Target event for UPDATE and DELETE
     */
    String eventId;

    /**
     * Event fields (title, start, end, attendees...) as produced by the language model
     */
    @Singular
    Map<String, String> details;

    @Override
    public VoiceMessageReceived origin() {
        return analysis.origin();
    }
}
