package ai.imaginecalendar.voiceworker.model.payload;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class EventApplied extends StagePayload {

    @NonNull
    IntentResolved intent;

    /**
     * Provider id of the created, updated or deleted event
     */
    String eventId;

    public CalendarAction action() {
        return intent.getAction();
    }

    @Override
    public VoiceMessageReceived origin() {
        return intent.origin();
    }
}
