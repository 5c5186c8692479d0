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
public class NotificationDelivered extends StagePayload {

    @NonNull
    EventApplied event;

    String notificationId;

    @Override
    public VoiceMessageReceived origin() {
        return event.origin();
    }
}
