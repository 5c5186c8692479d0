package ai.imaginecalendar.voiceworker.model.payload;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Output of intent analysis, optionally enriched with calendar context
 * by the intent_build_context stage.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class IntentAnalyzed extends StagePayload {

    @NonNull
    Transcribed transcription;

    /**
     * Coarse intent label, e.g. "create_event"
     */
    @NonNull
    String intentType;

    /**
     * Calendar context gathered for the intent request (free/busy windows, matched events)
     */
    @Singular("contextEntry")
    Map<String, String> context;

    public boolean hasContext() {
        return context != null && !context.isEmpty();
    }

    @Override
    public VoiceMessageReceived origin() {
        return transcription.origin();
    }
}
