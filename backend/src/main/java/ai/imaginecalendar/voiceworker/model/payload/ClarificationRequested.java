package ai.imaginecalendar.voiceworker.model.payload;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * The intent could not be resolved without asking the user
 */
@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class ClarificationRequested extends StagePayload {

    @NonNull
    IntentAnalyzed analysis;

    @NonNull
    String question;

    @Singular
    List<String> pendingFields;

    /**
     * Replies collected in earlier round trips for the same message
     */
    @Singular
    List<String> previousReplies;

    @Override
    public VoiceMessageReceived origin() {
        return analysis.origin();
    }
}
