package ai.imaginecalendar.voiceworker.model.payload;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder
@Jacksonized
@EqualsAndHashCode(callSuper = false)
public class ClarificationAnswered extends StagePayload {

    @NonNull
    ClarificationRequested request;

    @NonNull
    String reply;

    public IntentAnalyzed analysis() {
        return request.getAnalysis();
    }

    /**
     * All replies for this message so far, oldest first
     */
    public List<String> allReplies() {
        List<String> replies = new ArrayList<>(request.getPreviousReplies());
        replies.add(reply);
        return replies;
    }

    @Override
    public VoiceMessageReceived origin() {
        return request.origin();
    }
}
