package ai.imaginecalendar.voiceworker.model;

import lombok.Builder;
import lombok.Value;

/**
 * Operator query over the dead letter queue; null fields match everything
 */
@Value
@Builder
public class DeadLetterFilter {

    public static final int DEFAULT_LIMIT = 50;

    Stage stage;

    ErrorCategory errorCategory;

    String messageId;

    @Builder.Default
    int limit = DEFAULT_LIMIT;

    public static DeadLetterFilter all() {
        return DeadLetterFilter.builder().build();
    }

    public boolean matches(DeadLetterEntry entry) {
        if (stage != null && entry.getJob().getStage() != stage) {
            return false;
        }
        if (errorCategory != null && entry.getErrorCategory() != errorCategory) {
            return false;
        }
        return messageId == null || messageId.equals(entry.getJob().getMessageId());
    }
}
