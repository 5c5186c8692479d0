package ai.imaginecalendar.voiceworker.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ClarificationReplyRequest {

    @NotBlank
    private String reply;
}
