package ai.imaginecalendar.voiceworker.service.handler;

import ai.imaginecalendar.voiceworker.model.Stage;
import ai.imaginecalendar.voiceworker.service.exception.PermanentStageException;
import ai.imaginecalendar.voiceworker.support.PipelineFixtures;
import ai.imaginecalendar.voiceworker.support.ScriptedHandler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StageHandlerRegistryTest {

    @Test
    void resolve_RegisteredStage_ShouldReturnHandler() {
        WebhookReceivedHandler webhook = new WebhookReceivedHandler();
        StageHandlerRegistry registry = new StageHandlerRegistry(List.of(webhook));

        assertThat(registry.resolve(Stage.WEBHOOK_RECEIVED)).isSameAs(webhook);
        assertThat(registry.registeredStages()).containsExactly(Stage.WEBHOOK_RECEIVED);
    }

    @Test
    void resolve_MissingStage_ShouldThrowPermanent() {
        StageHandlerRegistry registry = new StageHandlerRegistry(List.of());

        assertThatThrownBy(() -> registry.resolve(Stage.EVENT_DELETE))
                .isInstanceOf(PermanentStageException.class)
                .hasMessageContaining("event_delete");
    }

    @Test
    void constructor_DuplicateHandlers_ShouldFail() {
        List<StageHandler> handlers = List.of(
                ScriptedHandler.producing(Stage.TRANSCRIPTION, PipelineFixtures.transcript()),
                ScriptedHandler.producing(Stage.TRANSCRIPTION, PipelineFixtures.transcript()));

        assertThatThrownBy(() -> new StageHandlerRegistry(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate handlers for stage transcription");
    }
}
