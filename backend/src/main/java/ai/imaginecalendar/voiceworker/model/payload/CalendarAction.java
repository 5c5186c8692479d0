package ai.imaginecalendar.voiceworker.model.payload;

import ai.imaginecalendar.voiceworker.model.Stage;

/**
 * Calendar mutation requested by a resolved intent
 */
public enum CalendarAction {
    CREATE(Stage.EVENT_CREATE),
    UPDATE(Stage.EVENT_UPDATE),
    DELETE(Stage.EVENT_DELETE);

    private final Stage stage;

    CalendarAction(Stage stage) {
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
