package io.slot4j.core;

/**
 * A produce or publish attempt failed. Carries the external service's error text.
 */
public class StageExecutionException extends Slot4jException {

    public enum Stage {
        PRODUCE,
        PUBLISH
    }

    private final Stage stage;

    public StageExecutionException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageExecutionException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage stage() {
        return stage;
    }
}
