package ph.extremelogic.common.core.health.api;

/**
 * Terminal outcome of a job, as written in completion lines.
 */
public enum CompletionStatus {
    SUCCESS("success"),
    VALIDATION_ERROR("validation_error"),
    PANIC("panic"),
    ERROR("error"),
    JUNK("junk");

    private final String text;

    CompletionStatus(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
