package tw.gc.well.activity.enums;

/**
 * State of a background classification job.
 * QUEUED → RUNNING → SUCCEEDED | FAILED | CANCELLED
 */
public enum JobState {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
