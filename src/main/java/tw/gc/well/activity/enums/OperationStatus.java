package tw.gc.well.activity.enums;

/**
 * Lifecycle of a persisted classification operation.
 * RUNNING only inside the writing transaction; committed operations are COMPLETED.
 */
public enum OperationStatus {
    RUNNING,
    COMPLETED
}
