package tw.gc.well.activity.datasource;

/**
 * One row of the well → completion → reservoir lookup.
 * Reservoir may be null when the completion has no assignment.
 */
public record CompletionRecord(String wellName, String completionName, String reservoir) {
}
