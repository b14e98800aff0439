package tw.gc.well.activity.services;

import lombok.Builder;
import tw.gc.well.activity.enums.JobState;

/**
 * Snapshot of a background classification job. Immutable; every update produces a new one.
 *
 * @param percent overall progress: 0-10 loading, 10-80 classification, 80-100 persistence
 */
@Builder(toBuilder = true)
public record JobProgress(
        String jobId,
        String operationName,
        JobState state,
        int percent,
        String statusText,
        Long operationId,
        int wellRowCount,
        int completionRowCount,
        String errorMessage
) {

    public static JobProgress queued(String jobId, String operationName) {
        return JobProgress.builder()
                .jobId(jobId)
                .operationName(operationName)
                .state(JobState.QUEUED)
                .statusText("Queued")
                .build();
    }
}
