package tw.gc.well.activity.services.classification;

import java.util.List;

/**
 * Both granularities of one classification run, each sorted by entity key then month.
 */
public record ClassificationResult(
        List<WellMonthlyTypeRow> wellRows,
        List<CompletionStatusRow> completionRows,
        int droppedReadings
) {

    public static ClassificationResult empty(int droppedReadings) {
        return new ClassificationResult(List.of(), List.of(), droppedReadings);
    }

    public ClassificationResult {
        wellRows = wellRows == null ? List.of() : List.copyOf(wellRows);
        completionRows = completionRows == null ? List.of() : List.copyOf(completionRows);
    }

    public boolean isEmpty() {
        return wellRows.isEmpty() && completionRows.isEmpty();
    }
}
