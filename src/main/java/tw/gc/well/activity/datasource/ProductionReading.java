package tw.gc.well.activity.datasource;

import java.time.LocalDate;

/**
 * Cumulative monthly production volumes reported for one completion.
 * Volumes are nullable; absent values are defaulted before aggregation.
 */
public record ProductionReading(String completionName, LocalDate date, Double oilVolume, Double waterVolume) {
}
