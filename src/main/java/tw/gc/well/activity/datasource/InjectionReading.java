package tw.gc.well.activity.datasource;

import java.time.LocalDate;

/**
 * Cumulative monthly injected water volume reported for one completion.
 */
public record InjectionReading(String completionName, LocalDate date, Double waterInjVolume) {
}
