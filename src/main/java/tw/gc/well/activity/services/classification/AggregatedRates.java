package tw.gc.well.activity.services.classification;

import java.util.List;

/**
 * Output of one {@link RateAggregator} pass, sorted by entity then month.
 */
public record AggregatedRates<K>(List<MonthlyRate<K>> rates, int unmappedReadings) {
}
