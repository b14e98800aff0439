package tw.gc.well.activity.services.classification;

import lombok.extern.slf4j.Slf4j;
import tw.gc.well.activity.datasource.InjectionReading;
import tw.gc.well.activity.datasource.ProductionReading;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Turns monthly volumes into calendar-day rates per (entity, year, month).
 *
 * <p>Volumes of every reading that falls in the same entity and month are summed,
 * then divided by the number of days in that month. Readings whose completion does
 * not resolve to an entity are left out. Pure: no state survives a call.
 */
@Slf4j
public final class RateAggregator {

    private static final int OIL = 0;
    private static final int WATER = 1;
    private static final int INJECTION = 2;

    /**
     * @param production  validated production readings
     * @param injection   validated injection readings
     * @param keyResolver completion name → entity key, empty for unmapped completions
     */
    public <K extends Comparable<? super K>> AggregatedRates<K> aggregate(
            List<ProductionReading> production,
            List<InjectionReading> injection,
            Function<String, Optional<K>> keyResolver) {

        Map<K, Map<YearMonth, double[]>> volumes = new TreeMap<>();
        int unmapped = 0;

        for (ProductionReading reading : production) {
            double[] slot = slot(volumes, keyResolver, reading.completionName(), reading.date());
            if (slot == null) {
                unmapped++;
                continue;
            }
            slot[OIL] += orZero(reading.oilVolume());
            slot[WATER] += orZero(reading.waterVolume());
        }

        for (InjectionReading reading : injection) {
            double[] slot = slot(volumes, keyResolver, reading.completionName(), reading.date());
            if (slot == null) {
                unmapped++;
                continue;
            }
            slot[INJECTION] += orZero(reading.waterInjVolume());
        }

        List<MonthlyRate<K>> rates = new ArrayList<>();
        volumes.forEach((entity, months) -> months.forEach((period, sums) -> {
            int days = period.lengthOfMonth();
            rates.add(new MonthlyRate<>(entity, period,
                    sums[OIL] / days, sums[WATER] / days, sums[INJECTION] / days));
        }));

        if (unmapped > 0) {
            log.debug("Skipped {} readings with no known well/completion", unmapped);
        }
        return new AggregatedRates<>(List.copyOf(rates), unmapped);
    }

    private static <K> double[] slot(Map<K, Map<YearMonth, double[]>> volumes,
                                     Function<String, Optional<K>> keyResolver,
                                     String completionName,
                                     LocalDate date) {
        if (date == null) {
            return null;
        }
        Optional<K> key = keyResolver.apply(completionName);
        if (key.isEmpty()) {
            return null;
        }
        return volumes
                .computeIfAbsent(key.get(), k -> new TreeMap<>())
                .computeIfAbsent(YearMonth.from(date), p -> new double[3]);
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
