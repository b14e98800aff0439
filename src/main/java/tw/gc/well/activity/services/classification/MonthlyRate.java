package tw.gc.well.activity.services.classification;

import java.time.YearMonth;

/**
 * Calendar-day rates of one entity in one month (volume / days in month).
 *
 * @param <K> entity key: well name or {@link CompletionKey}
 */
public record MonthlyRate<K>(K entity, YearMonth period, double oilRate, double waterRate, double waterInjRate) {

    public static <K> MonthlyRate<K> empty(K entity, YearMonth period) {
        return new MonthlyRate<>(entity, period, 0.0, 0.0, 0.0);
    }

    public boolean hasProduction() {
        return oilRate > 0 || waterRate > 0;
    }

    public boolean hasInjection() {
        return waterInjRate > 0;
    }

    public double productionRate() {
        return oilRate + waterRate;
    }
}
