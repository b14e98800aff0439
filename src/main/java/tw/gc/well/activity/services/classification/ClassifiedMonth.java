package tw.gc.well.activity.services.classification;

import tw.gc.well.activity.enums.WellMode;

import java.time.YearMonth;

/**
 * One month of an entity's densified timeline after the month walk.
 *
 * @param active          the month itself has reported data
 * @param carried         the mode was carried forward from an earlier month (or the history seed)
 * @param hasDualFunction the month was observed producing and injecting
 */
public record ClassifiedMonth<K>(
        K entity,
        YearMonth period,
        WellMode mode,
        double oilRate,
        double waterRate,
        double waterInjRate,
        boolean active,
        boolean carried,
        boolean hasDualFunction
) {

    public double productionRate() {
        return oilRate + waterRate;
    }

    public ClassifiedMonth<K> withMode(WellMode newMode) {
        return new ClassifiedMonth<>(entity, period, newMode, oilRate, waterRate, waterInjRate,
                active, carried, hasDualFunction);
    }
}
