package tw.gc.well.activity.services.classification;

import tw.gc.well.activity.enums.WellMode;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Month-by-month state machine over one entity's densified timeline.
 *
 * <p>The walk starts from the entity's history seed. A month with production and/or
 * injection sets the mode and becomes the carried state; a month without either
 * inherits the carried state and leaves it unchanged. DUAL months are settled
 * afterwards by {@link #resolveDual(ClassifiedMonth)} so that the carried state
 * seen by later gap months is the raw DUAL, not its resolution.
 */
public final class TemporalClassifier {

    private final WellMode ambiguousHistorySeed;

    public TemporalClassifier(WellMode ambiguousHistorySeed) {
        if (ambiguousHistorySeed != WellMode.PRODUCTION && ambiguousHistorySeed != WellMode.INJECTION) {
            throw new IllegalArgumentException("Ambiguous history seed must be PRODUCTION or INJECTION, got " + ambiguousHistorySeed);
        }
        this.ambiguousHistorySeed = ambiguousHistorySeed;
    }

    /**
     * Walk plus DUAL resolution. Output months never carry {@link WellMode#DUAL}.
     */
    public <K> List<ClassifiedMonth<K>> classify(K entity,
                                                 List<YearMonth> timeline,
                                                 Map<YearMonth, MonthlyRate<K>> ratesByMonth,
                                                 PresenceHistory history) {
        List<ClassifiedMonth<K>> walked = walk(entity, timeline, ratesByMonth, history);
        List<ClassifiedMonth<K>> resolved = new ArrayList<>(walked.size());
        for (ClassifiedMonth<K> month : walked) {
            resolved.add(resolveDual(month));
        }
        return resolved;
    }

    /**
     * Raw walk; DUAL months are left unresolved.
     *
     * @param timeline     consecutive months in ascending order
     * @param ratesByMonth observed rates, absent for gap months
     */
    public <K> List<ClassifiedMonth<K>> walk(K entity,
                                             List<YearMonth> timeline,
                                             Map<YearMonth, MonthlyRate<K>> ratesByMonth,
                                             PresenceHistory history) {
        PresenceHistory presence = history == null ? PresenceHistory.NONE : history;
        WellMode carried = presence.seedMode(ambiguousHistorySeed);
        List<ClassifiedMonth<K>> months = new ArrayList<>(timeline.size());

        for (YearMonth period : timeline) {
            MonthlyRate<K> rate = ratesByMonth.get(period);
            if (rate == null) {
                rate = MonthlyRate.empty(entity, period);
            }
            WellMode observed = WellMode.fromEvidence(rate.hasProduction(), rate.hasInjection());

            WellMode mode;
            if (observed != null) {
                carried = observed;
                mode = observed;
            } else {
                mode = carried;
            }

            months.add(new ClassifiedMonth<>(entity, period, mode,
                    rate.oilRate(), rate.waterRate(), rate.waterInjRate(),
                    observed != null,
                    observed == null,
                    observed == WellMode.DUAL));
        }
        return months;
    }

    /**
     * Replace DUAL by the dominant side. Ties go to production.
     */
    public static <K> ClassifiedMonth<K> resolveDual(ClassifiedMonth<K> month) {
        if (month.mode() != WellMode.DUAL) {
            return month;
        }
        return month.withMode(dominantMode(month.productionRate(), month.waterInjRate()));
    }

    public static WellMode dominantMode(double productionRate, double injectionRate) {
        return productionRate >= injectionRate ? WellMode.PRODUCTION : WellMode.INJECTION;
    }

    /**
     * Every month from {@code first} to {@code last}, both inclusive.
     */
    public static List<YearMonth> monthsBetween(YearMonth first, YearMonth last) {
        List<YearMonth> months = new ArrayList<>();
        for (YearMonth m = first; !m.isAfter(last); m = m.plusMonths(1)) {
            months.add(m);
        }
        return months;
    }
}
