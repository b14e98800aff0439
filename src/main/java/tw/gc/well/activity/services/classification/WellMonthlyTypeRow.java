package tw.gc.well.activity.services.classification;

import tw.gc.well.activity.enums.WellMode;

/**
 * Coarse result: one well in one month.
 */
public record WellMonthlyTypeRow(
        String wellName,
        int year,
        int month,
        WellMode wellType,
        double oilRate,
        double waterRate,
        double waterInjRate,
        boolean hasDualFunction,
        String remarks
) {

    public static final String NO_SECONDARY_TYPE = "NONE";

    public WellMonthlyTypeRow {
        wellName = wellName == null ? "" : wellName;
        wellType = wellType == null ? WellMode.UNKNOWN : wellType;
        oilRate = finiteOrZero(oilRate);
        waterRate = finiteOrZero(waterRate);
        waterInjRate = finiteOrZero(waterInjRate);
        remarks = remarks == null ? "" : remarks;
    }

    /**
     * The side that lost the dominance contest in a dual month.
     */
    public String secondaryType() {
        if (!hasDualFunction) {
            return NO_SECONDARY_TYPE;
        }
        if (wellType == WellMode.PRODUCTION) {
            return WellMode.INJECTION.name();
        }
        if (wellType == WellMode.INJECTION) {
            return WellMode.PRODUCTION.name();
        }
        return NO_SECONDARY_TYPE;
    }

    static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
