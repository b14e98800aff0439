package tw.gc.well.activity.services.classification;

import tw.gc.well.activity.enums.WellMode;

/**
 * Fine result: one completion of one well in one reservoir in one month.
 *
 * @param reservoir already resolved by {@link CompletionMapping}, including the unknown-reservoir sentinel
 */
public record CompletionStatusRow(
        String wellName,
        String completionName,
        String reservoir,
        int year,
        int month,
        boolean active,
        WellMode wellType,
        double oilRate,
        double waterRate,
        double waterInjRate
) {

    public CompletionStatusRow {
        wellName = wellName == null ? "" : wellName;
        completionName = completionName == null ? "" : completionName;
        if (reservoir == null || reservoir.isBlank()) {
            throw new IllegalArgumentException("Completion " + completionName + " of " + wellName + " has no reservoir");
        }
        wellType = wellType == null ? WellMode.UNKNOWN : wellType;
        oilRate = WellMonthlyTypeRow.finiteOrZero(oilRate);
        waterRate = WellMonthlyTypeRow.finiteOrZero(waterRate);
        waterInjRate = WellMonthlyTypeRow.finiteOrZero(waterInjRate);
    }
}
