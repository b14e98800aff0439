package tw.gc.well.activity.services.classification;

import tw.gc.well.activity.datasource.InjectionReading;
import tw.gc.well.activity.datasource.ProductionReading;
import tw.gc.well.activity.enums.InputField;

import java.util.List;
import java.util.Map;

/**
 * Readings after defaults have been applied. Every volume is non-null and non-negative,
 * every date is present.
 */
public record ValidatedReadings(
        List<ProductionReading> production,
        List<InjectionReading> injection,
        int droppedReadings,
        Map<InputField, Integer> defaultedFields
) {
}
