package tw.gc.well.activity.services.classification;

import lombok.extern.slf4j.Slf4j;
import tw.gc.well.activity.datasource.InjectionReading;
import tw.gc.well.activity.datasource.ProductionReading;
import tw.gc.well.activity.enums.InputField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies {@link InputField} defaults to raw readings.
 *
 * <p>Missing or negative volumes become the field default and are counted; readings
 * without a date cannot be placed in a month and are dropped. Counts are logged once
 * per run, not per row.
 */
@Slf4j
public final class ReadingValidator {

    public ValidatedReadings validate(List<ProductionReading> production, List<InjectionReading> injection) {
        Map<InputField, Integer> defaulted = new EnumMap<>(InputField.class);
        int dropped = 0;

        List<ProductionReading> validProduction = new ArrayList<>(production.size());
        for (ProductionReading reading : production) {
            if (reading == null || reading.date() == null) {
                dropped++;
                continue;
            }
            validProduction.add(new ProductionReading(
                    reading.completionName(),
                    reading.date(),
                    volume(reading.oilVolume(), InputField.OIL_VOLUME, defaulted),
                    volume(reading.waterVolume(), InputField.WATER_VOLUME, defaulted)));
        }

        List<InjectionReading> validInjection = new ArrayList<>(injection.size());
        for (InjectionReading reading : injection) {
            if (reading == null || reading.date() == null) {
                dropped++;
                continue;
            }
            validInjection.add(new InjectionReading(
                    reading.completionName(),
                    reading.date(),
                    volume(reading.waterInjVolume(), InputField.WATER_INJ_VOLUME, defaulted)));
        }

        if (dropped > 0) {
            log.warn("⚠️ Dropped {} readings without a {}", dropped, InputField.READING_DATE);
        }
        defaulted.forEach((field, count) ->
                log.warn("⚠️ Defaulted {} on {} readings to {}", field, count, field.defaultVolume()));

        return new ValidatedReadings(
                Collections.unmodifiableList(validProduction),
                Collections.unmodifiableList(validInjection),
                dropped,
                Collections.unmodifiableMap(defaulted));
    }

    private static double volume(Double value, InputField field, Map<InputField, Integer> defaulted) {
        if (value == null || value.isNaN() || value < 0) {
            defaulted.merge(field, 1, Integer::sum);
            return field.defaultVolume();
        }
        return value;
    }
}
