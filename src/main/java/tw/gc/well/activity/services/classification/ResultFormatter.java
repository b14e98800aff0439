package tw.gc.well.activity.services.classification;

import tw.gc.well.activity.AppConstants;
import tw.gc.well.activity.enums.WellMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shapes classified months into output rows and writes their remarks.
 */
public final class ResultFormatter {

    public List<WellMonthlyTypeRow> toWellRows(List<ClassifiedMonth<String>> months) {
        List<WellMonthlyTypeRow> rows = new ArrayList<>(months.size());
        for (ClassifiedMonth<String> month : months) {
            rows.add(new WellMonthlyTypeRow(
                    month.entity(),
                    month.period().getYear(),
                    month.period().getMonthValue(),
                    month.mode(),
                    month.oilRate(),
                    month.waterRate(),
                    month.waterInjRate(),
                    month.hasDualFunction(),
                    remarks(month)));
        }
        return rows;
    }

    public List<CompletionStatusRow> toCompletionRows(List<ClassifiedMonth<CompletionKey>> months) {
        List<CompletionStatusRow> rows = new ArrayList<>(months.size());
        for (ClassifiedMonth<CompletionKey> month : months) {
            CompletionKey key = month.entity();
            rows.add(new CompletionStatusRow(
                    key.wellName(),
                    key.completionName(),
                    key.reservoir(),
                    month.period().getYear(),
                    month.period().getMonthValue(),
                    month.active(),
                    month.mode(),
                    month.oilRate(),
                    month.waterRate(),
                    month.waterInjRate()));
        }
        return rows;
    }

    public String remarks(ClassifiedMonth<?> month) {
        if (month.hasDualFunction()) {
            return String.format(Locale.ROOT,
                    "Dual function well: Production rate = %s %s, Injection rate = %s %s",
                    rate(month.productionRate()), AppConstants.RATE_UNIT,
                    rate(month.waterInjRate()), AppConstants.RATE_UNIT);
        }
        if (month.carried()) {
            if (month.mode() == WellMode.UNKNOWN) {
                return "";
            }
            return "No reported volumes; carried forward as " + month.mode().name() + ".";
        }
        if (month.mode() == WellMode.PRODUCTION) {
            return String.format(Locale.ROOT, "Producing well. Oil rate: %s %s, Water rate: %s %s.",
                    rate(month.oilRate()), AppConstants.RATE_UNIT,
                    rate(month.waterRate()), AppConstants.RATE_UNIT);
        }
        if (month.mode() == WellMode.INJECTION) {
            return String.format(Locale.ROOT, "Injection well. Injection rate: %s %s.",
                    rate(month.waterInjRate()), AppConstants.RATE_UNIT);
        }
        return "";
    }

    private static String rate(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
