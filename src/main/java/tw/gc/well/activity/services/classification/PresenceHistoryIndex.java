package tw.gc.well.activity.services.classification;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the per-entity {@link PresenceHistory} lookup consulted when a walk starts.
 */
public final class PresenceHistoryIndex {

    public <K> Map<K, PresenceHistory> build(List<MonthlyRate<K>> rates) {
        Map<K, double[]> totals = new HashMap<>();
        for (MonthlyRate<K> rate : rates) {
            double[] sums = totals.computeIfAbsent(rate.entity(), k -> new double[2]);
            sums[0] += rate.productionRate();
            sums[1] += rate.waterInjRate();
        }

        Map<K, PresenceHistory> index = new HashMap<>(totals.size() * 2);
        totals.forEach((entity, sums) -> index.put(entity, new PresenceHistory(sums[0] > 0, sums[1] > 0)));
        return Collections.unmodifiableMap(index);
    }
}
