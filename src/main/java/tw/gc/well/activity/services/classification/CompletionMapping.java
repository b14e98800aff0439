package tw.gc.well.activity.services.classification;

import lombok.extern.slf4j.Slf4j;
import tw.gc.well.activity.datasource.CompletionRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable completion → well and completion → reservoir lookups for one run.
 *
 * <p>Built once from the data source's completion records. Wells or completions
 * matching an excluded pattern never enter the maps, so readings against them
 * resolve to nothing and are dropped by the {@link RateAggregator}.
 */
@Slf4j
public final class CompletionMapping {

    private final Map<String, String> completionToWell;
    private final Map<String, String> completionToReservoir;
    private final String unknownReservoir;

    private CompletionMapping(Map<String, String> completionToWell,
                              Map<String, String> completionToReservoir,
                              String unknownReservoir) {
        this.completionToWell = Collections.unmodifiableMap(completionToWell);
        this.completionToReservoir = Collections.unmodifiableMap(completionToReservoir);
        this.unknownReservoir = unknownReservoir;
    }

    public static CompletionMapping build(List<CompletionRecord> records,
                                          List<String> excludedPatterns,
                                          String unknownReservoir) {
        List<String> patterns = excludedPatterns == null ? List.of() : excludedPatterns;
        Map<String, String> toWell = new HashMap<>();
        Map<String, String> toReservoir = new HashMap<>();
        int excluded = 0;

        for (CompletionRecord record : records) {
            String well = record.wellName();
            String completion = record.completionName();
            if (isBlank(well) || isBlank(completion)) {
                continue;
            }
            if (matchesAny(well, patterns) || matchesAny(completion, patterns)) {
                excluded++;
                continue;
            }
            String previous = toWell.putIfAbsent(completion, well);
            if (previous != null && !previous.equals(well)) {
                log.warn("⚠️ Completion {} listed under wells {} and {}; keeping {}", completion, previous, well, previous);
                continue;
            }
            if (!isBlank(record.reservoir())) {
                toReservoir.putIfAbsent(completion, record.reservoir());
            }
        }

        if (excluded > 0) {
            log.info("Excluded {} completion records matching {}", excluded, patterns);
        }
        return new CompletionMapping(toWell, toReservoir, unknownReservoir);
    }

    public Optional<String> wellOf(String completionName) {
        if (completionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(completionToWell.get(completionName));
    }

    public String reservoirOf(String completionName) {
        return completionToReservoir.getOrDefault(completionName, unknownReservoir);
    }

    public Optional<CompletionKey> completionKeyOf(String completionName) {
        return wellOf(completionName)
                .map(well -> new CompletionKey(well, completionName, reservoirOf(completionName)));
    }

    public Set<String> wells() {
        return Collections.unmodifiableSet(new TreeSet<>(completionToWell.values()));
    }

    public int completionCount() {
        return completionToWell.size();
    }

    private static boolean matchesAny(String name, List<String> patterns) {
        for (String pattern : patterns) {
            if (!isBlank(pattern) && name.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
