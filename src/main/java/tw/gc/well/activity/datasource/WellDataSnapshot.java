package tw.gc.well.activity.datasource;

import java.util.List;

/**
 * Everything one classification run reads, captured once up front.
 */
public record WellDataSnapshot(
        List<CompletionRecord> completions,
        List<ProductionReading> production,
        List<InjectionReading> injection
) {
    public WellDataSnapshot {
        completions = completions == null ? List.of() : List.copyOf(completions);
        production = production == null ? List.of() : List.copyOf(production);
        injection = injection == null ? List.of() : List.copyOf(injection);
    }

    public boolean isEmpty() {
        return production.isEmpty() && injection.isEmpty();
    }
}
