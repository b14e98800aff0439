package tw.gc.well.activity.datasource;

import java.util.List;

/**
 * Read-only access to the relational store holding wells, completions and volumes.
 */
public interface WellDataSource {

    List<CompletionRecord> loadCompletions();

    List<ProductionReading> loadProductionReadings();

    List<InjectionReading> loadInjectionReadings();

    default WellDataSnapshot loadSnapshot() {
        return new WellDataSnapshot(loadCompletions(), loadProductionReadings(), loadInjectionReadings());
    }
}
