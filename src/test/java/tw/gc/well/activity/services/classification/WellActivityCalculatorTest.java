package tw.gc.well.activity.services.classification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.well.activity.config.ClassificationProperties;
import tw.gc.well.activity.datasource.ProductionReading;
import tw.gc.well.activity.datasource.WellDataSnapshot;
import tw.gc.well.activity.enums.TimelineExtent;
import tw.gc.well.activity.enums.WellMode;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.well.activity.testutil.WellDataTestFactory.*;

@DisplayName("WellActivityCalculator")
class WellActivityCalculatorTest {

    private static WellActivityCalculator calculator(int chunkSize) {
        return new WellActivityCalculator(properties(chunkSize));
    }

    private static List<WellMode> wellModes(ClassificationResult result, String well) {
        return result.wellRows().stream()
            .filter(r -> r.wellName().equals(well))
            .map(WellMonthlyTypeRow::wellType)
            .toList();
    }

    @Nested
    @DisplayName("Well level")
    class WellLevel {

        @Test
        @DisplayName("well W produces through the gap and injects from month 6")
        void wellWScenario() {
            ClassificationResult result = calculator(250).calculate(wellW());

            assertThat(wellModes(result, "W")).containsExactly(
                WellMode.PRODUCTION, WellMode.PRODUCTION, WellMode.PRODUCTION,
                WellMode.PRODUCTION, WellMode.PRODUCTION, WellMode.INJECTION);
            assertThat(result.wellRows()).extracting(WellMonthlyTypeRow::month).containsExactly(1, 2, 3, 4, 5, 6);
            assertThat(result.wellRows().get(3).remarks()).isEqualTo("No reported volumes; carried forward as PRODUCTION.");
            assertThat(result.wellRows().get(5).waterInjRate()).isEqualTo(8.0);
        }

        @Test
        @DisplayName("sums completions into well rates and densifies to the run horizon")
        void sumsCompletionsIntoWells() {
            ClassificationResult result = calculator(250).calculate(twoWellField());

            assertThat(result.wellRows())
                .extracting(r -> r.wellName() + " " + r.year() + "-" + r.month())
                .containsExactly(
                    "A 2023-1", "A 2023-2", "A 2023-3", "A 2023-4",
                    "B 2023-1", "B 2023-2", "B 2023-3", "B 2023-4");
            assertThat(wellModes(result, "A")).containsExactly(
                WellMode.PRODUCTION, WellMode.PRODUCTION, WellMode.INJECTION, WellMode.INJECTION);
            assertThat(wellModes(result, "B")).containsExactly(
                WellMode.PRODUCTION, WellMode.PRODUCTION, WellMode.PRODUCTION, WellMode.INJECTION);

            WellMonthlyTypeRow aFebruary = result.wellRows().get(1);
            assertThat(aFebruary.oilRate()).isEqualTo(12.0);
            assertThat(aFebruary.waterRate()).isEqualTo(1.0);
            assertThat(result.droppedReadings()).isEqualTo(1);
        }

        @Test
        @DisplayName("excluded wells produce no rows")
        void excludedWells() {
            ClassificationResult result = calculator(250).calculate(twoWellField());

            assertThat(result.wellRows()).noneMatch(r -> r.wellName().contains("PLA"));
            assertThat(result.completionRows()).noneMatch(r -> r.completionName().contains("PLA"));
        }

        @Test
        @DisplayName("dual month resolves to the dominant side and keeps the dual flag")
        void dualMonth() {
            WellDataSnapshot snapshot = new WellDataSnapshot(
                List.of(completion("D", "D-1", "R1")),
                List.of(production("D-1", 2023, 1, 155.0, 93.0)),
                List.of(injection("D-1", 2023, 1, 124.0)));

            ClassificationResult result = calculator(250).calculate(snapshot);

            assertThat(result.wellRows()).singleElement().satisfies(row -> {
                assertThat(row.wellType()).isEqualTo(WellMode.PRODUCTION);
                assertThat(row.hasDualFunction()).isTrue();
                assertThat(row.secondaryType()).isEqualTo("INJECTION");
                assertThat(row.remarks()).isEqualTo("Dual function well: Production rate = 8.00 bbl/d, Injection rate = 4.00 bbl/d");
            });
        }

        @Test
        @DisplayName("entity span stops each timeline at its own last observation")
        void entitySpan() {
            ClassificationProperties properties = properties(250);
            properties.setTimelineExtent(TimelineExtent.ENTITY_SPAN);

            ClassificationResult result = new WellActivityCalculator(properties).calculate(twoWellField());

            assertThat(wellModes(result, "A")).hasSize(3);
            assertThat(wellModes(result, "B")).hasSize(4);
            assertThat(result.completionRows()).hasSize(2 + 2 + 4);
        }
    }

    @Nested
    @DisplayName("Completion level")
    class CompletionLevel {

        @Test
        @DisplayName("rows are keyed by well, completion and reservoir in sorted order")
        void completionRows() {
            ClassificationResult result = calculator(250).calculate(twoWellField());

            assertThat(result.completionRows())
                .extracting(r -> r.completionName() + "@" + r.reservoir() + " " + r.month() + " " + r.wellType())
                .containsExactly(
                    "A-1@R1 1 PRODUCTION", "A-1@R1 2 PRODUCTION", "A-1@R1 3 PRODUCTION", "A-1@R1 4 PRODUCTION",
                    "A-2@R2 2 PRODUCTION", "A-2@R2 3 INJECTION", "A-2@R2 4 INJECTION",
                    "B-1@UNKNOWN 1 PRODUCTION", "B-1@UNKNOWN 2 PRODUCTION", "B-1@UNKNOWN 3 PRODUCTION", "B-1@UNKNOWN 4 INJECTION");
        }

        @Test
        @DisplayName("a month is active only when it has its own production or injection")
        void noFalseActivity() {
            ClassificationResult result = calculator(250).calculate(twoWellField());

            assertThat(result.completionRows()).allSatisfy(row ->
                assertThat(row.active()).isEqualTo(row.oilRate() > 0 || row.waterRate() > 0 || row.waterInjRate() > 0));
            assertThat(result.completionRows()).filteredOn(CompletionStatusRow::active).hasSize(6);
        }

        @Test
        @DisplayName("dual well splits into a producing and an injecting completion")
        void dualWellSplitsIntoSingleModeCompletions() {
            WellDataSnapshot snapshot = new WellDataSnapshot(
                List.of(completion("A", "A-1", "R1"), completion("A", "A-2", "R2")),
                List.of(production("A-1", 2023, 1, 310.0, 0.0)),
                List.of(
                    injection("A-2", 2023, 1, 124.0),
                    injection("A-2", 2023, 2, 280.0)));

            ClassificationResult result = calculator(250).calculate(snapshot);

            assertThat(result.wellRows()).hasSize(2);
            WellMonthlyTypeRow january = result.wellRows().get(0);
            assertThat(january.wellType()).isEqualTo(WellMode.PRODUCTION);
            assertThat(january.hasDualFunction()).isTrue();
            assertThat(january.secondaryType()).isEqualTo("INJECTION");
            WellMonthlyTypeRow february = result.wellRows().get(1);
            assertThat(february.wellType()).isEqualTo(WellMode.INJECTION);
            assertThat(february.hasDualFunction()).isFalse();

            assertThat(result.completionRows())
                .extracting(r -> r.completionName() + " " + r.month() + " " + r.wellType() + " " + r.active())
                .containsExactly(
                    "A-1 1 PRODUCTION true", "A-1 2 PRODUCTION false",
                    "A-2 1 INJECTION true", "A-2 2 INJECTION true");
        }

        @Test
        @DisplayName("completions without a reservoir get the configured sentinel")
        void configuredUnknownReservoir() {
            ClassificationProperties properties = properties(250);
            properties.setUnknownReservoir("NO_RESERVOIR");

            ClassificationResult result = new WellActivityCalculator(properties).calculate(twoWellField());

            assertThat(result.completionRows())
                .filteredOn(r -> r.completionName().equals("B-1"))
                .hasSize(4)
                .allSatisfy(r -> assertThat(r.reservoir()).isEqualTo("NO_RESERVOIR"));
        }

        @Test
        @DisplayName("completion rates add up to the well rates")
        void granularityConsistency() {
            ClassificationResult result = calculator(250).calculate(twoWellField());

            for (WellMonthlyTypeRow well : result.wellRows()) {
                List<CompletionStatusRow> parts = result.completionRows().stream()
                    .filter(c -> c.wellName().equals(well.wellName()) && c.year() == well.year() && c.month() == well.month())
                    .toList();
                assertThat(parts.stream().mapToDouble(CompletionStatusRow::oilRate).sum())
                    .as("oil %s %d-%d", well.wellName(), well.year(), well.month())
                    .isCloseTo(well.oilRate(), within(1e-9));
                assertThat(parts.stream().mapToDouble(CompletionStatusRow::waterRate).sum())
                    .isCloseTo(well.waterRate(), within(1e-9));
                assertThat(parts.stream().mapToDouble(CompletionStatusRow::waterInjRate).sum())
                    .isCloseTo(well.waterInjRate(), within(1e-9));
            }
        }
    }

    @Nested
    @DisplayName("Run behaviour")
    class RunBehaviour {

        @Test
        @DisplayName("two runs over the same input give identical output")
        void idempotent() {
            WellActivityCalculator calculator = calculator(250);

            assertThat(calculator.calculate(twoWellField())).isEqualTo(calculator.calculate(twoWellField()));
        }

        @Test
        @DisplayName("chunk size does not change the output")
        void chunkInvariance() {
            ClassificationResult whole = calculator(10_000).calculate(twoWellField());

            assertThat(calculator(1).calculate(twoWellField())).isEqualTo(whole);
            assertThat(calculator(2).calculate(twoWellField())).isEqualTo(whole);
        }

        @Test
        @DisplayName("empty snapshot gives an empty result")
        void emptySnapshot() {
            ClassificationResult result = calculator(250).calculate(new WellDataSnapshot(null, null, null));

            assertThat(result.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("undated readings are dropped, the rest still classified")
        void undatedDropped() {
            WellDataSnapshot snapshot = new WellDataSnapshot(
                List.of(completion("A", "A-1", "R1")),
                List.of(
                    new ProductionReading("A-1", null, 5.0, 0.0),
                    production("A-1", 2023, 1, 31.0, 0.0)),
                List.of());

            ClassificationResult result = calculator(250).calculate(snapshot);

            assertThat(result.wellRows()).hasSize(1);
            assertThat(result.droppedReadings()).isEqualTo(1);
        }

        @Test
        @DisplayName("reports chunk-proportional progress up to 100")
        void reportsProgress() {
            List<Integer> percents = new ArrayList<>();
            RunMonitor monitor = new RunMonitor() {
                @Override
                public boolean isCancelled() {
                    return false;
                }

                @Override
                public void onProgress(int percent, String statusText) {
                    percents.add(percent);
                }
            };

            calculator(2).calculate(twoWellField(), monitor);

            // 2 wells in one chunk, 3 completions in two
            assertThat(percents).containsExactly(33, 66, 100);
        }

        @Test
        @DisplayName("stops at the next chunk boundary once cancelled")
        void cancelledBetweenChunks() {
            AtomicInteger chunksDone = new AtomicInteger();
            RunMonitor monitor = new RunMonitor() {
                @Override
                public boolean isCancelled() {
                    return chunksDone.get() > 0;
                }

                @Override
                public void onProgress(int percent, String statusText) {
                    chunksDone.incrementAndGet();
                }
            };

            assertThatThrownBy(() -> calculator(1).calculate(twoWellField(), monitor))
                .isInstanceOf(ClassificationCancelledException.class);
            assertThat(chunksDone).hasValue(1);
        }
    }
}
