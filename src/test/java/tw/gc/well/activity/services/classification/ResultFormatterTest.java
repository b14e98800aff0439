package tw.gc.well.activity.services.classification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.well.activity.enums.WellMode;

import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResultFormatter")
class ResultFormatterTest {

    private static final YearMonth MARCH = YearMonth.of(2023, 3);

    private final ResultFormatter formatter = new ResultFormatter();

    private static ClassifiedMonth<String> month(WellMode mode, double oil, double water, double inj,
                                                 boolean carried, boolean dual) {
        return new ClassifiedMonth<>("A", MARCH, mode, oil, water, inj, !carried, carried, dual);
    }

    @Nested
    @DisplayName("Remarks")
    class Remarks {

        @Test
        void dualMonth() {
            assertThat(formatter.remarks(month(WellMode.PRODUCTION, 5, 3, 4, false, true)))
                .isEqualTo("Dual function well: Production rate = 8.00 bbl/d, Injection rate = 4.00 bbl/d");
        }

        @Test
        void producingMonth() {
            assertThat(formatter.remarks(month(WellMode.PRODUCTION, 12.5, 1, 0, false, false)))
                .isEqualTo("Producing well. Oil rate: 12.50 bbl/d, Water rate: 1.00 bbl/d.");
        }

        @Test
        void injectingMonth() {
            assertThat(formatter.remarks(month(WellMode.INJECTION, 0, 0, 20, false, false)))
                .isEqualTo("Injection well. Injection rate: 20.00 bbl/d.");
        }

        @Test
        void carriedMonth() {
            assertThat(formatter.remarks(month(WellMode.INJECTION, 0, 0, 0, true, false)))
                .isEqualTo("No reported volumes; carried forward as INJECTION.");
        }

        @Test
        void unknownMonthIsBlank() {
            assertThat(formatter.remarks(month(WellMode.UNKNOWN, 0, 0, 0, true, false))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Rows")
    class Rows {

        @Test
        @DisplayName("well rows carry period, mode, rates, dual flag and remarks")
        void wellRows() {
            List<WellMonthlyTypeRow> rows = formatter.toWellRows(List.of(month(WellMode.INJECTION, 1, 0, 10, false, true)));

            assertThat(rows).singleElement().satisfies(row -> {
                assertThat(row.wellName()).isEqualTo("A");
                assertThat(row.year()).isEqualTo(2023);
                assertThat(row.month()).isEqualTo(3);
                assertThat(row.wellType()).isEqualTo(WellMode.INJECTION);
                assertThat(row.hasDualFunction()).isTrue();
                assertThat(row.secondaryType()).isEqualTo("PRODUCTION");
                assertThat(row.remarks()).startsWith("Dual function well");
            });
        }

        @Test
        @DisplayName("completion rows carry key and activity flag")
        void completionRows() {
            ClassifiedMonth<CompletionKey> month = new ClassifiedMonth<>(
                new CompletionKey("A", "A-1", "R1"), MARCH, WellMode.PRODUCTION, 0, 0, 0, false, true, false);

            List<CompletionStatusRow> rows = formatter.toCompletionRows(List.of(month));

            assertThat(rows).containsExactly(
                new CompletionStatusRow("A", "A-1", "R1", 2023, 3, false, WellMode.PRODUCTION, 0, 0, 0));
        }

        @Test
        @DisplayName("secondary type is NONE outside dual months")
        void secondaryType() {
            assertThat(new WellMonthlyTypeRow("A", 2023, 1, WellMode.PRODUCTION, 5, 3, 4, true, "").secondaryType())
                .isEqualTo("INJECTION");
            assertThat(new WellMonthlyTypeRow("A", 2023, 1, WellMode.PRODUCTION, 5, 0, 0, false, "").secondaryType())
                .isEqualTo("NONE");
        }

        @Test
        @DisplayName("backfills missing values with type defaults")
        void backfillsDefaults() {
            WellMonthlyTypeRow well = new WellMonthlyTypeRow(null, 2023, 1, null, Double.NaN, 1, Double.POSITIVE_INFINITY, false, null);
            CompletionStatusRow completion = new CompletionStatusRow("A", null, "R1", 2023, 1, false, null, Double.NaN, 0, 0);

            assertThat(well.wellName()).isEmpty();
            assertThat(well.wellType()).isEqualTo(WellMode.UNKNOWN);
            assertThat(well.oilRate()).isZero();
            assertThat(well.waterInjRate()).isZero();
            assertThat(well.remarks()).isEmpty();
            assertThat(completion.completionName()).isEmpty();
            assertThat(completion.wellType()).isEqualTo(WellMode.UNKNOWN);
            assertThat(completion.oilRate()).isZero();
        }

        @Test
        @DisplayName("completion rows need the reservoir resolved by the mapping")
        void completionRowRejectsBlankReservoir() {
            assertThatThrownBy(() -> new CompletionStatusRow("A", "A-1", " ", 2023, 1, false, WellMode.PRODUCTION, 0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("A-1");
        }
    }
}
