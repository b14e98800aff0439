package tw.gc.well.activity.datasource;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import tw.gc.well.activity.config.ClassificationProperties;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JdbcWellDataSource")
class JdbcWellDataSourceTest {

    private EmbeddedDatabase database;
    private ClassificationProperties properties;
    private JdbcWellDataSource dataSource;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .generateUniqueName(true)
            .setType(EmbeddedDatabaseType.H2)
            .addScript("well-source.sql")
            .build();
        properties = new ClassificationProperties();
        dataSource = new JdbcWellDataSource(new JdbcTemplate(database), properties);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("loads completions with trimmed names and their reservoir")
    void loadsCompletions() {
        assertThat(dataSource.loadCompletions()).containsExactlyInAnyOrder(
            new CompletionRecord("A", "A-1", "R1"),
            new CompletionRecord("A", "A-2", "R2"),
            new CompletionRecord("B", "B-1", null));
    }

    @Test
    @DisplayName("loads production readings keeping absent volumes as null")
    void loadsProduction() {
        assertThat(dataSource.loadProductionReadings()).containsExactlyInAnyOrder(
            new ProductionReading("A-1", LocalDate.of(2023, 1, 31), 310.0, 31.0),
            new ProductionReading("A-2", LocalDate.of(2023, 2, 28), null, 28.0));
    }

    @Test
    @DisplayName("loads injection readings from a timestamp column")
    void loadsInjection() {
        assertThat(dataSource.loadInjectionReadings()).containsExactly(
            new InjectionReading("B-1", LocalDate.of(2023, 4, 15), 300.0));
    }

    @Test
    @DisplayName("snapshot bundles all three sources")
    void loadsSnapshot() {
        WellDataSnapshot snapshot = dataSource.loadSnapshot();

        assertThat(snapshot.completions()).hasSize(3);
        assertThat(snapshot.production()).hasSize(2);
        assertThat(snapshot.injection()).hasSize(1);
        assertThat(snapshot.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("wraps query failures in DataSourceException")
    void wrapsFailures() {
        properties.getSource().setProductionQuery("SELECT * FROM NO_SUCH_TABLE");

        assertThatThrownBy(() -> dataSource.loadProductionReadings())
            .isInstanceOf(DataSourceException.class)
            .hasMessageContaining("production");
    }

    @Nested
    @DisplayName("Date conversion")
    class DateConversion {

        @Test
        void sqlTypes() {
            assertThat(JdbcWellDataSource.toLocalDate(Date.valueOf("2023-03-01"))).isEqualTo(LocalDate.of(2023, 3, 1));
            assertThat(JdbcWellDataSource.toLocalDate(Timestamp.valueOf("2023-03-01 10:15:00"))).isEqualTo(LocalDate.of(2023, 3, 1));
            assertThat(JdbcWellDataSource.toLocalDate(LocalDateTime.of(2023, 3, 1, 8, 0))).isEqualTo(LocalDate.of(2023, 3, 1));
        }

        @Test
        void text() {
            assertThat(JdbcWellDataSource.toLocalDate(" 2023-03-01 00:00:00")).isEqualTo(LocalDate.of(2023, 3, 1));
            assertThat(JdbcWellDataSource.toLocalDate("not a date")).isNull();
        }

        @Test
        void unsupported() {
            assertThat(JdbcWellDataSource.toLocalDate(null)).isNull();
            assertThat(JdbcWellDataSource.toLocalDate(42)).isNull();
        }
    }
}
