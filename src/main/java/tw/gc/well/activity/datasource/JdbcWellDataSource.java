package tw.gc.well.activity.datasource;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import tw.gc.well.activity.config.ClassificationProperties;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * JdbcTemplate-backed {@link WellDataSource}.
 *
 * Queries come from {@code classification.source.*}; columns are read by position
 * so the source tables can use whatever names they like.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcWellDataSource implements WellDataSource {

    private final JdbcTemplate jdbcTemplate;
    private final ClassificationProperties properties;

    @Override
    public List<CompletionRecord> loadCompletions() {
        String sql = properties.getSource().getCompletionsQuery();
        List<CompletionRecord> records = query("completions", sql, (rs, i) -> new CompletionRecord(
                trimmed(rs.getString(1)),
                trimmed(rs.getString(2)),
                trimmed(rs.getString(3))));
        log.info("📥 Loaded {} completion records", records.size());
        return records;
    }

    @Override
    public List<ProductionReading> loadProductionReadings() {
        String sql = properties.getSource().getProductionQuery();
        List<ProductionReading> readings = query("production", sql, (rs, i) -> new ProductionReading(
                trimmed(rs.getString(1)),
                toLocalDate(rs.getObject(2)),
                nullableDouble(rs, 3),
                nullableDouble(rs, 4)));
        log.info("📥 Loaded {} production readings", readings.size());
        return readings;
    }

    @Override
    public List<InjectionReading> loadInjectionReadings() {
        String sql = properties.getSource().getInjectionQuery();
        List<InjectionReading> readings = query("injection", sql, (rs, i) -> new InjectionReading(
                trimmed(rs.getString(1)),
                toLocalDate(rs.getObject(2)),
                nullableDouble(rs, 3)));
        log.info("📥 Loaded {} injection readings", readings.size());
        return readings;
    }

    private <T> List<T> query(String what, String sql, RowMapper<T> mapper) {
        try {
            return jdbcTemplate.query(sql, mapper);
        } catch (DataAccessException e) {
            log.error("❌ Failed to load {} from data source", what, e);
            throw new DataSourceException("Failed to load " + what + ": " + e.getMessage(), e);
        }
    }

    private static Double nullableDouble(ResultSet rs, int column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    /**
     * Drivers disagree on the date type they hand back; anything unrecognised becomes null
     * and the reading is dropped later as undated.
     */
    static LocalDate toLocalDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate localDate) {
            return localDate;
        }
        if (value instanceof Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toLocalDate();
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            try {
                return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed);
            } catch (RuntimeException e) {
                log.warn("⚠️ Unparseable reading date '{}'", trimmed);
                return null;
            }
        }
        return null;
    }
}
