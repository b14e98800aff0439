package tw.gc.well.activity.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bytefish.pgbulkinsert.PgBulkInsert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Example;
import org.springframework.data.domain.ExampleMatcher;
import org.springframework.data.domain.Sort;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.well.activity.bulk.WellCompletionStatusBulkInsertMapping;
import tw.gc.well.activity.bulk.WellMonthlyTypeBulkInsertMapping;
import tw.gc.well.activity.config.ClassificationProperties;
import tw.gc.well.activity.entities.ClassificationOperation;
import tw.gc.well.activity.entities.WellCompletionStatus;
import tw.gc.well.activity.entities.WellMonthlyType;
import tw.gc.well.activity.enums.OperationStatus;
import tw.gc.well.activity.repositories.ClassificationOperationRepository;
import tw.gc.well.activity.repositories.WellCompletionStatusRepository;
import tw.gc.well.activity.repositories.WellMonthlyTypeRepository;
import tw.gc.well.activity.services.classification.ClassificationCancelledException;
import tw.gc.well.activity.services.classification.CompletionStatusRow;
import tw.gc.well.activity.services.classification.RunMonitor;
import tw.gc.well.activity.services.classification.WellMonthlyTypeRow;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persistence of classification runs: one operation row plus its well-level and
 * completion-level result rows.
 *
 * <p>Rows are written in batches of {@code classification.persist-batch-size}. On
 * PostgreSQL the COPY protocol (PgBulkInsert) is used; any other database gets a
 * JdbcTemplate batch insert. Both paths run on the connection bound to the
 * current transaction.
 *
 * <p>{@link #replaceWithResults} is the write path for a whole run: the old operation
 * of the same name stays in place until the new one commits as COMPLETED.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OperationResultStore {

    private static final String INSERT_WELL_MONTHLY_TYPE = """
        INSERT INTO well_monthly_type (
            operation_id, well_name, year, month, well_type,
            oil_rate, water_rate, water_inj_rate, has_dual_function, remarks
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String INSERT_WELL_COMPLETION_STATUS = """
        INSERT INTO well_completion_status (
            operation_id, well_name, completion_name, reservoir, year, month,
            is_active, well_type, oil_rate, water_rate, water_inj_rate
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private final ClassificationOperationRepository operationRepository;
    private final WellMonthlyTypeRepository wellMonthlyTypeRepository;
    private final WellCompletionStatusRepository completionStatusRepository;
    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;
    private final ClassificationProperties properties;
    private final ObjectMapper objectMapper;

    private PgBulkInsert<WellMonthlyType> wellMonthlyTypeBulkInsert;
    private PgBulkInsert<WellCompletionStatus> completionStatusBulkInsert;

    /**
     * Row counts of a committed run.
     */
    public record StoredRun(ClassificationOperation operation, int wellRowCount, int completionRowCount) {
    }

    // ========================================================================
    // OPERATIONS
    // ========================================================================

    /**
     * Replace the named operation with a new COMPLETED one holding these rows, in one transaction.
     *
     * <p>The monitor is consulted between the well-level and completion-level writes. A
     * cancellation or any failure rolls everything back, including the delete of the
     * previous operation.
     *
     * @throws ClassificationCancelledException when the monitor reports cancellation
     */
    @Transactional
    public StoredRun replaceWithResults(String operationName, String description, Map<String, Object> parameters,
                                       List<WellMonthlyTypeRow> wellRows, List<CompletionStatusRow> completionRows,
                                       RunMonitor monitor) {
        RunMonitor runMonitor = monitor == null ? RunMonitor.NONE : monitor;
        ClassificationOperation operation = replaceOperation(operationName, description, parameters);
        Long operationId = operation.getId();

        int wells = saveWellMonthlyTypes(operationId, wellRows);
        if (runMonitor.isCancelled()) {
            throw new ClassificationCancelledException("Cancelled while saving operation '" + operationName + "'");
        }
        runMonitor.onProgress(50, "Saved " + wells + " well-level rows");

        int completions = saveCompletionStatuses(operationId, completionRows);
        markStatus(operationId, OperationStatus.COMPLETED);

        ClassificationOperation stored = operationRepository.findById(operationId).orElseThrow();
        return new StoredRun(stored, wells, completions);
    }

    /**
     * Drop any operation with this name (rows included) and start a fresh one in RUNNING state.
     */
    @Transactional
    public ClassificationOperation replaceOperation(String operationName, String description, Map<String, Object> parameters) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("Operation name is required");
        }

        operationRepository.findByOperationName(operationName).ifPresent(existing -> {
            int rows = deleteRows(existing.getId());
            operationRepository.delete(existing);
            operationRepository.flush();
            log.info("🗑️ Replaced operation '{}' (id={}, {} rows removed)", operationName, existing.getId(), rows);
        });

        ClassificationOperation operation = ClassificationOperation.builder()
            .operationName(operationName)
            .description(description)
            .parameters(toJson(parameters))
            .createdAt(LocalDateTime.now())
            .status(OperationStatus.RUNNING)
            .build();
        return operationRepository.saveAndFlush(operation);
    }

    @Transactional
    public void markStatus(Long operationId, OperationStatus status) {
        int updated = operationRepository.updateStatus(operationId, status);
        if (updated == 0) {
            log.warn("⚠️ No operation {} to mark {}", operationId, status);
        }
    }

    @Transactional
    public boolean deleteOperation(Long operationId) {
        if (!operationRepository.existsById(operationId)) {
            return false;
        }
        int rows = deleteRows(operationId);
        operationRepository.deleteById(operationId);
        log.info("🗑️ Deleted operation {} ({} rows)", operationId, rows);
        return true;
    }

    @Transactional(readOnly = true)
    public List<ClassificationOperation> listOperations() {
        return operationRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public Optional<ClassificationOperation> findOperation(Long operationId) {
        return operationRepository.findById(operationId);
    }

    @Transactional(readOnly = true)
    public Optional<Long> latestOperationId(String operationName) {
        return operationRepository.findFirstByOperationNameOrderByCreatedAtDescIdDesc(operationName)
            .map(ClassificationOperation::getId);
    }

    @Transactional(readOnly = true)
    public boolean operationExists(String operationName) {
        return operationRepository.existsByOperationName(operationName);
    }

    private int deleteRows(Long operationId) {
        return wellMonthlyTypeRepository.deleteByOperationId(operationId)
            + completionStatusRepository.deleteByOperationId(operationId);
    }

    private String toJson(Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(parameters);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Operation parameters are not serializable: " + e.getMessage(), e);
        }
    }

    // ========================================================================
    // RESULT ROWS
    // ========================================================================

    @Transactional
    public int saveWellMonthlyTypes(Long operationId, List<WellMonthlyTypeRow> rows) {
        if (rows == null || rows.isEmpty()) {
            log.warn("⚠️ No well-level rows to save for operation {}", operationId);
            return 0;
        }
        List<WellMonthlyType> entities = rows.stream().map(r -> toEntity(operationId, r)).toList();
        int saved = writeInBatches(entities, this::copyWellMonthlyTypes, this::jdbcInsertWellMonthlyTypes);
        log.info("📥 Saved {} well-level rows for operation {}", saved, operationId);
        return saved;
    }

    @Transactional
    public int saveCompletionStatuses(Long operationId, List<CompletionStatusRow> rows) {
        if (rows == null || rows.isEmpty()) {
            log.warn("⚠️ No completion-level rows to save for operation {}", operationId);
            return 0;
        }
        List<WellCompletionStatus> entities = rows.stream().map(r -> toEntity(operationId, r)).toList();
        int saved = writeInBatches(entities, this::copyCompletionStatuses, this::jdbcInsertCompletionStatuses);
        log.info("📥 Saved {} completion-level rows for operation {}", saved, operationId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<WellMonthlyType> findWellMonthlyTypes(Long operationId, String wellName) {
        WellMonthlyType probe = WellMonthlyType.builder()
            .operationId(operationId)
            .wellName(blankToNull(wellName))
            .build();
        ExampleMatcher matcher = ExampleMatcher.matching().withIgnorePaths("hasDualFunction");
        return wellMonthlyTypeRepository.findAll(Example.of(probe, matcher),
            Sort.by("wellName", "year", "month"));
    }

    @Transactional(readOnly = true)
    public List<WellCompletionStatus> findCompletionStatuses(Long operationId, String wellName, String reservoir,
                                                            Integer year, Integer month) {
        WellCompletionStatus probe = WellCompletionStatus.builder()
            .operationId(operationId)
            .wellName(blankToNull(wellName))
            .reservoir(blankToNull(reservoir))
            .year(year)
            .month(month)
            .build();
        ExampleMatcher matcher = ExampleMatcher.matching().withIgnorePaths("active");
        return completionStatusRepository.findAll(Example.of(probe, matcher),
            Sort.by("wellName", "completionName", "reservoir", "year", "month"));
    }

    public List<WellCompletionStatus> findCompletionStatuses(Long operationId, String wellName, String reservoir,
                                                            YearMonth period) {
        return findCompletionStatuses(operationId, wellName, reservoir,
            period != null ? period.getYear() : null,
            period != null ? period.getMonthValue() : null);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    // ========================================================================
    // BULK WRITE
    // ========================================================================

    @FunctionalInterface
    private interface CopyWriter<T> {
        void write(PGConnection connection, List<T> batch) throws SQLException;
    }

    private <T> int writeInBatches(List<T> entities, CopyWriter<T> copyWriter,
                                   Consumer<List<T>> jdbcWriter) {
        int batchSize = Math.max(1, properties.getPersistBatchSize());
        Connection conn = DataSourceUtils.getConnection(dataSource);
        try {
            PGConnection pgConn = conn.isWrapperFor(PGConnection.class) ? conn.unwrap(PGConnection.class) : null;
            int written = 0;
            for (int from = 0; from < entities.size(); from += batchSize) {
                List<T> batch = entities.subList(from, Math.min(from + batchSize, entities.size()));
                if (pgConn != null) {
                    copyWriter.write(pgConn, batch);
                } else {
                    jdbcWriter.accept(batch);
                }
                written += batch.size();
                log.debug("Wrote batch {}-{} of {}", from + 1, from + batch.size(), entities.size());
            }
            return written;
        } catch (SQLException e) {
            log.error("❌ Bulk insert failed: {}", e.getMessage());
            throw new DataAccessResourceFailureException("Bulk insert failed", e);
        } finally {
            DataSourceUtils.releaseConnection(conn, dataSource);
        }
    }

    private void copyWellMonthlyTypes(PGConnection conn, List<WellMonthlyType> batch) throws SQLException {
        initBulkInserts();
        wellMonthlyTypeBulkInsert.saveAll(conn, batch.stream());
    }

    private void copyCompletionStatuses(PGConnection conn, List<WellCompletionStatus> batch) throws SQLException {
        initBulkInserts();
        completionStatusBulkInsert.saveAll(conn, batch.stream());
    }

    private synchronized void initBulkInserts() {
        if (wellMonthlyTypeBulkInsert == null) {
            wellMonthlyTypeBulkInsert = new PgBulkInsert<>(new WellMonthlyTypeBulkInsertMapping());
        }
        if (completionStatusBulkInsert == null) {
            completionStatusBulkInsert = new PgBulkInsert<>(new WellCompletionStatusBulkInsertMapping());
        }
    }

    private void jdbcInsertWellMonthlyTypes(List<WellMonthlyType> batch) {
        jdbcTemplate.batchUpdate(INSERT_WELL_MONTHLY_TYPE, batch, batch.size(), (ps, w) -> {
            ps.setLong(1, w.getOperationId());
            ps.setString(2, w.getWellName());
            ps.setInt(3, w.getYear());
            ps.setInt(4, w.getMonth());
            ps.setString(5, w.getWellType().name());
            ps.setDouble(6, w.getOilRate() != null ? w.getOilRate() : 0.0);
            ps.setDouble(7, w.getWaterRate() != null ? w.getWaterRate() : 0.0);
            ps.setDouble(8, w.getWaterInjRate() != null ? w.getWaterInjRate() : 0.0);
            ps.setBoolean(9, w.isHasDualFunction());
            ps.setString(10, w.getRemarks() != null ? w.getRemarks() : "");
        });
    }

    private void jdbcInsertCompletionStatuses(List<WellCompletionStatus> batch) {
        jdbcTemplate.batchUpdate(INSERT_WELL_COMPLETION_STATUS, batch, batch.size(), (ps, c) -> {
            ps.setLong(1, c.getOperationId());
            ps.setString(2, c.getWellName());
            ps.setString(3, c.getCompletionName());
            ps.setString(4, c.getReservoir());
            ps.setInt(5, c.getYear());
            ps.setInt(6, c.getMonth());
            ps.setBoolean(7, c.isActive());
            ps.setString(8, c.getWellType().name());
            ps.setDouble(9, c.getOilRate() != null ? c.getOilRate() : 0.0);
            ps.setDouble(10, c.getWaterRate() != null ? c.getWaterRate() : 0.0);
            ps.setDouble(11, c.getWaterInjRate() != null ? c.getWaterInjRate() : 0.0);
        });
    }

    static WellMonthlyType toEntity(Long operationId, WellMonthlyTypeRow row) {
        return WellMonthlyType.builder()
            .operationId(operationId)
            .wellName(row.wellName())
            .year(row.year())
            .month(row.month())
            .wellType(row.wellType())
            .oilRate(row.oilRate())
            .waterRate(row.waterRate())
            .waterInjRate(row.waterInjRate())
            .hasDualFunction(row.hasDualFunction())
            .remarks(row.remarks())
            .build();
    }

    static WellCompletionStatus toEntity(Long operationId, CompletionStatusRow row) {
        return WellCompletionStatus.builder()
            .operationId(operationId)
            .wellName(row.wellName())
            .completionName(row.completionName())
            .reservoir(row.reservoir())
            .year(row.year())
            .month(row.month())
            .active(row.active())
            .wellType(row.wellType())
            .oilRate(row.oilRate())
            .waterRate(row.waterRate())
            .waterInjRate(row.waterInjRate())
            .build();
    }
}
