package tw.gc.well.activity.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.well.activity.enums.WellMode;

/**
 * Well-level monthly classification.
 * DUAL never reaches this table; {@code hasDualFunction} records that the month was dual.
 */
@Entity
@Table(name = "well_monthly_type",
    uniqueConstraints = @UniqueConstraint(name = "uk_well_monthly_type",
        columnNames = {"operation_id", "well_name", "year", "month"}),
    indexes = {
        @Index(name = "idx_wmt_operation", columnList = "operation_id"),
        @Index(name = "idx_wmt_well", columnList = "well_name")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WellMonthlyType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "operation_id", nullable = false)
    private Long operationId;

    @Column(name = "well_name", nullable = false, length = 100)
    private String wellName;

    @Column(name = "year", nullable = false)
    private Integer year;

    @Column(name = "month", nullable = false)
    private Integer month;

    /**
     * PRODUCTION, INJECTION or UNKNOWN
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "well_type", nullable = false, length = 20)
    private WellMode wellType;

    /**
     * Calendar-day rates, bbl/d
     */
    @Column(name = "oil_rate")
    private Double oilRate;

    @Column(name = "water_rate")
    private Double waterRate;

    @Column(name = "water_inj_rate")
    private Double waterInjRate;

    @Column(name = "has_dual_function")
    private boolean hasDualFunction;

    @Column(name = "remarks", length = 500)
    private String remarks;
}
