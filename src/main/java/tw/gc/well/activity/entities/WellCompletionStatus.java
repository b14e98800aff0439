package tw.gc.well.activity.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.well.activity.enums.WellMode;

/**
 * Completion/reservoir-level monthly classification with its activity flag.
 */
@Entity
@Table(name = "well_completion_status",
    uniqueConstraints = @UniqueConstraint(name = "uk_well_completion_status",
        columnNames = {"operation_id", "well_name", "completion_name", "reservoir", "year", "month"}),
    indexes = {
        @Index(name = "idx_wcs_operation", columnList = "operation_id"),
        @Index(name = "idx_wcs_well_reservoir", columnList = "well_name,reservoir")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WellCompletionStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "operation_id", nullable = false)
    private Long operationId;

    @Column(name = "well_name", nullable = false, length = 100)
    private String wellName;

    @Column(name = "completion_name", nullable = false, length = 100)
    private String completionName;

    @Column(name = "reservoir", nullable = false, length = 100)
    private String reservoir;

    @Column(name = "year", nullable = false)
    private Integer year;

    @Column(name = "month", nullable = false)
    private Integer month;

    /**
     * True only when the month itself reported production or injection
     */
    @Column(name = "is_active")
    private boolean active;

    @Enumerated(EnumType.STRING)
    @Column(name = "well_type", nullable = false, length = 20)
    private WellMode wellType;

    @Column(name = "oil_rate")
    private Double oilRate;

    @Column(name = "water_rate")
    private Double waterRate;

    @Column(name = "water_inj_rate")
    private Double waterInjRate;
}
