package tw.gc.well.activity.entities;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.well.activity.enums.OperationStatus;

import java.time.LocalDateTime;

/**
 * One named classification run. Result rows reference it by operation id.
 */
@Entity
@Table(name = "classification_operation", indexes = {
    @Index(name = "idx_operation_name", columnList = "operation_name", unique = true),
    @Index(name = "idx_operation_created", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationOperation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "operation_id")
    private Long id;

    @Column(name = "operation_name", nullable = false, length = 100)
    private String operationName;

    @Column(name = "description", length = 500)
    private String description;

    /**
     * Run parameters as a JSON object (chunk size, timeline extent, ...)
     */
    @Column(name = "parameters", length = 2000)
    private String parameters;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OperationStatus status;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (status == null) {
            status = OperationStatus.RUNNING;
        }
    }
}
