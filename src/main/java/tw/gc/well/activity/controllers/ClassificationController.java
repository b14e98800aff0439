package tw.gc.well.activity.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tw.gc.well.activity.entities.ClassificationOperation;
import tw.gc.well.activity.entities.WellCompletionStatus;
import tw.gc.well.activity.entities.WellMonthlyType;
import tw.gc.well.activity.services.ClassificationJobService;
import tw.gc.well.activity.services.JobProgress;
import tw.gc.well.activity.services.OperationResultStore;

import java.util.List;
import java.util.Map;

/**
 * Classification jobs and their stored results.
 */
@RestController
@RequestMapping("/api/classification")
@RequiredArgsConstructor
@Slf4j
public class ClassificationController {

    private final ClassificationJobService jobService;
    private final OperationResultStore resultStore;

    // ========================================================================
    // JOBS
    // ========================================================================

    /**
     * Start a classification run in the background.
     *
     * @param operationName results are stored under this name, replacing any previous run of the same name
     */
    @PostMapping("/jobs")
    public ResponseEntity<JobProgress> submitJob(
            @RequestParam(required = false) String operationName,
            @RequestParam(required = false) String description) {
        JobProgress progress = jobService.submit(operationName, description);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(progress);
    }

    @GetMapping("/jobs")
    public List<JobProgress> listJobs() {
        return jobService.listJobs();
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobProgress> getJob(@PathVariable String jobId) {
        return jobService.getProgress(jobId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<JobProgress> cancelJob(@PathVariable String jobId) {
        return jobService.cancel(jobId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    // ========================================================================
    // RESULTS
    // ========================================================================

    @GetMapping("/operations")
    public List<ClassificationOperation> listOperations() {
        return resultStore.listOperations();
    }

    @GetMapping("/operations/{operationId}/wells")
    public ResponseEntity<List<WellMonthlyType>> getWellTypes(
            @PathVariable Long operationId,
            @RequestParam(required = false) String wellName) {
        if (resultStore.findOperation(operationId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(resultStore.findWellMonthlyTypes(operationId, wellName));
    }

    @GetMapping("/operations/{operationId}/completions")
    public ResponseEntity<List<WellCompletionStatus>> getCompletionStatuses(
            @PathVariable Long operationId,
            @RequestParam(required = false) String wellName,
            @RequestParam(required = false) String reservoir,
            @RequestParam(required = false) Integer year,
            @RequestParam(required = false) Integer month) {
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("month must be between 1 and 12, got " + month);
        }
        if (resultStore.findOperation(operationId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(resultStore.findCompletionStatuses(operationId, wellName, reservoir, year, month));
    }

    @DeleteMapping("/operations/{operationId}")
    public ResponseEntity<Map<String, String>> deleteOperation(@PathVariable Long operationId) {
        if (!resultStore.deleteOperation(operationId)) {
            return ResponseEntity.notFound().build();
        }
        log.info("🗑️ Operation {} deleted via API", operationId);
        return ResponseEntity.ok(Map.of("status", "success", "message", "Operation " + operationId + " deleted"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.warn("⚠️ Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("status", "error", "message", e.getMessage()));
    }
}
