package tw.gc.well.activity.services;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tw.gc.well.activity.config.ClassificationProperties;
import tw.gc.well.activity.datasource.WellDataSnapshot;
import tw.gc.well.activity.datasource.WellDataSource;
import tw.gc.well.activity.enums.JobState;
import tw.gc.well.activity.services.OperationResultStore.StoredRun;
import tw.gc.well.activity.services.classification.ClassificationCancelledException;
import tw.gc.well.activity.services.classification.ClassificationResult;
import tw.gc.well.activity.services.classification.RunMonitor;
import tw.gc.well.activity.services.classification.WellActivityCalculator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Runs load → classify → persist off the request thread, one job at a time.
 *
 * <p>Cancellation is cooperative: the flag is read between classification chunks and
 * between the two row writes. Results are stored through
 * {@link OperationResultStore#replaceWithResults}, so a cancelled or failed job leaves
 * the previous operation of the same name untouched.
 *
 * <p>Finished jobs beyond {@code classification.job-retention} are forgotten, oldest first.
 */
@Service
@Slf4j
public class ClassificationJobService {

    private static final int LOAD_DONE = 10;
    private static final int CLASSIFY_DONE = 80;

    private final WellDataSource wellDataSource;
    private final WellActivityCalculator calculator;
    private final OperationResultStore resultStore;
    private final ClassificationProperties properties;
    private final ExecutorService executor;

    private final Map<String, JobHandle> jobs = new ConcurrentHashMap<>();
    private final AtomicLong submitted = new AtomicLong();

    @Autowired
    public ClassificationJobService(WellDataSource wellDataSource,
                                    WellActivityCalculator calculator,
                                    OperationResultStore resultStore,
                                    ClassificationProperties properties) {
        this(wellDataSource, calculator, resultStore, properties, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "classification-worker");
            t.setDaemon(true);
            return t;
        }));
    }

    ClassificationJobService(WellDataSource wellDataSource,
                             WellActivityCalculator calculator,
                             OperationResultStore resultStore,
                             ClassificationProperties properties,
                             ExecutorService executor) {
        this.wellDataSource = wellDataSource;
        this.calculator = calculator;
        this.resultStore = resultStore;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Queue a run. Returns immediately with the QUEUED snapshot.
     *
     * @param operationName name the results are stored under; blank means the configured default
     */
    public JobProgress submit(String operationName, String description) {
        String name = operationName == null || operationName.isBlank()
                ? properties.getDefaultOperationName()
                : operationName.trim();
        String jobId = UUID.randomUUID().toString();
        JobHandle handle = new JobHandle(submitted.incrementAndGet(), JobProgress.queued(jobId, name));
        jobs.put(jobId, handle);
        evictFinishedJobs();

        log.info("📥 Queued classification job {} for operation '{}'", jobId, name);
        executor.submit(() -> run(handle, name, description == null ? "" : description));
        return handle.progress();
    }

    public Optional<JobProgress> getProgress(String jobId) {
        JobHandle handle = jobs.get(jobId);
        return handle == null ? Optional.empty() : Optional.of(handle.progress());
    }

    public List<JobProgress> listJobs() {
        List<JobProgress> all = new ArrayList<>();
        jobs.values().forEach(h -> all.add(h.progress()));
        all.sort(Comparator.comparing(JobProgress::jobId));
        return all;
    }

    /**
     * Request cancellation. Takes effect at the next chunk boundary.
     *
     * @return the job's current snapshot, empty when the job is unknown
     */
    public Optional<JobProgress> cancel(String jobId) {
        JobHandle handle = jobs.get(jobId);
        if (handle == null) {
            return Optional.empty();
        }
        if (!handle.progress().state().isTerminal()) {
            handle.cancelRequested.set(true);
            log.info("🛑 Cancellation requested for job {}", jobId);
        }
        return Optional.of(handle.progress());
    }

    void run(JobHandle handle, String operationName, String description) {
        long start = System.currentTimeMillis();
        try {
            checkCancelled(handle);
            handle.update(p -> p.toBuilder().state(JobState.RUNNING).percent(0).statusText("Loading well data").build());
            log.info("🚀 Classification job {} started for '{}'", handle.progress().jobId(), operationName);

            WellDataSnapshot snapshot = wellDataSource.loadSnapshot();
            checkCancelled(handle);
            setProgress(handle, LOAD_DONE, String.format("Loaded %d completions, %d production and %d injection readings",
                    snapshot.completions().size(), snapshot.production().size(), snapshot.injection().size()));

            ClassificationResult result = calculator.calculate(snapshot, monitorFor(handle, LOAD_DONE, CLASSIFY_DONE));
            checkCancelled(handle);
            setProgress(handle, CLASSIFY_DONE, "Saving results");

            StoredRun stored = resultStore.replaceWithResults(operationName, description, runParameters(),
                    result.wellRows(), result.completionRows(), monitorFor(handle, CLASSIFY_DONE, 100));

            handle.update(p -> p.toBuilder()
                    .state(JobState.SUCCEEDED)
                    .percent(100)
                    .statusText("Completed")
                    .operationId(stored.operation().getId())
                    .wellRowCount(stored.wellRowCount())
                    .completionRowCount(stored.completionRowCount())
                    .build());
            log.info("✅ Classification job {} finished: operation {} with {} well rows, {} completion rows in {}ms",
                    handle.progress().jobId(), stored.operation().getId(), stored.wellRowCount(),
                    stored.completionRowCount(), System.currentTimeMillis() - start);

        } catch (ClassificationCancelledException e) {
            handle.update(p -> p.toBuilder().state(JobState.CANCELLED).statusText("Cancelled").build());
            log.info("🛑 Classification job {} cancelled: {}", handle.progress().jobId(), e.getMessage());

        } catch (Exception e) {
            log.error("❌ Classification job {} failed", handle.progress().jobId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            handle.update(p -> p.toBuilder().state(JobState.FAILED).statusText("Failed").errorMessage(message).build());

        } finally {
            evictFinishedJobs();
        }
    }

    private void evictFinishedJobs() {
        List<JobHandle> finished = new ArrayList<>();
        jobs.values().forEach(h -> {
            if (h.progress().state().isTerminal()) {
                finished.add(h);
            }
        });
        int excess = finished.size() - Math.max(0, properties.getJobRetention());
        if (excess <= 0) {
            return;
        }
        finished.sort(Comparator.comparingLong((JobHandle h) -> h.sequence));
        for (JobHandle handle : finished.subList(0, excess)) {
            jobs.remove(handle.progress().jobId());
        }
        log.debug("Forgot {} finished jobs", excess);
    }

    private Map<String, Object> runParameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("chunkSize", properties.getChunkSize());
        parameters.put("persistBatchSize", properties.getPersistBatchSize());
        parameters.put("timelineExtent", properties.getTimelineExtent().name());
        parameters.put("ambiguousHistorySeed", properties.getAmbiguousHistorySeed().name());
        parameters.put("excludedWellPatterns", properties.getExcludedWellPatterns());
        return parameters;
    }

    private RunMonitor monitorFor(JobHandle handle, int fromPercent, int toPercent) {
        return new RunMonitor() {
            @Override
            public boolean isCancelled() {
                return handle.cancelRequested.get();
            }

            @Override
            public void onProgress(int percent, String statusText) {
                setProgress(handle, fromPercent + percent * (toPercent - fromPercent) / 100, statusText);
            }
        };
    }

    private static void checkCancelled(JobHandle handle) {
        if (handle.cancelRequested.get()) {
            throw new ClassificationCancelledException("Cancelled by request");
        }
    }

    private static void setProgress(JobHandle handle, int percent, String statusText) {
        handle.update(p -> p.toBuilder().percent(percent).statusText(statusText).build());
    }

    @PreDestroy
    public void shutdown() {
        log.info("🛑 Shutting down classification worker");
        jobs.values().forEach(h -> h.cancelRequested.set(true));
        executor.shutdownNow();
    }

    static final class JobHandle {
        private final long sequence;
        private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
        private volatile JobProgress progress;

        JobHandle(long sequence, JobProgress initial) {
            this.sequence = sequence;
            this.progress = initial;
        }

        JobProgress progress() {
            return progress;
        }

        synchronized void update(UnaryOperator<JobProgress> change) {
            progress = change.apply(progress);
        }
    }
}
