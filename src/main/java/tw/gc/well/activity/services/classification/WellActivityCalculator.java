package tw.gc.well.activity.services.classification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.well.activity.config.ClassificationProperties;
import tw.gc.well.activity.datasource.WellDataSnapshot;
import tw.gc.well.activity.enums.TimelineExtent;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the monthly classification at both granularities over one data snapshot.
 *
 * <p>Flow: validate readings, build the completion mapping, aggregate calendar-day
 * rates per well and per completion, index presence history, then walk each entity's
 * densified timeline. Entities are processed in chunks of
 * {@link ClassificationProperties#getChunkSize()} groups; an entity's timeline is
 * never split, so the output does not depend on the chunk size.
 *
 * <p>Holds no state between calls. Safe to call concurrently.
 */
@Slf4j
@Service
public class WellActivityCalculator {

    private final ClassificationProperties properties;
    private final ReadingValidator validator = new ReadingValidator();
    private final RateAggregator aggregator = new RateAggregator();
    private final PresenceHistoryIndex historyIndex = new PresenceHistoryIndex();
    private final ResultFormatter formatter = new ResultFormatter();

    public WellActivityCalculator(ClassificationProperties properties) {
        this.properties = properties;
    }

    public ClassificationResult calculate(WellDataSnapshot snapshot) {
        return calculate(snapshot, RunMonitor.NONE);
    }

    /**
     * @throws ClassificationCancelledException when the monitor reports cancellation at a chunk boundary
     */
    public ClassificationResult calculate(WellDataSnapshot snapshot, RunMonitor monitor) {
        long start = System.currentTimeMillis();
        ValidatedReadings readings = validator.validate(snapshot.production(), snapshot.injection());
        CompletionMapping mapping = CompletionMapping.build(
                snapshot.completions(), properties.getExcludedWellPatterns(), properties.getUnknownReservoir());
        log.info("Mapped {} completions to {} wells", mapping.completionCount(), mapping.wells().size());

        AggregatedRates<String> wellRates = aggregator.aggregate(
                readings.production(), readings.injection(), mapping::wellOf);
        AggregatedRates<CompletionKey> completionRates = aggregator.aggregate(
                readings.production(), readings.injection(), mapping::completionKeyOf);

        int dropped = readings.droppedReadings() + wellRates.unmappedReadings();
        if (wellRates.unmappedReadings() > 0) {
            log.warn("⚠️ {} readings reference completions with no mapped well (unknown or excluded)",
                    wellRates.unmappedReadings());
        }
        if (wellRates.rates().isEmpty()) {
            log.warn("⚠️ No mapped readings in snapshot, nothing to classify");
            return ClassificationResult.empty(dropped);
        }

        YearMonth horizon = lastPeriod(wellRates.rates());
        TemporalClassifier classifier = new TemporalClassifier(properties.getAmbiguousHistorySeed());

        Map<String, List<MonthlyRate<String>>> wellGroups = groupByEntity(wellRates.rates());
        Map<CompletionKey, List<MonthlyRate<CompletionKey>>> completionGroups = groupByEntity(completionRates.rates());

        int chunkSize = Math.max(1, properties.getChunkSize());
        ChunkProgress progress = new ChunkProgress(
                chunkCount(wellGroups.size(), chunkSize) + chunkCount(completionGroups.size(), chunkSize), monitor);

        List<ClassifiedMonth<String>> wellMonths =
                classifyGroups("well", wellGroups, historyIndex.build(wellRates.rates()), horizon, classifier, chunkSize, progress);
        List<ClassifiedMonth<CompletionKey>> completionMonths =
                classifyGroups("completion", completionGroups, historyIndex.build(completionRates.rates()), horizon, classifier, chunkSize, progress);

        ClassificationResult result = new ClassificationResult(
                formatter.toWellRows(wellMonths), formatter.toCompletionRows(completionMonths), dropped);

        log.info("✅ Classified {} wells ({} rows) and {} completions ({} rows) up to {} in {}ms",
                wellGroups.size(), result.wellRows().size(),
                completionGroups.size(), result.completionRows().size(),
                horizon, System.currentTimeMillis() - start);
        return result;
    }

    private <K> List<ClassifiedMonth<K>> classifyGroups(String granularity,
                                                        Map<K, List<MonthlyRate<K>>> groups,
                                                        Map<K, PresenceHistory> histories,
                                                        YearMonth horizon,
                                                        TemporalClassifier classifier,
                                                        int chunkSize,
                                                        ChunkProgress progress) {
        List<K> entities = new ArrayList<>(groups.keySet());
        List<ClassifiedMonth<K>> out = new ArrayList<>();

        for (int from = 0; from < entities.size(); from += chunkSize) {
            progress.checkCancelled();
            List<K> chunk = entities.subList(from, Math.min(from + chunkSize, entities.size()));
            for (K entity : chunk) {
                List<MonthlyRate<K>> rates = groups.get(entity);
                Map<YearMonth, MonthlyRate<K>> byMonth = new TreeMap<>();
                for (MonthlyRate<K> rate : rates) {
                    byMonth.put(rate.period(), rate);
                }
                YearMonth first = rates.get(0).period();
                YearMonth last = properties.getTimelineExtent() == TimelineExtent.ENTITY_SPAN
                        ? rates.get(rates.size() - 1).period()
                        : horizon;
                out.addAll(classifier.classify(entity, TemporalClassifier.monthsBetween(first, last), byMonth,
                        histories.get(entity)));
            }
            log.debug("Classified {} chunk {}-{} of {}", granularity, from + 1, from + chunk.size(), entities.size());
            progress.chunkDone(granularity, from + chunk.size(), entities.size());
        }
        return out;
    }

    private static <K> Map<K, List<MonthlyRate<K>>> groupByEntity(List<MonthlyRate<K>> rates) {
        // rates arrive sorted by entity then month; keep that order
        Map<K, List<MonthlyRate<K>>> groups = new LinkedHashMap<>();
        for (MonthlyRate<K> rate : rates) {
            groups.computeIfAbsent(rate.entity(), k -> new ArrayList<>()).add(rate);
        }
        return groups;
    }

    private static YearMonth lastPeriod(List<? extends MonthlyRate<?>> rates) {
        YearMonth last = null;
        for (MonthlyRate<?> rate : rates) {
            if (last == null || rate.period().isAfter(last)) {
                last = rate.period();
            }
        }
        return last;
    }

    private static int chunkCount(int groups, int chunkSize) {
        return (groups + chunkSize - 1) / chunkSize;
    }

    private static final class ChunkProgress {
        private final int totalChunks;
        private final RunMonitor monitor;
        private int done;

        ChunkProgress(int totalChunks, RunMonitor monitor) {
            this.totalChunks = Math.max(1, totalChunks);
            this.monitor = monitor == null ? RunMonitor.NONE : monitor;
        }

        void checkCancelled() {
            if (monitor.isCancelled()) {
                throw new ClassificationCancelledException("Classification cancelled after " + done + " of " + totalChunks + " chunks");
            }
        }

        void chunkDone(String granularity, int entitiesDone, int entitiesTotal) {
            done++;
            monitor.onProgress(done * 100 / totalChunks,
                    String.format("Classified %d/%d %s entities", entitiesDone, entitiesTotal, granularity));
        }
    }
}
