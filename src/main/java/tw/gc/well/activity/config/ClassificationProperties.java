package tw.gc.well.activity.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.well.activity.AppConstants;
import tw.gc.well.activity.enums.TimelineExtent;
import tw.gc.well.activity.enums.WellMode;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "classification")
public class ClassificationProperties {

    /**
     * Entity groups classified per chunk. Cancellation is honoured between chunks.
     */
    private int chunkSize = 250;

    /**
     * Rows written per batch by the result store.
     */
    private int persistBatchSize = 500;

    /**
     * Wells or completions whose name contains any of these are left out of the run.
     */
    private List<String> excludedWellPatterns = new ArrayList<>(List.of("PLA"));

    private String unknownReservoir = AppConstants.UNKNOWN_RESERVOIR;

    private TimelineExtent timelineExtent = TimelineExtent.RUN_HORIZON;

    /**
     * Seed for entities with both production and injection history.
     * Policy choice, not a property of the data.
     */
    private WellMode ambiguousHistorySeed = WellMode.PRODUCTION;

    private String defaultOperationName = AppConstants.DEFAULT_OPERATION_NAME;

    /**
     * Finished jobs kept for progress queries. Older ones are forgotten first.
     */
    private int jobRetention = 100;

    private Source source = new Source();

    @Data
    public static class Source {
        /**
         * Columns: well name, completion name, reservoir
         */
        private String completionsQuery = "SELECT m.WELL_LEGAL_NAME, m.COMPLETION_LEGAL_NAME, s.RESERVORIO "
                + "FROM MAESTRA m LEFT JOIN SC s ON s.COMPLETION_LEGAL_NAME = m.COMPLETION_LEGAL_NAME";

        /**
         * Columns: completion name, date, oil volume, water volume
         */
        private String productionQuery = "SELECT COMP_S_NAME, PROD_DT, VO_OIL_PROD, VO_WAT_PROD FROM MENSUAL";

        /**
         * Columns: completion name, date, injected water volume
         */
        private String injectionQuery = "SELECT COMPLETION_LEGAL_NAME, \"Date\", Water_INJ_CALDAY FROM INY_CALDAY";
    }
}
