package tw.gc.well.activity;

/**
 * Application-wide constants
 */
public final class AppConstants {

    // Reservoir sentinel for completions without a reservoir assignment
    public static final String UNKNOWN_RESERVOIR = "UNKNOWN";

    // Rate unit used in remarks
    public static final String RATE_UNIT = "bbl/d";

    // Operation name used when a caller does not supply one
    public static final String DEFAULT_OPERATION_NAME = "WELL_TYPE_CLASSIFICATION";

    private AppConstants() {
        // Utility class
    }
}
