package tw.gc.well.activity.enums;

/**
 * Operating mode of a well or completion in a given month.
 *
 * <p>{@link #DUAL} only exists while a run is in progress: persisted and
 * returned rows always carry the dominant side of a dual month.
 */
public enum WellMode {
    /**
     * Oil or water produced
     */
    PRODUCTION,

    /**
     * Water injected
     */
    INJECTION,

    /**
     * Production and injection in the same month
     */
    DUAL,

    /**
     * No observed data and no history to fall back on
     */
    UNKNOWN;

    /**
     * Mode implied by one month of evidence, or null when the month has none.
     */
    public static WellMode fromEvidence(boolean hasProduction, boolean hasInjection) {
        if (hasProduction && hasInjection) {
            return DUAL;
        }
        if (hasProduction) {
            return PRODUCTION;
        }
        if (hasInjection) {
            return INJECTION;
        }
        return null;
    }
}
