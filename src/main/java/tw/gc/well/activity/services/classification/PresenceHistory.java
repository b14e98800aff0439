package tw.gc.well.activity.services.classification;

import tw.gc.well.activity.enums.WellMode;

/**
 * Whether an entity ever produced and/or ever injected across the whole run.
 */
public record PresenceHistory(boolean hasProductionHistory, boolean hasInjectionHistory) {

    public static final PresenceHistory NONE = new PresenceHistory(false, false);

    /**
     * Mode the month walk starts from before any month has been examined.
     *
     * @param ambiguousSeed mode to use when both histories exist
     */
    public WellMode seedMode(WellMode ambiguousSeed) {
        if (hasProductionHistory && hasInjectionHistory) {
            return ambiguousSeed;
        }
        if (hasProductionHistory) {
            return WellMode.PRODUCTION;
        }
        if (hasInjectionHistory) {
            return WellMode.INJECTION;
        }
        return WellMode.UNKNOWN;
    }
}
