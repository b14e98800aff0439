package tw.gc.well.activity.enums;

/**
 * How far the month-by-month walk of an entity extends.
 */
public enum TimelineExtent {
    /**
     * From the entity's first observed month to the last month observed anywhere in the run
     */
    RUN_HORIZON,

    /**
     * From the entity's first observed month to its own last observed month
     */
    ENTITY_SPAN
}
