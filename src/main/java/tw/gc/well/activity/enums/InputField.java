package tw.gc.well.activity.enums;

/**
 * Reading fields and the value used when one is absent.
 *
 * <p>A field without a default is mandatory: a reading missing it is dropped.
 * The reservoir sentinel is not listed here; it comes from
 * {@code classification.unknown-reservoir} and is applied by the completion mapping.
 */
public enum InputField {
    READING_DATE(null),
    OIL_VOLUME(0.0),
    WATER_VOLUME(0.0),
    WATER_INJ_VOLUME(0.0);

    private final Double defaultValue;

    InputField(Double defaultValue) {
        this.defaultValue = defaultValue;
    }

    public boolean isRequired() {
        return defaultValue == null;
    }

    public double defaultVolume() {
        if (defaultValue == null) {
            throw new IllegalStateException(name() + " has no default");
        }
        return defaultValue;
    }
}
