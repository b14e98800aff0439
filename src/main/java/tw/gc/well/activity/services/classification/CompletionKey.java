package tw.gc.well.activity.services.classification;

import java.util.Comparator;

/**
 * Fine-grained classification key: one completion of one well in one reservoir.
 */
public record CompletionKey(String wellName, String completionName, String reservoir)
        implements Comparable<CompletionKey> {

    private static final Comparator<CompletionKey> ORDER = Comparator
            .comparing(CompletionKey::wellName)
            .thenComparing(CompletionKey::completionName)
            .thenComparing(CompletionKey::reservoir);

    @Override
    public int compareTo(CompletionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return wellName + "/" + completionName + "@" + reservoir;
    }
}
