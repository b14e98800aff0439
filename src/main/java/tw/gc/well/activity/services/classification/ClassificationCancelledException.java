package tw.gc.well.activity.services.classification;

public class ClassificationCancelledException extends RuntimeException {

    public ClassificationCancelledException(String message) {
        super(message);
    }
}
