package tw.gc.well.activity.services.classification;

/**
 * Hook the calculator polls between chunks.
 */
public interface RunMonitor {

    RunMonitor NONE = new RunMonitor() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public void onProgress(int percent, String statusText) {
        }
    };

    boolean isCancelled();

    /**
     * @param percent 0-100 within the classification phase
     */
    void onProgress(int percent, String statusText);
}
