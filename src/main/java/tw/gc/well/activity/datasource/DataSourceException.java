package tw.gc.well.activity.datasource;

/**
 * Raised when the well data source cannot be read.
 */
public class DataSourceException extends RuntimeException {

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
