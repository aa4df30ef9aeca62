package win.ixuni.splice.core.operation;

/**
 * Base interface of every store operation
 * <p>
 * Each store call (BucketExists, ListObjects, GetObject, ...) is a small value class implementing this
 * interface. Drivers register one handler per operation type they support.
 *
 * @param <R> operation result type
 */
public interface Operation<R> {

    /**
     * Operation name used in logs, e.g. "GetObject"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - "Operation".length());
        }
        return className;
    }
}
