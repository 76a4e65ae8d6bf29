package win.ixuni.b2bridge.core.operation;

/**
 * Base interface of every storage operation
 * <p>
 * Each operation (CreateBucket, PutObject, ...) is a small command object; the type
 * parameter is what its handler produces.
 *
 * @param <R> operation result type
 */
public interface Operation<R> {

    /**
     * Get the operation name (for logging)
     *
     * @return operation name such as "CreateBucket" or "PutObject"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }
}
