package win.ixuni.splice.core.exception;

/**
 * Object not found exception
 */
public class ObjectNotFoundException extends SpliceException {

    public ObjectNotFoundException(String bucketName, String key) {
        super("NoSuchKey", "The specified key does not exist: " + bucketName + "/" + key);
    }
}
