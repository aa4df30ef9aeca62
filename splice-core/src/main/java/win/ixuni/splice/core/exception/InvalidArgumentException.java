package win.ixuni.splice.core.exception;

/**
 * Missing or malformed argument (empty bucket name, empty object key, bad driver settings)
 */
public class InvalidArgumentException extends SpliceException {

    public InvalidArgumentException(String message) {
        super("InvalidArgument", message);
    }
}
