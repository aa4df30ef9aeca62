package win.ixuni.splice.core.exception;

import lombok.Getter;

/**
 * Raised when an input object's body is not valid UTF-8 text; the object is left in place
 */
@Getter
public class MalformedContentException extends SpliceException {

    private final String key;

    public MalformedContentException(String bucketName, String key, Throwable cause) {
        super("MalformedContent", "Object is not valid UTF-8 text: " + bucketName + "/" + key, cause);
        this.key = key;
    }
}
