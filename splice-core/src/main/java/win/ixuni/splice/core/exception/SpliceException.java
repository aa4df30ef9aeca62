package win.ixuni.splice.core.exception;

import lombok.Getter;

/**
 * S3Splice base exception
 * <p>
 * Every failure raised by the merger or a driver carries a stable error code so callers
 * (and the CLI exit code mapping) can tell the cases apart without parsing messages.
 */
@Getter
public class SpliceException extends RuntimeException {

    private final String errorCode;

    public SpliceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SpliceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
