package win.ixuni.splice.core.exception;

import lombok.Getter;

/**
 * Raised when a listing under the merge prefix returns no entries at all
 */
@Getter
public class PrefixNotFoundException extends SpliceException {

    private final String bucketName;
    private final String prefix;

    public PrefixNotFoundException(String bucketName, String prefix) {
        super("PrefixNotFound", "Prefix not found! (" + bucketName + "/" + prefix + ")");
        this.bucketName = bucketName;
        this.prefix = prefix;
    }
}
