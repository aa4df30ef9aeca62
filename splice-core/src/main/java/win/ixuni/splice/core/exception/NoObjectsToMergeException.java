package win.ixuni.splice.core.exception;

import lombok.Getter;

/**
 * Raised after a full scan of the prefix when no object name starts with the requested initial name
 */
@Getter
public class NoObjectsToMergeException extends SpliceException {

    private final String initialName;

    public NoObjectsToMergeException(String prefix, String initialName) {
        super("NoObjectsToMerge",
                "No objects to merge starting with '" + initialName + "' under prefix '" + prefix + "'");
        this.initialName = initialName;
    }
}
