package win.ixuni.splice.cli.runner;

import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;
import win.ixuni.splice.core.exception.SpliceException;

/**
 * Process exit code for a failed run
 * <p>
 * Spring wraps runner failures, so the whole cause chain is inspected.
 */
@Component
public class MergeExitCodeMapper implements ExitCodeExceptionMapper {

    /**
     * The merge was rejected or could not complete (bad arguments, missing bucket, nothing to merge)
     */
    public static final int MERGE_FAILED = 2;

    /**
     * Anything else, store and client errors included
     */
    public static final int UNEXPECTED_ERROR = 1;

    @Override
    public int getExitCode(Throwable exception) {
        for (Throwable cause = exception; cause != null; cause = cause.getCause()) {
            if (cause instanceof SpliceException) {
                return MERGE_FAILED;
            }
        }
        return UNEXPECTED_ERROR;
    }
}
