package win.ixuni.splice.core.merge;

import java.util.List;

/**
 * Fixed names and separators used by the merger
 */
public final class MergeConstants {

    public static final String OBJECTS_SEPARATOR = "/";
    public static final String DOT = ".";
    public static final String LINE_BREAK = "\n";

    /**
     * Completion marker written by Hadoop/Spark output committers
     */
    public static final String SUCCESS_NO_EXTENSION = "_SUCCESS";
    public static final String SUCCESS_WITH_CRC_EXTENSION = DOT + SUCCESS_NO_EXTENSION + ".crc";

    public static final List<String> DEFAULT_MARKER_FILES = List.of(SUCCESS_NO_EXTENSION, SUCCESS_WITH_CRC_EXTENSION);

    public static final int DEFAULT_LIST_PAGE_SIZE = 1000;

    public static final String MERGED_CONTENT_TYPE = "text/plain";

    private MergeConstants() {
    }
}
