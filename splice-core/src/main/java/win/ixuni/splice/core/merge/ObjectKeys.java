package win.ixuni.splice.core.merge;

import static win.ixuni.splice.core.merge.MergeConstants.DOT;
import static win.ixuni.splice.core.merge.MergeConstants.OBJECTS_SEPARATOR;

/**
 * Key string helpers
 */
public final class ObjectKeys {

    private ObjectKeys() {
    }

    /**
     * Append the separator to a non-empty prefix that lacks it. Null and empty prefixes list the bucket root.
     */
    public static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return "";
        }
        return prefix.endsWith(OBJECTS_SEPARATOR) ? prefix : prefix + OBJECTS_SEPARATOR;
    }

    /**
     * Short name of a key: everything after the last separator
     */
    public static String extractName(String key) {
        return key.substring(key.lastIndexOf(OBJECTS_SEPARATOR) + 1);
    }

    /**
     * Extension of a key without the dot. A key without any dot is its own extension.
     */
    public static String extractExtension(String key) {
        return key.substring(key.lastIndexOf(DOT) + 1);
    }

    public static boolean isInformed(String value) {
        return value != null && !value.isEmpty();
    }
}
