package win.ixuni.splice.core.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ObjectKeysTest {

    @Test
    @DisplayName("Prefix without separator gets one appended")
    void normalizePrefix_appendsSeparator() {
        assertEquals("data/", ObjectKeys.normalizePrefix("data"));
        assertEquals("data/2024/", ObjectKeys.normalizePrefix("data/2024"));
    }

    @Test
    @DisplayName("Prefix normalization is idempotent")
    void normalizePrefix_isIdempotent() {
        for (String prefix : new String[]{"", "data", "data/", "a/b/c", "/"}) {
            String once = ObjectKeys.normalizePrefix(prefix);
            assertEquals(once, ObjectKeys.normalizePrefix(once), "prefix: " + prefix);
        }
    }

    @Test
    @DisplayName("Empty and null prefixes stay empty")
    void normalizePrefix_emptyStaysEmpty() {
        assertEquals("", ObjectKeys.normalizePrefix(""));
        assertEquals("", ObjectKeys.normalizePrefix(null));
    }

    @Test
    void extractName_returnsPartAfterLastSeparator() {
        assertEquals("job_part1.txt", ObjectKeys.extractName("data/job_part1.txt"));
        assertEquals("part.txt", ObjectKeys.extractName("a/b/c/part.txt"));
        assertEquals("root.txt", ObjectKeys.extractName("root.txt"));
        assertEquals("", ObjectKeys.extractName("data/"));
    }

    @Test
    void extractExtension_returnsPartAfterLastDot() {
        assertEquals("txt", ObjectKeys.extractExtension("data/result.txt"));
        assertEquals("gz", ObjectKeys.extractExtension("data/result.csv.gz"));
    }

    @Test
    @DisplayName("Key without a dot is its own extension")
    void extractExtension_withoutDot() {
        assertEquals("data/result", ObjectKeys.extractExtension("data/result"));
    }

    @Test
    void isInformed() {
        assertFalse(ObjectKeys.isInformed(null));
        assertFalse(ObjectKeys.isInformed(""));
        assertTrue(ObjectKeys.isInformed(" "));
        assertTrue(ObjectKeys.isInformed("bucket"));
    }
}
