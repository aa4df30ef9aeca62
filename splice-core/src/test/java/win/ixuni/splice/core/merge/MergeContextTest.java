package win.ixuni.splice.core.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergeContextTest {

    private static MergeContext context(String prefix) {
        return new MergeContext(MergeRequest.builder()
                .bucketName("bucket")
                .newObjectKey("out/result.txt")
                .objectsToMergeInitialName("part")
                .objectsToMergePrefix(prefix)
                .build());
    }

    private static String content(MergeContext ctx) {
        return new String(ctx.mergedContent(), StandardCharsets.UTF_8);
    }

    @Test
    void derivesPrefixAndExtension() {
        MergeContext ctx = context("out");
        assertEquals("out/", ctx.getPrefix());
        assertEquals("txt", ctx.getExtension());
    }

    @Test
    @DisplayName("Lines of consecutive objects are joined without a trailing line break")
    void appendLines_joinsObjects() {
        MergeContext ctx = context("");
        ctx.appendLines("part-0.txt", "a\nb\n");
        ctx.appendLines("part-1.txt", "c");

        assertEquals("a\nb\nc", content(ctx));
        assertEquals(List.of("part-0.txt", "part-1.txt"), ctx.getMergedKeys());
    }

    @Test
    @DisplayName("CRLF and CR terminators are normalized to LF")
    void appendLines_normalizesTerminators() {
        MergeContext ctx = context("");
        ctx.appendLines("part-0.txt", "a\r\nb\rc");

        assertEquals("a\nb\nc", content(ctx));
    }

    @Test
    @DisplayName("Blank lines inside an object are kept")
    void appendLines_keepsBlankLines() {
        MergeContext ctx = context("");
        ctx.appendLines("part-0.txt", "a\n\nb");

        assertEquals("a\n\nb", content(ctx));
    }

    @Test
    @DisplayName("Nothing merged yields empty content")
    void mergedContent_emptyWhenNothingMerged() {
        MergeContext ctx = context("");
        ctx.appendLines("empty.txt", "");

        assertEquals(0, ctx.mergedContent().length);
    }

    @Test
    void toResult_copiesCollectedKeys() {
        MergeContext ctx = context("out/");
        ctx.appendLines("out/part-0.txt", "x");
        ctx.deleted("out/part-0.txt");
        ctx.markerDeleted("out/_SUCCESS");

        MergeResult result = ctx.toResult(1);

        assertEquals("bucket", result.getBucketName());
        assertEquals("out/result.txt", result.getObjectKey());
        assertEquals("out/", result.getPrefix());
        assertEquals(List.of("out/part-0.txt"), result.getMergedKeys());
        assertEquals(List.of("out/part-0.txt"), result.getDeletedKeys());
        assertEquals(List.of("out/_SUCCESS"), result.getMarkerKeys());
        assertEquals(1, result.getSize());
    }
}
