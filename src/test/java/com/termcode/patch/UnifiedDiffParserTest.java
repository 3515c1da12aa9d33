package com.termcode.patch;

import com.termcode.models.DiffLine;
import com.termcode.models.FileDiff;
import com.termcode.models.Hunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnifiedDiffParserTest {

    private final UnifiedDiffParser parser = new UnifiedDiffParser();

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    void parsesModifyWithTwoHunks() {
        String patch = lines(
            "diff --git a/src/App.java b/src/App.java",
            "index 123abc..456def 100644",
            "--- a/src/App.java",
            "+++ b/src/App.java",
            "@@ -1,3 +1,4 @@ class App",
            " line1",
            "-line2",
            "+line2 changed",
            "+added",
            " line3",
            "@@ -10,2 +11,2 @@",
            " ten",
            "-eleven",
            "+ELEVEN");

        List<FileDiff> files = parser.parse(patch);

        assertEquals(1, files.size());
        FileDiff file = files.get(0);
        assertEquals("src/App.java", file.getFile());
        assertEquals(FileDiff.Operation.MODIFY, file.getOperation());
        assertEquals(List.of("index 123abc..456def 100644", "--- a/src/App.java", "+++ b/src/App.java"),
            file.getHeaderLines());
        assertEquals(2, file.getHunks().size());

        Hunk first = file.getHunks().get(0);
        assertEquals(1, first.getOldStart());
        assertEquals(3, first.getOldCount());
        assertEquals(1, first.getNewStart());
        assertEquals(4, first.getNewCount());
        assertEquals("class App", first.getContext());
        assertEquals(5, first.getLines().size());
        assertEquals(DiffLine.Kind.CONTEXT, first.getLines().get(0).getKind());
        assertEquals(DiffLine.Kind.REMOVE, first.getLines().get(1).getKind());
        assertEquals(DiffLine.Kind.ADD, first.getLines().get(2).getKind());
        assertEquals("line2 changed", first.getLines().get(2).getContent());
        assertTrue(first.hasConsistentCounts());

        Hunk second = file.getHunks().get(1);
        assertEquals(10, second.getOldStart());
        assertEquals(11, second.getNewStart());
        assertEquals("", second.getContext());
    }

    @Test
    void tracksOldAndNewLineNumbers() {
        String patch = lines(
            "diff --git a/a.txt b/a.txt",
            "@@ -4,3 +4,3 @@",
            " keep",
            "-old",
            "+new",
            " tail");

        List<DiffLine> body = parser.parse(patch).get(0).getHunks().get(0).getLines();

        assertEquals(Integer.valueOf(4), body.get(0).getOldLineNumber());
        assertEquals(Integer.valueOf(4), body.get(0).getNewLineNumber());
        assertEquals(Integer.valueOf(5), body.get(1).getOldLineNumber());
        assertNull(body.get(1).getNewLineNumber());
        assertNull(body.get(2).getOldLineNumber());
        assertEquals(Integer.valueOf(5), body.get(2).getNewLineNumber());
        assertEquals(Integer.valueOf(6), body.get(3).getOldLineNumber());
        assertEquals(Integer.valueOf(6), body.get(3).getNewLineNumber());
    }

    @Test
    void missingCountsDefaultToOne() {
        String patch = lines(
            "diff --git a/a.txt b/a.txt",
            "@@ -5 +5 @@",
            "-x",
            "+y");

        Hunk hunk = parser.parse(patch).get(0).getHunks().get(0);

        assertEquals(5, hunk.getOldStart());
        assertEquals(1, hunk.getOldCount());
        assertEquals(5, hunk.getNewStart());
        assertEquals(1, hunk.getNewCount());
    }

    @Test
    void detectsCreatedFile() {
        String patch = lines(
            "diff --git a/docs/new.md b/docs/new.md",
            "new file mode 100644",
            "--- /dev/null",
            "+++ b/docs/new.md",
            "@@ -0,0 +1,2 @@",
            "+# Title",
            "+body");

        FileDiff file = parser.parse(patch).get(0);

        assertEquals(FileDiff.Operation.CREATE, file.getOperation());
        assertEquals("docs/new.md", file.getFile());
        assertEquals(2, file.getHunks().get(0).countNewSideLines());
    }

    @Test
    void detectsDeletedFile() {
        String patch = lines(
            "diff --git a/old.txt b/old.txt",
            "deleted file mode 100644",
            "--- a/old.txt",
            "+++ /dev/null",
            "@@ -1,2 +0,0 @@",
            "-a",
            "-b");

        FileDiff file = parser.parse(patch).get(0);

        assertEquals(FileDiff.Operation.DELETE, file.getOperation());
        assertEquals("old.txt", file.getFile());
    }

    @Test
    void detectsRename() {
        String patch = lines(
            "diff --git a/src/Old.java b/src/New.java",
            "similarity index 90%",
            "rename from src/Old.java",
            "rename to src/New.java",
            "@@ -1 +1 @@",
            "-class Old {}",
            "+class New {}");

        FileDiff file = parser.parse(patch).get(0);

        assertEquals(FileDiff.Operation.RENAME, file.getOperation());
        assertEquals("src/Old.java", file.getOldPath());
        assertEquals("src/New.java", file.getNewPath());
        assertEquals("src/New.java", file.getFile());
        assertEquals("diff --git a/src/Old.java b/src/New.java", file.gitHeader());
    }

    @Test
    void ignoresProseAroundDiff() {
        String patch = lines(
            "Here is the fix you asked for:",
            "",
            "diff --git a/a.txt b/a.txt",
            "--- a/a.txt",
            "+++ b/a.txt",
            "@@ -1,2 +1,2 @@",
            " first",
            "-second",
            "+SECOND",
            "",
            "Let me know if anything else needs changing.");

        List<FileDiff> files = parser.parse(patch);

        assertEquals(1, files.size());
        Hunk hunk = files.get(0).getHunks().get(0);
        assertEquals(3, hunk.getLines().size());
        assertTrue(hunk.hasConsistentCounts());
    }

    @Test
    void skipsMalformedFileHeaderButKeepsLaterBlocks() {
        String patch = lines(
            "diff --git broken header",
            "@@ -1 +1 @@",
            "-a",
            "+b",
            "diff --git a/ok.txt b/ok.txt",
            "@@ -1 +1 @@",
            "-c",
            "+d");

        UnifiedDiffParser.ParseResult result = parser.parseDetailed(patch);

        assertEquals(List.of("diff --git broken header"), result.getSkippedHeaders());
        assertEquals(1, result.getFiles().size());
        assertEquals("ok.txt", result.getFiles().get(0).getFile());
    }

    @Test
    void keepsNoNewlineMarkerOnlyInRawLines() {
        String patch = lines(
            "diff --git a/a.txt b/a.txt",
            "@@ -1 +1 @@",
            "-old",
            "\\ No newline at end of file",
            "+new",
            "\\ No newline at end of file");

        Hunk hunk = parser.parse(patch).get(0).getHunks().get(0);

        assertEquals(2, hunk.getLines().size());
        assertEquals(4, hunk.getRawLines().size());
        assertEquals("\\ No newline at end of file", hunk.toPatchLines().get(2));
    }

    @Test
    void blankLineInsideHunkIsEmptyContext() {
        String patch = lines(
            "diff --git a/a.txt b/a.txt",
            "@@ -1,3 +1,3 @@",
            " a",
            "",
            "-b",
            "+c");

        Hunk hunk = parser.parse(patch).get(0).getHunks().get(0);

        assertEquals(4, hunk.getLines().size());
        assertEquals(DiffLine.Kind.CONTEXT, hunk.getLines().get(1).getKind());
        assertEquals("", hunk.getLines().get(1).getContent());
        assertTrue(hunk.hasConsistentCounts());
    }

    @Test
    void parsesCrlfInput() {
        String patch = "diff --git a/a.txt b/a.txt\r\n@@ -1 +1 @@\r\n-x\r\n+y\r\n";

        Hunk hunk = parser.parse(patch).get(0).getHunks().get(0);

        assertEquals("x", hunk.getLines().get(0).getContent());
        assertEquals("y", hunk.getLines().get(1).getContent());
    }

    @Test
    void keepsFilesInSourceOrder() {
        String patch = lines(
            "diff --git a/b.txt b/b.txt",
            "@@ -1 +1 @@",
            "-1",
            "+2",
            "diff --git a/a.txt b/a.txt",
            "@@ -1 +1 @@",
            "-3",
            "+4");

        List<FileDiff> files = parser.parse(patch);

        assertEquals("b.txt", files.get(0).getFile());
        assertEquals("a.txt", files.get(1).getFile());
    }

    @Test
    void blankOrProseOnlyInputYieldsNothing() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("   \n\n").isEmpty());
        assertTrue(parser.parse("I could not produce a patch for this.").isEmpty());
    }
}
