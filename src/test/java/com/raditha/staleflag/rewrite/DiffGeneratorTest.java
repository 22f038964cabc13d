package com.raditha.staleflag.rewrite;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DiffGenerator.
 */
class DiffGeneratorTest {

    private final DiffGenerator diffGenerator = new DiffGenerator();

    @Test
    void testUnifiedDiff() {
        String diff = diffGenerator.generateUnifiedDiff("flag/Client.java",
                "class A {\n    void a() {\n        if (on()) {\n            x();\n        }\n    }\n}",
                "class A {\n    void a() {\n        x();\n    }\n}");

        assertTrue(diff.startsWith("--- a/flag/Client.java"));
        assertTrue(diff.contains("+++ b/flag/Client.java"));
        assertTrue(diff.contains("-        if (on()) {"));
        assertTrue(diff.contains("+        x();"));
        assertTrue(diff.contains("@@"));
    }

    @Test
    void testNoChangesGivesEmptyDiff() {
        assertEquals("", diffGenerator.generateUnifiedDiff("A.java", "class A {}", "class A {}"));
    }

    @Test
    void testContextLines() {
        String original = "1\n2\n3\n4\n5\n6\n7";
        String rewritten = "1\n2\n3\nfour\n5\n6\n7";

        String narrow = diffGenerator.generateUnifiedDiff("A.java", original, rewritten, 0);
        String wide = diffGenerator.generateUnifiedDiff("A.java", original, rewritten, 3);

        assertFalse(narrow.contains(" 3"));
        assertTrue(wide.contains(" 3"));
        assertTrue(wide.contains(" 7"));
    }
}
