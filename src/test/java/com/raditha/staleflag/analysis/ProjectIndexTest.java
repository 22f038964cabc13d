package com.raditha.staleflag.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.raditha.staleflag.TestSources;
import com.raditha.staleflag.model.Binding;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProjectIndex.
 */
class ProjectIndexTest {

    private static ProjectIndex index() {
        Map<String, CompilationUnit> units = new LinkedHashMap<>();
        units.put("p/Root.java", TestSources.parse("""
                package p;

                public class Root {
                    protected final String key = "staleFlag";
                    private String secret = "hidden";
                }
                """));
        units.put("p/Mid.java", TestSources.parse("""
                package p;

                public class Mid extends Root {
                    String label = "mid";
                }
                """));
        units.put("q/Leaf.java", TestSources.parse("""
                package q;

                import p.Mid;

                public class Leaf extends Mid implements Marker {
                    private String label = "leaf";
                }
                """));
        units.put("q/Marker.java", TestSources.parse("""
                package q;

                interface Marker {
                    String TAG = "marker";
                }
                """));
        return ProjectIndex.build(units);
    }

    @Test
    void testSupertypesResolvedWhileBuilding() {
        ProjectIndex index = index();

        assertEquals(List.of("p.Mid", "q.Marker"), index.getType("q.Leaf").orElseThrow().supertypes());
        assertEquals(List.of("p.Root"), index.getType("p.Mid").orElseThrow().supertypes());
        assertTrue(index.getType("p.Root").orElseThrow().supertypes().isEmpty());
        assertEquals("q/Leaf.java", index.getType("q.Leaf").orElseThrow().unitName());
    }

    @Test
    void testVisibleFieldsFollowInheritance() {
        Map<String, Binding> fields = index().fieldsOf("q.Leaf");

        assertEquals("q.Leaf", fields.get("label").ownerType());
        assertEquals("p.Root", fields.get("key").ownerType());
        assertEquals("q.Marker", fields.get("TAG").ownerType());
        assertFalse(fields.containsKey("secret"));
        assertTrue(index().fieldsOf("p.Root").containsKey("secret"));
    }

    @Test
    void testPrivacyCapturedOnBinding() {
        ProjectIndex index = index();

        assertTrue(index.findByKey("p.Root#secret").orElseThrow().privateMember());
        assertFalse(index.findByKey("p.Root#key").orElseThrow().privateMember());
        assertThrows(UnsupportedOperationException.class, () -> index.fieldsOf("q.Leaf").clear());
        assertTrue(index.fieldsOf("q.Unknown").isEmpty());
    }
}
