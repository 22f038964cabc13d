package com.raditha.staleflag.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.staleflag.TestSources;
import com.raditha.staleflag.model.Binding;
import com.raditha.staleflag.model.BindingKind;
import com.raditha.staleflag.model.ErrorKind;
import com.raditha.staleflag.model.FlagCleanupException;
import com.raditha.staleflag.model.FlagSpec;
import com.raditha.staleflag.model.MatchSite;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReferenceResolver.
 */
class ReferenceResolverTest {

    private static final FlagSpec SPEC = FlagSpec.of("staleFlag", "exp.boolValue", true);

    private static ReferenceResolver.ResolutionResult resolve(String source, int maxHops) {
        CompilationUnit cu = TestSources.parse(source);
        BindingResolver bindings = new BindingResolver(ProjectIndex.build(Map.of("A.java", cu)));
        return new ReferenceResolver(bindings, maxHops).resolve(cu, SPEC);
    }

    @Test
    void testLiteralAndConstantArguments() {
        ReferenceResolver.ResolutionResult result = resolve("""
                class A {
                    private static final String STALE = "staleFlag";
                    private static final String OTHER = "otherFlag";
                    Experiments exp;

                    void run() {
                        exp.boolValue("staleFlag");
                        exp.boolValue(STALE);
                        exp.boolValue(OTHER);
                        exp.boolValue("otherFlag");
                        exp.strValue("staleFlag");
                    }
                }
                """, 8);

        List<MatchSite> sites = result.sites();
        assertEquals(2, sites.size());
        assertTrue(sites.get(0).chain().isEmpty());
        assertEquals(1, sites.get(1).chain().size());
        assertEquals(BindingKind.CONSTANT, sites.get(1).chain().get(0).kind());
        assertNotNull(sites.get(1).range());
        assertTrue(result.unsupported().isEmpty());
    }

    @Test
    void testShadowedConstantDoesNotMatch() {
        ReferenceResolver.ResolutionResult result = resolve("""
                class A {
                    static final String FLAG = "staleFlag";
                    Experiments exp;

                    void shadowed() {
                        String FLAG = "otherFlag";
                        exp.boolValue(FLAG);
                    }

                    void plain() {
                        exp.boolValue(FLAG);
                    }
                }
                """, 8);

        assertEquals(1, result.sites().size());
        assertEquals("plain", result.sites().get(0).call()
                .findAncestor(MethodDeclaration.class).orElseThrow().getNameAsString());
    }

    @Test
    void testLocalChain() {
        ReferenceResolver.ResolutionResult result = resolve("""
                class A {
                    static final String BASE = "staleFlag";
                    Experiments exp;

                    void run() {
                        String alias = BASE;
                        String key = alias;
                        exp.boolValue(key);
                    }
                }
                """, 8);

        MatchSite site = result.sites().get(0);
        assertEquals(List.of("key", "alias", "BASE"), site.chain().stream().map(Binding::name).toList());
    }

    @Test
    void testChainLongerThanHopLimit() {
        String source = """
                class A {
                    static final String K3 = "staleFlag";
                    static final String K2 = K3;
                    static final String K1 = K2;
                    Experiments exp;

                    void run() {
                        exp.boolValue(K1);
                    }
                }
                """;

        ReferenceResolver.ResolutionResult limited = resolve(source, 2);
        ReferenceResolver.ResolutionResult enough = resolve(source, 3);

        assertTrue(limited.sites().isEmpty());
        assertEquals(ErrorKind.RESOLUTION_DEPTH_EXCEEDED, limited.unsupported().get(0).kind());
        assertEquals(1, enough.sites().size());
        assertEquals(3, enough.sites().get(0).chain().size());
    }

    @Test
    void testCyclicChain() {
        ReferenceResolver.ResolutionResult result = resolve("""
                class A {
                    static final String A1 = A2;
                    static final String A2 = A1;
                    Experiments exp;

                    void run() {
                        exp.boolValue(A1);
                    }
                }
                """, 8);

        assertTrue(result.sites().isEmpty());
        assertEquals(ErrorKind.RESOLUTION_DEPTH_EXCEEDED, result.unsupported().get(0).kind());
    }

    @Test
    void testConflictingLiteralsAreAmbiguous() {
        String source = """
                class A {
                    Experiments exp;

                    void run(boolean admin) {
                        String key = "staleFlag";
                        if (admin) {
                            key = "adminFlag";
                        }
                        exp.boolValue(key);
                    }
                }
                """;

        FlagCleanupException e = assertThrows(FlagCleanupException.class, () -> resolve(source, 8));
        assertEquals(ErrorKind.AMBIGUOUS_BINDING, e.getKind());
        assertTrue(e.getKind().skipsUnit());
    }

    @Test
    void testReassignmentBetweenOtherFlagsIsNotAMatch() {
        ReferenceResolver.ResolutionResult result = resolve("""
                class A {
                    Experiments exp;

                    void run(boolean admin) {
                        String key = "alpha";
                        if (admin) {
                            key = "beta";
                        }
                        exp.boolValue(key);
                    }
                }
                """, 8);

        assertTrue(result.sites().isEmpty());
        assertTrue(result.unsupported().isEmpty());
    }

    @Test
    void testUnknownArgumentIsIgnored() {
        ReferenceResolver.ResolutionResult result = resolve("""
                class A {
                    Experiments exp;

                    void run(String name) {
                        exp.boolValue(name);
                        exp.boolValue(lookup());
                        exp.boolValue(External.FLAG);
                    }
                }
                """, 8);

        assertTrue(result.sites().isEmpty());
        assertTrue(result.unsupported().isEmpty());
    }

    @Test
    void testStaticImportAcrossUnits() {
        Map<String, CompilationUnit> units = TestSources.parseAll(Map.of(
                "com/acme/Flags.java", """
                        package com.acme;

                        public interface Flags {
                            String STALE = "staleFlag";
                        }
                        """,
                "com/acme/web/Page.java", """
                        package com.acme.web;

                        import static com.acme.Flags.*;

                        class Page {
                            Experiments exp;

                            void render() {
                                if (exp.boolValue(STALE)) {
                                    show();
                                }
                            }
                        }
                        """));
        BindingResolver bindings = new BindingResolver(ProjectIndex.build(units));

        ReferenceResolver.ResolutionResult result =
                new ReferenceResolver(bindings, 8).resolve(units.get("com/acme/web/Page.java"), SPEC);

        assertEquals(1, result.sites().size());
        assertEquals("com.acme.Flags#STALE", result.sites().get(0).chain().get(0).key());
        assertTrue(result.sites().get(0).chain().get(0).exported());
    }
}
