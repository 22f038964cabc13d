package com.raditha.staleflag.util;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.staleflag.TestSources;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ASTUtility.
 */
class ASTUtilityTest {

    private static final String SOURCE = """
            class A {
                void run(int n) {
                    System.out.println("x");
                    System.out.println("x");
                    if (n > 0) {
                        go();
                    } else {
                        stop();
                    }
                }
            }
            """;

    private static NodeList<Statement> body(CompilationUnit cu) {
        return cu.findFirst(MethodDeclaration.class).orElseThrow().getBody().orElseThrow().getStatements();
    }

    @Test
    void testIndexOfUsesIdentity() {
        CompilationUnit cu = TestSources.parse(SOURCE);
        NodeList<Statement> statements = body(cu);

        assertEquals(statements.get(0), statements.get(1));
        assertEquals(1, ASTUtility.indexOf(statements, statements.get(1)));
        assertEquals(-1, ASTUtility.indexOf(statements, statements.get(1).clone()));
    }

    @Test
    void testRemoveStatementFromBlock() {
        CompilationUnit cu = TestSources.parse(SOURCE);
        Statement second = body(cu).get(1);

        Node parent = ASTUtility.removeStatement(second);

        assertInstanceOf(BlockStmt.class, parent);
        assertEquals(2, body(cu).size());
        assertFalse(ASTUtility.isAttached(second, cu));
        assertTrue(ASTUtility.isAttached(body(cu).get(0), cu));
    }

    @Test
    void testRemoveElseStatement() {
        CompilationUnit cu = TestSources.parse(SOURCE);
        IfStmt ifStmt = cu.findFirst(IfStmt.class).orElseThrow();

        ASTUtility.removeStatement(ifStmt.getElseStmt().orElseThrow());

        assertTrue(ifStmt.getElseStmt().isEmpty());
    }

    @Test
    void testSpliceStatements() {
        CompilationUnit cu = TestSources.parse(SOURCE);
        IfStmt ifStmt = cu.findFirst(IfStmt.class).orElseThrow();
        List<Statement> replacement = List.of(
                StaticJavaParser.parseStatement("a();"),
                StaticJavaParser.parseStatement("b();"));

        ASTUtility.spliceStatements(ifStmt, replacement);

        assertEquals(List.of("System.out.println(\"x\");", "System.out.println(\"x\");", "a();", "b();"),
                body(cu).stream().map(Statement::toString).toList());
    }

    @Test
    void testSpliceIntoNonBlockWrapsSeveral() {
        CompilationUnit cu = TestSources.parse(SOURCE);
        IfStmt ifStmt = cu.findFirst(IfStmt.class).orElseThrow();

        ASTUtility.spliceStatements(ifStmt.getThenStmt(), List.of(
                StaticJavaParser.parseStatement("a();"),
                StaticJavaParser.parseStatement("b();")));

        assertInstanceOf(BlockStmt.class, ifStmt.getThenStmt());
        assertEquals(2, ifStmt.getThenStmt().asBlockStmt().getStatements().size());
    }

    @Test
    void testReplaceExpressionInArguments() {
        MethodCallExpr call = StaticJavaParser.parseExpression("log(a, a)").asMethodCallExpr();
        BooleanLiteralExpr literal = new BooleanLiteralExpr(true);

        ASTUtility.replaceExpression(call.getArgument(1), literal);

        assertEquals("log(a, true)", call.toString());
    }

    @Test
    void testReplaceDetachedExpressionFails() {
        assertThrows(IllegalStateException.class,
                () -> ASTUtility.replaceExpression(new BooleanLiteralExpr(true), new BooleanLiteralExpr(false)));
    }

    @Test
    void testIsTerminator() {
        assertTrue(ASTUtility.isTerminator(StaticJavaParser.parseStatement("return;")));
        assertTrue(ASTUtility.isTerminator(StaticJavaParser.parseStatement("throw new IllegalStateException();")));
        assertTrue(ASTUtility.isTerminator(StaticJavaParser.parseStatement("break;")));
        assertTrue(ASTUtility.isTerminator(StaticJavaParser.parseStatement("continue;")));
        assertFalse(ASTUtility.isTerminator(StaticJavaParser.parseStatement("go();")));
    }

    @Test
    void testIsSideEffectFree() {
        assertTrue(ASTUtility.isSideEffectFree(StaticJavaParser.parseExpression("a && !b")));
        assertTrue(ASTUtility.isSideEffectFree(StaticJavaParser.parseExpression("this.x == Flags.Y")));
        assertTrue(ASTUtility.isSideEffectFree(StaticJavaParser.parseExpression("c ? \"x\" : (String) y")));
        assertFalse(ASTUtility.isSideEffectFree(StaticJavaParser.parseExpression("i++")));
        assertFalse(ASTUtility.isSideEffectFree(StaticJavaParser.parseExpression("--i > 0")));
        assertFalse(ASTUtility.isSideEffectFree(StaticJavaParser.parseExpression("a && check()")));
        assertFalse(ASTUtility.isSideEffectFree(StaticJavaParser.parseExpression("new Object()")));
    }

    @Test
    void testIncrementOrDecrement() {
        assertTrue(ASTUtility.isIncrementOrDecrement(UnaryExpr.Operator.PREFIX_INCREMENT));
        assertTrue(ASTUtility.isIncrementOrDecrement(UnaryExpr.Operator.POSTFIX_DECREMENT));
        assertFalse(ASTUtility.isIncrementOrDecrement(UnaryExpr.Operator.LOGICAL_COMPLEMENT));
        assertFalse(ASTUtility.isIncrementOrDecrement(UnaryExpr.Operator.MINUS));
    }

    @Test
    void testDeclaredNamesAndDepth() {
        CompilationUnit cu = TestSources.parse("""
                class A {
                    void run(int n) {
                        for (int i = 0; i < n; i++) {
                            int j = i;
                        }
                    }
                }
                """);
        MethodDeclaration run = cu.findFirst(MethodDeclaration.class).orElseThrow();

        assertEquals(Set.of("n", "i", "j"), ASTUtility.declaredNames(run));
        assertTrue(ASTUtility.depth(run.getBody().orElseThrow()) > ASTUtility.depth(run));
        assertEquals(0, ASTUtility.depth(cu));
    }
}
