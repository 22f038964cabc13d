package com.raditha.staleflag.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.raditha.staleflag.model.Binding;
import com.raditha.staleflag.util.ASTUtility;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Builds the chain of scope tables visible at a node.
 * <p>
 * Walks from the node up to the compilation unit. Each enclosing construct that
 * introduces names contributes one table: locals declared earlier in enclosing
 * blocks, loop and resource variables, catch, lambda and method parameters, the
 * fields of enclosing types (with inherited project fields), and finally the
 * unit's static imports.
 */
public class ScopeAnalyzer {

    private final ProjectIndex index;

    public ScopeAnalyzer(ProjectIndex index) {
        this.index = index;
    }

    /**
     * Scope table in effect at the node, innermost first through {@link ScopeTable#getParent()}.
     */
    public ScopeTable scopeAt(Node node) {
        Deque<Frame> frames = new ArrayDeque<>();
        CompilationUnit cu = null;
        Node child = node;
        Node parent = node.getParentNode().orElse(null);
        while (parent != null) {
            if (parent instanceof CompilationUnit unit) {
                cu = unit;
                break;
            }
            List<Binding> declared = declarationsVisibleFrom(parent, child);
            if (!declared.isEmpty()) {
                frames.push(new Frame(parent, declared));
            }
            child = parent;
            parent = parent.getParentNode().orElse(null);
        }

        ScopeTable table = new ScopeTable(null, cu);
        if (cu != null) {
            index.staticImportBindings(cu).forEach(table::declare);
        }
        for (Frame frame : frames) {
            table = new ScopeTable(table, frame.owner());
            frame.bindings().forEach(table::declare);
        }
        return table;
    }

    private record Frame(Node owner, List<Binding> bindings) {
    }

    private List<Binding> declarationsVisibleFrom(Node parent, Node child) {
        if (parent instanceof BlockStmt block) {
            return localsBefore(block.getStatements(), child);
        }
        if (parent instanceof SwitchEntry entry) {
            return localsBefore(entry.getStatements(), child);
        }
        if (parent instanceof SwitchStmt switchStmt && child instanceof SwitchEntry) {
            return switchLocalsBefore(switchStmt, child);
        }
        if (parent instanceof VariableDeclarationExpr declaration) {
            return declaratorsBefore(declaration, child);
        }
        if (parent instanceof ForStmt forStmt) {
            if (ASTUtility.indexOf(forStmt.getInitialization(), child) >= 0) {
                return List.of();
            }
            List<Binding> locals = new ArrayList<>();
            forStmt.getInitialization().forEach(init -> locals.addAll(declaratorsOf(init)));
            return locals;
        }
        if (parent instanceof ForEachStmt forEach) {
            return child == forEach.getBody() ? declaratorsOf(forEach.getVariable()) : List.of();
        }
        if (parent instanceof TryStmt tryStmt) {
            return resourcesVisibleFrom(tryStmt, child);
        }
        if (parent instanceof CatchClause catchClause) {
            return List.of(parameterBinding(catchClause.getParameter()));
        }
        if (parent instanceof LambdaExpr lambda) {
            return lambda.getParameters().stream().map(ScopeAnalyzer::parameterBinding).toList();
        }
        if (parent instanceof CallableDeclaration<?> callable) {
            return callable.getParameters().stream().map(ScopeAnalyzer::parameterBinding).toList();
        }
        if (parent instanceof TypeDeclaration<?> type) {
            return typeFields(type);
        }
        if (parent instanceof ObjectCreationExpr creation) {
            return anonymousFields(creation, child);
        }
        return List.of();
    }

    private List<Binding> typeFields(TypeDeclaration<?> type) {
        Optional<String> fqn = type.getFullyQualifiedName();
        if (fqn.isPresent() && index.getType(fqn.get()).isPresent()) {
            return new ArrayList<>(index.fieldsOf(fqn.get()).values());
        }
        return ProjectIndex.fieldBindings(type, null);
    }

    private List<Binding> anonymousFields(ObjectCreationExpr creation, Node child) {
        Optional<NodeList<BodyDeclaration<?>>> body = creation.getAnonymousClassBody();
        if (body.isEmpty() || ASTUtility.indexOf(body.get(), child) < 0) {
            return List.of();
        }
        return ProjectIndex.memberBindings(body.get(), null, false);
    }

    private List<Binding> localsBefore(NodeList<Statement> statements, Node child) {
        int end = ASTUtility.indexOf(statements, child);
        if (end < 0) {
            end = statements.size();
        }
        List<Binding> locals = new ArrayList<>();
        for (int i = 0; i < end; i++) {
            if (statements.get(i) instanceof ExpressionStmt expressionStmt) {
                locals.addAll(declaratorsOf(expressionStmt.getExpression()));
            }
        }
        return locals;
    }

    private List<Binding> switchLocalsBefore(SwitchStmt switchStmt, Node child) {
        List<Binding> locals = new ArrayList<>();
        for (SwitchEntry entry : switchStmt.getEntries()) {
            if (entry == child) {
                break;
            }
            if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                locals.addAll(localsBefore(entry.getStatements(), null));
            }
        }
        return locals;
    }

    private List<Binding> declaratorsBefore(VariableDeclarationExpr declaration, Node child) {
        List<Binding> locals = new ArrayList<>();
        for (VariableDeclarator variable : declaration.getVariables()) {
            if (variable == child) {
                break;
            }
            locals.add(localBinding(variable));
        }
        return locals;
    }

    private List<Binding> resourcesVisibleFrom(TryStmt tryStmt, Node child) {
        int end;
        if (child == tryStmt.getTryBlock()) {
            end = tryStmt.getResources().size();
        } else {
            end = Math.max(ASTUtility.indexOf(tryStmt.getResources(), child), 0);
        }
        List<Binding> locals = new ArrayList<>();
        for (int i = 0; i < end; i++) {
            locals.addAll(declaratorsOf(tryStmt.getResources().get(i)));
        }
        return locals;
    }

    private static List<Binding> declaratorsOf(Expression expression) {
        if (expression instanceof VariableDeclarationExpr declaration) {
            return declaration.getVariables().stream().map(ScopeAnalyzer::localBinding).toList();
        }
        return List.of();
    }

    static Binding localBinding(VariableDeclarator variable) {
        return Binding.local(variable.getNameAsString(), variable, variable.getInitializer().orElse(null));
    }

    static Binding parameterBinding(Parameter parameter) {
        return Binding.parameter(parameter.getNameAsString(), parameter);
    }
}
