package com.raditha.staleflag.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.raditha.staleflag.model.Binding;
import com.raditha.staleflag.model.BindingKind;
import com.raditha.staleflag.util.ASTUtility;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves names to the declarations that bind them.
 * <p>
 * Resolution goes strictly through scope tables and the project index. A method
 * called {@code isEnabled} and a local called {@code isEnabled} are different
 * things here because only {@link NameExpr} and {@link FieldAccessExpr} nodes are
 * ever resolved, and each against the scope it appears in.
 */
public class BindingResolver {

    private final ProjectIndex index;
    private final ScopeAnalyzer scopes;

    public BindingResolver(ProjectIndex index) {
        this(index, new ScopeAnalyzer(index));
    }

    public BindingResolver(ProjectIndex index, ScopeAnalyzer scopes) {
        this.index = index;
        this.scopes = scopes;
    }

    public ScopeAnalyzer getScopeAnalyzer() {
        return scopes;
    }

    /**
     * The binding a name or field access refers to, if it is declared in the project.
     */
    public Optional<Binding> resolve(Expression expression) {
        Expression expr = unwrap(expression);
        if (expr instanceof NameExpr name) {
            return scopes.scopeAt(name).lookup(name.getNameAsString());
        }
        if (expr instanceof FieldAccessExpr access) {
            return resolveFieldAccess(access);
        }
        return Optional.empty();
    }

    private Optional<Binding> resolveFieldAccess(FieldAccessExpr access) {
        Expression scope = access.getScope();
        String member = access.getNameAsString();
        if (scope.isThisExpr() && scope.asThisExpr().getTypeName().isEmpty()) {
            return lookupField(scopes.scopeAt(access), member);
        }
        if (!(scope instanceof NameExpr) && !(scope instanceof FieldAccessExpr)) {
            return Optional.empty();
        }
        if (scope instanceof NameExpr name && scopes.scopeAt(name).lookup(name.getNameAsString()).isPresent()) {
            // a variable, not a type name
            return Optional.empty();
        }
        Optional<CompilationUnit> cu = access.findCompilationUnit();
        if (cu.isEmpty()) {
            return Optional.empty();
        }
        return index.resolveType(cu.get(), scope.toString())
                .map(type -> index.fieldsOf(type).get(member));
    }

    private static Optional<Binding> lookupField(ScopeTable table, String name) {
        for (ScopeTable t = table; t != null; t = t.getParent()) {
            Optional<Binding> binding = t.lookupLocal(name);
            if (binding.isPresent() && binding.get().kind() != BindingKind.LOCAL
                    && binding.get().kind() != BindingKind.PARAMETER) {
                return binding;
            }
        }
        return Optional.empty();
    }

    /**
     * The binding introduced by a variable declarator.
     */
    public Binding bindingOf(VariableDeclarator declarator) {
        Node parent = declarator.getParentNode().orElse(null);
        if (parent instanceof FieldDeclaration) {
            Optional<Binding> indexed = enclosingTypeName(declarator)
                    .map(index::fieldsOf)
                    .map(fields -> fields.get(declarator.getNameAsString()))
                    .filter(b -> b.declaration() == declarator);
            if (indexed.isPresent()) {
                return indexed.get();
            }
            FieldDeclaration field = (FieldDeclaration) parent;
            return new Binding(declarator.getNameAsString(), BindingKind.FIELD, declarator,
                    declarator.getInitializer().orElse(null), null, field.isPublic() || field.isProtected(),
                    field.isPrivate());
        }
        return ScopeAnalyzer.localBinding(declarator);
    }

    private static Optional<String> enclosingTypeName(Node node) {
        for (Node n = node.getParentNode().orElse(null); n != null; n = n.getParentNode().orElse(null)) {
            if (n instanceof TypeDeclaration<?> type) {
                return type.getFullyQualifiedName();
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the declaration cannot be reassigned by the language itself.
     */
    public boolean isFinal(Binding binding) {
        if (binding.kind().isShared()) {
            return true;
        }
        Node parent = binding.declaration().getParentNode().orElse(null);
        if (parent instanceof VariableDeclarationExpr declaration) {
            return declaration.isFinal();
        }
        if (parent instanceof FieldDeclaration field) {
            return field.isFinal();
        }
        return false;
    }

    /**
     * Values assigned to the binding after its declaration. Compound assignments
     * and increments are returned as the whole expression, which never resolves
     * to a literal.
     */
    public List<Expression> assignedValues(Binding binding) {
        List<Expression> values = new ArrayList<>();
        if (isFinal(binding)) {
            return values;
        }
        Node root = searchRoot(binding);
        for (AssignExpr assign : root.findAll(AssignExpr.class)) {
            if (refersTo(assign.getTarget(), binding)) {
                values.add(assign.getOperator() == AssignExpr.Operator.ASSIGN ? assign.getValue() : assign);
            }
        }
        for (UnaryExpr unary : root.findAll(UnaryExpr.class)) {
            if (ASTUtility.isIncrementOrDecrement(unary.getOperator())
                    && refersTo(unary.getExpression(), binding)) {
                values.add(unary);
            }
        }
        return values;
    }

    /**
     * All reads and writes of the binding inside the part of the tree where it can
     * be referenced: the enclosing member for locals, the whole unit for fields.
     */
    public List<Expression> findReferences(Binding binding) {
        List<Expression> references = new ArrayList<>();
        Node root = searchRoot(binding);
        for (NameExpr name : root.findAll(NameExpr.class)) {
            if (refersTo(name, binding)) {
                references.add(name);
            }
        }
        if (binding.kind() != BindingKind.LOCAL && binding.kind() != BindingKind.PARAMETER) {
            for (FieldAccessExpr access : root.findAll(FieldAccessExpr.class)) {
                if (refersTo(access, binding)) {
                    references.add(access);
                }
            }
        }
        return references;
    }

    private boolean refersTo(Expression expression, Binding binding) {
        Expression expr = unwrap(expression);
        String name;
        if (expr instanceof NameExpr nameExpr) {
            name = nameExpr.getNameAsString();
        } else if (expr instanceof FieldAccessExpr access) {
            name = access.getNameAsString();
        } else {
            return false;
        }
        return name.equals(binding.name()) && resolve(expr).map(binding::sameDeclaration).orElse(false);
    }

    private static Node searchRoot(Binding binding) {
        Node declaration = binding.declaration();
        if (binding.kind() == BindingKind.LOCAL || binding.kind() == BindingKind.PARAMETER) {
            for (Node n = declaration.getParentNode().orElse(null); n != null; n = n.getParentNode().orElse(null)) {
                if (n instanceof BodyDeclaration<?>) {
                    return n;
                }
            }
        }
        Optional<CompilationUnit> cu = declaration.findCompilationUnit();
        return cu.isPresent() ? cu.get() : declaration.findRootNode();
    }

    public static Expression unwrap(Expression expression) {
        Expression expr = expression;
        while (expr instanceof EnclosedExpr enclosed) {
            expr = enclosed.getInner();
        }
        return expr;
    }
}
