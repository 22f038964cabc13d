package com.raditha.staleflag.rewrite;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.raditha.staleflag.analysis.BindingResolver;
import com.raditha.staleflag.model.Binding;
import com.raditha.staleflag.model.BindingKind;
import com.raditha.staleflag.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Removes declarations that the rewrite left without references.
 * This acts as a garbage collector for flag keys and result variables.
 */
public class DeclarationCleanup {

    private static final Logger logger = LoggerFactory.getLogger(DeclarationCleanup.class);

    private final BindingResolver bindings;

    public DeclarationCleanup(BindingResolver bindings) {
        this.bindings = bindings;
    }

    /**
     * Remove candidate locals and private fields that have no references left.
     * Removing one declaration can orphan another, so candidates are swept until
     * nothing more goes.
     *
     * @return number of declarations removed
     */
    public int cleanLocals(CompilationUnit cu, Collection<VariableDeclarator> candidates) {
        int removed = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (VariableDeclarator declarator : candidates) {
                if (!ASTUtility.isAttached(declarator, cu)) {
                    continue;
                }
                Binding binding = bindings.bindingOf(declarator);
                if (isRemovable(binding) && bindings.findReferences(binding).isEmpty() && remove(declarator)) {
                    logger.debug("Removed unused {} {}", binding.kind(), binding.name());
                    removed++;
                    changed = true;
                }
            }
        }
        return removed;
    }

    private boolean isRemovable(Binding binding) {
        VariableDeclarator declarator = (VariableDeclarator) binding.declaration();
        boolean pure = declarator.getInitializer().map(ASTUtility::isSideEffectFree).orElse(true);
        if (!pure) {
            return false;
        }
        if (binding.kind() == BindingKind.LOCAL) {
            return declarator.getParentNode().filter(VariableDeclarationExpr.class::isInstance).isPresent();
        }
        return binding.kind() == BindingKind.FIELD
                && declarator.getParentNode()
                        .filter(FieldDeclaration.class::isInstance)
                        .map(p -> ((FieldDeclaration) p).isPrivate())
                        .orElse(false);
    }

    /**
     * Delete a project constant's declaration from its unit.
     *
     * @return true if the declaration was removed
     */
    public boolean removeSharedConstant(Binding constant) {
        if (!(constant.declaration() instanceof VariableDeclarator declarator)) {
            return false;
        }
        logger.info("Removing unused constant {}", constant.key());
        return remove(declarator);
    }

    /**
     * Drop {@code import static owner.NAME;} for a deleted constant.
     *
     * @param key constant key in {@code owner#name} form
     * @return number of imports removed
     */
    public int removeStaticImports(CompilationUnit cu, String key) {
        List<ImportDeclaration> matching = staticImportsOf(cu, key);
        matching.forEach(ImportDeclaration::remove);
        return matching.size();
    }

    public boolean hasStaticImport(CompilationUnit cu, String key) {
        return !staticImportsOf(cu, key).isEmpty();
    }

    private static List<ImportDeclaration> staticImportsOf(CompilationUnit cu, String key) {
        String imported = key.replace('#', '.');
        return cu.getImports().stream()
                .filter(i -> i.isStatic() && !i.isAsterisk() && i.getNameAsString().equals(imported))
                .toList();
    }

    private static boolean remove(VariableDeclarator declarator) {
        Node parent = declarator.getParentNode().orElse(null);
        if (parent instanceof FieldDeclaration field) {
            return field.getVariables().size() == 1 ? field.remove() : declarator.remove();
        }
        if (parent instanceof VariableDeclarationExpr declaration) {
            if (declaration.getVariables().size() > 1) {
                return declarator.remove();
            }
            if (declaration.getParentNode().orElse(null) instanceof ExpressionStmt statement
                    && ASTUtility.containingStatements(statement) != null) {
                ASTUtility.removeStatement(statement);
                return true;
            }
        }
        return false;
    }
}
