package com.raditha.staleflag.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.raditha.staleflag.model.Binding;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Counts references to project constants and enum constants in one unit.
 * Counts from all units are summed by the engine before any shared declaration
 * is deleted.
 */
public class ReferenceCounter {

    private final ProjectIndex index;
    private final BindingResolver bindings;

    public ReferenceCounter(ProjectIndex index, BindingResolver bindings) {
        this.index = index;
        this.bindings = bindings;
    }

    /**
     * References per constant key ({@code owner#name}) in the unit.
     */
    public Map<String, Integer> countSharedReferences(CompilationUnit cu) {
        Map<String, Integer> counts = new HashMap<>();
        for (NameExpr name : cu.findAll(NameExpr.class)) {
            Optional<Binding> binding = bindings.resolve(name);
            if (binding.isPresent()) {
                count(binding.get(), counts);
            } else if (isSwitchLabel(name)) {
                // enum case labels are resolved against the selector type, which is
                // not known here; count every enum constant of that name
                index.enumConstantsNamed(name.getNameAsString()).forEach(b -> count(b, counts));
            }
        }
        for (FieldAccessExpr access : cu.findAll(FieldAccessExpr.class)) {
            bindings.resolve(access).ifPresent(b -> count(b, counts));
        }
        return counts;
    }

    private static void count(Binding binding, Map<String, Integer> counts) {
        if (binding.kind().isShared() && binding.key() != null) {
            counts.merge(binding.key(), 1, Integer::sum);
        }
    }

    private static boolean isSwitchLabel(Expression expression) {
        return expression.getParentNode()
                .filter(SwitchEntry.class::isInstance)
                .map(SwitchEntry.class::cast)
                .map(entry -> entry.getLabels().stream().anyMatch(label -> label == expression))
                .orElse(false);
    }
}
