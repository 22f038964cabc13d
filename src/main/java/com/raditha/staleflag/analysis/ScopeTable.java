package com.raditha.staleflag.analysis;

import com.github.javaparser.ast.Node;
import com.raditha.staleflag.model.Binding;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name-to-binding map for one lexical scope, linked to its enclosing scope.
 */
public class ScopeTable {

    private final ScopeTable parent;
    private final Node owner;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    public ScopeTable(ScopeTable parent, Node owner) {
        this.parent = parent;
        this.owner = owner;
    }

    public void declare(Binding binding) {
        bindings.put(binding.name(), binding);
    }

    /**
     * Innermost binding visible under the name.
     */
    public Optional<Binding> lookup(String name) {
        for (ScopeTable table = this; table != null; table = table.parent) {
            Binding binding = table.bindings.get(name);
            if (binding != null) {
                return Optional.of(binding);
            }
        }
        return Optional.empty();
    }

    public Optional<Binding> lookupLocal(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * True when this scope declares the name and an enclosing scope declares it too.
     */
    public boolean shadows(String name) {
        return bindings.containsKey(name) && parent != null && parent.lookup(name).isPresent();
    }

    /**
     * The scope that actually holds the visible binding for the name.
     */
    public Optional<ScopeTable> declaringScope(String name) {
        for (ScopeTable table = this; table != null; table = table.parent) {
            if (table.bindings.containsKey(name)) {
                return Optional.of(table);
            }
        }
        return Optional.empty();
    }

    public ScopeTable getParent() {
        return parent;
    }

    /**
     * The node that opens this scope. Compared by identity when scopes are matched.
     */
    public Node getOwner() {
        return owner;
    }

    public Collection<Binding> getBindings() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    @Override
    public String toString() {
        String ownerName = owner == null ? "<root>" : owner.getClass().getSimpleName();
        return ownerName + bindings.keySet();
    }
}
