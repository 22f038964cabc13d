package com.raditha.staleflag.model;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;

/**
 * A name-to-value association created by a declaration.
 *
 * @param name        the declared name
 * @param kind        what declared it
 * @param declaration the declaring node (VariableDeclarator, Parameter or EnumConstantDeclaration)
 * @param initializer the initializer expression, null when there is none
 * @param ownerType   fully qualified name of the declaring type for fields, null otherwise
 * @param exported    true when visible outside the declaring package or type hierarchy
 * @param privateMember true for private fields, which subtypes do not inherit
 */
public record Binding(
        String name,
        BindingKind kind,
        Node declaration,
        Expression initializer,
        String ownerType,
        boolean exported,
        boolean privateMember) {

    public static Binding local(String name, Node declaration, Expression initializer) {
        return new Binding(name, BindingKind.LOCAL, declaration, initializer, null, false, false);
    }

    public static Binding parameter(String name, Node declaration) {
        return new Binding(name, BindingKind.PARAMETER, declaration, null, null, false, false);
    }

    /**
     * Project-wide key for fields of named types, e.g. {@code com.acme.Flags#STALE}.
     * Null for locals, parameters and members of anonymous classes.
     */
    public String key() {
        if (ownerType == null) {
            return null;
        }
        return ownerType + "#" + name;
    }

    /**
     * Whether both bindings come from the same declaration node. Node equality in
     * JavaParser is structural, so this compares identity.
     */
    public boolean sameDeclaration(Binding other) {
        return other != null && declaration == other.declaration;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Binding other && sameDeclaration(other);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(declaration);
    }

    @Override
    public String toString() {
        String key = key();
        return kind + " " + (key != null ? key : name);
    }
}
