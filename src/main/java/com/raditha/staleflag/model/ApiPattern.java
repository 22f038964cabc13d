package com.raditha.staleflag.model;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;

import java.util.Optional;

/**
 * The call shape that queries a flag, e.g. {@code experiments.isEnabled} with
 * the flag identifier at argument 0.
 *
 * @param qualifier     receiver text; {@code *} matches any receiver and an empty
 *                      qualifier matches an unqualified call
 * @param methodName    name of the query method
 * @param argumentIndex position of the argument holding the flag identifier
 */
public record ApiPattern(String qualifier, String methodName, int argumentIndex) {

    public static final String ANY_RECEIVER = "*";

    public ApiPattern {
        if (methodName == null || methodName.isBlank()) {
            throw new IllegalArgumentException("methodName cannot be empty");
        }
        if (argumentIndex < 0) {
            throw new IllegalArgumentException("argumentIndex must be >= 0");
        }
        if (qualifier == null) {
            qualifier = "";
        }
    }

    /**
     * Parse {@code receiver.method} or {@code receiver.method#index}.
     */
    public static ApiPattern parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("API pattern cannot be empty");
        }
        String shape = pattern.trim();
        int index = 0;
        int hash = shape.indexOf('#');
        if (hash >= 0) {
            try {
                index = Integer.parseInt(shape.substring(hash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid argument index in API pattern: " + pattern, e);
            }
            shape = shape.substring(0, hash);
        }
        return parse(shape, index);
    }

    public static ApiPattern parse(String qualifiedMethod, int argumentIndex) {
        int dot = qualifiedMethod.lastIndexOf('.');
        if (dot < 0) {
            return new ApiPattern("", qualifiedMethod, argumentIndex);
        }
        return new ApiPattern(qualifiedMethod.substring(0, dot), qualifiedMethod.substring(dot + 1), argumentIndex);
    }

    /**
     * Whether the call has this pattern's method name, receiver and enough arguments.
     * Matching the call says nothing about which flag it queries.
     */
    public boolean matches(MethodCallExpr call) {
        if (!call.getNameAsString().equals(methodName) || call.getArguments().size() <= argumentIndex) {
            return false;
        }
        if (ANY_RECEIVER.equals(qualifier)) {
            return true;
        }
        Optional<Expression> scope = call.getScope();
        if (scope.isEmpty()) {
            return qualifier.isEmpty();
        }
        String receiver = scope.get().toString();
        if (receiver.startsWith("this.")) {
            receiver = receiver.substring("this.".length());
        }
        return receiver.equals(qualifier);
    }

    public Expression flagArgument(MethodCallExpr call) {
        return call.getArgument(argumentIndex);
    }

    @Override
    public String toString() {
        String method = qualifier.isEmpty() ? methodName : qualifier + "." + methodName;
        return method + "#" + argumentIndex;
    }
}
