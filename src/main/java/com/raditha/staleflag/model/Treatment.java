package com.raditha.staleflag.model;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.StringLiteralExpr;

/**
 * The fixed outcome a stale flag is resolved to.
 *
 * @param kind  boolean, string or enum
 * @param value textual value: {@code true}/{@code false}, the raw string, or a
 *              qualified enum constant like {@code Variant.CONTROL}
 */
public record Treatment(TreatmentKind kind, String value) {

    public Treatment {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (kind == TreatmentKind.BOOLEAN && !value.equals("true") && !value.equals("false")) {
            throw new IllegalArgumentException("Boolean treatment must be true or false, got: " + value);
        }
        if (kind == TreatmentKind.ENUM && value.lastIndexOf('.') <= 0) {
            throw new IllegalArgumentException("Enum treatment must be qualified (Type.CONSTANT), got: " + value);
        }
    }

    public static Treatment ofBoolean(boolean value) {
        return new Treatment(TreatmentKind.BOOLEAN, Boolean.toString(value));
    }

    public static Treatment ofString(String value) {
        return new Treatment(TreatmentKind.STRING, value);
    }

    public static Treatment ofEnum(String qualifiedConstant) {
        return new Treatment(TreatmentKind.ENUM, qualifiedConstant);
    }

    public boolean isBoolean() {
        return kind == TreatmentKind.BOOLEAN;
    }

    /**
     * A fresh, detached expression for this treatment. Every call returns a new node.
     */
    public Expression toExpression() {
        return switch (kind) {
            case BOOLEAN -> new BooleanLiteralExpr(Boolean.parseBoolean(value));
            case STRING -> new StringLiteralExpr(value);
            case ENUM -> StaticJavaParser.parseExpression(value);
        };
    }

    /**
     * For enum treatments, the type part of {@code Variant.CONTROL}.
     */
    public String enumTypeName() {
        return kind == TreatmentKind.ENUM ? value.substring(0, value.lastIndexOf('.')) : null;
    }

    /**
     * For enum treatments, the constant part of {@code Variant.CONTROL}.
     */
    public String enumConstantName() {
        return kind == TreatmentKind.ENUM ? value.substring(value.lastIndexOf('.') + 1) : null;
    }

    @Override
    public String toString() {
        return kind == TreatmentKind.STRING ? "\"" + value + "\"" : value;
    }
}
