package com.raditha.staleflag.model;

import com.github.javaparser.ast.expr.MethodCallExpr;
import com.raditha.staleflag.analysis.ScopeTable;

import java.util.List;

/**
 * A flag-query call whose flag argument resolved to the target flag.
 *
 * @param call  the query call
 * @param chain bindings followed from the argument to the literal, in hop order;
 *              empty when the argument is the literal itself
 * @param scope scope table in effect at the call
 * @param range source location of the call
 */
public record MatchSite(MethodCallExpr call, List<Binding> chain, ScopeTable scope, Range range) {

    public MatchSite {
        chain = List.copyOf(chain);
    }

    @Override
    public String toString() {
        return call + " at " + range + (chain.isEmpty() ? "" : " via " + chain);
    }
}
