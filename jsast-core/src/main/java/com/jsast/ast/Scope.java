package com.jsast.ast;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Superclass for the nodes that can host local variables: {@link Program}, {@link FunctionNode},
 * {@link ArrowFunctionNode} and {@link CatchClause}.
 *
 * <p>The node model never fills the environment itself; a resolver pass does, and records the
 * declaring scope of each variable in {@link Name#scope()}.</p>
 */
public abstract sealed class Scope extends Node permits Program, FunctionNode, ArrowFunctionNode, CatchClause {

    /** The variable implicitly declared in every non-arrow function scope. */
    public static final String ARGUMENTS = "arguments";

    private Set<String> environment;

    /**
     * Variables declared in this scope, or null if no resolver has populated it yet.
     */
    public Set<String> environment() {
        return environment;
    }

    public void setEnvironment(Set<String> environment) {
        this.environment = environment;
    }

    /**
     * Adds {@code name} to the environment, creating it on first use.
     *
     * @return true if the name was not declared here before
     */
    public boolean declare(String name) {
        if (environment == null) {
            environment = new LinkedHashSet<>();
        }
        return environment.add(name);
    }

    /** True if {@code name} is declared directly in this scope. */
    public boolean isDeclared(String name) {
        return environment != null && environment.contains(name);
    }
}
