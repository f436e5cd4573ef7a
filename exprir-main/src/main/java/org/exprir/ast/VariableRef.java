package org.exprir.ast;

import java.util.Objects;

/**
 * Symbolic reference to an identifier. No binding is resolved.
 */
public record VariableRef(String name) implements Expression {

    public VariableRef {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
