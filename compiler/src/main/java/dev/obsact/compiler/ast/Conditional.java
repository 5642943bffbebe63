package dev.obsact.compiler.ast;

import java.util.Objects;

/**
 * {@code if condition then action [else action]}. A null else-action means nothing happens
 * when the condition is false.
 */
public record Conditional(Condition condition, Action thenAction, Action elseAction) implements Command {

    public Conditional {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenAction, "thenAction");
    }

    public Conditional(Condition condition, Action thenAction) {
        this(condition, thenAction, null);
    }

    public boolean hasElse() {
        return elseAction != null;
    }

    @Override
    public <R> R accept(Command.Visitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
