package dev.obsact.compiler.ast;

import java.util.Objects;

/**
 * {@code set observation = literal}.
 */
public record Attribution(String observation, Literal value) implements Command {

    public Attribution {
        Objects.requireNonNull(observation, "observation");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(Command.Visitor<R> visitor) {
        return visitor.visitAttribution(this);
    }
}
