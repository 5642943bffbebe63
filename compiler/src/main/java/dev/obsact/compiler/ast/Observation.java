package dev.obsact.compiler.ast;

import java.util.Objects;

/**
 * A comparison of an observation against a literal, e.g. {@code temp > 20}.
 */
public record Observation(String name, RelationalOperator operator, Literal operand) {

    public Observation {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }
}
