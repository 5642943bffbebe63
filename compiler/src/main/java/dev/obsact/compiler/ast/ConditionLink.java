package dev.obsact.compiler.ast;

import java.util.Objects;

/**
 * One comparison of a condition and the combinator that joins it to the next link, or null
 * on the last link.
 */
public record ConditionLink(Observation observation, Combinator next) {

    public ConditionLink {
        Objects.requireNonNull(observation, "observation");
    }

    public boolean isLast() {
        return next == null;
    }
}
