package dev.obsact.compiler.ast;

/**
 * One top-level statement, terminated by a period in the source.
 */
public sealed interface Command permits Attribution, Conditional, Action {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visitAttribution(Attribution attribution);

        R visitConditional(Conditional conditional);

        R visitAction(Action action);
    }
}
