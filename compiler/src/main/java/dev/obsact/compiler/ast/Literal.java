package dev.obsact.compiler.ast;

/**
 * A typed constant: an integer or a boolean.
 */
public sealed interface Literal permits IntegerLiteral, BooleanLiteral {

    <R> R accept(Visitor<R> visitor);

    static Literal of(long value) {
        return new IntegerLiteral(value);
    }

    static Literal of(boolean value) {
        return new BooleanLiteral(value);
    }

    interface Visitor<R> {

        R visitInteger(IntegerLiteral literal);

        R visitBoolean(BooleanLiteral literal);
    }
}
