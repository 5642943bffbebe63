package dev.obsact.compiler.ast;

public record IntegerLiteral(long value) implements Literal {

    @Override
    public <R> R accept(Literal.Visitor<R> visitor) {
        return visitor.visitInteger(this);
    }
}
