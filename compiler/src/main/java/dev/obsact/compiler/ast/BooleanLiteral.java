package dev.obsact.compiler.ast;

public record BooleanLiteral(boolean value) implements Literal {

    @Override
    public <R> R accept(Literal.Visitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
