package dev.obsact.compiler.ast;

import java.util.Objects;

/**
 * {@code turnOn device} or {@code turnOff device}.
 */
public record SimpleAction(Toggle toggle, String device) implements Action {

    public SimpleAction {
        Objects.requireNonNull(toggle, "toggle");
        Objects.requireNonNull(device, "device");
    }

    @Override
    public <R> R accept(Action.Visitor<R> visitor) {
        return visitor.visitSimpleAction(this);
    }
}
