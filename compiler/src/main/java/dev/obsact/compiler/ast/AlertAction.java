package dev.obsact.compiler.ast;

import java.util.Objects;

/**
 * {@code send alert ("message") device} or {@code send alert ("message", observation) device}.
 * When an observation is attached, the alert carries its value at run time.
 */
public record AlertAction(String message, String device, String observation) implements Action {

    public AlertAction {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(device, "device");
    }

    public AlertAction(String message, String device) {
        this(message, device, null);
    }

    @Override
    public <R> R accept(Action.Visitor<R> visitor) {
        return visitor.visitAlertAction(this);
    }
}
