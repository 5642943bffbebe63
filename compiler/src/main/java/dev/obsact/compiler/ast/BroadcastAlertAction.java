package dev.obsact.compiler.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code send alert ("message") for all : d1, d2, ...}. Lowered to one alert per device, in
 * list order.
 */
public record BroadcastAlertAction(String message, List<String> devices, String observation) implements Action {

    public BroadcastAlertAction {
        Objects.requireNonNull(message, "message");
        devices = List.copyOf(Objects.requireNonNull(devices, "devices"));
        if (devices.isEmpty()) {
            throw new IllegalArgumentException("a broadcast alert targets at least one device");
        }
    }

    public BroadcastAlertAction(String message, List<String> devices) {
        this(message, devices, null);
    }

    @Override
    public <R> R accept(Action.Visitor<R> visitor) {
        return visitor.visitBroadcastAlertAction(this);
    }
}
