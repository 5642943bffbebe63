package dev.obsact.compiler.ast;

import java.util.Objects;

/**
 * {@code device : name} or {@code device : name, observation}. The observation is null when
 * the device binds none.
 */
public record DeviceDecl(String name, String observation) {

    public DeviceDecl {
        Objects.requireNonNull(name, "name");
    }

    public DeviceDecl(String name) {
        this(name, null);
    }

    public boolean hasObservation() {
        return observation != null;
    }
}
