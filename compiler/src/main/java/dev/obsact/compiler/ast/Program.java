package dev.obsact.compiler.ast;

import java.util.List;
import java.util.Objects;

/**
 * Root of a compiled unit: the device declarations followed by the commands, in source order.
 */
public record Program(List<DeviceDecl> devices, List<Command> commands) {

    public Program {
        devices = List.copyOf(Objects.requireNonNull(devices, "devices"));
        commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
        if (devices.isEmpty()) {
            throw new IllegalArgumentException("a program declares at least one device");
        }
        if (commands.isEmpty()) {
            throw new IllegalArgumentException("a program has at least one command");
        }
    }
}
