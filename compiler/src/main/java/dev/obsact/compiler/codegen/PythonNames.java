package dev.obsact.compiler.codegen;

import dev.obsact.compiler.ast.Action;
import dev.obsact.compiler.ast.AlertAction;
import dev.obsact.compiler.ast.Attribution;
import dev.obsact.compiler.ast.BroadcastAlertAction;
import dev.obsact.compiler.ast.Command;
import dev.obsact.compiler.ast.ConditionLink;
import dev.obsact.compiler.ast.Conditional;
import dev.obsact.compiler.ast.DeviceDecl;
import dev.obsact.compiler.ast.Program;
import dev.obsact.compiler.ast.SimpleAction;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Python variable names for the observations of one program.
 * <p>
 * An observation keeps its own name unless that name is a Python keyword or one of the names
 * the generated module itself refers to inside the entry point (the runtime functions and
 * {@code str}). Such a name gets trailing underscores until it is free, skipping any name the
 * program already uses, so {@code class} becomes {@code class_}, or {@code class__} when the
 * program also has a {@code class_}.
 */
final class PythonNames {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final Set<String> GENERATED = Set.of(
            "turnOn", "turnOff", "alert", "alertWithValue", "str");

    private final Map<String, String> renamed;

    private PythonNames(Map<String, String> renamed) {
        this.renamed = renamed;
    }

    static PythonNames forProgram(Program program) {
        Set<String> used = observationNames(program);
        Set<String> taken = new LinkedHashSet<>(used);
        Map<String, String> renamed = new HashMap<>();
        for (String name : used) {
            if (!isClaimed(name)) {
                continue;
            }
            String candidate = name + "_";
            while (isClaimed(candidate) || taken.contains(candidate)) {
                candidate += "_";
            }
            taken.add(candidate);
            renamed.put(name, candidate);
        }
        return new PythonNames(renamed);
    }

    String of(String observation) {
        return renamed.getOrDefault(observation, observation);
    }

    private static boolean isClaimed(String name) {
        return KEYWORDS.contains(name) || GENERATED.contains(name);
    }

    private static Set<String> observationNames(Program program) {
        Set<String> names = new LinkedHashSet<>();
        for (DeviceDecl device : program.devices()) {
            if (device.hasObservation()) {
                names.add(device.observation());
            }
        }
        Action.Visitor<Void> actions = new Action.Visitor<>() {
            @Override
            public Void visitSimpleAction(SimpleAction action) {
                return null;
            }

            @Override
            public Void visitAlertAction(AlertAction action) {
                addIfPresent(names, action.observation());
                return null;
            }

            @Override
            public Void visitBroadcastAlertAction(BroadcastAlertAction action) {
                addIfPresent(names, action.observation());
                return null;
            }
        };
        Command.Visitor<Void> commands = new Command.Visitor<>() {
            @Override
            public Void visitAttribution(Attribution attribution) {
                names.add(attribution.observation());
                return null;
            }

            @Override
            public Void visitConditional(Conditional conditional) {
                for (ConditionLink link : conditional.condition().links()) {
                    names.add(link.observation().name());
                }
                conditional.thenAction().accept(actions);
                if (conditional.hasElse()) {
                    conditional.elseAction().accept(actions);
                }
                return null;
            }

            @Override
            public Void visitAction(Action action) {
                return action.accept(actions);
            }
        };
        for (Command command : program.commands()) {
            command.accept(commands);
        }
        return names;
    }

    private static void addIfPresent(Set<String> names, String name) {
        if (name != null) {
            names.add(name);
        }
    }
}
