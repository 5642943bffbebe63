package dev.obsact.compiler.codegen;

import dev.obsact.compiler.ast.Action;
import dev.obsact.compiler.ast.AlertAction;
import dev.obsact.compiler.ast.Attribution;
import dev.obsact.compiler.ast.BooleanLiteral;
import dev.obsact.compiler.ast.BroadcastAlertAction;
import dev.obsact.compiler.ast.Combinator;
import dev.obsact.compiler.ast.Command;
import dev.obsact.compiler.ast.Condition;
import dev.obsact.compiler.ast.ConditionLink;
import dev.obsact.compiler.ast.Conditional;
import dev.obsact.compiler.ast.DeviceDecl;
import dev.obsact.compiler.ast.IntegerLiteral;
import dev.obsact.compiler.ast.Literal;
import dev.obsact.compiler.ast.Observation;
import dev.obsact.compiler.ast.Program;
import dev.obsact.compiler.ast.SimpleAction;
import dev.obsact.compiler.ast.SourceForm;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lowers an ObsAct {@link Program} into a Python module that drives devices through four
 * runtime functions: {@code turnOn(device)}, {@code turnOff(device)},
 * {@code alert(device, message)} and {@code alertWithValue(device, message, valueText)}.
 * <p>
 * Observation names that Python would reject or that would shadow the runtime functions are
 * renamed consistently (see {@link PythonNames}); echo comments keep the source names.
 * <p>
 * Generation walks the tree once and cannot fail for a well-formed program. All state lives
 * in the call, so one generator may be reused and the same program always yields the same text.
 */
public final class PythonGenerator {

    /**
     * Condition text plus the single combinator it is built from, if any, so a caller can tell
     * whether joining it to another combinator would let Python regroup it.
     */
    private static final class Guard {
        final String text;
        final Combinator joinedBy;
        final boolean mixed;

        Guard(String text, Combinator joinedBy, boolean mixed) {
            this.text = text;
            this.joinedBy = joinedBy;
            this.mixed = mixed;
        }

        static Guard of(String comparison) {
            return new Guard(comparison, null, false);
        }

        /** {@code head <operator> this}, keeping this guard grouped as one operand. */
        Guard prependedWith(String head, Combinator operator) {
            boolean needsParentheses = mixed || (joinedBy != null && joinedBy != operator);
            String rest = needsParentheses ? "(" + text + ")" : text;
            return new Guard(head + " " + keyword(operator) + " " + rest, operator, needsParentheses || mixed);
        }

        String format() {
            return text;
        }
    }

    private static final String RUNTIME_FUNCTIONS = "turnOn, turnOff, alert, alertWithValue";

    private static final String HEADER = """
# Generated from ObsAct source. Do not edit.
# Device actions are delegated to the runtime module imported below.

from %s import %s


# Program logic
def %s():
""";

    private static final Literal.Visitor<String> LITERALS = new Literal.Visitor<>() {
        @Override
        public String visitInteger(IntegerLiteral literal) {
            return Long.toString(literal.value());
        }

        @Override
        public String visitBoolean(BooleanLiteral literal) {
            return literal.value() ? "True" : "False";
        }
    };

    private final GeneratorConfig config;

    public PythonGenerator() {
        this(GeneratorConfig.defaults());
    }

    public PythonGenerator(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public String generate(Program program) {
        Objects.requireNonNull(program, "program");

        StringBuilder script = new StringBuilder();
        script.append(HEADER.formatted(config.runtimeModule(), RUNTIME_FUNCTIONS, config.entryPoint()));

        PythonNames names = PythonNames.forProgram(program);
        boolean separate = renderObservationVariables(script, program.devices(), names);

        CommandRenderer commands = new CommandRenderer(script, names);
        for (Command command : program.commands()) {
            if (separate) {
                script.append('\n');
            }
            command.accept(commands);
            separate = true;
        }

        script.append("\n\n");
        script.append("if __name__ == '__main__':\n");
        indent(script, 1);
        script.append(config.entryPoint()).append("()\n");
        return script.toString();
    }

    /**
     * Declares each observation bound by a device once, in declaration order.
     *
     * @return whether anything was declared
     */
    private boolean renderObservationVariables(StringBuilder script, List<DeviceDecl> devices, PythonNames names) {
        Map<String, String> boundBy = new LinkedHashMap<>();
        for (DeviceDecl device : devices) {
            if (device.hasObservation()) {
                boundBy.putIfAbsent(device.observation(), device.name());
            }
        }
        for (Map.Entry<String, String> variable : boundBy.entrySet()) {
            comment(script, 1, "Observation of device " + variable.getValue());
            indent(script, 1);
            script.append(names.of(variable.getKey())).append(" = None  # Set by the program\n");
        }
        return !boundBy.isEmpty();
    }

    private final class CommandRenderer implements Command.Visitor<Void> {
        private final StringBuilder script;
        private final PythonNames names;

        CommandRenderer(StringBuilder script, PythonNames names) {
            this.script = script;
            this.names = names;
        }

        @Override
        public Void visitAttribution(Attribution attribution) {
            comment(script, 1, SourceForm.of(attribution));
            indent(script, 1);
            script.append(names.of(attribution.observation())).append(" = ").append(renderLiteral(attribution.value())).append('\n');
            return null;
        }

        @Override
        public Void visitConditional(Conditional conditional) {
            comment(script, 1, "if " + SourceForm.of(conditional.condition()) + " then ...");
            indent(script, 1);
            script.append("if ").append(renderCondition(conditional.condition(), names).format()).append(":\n");
            renderAction(script, conditional.thenAction(), 2, names);
            if (conditional.hasElse()) {
                indent(script, 1);
                script.append("else:\n");
                renderAction(script, conditional.elseAction(), 2, names);
            }
            return null;
        }

        @Override
        public Void visitAction(Action action) {
            renderAction(script, action, 1, names);
            return null;
        }
    }

    private final class ActionRenderer implements Action.Visitor<Void> {
        private final StringBuilder script;
        private final int indentLevel;
        private final PythonNames names;

        ActionRenderer(StringBuilder script, int indentLevel, PythonNames names) {
            this.script = script;
            this.indentLevel = indentLevel;
            this.names = names;
        }

        @Override
        public Void visitSimpleAction(SimpleAction action) {
            call(action.toggle().keyword(), pythonString(action.device()));
            return null;
        }

        @Override
        public Void visitAlertAction(AlertAction action) {
            renderAlert(action.device(), action.message(), action.observation());
            return null;
        }

        @Override
        public Void visitBroadcastAlertAction(BroadcastAlertAction action) {
            for (String device : action.devices()) {
                renderAlert(device, action.message(), action.observation());
            }
            return null;
        }

        private void renderAlert(String device, String message, String observation) {
            if (observation == null) {
                call("alert", pythonString(device), pythonString(message));
            } else {
                call("alertWithValue", pythonString(device), pythonString(message), "str(" + names.of(observation) + ")");
            }
        }

        private void call(String function, String... arguments) {
            indent(script, indentLevel);
            script.append(function).append('(').append(String.join(", ", arguments)).append(")\n");
        }
    }

    private void renderAction(StringBuilder script, Action action, int indentLevel, PythonNames names) {
        comment(script, indentLevel, SourceForm.of(action));
        action.accept(new ActionRenderer(script, indentLevel, names));
    }

    /**
     * Folds the chain from its last link backwards, so each link's combinator joins its own
     * comparison to everything after it, exactly as the source groups it.
     */
    private Guard renderCondition(Condition condition, PythonNames names) {
        List<ConditionLink> links = condition.links();
        Guard guard = Guard.of(renderObservation(links.get(links.size() - 1).observation(), names));
        for (int i = links.size() - 2; i >= 0; i--) {
            ConditionLink link = links.get(i);
            guard = guard.prependedWith(renderObservation(link.observation(), names), link.next());
        }
        return guard;
    }

    private String renderObservation(Observation observation, PythonNames names) {
        return names.of(observation.name()) + " " + observation.operator().symbol() + " " + renderLiteral(observation.operand());
    }

    private String renderLiteral(Literal literal) {
        return literal.accept(LITERALS);
    }

    private static String keyword(Combinator combinator) {
        switch (combinator) {
            case AND:
                return "and";
            case OR:
                return "or";
            default:
                throw new IllegalArgumentException("unknown combinator: " + combinator);
        }
    }

    private void comment(StringBuilder script, int indentLevel, String text) {
        indent(script, indentLevel);
        script.append("# ").append(text.replace('\r', ' ').replace('\n', ' ')).append('\n');
    }

    private void indent(StringBuilder script, int level) {
        for (int i = 0; i < level * config.indentWidth(); i++) {
            script.append(' ');
        }
    }

    static String pythonString(String text) {
        StringBuilder literal = new StringBuilder(text.length() + 2);
        literal.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\':
                    literal.append("\\\\");
                    break;
                case '"':
                    literal.append("\\\"");
                    break;
                case '\n':
                    literal.append("\\n");
                    break;
                case '\r':
                    literal.append("\\r");
                    break;
                case '\t':
                    literal.append("\\t");
                    break;
                default:
                    literal.append(c);
            }
        }
        return literal.append('"').toString();
    }
}
