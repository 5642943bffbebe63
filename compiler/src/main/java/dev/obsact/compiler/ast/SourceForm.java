package dev.obsact.compiler.ast;

import java.util.StringJoiner;

/**
 * Renders AST nodes back to canonical ObsAct source, without the terminating period.
 */
public final class SourceForm {

    private static final Literal.Visitor<String> LITERALS = new Literal.Visitor<>() {
        @Override
        public String visitInteger(IntegerLiteral literal) {
            return Long.toString(literal.value());
        }

        @Override
        public String visitBoolean(BooleanLiteral literal) {
            return Boolean.toString(literal.value());
        }
    };

    private static final Action.Visitor<String> ACTIONS = new Action.Visitor<>() {
        @Override
        public String visitSimpleAction(SimpleAction action) {
            return action.toggle().keyword() + " " + action.device();
        }

        @Override
        public String visitAlertAction(AlertAction action) {
            return alertPrefix(action.message(), action.observation()) + " " + action.device();
        }

        @Override
        public String visitBroadcastAlertAction(BroadcastAlertAction action) {
            return alertPrefix(action.message(), action.observation())
                    + " for all : " + String.join(", ", action.devices());
        }
    };

    private static final Command.Visitor<String> COMMANDS = new Command.Visitor<>() {
        @Override
        public String visitAttribution(Attribution attribution) {
            return "set " + attribution.observation() + " = " + of(attribution.value());
        }

        @Override
        public String visitConditional(Conditional conditional) {
            String text = "if " + of(conditional.condition()) + " then " + of(conditional.thenAction());
            if (conditional.hasElse()) {
                text += " else " + of(conditional.elseAction());
            }
            return text;
        }

        @Override
        public String visitAction(Action action) {
            return action.accept(ACTIONS);
        }
    };

    private SourceForm() {
    }

    public static String of(Command command) {
        return command.accept(COMMANDS);
    }

    public static String of(Literal literal) {
        return literal.accept(LITERALS);
    }

    public static String of(Observation observation) {
        return observation.name() + " " + observation.operator().symbol() + " " + of(observation.operand());
    }

    public static String of(Condition condition) {
        StringBuilder text = new StringBuilder();
        for (ConditionLink link : condition.links()) {
            text.append(of(link.observation()));
            if (!link.isLast()) {
                text.append(' ').append(link.next().symbol()).append(' ');
            }
        }
        return text.toString();
    }

    public static String of(DeviceDecl device) {
        if (device.hasObservation()) {
            return "device : " + device.name() + ", " + device.observation();
        }
        return "device : " + device.name();
    }

    private static String alertPrefix(String message, String observation) {
        StringJoiner arguments = new StringJoiner(", ", "(", ")");
        arguments.add("\"" + message + "\"");
        if (observation != null) {
            arguments.add(observation);
        }
        return "send alert " + arguments;
    }
}
