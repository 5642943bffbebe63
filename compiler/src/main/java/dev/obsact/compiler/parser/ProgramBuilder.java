package dev.obsact.compiler.parser;

import dev.obsact.antlr.ObsActBaseVisitor;
import dev.obsact.antlr.ObsActParser;
import dev.obsact.compiler.CompileError;
import dev.obsact.compiler.ast.Action;
import dev.obsact.compiler.ast.AlertAction;
import dev.obsact.compiler.ast.Attribution;
import dev.obsact.compiler.ast.BroadcastAlertAction;
import dev.obsact.compiler.ast.Combinator;
import dev.obsact.compiler.ast.Command;
import dev.obsact.compiler.ast.Condition;
import dev.obsact.compiler.ast.Conditional;
import dev.obsact.compiler.ast.DeviceDecl;
import dev.obsact.compiler.ast.Literal;
import dev.obsact.compiler.ast.Observation;
import dev.obsact.compiler.ast.Program;
import dev.obsact.compiler.ast.RelationalOperator;
import dev.obsact.compiler.ast.SimpleAction;
import dev.obsact.compiler.ast.Toggle;
import dev.obsact.compiler.lexer.SourceToken;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an ObsAct parse tree into the immutable AST. The section checks (devices first, at
 * least one of each) run on every tree; the AST itself is only built from a tree that parsed
 * without errors.
 */
final class ProgramBuilder {

    private final List<CompileError> errors;
    private final ActionBuilder actions = new ActionBuilder();

    ProgramBuilder(List<CompileError> errors) {
        this.errors = errors;
    }

    /**
     * Returns the program, or null when {@code errors} is non-empty afterwards.
     */
    Program build(ObsActParser.ProgramContext tree) {
        checkSections(tree);
        if (!errors.isEmpty()) {
            return null;
        }

        List<DeviceDecl> devices = new ArrayList<>();
        List<Command> commands = new ArrayList<>();
        for (ObsActParser.StatementContext statement : tree.statement()) {
            if (statement.deviceDecl() != null) {
                devices.add(device(statement.deviceDecl()));
            } else {
                commands.add(command(statement.command()));
            }
        }
        if (!errors.isEmpty()) {
            return null;
        }
        return new Program(devices, commands);
    }

    private void checkSections(ObsActParser.ProgramContext tree) {
        int devices = 0;
        int commands = 0;
        for (ObsActParser.StatementContext statement : tree.statement()) {
            if (statement.deviceDecl() != null) {
                if (commands > 0) {
                    errors.add(CompileError.syntax(
                            "device declarations must precede commands", statement.getStart().getLine()));
                }
                devices++;
            } else if (statement.command() != null) {
                commands++;
            }
        }
        if (devices == 0) {
            errors.add(CompileError.syntax("program must declare at least one device", tree.getStart().getLine()));
        }
        if (commands == 0) {
            errors.add(CompileError.syntax("program must contain at least one command", lastLine(tree)));
        }
    }

    private DeviceDecl device(ObsActParser.DeviceDeclContext ctx) {
        ObsActParser.DeviceBindingContext binding = ctx.deviceBinding();
        String name = binding.deviceName().getText();
        if (binding.observationName() != null) {
            return new DeviceDecl(name, binding.observationName().getText());
        }
        return new DeviceDecl(name);
    }

    private Command command(ObsActParser.CommandContext ctx) {
        if (ctx.attribution() != null) {
            ObsActParser.AttributionContext attribution = ctx.attribution();
            return new Attribution(attribution.observationName().getText(), literal(attribution.literal()));
        }
        if (ctx.conditional() != null) {
            return conditional(ctx.conditional());
        }
        return actions.visit(ctx.deviceAction());
    }

    private Conditional conditional(ObsActParser.ConditionalContext ctx) {
        Condition condition = condition(ctx.condition());
        Action thenAction = actions.visit(ctx.deviceAction(0));
        Action elseAction = ctx.ELSE() != null ? actions.visit(ctx.deviceAction(1)) : null;
        return new Conditional(condition, thenAction, elseAction);
    }

    private Condition condition(ObsActParser.ConditionContext ctx) {
        List<Observation> observations = new ArrayList<>();
        for (ObsActParser.ObservationContext observation : ctx.observation()) {
            observations.add(new Observation(
                    observation.observationName().getText(),
                    RelationalOperator.fromSymbol(observation.RELOP().getText()),
                    literal(observation.literal())));
        }
        List<Combinator> combinators = new ArrayList<>();
        for (ObsActParser.CombinatorContext combinator : ctx.combinator()) {
            combinators.add(combinator.AND() != null ? Combinator.AND : Combinator.OR);
        }
        return Condition.chain(observations, combinators);
    }

    private Literal literal(ObsActParser.LiteralContext ctx) {
        if (ctx.BOOLEAN() != null) {
            return Literal.of(Boolean.parseBoolean(ctx.BOOLEAN().getText()));
        }
        TerminalNode number = ctx.NUMBER();
        try {
            return Literal.of(Long.parseLong(number.getText()));
        } catch (NumberFormatException e) {
            errors.add(CompileError.syntax(
                    "integer literal " + number.getText() + " is out of range", number.getSymbol().getLine()));
            return Literal.of(0L);
        }
    }

    private static int lastLine(ObsActParser.ProgramContext tree) {
        Token stop = tree.getStop();
        return stop != null ? stop.getLine() : tree.getStart().getLine();
    }

    private static List<String> deviceNames(ObsActParser.DeviceListContext ctx) {
        List<String> names = new ArrayList<>();
        for (ObsActParser.DeviceNameContext name : ctx.deviceName()) {
            names.add(name.getText());
        }
        return names;
    }

    private static String optionalName(ObsActParser.ObservationNameContext ctx) {
        return ctx != null ? ctx.getText() : null;
    }

    private static final class ActionBuilder extends ObsActBaseVisitor<Action> {

        @Override
        public Action visitSimpleAction(ObsActParser.SimpleActionContext ctx) {
            Toggle toggle = ctx.toggle().TURN_ON() != null ? Toggle.ON : Toggle.OFF;
            return new SimpleAction(toggle, ctx.deviceName().getText());
        }

        @Override
        public Action visitAlertAction(ObsActParser.AlertActionContext ctx) {
            return new AlertAction(
                    SourceToken.unquote(ctx.MESSAGE().getText()),
                    ctx.deviceName().getText(),
                    optionalName(ctx.observationName()));
        }

        @Override
        public Action visitBroadcastAlertAction(ObsActParser.BroadcastAlertActionContext ctx) {
            return new BroadcastAlertAction(
                    SourceToken.unquote(ctx.MESSAGE().getText()),
                    deviceNames(ctx.deviceList()),
                    optionalName(ctx.observationName()));
        }
    }
}
