package dev.obsact.compiler.ast;

/**
 * The effect of a command: a power toggle, a single alert or a broadcast alert. An action is
 * also a command on its own.
 */
public sealed interface Action extends Command permits SimpleAction, AlertAction, BroadcastAlertAction {

    <R> R accept(Action.Visitor<R> visitor);

    @Override
    default <R> R accept(Command.Visitor<R> visitor) {
        return visitor.visitAction(this);
    }

    interface Visitor<R> {

        R visitSimpleAction(SimpleAction action);

        R visitAlertAction(AlertAction action);

        R visitBroadcastAlertAction(BroadcastAlertAction action);
    }
}
