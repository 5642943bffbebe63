package dev.obsact.compiler.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgramTest {

    private static final Command TURN_ON = new SimpleAction(Toggle.ON, "led1");

    @Test
    void requiresADevice() {
        assertThatThrownBy(() -> new Program(List.of(), List.of(TURN_ON)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("device");
    }

    @Test
    void requiresACommand() {
        assertThatThrownBy(() -> new Program(List.of(new DeviceDecl("led1")), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("command");
    }

    @Test
    void isImmutable() {
        List<Command> commands = new ArrayList<>(List.of(TURN_ON));
        Program program = new Program(List.of(new DeviceDecl("led1")), commands);
        commands.add(new SimpleAction(Toggle.OFF, "led1"));

        assertThat(program.commands()).containsExactly(TURN_ON);
    }

    @Test
    void broadcastNeedsADevice() {
        assertThatThrownBy(() -> new BroadcastAlertAction("Emergency", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void actionsAreCommands() {
        Command command = new AlertAction("Hi", "panel");

        String variant = command.accept(new Command.Visitor<String>() {
            @Override
            public String visitAttribution(Attribution attribution) {
                return "attribution";
            }

            @Override
            public String visitConditional(Conditional conditional) {
                return "conditional";
            }

            @Override
            public String visitAction(Action action) {
                return "action";
            }
        });

        assertThat(variant).isEqualTo("action");
    }

    @Test
    void relationalOperatorsRoundTripTheirSymbols() {
        for (RelationalOperator operator : RelationalOperator.values()) {
            assertThat(RelationalOperator.fromSymbol(operator.symbol())).isSameAs(operator);
        }
        assertThatThrownBy(() -> RelationalOperator.fromSymbol("=<"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
