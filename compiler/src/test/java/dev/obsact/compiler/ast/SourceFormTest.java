package dev.obsact.compiler.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceFormTest {

    @Test
    void attribution() {
        assertThat(SourceForm.of(new Attribution("temp", Literal.of(25)))).isEqualTo("set temp = 25");
        assertThat(SourceForm.of(new Attribution("status", Literal.of(false)))).isEqualTo("set status = false");
    }

    @Test
    void conditionalWithElse() {
        Condition condition = Condition.chain(
                List.of(new Observation("temp", RelationalOperator.GREATER_OR_EQUAL, Literal.of(25)),
                        new Observation("temp", RelationalOperator.LESS_OR_EQUAL, Literal.of(30))),
                List.of(Combinator.AND));
        Conditional conditional = new Conditional(condition,
                new SimpleAction(Toggle.ON, "redLED"), new SimpleAction(Toggle.OFF, "redLED"));

        assertThat(SourceForm.of(conditional))
                .isEqualTo("if temp >= 25 && temp <= 30 then turnOn redLED else turnOff redLED");
    }

    @Test
    void alerts() {
        assertThat(SourceForm.of(new AlertAction("Test message", "sensor1")))
                .isEqualTo("send alert (\"Test message\") sensor1");
        assertThat(SourceForm.of(new AlertAction("Temp value", "sensor1", "temp")))
                .isEqualTo("send alert (\"Temp value\", temp) sensor1");
        assertThat(SourceForm.of(new BroadcastAlertAction("Emergency", List.of("sensor1", "led1", "buzzer"))))
                .isEqualTo("send alert (\"Emergency\") for all : sensor1, led1, buzzer");
    }

    @Test
    void devices() {
        assertThat(SourceForm.of(new DeviceDecl("sensor1", "temp"))).isEqualTo("device : sensor1, temp");
        assertThat(SourceForm.of(new DeviceDecl("led1"))).isEqualTo("device : led1");
    }
}
