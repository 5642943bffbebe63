package dev.obsact.compiler.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Condition chains")
class ConditionTest {

    private static final Observation WARM = new Observation("temp", RelationalOperator.GREATER, Literal.of(20));
    private static final Observation COOL = new Observation("temp", RelationalOperator.LESS, Literal.of(30));
    private static final Observation ON = new Observation("status", RelationalOperator.EQUAL, Literal.of(true));

    @Test
    @DisplayName("stores each combinator on the link it follows")
    void chainAttachesCombinatorsToPrecedingLink() {
        Condition condition = Condition.chain(List.of(WARM, COOL, ON), List.of(Combinator.AND, Combinator.OR));

        assertThat(condition.links()).extracting(ConditionLink::next)
                .containsExactly(Combinator.AND, Combinator.OR, null);
        assertThat(condition.links()).extracting(ConditionLink::observation).containsExactly(WARM, COOL, ON);
    }

    @Test
    void singleComparison() {
        Condition condition = Condition.of(WARM);

        assertThat(condition.links()).singleElement().satisfies(link -> assertThat(link.isLast()).isTrue());
    }

    @Test
    void rejectsMismatchedCombinatorCount() {
        assertThatThrownBy(() -> Condition.chain(List.of(WARM, COOL), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsEmptyChain() {
        assertThatThrownBy(() -> new Condition(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects a combinator on the last link or a missing one in the middle")
    void rejectsMisplacedCombinators() {
        assertThatThrownBy(() -> new Condition(List.of(new ConditionLink(WARM, Combinator.AND))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Condition(List.of(new ConditionLink(WARM, null), new ConditionLink(COOL, null))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copiesItsLinks() {
        List<ConditionLink> links = new ArrayList<>(List.of(new ConditionLink(WARM, null)));
        Condition condition = new Condition(links);
        links.clear();

        assertThat(condition.links()).hasSize(1);
        assertThatThrownBy(() -> condition.links().add(new ConditionLink(COOL, null)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
