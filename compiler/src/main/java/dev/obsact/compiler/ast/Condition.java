package dev.obsact.compiler.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A guard made of one or more comparisons. Each link carries the combinator joining it to the
 * next link; there is no precedence, so the chain groups to the right:
 * {@code a && b || c} means {@code a && (b || c)}.
 */
public record Condition(List<ConditionLink> links) {

    public Condition {
        links = List.copyOf(Objects.requireNonNull(links, "links"));
        if (links.isEmpty()) {
            throw new IllegalArgumentException("a condition has at least one comparison");
        }
        for (int i = 0; i < links.size(); i++) {
            boolean last = i == links.size() - 1;
            if (last != links.get(i).isLast()) {
                throw new IllegalArgumentException("only the final link of a condition may lack a combinator");
            }
        }
    }

    public static Condition of(Observation observation) {
        return new Condition(List.of(new ConditionLink(observation, null)));
    }

    /**
     * Builds a chain from its comparisons and the combinators between them;
     * {@code combinators.size()} must be {@code observations.size() - 1}.
     */
    public static Condition chain(List<Observation> observations, List<Combinator> combinators) {
        if (combinators.size() != observations.size() - 1) {
            throw new IllegalArgumentException("expected " + (observations.size() - 1)
                    + " combinator(s) for " + observations.size() + " comparison(s), got " + combinators.size());
        }
        List<ConditionLink> links = new ArrayList<>(observations.size());
        for (int i = 0; i < observations.size(); i++) {
            Combinator next = i < combinators.size() ? combinators.get(i) : null;
            links.add(new ConditionLink(observations.get(i), next));
        }
        return new Condition(links);
    }
}
