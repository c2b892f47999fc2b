package com.salesBoard.biAgent.analysis.rule;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of rules. Classification takes the first rule that holds; lists such as
 * risks collect the output of every rule that holds, in declaration order.
 */
@Slf4j
public final class RuleSet<T, R> {

    private final List<Rule<T, R>> rules;

    private RuleSet(List<Rule<T, R>> rules) {
        this.rules = List.copyOf(rules);
    }

    @SafeVarargs
    public static <T, R> RuleSet<T, R> of(Rule<T, R>... rules) {
        return new RuleSet<>(List.of(rules));
    }

    public Optional<R> firstMatch(T facts) {
        for (Rule<T, R> rule : rules) {
            if (rule.matches(facts)) {
                log.debug("Rule matched - rule: {}", rule.getName());
                return Optional.ofNullable(rule.apply(facts));
            }
        }
        return Optional.empty();
    }

    public List<R> allMatches(T facts) {
        List<R> outputs = new ArrayList<>();
        for (Rule<T, R> rule : rules) {
            if (rule.matches(facts)) {
                outputs.add(rule.apply(facts));
            }
        }
        return outputs;
    }
}
