package com.salesBoard.biAgent.analysis.rule;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A named condition over facts of type {@code T} and the output it yields when it holds.
 */
public final class Rule<T, R> {

    private final String name;
    private final Predicate<T> condition;
    private final Function<T, R> output;

    private Rule(String name, Predicate<T> condition, Function<T, R> output) {
        this.name = Objects.requireNonNull(name, "name");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.output = Objects.requireNonNull(output, "output");
    }

    public static <T, R> Rule<T, R> when(String name, Predicate<T> condition, Function<T, R> output) {
        return new Rule<>(name, condition, output);
    }

    public static <T, R> Rule<T, R> constant(String name, Predicate<T> condition, R output) {
        return new Rule<>(name, condition, facts -> output);
    }

    public String getName() {
        return name;
    }

    boolean matches(T facts) {
        return condition.test(facts);
    }

    R apply(T facts) {
        return output.apply(facts);
    }
}
