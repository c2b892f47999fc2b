package com.salesBoard.biAgent.analysis.rule;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RuleSetTest {

    private final RuleSet<Integer, String> sizes = RuleSet.of(
            Rule.constant("negative", value -> value < 0, "negative"),
            Rule.when("small", value -> value < 10, value -> "small " + value),
            Rule.when("even", value -> value % 2 == 0, value -> "even " + value));

    @Test
    void firstMatchStopsAtTheFirstHoldingRule() {
        assertThat(sizes.firstMatch(4)).contains("small 4");
        assertThat(sizes.firstMatch(-3)).contains("negative");
        assertThat(sizes.firstMatch(12)).contains("even 12");
    }

    @Test
    void firstMatchIsEmptyWhenNothingHolds() {
        assertThat(sizes.firstMatch(11)).isEmpty();
    }

    @Test
    void allMatchesKeepsDeclarationOrder() {
        assertThat(sizes.allMatches(-2)).containsExactly("negative", "small -2", "even -2");
        assertThat(sizes.allMatches(11)).isEmpty();
    }
}
