package com.maxdemarzi.minimizer.expression;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class VariablesTest {

    @Test
    void shouldExtractSortedUniqueUpperCaseLetters() {
        assertThat(Variables.extract("c + a'b + Ab")).containsExactly("A", "B", "C");
    }

    @Test
    void shouldIgnoreConstantsAndOperators() {
        assertThat(Variables.extract("1 + 0 & !(~1)")).isEmpty();
        assertThat(Variables.extract(null)).isEmpty();
    }

    @Test
    void shouldMatchVariablesOfCompiledExpression() throws Exception {
        String expression = "D(B + A') ^ c";
        assertThat(PostfixExpression.compile(expression).variables())
                .containsExactlyElementsOf(Variables.extract(expression));
    }
}
