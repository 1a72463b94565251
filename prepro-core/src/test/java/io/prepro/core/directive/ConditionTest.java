package io.prepro.core.directive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.prepro.core.exception.DirectiveSyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConditionTest {

    @Test
    void shouldParseEquality() {
        assertThat(Condition.parse(" a == b ", 1))
                .isEqualTo(new Condition(ConditionOperator.EQUALS, "a", "b"));
        assertThat(Condition.parse("$<x>!=1", 1))
                .isEqualTo(new Condition(ConditionOperator.NOT_EQUALS, "$<x>", "1"));
    }

    @Test
    void shouldSplitAtFirstOperator() {
        assertThat(Condition.parse("a!=b==c", 1))
                .isEqualTo(new Condition(ConditionOperator.NOT_EQUALS, "a", "b==c"));
    }

    @Test
    void shouldParseDefinedForms() {
        assertThat(Condition.parse("defined( DEBUG )", 1))
                .isEqualTo(new Condition(ConditionOperator.DEFINED, "DEBUG", null));
        assertThat(Condition.parse("undefined(x.y)", 1))
                .isEqualTo(new Condition(ConditionOperator.UNDEFINED, "x.y", null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"=", "<>", "a", "defined", "defined()", "defined(a b)", "==b", "a!=", "a = b"})
    void shouldRejectMalformedExpressions(String expression) {
        assertThatThrownBy(() -> Condition.parse(expression, 9))
                .isInstanceOf(DirectiveSyntaxException.class)
                .hasMessageStartingWith("Line 9: Invalid [#if] expression");
    }
}
