package io.prepro.core.directive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.prepro.core.exception.DirectiveSyntaxException;
import io.prepro.core.variable.SymbolTable;
import io.prepro.core.variable.VariableExpander;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("DirectiveInterpreter")
@ExtendWith(MockitoExtension.class)
class DirectiveInterpreterTest {

    @Mock private VariableExpander mockExpander;

    private SymbolTable symbols;
    private DirectiveParser parser;
    private DirectiveInterpreter interpreter;
    private int lineNumber;

    @BeforeEach
    void setUp() {
        symbols = new SymbolTable();
        parser = new DirectiveParser('#');
        interpreter = new DirectiveInterpreter('#', symbols, mockExpander);
        lineNumber = 0;
    }

    private void run(String line) {
        interpreter.execute(parser.parse(line).orElseThrow(), ++lineNumber);
    }

    @Nested
    @DisplayName("define")
    class Define {

        @Test
        void shouldStoreTrimmedValueVerbatim() {
            run("#define greeting =  hello $<name>  ");

            assertThat(symbols.get("greeting")).contains("hello $<name>");
            verify(mockExpander, never()).expand(anyString(), anyInt());
        }

        @Test
        void shouldDefineEmptyValueWithoutEquals() {
            run("#define flag");

            assertThat(symbols.get("flag")).contains("");
        }

        @Test
        void shouldSkipDefineWhenInactive() {
            run("#if defined(nothing)");
            run("#define flag");

            assertThat(symbols.contains("flag")).isFalse();
        }
    }

    @Nested
    @DisplayName("if")
    class If {

        @Test
        void shouldCompareExpandedTrimmedOperands() {
            // GIVEN
            when(mockExpander.expand("$<env>", 1)).thenReturn(" prod ");
            when(mockExpander.expand("prod", 1)).thenReturn("prod");

            // WHEN
            run("#if $<env> == prod");

            // THEN
            assertThat(interpreter.isActive()).isTrue();
            assertThat(interpreter.depth()).isEqualTo(1);
        }

        @Test
        void shouldNotExpandOperandsWhenInactive() {
            run("#if undefined(x)");
            symbols.set("x", "1");
            run("#else");
            run("#if $<y>==1");

            assertThat(interpreter.isActive()).isFalse();
            verify(mockExpander, never()).expand(anyString(), anyInt());
        }

        @Test
        void shouldRejectElseOutsideIf() {
            assertThatThrownBy(() -> run("#else"))
                    .isInstanceOf(DirectiveSyntaxException.class)
                    .hasMessage("Line 1: [#else] is not within [#if]: #else");
        }

        @Test
        void shouldRejectEndifClosingSwitch() {
            when(mockExpander.expand("x", 1)).thenReturn("x");
            run("#switch x");

            assertThatThrownBy(() -> run("#endif"))
                    .isInstanceOf(DirectiveSyntaxException.class)
                    .hasMessageContaining("not within [#if]");
        }

        @Test
        void shouldRejectTrailingText() {
            run("#if defined(a)");

            assertThatThrownBy(() -> run("#else if"))
                    .isInstanceOf(DirectiveSyntaxException.class)
                    .hasMessageContaining("Unexpected text after [#else]");
        }
    }

    @Nested
    @DisplayName("switch")
    class Switch {

        @Test
        void shouldExpandCaseValues() {
            // GIVEN
            when(mockExpander.expand("$<env>", 1)).thenReturn("prod");
            when(mockExpander.expand("dev", 2)).thenReturn("dev");
            when(mockExpander.expand("$<prod>", 3)).thenReturn("prod");

            // WHEN
            run("#switch $<env>");
            run("#case dev");
            boolean devActive = interpreter.isActive();
            run("#case $<prod>");

            // THEN
            assertThat(devActive).isFalse();
            assertThat(interpreter.isActive()).isTrue();
        }

        @Test
        void shouldRejectCaseAfterDefault() {
            when(mockExpander.expand("x", 1)).thenReturn("x");
            run("#switch x");
            run("#default");

            assertThatThrownBy(() -> run("#case x"))
                    .isInstanceOf(DirectiveSyntaxException.class)
                    .hasMessageContaining("[#case] cannot follow [#default]");
        }

        @Test
        void shouldUseCustomMarkerInMessages() {
            DirectiveInterpreter custom = new DirectiveInterpreter('@', symbols, mockExpander);

            assertThatThrownBy(
                            () -> custom.execute(new DirectiveParser('@').parse("@endswitch").orElseThrow(), 5))
                    .hasMessage("Line 5: [@endswitch] is not within [@switch]: @endswitch");
        }
    }

    @Test
    void shouldReportUnclosedBlock() {
        run("#if defined(a)");
        run("#if defined(b)");

        assertThatThrownBy(() -> interpreter.verifyClosed(10))
                .isInstanceOf(DirectiveSyntaxException.class)
                .hasMessage("Line 10: Unclosed [#if] opened at line 2.");
    }

    @Test
    void shouldPassVerifyWhenBalanced() {
        run("#if defined(a)");
        run("#endif");

        interpreter.verifyClosed(2);

        assertThat(interpreter.depth()).isZero();
    }
}
