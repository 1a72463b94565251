package io.prepro.core.directive;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DirectiveParserTest {

    private final DirectiveParser parser = new DirectiveParser('#');

    @Test
    void shouldParseKeywordAndTrimmedArgument() {
        Optional<Directive> directive = parser.parse("   #define  name = value  ");

        assertThat(directive).isPresent();
        assertThat(directive.get().kind()).isEqualTo(DirectiveKind.DEFINE);
        assertThat(directive.get().argument()).isEqualTo("name = value");
        assertThat(directive.get().line()).isEqualTo("   #define  name = value  ");
    }

    @Test
    void shouldParseDirectiveWithoutArgument() {
        Directive directive = parser.parse("\t#endif").orElseThrow();

        assertThat(directive.kind()).isEqualTo(DirectiveKind.ENDIF);
        assertThat(directive.hasArgument()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "text", "# if a==a", "#!/bin/sh", "#include x", "#IF a==a", "#if(a==a)", "x #if a==a", "@if a==a"})
    void shouldTreatOtherLinesAsText(String line) {
        assertThat(parser.parse(line)).isEmpty();
    }

    @Test
    void shouldHonorCustomMarker() {
        DirectiveParser custom = new DirectiveParser('@');

        assertThat(custom.parse("@switch x").map(Directive::kind)).contains(DirectiveKind.SWITCH);
        assertThat(custom.parse("#switch x")).isEmpty();
    }
}
