package io.prepro.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.prepro.core.secret.InMemorySecretResolver;
import io.prepro.core.variable.VariableStyle;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("PreprocessorConfig")
class PreprocessorConfigTest {

    @Test
    @DisplayName("defaults match documented behavior")
    void shouldExposeDefaults() {
        PreprocessorConfig config = PreprocessorConfig.defaults();

        assertThat(config.getStatementMarker()).isEqualTo('#');
        assertThat(config.getVariableStyle()).isEqualTo(VariableStyle.ANGLE);
        assertThat(config.isProcessStatements()).isTrue();
        assertThat(config.isExpandVariables()).isTrue();
        assertThat(config.getCommentMarkers()).containsExactly("//");
        assertThat(config.isStripComments()).isTrue();
        assertThat(config.isRemoveComments()).isFalse();
        assertThat(config.isRemoveBlank()).isFalse();
        assertThat(config.isBlankSuppressedLines()).isTrue();
        assertThat(config.getTabStop()).isZero();
        assertThat(config.getIndent()).isZero();
        assertThat(config.getLineEnding()).isEqualTo(LineEnding.PLATFORM);
        assertThat(config.getDefaultVariable()).isNull();
        assertThat(config.getDefaultEnvironmentVariable()).isNull();
        assertThat(config.getSecretResolver()).isNotNull();
    }

    @Nested
    @DisplayName("builder validation")
    class Validation {

        @ParameterizedTest
        @ValueSource(chars = {' ', '\t', 'a', 'Z', '7'})
        void shouldRejectIllegalStatementMarkers(char marker) {
            assertThatThrownBy(() -> PreprocessorConfig.builder().statementMarker(marker))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectNegativeWidths() {
            assertThatThrownBy(() -> PreprocessorConfig.builder().tabStop(-1))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> PreprocessorConfig.builder().indent(-1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectInvalidCommentMarker() {
            assertThatThrownBy(() -> PreprocessorConfig.builder().addCommentMarker("rem"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectNullCollaborators() {
            assertThatThrownBy(() -> PreprocessorConfig.builder().secretResolver(null))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> PreprocessorConfig.builder().lineEnding(null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Test
    void shouldCopyEnvironment() {
        Map<String, String> environment = new HashMap<>(Map.of("A", "1"));

        PreprocessorConfig config = PreprocessorConfig.builder().environment(environment).build();
        environment.put("B", "2");

        assertThat(config.getEnvironment()).containsOnlyKeys("A");
    }

    @Test
    void shouldKeepCommentMarkersUnmodifiable() {
        PreprocessorConfig config = PreprocessorConfig.builder().addCommentMarker("#").build();

        assertThat(config.getCommentMarkers()).containsExactly("//", "#");
        assertThatThrownBy(() -> config.getCommentMarkers().add(";"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRoundTripThroughToBuilder() {
        InMemorySecretResolver resolver = new InMemorySecretResolver();
        PreprocessorConfig original =
                PreprocessorConfig.builder()
                        .statementMarker('@')
                        .variableStyle(VariableStyle.PAREN)
                        .clearCommentMarkers()
                        .addCommentMarker("--")
                        .tabStop(4)
                        .indent(2)
                        .defaultVariable("")
                        .secretResolver(resolver)
                        .build();

        PreprocessorConfig copy = original.toBuilder().removeBlank(true).build();

        assertThat(copy.getStatementMarker()).isEqualTo('@');
        assertThat(copy.getVariableStyle()).isEqualTo(VariableStyle.PAREN);
        assertThat(copy.getCommentMarkers()).containsExactly("--");
        assertThat(copy.getTabStop()).isEqualTo(4);
        assertThat(copy.getIndent()).isEqualTo(2);
        assertThat(copy.getDefaultVariable()).isEmpty();
        assertThat(copy.getSecretResolver()).isSameAs(resolver);
        assertThat(copy.isRemoveBlank()).isTrue();
        assertThat(original.isRemoveBlank()).isFalse();
    }

    @Test
    void shouldResolveLineTerminators() {
        assertThat(LineEnding.CRLF.terminator()).isEqualTo("\r\n");
        assertThat(LineEnding.LF.terminator()).isEqualTo("\n");
        assertThat(LineEnding.PLATFORM.terminator()).isEqualTo(System.lineSeparator());
    }
}
