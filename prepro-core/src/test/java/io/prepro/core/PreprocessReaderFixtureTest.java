package io.prepro.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.prepro.core.secret.InMemorySecretResolver;
import io.prepro.core.secret.SecretKind;
import io.prepro.core.secret.SecretReference;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;

/// Processes a complete configuration template from test resources.
class PreprocessReaderFixtureTest {

    private static InputStream resource(String name) {
        return Objects.requireNonNull(
                PreprocessReaderFixtureTest.class.getResourceAsStream("/fixtures/" + name), name);
    }

    @Test
    void shouldRenderServiceTemplate() throws IOException {
        // GIVEN
        PreprocessorConfig config =
                PreprocessorConfig.builder()
                        .addCommentMarker("#")
                        .removeBlank(true)
                        .lineEnding(LineEnding.LF)
                        .environment(Map.of("DEPLOY_ENV", "staging"))
                        .secretResolver(
                                new InMemorySecretResolver()
                                        .put(new SecretReference(SecretKind.SECRET, "db", "ops"), "hunter2"))
                        .build();
        String expected;
        try (InputStream in = resource("service.conf")) {
            expected = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        // WHEN
        String actual;
        try (PreprocessReader reader =
                new PreprocessReader(new InputStreamReader(resource("service.conf.in"), StandardCharsets.UTF_8), config)) {
            actual = reader.readToEnd();
        }

        // THEN
        assertThat(actual).isEqualTo(expected);
    }
}
