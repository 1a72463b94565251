package io.prepro.core.variable;

import io.prepro.core.PreprocessorConfig;
import io.prepro.core.exception.CyclicReferenceException;
import io.prepro.core.exception.ProfileResolutionException;
import io.prepro.core.exception.UndefinedVariableException;
import io.prepro.core.secret.SecretKind;
import io.prepro.core.secret.SecretNotFoundException;
import io.prepro.core.secret.SecretReference;
import io.prepro.core.secret.SecretResolver;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/// Replaces variable references in a line with their values.
///
/// ### Resolution
/// - **Plain** `$<name>`: looked up in the {@link SymbolTable}; the value is
///   expanded recursively before substitution. Undefined names use the
///   configured default variable, or fail.
/// - **Environment** `$<<NAME>>`: looked up in the configured environment
///   map; substituted literally. Undefined names use the configured default
///   environment variable, or fail.
/// - **Secret** `$<<<kind:name[:vault]>>>`: delegated to the configured
///   {@link SecretResolver}; substituted literally.
///
/// Substituted text is never scanned again for references.
///
/// ### Cycle detection
/// Recursive expansion threads an explicit stack of the names being expanded
/// through the calls. Meeting a name already on the stack raises
/// {@link CyclicReferenceException}.
///
/// @implNote Holds no per-call state, so nested and repeated calls are safe.
/// The symbol table itself is not thread-safe.
public class VariableExpander {

    private final SymbolTable symbols;
    private final VariableStyle style;
    private final String defaultVariable;
    private final String defaultEnvironmentVariable;
    private final Map<String, String> environment;
    private final SecretResolver secretResolver;

    /// Creates an expander using the reference settings of a configuration.
    ///
    /// @param config source of style, defaults, environment and secret resolver, not null
    /// @param symbols the variables to resolve plain references against, not null
    public VariableExpander(PreprocessorConfig config, SymbolTable symbols) {
        this.symbols = symbols;
        this.style = config.getVariableStyle();
        this.defaultVariable = config.getDefaultVariable();
        this.defaultEnvironmentVariable = config.getDefaultEnvironmentVariable();
        this.environment = config.getEnvironment();
        this.secretResolver = config.getSecretResolver();
    }

    /// Expands every reference in the text.
    ///
    /// @param text the text to expand, not null
    /// @param lineNumber input line used in error messages
    /// @return the expanded text, never null
    /// @throws UndefinedVariableException if a reference has no value and no default
    /// @throws CyclicReferenceException if a variable refers back to itself
    /// @throws ProfileResolutionException if a secret reference cannot be resolved
    public String expand(String text, int lineNumber) {
        return expand(text, lineNumber, new ArrayDeque<>());
    }

    /// Lists the references in the text without resolving them.
    ///
    /// @param text the text to scan, not null
    /// @return references in order of appearance, never null
    public List<VariableReference> findReferences(String text) {
        List<VariableReference> references = new ArrayList<>();
        Matcher matcher = style.pattern().matcher(text);
        while (matcher.find()) {
            references.add(toReference(matcher));
        }
        return references;
    }

    private String expand(String text, int lineNumber, Deque<String> expanding) {
        Matcher matcher = style.pattern().matcher(text);
        if (!matcher.find()) {
            return text;
        }

        StringBuilder result = new StringBuilder(text.length());
        do {
            VariableReference reference = toReference(matcher);
            String value =
                    switch (reference.kind()) {
                        case PLAIN -> resolvePlain(reference, lineNumber, expanding);
                        case ENVIRONMENT -> resolveEnvironment(reference, lineNumber);
                        case SECRET -> resolveSecret(reference, lineNumber);
                    };
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        } while (matcher.find());

        matcher.appendTail(result);
        return result.toString();
    }

    private String resolvePlain(VariableReference reference, int lineNumber, Deque<String> expanding) {
        String name = reference.body();
        if (expanding.contains(name)) {
            List<String> chain = new ArrayList<>(expanding);
            chain.add(name);
            throw new CyclicReferenceException(lineNumber, chain);
        }

        String value = symbols.get(name).orElse(null);
        if (value == null) {
            if (defaultVariable == null) {
                throw new UndefinedVariableException(
                        lineNumber,
                        reference.text(),
                        "Undefined variable reference [" + reference.text() + "].");
            }
            return defaultVariable;
        }

        expanding.addLast(name);
        try {
            return expand(value, lineNumber, expanding);
        } finally {
            expanding.removeLast();
        }
    }

    private String resolveEnvironment(VariableReference reference, int lineNumber) {
        String value = environment.get(reference.body());
        if (value == null) {
            if (defaultEnvironmentVariable == null) {
                throw new UndefinedVariableException(
                        lineNumber,
                        reference.text(),
                        "Undefined environment variable reference [" + reference.text() + "].");
            }
            return defaultEnvironmentVariable;
        }
        return value;
    }

    private String resolveSecret(VariableReference reference, int lineNumber) {
        String[] parts = reference.body().split(":", 3);
        SecretKind kind =
                SecretKind.fromToken(parts[0])
                        .orElseThrow(
                                () ->
                                        new ProfileResolutionException(
                                                lineNumber,
                                                "Unknown reference kind ["
                                                        + parts[0]
                                                        + "] in "
                                                        + reference.text()
                                                        + "; expected password, secret or profile."));
        SecretReference secret = new SecretReference(kind, parts[1], parts.length > 2 ? parts[2] : null);

        try {
            return secretResolver.resolve(secret);
        } catch (SecretNotFoundException e) {
            throw new ProfileResolutionException(
                    lineNumber, "Cannot resolve " + reference.text() + ": " + e.getMessage(), e);
        }
    }

    private static VariableReference toReference(Matcher matcher) {
        ReferenceKind kind;
        String body;
        if ((body = matcher.group("secret")) != null) {
            kind = ReferenceKind.SECRET;
        } else if ((body = matcher.group("env")) != null) {
            kind = ReferenceKind.ENVIRONMENT;
        } else {
            body = matcher.group("plain");
            kind = ReferenceKind.PLAIN;
        }
        return new VariableReference(kind, body, matcher.group(), matcher.start(), matcher.end());
    }
}
