package io.prepro.core;

import io.prepro.core.format.CommentMarkers;
import io.prepro.core.secret.SecretResolver;
import io.prepro.core.variable.VariableStyle;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Options controlling how a {@link PreprocessReader} transforms its input.
///
/// Instances are immutable. Use {@link #builder()} to construct one, or
/// {@link #defaults()} for the default options.
///
/// ### Default Values
/// - `statementMarker`: `#`
/// - `variableStyle`: {@link VariableStyle#ANGLE}
/// - `processStatements`, `expandVariables`, `stripComments`, `blankSuppressedLines`: `true`
/// - `removeComments`, `removeBlank`: `false`
/// - `commentMarkers`: `//`
/// - `tabStop`, `indent`: `0`
/// - `lineEnding`: {@link LineEnding#PLATFORM}
/// - `defaultVariable`, `defaultEnvironmentVariable`: `null` (undefined references fail)
/// - `environment`: {@link System#getenv()}
/// - `secretResolver`: {@link SecretResolver#none()}
///
/// @implNote Immutable and thread-safe. A reader captures its configuration at
/// construction, so options cannot change once reading has started.
/// @see Builder
public final class PreprocessorConfig {

    private static final PreprocessorConfig DEFAULTS = builder().build();

    private final char statementMarker;
    private final VariableStyle variableStyle;
    private final boolean processStatements;
    private final boolean expandVariables;
    private final Set<String> commentMarkers;
    private final boolean stripComments;
    private final boolean removeComments;
    private final boolean removeBlank;
    private final boolean blankSuppressedLines;
    private final int tabStop;
    private final int indent;
    private final LineEnding lineEnding;
    private final String defaultVariable;
    private final String defaultEnvironmentVariable;
    private final Map<String, String> environment;
    private final SecretResolver secretResolver;

    private PreprocessorConfig(Builder builder) {
        this.statementMarker = builder.statementMarker;
        this.variableStyle = builder.variableStyle;
        this.processStatements = builder.processStatements;
        this.expandVariables = builder.expandVariables;
        this.commentMarkers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.commentMarkers));
        this.stripComments = builder.stripComments;
        this.removeComments = builder.removeComments;
        this.removeBlank = builder.removeBlank;
        this.blankSuppressedLines = builder.blankSuppressedLines;
        this.tabStop = builder.tabStop;
        this.indent = builder.indent;
        this.lineEnding = builder.lineEnding;
        this.defaultVariable = builder.defaultVariable;
        this.defaultEnvironmentVariable = builder.defaultEnvironmentVariable;
        this.environment = builder.environment;
        this.secretResolver = builder.secretResolver;
    }

    /// Returns the default configuration.
    ///
    /// @return shared default instance, never null
    public static PreprocessorConfig defaults() {
        return DEFAULTS;
    }

    /// Creates a new builder initialized with the default options.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Creates a builder initialized from this configuration.
    ///
    /// @return a new builder instance, never null
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.statementMarker = statementMarker;
        builder.variableStyle = variableStyle;
        builder.processStatements = processStatements;
        builder.expandVariables = expandVariables;
        builder.commentMarkers.clear();
        builder.commentMarkers.addAll(commentMarkers);
        builder.stripComments = stripComments;
        builder.removeComments = removeComments;
        builder.removeBlank = removeBlank;
        builder.blankSuppressedLines = blankSuppressedLines;
        builder.tabStop = tabStop;
        builder.indent = indent;
        builder.lineEnding = lineEnding;
        builder.defaultVariable = defaultVariable;
        builder.defaultEnvironmentVariable = defaultEnvironmentVariable;
        builder.environment = environment;
        builder.secretResolver = secretResolver;
        return builder;
    }

    /// Returns the character that introduces a directive line.
    public char getStatementMarker() {
        return statementMarker;
    }

    public VariableStyle getVariableStyle() {
        return variableStyle;
    }

    /// Returns whether directive lines are interpreted.
    ///
    /// @return `false` if directive lines are passed through as ordinary text
    public boolean isProcessStatements() {
        return processStatements;
    }

    /// Returns whether references in ordinary lines are expanded.
    ///
    /// Directive operands are expanded regardless of this option.
    public boolean isExpandVariables() {
        return expandVariables;
    }

    /// Returns the comment line prefixes.
    ///
    /// @return unmodifiable set in insertion order, never null (may be empty)
    public Set<String> getCommentMarkers() {
        return commentMarkers;
    }

    /// Returns whether comment lines are emptied.
    public boolean isStripComments() {
        return stripComments;
    }

    /// Returns whether comment lines are removed from the output.
    public boolean isRemoveComments() {
        return removeComments;
    }

    /// Returns whether blank and whitespace-only lines are removed from the output.
    public boolean isRemoveBlank() {
        return removeBlank;
    }

    /// Returns whether directive lines and lines in inactive branches are
    /// returned as empty lines, keeping output line numbers aligned with input.
    ///
    /// @return `false` if such lines are removed from the output
    public boolean isBlankSuppressedLines() {
        return blankSuppressedLines;
    }

    public int getTabStop() {
        return tabStop;
    }

    public int getIndent() {
        return indent;
    }

    public LineEnding getLineEnding() {
        return lineEnding;
    }

    /// Returns the substitute for undefined plain references.
    ///
    /// @return the default value, or null if undefined references fail
    public String getDefaultVariable() {
        return defaultVariable;
    }

    /// Returns the substitute for undefined environment references.
    ///
    /// @return the default value, or null if undefined references fail
    public String getDefaultEnvironmentVariable() {
        return defaultEnvironmentVariable;
    }

    /// Returns the environment that environment references resolve against.
    ///
    /// @return environment map, never null
    public Map<String, String> getEnvironment() {
        return environment;
    }

    public SecretResolver getSecretResolver() {
        return secretResolver;
    }

    /// Fluent builder for {@link PreprocessorConfig}.
    ///
    /// Setters validate their arguments immediately and throw
    /// {@link IllegalArgumentException} for illegal values.
    public static final class Builder {
        private char statementMarker = '#';
        private VariableStyle variableStyle = VariableStyle.ANGLE;
        private boolean processStatements = true;
        private boolean expandVariables = true;
        private final Set<String> commentMarkers = new LinkedHashSet<>(Set.of(CommentMarkers.DEFAULT));
        private boolean stripComments = true;
        private boolean removeComments = false;
        private boolean removeBlank = false;
        private boolean blankSuppressedLines = true;
        private int tabStop = 0;
        private int indent = 0;
        private LineEnding lineEnding = LineEnding.PLATFORM;
        private String defaultVariable;
        private String defaultEnvironmentVariable;
        private Map<String, String> environment = System.getenv();
        private SecretResolver secretResolver = SecretResolver.none();

        private Builder() {}

        /// Sets the character that introduces directive lines.
        ///
        /// @param statementMarker marker character, not whitespace, a letter or a digit
        /// @return this builder for chaining, never null
        /// @throws IllegalArgumentException if the marker is not allowed
        public Builder statementMarker(char statementMarker) {
            if (Character.isWhitespace(statementMarker) || Character.isLetterOrDigit(statementMarker)) {
                throw new IllegalArgumentException(
                        "statementMarker must not be whitespace, a letter or a digit: [" + statementMarker + "]");
            }
            this.statementMarker = statementMarker;
            return this;
        }

        /// Sets the reference bracket style.
        ///
        /// @param variableStyle the style, not null
        /// @return this builder for chaining, never null
        public Builder variableStyle(VariableStyle variableStyle) {
            this.variableStyle = Objects.requireNonNull(variableStyle, "variableStyle");
            return this;
        }

        public Builder processStatements(boolean processStatements) {
            this.processStatements = processStatements;
            return this;
        }

        public Builder expandVariables(boolean expandVariables) {
            this.expandVariables = expandVariables;
            return this;
        }

        /// Adds a comment line prefix.
        ///
        /// @param marker the prefix, e.g. `#` or `--`, not null
        /// @return this builder for chaining, never null
        /// @throws IllegalArgumentException if the marker is empty, contains
        ///         whitespace or contains characters other than ASCII or
        ///         Unicode punctuation such as `§`
        public Builder addCommentMarker(String marker) {
            commentMarkers.add(CommentMarkers.validate(marker));
            return this;
        }

        /// Removes all comment line prefixes, including the default `//`.
        ///
        /// @return this builder for chaining, never null
        public Builder clearCommentMarkers() {
            commentMarkers.clear();
            return this;
        }

        public Builder stripComments(boolean stripComments) {
            this.stripComments = stripComments;
            return this;
        }

        public Builder removeComments(boolean removeComments) {
            this.removeComments = removeComments;
            return this;
        }

        public Builder removeBlank(boolean removeBlank) {
            this.removeBlank = removeBlank;
            return this;
        }

        public Builder blankSuppressedLines(boolean blankSuppressedLines) {
            this.blankSuppressedLines = blankSuppressedLines;
            return this;
        }

        /// Sets the tab stop width.
        ///
        /// @param tabStop column width, `0` disables tab expansion
        /// @return this builder for chaining, never null
        /// @throws IllegalArgumentException if negative
        public Builder tabStop(int tabStop) {
            if (tabStop < 0) {
                throw new IllegalArgumentException("tabStop must be >= 0");
            }
            this.tabStop = tabStop;
            return this;
        }

        /// Sets the number of spaces prefixed to each non-blank output line.
        ///
        /// @param indent space count
        /// @return this builder for chaining, never null
        /// @throws IllegalArgumentException if negative
        public Builder indent(int indent) {
            if (indent < 0) {
                throw new IllegalArgumentException("indent must be >= 0");
            }
            this.indent = indent;
            return this;
        }

        public Builder lineEnding(LineEnding lineEnding) {
            this.lineEnding = Objects.requireNonNull(lineEnding, "lineEnding");
            return this;
        }

        /// Sets the substitute for undefined plain references.
        ///
        /// @param defaultVariable the value, or null to make undefined references fail
        /// @return this builder for chaining, never null
        public Builder defaultVariable(String defaultVariable) {
            this.defaultVariable = defaultVariable;
            return this;
        }

        /// Sets the substitute for undefined environment references.
        ///
        /// @param defaultEnvironmentVariable the value, or null to make undefined references fail
        /// @return this builder for chaining, never null
        public Builder defaultEnvironmentVariable(String defaultEnvironmentVariable) {
            this.defaultEnvironmentVariable = defaultEnvironmentVariable;
            return this;
        }

        /// Sets the environment that environment references resolve against.
        ///
        /// @param environment variable map, not null; copied
        /// @return this builder for chaining, never null
        public Builder environment(Map<String, String> environment) {
            this.environment = Map.copyOf(environment);
            return this;
        }

        /// Sets the resolver for secret, password and profile references.
        ///
        /// @param secretResolver the resolver, not null
        /// @return this builder for chaining, never null
        public Builder secretResolver(SecretResolver secretResolver) {
            this.secretResolver = Objects.requireNonNull(secretResolver, "secretResolver");
            return this;
        }

        /// Builds an immutable configuration from the current options.
        ///
        /// @return the configuration, never null
        public PreprocessorConfig build() {
            return new PreprocessorConfig(this);
        }
    }
}
