package io.prepro.core.directive;

/// A directive line split into its keyword and argument.
///
/// @param kind the directive, not null
/// @param argument text after the keyword, trimmed; empty when absent
/// @param line the source line as read, not null
public record Directive(DirectiveKind kind, String argument, String line) {

    public boolean hasArgument() {
        return !argument.isEmpty();
    }
}
