package io.prepro.core.variable;

/// A variable reference found in a line of text.
///
/// @param kind the reference kind, not null
/// @param body the name, or `kind:name[:vault]` for secrets, not null
/// @param text the full reference text including delimiters, not null
/// @param start index of the first character of the reference
/// @param end index after the last character of the reference
public record VariableReference(ReferenceKind kind, String body, String text, int start, int end) {}
