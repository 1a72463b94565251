package io.prepro.core.variable;

/// Kind of variable reference, distinguished by delimiter nesting depth.
///
/// @see VariableStyle
public enum ReferenceKind {

    /// `$<name>`: a symbol table variable, expanded recursively.
    PLAIN(1),

    /// `$<<NAME>>`: an environment variable, substituted literally.
    ENVIRONMENT(2),

    /// `$<<<kind:name[:vault]>>>`: a secret, password or profile value.
    SECRET(3);

    private final int depth;

    ReferenceKind(int depth) {
        this.depth = depth;
    }

    /// Returns how many opening delimiters introduce this kind.
    ///
    /// @return delimiter count, 1 to 3
    public int depth() {
        return depth;
    }
}
