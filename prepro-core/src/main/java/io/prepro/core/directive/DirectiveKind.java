package io.prepro.core.directive;

import java.util.Optional;

/// The directives understood by the preprocessor.
public enum DirectiveKind {
    DEFINE("define", true),
    IF("if", true),
    ELSE("else", false),
    ENDIF("endif", false),
    SWITCH("switch", true),
    CASE("case", true),
    DEFAULT("default", false),
    ENDSWITCH("endswitch", false);

    private final String keyword;
    private final boolean takesArgument;

    DirectiveKind(String keyword, boolean takesArgument) {
        this.keyword = keyword;
        this.takesArgument = takesArgument;
    }

    /// Returns the keyword written after the statement marker.
    ///
    /// @return lower-case keyword, never null
    public String keyword() {
        return keyword;
    }

    /// Returns whether the directive is followed by an argument.
    ///
    /// @return `false` for `else`, `endif`, `default` and `endswitch`
    public boolean takesArgument() {
        return takesArgument;
    }

    /// Looks up a directive by keyword. Keywords are case sensitive.
    ///
    /// @param keyword candidate keyword, not null
    /// @return the directive kind, or empty if the keyword is not recognized
    public static Optional<DirectiveKind> fromKeyword(String keyword) {
        for (DirectiveKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
