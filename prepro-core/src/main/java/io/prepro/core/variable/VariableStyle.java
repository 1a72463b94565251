package io.prepro.core.variable;

import java.util.regex.Pattern;

/// Bracket style used to recognize variable references.
///
/// Every style supports the three {@link ReferenceKind}s by repeating its
/// delimiters:
///
/// | Style   | Plain     | Environment   | Secret                          |
/// |---------|-----------|---------------|---------------------------------|
/// | `ANGLE` | `$<name>` | `$<<NAME>>`   | `$<<<secret:name:vault>>>`      |
/// | `CURLY` | `${name}` | `${{NAME}}`   | `${{{secret:name:vault}}}`      |
/// | `PAREN` | `$(name)` | `$((NAME))`   | `$(((secret:name:vault)))`      |
///
/// Use a non-default style when the angle form conflicts with the syntax of
/// the text being processed.
public enum VariableStyle {
    ANGLE('<', '>'),
    CURLY('{', '}'),
    PAREN('(', ')');

    /// Characters allowed in variable and environment variable names.
    public static final String NAME_CHARS = "[A-Za-z0-9_.\\-]";

    private final char open;
    private final char close;
    private final Pattern pattern;

    VariableStyle(char open, char close) {
        this.open = open;
        this.close = close;
        this.pattern = compile(open, close);
    }

    /// Returns the reference pattern for this style.
    ///
    /// Alternatives are ordered so that, at any position, the secret form wins
    /// over the environment form, which wins over the plain form. Named groups
    /// `secret`, `env` and `plain` capture the reference body.
    ///
    /// @return compiled pattern, never null
    public Pattern pattern() {
        return pattern;
    }

    /// Formats a reference in this style.
    ///
    /// @param kind reference kind, not null
    /// @param body the name, or `kind:name[:vault]` for secrets, not null
    /// @return reference text, e.g. `$<<HOME>>`, never null
    public String format(ReferenceKind kind, String body) {
        String o = String.valueOf(open).repeat(kind.depth());
        String c = String.valueOf(close).repeat(kind.depth());
        return "$" + o + body + c;
    }

    private static Pattern compile(char open, char close) {
        String o = Pattern.quote(String.valueOf(open));
        String c = Pattern.quote(String.valueOf(close));
        String name = NAME_CHARS + "+";
        String secret =
                "\\$" + o + o + o + "(?<secret>[A-Za-z]+:" + name + "(?::" + name + ")?)" + c + c + c;
        String env = "\\$" + o + o + "(?<env>" + name + ")" + c + c;
        String plain = "\\$" + o + "(?<plain>" + name + ")" + c;
        return Pattern.compile(secret + "|" + env + "|" + plain);
    }
}
