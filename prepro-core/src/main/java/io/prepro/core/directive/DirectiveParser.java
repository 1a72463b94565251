package io.prepro.core.directive;

import java.util.Optional;

/// Recognizes directive lines.
///
/// A line is a directive when its first non-whitespace character is the
/// statement marker, immediately followed by a known keyword that ends at
/// whitespace or at the end of the line. Lines such as `#!/bin/sh` or
/// `# note` are not directives.
public class DirectiveParser {

    private final char statementMarker;

    public DirectiveParser(char statementMarker) {
        this.statementMarker = statementMarker;
    }

    /// Parses a line as a directive.
    ///
    /// @param line the source line, not null
    /// @return the directive, or empty if the line is ordinary text
    public Optional<Directive> parse(String line) {
        int pos = 0;
        while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
            pos++;
        }
        if (pos >= line.length() || line.charAt(pos) != statementMarker) {
            return Optional.empty();
        }

        int keywordStart = ++pos;
        while (pos < line.length() && Character.isLetter(line.charAt(pos))) {
            pos++;
        }
        if (pos < line.length() && !Character.isWhitespace(line.charAt(pos))) {
            return Optional.empty();
        }

        String keyword = line.substring(keywordStart, pos);
        String argument = line.substring(pos).trim();
        return DirectiveKind.fromKeyword(keyword).map(kind -> new Directive(kind, argument, line));
    }
}
