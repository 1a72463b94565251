package io.prepro.core.format;

import io.prepro.core.PreprocessorConfig;
import java.util.Optional;

/// Applies comment handling, blank-line removal, tab expansion and indentation
/// to a line that is about to be emitted.
///
/// Steps, in order:
/// 1. Comment lines are removed (`removeComments`) or emptied (`stripComments`)
/// 2. Blank lines are removed when `removeBlank` is set
/// 3. Tabs are expanded to the next multiple of `tabStop`
/// 4. Non-blank lines are prefixed with `indent` spaces
///
/// Line terminators are not added here.
public class LineFormatter {

    private final CommentMarkers commentMarkers;
    private final boolean stripComments;
    private final boolean removeComments;
    private final boolean removeBlank;
    private final int tabStop;
    private final String indent;

    /// Creates a formatter from the formatting options of a configuration.
    ///
    /// @param config the configuration, not null
    public LineFormatter(PreprocessorConfig config) {
        this.commentMarkers = new CommentMarkers(config.getCommentMarkers());
        this.stripComments = config.isStripComments();
        this.removeComments = config.isRemoveComments();
        this.removeBlank = config.isRemoveBlank();
        this.tabStop = config.getTabStop();
        this.indent = " ".repeat(config.getIndent());
    }

    /// Formats a line.
    ///
    /// @param line the expanded line without terminator, not null
    /// @return the formatted line, or empty if the line is removed from the output
    public Optional<String> format(String line) {
        String text = line;

        if (commentMarkers.isComment(text)) {
            if (removeComments) {
                return Optional.empty();
            }
            if (stripComments) {
                text = "";
            }
        }

        if (removeBlank && text.isBlank()) {
            return Optional.empty();
        }

        if (tabStop > 0) {
            text = expandTabs(text, tabStop);
        }

        if (!indent.isEmpty() && !text.isBlank()) {
            text = indent + text;
        }

        return Optional.of(text);
    }

    /// Replaces each tab with the spaces needed to reach the next tab stop.
    ///
    /// @param text the text, not null
    /// @param tabStop column width, must be positive
    /// @return the text without tabs, never null
    public static String expandTabs(String text, int tabStop) {
        if (text.indexOf('\t') < 0) {
            return text;
        }

        StringBuilder result = new StringBuilder(text.length() + tabStop * 2);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\t') {
                int spaces = tabStop - (result.length() % tabStop);
                result.append(" ".repeat(spaces));
            } else {
                result.append(ch);
            }
        }
        return result.toString();
    }
}
