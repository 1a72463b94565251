package io.prepro.core.format;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// Recognizes comment lines by their leading marker.
///
/// A line is a comment when, after leading whitespace, it starts with one of
/// the markers. A marker further along the line does not make it a comment.
public final class CommentMarkers {

    /// The marker used when none is configured: `//`.
    public static final String DEFAULT = "//";

    private static final Pattern MARKER_PATTERN = Pattern.compile("[\\p{Punct}\\p{IsPunctuation}]+");

    private final List<String> markers;

    /// Creates a matcher for the given markers.
    ///
    /// @param markers comment prefixes, not null (may be empty, which matches nothing)
    public CommentMarkers(Set<String> markers) {
        this.markers = List.copyOf(markers);
    }

    /// Validates a comment marker.
    ///
    /// @param marker candidate marker, may be null
    /// @return the marker, never null
    /// @throws IllegalArgumentException if the marker is null, empty, contains
    ///         whitespace or contains characters other than ASCII or Unicode
    ///         punctuation
    public static String validate(String marker) {
        if (marker == null || marker.isEmpty()) {
            throw new IllegalArgumentException("Comment marker must not be empty.");
        }
        if (!MARKER_PATTERN.matcher(marker).matches()) {
            throw new IllegalArgumentException(
                    "Comment marker must consist of punctuation characters without whitespace: ["
                            + marker
                            + "]");
        }
        return marker;
    }

    /// Checks whether a line is a comment.
    ///
    /// @param line the line, not null
    /// @return `true` if the first non-whitespace text starts with a marker
    public boolean isComment(String line) {
        int start = 0;
        while (start < line.length() && Character.isWhitespace(line.charAt(start))) {
            start++;
        }
        for (String marker : markers) {
            if (line.startsWith(marker, start)) {
                return true;
            }
        }
        return false;
    }

    public List<String> markers() {
        return markers;
    }
}
