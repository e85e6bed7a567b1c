package com.threatlens.core.model;

import java.util.Objects;

/**
 * A line introduced by a diff.
 *
 * @param filePath path of the file in the new revision (without {@code b/} prefix)
 * @param lineNumber 1-based position in the new file
 * @param text line content without the leading {@code +} marker
 */
public record AddedLine(
    String filePath,
    int lineNumber,
    String text
) {
    /**
     * Compact constructor with validation.
     */
    public AddedLine {
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
