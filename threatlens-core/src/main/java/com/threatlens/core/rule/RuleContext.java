package com.threatlens.core.rule;

import com.threatlens.core.model.AddedLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Context passed to a {@link Rule} for one line.
 *
 * @param linesInFile all added lines of the current file, in diff order
 * @param indexInFile index of the line under evaluation within {@code linesInFile}
 */
public record RuleContext(
    List<AddedLine> linesInFile,
    int indexInFile
) {
    /**
     * Compact constructor with validation.
     */
    public RuleContext {
        Objects.requireNonNull(linesInFile, "linesInFile must not be null");
        if (indexInFile < 0 || indexInFile >= linesInFile.size()) {
            throw new IndexOutOfBoundsException(
                "indexInFile " + indexInFile + " outside [0, " + linesInFile.size() + ")");
        }
    }

    /**
     * Returns the text of the added lines within {@code distance} positions of the current line.
     *
     * <p>Distance counts added lines, not new-file line numbers: lines that were not added by
     * the diff are never part of the window.
     *
     * @param distance number of lines before and after the current line
     * @return line texts of the window, current line included, in diff order
     */
    public List<String> window(int distance) {
        int start = Math.max(0, indexInFile - distance);
        int end = Math.min(linesInFile.size() - 1, indexInFile + distance);

        List<String> texts = new ArrayList<>(end - start + 1);
        for (int i = start; i <= end; i++) {
            texts.add(linesInFile.get(i).text());
        }
        return texts;
    }
}
