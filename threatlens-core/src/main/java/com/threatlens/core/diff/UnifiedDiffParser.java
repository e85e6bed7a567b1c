package com.threatlens.core.diff;

import com.threatlens.core.model.AddedLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts added lines from unified diff text.
 *
 * <p>The parser is total: any input, including empty or malformed text, yields a
 * (possibly empty) list and never throws.
 *
 * <p><b>Tracking rules:</b>
 * <ul>
 *   <li>{@code +++ b/path} selects the current file; {@code +++ /dev/null} selects no file</li>
 *   <li>{@code @@ -a,b +c,d @@} starts a hunk whose first new-file line is {@code c}, at least 1</li>
 *   <li>{@code +} lines are emitted and advance the new-file counter</li>
 *   <li>context lines (leading space) advance the counter only</li>
 *   <li>{@code -} lines and anything outside a hunk are skipped</li>
 * </ul>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * List<AddedLine> lines = new UnifiedDiffParser().parse(diffText);
 * }</pre>
 *
 * @since 1.0.0
 */
public class UnifiedDiffParser {

    private static final Logger log = LoggerFactory.getLogger(UnifiedDiffParser.class);

    private static final Pattern HUNK_HEADER =
        Pattern.compile("^@@\\s+-\\d+(?:,\\d+)?\\s+\\+(\\d+)(?:,\\d+)?\\s+@@");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private static final String NEW_FILE_HEADER = "+++ ";
    private static final String DEV_NULL = "/dev/null";
    private static final String NEW_SIDE_PREFIX = "b/";

    /**
     * Parses diff text into added lines, in diff order.
     *
     * @param diffText unified diff text; null is treated as empty
     * @return added lines with file path and new-file line number
     */
    public List<AddedLine> parse(String diffText) {
        List<AddedLine> added = new ArrayList<>();
        if (diffText == null || diffText.isEmpty()) {
            return added;
        }

        String currentFile = null;
        int newLineNumber = 0;
        boolean inHunk = false;

        for (String rawLine : LINE_BREAK.split(diffText, -1)) {
            if (rawLine.startsWith(NEW_FILE_HEADER)) {
                currentFile = parseNewFilePath(rawLine);
                inHunk = false;
                continue;
            }

            Matcher hunk = HUNK_HEADER.matcher(rawLine);
            if (hunk.find()) {
                newLineNumber = parseLineNumber(hunk.group(1));
                inHunk = true;
                continue;
            }

            if (!inHunk || currentFile == null) {
                continue;
            }

            if (rawLine.startsWith("+")) {
                added.add(new AddedLine(currentFile, newLineNumber, rawLine.substring(1)));
                newLineNumber = advance(newLineNumber);
            } else if (rawLine.startsWith(" ")) {
                newLineNumber = advance(newLineNumber);
            }
            // '-' lines and "\ No newline at end of file" do not exist in the new file
        }

        log.debug("Parsed {} added lines", added.size());
        return added;
    }

    private String parseNewFilePath(String rawLine) {
        String value = rawLine.substring(NEW_FILE_HEADER.length()).trim();
        if (value.equals(DEV_NULL)) {
            return null;
        }
        if (value.startsWith(NEW_SIDE_PREFIX)) {
            return value.substring(NEW_SIDE_PREFIX.length());
        }
        return value;
    }

    private int parseLineNumber(String digits) {
        try {
            return Math.max(1, Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            // digits overflowing int; no real file has that many lines
            return Integer.MAX_VALUE;
        }
    }

    /**
     * Moves to the next new-file line, saturating at {@link Integer#MAX_VALUE}.
     */
    private static int advance(int lineNumber) {
        return lineNumber == Integer.MAX_VALUE ? lineNumber : lineNumber + 1;
    }
}
