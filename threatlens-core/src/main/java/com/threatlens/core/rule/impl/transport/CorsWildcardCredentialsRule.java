package com.threatlens.core.rule.impl.transport;

import com.threatlens.core.model.AddedLine;
import com.threatlens.core.model.Severity;
import com.threatlens.core.rule.RuleContext;
import com.threatlens.core.rule.base.AbstractRule;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Flags a wildcard CORS origin combined with credentials enabled.
 *
 * <p>The two settings usually sit on separate lines, so the rule looks at a window of
 * {@value #WINDOW_DISTANCE} added lines before and after the current one. Every added line
 * inside a window that holds both signals is reported.
 *
 * <p><b>Limitation:</b> the window only contains added lines of the same file. If one of the
 * settings already existed in the file and only the other is added, nothing is reported.
 */
public class CorsWildcardCredentialsRule extends AbstractRule {

    static final int WINDOW_DISTANCE = 5;

    private static final Pattern WILDCARD_ORIGIN = Pattern.compile(
        "origin\\s*:\\s*[\"'`]\\*[\"'`]", Pattern.CASE_INSENSITIVE);
    private static final Pattern WILDCARD_ORIGIN_HEADER = Pattern.compile(
        "Access-Control-Allow-Origin\\s*[:=]\\s*[\"'`]\\*[\"'`]", Pattern.CASE_INSENSITIVE);
    private static final Pattern CREDENTIALS = Pattern.compile(
        "credentials\\s*:\\s*true", Pattern.CASE_INSENSITIVE);
    private static final Pattern CREDENTIALS_HEADER = Pattern.compile(
        "Access-Control-Allow-Credentials\\s*[:=]\\s*[\"'`]true[\"'`]", Pattern.CASE_INSENSITIVE);

    public CorsWildcardCredentialsRule() {
        super(
            "cors-wildcard-credentials",
            "Wildcard CORS origin with credentials",
            Severity.HIGH,
            "Using origin '*' with credentials enabled can leak authenticated data cross-site.");
    }

    @Override
    public Optional<String> match(AddedLine line, RuleContext context) {
        String window = String.join("\n", context.window(WINDOW_DISTANCE));

        boolean wildcardOrigin = WILDCARD_ORIGIN.matcher(window).find()
            || WILDCARD_ORIGIN_HEADER.matcher(window).find();
        if (!wildcardOrigin) {
            return noMatch();
        }

        boolean credentials = CREDENTIALS.matcher(window).find()
            || CREDENTIALS_HEADER.matcher(window).find();
        return credentials ? evidence(line) : noMatch();
    }
}
