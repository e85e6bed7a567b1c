package com.threatlens.core;

import com.threatlens.core.model.Finding;
import com.threatlens.core.model.FindingSource;
import com.threatlens.core.model.Severity;

/**
 * Builds findings for tests.
 */
public final class TestFindings {

    private TestFindings() {
    }

    public static Finding rule(String ruleId, Severity severity, String filePath, int line) {
        return new Finding(ruleId, ruleId, severity, "test finding", filePath, line,
            "evidence " + line, FindingSource.RULE, null);
    }

    public static Finding advisory(String ruleId, Severity severity, String filePath, int line) {
        return new Finding(ruleId, ruleId, severity, "test finding (advisory)", filePath, line,
            "evidence " + line, FindingSource.ADVISORY, 0.8);
    }
}
