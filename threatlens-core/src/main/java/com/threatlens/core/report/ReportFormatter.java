package com.threatlens.core.report;

import com.threatlens.core.service.ScanError;
import com.threatlens.core.service.ScanResponse;

/**
 * Turns scan results into text for a terminal, a CI log or another program.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CountReportFormatter implements ReportFormatter {
 *     public String getId() { return "count"; }
 *     public String format(ScanResponse response) { return String.valueOf(response.summary().total()); }
 *     public String formatError(ScanError error) { return error.message(); }
 * }
 * }</pre>
 */
public interface ReportFormatter {

    /**
     * Returns the format name used on the command line (e.g. "pretty", "json").
     *
     * @return format identifier
     */
    String getId();

    /**
     * Formats a successful scan.
     *
     * @param response scan response
     * @return formatted report
     */
    String format(ScanResponse response);

    /**
     * Formats a rejected scan.
     *
     * @param error scan error
     * @return formatted error
     */
    String formatError(ScanError error);
}
