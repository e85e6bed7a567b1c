package com.threatlens.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.threatlens.core.service.ScanError;
import com.threatlens.core.service.ScanResponse;

/**
 * Pretty-printed JSON report, the same document an HTTP front end would return.
 *
 * <p>Errors are rendered as {@code {"error": "...", "status": 400}} with the status taken from
 * {@link com.threatlens.core.service.ErrorKind#httpStatus()}.
 */
public class JsonReportFormatter implements ReportFormatter {

    private final ObjectMapper objectMapper;

    public JsonReportFormatter() {
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String format(ScanResponse response) {
        return write(response);
    }

    @Override
    public String formatError(ScanError error) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("error", error.message());
        body.put("status", error.kind().httpStatus());
        return write(body);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }
}
