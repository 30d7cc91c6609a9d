package com.codesentinel.core.report.render.impl;

import com.codesentinel.core.model.AnalysisReport;
import com.codesentinel.core.report.render.RenderContext;
import com.codesentinel.core.report.render.ReportRenderer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Pretty-printed JSON in the snake_case shape of the analysis API.
 */
public class JsonReportRenderer implements ReportRenderer {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String render(AnalysisReport report, RenderContext context) {
        try {
            return JSON_MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report: " + e.getMessage(), e);
        }
    }
}
