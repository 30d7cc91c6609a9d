package com.codesentinel.core.report.render;

import com.codesentinel.core.model.AnalysisReport;

/**
 * Formats an {@link AnalysisReport} for output.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI); the CLI selects
 * one by {@link #getId()} from its {@code --format} option.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codesentinel.core.report.render.ReportRenderer}
 *
 * @see RenderContext
 * @see ReportRenderers
 */
public interface ReportRenderer {

    /**
     * Returns unique identifier for this renderer. Should be lowercase
     * (e.g., "text", "json", "markdown").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns the file extension conventionally used for this format, without the dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Renders a report.
     *
     * @param report report to render
     * @param context rendering settings
     * @return rendered document
     * @throws IllegalStateException if the report cannot be rendered
     */
    String render(AnalysisReport report, RenderContext context);
}
