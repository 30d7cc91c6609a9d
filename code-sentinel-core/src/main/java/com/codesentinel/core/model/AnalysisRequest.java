package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request-shaped input consumed at the boundary.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "code": "password = \"admin123\"",
 *   "file_name": "settings.py",
 *   "options": { "security": true, "performance": false }
 * }
 * }</pre>
 *
 * @param code source text
 * @param fileName optional file name
 * @param options category switches, all on when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisRequest(
    @JsonProperty("code") String code,
    @JsonProperty("file_name") String fileName,
    @JsonProperty("options") AnalysisFlags options
) {
    public AnalysisRequest {
        if (options == null) {
            options = AnalysisFlags.defaults();
        }
    }

    /**
     * Returns the source unit described by this request.
     *
     * @return source unit
     */
    public SourceUnit toSourceUnit() {
        return new SourceUnit(code, fileName);
    }
}
