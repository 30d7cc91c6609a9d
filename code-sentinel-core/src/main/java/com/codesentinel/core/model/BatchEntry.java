package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one unit inside a batch.
 *
 * @param index position of the unit in the batch
 * @param fileName file name, or {@code file_<index>.py} when none was supplied
 * @param report analysis report, null if the unit could not be analyzed at all
 * @param error error message when {@code report} is null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchEntry(
    @JsonProperty("index") int index,
    @JsonProperty("file_name") String fileName,
    @JsonProperty("report") AnalysisReport report,
    @JsonProperty("error") String error
) {
    /**
     * Returns true if the unit was analyzed successfully.
     *
     * @return true when a successful report exists
     */
    @JsonProperty("success")
    public boolean success() {
        return report != null && report.success();
    }
}
