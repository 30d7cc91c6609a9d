package com.codesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of analyzing several units with the same options.
 *
 * @param totalProcessed number of units processed
 * @param successful units analyzed successfully
 * @param failed units rejected or failed
 * @param results per-unit outcomes in submission order
 */
public record BatchReport(
    @JsonProperty("total_processed") int totalProcessed,
    @JsonProperty("successful") int successful,
    @JsonProperty("failed") int failed,
    @JsonProperty("results") List<BatchEntry> results
) {
    public BatchReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * Builds a batch report, deriving the counters from the entries.
     *
     * @param results per-unit outcomes
     * @return batch report
     */
    public static BatchReport of(List<BatchEntry> results) {
        int successful = (int) results.stream().filter(BatchEntry::success).count();
        return new BatchReport(results.size(), successful, results.size() - successful, results);
    }
}
