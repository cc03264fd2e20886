package com.pagesentry.analyze.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestSummary(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("main_url") String mainUrl,
    @JsonProperty("total_pages") int totalPages,
    @JsonProperty("total_matches") int totalMatches,
    @JsonProperty("categories") List<String> categories,
    @JsonProperty("status") String status,
    @JsonProperty("batch_num") Integer batchNum,
    @JsonProperty("batch_pages") Integer batchPages,
    @JsonProperty("batch_matches") Integer batchMatches,
    @JsonProperty("validation_enabled") boolean validationEnabled
) {
    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_COMPLETED = "completed";

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }
}
