package dev.jbang.mediafetch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.jbang.mediafetch.stats.DownloadStats;
import java.util.List;

/** Contents of the JSON report written by the download command */
@JsonPropertyOrder({"summary", "stats", "outcomes"})
public record DownloadReportFile(
		@JsonProperty("summary") String summary,
		@JsonProperty("stats") DownloadStats stats,
		@JsonProperty("outcomes") List<OutcomeRecord> outcomes) {}
