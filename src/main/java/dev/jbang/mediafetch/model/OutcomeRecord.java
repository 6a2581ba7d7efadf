package dev.jbang.mediafetch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.jbang.mediafetch.governor.TaskOutcome;
import java.util.Locale;

/** A terminal task outcome as written to the download report */
@JsonPropertyOrder({"id", "status", "file", "size", "attempts", "elapsed_ms", "error_kind", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutcomeRecord(
		@JsonProperty("id") String id,
		@JsonProperty("status") String status,
		@JsonProperty("file") String file,
		@JsonProperty("size") long size,
		@JsonProperty("attempts") int attempts,
		@JsonProperty("elapsed_ms") long elapsedMillis,
		@JsonProperty("error_kind") String errorKind,
		@JsonProperty("error") String error) {

	public static OutcomeRecord of(TaskOutcome outcome) {
		return new OutcomeRecord(
				outcome.taskId(),
				outcome.status().name().toLowerCase(Locale.ROOT),
				outcome.destination().toString(),
				outcome.bytesWritten(),
				outcome.attempts(),
				outcome.elapsed().toMillis(),
				outcome.error() != null ? outcome.error().kind().name().toLowerCase(Locale.ROOT) : null,
				outcome.errorMessage());
	}
}
