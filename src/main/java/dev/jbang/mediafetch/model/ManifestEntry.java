package dev.jbang.mediafetch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One attachment listed in a download manifest. The filename is optional; without it a name is
 * derived from the id and the URL.
 */
@JsonPropertyOrder({"id", "url", "filename"})
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestEntry(
		@JsonProperty("id") String id,
		@JsonProperty("url") String url,
		@JsonProperty("filename") String filename) {}
