package dev.pinharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Engagement counters as reported by the site */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PinStats(
		@JsonProperty("likes") int likes, @JsonProperty("saves") int saves, @JsonProperty("comments") int comments) {

	public static final PinStats EMPTY = new PinStats(0, 0, 0);
}
