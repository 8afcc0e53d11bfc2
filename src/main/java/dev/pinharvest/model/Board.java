package dev.pinharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Board(
		@JsonProperty("id") String id, @JsonProperty("name") String name, @JsonProperty("url") String url) {}
