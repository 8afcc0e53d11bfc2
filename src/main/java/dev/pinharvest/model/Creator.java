package dev.pinharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The account that published a pin */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Creator(
		@JsonProperty("name") String name,
		@JsonProperty("username") String username,
		@JsonProperty("id") String id,
		@JsonProperty("follower_count") Integer followerCount,
		@JsonProperty("avatar_url") String avatarUrl) {}
