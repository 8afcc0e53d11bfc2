package dev.pinharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Represents a single harvested pin */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
	"id",
	"title",
	"description",
	"image_urls",
	"largest_image_url",
	"creator",
	"board",
	"categories",
	"stats",
	"url",
	"source_link",
	"downloaded",
	"download_path",
	"raw_data"
})
public class Pin {
	@JsonProperty("id")
	private String id;

	@JsonProperty("title")
	private String title;

	@JsonProperty("description")
	private String description;

	@JsonProperty("image_urls")
	private Map<String, String> imageUrls;

	@JsonProperty("largest_image_url")
	private String largestImageUrl;

	@JsonProperty("creator")
	private Creator creator;

	@JsonProperty("board")
	private Board board;

	@JsonProperty("categories")
	private List<String> categories;

	@JsonProperty("stats")
	private PinStats stats;

	@JsonProperty("url")
	private String url;

	@JsonProperty("source_link")
	private String sourceLink;

	@JsonProperty("downloaded")
	private boolean downloaded;

	@JsonProperty("download_path")
	private String downloadPath;

	@JsonProperty("raw_data")
	private Map<String, Object> rawData;

	public Pin() {
		imageUrls = new LinkedHashMap<>();
		categories = new ArrayList<>();
		rawData = new LinkedHashMap<>();
	}

	public String id() {
		return id;
	}

	public Pin id(String id) {
		this.id = id;
		return this;
	}

	public String title() {
		return title;
	}

	public Pin title(String title) {
		this.title = title;
		return this;
	}

	public String description() {
		return description;
	}

	public Pin description(String description) {
		this.description = description;
		return this;
	}

	public Map<String, String> imageUrls() {
		return imageUrls;
	}

	public Pin imageUrls(Map<String, String> imageUrls) {
		this.imageUrls = imageUrls != null ? new LinkedHashMap<>(imageUrls) : new LinkedHashMap<>();
		return this;
	}

	public Pin imageUrl(String sizeLabel, String url) {
		this.imageUrls.put(sizeLabel, url);
		return this;
	}

	public String largestImageUrl() {
		return largestImageUrl;
	}

	public Pin largestImageUrl(String largestImageUrl) {
		this.largestImageUrl = largestImageUrl;
		return this;
	}

	public Creator creator() {
		return creator;
	}

	public Pin creator(Creator creator) {
		this.creator = creator;
		return this;
	}

	public Board board() {
		return board;
	}

	public Pin board(Board board) {
		this.board = board;
		return this;
	}

	public List<String> categories() {
		return categories;
	}

	public Pin categories(List<String> categories) {
		this.categories = categories != null ? new ArrayList<>(categories) : new ArrayList<>();
		return this;
	}

	public PinStats stats() {
		return stats;
	}

	public Pin stats(PinStats stats) {
		this.stats = stats;
		return this;
	}

	public String url() {
		return url;
	}

	public Pin url(String url) {
		this.url = url;
		return this;
	}

	public String sourceLink() {
		return sourceLink;
	}

	public Pin sourceLink(String sourceLink) {
		this.sourceLink = sourceLink;
		return this;
	}

	public boolean downloaded() {
		return downloaded;
	}

	public Pin downloaded(boolean downloaded) {
		this.downloaded = downloaded;
		return this;
	}

	public String downloadPath() {
		return downloadPath;
	}

	public Pin downloadPath(String downloadPath) {
		this.downloadPath = downloadPath;
		return this;
	}

	public Map<String, Object> rawData() {
		return rawData;
	}

	public Pin rawData(Map<String, Object> rawData) {
		this.rawData = rawData != null ? new LinkedHashMap<>(rawData) : new LinkedHashMap<>();
		return this;
	}

	/** True if the pin carries at least one URL an image can be fetched from */
	public boolean hasImage() {
		return (largestImageUrl != null && !largestImageUrl.isBlank())
				|| imageUrls.values().stream().anyMatch(u -> u != null && !u.isBlank());
	}

	public static Pin create() {
		return new Pin();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Pin pin = (Pin) o;
		return Objects.equals(id, pin.id);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(id);
	}

	@Override
	public String toString() {
		return "Pin{id='" + id + "', title='" + title + "', largestImageUrl='" + largestImageUrl + "'}";
	}
}
