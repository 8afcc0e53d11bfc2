package dev.pinharvest.extract;

import com.fasterxml.jackson.databind.JsonNode;
import dev.pinharvest.model.Board;
import dev.pinharvest.model.Creator;
import dev.pinharvest.model.Pin;
import dev.pinharvest.model.PinStats;
import dev.pinharvest.util.JsonUtils;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** Maps pin objects of the site's JSON (API results and embedded page state) to {@link Pin} */
public class PinJsonMapper {
	private static final String SITE = "https://www.pinterest.com";

	/**
	 * Map one pin object.
	 *
	 * @return the pin, or null if the object has no id
	 */
	public static Pin toPin(JsonNode node) {
		String id = text(node, "id");
		if (id == null || id.isEmpty()) {
			return null;
		}
		Pin pin = Pin.create()
				.id(id)
				.title(firstText(node, "title", "grid_title"))
				.description(firstText(node, "description", "closeup_unified_description"))
				.url(SITE + "/pin/" + id + "/")
				.sourceLink(text(node, "link"));

		JsonNode images = node.path("images");
		if (images.isObject()) {
			Iterator<Map.Entry<String, JsonNode>> it = images.fields();
			while (it.hasNext()) {
				Map.Entry<String, JsonNode> image = it.next();
				String url = text(image.getValue(), "url");
				if (url == null) {
					continue;
				}
				String label = image.getKey().equals("orig") ? "original" : image.getKey().replace("x", "");
				pin.imageUrl(label, url);
			}
		}
		String largest = pin.imageUrls().get("original");
		if (largest == null) {
			largest = pin.imageUrls().entrySet().stream()
					.filter(e -> e.getKey().matches("\\d+"))
					.max((a, b) -> Integer.compare(Integer.parseInt(a.getKey()), Integer.parseInt(b.getKey())))
					.map(Map.Entry::getValue)
					.orElse(null);
		}
		pin.largestImageUrl(largest);

		JsonNode creator = node.has("creator") ? node.path("creator") : node.path("pinner");
		if (creator.isObject()) {
			String username = text(creator, "username");
			String name = firstText(creator, "full_name", "username", "name");
			pin.creator(new Creator(
					name,
					username,
					text(creator, "id"),
					creator.path("follower_count").isNumber() ? creator.path("follower_count").asInt() : null,
					text(creator, "image_medium_url")));
		}

		JsonNode board = node.path("board");
		if (board.isObject()) {
			String boardName = text(board, "name");
			String path = text(board, "url");
			String boardUrl = path != null && !path.isEmpty() ? SITE + "/" + stripLeadingSlash(path) : null;
			pin.board(new Board(text(board, "id"), boardName, boardUrl));
			if (boardName != null && !boardName.isBlank()) {
				List<String> categories = new ArrayList<>();
				for (String part : boardName.split("/")) {
					if (!part.isBlank()) {
						categories.add(part.trim());
					}
				}
				pin.categories(categories);
			}
		}

		JsonNode aggregated = node.path("aggregated_pin_data").path("aggregated_stats");
		pin.stats(new PinStats(
				count(node, aggregated, "like_count"),
				Math.max(count(node, aggregated, "repin_count"), aggregated.path("saves").asInt(0)),
				count(node, aggregated, "comment_count")));

		pin.rawData(JsonUtils.toMap(node));
		return pin;
	}

	private static int count(JsonNode node, JsonNode aggregated, String field) {
		if (node.path(field).isNumber()) {
			return node.path(field).asInt();
		}
		return aggregated.path(field).asInt(0);
	}

	private static String firstText(JsonNode node, String... fields) {
		for (String field : fields) {
			String value = text(node, field);
			if (value != null && !value.isBlank()) {
				return value;
			}
		}
		return null;
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.path(field);
		return value.isValueNode() && !value.isNull() ? value.asText() : null;
	}

	private static String stripLeadingSlash(String path) {
		return path.startsWith("/") ? path.substring(1) : path;
	}
}
