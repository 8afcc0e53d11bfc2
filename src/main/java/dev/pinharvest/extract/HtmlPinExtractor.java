package dev.pinharvest.extract;

import com.fasterxml.jackson.databind.JsonNode;
import dev.pinharvest.download.CandidateUrls;
import dev.pinharvest.model.Pin;
import dev.pinharvest.util.JsonUtils;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts pins from a rendered search or pin page with Jsoup. Pin cards are located with the
 * first selector that matches anything; when no card yields a pin the embedded {@code
 * __PWS_DATA__} state is read instead.
 */
public class HtmlPinExtractor implements PinExtractor {
	private static final Logger logger = LoggerFactory.getLogger(HtmlPinExtractor.class);

	public static final List<String> PIN_SELECTORS = List.of(
			"[data-test-id=pin]",
			"[data-test-id=pinWrapper]",
			"div[data-test-id=pin-card]",
			"div[role=listitem]",
			".Grid__Item",
			".Collection-Item");

	private static final List<String> TITLE_SELECTORS =
			List.of("[data-test-id=pinTitle]", "h1", "div[class*=title]");

	private static final Pattern PIN_HREF = Pattern.compile("/pin/(\\d+)/?");
	private static final Pattern PATH_SIZE = Pattern.compile("/(\\d+)x\\d*/");

	@Override
	public List<Pin> extractRecords(String html) {
		if (html == null || html.isEmpty()) {
			return List.of();
		}
		Document doc = Jsoup.parse(html);
		Elements cards = new Elements();
		for (String selector : PIN_SELECTORS) {
			cards = doc.select(selector);
			if (!cards.isEmpty()) {
				logger.trace("Selector '{}' matched {} pin cards", selector, cards.size());
				break;
			}
		}

		Map<String, Pin> pins = new LinkedHashMap<>();
		for (Element card : cards) {
			Pin pin = parseCard(card);
			if (pin != null && pin.hasImage()) {
				pins.putIfAbsent(pin.id(), pin);
			}
		}
		if (pins.isEmpty()) {
			for (Pin pin : fromEmbeddedState(doc)) {
				if (pin.hasImage()) {
					pins.putIfAbsent(pin.id(), pin);
				}
			}
		}
		return new ArrayList<>(pins.values());
	}

	private Pin parseCard(Element card) {
		String id = pinId(card);
		if (id == null) {
			return null;
		}
		Pin pin = Pin.create().id(id).url("https://www.pinterest.com/pin/" + id + "/");

		Element img = card.selectFirst("img[srcset], img[src]");
		if (img != null) {
			if (img.hasAttr("srcset")) {
				parseSrcset(img.attr("srcset"), pin);
			}
			if (pin.imageUrls().isEmpty() && img.hasAttr("src")) {
				addSrc(img.attr("src"), pin);
			}
			List<String> ordered = CandidateUrls.resolve(pin.imageUrls());
			pin.largestImageUrl(ordered.isEmpty() ? null : ordered.get(0));
		}

		for (String selector : TITLE_SELECTORS) {
			Element title = card.selectFirst(selector);
			if (title != null && !title.text().isBlank()) {
				pin.title(title.text().trim());
				break;
			}
		}
		if (img != null) {
			for (String attr : List.of("alt", "title", "aria-label")) {
				if (!img.attr(attr).isBlank()) {
					pin.description(img.attr(attr).trim());
					break;
				}
			}
		}
		return pin;
	}

	private static String pinId(Element card) {
		String id = card.attr("data-pin-id");
		if (!id.isBlank()) {
			return id.trim();
		}
		for (Element link : card.select("a[href]")) {
			Matcher m = PIN_HREF.matcher(link.attr("href"));
			if (m.find()) {
				return m.group(1);
			}
		}
		return null;
	}

	// "url 1x, url 2x" or "url 236w"; labels come from the size in the URL path when present
	private static void parseSrcset(String srcset, Pin pin) {
		for (String part : srcset.split(",")) {
			String[] tokens = part.trim().split("\\s+");
			if (tokens.length == 0 || tokens[0].isEmpty()) {
				continue;
			}
			String url = tokens[0];
			String label = sizeLabel(url);
			if (label == null) {
				label = tokens.length > 1 ? tokens[1].replaceAll("[^0-9]", "") : "";
			}
			pin.imageUrl(label.isEmpty() ? "unknown" : label, url);
		}
	}

	private static void addSrc(String src, Pin pin) {
		String label = sizeLabel(src);
		pin.imageUrl(label != null ? label : "src", src);
		String original = CandidateUrls.toOriginal(src);
		if (!original.equals(src)) {
			pin.imageUrl("original", original);
		}
	}

	private static String sizeLabel(String url) {
		if (url.contains("/originals/")) {
			return "original";
		}
		Matcher m = PATH_SIZE.matcher(url);
		return m.find() ? m.group(1) : null;
	}

	private List<Pin> fromEmbeddedState(Document doc) {
		List<Pin> result = new ArrayList<>();
		Element script = doc.selectFirst("script#__PWS_DATA__");
		if (script == null) {
			return result;
		}
		try {
			JsonNode pinsNode = JsonUtils.readTree(script.data()).path("props").path("initialReduxState").path("pins");
			Iterator<JsonNode> it = pinsNode.elements();
			while (it.hasNext()) {
				Pin pin = PinJsonMapper.toPin(it.next());
				if (pin != null) {
					result.add(pin);
				}
			}
		} catch (IOException e) {
			logger.debug("Unreadable embedded page state: {}", e.getMessage());
		}
		return result;
	}
}
