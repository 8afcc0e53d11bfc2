package dev.pinharvest.download;

import dev.pinharvest.model.Pin;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the ordered list of URLs to try for the image of a pin. Each URL is scored by the size
 * encoded in its label or path (width times height); {@code original} beats any finite size and a
 * missing height counts as 1.5 times the width. The list is sorted best first and deduplicated,
 * and is never reordered while a download runs.
 */
public class CandidateUrls {
	static final double ORIGINAL = Double.POSITIVE_INFINITY;
	static final double UNKNOWN = 0;

	private static final Pattern LABEL_SIZE = Pattern.compile("^(\\d+)(?:x(\\d+)?)?$");
	private static final Pattern PATH_SIZE = Pattern.compile("/(\\d+)x(\\d*)/");
	private static final Pattern SUFFIX_SIZE = Pattern.compile("[_-](\\d+)\\.(?:jpe?g|png|gif|webp)$");
	private static final Pattern PINIMG_SIZED = Pattern.compile("^(https?://i\\.pinimg\\.com)/\\d+x\\d*/(.+)$");

	private record Candidate(String url, double score) {}

	/**
	 * Order labelled URLs best first.
	 *
	 * @param labelled size label to URL, e.g. {@code "736" -> https://i.pinimg.com/736x/...}
	 */
	public static List<String> resolve(Map<String, String> labelled) {
		List<Candidate> candidates = new ArrayList<>();
		for (var entry : labelled.entrySet()) {
			String url = entry.getValue();
			if (url == null || url.isBlank()) {
				continue;
			}
			double score = scoreLabel(entry.getKey());
			if (score == UNKNOWN) {
				score = scoreUrl(url);
			}
			candidates.add(new Candidate(url, score));
		}
		// List.sort is stable, so equal scores keep their input order
		candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());
		LinkedHashSet<String> unique = new LinkedHashSet<>();
		for (Candidate candidate : candidates) {
			unique.add(candidate.url());
		}
		return new ArrayList<>(unique);
	}

	/**
	 * Candidate URLs for a pin: its labelled image URLs and its largest image URL. When nothing
	 * is known to be the original, the originals rewrite of the best sized pinimg URL goes first.
	 */
	public static List<String> forPin(Pin pin) {
		Map<String, String> labelled = new LinkedHashMap<>(pin.imageUrls());
		if (pin.largestImageUrl() != null && !labelled.containsValue(pin.largestImageUrl())) {
			labelled.put("largest", pin.largestImageUrl());
		}
		List<String> ordered = resolve(labelled);
		if (ordered.isEmpty()) {
			return ordered;
		}
		String best = ordered.get(0);
		if (scoreOf(labelled, best) != ORIGINAL) {
			String original = toOriginal(best);
			if (!original.equals(best)) {
				LinkedHashSet<String> withOriginal = new LinkedHashSet<>();
				withOriginal.add(original);
				withOriginal.addAll(ordered);
				return new ArrayList<>(withOriginal);
			}
		}
		return ordered;
	}

	/** Rewrite a sized pinimg URL ({@code /736x/...}) to its {@code /originals/} form */
	public static String toOriginal(String url) {
		Matcher m = PINIMG_SIZED.matcher(url);
		return m.matches() ? m.group(1) + "/originals/" + m.group(2) : url;
	}

	static double scoreLabel(String label) {
		if (label == null) {
			return UNKNOWN;
		}
		String lower = label.trim().toLowerCase(Locale.ROOT);
		if (lower.equals("original") || lower.equals("orig") || lower.equals("originals")) {
			return ORIGINAL;
		}
		Matcher m = LABEL_SIZE.matcher(lower);
		return m.matches() ? area(m.group(1), m.group(2)) : UNKNOWN;
	}

	static double scoreUrl(String url) {
		if (url.contains("/originals/")) {
			return ORIGINAL;
		}
		Matcher m = PATH_SIZE.matcher(url);
		if (m.find()) {
			return area(m.group(1), m.group(2));
		}
		m = SUFFIX_SIZE.matcher(url.toLowerCase(Locale.ROOT));
		if (m.find()) {
			return area(m.group(1), null);
		}
		return UNKNOWN;
	}

	private static double scoreOf(Map<String, String> labelled, String url) {
		double best = scoreUrl(url);
		for (var entry : labelled.entrySet()) {
			if (url.equals(entry.getValue())) {
				best = Math.max(best, scoreLabel(entry.getKey()));
			}
		}
		return best;
	}

	private static double area(String width, String height) {
		double w = Double.parseDouble(width);
		double h = height != null && !height.isEmpty() ? Double.parseDouble(height) : w * 1.5;
		return w * h;
	}
}
