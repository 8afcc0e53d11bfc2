package dev.pinharvest.download;

import static org.assertj.core.api.Assertions.*;

import dev.pinharvest.model.Pin;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CandidateUrlsTest {

	@Test
	void testResolve_OriginalFirstThenBySize() {
		// Given
		Map<String, String> labelled = new LinkedHashMap<>();
		labelled.put("170", "https://i.pinimg.com/170x/aa/p1.jpg");
		labelled.put("original", "https://i.pinimg.com/originals/aa/p1.jpg");
		labelled.put("736", "https://i.pinimg.com/736x/aa/p1.jpg");

		// When
		List<String> ordered = CandidateUrls.resolve(labelled);

		// Then
		assertThat(ordered).containsExactly(
				"https://i.pinimg.com/originals/aa/p1.jpg",
				"https://i.pinimg.com/736x/aa/p1.jpg",
				"https://i.pinimg.com/170x/aa/p1.jpg");
	}

	@Test
	void testResolve_DropsBlankAndDuplicateUrls() {
		// Given
		Map<String, String> labelled = new LinkedHashMap<>();
		labelled.put("236x", "https://i.pinimg.com/236x/aa/p1.jpg");
		labelled.put("small", "");
		labelled.put("236", "https://i.pinimg.com/236x/aa/p1.jpg");

		// When
		List<String> ordered = CandidateUrls.resolve(labelled);

		// Then
		assertThat(ordered).containsExactly("https://i.pinimg.com/236x/aa/p1.jpg");
	}

	@Test
	void testResolve_UnknownLabelFallsBackToUrlSize() {
		// Given
		Map<String, String> labelled = new LinkedHashMap<>();
		labelled.put("thumb", "https://i.pinimg.com/60x60/aa/p1.jpg");
		labelled.put("big", "https://i.pinimg.com/1200x/aa/p1.jpg");

		// When
		List<String> ordered = CandidateUrls.resolve(labelled);

		// Then
		assertThat(ordered).containsExactly(
				"https://i.pinimg.com/1200x/aa/p1.jpg", "https://i.pinimg.com/60x60/aa/p1.jpg");
	}

	@Test
	void testScoreLabel() {
		assertThat(CandidateUrls.scoreLabel("original")).isEqualTo(CandidateUrls.ORIGINAL);
		assertThat(CandidateUrls.scoreLabel("600x315")).isEqualTo(600.0 * 315);
		assertThat(CandidateUrls.scoreLabel("474x")).isEqualTo(474.0 * 474 * 1.5);
		assertThat(CandidateUrls.scoreLabel("medium")).isEqualTo(CandidateUrls.UNKNOWN);
	}

	@Test
	void testToOriginal() {
		assertThat(CandidateUrls.toOriginal("https://i.pinimg.com/736x/ab/cd/p1.jpg"))
				.isEqualTo("https://i.pinimg.com/originals/ab/cd/p1.jpg");
		assertThat(CandidateUrls.toOriginal("https://example.com/736x/p1.jpg"))
				.isEqualTo("https://example.com/736x/p1.jpg");
	}

	@Test
	void testForPin_PrependsOriginalsRewrite() {
		// Given
		Pin pin = Pin.create()
				.id("p1")
				.imageUrl("236", "https://i.pinimg.com/236x/ab/cd/p1.jpg")
				.imageUrl("736", "https://i.pinimg.com/736x/ab/cd/p1.jpg");

		// When
		List<String> candidates = CandidateUrls.forPin(pin);

		// Then
		assertThat(candidates).containsExactly(
				"https://i.pinimg.com/originals/ab/cd/p1.jpg",
				"https://i.pinimg.com/736x/ab/cd/p1.jpg",
				"https://i.pinimg.com/236x/ab/cd/p1.jpg");
	}

	@Test
	void testForPin_KeepsKnownOriginal() {
		// Given
		Pin pin = Pin.create()
				.id("p1")
				.imageUrl("original", "https://i.pinimg.com/originals/ab/cd/p1.jpg")
				.largestImageUrl("https://i.pinimg.com/736x/ab/cd/p1.jpg");

		// When
		List<String> candidates = CandidateUrls.forPin(pin);

		// Then
		assertThat(candidates).containsExactly(
				"https://i.pinimg.com/originals/ab/cd/p1.jpg", "https://i.pinimg.com/736x/ab/cd/p1.jpg");
	}

	@Test
	void testForPin_NoImages() {
		assertThat(CandidateUrls.forPin(Pin.create().id("p1"))).isEmpty();
	}
}
