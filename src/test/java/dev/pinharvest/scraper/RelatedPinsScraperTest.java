package dev.pinharvest.scraper;

import static dev.pinharvest.testing.TestPins.pins;
import static org.assertj.core.api.Assertions.*;

import dev.pinharvest.store.KeywordPartition;
import dev.pinharvest.store.SqlitePinRepository;
import dev.pinharvest.testing.FakeBrowser;
import dev.pinharvest.testing.ScriptedExtractor;
import dev.pinharvest.util.CancellationToken;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RelatedPinsScraperTest {

	@TempDir
	Path tempDir;

	private SqlitePinRepository repository;
	private final FakeBrowser browser = new FakeBrowser();

	@BeforeEach
	void setUp() {
		repository = SqlitePinRepository.open(KeywordPartition.of(tempDir, "cat"));
	}

	@AfterEach
	void tearDown() {
		repository.close();
	}

	private RelatedPinsScraper scraper(ScriptedExtractor extractor, List<String> seeds, int target, int maxPerSeed) {
		PinCollector collector = new PinCollector(repository, "cat", null, target, null, "acquire:cat");
		ScraperConfig config =
				new ScraperConfig(collector, LoggerFactory.getLogger("test"), 10, new CancellationToken(), d -> {});
		return new RelatedPinsScraper(config, browser, extractor, seeds, maxPerSeed);
	}

	@Test
	void testCall_ExpandsBreadthFirst() {
		// Given
		ScriptedExtractor extractor = new ScriptedExtractor(pins("r1", "r2"));

		// When
		ScraperResult result = scraper(extractor, List.of("s1"), 10, 1).call();

		// Then
		assertThat(result.success()).isTrue();
		assertThat(result.itemsSaved()).isEqualTo(2);
		assertThat(browser.navigations).containsExactly(
				PinterestUrls.pinUrl("s1"), PinterestUrls.pinUrl("r1"), PinterestUrls.pinUrl("r2"));
		assertThat(repository.getPinIds("cat")).containsExactly("r1", "r2");
	}

	@Test
	void testCall_SeedOverItsLimitIsNotScrolled() {
		// Given
		ScriptedExtractor extractor = new ScriptedExtractor(pins("r1", "r2"));

		// When
		scraper(extractor, List.of("s1"), 10, 2).call();

		// Then s1 is not scrolled, r1 and r2 each scroll until they stall
		assertThat(browser.scrolls).containsExactly(3000, -6000, 9000, 3000, 3000, -6000, 9000, 3000);
	}

	@Test
	void testCall_VisitsEachSeedOnce() {
		// Given
		ScriptedExtractor extractor = new ScriptedExtractor(pins("s1"));

		// When
		scraper(extractor, List.of("s1", "s1", "s2"), 10, 50).call();

		// Then
		assertThat(browser.navigations).containsExactly(PinterestUrls.pinUrl("s1"), PinterestUrls.pinUrl("s2"));
	}

	@Test
	void testCall_UnreachableSeedCountsAsFailure() {
		// Given
		browser.failingUrls.add(PinterestUrls.pinUrl("s1"));
		ScriptedExtractor extractor = new ScriptedExtractor(pins("r1"));

		// When
		ScraperResult result = scraper(extractor, List.of("s1", "s2"), 10, 1).call();

		// Then
		assertThat(result.success()).isTrue();
		assertThat(result.itemsFailed()).isEqualTo(1);
		assertThat(result.itemsSaved()).isEqualTo(1);
	}

	@Test
	void testCall_StopsAtTarget() {
		// Given
		ScriptedExtractor extractor = new ScriptedExtractor(pins("r1", "r2", "r3"));

		// When
		ScraperResult result = scraper(extractor, List.of("s1"), 2, 50).call();

		// Then
		assertThat(result.itemsSaved()).isEqualTo(2);
		assertThat(browser.navigations).containsExactly(PinterestUrls.pinUrl("s1"));
	}
}
