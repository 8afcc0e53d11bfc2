package dev.pinharvest.scraper;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ScraperResultTest {

	@Test
	void testSuccessResult() {
		// When
		ScraperResult result = ScraperResult.success(10, 5, 2);

		// Then
		assertThat(result.success()).isTrue();
		assertThat(result.error()).isNull();
		assertThat(result.toString()).isEqualTo("SUCCESS (10 pins saved, 5 duplicates skipped, 2 failed)");
	}

	@Test
	void testFailureResult() {
		// Given
		Exception error = new AcquisitionException("No usable request");

		// When
		ScraperResult result = ScraperResult.failure(3, 0, 1, error);

		// Then
		assertThat(result.success()).isFalse();
		assertThat(result.itemsSaved()).isEqualTo(3);
		assertThat(result.error()).isSameAs(error);
		assertThat(result.toString()).isEqualTo("FAILED - No usable request (3 pins saved)");
	}

	@Test
	void testFailureResultWithoutCounts() {
		// When
		ScraperResult result = ScraperResult.failure(new RuntimeException("boom"));

		// Then
		assertThat(result.itemsSaved()).isZero();
		assertThat(result.toString()).isEqualTo("FAILED - boom (0 pins saved)");
	}
}
