package dev.pinharvest.scraper;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HarvestStrategyTest {

	@Test
	void testForTarget() {
		assertThat(HarvestStrategy.forTarget(1)).isEqualTo(HarvestStrategy.SCROLL);
		assertThat(HarvestStrategy.forTarget(99)).isEqualTo(HarvestStrategy.SCROLL);
		assertThat(HarvestStrategy.forTarget(100)).isEqualTo(HarvestStrategy.DEEP_SCROLL);
		assertThat(HarvestStrategy.forTarget(999)).isEqualTo(HarvestStrategy.DEEP_SCROLL);
		assertThat(HarvestStrategy.forTarget(1000)).isEqualTo(HarvestStrategy.HYBRID);
	}

	@Test
	void testScrollLimits() {
		assertThat(HarvestStrategy.SCROLL.scrollLimits(2).maxScrolls()).isEqualTo(10);
		assertThat(HarvestStrategy.SCROLL.scrollLimits(50).maxScrolls()).isEqualTo(150);
		assertThat(HarvestStrategy.DEEP_SCROLL.scrollLimits(100).maxScrolls()).isEqualTo(300);
		assertThat(HarvestStrategy.HYBRID.scrollLimits(1000).noNewLimit()).isEqualTo(10);
	}

	@Test
	void testExpandsRelated() {
		assertThat(HarvestStrategy.HYBRID.expandsRelated()).isTrue();
		assertThat(HarvestStrategy.DEEP_SCROLL.expandsRelated()).isFalse();
	}
}
