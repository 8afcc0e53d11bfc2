package dev.pinharvest.scraper;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class BookmarkIteratorTest {

	private static class ScriptedPages extends BookmarkIterator<String> {
		private final Map<String, Page<String>> pages;
		final List<String> requested = new ArrayList<>();
		Exception error;

		ScriptedPages(Map<String, Page<String>> pages) {
			this.pages = pages;
		}

		@Override
		protected Page<String> fetchPage(String bookmark) throws Exception {
			String key = bookmark == null ? "first" : bookmark;
			requested.add(key);
			Page<String> page = pages.get(key);
			if (page == null) {
				throw new IllegalStateException("no page " + key);
			}
			return page;
		}

		@Override
		protected void handleFetchError(Exception e) {
			error = e;
		}
	}

	@Test
	void testIteration_FollowsBookmarksUntilEnd() {
		// Given
		ScriptedPages pages = new ScriptedPages(Map.of(
				"first", new BookmarkIterator.Page<>(List.of("a", "b"), "b2"),
				"b2", new BookmarkIterator.Page<>(List.of("c"), BookmarkIterator.END_BOOKMARK)));

		// When
		List<String> items = new ArrayList<>();
		pages.forEachRemaining(items::addAll);

		// Then
		assertThat(items).containsExactly("a", "b", "c");
		assertThat(pages.requested).containsExactly("first", "b2");
		assertThat(pages.pagesFetched()).isEqualTo(2);
		assertThat(pages.error).isNull();
	}

	@Test
	void testIteration_EmptyPageEnds() {
		// Given
		ScriptedPages pages = new ScriptedPages(Map.of("first", new BookmarkIterator.Page<>(List.of(), "b2")));

		// When/Then
		assertThat(pages.hasNext()).isFalse();
		assertThat(pages.pagesFetched()).isEqualTo(1);
		assertThatThrownBy(pages::next).isInstanceOf(NoSuchElementException.class);
	}

	@Test
	void testIteration_ErrorEndsIteration() {
		// Given
		ScriptedPages pages = new ScriptedPages(Map.of("first", new BookmarkIterator.Page<>(List.of("a"), "missing")));

		// When
		List<String> first = pages.next();
		boolean more = pages.hasNext();

		// Then
		assertThat(first).containsExactly("a");
		assertThat(more).isFalse();
		assertThat(pages.error).hasMessage("no page missing");
		assertThat(pages.pagesFetched()).isEqualTo(1);
	}
}
