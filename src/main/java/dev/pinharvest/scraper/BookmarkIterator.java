package dev.pinharvest.scraper;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Abstract base class for cursor-paginated iteration over API results. Each element is one page;
 * the next page is fetched lazily with the bookmark the previous page returned.
 */
public abstract class BookmarkIterator<T> implements Iterator<List<T>> {
	/** Bookmark value the API returns once the results are exhausted */
	static final String END_BOOKMARK = "-end-";

	private String bookmark = null;
	private List<T> nextPage = null;
	private boolean hasMore = true;
	private int pagesFetched = 0;

	/**
	 * One page of results.
	 *
	 * @param items records of this page
	 * @param nextBookmark cursor of the following page, or null if there is none
	 */
	public record Page<T>(List<T> items, String nextBookmark) {}

	@Override
	public boolean hasNext() {
		if (nextPage != null) {
			return true;
		}
		if (!hasMore) {
			return false;
		}
		fetchNextPage();
		return nextPage != null;
	}

	@Override
	public List<T> next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		List<T> page = nextPage;
		nextPage = null;
		return page;
	}

	public int pagesFetched() {
		return pagesFetched;
	}

	private void fetchNextPage() {
		try {
			Page<T> page = fetchPage(bookmark);
			pagesFetched++;

			if (page == null || page.items() == null || page.items().isEmpty()) {
				hasMore = false;
				nextPage = null;
				return;
			}

			nextPage = page.items();
			bookmark = page.nextBookmark();
			if (bookmark == null || bookmark.isBlank() || END_BOOKMARK.equals(bookmark)) {
				hasMore = false;
			}
		} catch (Exception e) {
			handleFetchError(e);
			hasMore = false;
			nextPage = null;
		}
	}

	/**
	 * Fetch a page of results from the API.
	 * @param bookmark The cursor returned by the previous page, null for the first page
	 * @return The page, or null/empty if there are no more results
	 */
	protected abstract Page<T> fetchPage(String bookmark) throws Exception;

	/**
	 * Handle errors that occur during page fetching. Iteration ends afterwards.
	 * @param e The exception that occurred
	 */
	protected abstract void handleFetchError(Exception e);
}
