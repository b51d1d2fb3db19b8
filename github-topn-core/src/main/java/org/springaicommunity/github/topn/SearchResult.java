package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a paginated search containing items and pagination info.
 *
 * @param <T> the type of items in the result
 * @param items the items on this page, in server order
 * @param nextCursor cursor for fetching the next page (null if no more pages)
 * @param hasMore whether there are more pages available
 */
public record SearchResult<T>(List<T> items, @Nullable String nextCursor, boolean hasMore) {

	public SearchResult {
		items = List.copyOf(items);
	}

	/**
	 * Create a result that ends pagination.
	 * @param <T> the item type
	 * @param items the items on the final page
	 * @return SearchResult with no next page
	 */
	public static <T> SearchResult<T> lastPage(List<T> items) {
		return new SearchResult<>(items, null, false);
	}

}
