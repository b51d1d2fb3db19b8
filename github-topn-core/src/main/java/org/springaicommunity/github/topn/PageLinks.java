package org.springaicommunity.github.topn;

import org.jspecify.annotations.Nullable;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Page numbers from a GitHub {@code Link} response header.
 *
 * <p>
 * Example header:
 * {@code <https://api.github.com/search/repositories?q=org%3Anetflix&page=2>; rel="next", <...&page=5>; rel="last"}
 *
 * @param next number of the next page, empty on the last page
 * @param last number of the last page, empty when the response is the only page
 */
public record PageLinks(OptionalInt next, OptionalInt last) {

	private static final Pattern LINK_PATTERN = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"([^\"]+)\"");

	private static final Pattern PAGE_PARAM_PATTERN = Pattern.compile("[?&]page=(\\d+)(?:&|$)");

	private static final PageLinks NONE = new PageLinks(OptionalInt.empty(), OptionalInt.empty());

	/**
	 * Parse a {@code Link} header.
	 * @param linkHeader header value, may be null or empty
	 * @return the next and last page numbers found
	 * @throws ResponseDecodingException if a next or last link carries no page number
	 */
	public static PageLinks parse(@Nullable String linkHeader) {
		if (linkHeader == null || linkHeader.isBlank()) {
			return NONE;
		}
		OptionalInt next = OptionalInt.empty();
		OptionalInt last = OptionalInt.empty();
		Matcher matcher = LINK_PATTERN.matcher(linkHeader);
		while (matcher.find()) {
			String url = matcher.group(1);
			for (String rel : matcher.group(2).trim().split("\\s+")) {
				if ("next".equals(rel)) {
					next = OptionalInt.of(pageOf(url));
				}
				else if ("last".equals(rel)) {
					last = OptionalInt.of(pageOf(url));
				}
			}
		}
		return new PageLinks(next, last);
	}

	/**
	 * Parse the {@code Link} header of a response.
	 * @param response REST response
	 * @return the next and last page numbers found
	 */
	public static PageLinks of(GitHubResponse response) {
		return parse(response.firstHeader("Link").orElse(null));
	}

	private static int pageOf(String url) {
		Matcher matcher = PAGE_PARAM_PATTERN.matcher(url);
		if (!matcher.find()) {
			throw new ResponseDecodingException("Link without page parameter: " + url);
		}
		try {
			return Integer.parseInt(matcher.group(1));
		}
		catch (NumberFormatException e) {
			throw new ResponseDecodingException("Link page number out of range: " + url, e);
		}
	}

}
