package org.springaicommunity.github.topn;

import java.time.Instant;

/**
 * Rate limit state reported by the GitHub API in the {@code X-RateLimit-*} headers.
 *
 * @param limit the maximum number of requests allowed in the current window
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if fewer than {@code threshold} requests are left.
	 * @param threshold remaining request count considered low
	 * @return true if remaining is known and below the threshold
	 */
	public boolean isBelow(int threshold) {
		return remaining >= 0 && remaining < threshold;
	}

}
