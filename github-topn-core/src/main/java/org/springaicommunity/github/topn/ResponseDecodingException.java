package org.springaicommunity.github.topn;

/**
 * Thrown when a GitHub response does not have the shape the ranking code expects.
 */
public class ResponseDecodingException extends RuntimeException {

	public ResponseDecodingException(String message) {
		super(message);
	}

	public ResponseDecodingException(String message, Throwable cause) {
		super(message, cause);
	}

}
