package org.gutensearch.search.service;

/**
 * Rejected search input, reported to clients as a 400.
 */
public class InvalidQueryException extends IllegalArgumentException {
	public InvalidQueryException(String message) {
		super(message);
	}
}
