package org.gutensearch.core.storage;

/**
 * The storage backend could not be reached.
 */
public class StorageConnectionException extends StorageException {
	public StorageConnectionException(String message) {
		super(message);
	}

	public StorageConnectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
