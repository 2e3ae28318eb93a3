package org.gutensearch.core.storage;

/**
 * A storage backend call failed.
 */
public class StorageException extends Exception {
	public StorageException(String message) {
		super(message);
	}

	public StorageException(String message, Throwable cause) {
		super(message, cause);
	}
}
