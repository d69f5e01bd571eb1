package org.springaicommunity.scvs;

import java.nio.file.Path;

/**
 * Raised when a repository snapshot cannot be written or read.
 */
public class RepositoryStoreException extends RuntimeException {

	private final Path path;

	public RepositoryStoreException(String message, Path path, Throwable cause) {
		super(message + ": " + path, cause);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

}
