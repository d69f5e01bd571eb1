package org.springaicommunity.scvs;

/**
 * Outcome of {@code init}: the now-active repository and where it came from.
 *
 * @param repository the active repository
 * @param origin how the repository was obtained
 */
public record RepositoryOpened(Repository repository, Origin origin) {

	public enum Origin {

		/** A new repository was initialized. */
		CREATED,

		/** A saved snapshot was loaded. */
		LOADED,

		/** The repository was already loaded in this process. */
		ALREADY_OPEN

	}

}
