package org.springaicommunity.scvs;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for repository snapshots.
 *
 * <p>
 * Abstracts storage so that the version control system can be tested without touching
 * the file system.
 */
public interface RepositoryStore {

	/**
	 * Persist a snapshot, replacing any previous one with the same name.
	 * @param snapshot the snapshot
	 * @throws RepositoryStoreException if the snapshot cannot be written
	 */
	void save(RepositorySnapshot snapshot);

	/**
	 * Load the snapshot of a repository.
	 * @param name repository name
	 * @return the snapshot, empty if none was saved
	 * @throws RepositoryStoreException if a saved snapshot cannot be read
	 */
	Optional<RepositorySnapshot> load(String name);

	boolean exists(String name);

	/**
	 * Names of the saved repositories, sorted.
	 * @return repository names
	 */
	default List<String> names() {
		return List.of();
	}

}
