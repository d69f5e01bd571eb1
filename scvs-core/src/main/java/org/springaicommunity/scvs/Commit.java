package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Immutable, content-addressed commit.
 *
 * @param id content hash over parent, author, timestamp, message and file list
 * @param parentId parent commit id, {@code null} for a root commit
 * @param author committing collaborator
 * @param timestamp commit time
 * @param branch branch the commit was created on
 * @param message commit message
 * @param changes ordered file changes
 * @param kind structural kind
 * @param mergedFrom source branch for merge commits
 */
public record Commit(String id, @Nullable String parentId, String author, LocalDateTime timestamp, String branch,
		String message, List<FileChange> changes, CommitKind kind, @Nullable String mergedFrom) {

	public Commit {
		changes = List.copyOf(changes);
	}

	/**
	 * Returns the ordered file paths of this commit.
	 * @return file paths
	 */
	public List<String> files() {
		return changes.stream().map(FileChange::path).toList();
	}

}
