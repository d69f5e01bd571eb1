package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A named, mutable pointer into the commit graph.
 *
 * @param name branch name, unique within a repository
 * @param tipId id of the tip commit, {@code null} before the first commit
 * @param createdAt creation time
 * @param createdFrom branch this one was created from, {@code null} for the default branch
 */
public record Branch(String name, @Nullable String tipId, LocalDateTime createdAt, @Nullable String createdFrom) {

	public Branch withTip(String tipId) {
		return new Branch(name, tipId, createdAt, createdFrom);
	}

}
