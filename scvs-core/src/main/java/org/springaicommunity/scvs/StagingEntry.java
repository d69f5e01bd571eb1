package org.springaicommunity.scvs;

import java.time.LocalDateTime;

/**
 * A pending file change on a branch.
 *
 * @param branch branch the change is staged on
 * @param path file path, unique per branch
 * @param kind inferred change kind
 * @param included whether the next commit picks this entry up
 * @param stagedAt when the entry was last staged
 */
public record StagingEntry(String branch, String path, ChangeKind kind, boolean included, LocalDateTime stagedAt) {

	public StagingEntry withIncluded(boolean included) {
		return new StagingEntry(branch, path, kind, included, stagedAt);
	}

	/**
	 * Stage this path again, keeping its inclusion flag.
	 * @param kind newly inferred change kind
	 * @param stagedAt time of the new staging
	 * @return the refreshed entry
	 */
	public StagingEntry restaged(ChangeKind kind, LocalDateTime stagedAt) {
		return new StagingEntry(branch, path, kind, included, stagedAt);
	}

}
