package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Working state of a repository.
 *
 * @param repository repository name
 * @param head checked-out branch
 * @param tipId tip of the checked-out branch, {@code null} before the first commit
 * @param staged staging entries of the checked-out branch
 * @param branchCount number of branches
 * @param commitCount number of commits in the graph
 * @param activePullRequests number of requests in the active queue
 */
public record RepositoryStatus(String repository, String head, @Nullable String tipId, List<StagingEntry> staged,
		int branchCount, int commitCount, int activePullRequests) {

	public RepositoryStatus {
		staged = List.copyOf(staged);
	}

}
