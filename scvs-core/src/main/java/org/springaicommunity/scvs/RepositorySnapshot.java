package org.springaicommunity.scvs;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Persistent form of a repository.
 *
 * @param formatVersion snapshot layout version
 * @param name repository name
 * @param head checked-out branch
 * @param defaultBranch branch that cannot be deleted
 * @param branches branches in creation order
 * @param commits commits in insertion order
 * @param staging staging entries of every branch
 * @param collaborators collaborator records
 * @param activePullRequests active queue, FIFO
 * @param closedPullRequests archive, closure order
 * @param lastPullRequestId last allocated pull request id
 * @param savedAt snapshot time
 */
public record RepositorySnapshot(int formatVersion, String name, String head, String defaultBranch,
		List<Branch> branches, List<Commit> commits, List<StagingEntry> staging, List<Collaborator> collaborators,
		List<PullRequest> activePullRequests, List<PullRequest> closedPullRequests, int lastPullRequestId,
		LocalDateTime savedAt) {

	public static final int CURRENT_FORMAT = 1;

}
