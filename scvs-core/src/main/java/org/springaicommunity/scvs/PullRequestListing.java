package org.springaicommunity.scvs;

import java.util.List;

/**
 * Snapshot of the pull request containers.
 *
 * @param active open and in-review requests, FIFO by creation
 * @param closed merged and rejected requests, in closure order
 */
public record PullRequestListing(List<PullRequest> active, List<PullRequest> closed) {

	public PullRequestListing {
		active = List.copyOf(active);
		closed = List.copyOf(closed);
	}

}
