package org.springaicommunity.scvs;

import java.util.List;

/**
 * Branches of a repository and the one checked out.
 *
 * @param head checked-out branch
 * @param branches branches ordered by name
 */
public record BranchListing(String head, List<Branch> branches) {

	public BranchListing {
		branches = List.copyOf(branches);
	}

}
