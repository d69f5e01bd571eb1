package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A request to merge one branch into another, with its review history.
 *
 * @param id identifier, allocated in increasing order and never reused
 * @param title display title
 * @param source branch to merge from
 * @param destination branch to merge into
 * @param author collaborator who opened the request
 * @param createdAt creation time
 * @param state review state
 * @param reviews reviews in the order they were left
 * @param tags free-text tags, duplicates allowed
 * @param mergeCommitId resulting merge commit once merged
 * @param closedAt time the request reached a terminal state
 */
public record PullRequest(int id, String title, String source, String destination, String author,
		LocalDateTime createdAt, PullRequestState state, List<ReviewComment> reviews, List<String> tags,
		@Nullable String mergeCommitId, @Nullable LocalDateTime closedAt) {

	public PullRequest {
		reviews = List.copyOf(reviews);
		tags = List.copyOf(tags);
	}

	static PullRequest open(int id, String source, String destination, String author, LocalDateTime createdAt) {
		return new PullRequest(id, "PR #" + id + ": Merge " + source + " into " + destination, source, destination,
				author, createdAt, PullRequestState.OPEN, List.of(), List.of(), null, null);
	}

	PullRequest withReview(ReviewComment review, PullRequestState newState) {
		List<ReviewComment> updated = new ArrayList<>(reviews);
		updated.add(review);
		return new PullRequest(id, title, source, destination, author, createdAt, newState, updated, tags,
				mergeCommitId, closedAt);
	}

	PullRequest withTag(String tag) {
		List<String> updated = new ArrayList<>(tags);
		updated.add(tag);
		return new PullRequest(id, title, source, destination, author, createdAt, state, reviews, updated,
				mergeCommitId, closedAt);
	}

	PullRequest merged(String commitId, LocalDateTime at) {
		return new PullRequest(id, title, source, destination, author, createdAt, PullRequestState.MERGED, reviews,
				tags, commitId, at);
	}

	PullRequest rejected(LocalDateTime at) {
		return new PullRequest(id, title, source, destination, author, createdAt, PullRequestState.REJECTED, reviews,
				tags, mergeCommitId, at);
	}

}
