package org.springaicommunity.scvs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Pull request review workflow: a FIFO active queue and a closed archive.
 *
 * <p>
 * Requests move {@code open -> en_revision -> merged | rejected}. Terminal requests leave
 * the active queue and are appended to the archive, where they are never changed again.
 * Identifiers are allocated only when a request is actually created.
 *
 * <p>
 * Not thread-safe: guarded by the owning {@link Repository}.
 */
public class PullRequestQueue {

	private static final Logger logger = LoggerFactory.getLogger(PullRequestQueue.class);

	private final CommitGraph graph;

	private final MergeEngine mergeEngine;

	private final AccessControl accessControl;

	private final List<PullRequest> active = new ArrayList<>();

	private final List<PullRequest> closed = new ArrayList<>();

	private int lastId;

	public PullRequestQueue(CommitGraph graph, MergeEngine mergeEngine, AccessControl accessControl) {
		this.graph = graph;
		this.mergeEngine = mergeEngine;
		this.accessControl = accessControl;
	}

	/**
	 * Open a pull request at the tail of the active queue.
	 * @return the new request, or {@code PermissionDenied} / {@code BranchNotFound} /
	 * {@code SameBranch}
	 */
	public OperationResult<PullRequest> create(String actor, String source, String destination, LocalDateTime now) {
		OperationResult<String> authorized = accessControl.authorize(actor, Permissions.PUSH,
				"open a pull request into '" + destination + "'");
		if (!authorized.isSuccess()) {
			return authorized.map(ignored -> null);
		}
		if (!graph.hasBranch(source)) {
			return OperationResult.failure(ErrorKind.BRANCH_NOT_FOUND, "Branch '" + source + "' does not exist");
		}
		if (!graph.hasBranch(destination)) {
			return OperationResult.failure(ErrorKind.BRANCH_NOT_FOUND,
					"Branch '" + destination + "' does not exist");
		}
		if (source.equals(destination)) {
			return OperationResult.failure(ErrorKind.SAME_BRANCH,
					"Source and destination are the same branch '" + source + "'");
		}

		PullRequest request = PullRequest.open(++lastId, source, destination, actor, now);
		active.add(request);
		logger.info("Opened PR #{} {} -> {} by '{}'", request.id(), source, destination, actor);
		return OperationResult.success(request);
	}

	/**
	 * Leave a review; moves an open request to {@code en_revision}.
	 */
	public OperationResult<PullRequest> review(String actor, int id, String comment, LocalDateTime now) {
		OperationResult<String> authorized = accessControl.authorize(actor, Permissions.PULL,
				"review PR #" + id);
		if (!authorized.isSuccess()) {
			return authorized.map(ignored -> null);
		}
		int index = indexOf(id);
		if (index < 0) {
			return notFound(id);
		}
		PullRequest reviewed = active.get(index)
			.withReview(new ReviewComment(actor, comment, now), PullRequestState.EN_REVISION);
		active.set(index, reviewed);
		logger.info("PR #{} reviewed by '{}'", id, actor);
		return OperationResult.success(reviewed);
	}

	/**
	 * Append a tag. The state is unchanged.
	 */
	public OperationResult<PullRequest> tag(String actor, int id, String label) {
		OperationResult<String> authorized = accessControl.authorize(actor, Permissions.PULL, "tag PR #" + id);
		if (!authorized.isSuccess()) {
			return authorized.map(ignored -> null);
		}
		int index = indexOf(id);
		if (index < 0) {
			return notFound(id);
		}
		PullRequest tagged = active.get(index).withTag(label);
		active.set(index, tagged);
		logger.debug("PR #{} tagged '{}'", id, label);
		return OperationResult.success(tagged);
	}

	/**
	 * Approve a request: merge its source into its destination and archive it. A failed
	 * merge leaves the request in the active queue unchanged.
	 */
	public OperationResult<PullRequest> approve(String actor, int id, LocalDateTime now) {
		OperationResult<String> authorized = accessControl.authorize(actor, Permissions.MERGE, "approve PR #" + id);
		if (!authorized.isSuccess()) {
			return authorized.map(ignored -> null);
		}
		int index = indexOf(id);
		if (index < 0) {
			return notFound(id);
		}
		PullRequest request = active.get(index);
		OperationResult<Commit> merge = mergeEngine.merge(actor, request.source(), request.destination(), now);
		if (merge instanceof OperationResult.Failure<Commit> failure) {
			logger.warn("PR #{} could not be merged: {}", id, failure.message());
			return failure.retype();
		}

		PullRequest merged = request.merged(merge.orElseThrow().id(), now);
		active.remove(index);
		closed.add(merged);
		logger.info("PR #{} approved by '{}' and merged as {}", id, actor, merged.mergeCommitId());
		return OperationResult.success(merged);
	}

	/**
	 * Reject a request and archive it. A non-blank reason is recorded as a review.
	 */
	public OperationResult<PullRequest> reject(String actor, int id, String reason, LocalDateTime now) {
		OperationResult<String> authorized = accessControl.authorize(actor, Permissions.MERGE, "reject PR #" + id);
		if (!authorized.isSuccess()) {
			return authorized.map(ignored -> null);
		}
		int index = indexOf(id);
		if (index < 0) {
			return notFound(id);
		}
		PullRequest request = active.get(index);
		if (!reason.isBlank()) {
			request = request.withReview(new ReviewComment(actor, "Rechazado: " + reason.trim(), now),
					request.state());
		}
		PullRequest rejected = request.rejected(now);
		active.remove(index);
		closed.add(rejected);
		logger.info("PR #{} rejected by '{}'", id, actor);
		return OperationResult.success(rejected);
	}

	/**
	 * Pop the head of the active queue without changing its state.
	 * @return the popped request, or informational {@code QueueEmpty}
	 */
	public OperationResult<PullRequest> next(String actor) {
		OperationResult<String> authorized = accessControl.authorize(actor, Permissions.MERGE,
				"take the next pull request");
		if (!authorized.isSuccess()) {
			return authorized.map(ignored -> null);
		}
		if (active.isEmpty()) {
			return OperationResult.failure(ErrorKind.QUEUE_EMPTY, "No pull requests in the queue");
		}
		PullRequest head = active.remove(0);
		logger.info("Took PR #{} off the queue", head.id());
		return OperationResult.success(head);
	}

	/**
	 * Empty the active queue. The archive is untouched.
	 * @return number of dropped requests
	 */
	public OperationResult<Integer> clear(String actor) {
		OperationResult<String> authorized = accessControl.authorize(actor, Permissions.MERGE,
				"clear the pull request queue");
		if (!authorized.isSuccess()) {
			return authorized.map(ignored -> null);
		}
		int dropped = active.size();
		active.clear();
		logger.info("Cleared {} pull request(s) from the queue", dropped);
		return OperationResult.success(dropped);
	}

	public PullRequestListing list() {
		return new PullRequestListing(active, closed);
	}

	/**
	 * Find a request in the queue or the archive.
	 */
	public OperationResult<PullRequest> status(int id) {
		Optional<PullRequest> found = active.stream()
			.filter(request -> request.id() == id)
			.findFirst()
			.or(() -> closed.stream().filter(request -> request.id() == id).findFirst());
		return found.map(OperationResult::success).orElseGet(() -> notFound(id));
	}

	public QueueSummary summary() {
		int open = (int) active.stream().filter(request -> request.state() == PullRequestState.OPEN).count();
		int merged = (int) closed.stream().filter(request -> request.state() == PullRequestState.MERGED).count();
		return new QueueSummary(open, active.size() - open, merged, closed.size() - merged,
				active.isEmpty() ? null : active.get(0).id());
	}

	public int lastId() {
		return lastId;
	}

	void restore(Collection<PullRequest> savedActive, Collection<PullRequest> savedClosed, int savedLastId) {
		active.clear();
		active.addAll(savedActive);
		closed.clear();
		closed.addAll(savedClosed);
		lastId = savedLastId;
	}

	private int indexOf(int id) {
		for (int i = 0; i < active.size(); i++) {
			if (active.get(i).id() == id) {
				return i;
			}
		}
		return -1;
	}

	private static <T> OperationResult<T> notFound(int id) {
		return OperationResult.failure(ErrorKind.PR_NOT_FOUND, "Pull request #" + id + " not found");
	}

}
