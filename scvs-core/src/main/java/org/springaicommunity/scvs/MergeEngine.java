package org.springaicommunity.scvs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds the history of one branch into another as a single new commit.
 *
 * <p>
 * A source path is contributed when its latest change on the source comes from a commit
 * the destination lineage does not contain. The source's change kind wins over whatever
 * the destination recorded for that path. The result is a single-parent commit tagged
 * {@link CommitKind#MERGE}.
 */
public class MergeEngine {

	private static final Logger logger = LoggerFactory.getLogger(MergeEngine.class);

	private final CommitGraph graph;

	private final AccessControl accessControl;

	public MergeEngine(CommitGraph graph, AccessControl accessControl) {
		this.graph = graph;
		this.accessControl = accessControl;
	}

	/**
	 * Merge {@code source} into {@code destination}.
	 * @param actor collaborator performing the merge, needs {@code merge}
	 * @param source branch to merge from
	 * @param destination branch to merge into
	 * @param now merge time
	 * @return the merge commit, or {@code PermissionDenied} / {@code BranchNotFound} /
	 * {@code SameBranch} / {@code EmptyCommit}
	 */
	public OperationResult<Commit> merge(String actor, String source, String destination, LocalDateTime now) {
		OperationResult<String> authorized = accessControl.authorize(actor, Permissions.MERGE,
				"merge into '" + destination + "'");
		if (!authorized.isSuccess()) {
			return authorized.map(ignored -> null);
		}

		Branch sourceBranch = graph.branch(source).orElse(null);
		if (sourceBranch == null) {
			return OperationResult.failure(ErrorKind.BRANCH_NOT_FOUND, "Branch '" + source + "' does not exist");
		}
		Branch destinationBranch = graph.branch(destination).orElse(null);
		if (destinationBranch == null) {
			return OperationResult.failure(ErrorKind.BRANCH_NOT_FOUND,
					"Branch '" + destination + "' does not exist");
		}
		if (source.equals(destination)) {
			return OperationResult.failure(ErrorKind.SAME_BRANCH, "Cannot merge branch '" + source + "' into itself");
		}
		if (sourceBranch.tipId() == null) {
			return OperationResult.failure(ErrorKind.EMPTY_COMMIT,
					"Nothing to merge: branch '" + source + "' has no commits");
		}

		// Destination tip files first; a contributed path replaces its entry in place
		Map<String, FileChange> byPath = new LinkedHashMap<>();
		if (destinationBranch.tipId() != null) {
			graph.commit(destinationBranch.tipId())
				.ifPresent(tip -> tip.changes().forEach(change -> byPath.put(change.path(), change)));
		}
		List<FileChange> contributed = contributedChanges(sourceBranch, destinationBranch);
		contributed.forEach(change -> byPath.put(change.path(), change));
		List<FileChange> changes = new ArrayList<>(byPath.values());

		String message = "Merge branch '" + source + "' into " + destination;
		Commit commit = graph.append(destination, actor, message, changes, CommitKind.MERGE, source, now);
		logger.info("Merged '{}' into '{}' as {} ({} contributed file(s))", source, destination, commit.id(),
				contributed.size());
		return OperationResult.success(commit);
	}

	private List<FileChange> contributedChanges(Branch source, Branch destination) {
		Set<String> shared = new HashSet<>();
		graph.lineage(destination.tipId()).forEach(commit -> shared.add(commit.id()));

		// Newest first, so the first change seen for a path is its latest one
		Map<String, FileChange> latest = new LinkedHashMap<>();
		Set<String> settled = new HashSet<>();
		for (Commit commit : graph.lineage(source.tipId())) {
			for (FileChange change : commit.changes()) {
				if (settled.add(change.path()) && !shared.contains(commit.id())) {
					latest.put(change.path(), change);
				}
			}
		}

		List<FileChange> contributed = new ArrayList<>(latest.values());
		Collections.reverse(contributed);
		return contributed;
	}

}
