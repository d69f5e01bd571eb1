package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Commit store and branch pointers.
 *
 * <p>
 * Commits are immutable and only ever appended. The commit map is a concurrent map so
 * that a {@link CommitLog} handed out under a read lock stays valid while later commits
 * are appended. Branch pointers are guarded by the owning {@link Repository}.
 */
public class CommitGraph {

	private static final Logger logger = LoggerFactory.getLogger(CommitGraph.class);

	private final Map<String, Commit> commits = new ConcurrentHashMap<>();

	// Insertion sequence, used to break timestamp ties in logs
	private final Map<String, Long> sequence = new ConcurrentHashMap<>();

	private final AtomicLong nextSequence = new AtomicLong();

	private final Map<String, Branch> branches = new LinkedHashMap<>();

	public Optional<Branch> branch(String name) {
		return Optional.ofNullable(branches.get(name));
	}

	public boolean hasBranch(String name) {
		return branches.containsKey(name);
	}

	/**
	 * Returns all branches ordered by name.
	 * @return branches
	 */
	public List<Branch> branches() {
		List<Branch> sorted = new ArrayList<>(branches.values());
		sorted.sort(Comparator.comparing(Branch::name));
		return sorted;
	}

	/**
	 * Create the first branch of a repository, with no tip.
	 */
	Branch createRootBranch(String name, LocalDateTime now) {
		Branch branch = new Branch(name, null, now, null);
		branches.put(name, branch);
		return branch;
	}

	/**
	 * Create a branch starting at the tip of another branch.
	 * @param name new branch name
	 * @param from branch to start from
	 * @param now creation time
	 * @return the new branch, or {@code DuplicateBranch} / {@code BranchNotFound}
	 */
	public OperationResult<Branch> createBranch(String name, String from, LocalDateTime now) {
		if (branches.containsKey(name)) {
			return OperationResult.failure(ErrorKind.DUPLICATE_BRANCH, "Branch '" + name + "' already exists");
		}
		Branch parent = branches.get(from);
		if (parent == null) {
			return OperationResult.failure(ErrorKind.BRANCH_NOT_FOUND, "Branch '" + from + "' does not exist");
		}
		Branch branch = new Branch(name, parent.tipId(), now, from);
		branches.put(name, branch);
		logger.info("Created branch '{}' from '{}' at {}", name, from, parent.tipId());
		return OperationResult.success(branch);
	}

	/**
	 * Delete a branch pointer. Commits stay in the graph.
	 * @param name branch to delete
	 * @param head currently checked-out branch
	 * @param protectedBranch branch that can never be deleted
	 * @return the deleted branch, or {@code ActiveBranch} / {@code ProtectedBranch} /
	 * {@code BranchNotFound}
	 */
	public OperationResult<Branch> deleteBranch(String name, String head, String protectedBranch) {
		if (name.equals(protectedBranch)) {
			return OperationResult.failure(ErrorKind.PROTECTED_BRANCH, "Branch '" + name + "' cannot be deleted");
		}
		if (name.equals(head)) {
			return OperationResult.failure(ErrorKind.ACTIVE_BRANCH,
					"Branch '" + name + "' is checked out and cannot be deleted");
		}
		Branch removed = branches.remove(name);
		if (removed == null) {
			return OperationResult.failure(ErrorKind.BRANCH_NOT_FOUND, "Branch '" + name + "' does not exist");
		}
		logger.info("Deleted branch '{}'", name);
		return OperationResult.success(removed);
	}

	/**
	 * Append a new commit on top of a branch and advance its tip.
	 * @param branchName branch to commit on, must exist
	 * @param author committing collaborator
	 * @param message commit message
	 * @param changes ordered file changes, must not be empty
	 * @param kind structural kind
	 * @param mergedFrom merge source, for merge commits
	 * @param timestamp commit time
	 * @return the appended (or identical, already present) commit
	 */
	Commit append(String branchName, String author, String message, List<FileChange> changes, CommitKind kind,
			@Nullable String mergedFrom, LocalDateTime timestamp) {
		Branch branch = branches.get(branchName);
		if (branch == null) {
			throw new IllegalArgumentException("Unknown branch: " + branchName);
		}
		String parentId = branch.tipId();
		List<String> files = changes.stream().map(FileChange::path).toList();
		String id = CommitHasher.hash(parentId, author, timestamp, message, files);

		Commit commit = commits.get(id);
		if (commit == null) {
			commit = new Commit(id, parentId, author, timestamp, branchName, message, changes, kind, mergedFrom);
			store(commit);
		}
		else {
			logger.debug("Commit {} already present, reusing it", id);
		}
		branches.put(branchName, branch.withTip(id));
		logger.info("Committed {} on '{}' ({} file(s), parent {})", id, branchName, files.size(), parentId);
		return commit;
	}

	private void store(Commit commit) {
		sequence.put(commit.id(), nextSequence.getAndIncrement());
		commits.put(commit.id(), commit);
	}

	public Optional<Commit> commit(String id) {
		return Optional.ofNullable(commits.get(id));
	}

	public int commitCount() {
		return commits.size();
	}

	/**
	 * Returns the chain of commits from a tip back to its root, tip first.
	 * @param tipId tip commit id, {@code null} for an empty branch
	 * @return the lineage
	 */
	public List<Commit> lineage(@Nullable String tipId) {
		List<Commit> lineage = new ArrayList<>();
		String current = tipId;
		while (current != null) {
			Commit commit = commits.get(current);
			if (commit == null) {
				break;
			}
			lineage.add(commit);
			current = commit.parentId();
		}
		return lineage;
	}

	/**
	 * Returns the paths live at a tip: replays the lineage oldest first, dropping paths
	 * whose latest change is a deletion.
	 * @param tipId tip commit id
	 * @return live paths, in first-recorded order
	 */
	public Set<String> trackedPaths(@Nullable String tipId) {
		Map<String, ChangeKind> latest = latestKinds(tipId);
		Set<String> live = new LinkedHashSet<>();
		latest.forEach((path, kind) -> {
			if (kind != ChangeKind.DELETED) {
				live.add(path);
			}
		});
		return live;
	}

	/**
	 * Returns every path recorded anywhere in a lineage with its latest change kind.
	 * @param tipId tip commit id
	 * @return paths in first-recorded order
	 */
	public Map<String, ChangeKind> latestKinds(@Nullable String tipId) {
		List<Commit> lineage = lineage(tipId);
		Map<String, ChangeKind> latest = new LinkedHashMap<>();
		for (int i = lineage.size() - 1; i >= 0; i--) {
			for (FileChange change : lineage.get(i).changes()) {
				latest.put(change.path(), change.kind());
			}
		}
		return latest;
	}

	/**
	 * Log of the commits reachable from the given tips.
	 * @param tipIds tip commit ids
	 * @return a lazy, restartable log
	 */
	public CommitLog log(Collection<String> tipIds) {
		return new CommitLog(tipIds, commits::get, sequence);
	}

	/**
	 * Returns every commit in insertion order.
	 */
	List<Commit> commitsInOrder() {
		List<Commit> ordered = new ArrayList<>(commits.values());
		ordered.sort(Comparator.comparingLong(commit -> sequence.get(commit.id())));
		return ordered;
	}

	List<Branch> branchesInOrder() {
		return new ArrayList<>(branches.values());
	}

	void restore(List<Commit> savedCommits, List<Branch> savedBranches) {
		commits.clear();
		sequence.clear();
		nextSequence.set(0);
		branches.clear();
		savedCommits.forEach(this::store);
		savedBranches.forEach(branch -> branches.put(branch.name(), branch));
	}

}
