package org.springaicommunity.scvs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-branch set of pending file entries with inclusion toggles.
 *
 * <p>
 * Entries keep their insertion order. A new entry starts excluded; only entries toggled
 * to included are consumed by the next commit, the rest stay staged.
 *
 * <p>
 * Not thread-safe: guarded by the owning {@link Repository}.
 */
public class StagingArea {

	private static final Logger logger = LoggerFactory.getLogger(StagingArea.class);

	private final Map<String, LinkedHashMap<String, StagingEntry>> branches = new TreeMap<>();

	/**
	 * Stage a path. The kind is {@link ChangeKind#MODIFIED} when the path is live on the
	 * branch tip, {@link ChangeKind#ADDED} otherwise. Re-adding a path updates its kind and
	 * staging time but keeps its position and inclusion flag.
	 * @param branch branch name
	 * @param path file path
	 * @param trackedPaths paths live on the branch tip
	 * @param now staging time
	 * @return the staged entry
	 */
	public StagingEntry add(String branch, String path, Set<String> trackedPaths, LocalDateTime now) {
		ChangeKind kind = trackedPaths.contains(path) ? ChangeKind.MODIFIED : ChangeKind.ADDED;
		return put(branch, path, kind, now);
	}

	/**
	 * Stage the deletion of a path that is live on the branch tip.
	 * @param branch branch name
	 * @param path file path
	 * @param trackedPaths paths live on the branch tip
	 * @param now staging time
	 * @return the staged entry, or {@code StagingEntryNotFound} for an untracked path
	 */
	public OperationResult<StagingEntry> markDeleted(String branch, String path, Set<String> trackedPaths,
			LocalDateTime now) {
		if (!trackedPaths.contains(path)) {
			return OperationResult.failure(ErrorKind.STAGING_ENTRY_NOT_FOUND,
					"File '" + path + "' is not tracked on branch '" + branch + "'");
		}
		return OperationResult.success(put(branch, path, ChangeKind.DELETED, now));
	}

	private StagingEntry put(String branch, String path, ChangeKind kind, LocalDateTime now) {
		LinkedHashMap<String, StagingEntry> entries = branches.computeIfAbsent(branch, b -> new LinkedHashMap<>());
		StagingEntry existing = entries.get(path);
		StagingEntry entry = existing != null ? existing.restaged(kind, now)
				: new StagingEntry(branch, path, kind, false, now);
		// re-putting an existing key keeps its insertion position
		entries.put(path, entry);
		logger.debug("Staged {} [{}] on '{}'", path, kind.marker(), branch);
		return entry;
	}

	/**
	 * Returns the entries of a branch in insertion order.
	 * @param branch branch name
	 * @return staged entries
	 */
	public List<StagingEntry> list(String branch) {
		LinkedHashMap<String, StagingEntry> entries = branches.get(branch);
		return entries == null ? List.of() : List.copyOf(entries.values());
	}

	/**
	 * Flip the inclusion flag of a staged path.
	 * @param branch branch name
	 * @param path file path
	 * @return the updated entry, or {@code StagingEntryNotFound}
	 */
	public OperationResult<StagingEntry> toggle(String branch, String path) {
		LinkedHashMap<String, StagingEntry> entries = branches.get(branch);
		StagingEntry existing = entries != null ? entries.get(path) : null;
		if (existing == null) {
			return OperationResult.failure(ErrorKind.STAGING_ENTRY_NOT_FOUND,
					"File '" + path + "' is not in the staging area of branch '" + branch + "'");
		}
		StagingEntry toggled = existing.withIncluded(!existing.included());
		entries.put(path, toggled);
		logger.debug("Toggled {} on '{}' -> {}", path, branch, toggled.included() ? "included" : "excluded");
		return OperationResult.success(toggled);
	}

	/**
	 * Remove and return the included entries of a branch, in insertion order.
	 * @param branch branch name
	 * @return consumed entries, empty when nothing is included
	 */
	public List<StagingEntry> consumeIncluded(String branch) {
		LinkedHashMap<String, StagingEntry> entries = branches.get(branch);
		if (entries == null) {
			return List.of();
		}
		List<StagingEntry> consumed = new ArrayList<>();
		Iterator<StagingEntry> iterator = entries.values().iterator();
		while (iterator.hasNext()) {
			StagingEntry entry = iterator.next();
			if (entry.included()) {
				consumed.add(entry);
				iterator.remove();
			}
		}
		return consumed;
	}

	/**
	 * Returns the included entries of a branch without consuming them.
	 */
	public List<StagingEntry> included(String branch) {
		return list(branch).stream().filter(StagingEntry::included).toList();
	}

	/**
	 * Drop every entry of a branch.
	 * @return number of removed entries
	 */
	public int clear(String branch) {
		LinkedHashMap<String, StagingEntry> entries = branches.remove(branch);
		return entries == null ? 0 : entries.size();
	}

	/**
	 * Drop the included entries of a branch.
	 * @return number of removed entries
	 */
	public int clearIncluded(String branch) {
		return consumeIncluded(branch).size();
	}

	/**
	 * Forget a deleted branch.
	 */
	void discard(String branch) {
		branches.remove(branch);
	}

	/**
	 * Returns every entry across branches, grouped by branch.
	 */
	List<StagingEntry> all() {
		List<StagingEntry> all = new ArrayList<>();
		branches.values().forEach(entries -> all.addAll(entries.values()));
		return all;
	}

	void restore(Collection<StagingEntry> entries) {
		branches.clear();
		for (StagingEntry entry : entries) {
			branches.computeIfAbsent(entry.branch(), b -> new LinkedHashMap<>()).put(entry.path(), entry);
		}
	}

}
