package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Function;

/**
 * Lazy, restartable walk over the commits reachable from a set of branch tips.
 *
 * <p>
 * Commits come out most recent first; equal timestamps are ordered by insertion, the
 * later-appended commit first. Every call to {@link #iterator()} starts a fresh walk.
 * The walk terminates because every commit has at most one parent and the graph is
 * append-only.
 */
public final class CommitLog implements Iterable<Commit> {

	private final Collection<String> tipIds;

	private final Function<String, @Nullable Commit> lookup;

	private final Map<String, Long> sequence;

	CommitLog(Collection<String> tipIds, Function<String, @Nullable Commit> lookup, Map<String, Long> sequence) {
		this.tipIds = List.copyOf(tipIds);
		this.lookup = lookup;
		this.sequence = sequence;
	}

	@Override
	public Iterator<Commit> iterator() {
		return new Walk();
	}

	/**
	 * Materialize at most {@code limit} commits.
	 * @param limit maximum number of commits, non-positive for all
	 * @return the commits, most recent first
	 */
	public List<Commit> take(int limit) {
		List<Commit> commits = new ArrayList<>();
		for (Commit commit : this) {
			if (limit > 0 && commits.size() >= limit) {
				break;
			}
			commits.add(commit);
		}
		return commits;
	}

	private Comparator<Commit> newestFirst() {
		Comparator<Commit> byTime = Comparator.comparing(Commit::timestamp);
		Comparator<Commit> bySequence = Comparator.comparingLong(commit -> sequence.getOrDefault(commit.id(), 0L));
		return byTime.thenComparing(bySequence).reversed();
	}

	private final class Walk implements Iterator<Commit> {

		private final PriorityQueue<Commit> frontier = new PriorityQueue<>(newestFirst());

		private final Set<String> seen = new HashSet<>();

		private Walk() {
			tipIds.forEach(this::enqueue);
		}

		private void enqueue(String id) {
			if (seen.add(id)) {
				Commit commit = lookup.apply(id);
				if (commit != null) {
					frontier.add(commit);
				}
			}
		}

		@Override
		public boolean hasNext() {
			return !frontier.isEmpty();
		}

		@Override
		public Commit next() {
			Commit commit = frontier.poll();
			if (commit == null) {
				throw new NoSuchElementException();
			}
			if (commit.parentId() != null) {
				enqueue(commit.parentId());
			}
			return commit;
		}

	}

}
