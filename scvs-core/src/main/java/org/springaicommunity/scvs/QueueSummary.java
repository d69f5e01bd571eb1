package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;

/**
 * Counts over the pull request queue and archive.
 *
 * @param open active requests not yet reviewed
 * @param inRevision active requests with at least one review
 * @param merged archived merged requests
 * @param rejected archived rejected requests
 * @param nextId id at the head of the active queue, {@code null} when empty
 */
public record QueueSummary(int open, int inRevision, int merged, int rejected, @Nullable Integer nextId) {
}
