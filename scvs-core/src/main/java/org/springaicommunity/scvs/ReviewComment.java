package org.springaicommunity.scvs;

import java.time.LocalDateTime;

/**
 * A review left on a pull request.
 *
 * @param reviewer reviewing collaborator
 * @param comment review text
 * @param createdAt review time
 */
public record ReviewComment(String reviewer, String comment, LocalDateTime createdAt) {
}
