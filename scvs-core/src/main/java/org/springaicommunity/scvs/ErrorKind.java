package org.springaicommunity.scvs;

/**
 * Failure kinds reported by repository operations.
 *
 * <p>
 * Informational kinds ({@link #QUEUE_EMPTY}, {@link #NOT_FOUND}) describe normal outcomes
 * of read-only queries and are rendered without alarm by callers.
 */
public enum ErrorKind {

	DUPLICATE_BRANCH("DuplicateBranch", false),

	BRANCH_NOT_FOUND("BranchNotFound", false),

	ACTIVE_BRANCH("ActiveBranch", false),

	PROTECTED_BRANCH("ProtectedBranch", false),

	SAME_BRANCH("SameBranch", false),

	EMPTY_COMMIT("EmptyCommit", false),

	PR_NOT_FOUND("PRNotFound", false),

	PERMISSION_DENIED("PermissionDenied", false),

	COLLABORATOR_NOT_FOUND("CollaboratorNotFound", false),

	STAGING_ENTRY_NOT_FOUND("StagingEntryNotFound", false),

	INVALID_ROLE("InvalidRole", false),

	INVALID_PERMISSION("InvalidPermission", false),

	NO_ACTIVE_REPOSITORY("NoActiveRepository", false),

	INVALID_NAME("InvalidName", false),

	QUEUE_EMPTY("QueueEmpty", true),

	NOT_FOUND("NotFound", true);

	private final String label;

	private final boolean informational;

	ErrorKind(String label, boolean informational) {
		this.label = label;
		this.informational = informational;
	}

	/**
	 * Returns the display label of this kind (e.g. {@code "BranchNotFound"}).
	 * @return the label
	 */
	public String label() {
		return label;
	}

	/**
	 * Returns true if this kind is a normal outcome rather than an error.
	 * @return whether the kind is informational
	 */
	public boolean isInformational() {
		return informational;
	}

}
