package org.springaicommunity.scvs;

/**
 * Structural kind of a commit. Every commit has at most one parent; a merge is recorded
 * as a regular append tagged {@link #MERGE}.
 */
public enum CommitKind {

	ROOT,

	NORMAL,

	MERGE

}
