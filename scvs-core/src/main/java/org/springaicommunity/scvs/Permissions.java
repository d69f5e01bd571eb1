package org.springaicommunity.scvs;

/**
 * Well-known permission names checked by repository operations.
 *
 * <p>
 * Permissions are plain strings so new kinds can be introduced through the
 * {@link RoleCatalog} without code changes.
 */
public final class Permissions {

	/** Create branches, commit and open pull requests. */
	public static final String PUSH = "push";

	/** Check out branches, review and tag pull requests. */
	public static final String PULL = "pull";

	/** Merge branches and close pull requests. */
	public static final String MERGE = "merge";

	private Permissions() {
	}

}
