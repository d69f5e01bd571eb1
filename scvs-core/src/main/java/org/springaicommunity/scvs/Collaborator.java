package org.springaicommunity.scvs;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A repository collaborator and its single active role record.
 *
 * <p>
 * The permission set is the set granted to this collaborator. An authorization check
 * additionally requires the permission to be allowed by the collaborator's current role
 * in the {@link RoleCatalog}, so a role downgrade takes effect immediately.
 *
 * @param identity unique, case-sensitive identity (email or name)
 * @param role current role name
 * @param permissions granted permissions, kept sorted
 */
public record Collaborator(String identity, String role, Set<String> permissions) {

	public Collaborator {
		permissions = Collections.unmodifiableSortedSet(new TreeSet<>(permissions));
	}

	/**
	 * Returns true if the permission was granted to this collaborator.
	 * @param permission permission name
	 * @return whether the permission is held
	 */
	public boolean holds(String permission) {
		return permissions.contains(permission);
	}

}
