package org.springaicommunity.scvs;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named roles and the permissions each role is allowed to carry.
 *
 * <p>
 * The catalog is a set-valued capability map ({@code role -> set<permission>}). Role
 * names are case-insensitive and stored lower case.
 */
public final class RoleCatalog {

	/** Role given to collaborators registered through {@code addContributor}. */
	public static final String CONTRIBUTOR = "contributor";

	private final Map<String, Set<String>> allowed;

	private RoleCatalog(Map<String, Set<String>> allowed) {
		this.allowed = allowed;
	}

	/**
	 * The default catalog: admin, maintainer, developer, guest and contributor.
	 * @return the default role catalog
	 */
	public static RoleCatalog defaults() {
		return builder().role("admin", Permissions.PULL, Permissions.PUSH, Permissions.MERGE)
			.role("maintainer", Permissions.PUSH, Permissions.MERGE)
			.role("developer", Permissions.PUSH)
			.role("guest", Permissions.PULL)
			.role(CONTRIBUTOR)
			.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Normalize a role name the way the catalog stores it.
	 * @param role raw role name
	 * @return trimmed lower-case role name
	 */
	public static String normalize(String role) {
		return role.trim().toLowerCase(Locale.ROOT);
	}

	public boolean contains(String role) {
		return allowed.containsKey(normalize(role));
	}

	/**
	 * Returns the permissions the given role may carry, empty for unknown roles.
	 * @param role role name
	 * @return sorted, unmodifiable permission set
	 */
	public Set<String> allowedPermissions(String role) {
		return allowed.getOrDefault(normalize(role), Collections.emptySortedSet());
	}

	/**
	 * Returns the permissions of {@code requested} that the role may not carry.
	 * @param role role name
	 * @param requested requested permissions
	 * @return sorted set of disallowed permissions, empty when all are allowed
	 */
	public Set<String> disallowed(String role, Collection<String> requested) {
		Set<String> permitted = allowedPermissions(role);
		Set<String> invalid = new TreeSet<>();
		for (String permission : requested) {
			if (!permitted.contains(permission)) {
				invalid.add(permission);
			}
		}
		return invalid;
	}

	/**
	 * Returns the role names in declaration order.
	 * @return role names
	 */
	public List<String> roles() {
		return List.copyOf(allowed.keySet());
	}

	/**
	 * Builder for custom catalogs.
	 */
	public static final class Builder {

		private final Map<String, Set<String>> roles = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder role(String name, String... permissions) {
			roles.put(normalize(name), Collections.unmodifiableSortedSet(new TreeSet<>(List.of(permissions))));
			return this;
		}

		public RoleCatalog build() {
			return new RoleCatalog(Collections.unmodifiableMap(new LinkedHashMap<>(roles)));
		}

	}

}
