package org.springaicommunity.scvs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeMap;

/**
 * Collaborator registry and authorization layer.
 *
 * <p>
 * Owns the {@code collaborator -> role -> permission-set} mapping of one repository and
 * answers authorization queries. Lookups are case-sensitive exact matches. Checking a
 * permission for an unknown collaborator returns {@code false}, never an error.
 *
 * <p>
 * Not thread-safe: the owning {@link Repository} guards every call with its lock.
 */
public class AccessControl {

	private static final Logger logger = LoggerFactory.getLogger(AccessControl.class);

	private final RoleCatalog catalog;

	private final boolean enforced;

	// Sorted by identity so listings are alphabetical
	private final TreeMap<String, Collaborator> collaborators = new TreeMap<>();

	/**
	 * @param catalog role catalog used to validate grants
	 * @param enforced when false, {@link #authorize} lets every actor through
	 */
	public AccessControl(RoleCatalog catalog, boolean enforced) {
		this.catalog = catalog;
		this.enforced = enforced;
	}

	/**
	 * Grant a role, replacing any role record the collaborator already has.
	 *
	 * <p>
	 * When no permissions are requested the role's full catalog set is granted.
	 * @param identity collaborator identity
	 * @param role role name (validated against the catalog)
	 * @param permissions requested permissions (validated against the role)
	 * @return the new collaborator record, or {@code InvalidRole} / {@code InvalidPermission}
	 */
	public OperationResult<Collaborator> grantRole(String identity, String role, Collection<String> permissions) {
		String normalizedRole = RoleCatalog.normalize(role);
		Set<String> requested = normalizePermissions(permissions);
		OperationResult<Set<String>> validated = validate(normalizedRole, requested);
		if (!validated.isSuccess()) {
			return validated.map(ignored -> null);
		}

		Set<String> granted = requested.isEmpty() ? catalog.allowedPermissions(normalizedRole) : requested;
		Collaborator collaborator = new Collaborator(identity, normalizedRole, granted);
		Collaborator previous = collaborators.put(identity, collaborator);
		if (previous != null) {
			logger.info("Replaced role of '{}': {} -> {} {}", identity, previous.role(), normalizedRole,
					collaborator.permissions());
		}
		else {
			logger.info("Granted role '{}' to '{}' with permissions {}", normalizedRole, identity,
					collaborator.permissions());
		}
		return OperationResult.success(collaborator);
	}

	/**
	 * Change the role of an existing collaborator and add permissions to its set.
	 *
	 * <p>
	 * Previously granted permissions are kept; those the new role does not allow stop
	 * passing {@link #check} until the role allows them again.
	 * @param identity collaborator identity
	 * @param role new role name
	 * @param addPermissions permissions to add (validated against the new role)
	 * @return the updated record, or {@code CollaboratorNotFound} / {@code InvalidRole} /
	 * {@code InvalidPermission}
	 */
	public OperationResult<Collaborator> updateRole(String identity, String role, Collection<String> addPermissions) {
		Collaborator existing = collaborators.get(identity);
		if (existing == null) {
			return OperationResult.failure(ErrorKind.COLLABORATOR_NOT_FOUND,
					"Collaborator '" + identity + "' not found");
		}

		String normalizedRole = RoleCatalog.normalize(role);
		Set<String> requested = normalizePermissions(addPermissions);
		OperationResult<Set<String>> validated = validate(normalizedRole, requested);
		if (!validated.isSuccess()) {
			return validated.map(ignored -> null);
		}

		Set<String> merged = new LinkedHashSet<>(existing.permissions());
		merged.addAll(requested);
		Collaborator updated = new Collaborator(identity, normalizedRole, merged);
		collaborators.put(identity, updated);
		logger.info("Updated role of '{}': {} -> {}, added {}", identity, existing.role(), normalizedRole, requested);
		return OperationResult.success(updated);
	}

	/**
	 * Register a collaborator with the {@code contributor} role and no permissions.
	 * Registering an existing identity leaves its record untouched.
	 * @param name collaborator name
	 * @return the (new or existing) record
	 */
	public OperationResult<Collaborator> addContributor(String name) {
		Collaborator existing = collaborators.get(name);
		if (existing != null) {
			logger.debug("Contributor '{}' already registered with role '{}'", name, existing.role());
			return OperationResult.success(existing);
		}
		Collaborator contributor = new Collaborator(name, RoleCatalog.CONTRIBUTOR, Set.of());
		collaborators.put(name, contributor);
		logger.info("Added contributor '{}'", name);
		return OperationResult.success(contributor);
	}

	/**
	 * Remove a collaborator and its role record.
	 * @param identity collaborator identity
	 * @return the removed record, or {@code CollaboratorNotFound}
	 */
	public OperationResult<Collaborator> revoke(String identity) {
		Collaborator removed = collaborators.remove(identity);
		if (removed == null) {
			return OperationResult.failure(ErrorKind.COLLABORATOR_NOT_FOUND,
					"Collaborator '" + identity + "' not found");
		}
		logger.info("Revoked '{}' (role '{}')", identity, removed.role());
		return OperationResult.success(removed);
	}

	/**
	 * Returns true if the collaborator holds the permission and its current role allows
	 * it. Unknown collaborators have no permissions.
	 * @param identity collaborator identity
	 * @param permission permission name
	 * @return whether the collaborator is authorized
	 */
	public boolean check(String identity, String permission) {
		Collaborator collaborator = collaborators.get(identity);
		if (collaborator == null) {
			return false;
		}
		String normalized = normalizePermission(permission);
		return collaborator.holds(normalized) && catalog.allowedPermissions(collaborator.role()).contains(normalized);
	}

	/**
	 * Gate a protected action. Passes when enforcement is disabled.
	 * @param actor acting collaborator
	 * @param permission required permission
	 * @param action short description of the action, used in the denial message
	 * @return the actor on success, or {@code PermissionDenied}
	 */
	public OperationResult<String> authorize(String actor, String permission, String action) {
		if (!enforced || check(actor, permission)) {
			return OperationResult.success(actor);
		}
		logger.warn("Denied '{}' to '{}': missing '{}' permission", action, actor, permission);
		return OperationResult.failure(ErrorKind.PERMISSION_DENIED,
				"'" + actor + "' lacks '" + permission + "' permission to " + action);
	}

	/**
	 * Returns the role record of a collaborator.
	 * @param identity collaborator identity
	 * @return the record, or {@code CollaboratorNotFound}
	 */
	public OperationResult<Collaborator> show(String identity) {
		Collaborator collaborator = collaborators.get(identity);
		if (collaborator == null) {
			return OperationResult.failure(ErrorKind.COLLABORATOR_NOT_FOUND,
					"Collaborator '" + identity + "' not found");
		}
		return OperationResult.success(collaborator);
	}

	/**
	 * Case-sensitive exact lookup. Not finding the name is a normal outcome.
	 * @param name collaborator name
	 * @return the record, or informational {@code NotFound}
	 */
	public OperationResult<Collaborator> find(String name) {
		Collaborator collaborator = collaborators.get(name);
		if (collaborator == null) {
			return OperationResult.failure(ErrorKind.NOT_FOUND, "Collaborator '" + name + "' not found");
		}
		return OperationResult.success(collaborator);
	}

	/**
	 * Returns all collaborators ordered alphabetically by identity.
	 * @return collaborator records
	 */
	public List<Collaborator> list() {
		return List.copyOf(collaborators.values());
	}

	/**
	 * Replace the registry content with previously saved records.
	 */
	void restore(Collection<Collaborator> records) {
		collaborators.clear();
		for (Collaborator record : records) {
			collaborators.put(record.identity(), record);
		}
	}

	private OperationResult<Set<String>> validate(String role, Set<String> requested) {
		if (!catalog.contains(role)) {
			return OperationResult.failure(ErrorKind.INVALID_ROLE,
					"Invalid role '" + role + "'. Valid roles: " + String.join(", ", catalog.roles()));
		}
		Set<String> invalid = catalog.disallowed(role, requested);
		if (!invalid.isEmpty()) {
			Set<String> allowed = catalog.allowedPermissions(role);
			return OperationResult.failure(ErrorKind.INVALID_PERMISSION,
					"Invalid permissions for role '" + role + "': " + String.join(", ", invalid) + ". Allowed: "
							+ (allowed.isEmpty() ? "none" : String.join(", ", allowed)));
		}
		return OperationResult.success(requested);
	}

	/**
	 * Accepts both separate values and comma separated lists ({@code "push,merge"}).
	 */
	static Set<String> normalizePermissions(Collection<String> permissions) {
		Set<String> normalized = new LinkedHashSet<>();
		for (String value : permissions) {
			for (String part : value.split("[,\\s]+")) {
				if (!part.isBlank()) {
					normalized.add(normalizePermission(part));
				}
			}
		}
		return normalized;
	}

	private static String normalizePermission(String permission) {
		return permission.trim().toLowerCase(Locale.ROOT);
	}

}
