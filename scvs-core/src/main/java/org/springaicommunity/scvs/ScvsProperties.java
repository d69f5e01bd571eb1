package org.springaicommunity.scvs;

/**
 * Settings for repositories, persistence and the acting user.
 */
public class ScvsProperties {

	private String dataDirectory = ".scvs";

	private String defaultBranch = "main";

	private String user = "user@example.com";

	private String ownerRole = "admin";

	private boolean enforcePermissions = true;

	private boolean autosave = true;

	private int logLimit = 20;

	private boolean verbose = false;

	/**
	 * Directory where repository snapshots ({@code <name>.json}) are written.
	 * @return the data directory
	 */
	public String getDataDirectory() {
		return dataDirectory;
	}

	/**
	 * Set the snapshot directory.
	 * @param dataDirectory the data directory
	 */
	public void setDataDirectory(String dataDirectory) {
		this.dataDirectory = dataDirectory;
	}

	/**
	 * Branch created by {@code init}; it can never be deleted.
	 * @return the default branch name
	 */
	public String getDefaultBranch() {
		return defaultBranch;
	}

	/**
	 * Set the default branch name.
	 * @param defaultBranch the default branch name
	 */
	public void setDefaultBranch(String defaultBranch) {
		this.defaultBranch = defaultBranch;
	}

	/**
	 * Identity of the acting collaborator.
	 * @return the user identity
	 */
	public String getUser() {
		return user;
	}

	/**
	 * Set the acting collaborator.
	 * @param user the user identity
	 */
	public void setUser(String user) {
		this.user = user;
	}

	/**
	 * Role granted to the user who initializes a repository.
	 * @return the owner role
	 */
	public String getOwnerRole() {
		return ownerRole;
	}

	/**
	 * Set the owner role.
	 * @param ownerRole the owner role
	 */
	public void setOwnerRole(String ownerRole) {
		this.ownerRole = ownerRole;
	}

	/**
	 * Whether protected operations check the actor's permissions.
	 * @return true if permissions are enforced
	 */
	public boolean isEnforcePermissions() {
		return enforcePermissions;
	}

	/**
	 * Set permission enforcement.
	 * @param enforcePermissions true to enforce permissions
	 */
	public void setEnforcePermissions(boolean enforcePermissions) {
		this.enforcePermissions = enforcePermissions;
	}

	/**
	 * Whether the active repository is saved after every successful change.
	 * @return true if autosave is enabled
	 */
	public boolean isAutosave() {
		return autosave;
	}

	/**
	 * Set autosave.
	 * @param autosave true to save after every change
	 */
	public void setAutosave(boolean autosave) {
		this.autosave = autosave;
	}

	/**
	 * Maximum number of commits shown by {@code log}.
	 * @return the log limit
	 */
	public int getLogLimit() {
		return logLimit;
	}

	/**
	 * Set the log limit.
	 * @param logLimit maximum number of commits shown
	 */
	public void setLogLimit(int logLimit) {
		this.logLimit = logLimit;
	}

	/**
	 * Whether verbose logging is enabled.
	 * @return true for verbose output
	 */
	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * Set verbose logging.
	 * @param verbose true for verbose output
	 */
	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
