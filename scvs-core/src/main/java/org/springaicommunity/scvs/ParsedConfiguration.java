package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Storage
	public String dataDirectory;

	public boolean autosave;

	// Identity and access
	public String user;

	public boolean enforcePermissions;

	// Repository to open on startup
	@Nullable
	public String repository = null;

	// Output
	public boolean verbose;

	public int logLimit;

	public boolean helpRequested = false;

	// Tokens of a one-shot command; empty starts the interactive shell
	public List<String> command = new ArrayList<>();

	public ParsedConfiguration(ScvsProperties defaultProperties) {
		// Initialize with defaults
		this.dataDirectory = defaultProperties.getDataDirectory();
		this.autosave = defaultProperties.isAutosave();
		this.user = defaultProperties.getUser();
		this.enforcePermissions = defaultProperties.isEnforcePermissions();
		this.verbose = defaultProperties.isVerbose();
		this.logLimit = defaultProperties.getLogLimit();
	}

	/**
	 * Returns true when a one-shot command was given.
	 */
	public boolean hasCommand() {
		return !command.isEmpty();
	}

	/**
	 * Copy the parsed values onto a properties instance.
	 * @param properties properties to update
	 * @return the same properties
	 */
	public ScvsProperties applyTo(ScvsProperties properties) {
		properties.setDataDirectory(dataDirectory);
		properties.setAutosave(autosave);
		properties.setUser(user);
		properties.setEnforcePermissions(enforcePermissions);
		properties.setVerbose(verbose);
		properties.setLogLimit(logLimit);
		return properties;
	}

}
