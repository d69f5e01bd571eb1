package org.springaicommunity.scvs;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Reads SCVS settings from {@code .env} files and the process environment.
 *
 * <p>
 * Sources are consulted in order: the {@code .env} file of the working directory
 * (which also answers for system variables), then {@code ~/.env}. Both files are
 * optional and loaded once per process.
 */
public final class EnvironmentSupport {

	/** Identity of the acting collaborator. */
	public static final String USER_VARIABLE = "SCVS_USER";

	/** Directory holding the repository snapshot files. */
	public static final String DATA_DIRECTORY_VARIABLE = "SCVS_DATA_DIR";

	private static final List<Dotenv> SOURCES = loadSources();

	private EnvironmentSupport() {
	}

	private static List<Dotenv> loadSources() {
		Dotenv workingDirectory = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();
		String home = System.getProperty("user.home");
		if (home == null) {
			return List.of(workingDirectory);
		}
		return List.of(workingDirectory,
				Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load());
	}

	/**
	 * Look up a variable, ignoring blank values.
	 * @param name variable name
	 * @return the trimmed value, or {@code null} when no source defines it
	 */
	@Nullable
	public static String get(String name) {
		for (Dotenv source : SOURCES) {
			String value = source.get(name);
			if (value != null && !value.isBlank()) {
				return value.trim();
			}
		}
		return null;
	}

	/**
	 * Override the user and data directory of {@code properties} with the values found
	 * in the environment.
	 * @param properties properties to update
	 * @return the same properties
	 */
	public static ScvsProperties applyTo(ScvsProperties properties) {
		String user = get(USER_VARIABLE);
		if (user != null) {
			properties.setUser(user);
		}
		String dataDirectory = get(DATA_DIRECTORY_VARIABLE);
		if (dataDirectory != null) {
			properties.setDataDirectory(dataDirectory);
		}
		return properties;
	}

}
