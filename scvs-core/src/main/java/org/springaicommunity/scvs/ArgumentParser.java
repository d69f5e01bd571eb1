package org.springaicommunity.scvs;

import java.util.Arrays;

/**
 * Command-line argument parser for the SCVS shell. Options come first; the first
 * token that is not an option starts a one-shot command.
 */
public class ArgumentParser {

	private final ScvsProperties defaultProperties;

	public ArgumentParser(ScvsProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-d", "--data-dir":
					config.dataDirectory = getRequiredValue(args, i, "data-dir");
					i++; // Skip next argument since we consumed it
					break;

				case "-u", "--user":
					config.user = getRequiredValue(args, i, "user").trim();
					i++;
					break;

				case "-r", "--repo":
					config.repository = getRequiredValue(args, i, "repo");
					i++;
					break;

				case "--no-autosave":
					config.autosave = false;
					break;

				case "--no-permissions":
					config.enforcePermissions = false;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "--log-limit":
					String limitStr = getRequiredValue(args, i, "log-limit");
					try {
						config.logLimit = Integer.parseInt(limitStr);
						if (config.logLimit <= 0) {
							throw new IllegalArgumentException("Log limit must be positive: " + config.logLimit);
						}
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid log limit '" + limitStr + "': must be a positive integer");
					}
					i++;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					// Everything from here on is the command
					config.command.addAll(Arrays.asList(args).subList(i, args.length));
					i = args.length;
					break;
			}
		}

		validateConfiguration(config);
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
			if (!arg.startsWith("-")) {
				return false;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: scvs [OPTIONS] [COMMAND [ARGS...]]\n");
		help.append("\n");
		help.append("Simulated version control with branches, staging, pull requests and roles.\n");
		help.append("Without a command an interactive shell is started.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -d, --data-dir DIR      Directory for repository files (default: ")
			.append(defaultProperties.getDataDirectory())
			.append(")\n");
		help.append("    -u, --user USER         Acting collaborator (default: ")
			.append(defaultProperties.getUser())
			.append(")\n");
		help.append("    -r, --repo NAME         Open (or create) a repository on startup\n");
		help.append("    --no-autosave           Do not save after each change\n");
		help.append("    --no-permissions        Do not check role permissions\n");
		help.append("    --log-limit N           Commits shown by log (default: ")
			.append(defaultProperties.getLogLimit())
			.append(")\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ")
			.append(EnvironmentSupport.USER_VARIABLE)
			.append("               Acting collaborator (read from .env or the environment)\n");
		help.append("    ")
			.append(EnvironmentSupport.DATA_DIRECTORY_VARIABLE)
			.append("           Directory for repository files\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    scvs --user ana@example.com\n");
		help.append("    scvs --repo proyect log\n");
		help.append("    scvs --repo proyect pr list\n");
		help.append("\n");
		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.dataDirectory.trim().isEmpty()) {
			throw new IllegalArgumentException("Data directory cannot be empty");
		}
		if (config.user.isEmpty()) {
			throw new IllegalArgumentException("User cannot be empty");
		}
		if (config.repository != null && config.repository.trim().isEmpty()) {
			throw new IllegalArgumentException("Repository name cannot be empty");
		}
	}

}
