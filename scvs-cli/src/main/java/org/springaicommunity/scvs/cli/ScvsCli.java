package org.springaicommunity.scvs.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.scvs.ArgumentParser;
import org.springaicommunity.scvs.EnvironmentSupport;
import org.springaicommunity.scvs.OperationResult;
import org.springaicommunity.scvs.ParsedConfiguration;
import org.springaicommunity.scvs.ScvsBuilder;
import org.springaicommunity.scvs.ScvsProperties;
import org.springaicommunity.scvs.VersionControlSystem;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * SCVS command-line application.
 *
 * <p>
 * Without a command it starts an interactive shell with a {@code scvs [repo] (branch)> }
 * prompt; otherwise it runs the given command once and exits.
 *
 * <p>
 * Usage: java -jar scvs-cli.jar [OPTIONS] [COMMAND [ARGS...]]
 *
 * <p>
 * Examples: <pre>
 *   java -jar scvs-cli.jar --user ana@example.com
 *   java -jar scvs-cli.jar --repo proyect status
 *   java -jar scvs-cli.jar --repo proyect pr list
 * </pre>
 */
public class ScvsCli {

	private static final Logger logger = LoggerFactory.getLogger(ScvsCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args, System.in, System.out);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("SCVS failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args, InputStream in, PrintStream out) throws IOException {
		ScvsProperties properties = EnvironmentSupport.applyTo(new ScvsProperties());
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			out.println("Error: " + e.getMessage());
			out.println("Use --help for usage.");
			return 2;
		}
		config.applyTo(properties);
		configureLogging(config.verbose);
		logConfiguration(config);

		VersionControlSystem vcs = ScvsBuilder.create().properties(properties).buildVersionControlSystem();
		CommandHandler handler = new CommandHandler(vcs, out, config.logLimit);

		if (config.repository != null) {
			OperationResult<?> opened = vcs.init(config.repository);
			if (!opened.isSuccess()) {
				out.println("Error: " + opened);
				return 1;
			}
		}

		if (config.hasCommand()) {
			handler.execute(config.command);
			return handler.lastCommandFailed() ? 1 : 0;
		}
		return repl(handler, in, out);
	}

	private static int repl(CommandHandler handler, InputStream in, PrintStream out) throws IOException {
		out.println("SCVS interactive shell. Type 'help' for commands, 'exit' to quit.");
		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		while (true) {
			out.print(handler.prompt());
			out.flush();
			String line = reader.readLine();
			if (line == null) {
				out.println();
				return 0;
			}
			if (handler.execute(line) == CommandHandler.Outcome.EXIT) {
				return 0;
			}
		}
	}

	private static void configureLogging(boolean verbose) {
		if (!verbose) {
			return;
		}
		// Shell output stays quiet unless -v is given
		if (LoggerFactory.getLogger("org.springaicommunity.scvs") instanceof ch.qos.logback.classic.Logger scvsLogger) {
			scvsLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.debug("Configuration:");
		logger.debug("  User: {}", config.user);
		logger.debug("  Data directory: {}", config.dataDirectory);
		logger.debug("  Repository: {}", config.repository != null ? config.repository : "(none)");
		logger.debug("  Autosave: {}", config.autosave);
		logger.debug("  Permissions enforced: {}", config.enforcePermissions);
		logger.debug("  Log limit: {}", config.logLimit);
	}

}
