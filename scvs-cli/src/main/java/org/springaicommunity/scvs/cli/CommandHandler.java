package org.springaicommunity.scvs.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.scvs.BranchListing;
import org.springaicommunity.scvs.CommitLog;
import org.springaicommunity.scvs.OperationResult;
import org.springaicommunity.scvs.Repository;
import org.springaicommunity.scvs.RepositoryOpened;
import org.springaicommunity.scvs.RepositoryStoreException;
import org.springaicommunity.scvs.StagingEntry;
import org.springaicommunity.scvs.VersionControlSystem;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Parses shell command lines and dispatches them to the {@link VersionControlSystem}.
 *
 * <p>
 * Usage errors and storage failures are reported on the output stream and never end the
 * session; only {@code exit} does. {@link #lastCommandFailed()} tells whether the most
 * recent command reported an error.
 */
public class CommandHandler {

	private static final Logger logger = LoggerFactory.getLogger(CommandHandler.class);

	/**
	 * Whether the shell keeps reading commands.
	 */
	public enum Outcome {

		CONTINUE, EXIT

	}

	private final VersionControlSystem vcs;

	private final PrintStream out;

	private final int logLimit;

	private boolean failed;

	public CommandHandler(VersionControlSystem vcs, PrintStream out, int logLimit) {
		this.vcs = vcs;
		this.out = out;
		this.logLimit = logLimit;
	}

	/**
	 * Prompt showing the active repository and branch: {@code scvs [repo] (branch)> }.
	 */
	public String prompt() {
		return vcs.current()
			.map(repository -> "scvs [" + repository.name() + "] (" + repository.head() + ")> ")
			.orElse("scvs> ");
	}

	public Outcome execute(String line) {
		List<String> tokens;
		try {
			tokens = tokenize(line);
		}
		catch (IllegalArgumentException e) {
			failed = true;
			out.println("Error: " + e.getMessage());
			return Outcome.CONTINUE;
		}
		return execute(tokens);
	}

	/**
	 * Run one command.
	 * @param tokens command name followed by its arguments
	 * @return whether the shell should continue
	 */
	public Outcome execute(List<String> tokens) {
		failed = false;
		if (tokens.isEmpty()) {
			return Outcome.CONTINUE;
		}
		String command = tokens.get(0).toLowerCase(Locale.ROOT);
		List<String> args = tokens.subList(1, tokens.size());
		logger.debug("Executing '{}' with {}", command, args);
		try {
			return dispatch(command, args);
		}
		catch (UsageException e) {
			failed = true;
			out.println("Usage: " + e.getMessage());
		}
		catch (IllegalArgumentException e) {
			failed = true;
			out.println("Error: " + e.getMessage());
		}
		catch (RepositoryStoreException e) {
			failed = true;
			logger.error("Storage failure: {}", e.getMessage(), e);
			out.println("Error: could not save or load the repository (" + e.getPath() + ")");
		}
		return Outcome.CONTINUE;
	}

	/**
	 * Whether the last executed command reported an error. Informational results such as
	 * an empty queue do not count.
	 */
	public boolean lastCommandFailed() {
		return failed;
	}

	private Outcome dispatch(String command, List<String> args) {
		switch (command) {
			case "exit", "quit":
				out.println("Bye.");
				return Outcome.EXIT;
			case "help":
				out.println(helpText());
				break;
			case "whoami":
				out.println(vcs.user());
				break;
			case "init":
				init(args);
				break;
			case "repos":
				repositories();
				break;
			case "add":
				requireArgs(args, 1, "add <file...>");
				report(vcs.stageAdd(args.toArray(new String[0])), entries -> "Staged: "
						+ String.join(", ", entries.stream().map(StagingEntry::path).toList()));
				break;
			case "rm":
				requireArgs(args, 1, "rm <file>");
				report(vcs.stageRemove(args.get(0)), entry -> "Staged deletion of " + entry.path());
				break;
			case "commit":
				requireArgs(args, 1, "commit \"<message>\"");
				report(vcs.commit(String.join(" ", args)), OutputFormatter::commitCreated);
				break;
			case "status":
				report(vcs.status(), OutputFormatter::status);
				break;
			case "log":
				log(args);
				break;
			case "checkout":
				requireArgs(args, 1, "checkout <branch>");
				report(vcs.checkout(args.get(0)), branch -> "Switched to '" + branch.name() + "'.");
				break;
			case "stage":
				stage(args);
				break;
			case "branch":
				branch(args);
				break;
			case "merge":
				if (args.size() != 2) {
					throw new UsageException("merge <source> <destination>");
				}
				report(vcs.merge(args.get(0), args.get(1)),
						commit -> "Merge completed on '" + commit.branch() + "'. Commit: " + commit.id()
								+ ". Files: " + String.join(", ", commit.files()));
				break;
			case "pr":
				pullRequest(args);
				break;
			case "role":
				role(args);
				break;
			case "contributors":
				report(vcs.listContributors(), OutputFormatter::collaborators);
				break;
			case "add-contributor":
				requireArgs(args, 1, "add-contributor <name>");
				report(vcs.addContributor(String.join(" ", args)),
						collaborator -> "Collaborator '" + collaborator.identity() + "' registered (role: "
								+ collaborator.role() + ").");
				break;
			case "remove-contributor":
				requireArgs(args, 1, "remove-contributor <name>");
				report(vcs.removeContributor(String.join(" ", args)),
						collaborator -> "Collaborator '" + collaborator.identity() + "' removed.");
				break;
			case "find-contributor":
				requireArgs(args, 1, "find-contributor <name>");
				report(vcs.findContributor(String.join(" ", args)), collaborator -> "Found: name='"
						+ collaborator.identity() + "', role='" + collaborator.role() + "'");
				break;
			default:
				failed = true;
				out.println("Unknown command '" + command + "'. Type 'help' for the list of commands.");
				break;
		}
		return Outcome.CONTINUE;
	}

	private void init(List<String> args) {
		requireArgs(args, 1, "init <repo>");
		OperationResult<RepositoryOpened> result = vcs.init(args.get(0));
		report(result, opened -> {
			Repository repository = opened.repository();
			switch (opened.origin()) {
				case CREATED:
					return "Repository '" + repository.name() + "' initialized. You are '" + vcs.user() + "'.";
				case LOADED:
					return "Repository '" + repository.name() + "' loaded.";
				default:
					return "Repository '" + repository.name() + "' is already open.";
			}
		});
	}

	private void repositories() {
		List<String> names = vcs.repositories();
		if (names.isEmpty()) {
			out.println("No repositories yet. Use 'init <repo>' to create one.");
			return;
		}
		String active = vcs.current().map(Repository::name).orElse("");
		names.forEach(name -> out.println((name.equals(active) ? "* " : "  ") + name));
	}

	private void log(List<String> args) {
		OperationResult<CommitLog> result = args.isEmpty() ? vcs.log() : vcs.log(args.get(0));
		String title = args.isEmpty() ? "History (all branches):" : "History of branch '" + args.get(0) + "':";
		report(result, commits -> OutputFormatter.log(commits.take(logLimit), title, logLimit));
	}

	private void stage(List<String> args) {
		requireArgs(args, 1, "stage <list|toggle <file>|clear|clear_selected>");
		switch (args.get(0)) {
			case "list":
				report(vcs.stageList(), OutputFormatter::staging);
				break;
			case "toggle":
				requireArgs(args, 2, "stage toggle <file>");
				report(vcs.stageToggle(args.get(1)), entry -> "Selection of '" + entry.path() + "' changed to: "
						+ (entry.included() ? "selected" : "not selected"));
				break;
			case "clear":
				report(vcs.stageClear(),
						count -> count > 0 ? "Staging area cleared (" + count + " file(s) removed)."
								: "Staging area was already empty.");
				break;
			case "clear_selected":
				report(vcs.stageClearSelected(),
						count -> count > 0 ? count + " selected file(s) removed from staging."
								: "No selected files to clear.");
				break;
			default:
				out.println("Unknown stage subcommand '" + args.get(0) + "'.");
				break;
		}
	}

	private void branch(List<String> args) {
		if (args.isEmpty() || "--list".equals(args.get(0))) {
			OperationResult<BranchListing> listing = vcs.listBranches();
			boolean tree = !args.isEmpty();
			report(listing, branches -> tree
					? OutputFormatter.branches(branches) + "\n\n" + OutputFormatter.branchTree(branches)
					: OutputFormatter.branches(branches));
			return;
		}
		switch (args.get(0)) {
			case "-b":
				requireArgs(args, 2, "branch -b <name> [from]");
				String name = args.get(1);
				report(args.size() > 2 ? vcs.createBranch(name, args.get(2)) : vcs.createBranch(name),
						branch -> "Branch '" + branch.name() + "' created from '" + branch.createdFrom() + "'.");
				break;
			case "-d":
				requireArgs(args, 2, "branch -d <name>");
				report(vcs.deleteBranch(args.get(1)), branch -> "Branch '" + branch.name() + "' deleted.");
				break;
			default:
				throw new UsageException("branch [--list] | -b <name> [from] | -d <name>");
		}
	}

	private void pullRequest(List<String> args) {
		requireArgs(args, 1, "pr <create|list|status|review|approve|reject|tag|next|clear> ...");
		String sub = args.get(0);
		List<String> rest = args.subList(1, args.size());
		switch (sub) {
			case "create":
				if (rest.size() < 2) {
					throw new UsageException("pr create <source> <destination>");
				}
				report(vcs.prCreate(rest.get(0), rest.get(1)), OutputFormatter::pullRequestCreated);
				break;
			case "list":
				report(vcs.prList(), OutputFormatter::pullRequests);
				break;
			case "status":
				if (rest.isEmpty()) {
					report(vcs.prStatus(), OutputFormatter::queueSummary);
				}
				else {
					report(vcs.prStatus(parseId(rest.get(0))), OutputFormatter::pullRequest);
				}
				break;
			case "review":
				if (rest.size() < 2) {
					throw new UsageException("pr review <id> \"<comment>\"");
				}
				report(vcs.prReview(parseId(rest.get(0)), joinFrom(rest, 1)),
						request -> "Review added to PR #" + request.id() + " by " + vcs.user() + ".");
				break;
			case "approve":
				requireArgs(rest, 1, "pr approve <id>");
				report(vcs.prApprove(parseId(rest.get(0))), request -> "PR #" + request.id()
						+ " approved and merged. Commit: " + request.mergeCommitId());
				break;
			case "reject":
				requireArgs(rest, 1, "pr reject <id> [\"reason\"]");
				report(vcs.prReject(parseId(rest.get(0)), joinFrom(rest, 1)),
						request -> "PR #" + request.id() + " rejected.");
				break;
			case "tag":
				if (rest.size() < 2) {
					throw new UsageException("pr tag <id> <label>");
				}
				report(vcs.prTag(parseId(rest.get(0)), joinFrom(rest, 1)),
						request -> "Tag added to PR #" + request.id() + ". Tags: " + String.join(", ", request.tags()));
				break;
			case "next":
				report(vcs.prNext(), request -> "Next: PR #" + request.id() + " '" + request.title() + "' ("
						+ request.state().label() + ")");
				break;
			case "clear":
				report(vcs.prClear(), count -> "Pull request queue cleared (" + count + " removed).");
				break;
			default:
				out.println("Unknown pr subcommand '" + sub + "'.");
				break;
		}
	}

	private void role(List<String> args) {
		requireArgs(args, 1, "role <add|update|remove|show|list|check> ...");
		String sub = args.get(0);
		List<String> rest = args.subList(1, args.size());
		switch (sub) {
			case "add":
				if (rest.size() < 2) {
					throw new UsageException("role add <email> <role> [permissions...]");
				}
				report(vcs.roleAdd(rest.get(0), rest.get(1), permissionsFrom(rest)),
						collaborator -> "Role '" + collaborator.role() + "' assigned to '" + collaborator.identity()
								+ "'. Permissions: " + OutputFormatter.permissions(collaborator));
				break;
			case "update":
				if (rest.size() < 2) {
					throw new UsageException("role update <email> <role> [permissions to add...]");
				}
				report(vcs.roleUpdate(rest.get(0), rest.get(1), permissionsFrom(rest)),
						collaborator -> "Role of '" + collaborator.identity() + "' is now '" + collaborator.role()
								+ "'. Permissions: " + OutputFormatter.permissions(collaborator));
				break;
			case "remove":
				requireArgs(rest, 1, "role remove <email>");
				report(vcs.roleRemove(rest.get(0)), collaborator -> "Role removed for '" + collaborator.identity() + "'.");
				break;
			case "show":
				requireArgs(rest, 1, "role show <email>");
				report(vcs.roleShow(rest.get(0)), OutputFormatter::collaborator);
				break;
			case "list":
				report(vcs.roleList(), OutputFormatter::collaborators);
				break;
			case "check":
				if (rest.size() != 2) {
					throw new UsageException("role check <email> <permission>");
				}
				String email = rest.get(0);
				String permission = rest.get(1);
				report(vcs.roleCheck(email, permission),
						granted -> granted ? "Yes, '" + email + "' has permission '" + permission + "'."
								: "No, '" + email + "' does NOT have permission '" + permission + "'.");
				break;
			default:
				out.println("Unknown role subcommand '" + sub + "'.");
				break;
		}
	}

	private <T> void report(OperationResult<T> result, Function<T, String> render) {
		if (result instanceof OperationResult.Success<T> success) {
			out.println(render.apply(success.value()));
			return;
		}
		OperationResult.Failure<T> failure = (OperationResult.Failure<T>) result;
		if (failure.kind().isInformational()) {
			out.println(failure.message());
		}
		else {
			failed = true;
			out.println("Error [" + failure.kind().label() + "]: " + failure.message());
		}
	}

	private static String[] permissionsFrom(List<String> rest) {
		return rest.subList(2, rest.size()).toArray(new String[0]);
	}

	private static String joinFrom(List<String> tokens, int from) {
		return String.join(" ", tokens.subList(from, tokens.size()));
	}

	private static int parseId(String value) {
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid pull request id '" + value + "'");
		}
	}

	private static void requireArgs(List<String> args, int count, String usage) {
		if (args.size() < count) {
			throw new UsageException(usage);
		}
	}

	/**
	 * Split a command line into tokens. Single or double quotes group words; quotes are
	 * removed.
	 * @param line the command line
	 * @return tokens
	 * @throws IllegalArgumentException if a quote is not closed
	 */
	static List<String> tokenize(String line) {
		List<String> tokens = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		char quote = 0;
		boolean inToken = false;
		for (char c : line.toCharArray()) {
			if (quote != 0) {
				if (c == quote) {
					quote = 0;
				}
				else {
					current.append(c);
				}
			}
			else if (c == '"' || c == '\'') {
				quote = c;
				inToken = true;
			}
			else if (Character.isWhitespace(c)) {
				if (inToken) {
					tokens.add(current.toString());
					current.setLength(0);
					inToken = false;
				}
			}
			else {
				current.append(c);
				inToken = true;
			}
		}
		if (quote != 0) {
			throw new IllegalArgumentException("Unclosed quote in: " + line);
		}
		if (inToken) {
			tokens.add(current.toString());
		}
		return tokens;
	}

	static String helpText() {
		return """
				--- SCVS help ---
				Repository and files:
				  init <repo>                 Initialize or load a repository
				  repos                       List repositories (* marks the active one)
				  add <file...>               Stage files
				  rm <file>                   Stage the deletion of a tracked file
				  commit "<message>"          Commit the selected staged files
				  status                      Show the current state
				  log [branch]                Show history
				Branches and merging:
				  branch [--list]             List branches (and the tree with --list)
				  branch -b <name> [from]     Create a branch from [from] (or the current one)
				  branch -d <name>            Delete a branch
				  checkout <branch>           Switch branch
				  merge <source> <dest>       Merge source into destination
				Staging area:
				  stage list                  Show staged files
				  stage toggle <file>         (De)select a file for the next commit
				  stage clear | clear_selected
				Pull requests:
				  pr create <source> <dest>   pr list   pr status [id]   pr next   pr clear
				  pr review <id> "<comment>"  pr approve <id>   pr reject <id> ["reason"]   pr tag <id> <label>
				Roles and collaborators:
				  role add <email> <role> [perms...]   role update <email> <role> [perms...]
				  role remove <email>   role show <email>   role list   role check <email> <perm>
				  contributors   add-contributor <name>   remove-contributor <name>   find-contributor <name>
				Other:
				  whoami   help   exit""";
	}

	/**
	 * Wrong number or shape of command arguments.
	 */
	static class UsageException extends IllegalArgumentException {

		UsageException(String usage) {
			super(usage);
		}

	}

}
