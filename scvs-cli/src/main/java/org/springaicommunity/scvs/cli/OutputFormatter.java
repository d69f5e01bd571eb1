package org.springaicommunity.scvs.cli;

import org.springaicommunity.scvs.Branch;
import org.springaicommunity.scvs.BranchListing;
import org.springaicommunity.scvs.Collaborator;
import org.springaicommunity.scvs.Commit;
import org.springaicommunity.scvs.CommitKind;
import org.springaicommunity.scvs.PullRequest;
import org.springaicommunity.scvs.PullRequestListing;
import org.springaicommunity.scvs.QueueSummary;
import org.springaicommunity.scvs.RepositoryStatus;
import org.springaicommunity.scvs.ReviewComment;
import org.springaicommunity.scvs.StagingEntry;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders core result records as console text.
 */
final class OutputFormatter {

	static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private static final String RULE = "-".repeat(60);

	private OutputFormatter() {
	}

	static String stagingEntry(StagingEntry entry) {
		return String.format("  %s %-30s (%s)", entry.included() ? "[X]" : "[ ]", entry.path(),
				entry.kind().marker());
	}

	static String staging(List<StagingEntry> entries) {
		if (entries.isEmpty()) {
			return "Staging area is empty. (use 'add <file...>')";
		}
		StringBuilder text = new StringBuilder("Staging:\n");
		entries.forEach(entry -> text.append(stagingEntry(entry)).append('\n'));
		long included = entries.stream().filter(StagingEntry::included).count();
		text.append(included > 0 ? "(" + included + " file(s) selected)" : "(no file selected)");
		return text.toString();
	}

	static String status(RepositoryStatus status) {
		StringBuilder text = new StringBuilder();
		text.append("Repository '").append(status.repository()).append("', on branch '").append(status.head())
			.append("'\n");
		text.append(status.tipId() != null ? "Last commit: " + status.tipId() : "No commits yet.").append('\n');
		text.append(status.branchCount())
			.append(" branch(es), ")
			.append(status.commitCount())
			.append(" commit(s), ")
			.append(status.activePullRequests())
			.append(" open pull request(s)\n\n");
		text.append(staging(status.staged()));
		return text.toString();
	}

	static String commitCreated(Commit commit) {
		return "Commit " + commit.id() + " on '" + commit.branch() + "'. Files: " + String.join(", ", commit.files());
	}

	static String commit(Commit commit) {
		StringBuilder text = new StringBuilder();
		text.append("commit ").append(commit.id());
		if (commit.kind() == CommitKind.MERGE) {
			text.append(" (merge of '").append(commit.mergedFrom()).append("')");
		}
		text.append('\n');
		text.append("Parent: ").append(commit.parentId() != null ? commit.parentId() : "(root)").append('\n');
		text.append("Author: ").append(commit.author()).append('\n');
		text.append("Date:   ").append(commit.timestamp().format(TIMESTAMP)).append('\n');
		text.append("Branch: ").append(commit.branch()).append("\n\n");
		text.append("    ").append(commit.message()).append('\n');
		text.append("    Files: ")
			.append(commit.changes()
				.stream()
				.map(change -> change.path() + " (" + change.kind().marker() + ")")
				.collect(Collectors.joining(", ")));
		return text.toString();
	}

	static String log(List<Commit> commits, String title, int limit) {
		if (commits.isEmpty()) {
			return title + "\nNo commits.";
		}
		StringBuilder text = new StringBuilder(title).append('\n');
		for (Commit commit : commits) {
			text.append(RULE).append('\n').append(commit(commit)).append('\n');
		}
		text.append(RULE);
		if (commits.size() == limit) {
			text.append("\n...(last ").append(limit).append(")");
		}
		return text.toString();
	}

	static String branches(BranchListing listing) {
		StringBuilder text = new StringBuilder("Branches:");
		for (Branch branch : listing.branches()) {
			text.append('\n')
				.append(branch.name().equals(listing.head()) ? "* " : "  ")
				.append(String.format("%-25s %s", branch.name(), branch.tipId() != null ? branch.tipId() : "(empty)"));
		}
		return text.toString();
	}

	static String branchTree(BranchListing listing) {
		StringBuilder text = new StringBuilder("Tree:");
		for (Branch branch : listing.branches()) {
			if (branch.createdFrom() == null) {
				appendTree(text, listing, branch, 0);
			}
		}
		return text.toString();
	}

	private static void appendTree(StringBuilder text, BranchListing listing, Branch node, int depth) {
		text.append('\n').append("  ".repeat(depth)).append("- ").append(node.name());
		for (Branch child : listing.branches()) {
			if (node.name().equals(child.createdFrom())) {
				appendTree(text, listing, child, depth + 1);
			}
		}
	}

	static String pullRequestCreated(PullRequest request) {
		return "Pull request #" + request.id() + " created: '" + request.title() + "' by " + request.author() + ".";
	}

	static String pullRequests(PullRequestListing listing) {
		StringBuilder text = new StringBuilder("--- Pending pull requests ---\n");
		if (listing.active().isEmpty()) {
			text.append("(none)\n");
		}
		else {
			text.append(String.format("%-5s %-12s %-15s %-15s %-25s %s%n", "ID", "State", "Source", "Destination",
					"Author", "Tags"));
			for (PullRequest request : listing.active()) {
				text.append(String.format("%-5d %-12s %-15s %-15s %-25s %s%n", request.id(), request.state().label(),
						request.source(), request.destination(), request.author(), String.join(",", request.tags())));
			}
		}
		text.append("\n--- Closed pull requests ---\n");
		if (listing.closed().isEmpty()) {
			text.append("(none)");
		}
		else {
			text.append(String.format("%-5s %-12s %-15s %-15s %s", "ID", "State", "Source", "Destination", "Closed"));
			for (PullRequest request : listing.closed()) {
				text.append(String.format("%n%-5d %-12s %-15s %-15s %s", request.id(), request.state().label(),
						request.source(), request.destination(),
						request.closedAt() != null ? request.closedAt().format(TIMESTAMP) : "N/A"));
			}
		}
		return text.toString();
	}

	static String pullRequest(PullRequest request) {
		StringBuilder text = new StringBuilder();
		text.append("--- PR #").append(request.id()).append(" ---\n");
		text.append(String.format("%-12s: %s%n", "Title", request.title()));
		text.append(String.format("%-12s: %s%n", "State", request.state().label()));
		text.append(String.format("%-12s: %s -> %s%n", "Branches", request.source(), request.destination()));
		text.append(String.format("%-12s: %s%n", "Author", request.author()));
		text.append(String.format("%-12s: %s%n", "Created", request.createdAt().format(TIMESTAMP)));
		text.append(String.format("%-12s: %s%n", "Tags", request.tags().isEmpty() ? "-" : String.join(", ", request.tags())));
		if (request.mergeCommitId() != null) {
			text.append(String.format("%-12s: %s%n", "Merge commit", request.mergeCommitId()));
		}
		if (request.closedAt() != null) {
			text.append(String.format("%-12s: %s%n", "Closed", request.closedAt().format(TIMESTAMP)));
		}
		text.append("Reviews:");
		if (request.reviews().isEmpty()) {
			text.append(" (none)");
		}
		int index = 1;
		for (ReviewComment review : request.reviews()) {
			text.append(String.format("%n [%d](%s) %s: %s", index++, review.createdAt().format(TIMESTAMP),
					review.reviewer(), review.comment()));
		}
		return text.toString();
	}

	static String queueSummary(QueueSummary summary) {
		return "Pull requests: " + summary.open() + " open, " + summary.inRevision() + " in revision, "
				+ summary.merged() + " merged, " + summary.rejected() + " rejected. Next in queue: "
				+ (summary.nextId() != null ? "#" + summary.nextId() : "none");
	}

	static String collaborators(List<Collaborator> collaborators) {
		if (collaborators.isEmpty()) {
			return "No collaborators.";
		}
		StringBuilder text = new StringBuilder(String.format("%-30s %-15s %s", "Name", "Role", "Permissions"));
		for (Collaborator collaborator : collaborators) {
			text.append(String.format("%n%-30s %-15s %s", collaborator.identity(), collaborator.role(),
					permissions(collaborator)));
		}
		return text.toString();
	}

	static String collaborator(Collaborator collaborator) {
		return "--- Role of " + collaborator.identity() + " ---\nRole: " + collaborator.role() + "\nPermissions: "
				+ permissions(collaborator);
	}

	static String permissions(Collaborator collaborator) {
		return collaborator.permissions().isEmpty() ? "none" : String.join(", ", collaborator.permissions());
	}

}
