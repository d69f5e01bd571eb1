package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * A repository aggregate: branches, HEAD, staging area, commit graph, pull request
 * workflow and collaborator registry.
 *
 * <p>
 * Every operation returns an {@link OperationResult}; expected failures are never
 * thrown. Mutating operations hold the write lock for their whole duration, queries hold
 * the read lock, so concurrent callers observe a linearizable history. Protected
 * operations check the actor's permission before touching any state.
 */
public class Repository {

	private static final Logger logger = LoggerFactory.getLogger(Repository.class);

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	private final String name;

	private final String defaultBranch;

	private final Clock clock;

	private final AccessControl accessControl;

	private final StagingArea staging = new StagingArea();

	private final CommitGraph graph = new CommitGraph();

	private final MergeEngine mergeEngine;

	private final PullRequestQueue pullRequests;

	private String head;

	private Repository(String name, String defaultBranch, RoleCatalog catalog, boolean enforcePermissions,
			Clock clock) {
		this.name = name;
		this.defaultBranch = defaultBranch;
		this.head = defaultBranch;
		this.clock = clock;
		this.accessControl = new AccessControl(catalog, enforcePermissions);
		this.mergeEngine = new MergeEngine(graph, accessControl);
		this.pullRequests = new PullRequestQueue(graph, mergeEngine, accessControl);
	}

	/**
	 * Create a repository with an empty default branch and grant its owner the owner role.
	 * @param name repository name
	 * @param owner identity of the creating collaborator
	 * @param properties settings (default branch, owner role, permission enforcement)
	 * @param catalog role catalog
	 * @param clock time source
	 * @return the new repository
	 * @throws IllegalArgumentException if the owner role is not in the catalog
	 */
	public static Repository initialize(String name, String owner, ScvsProperties properties, RoleCatalog catalog,
			Clock clock) {
		Repository repository = new Repository(name, properties.getDefaultBranch(), catalog,
				properties.isEnforcePermissions(), clock);
		repository.graph.createRootBranch(properties.getDefaultBranch(), repository.now());
		OperationResult<Collaborator> owned = repository.accessControl.grantRole(owner, properties.getOwnerRole(),
				List.of());
		if (owned instanceof OperationResult.Failure<Collaborator> failure) {
			throw new IllegalArgumentException("Cannot grant owner role: " + failure.message());
		}
		logger.info("Initialized repository '{}' (default branch '{}', owner '{}')", name,
				properties.getDefaultBranch(), owner);
		return repository;
	}

	/**
	 * Rebuild a repository from a snapshot.
	 */
	public static Repository fromSnapshot(RepositorySnapshot snapshot, ScvsProperties properties,
			RoleCatalog catalog, Clock clock) {
		Repository repository = new Repository(snapshot.name(), snapshot.defaultBranch(), catalog,
				properties.isEnforcePermissions(), clock);
		repository.graph.restore(snapshot.commits(), snapshot.branches());
		repository.staging.restore(snapshot.staging());
		repository.accessControl.restore(snapshot.collaborators());
		repository.pullRequests.restore(snapshot.activePullRequests(), snapshot.closedPullRequests(),
				snapshot.lastPullRequestId());
		repository.head = repository.graph.hasBranch(snapshot.head()) ? snapshot.head() : snapshot.defaultBranch();
		logger.debug("Restored repository '{}' with {} commit(s) and {} branch(es)", snapshot.name(),
				snapshot.commits().size(), snapshot.branches().size());
		return repository;
	}

	/**
	 * Capture the repository state for persistence.
	 */
	public RepositorySnapshot snapshot() {
		return read(() -> {
			PullRequestListing listing = pullRequests.list();
			return new RepositorySnapshot(RepositorySnapshot.CURRENT_FORMAT, name, head, defaultBranch,
					graph.branchesInOrder(), graph.commitsInOrder(), staging.all(), accessControl.list(),
					listing.active(), listing.closed(), pullRequests.lastId(), now());
		});
	}

	public String name() {
		return name;
	}

	public String defaultBranch() {
		return defaultBranch;
	}

	public String head() {
		return read(() -> head);
	}

	// Branches

	public OperationResult<Branch> createBranch(String actor, String branchName) {
		return write(() -> doCreateBranch(actor, branchName, head));
	}

	public OperationResult<Branch> createBranch(String actor, String branchName, String from) {
		return write(() -> doCreateBranch(actor, branchName, from));
	}

	private OperationResult<Branch> doCreateBranch(String actor, String branchName, String from) {
		return accessControl.authorize(actor, Permissions.PUSH, "create branch '" + branchName + "'")
			.flatMap(ok -> graph.createBranch(branchName, from, now()));
	}

	public OperationResult<Branch> deleteBranch(String actor, String branchName) {
		return write(() -> accessControl.authorize(actor, Permissions.PUSH, "delete branch '" + branchName + "'")
			.flatMap(ok -> graph.deleteBranch(branchName, head, defaultBranch))
			.map(deleted -> {
				staging.discard(branchName);
				return deleted;
			}));
	}

	public BranchListing listBranches() {
		return read(() -> new BranchListing(head, graph.branches()));
	}

	public OperationResult<Branch> checkout(String actor, String branchName) {
		return write(() -> accessControl.authorize(actor, Permissions.PULL, "check out '" + branchName + "'")
			.flatMap(ok -> {
				Branch branch = graph.branch(branchName).orElse(null);
				if (branch == null) {
					return OperationResult.failure(ErrorKind.BRANCH_NOT_FOUND,
							"Branch '" + branchName + "' does not exist");
				}
				String previous = head;
				head = branchName;
				logger.info("Switched from '{}' to '{}'", previous, branchName);
				return OperationResult.success(branch);
			}));
	}

	// Staging

	/**
	 * Stage paths on the checked-out branch. Blank paths are ignored.
	 */
	public OperationResult<List<StagingEntry>> stageAdd(List<String> paths) {
		return write(() -> {
			LocalDateTime now = now();
			Set<String> tracked = graph.trackedPaths(tipOf(head));
			List<StagingEntry> staged = new ArrayList<>();
			for (String path : paths) {
				if (!path.isBlank()) {
					staged.add(staging.add(head, path.trim(), tracked, now));
				}
			}
			if (staged.isEmpty()) {
				return OperationResult.failure(ErrorKind.STAGING_ENTRY_NOT_FOUND, "No file paths given");
			}
			logger.info("Staged {} file(s) on '{}'", staged.size(), head);
			return OperationResult.success(staged);
		});
	}

	public OperationResult<StagingEntry> stageRemove(String path) {
		return write(() -> staging.markDeleted(head, path, graph.trackedPaths(tipOf(head)), now()));
	}

	public List<StagingEntry> stageList() {
		return read(() -> staging.list(head));
	}

	public OperationResult<StagingEntry> stageToggle(String path) {
		return write(() -> staging.toggle(head, path));
	}

	public int stageClear() {
		return write(() -> staging.clear(head));
	}

	public int stageClearSelected() {
		return write(() -> staging.clearIncluded(head));
	}

	public RepositoryStatus status() {
		return read(() -> new RepositoryStatus(name, head, tipOf(head), staging.list(head), graph.branches().size(),
				graph.commitCount(), pullRequests.list().active().size()));
	}

	// Commits

	/**
	 * Commit the included staging entries of the checked-out branch.
	 * @return the new commit, or {@code PermissionDenied} / {@code EmptyCommit}
	 */
	public OperationResult<Commit> commit(String actor, String message) {
		return write(() -> {
			OperationResult<String> authorized = accessControl.authorize(actor, Permissions.PUSH,
					"commit on '" + head + "'");
			if (!authorized.isSuccess()) {
				return authorized.map(ignored -> null);
			}
			if (staging.included(head).isEmpty()) {
				return OperationResult.failure(ErrorKind.EMPTY_COMMIT,
						"Nothing to commit on '" + head + "': no staged file is included");
			}
			List<FileChange> changes = staging.consumeIncluded(head)
				.stream()
				.map(entry -> new FileChange(entry.path(), entry.kind()))
				.toList();
			CommitKind kind = tipOf(head) == null ? CommitKind.ROOT : CommitKind.NORMAL;
			return OperationResult.success(graph.append(head, actor, message, changes, kind, null, now()));
		});
	}

	/**
	 * Log of every branch, most recent first.
	 */
	public CommitLog log() {
		return read(() -> graph.log(graph.branches().stream().map(Branch::tipId).filter(Objects::nonNull).toList()));
	}

	public OperationResult<CommitLog> log(String branchName) {
		return read(() -> {
			Branch branch = graph.branch(branchName).orElse(null);
			if (branch == null) {
				return OperationResult.failure(ErrorKind.BRANCH_NOT_FOUND,
						"Branch '" + branchName + "' does not exist");
			}
			return OperationResult.success(graph.log(branch.tipId() == null ? List.of() : List.of(branch.tipId())));
		});
	}

	public OperationResult<Commit> merge(String actor, String source, String destination) {
		return write(() -> mergeEngine.merge(actor, source, destination, now()));
	}

	// Collaborators and roles

	public List<Collaborator> listContributors() {
		return read(accessControl::list);
	}

	public OperationResult<Collaborator> addContributor(String contributor) {
		return write(() -> accessControl.addContributor(contributor));
	}

	public OperationResult<Collaborator> removeContributor(String contributor) {
		return write(() -> accessControl.revoke(contributor));
	}

	public OperationResult<Collaborator> findContributor(String contributor) {
		return read(() -> accessControl.find(contributor));
	}

	public OperationResult<Collaborator> roleAdd(String identity, String role, List<String> permissions) {
		return write(() -> accessControl.grantRole(identity, role, permissions));
	}

	public OperationResult<Collaborator> roleUpdate(String identity, String role, List<String> permissions) {
		return write(() -> accessControl.updateRole(identity, role, permissions));
	}

	public boolean roleCheck(String identity, String permission) {
		return read(() -> accessControl.check(identity, permission));
	}

	public OperationResult<Collaborator> roleRemove(String identity) {
		return write(() -> accessControl.revoke(identity));
	}

	public OperationResult<Collaborator> roleShow(String identity) {
		return read(() -> accessControl.show(identity));
	}

	public List<Collaborator> roleList() {
		return read(accessControl::list);
	}

	// Pull requests

	public OperationResult<PullRequest> prCreate(String actor, String source, String destination) {
		return write(() -> pullRequests.create(actor, source, destination, now()));
	}

	public OperationResult<PullRequest> prReview(String actor, int id, String comment) {
		return write(() -> pullRequests.review(actor, id, comment, now()));
	}

	public OperationResult<PullRequest> prTag(String actor, int id, String label) {
		return write(() -> pullRequests.tag(actor, id, label));
	}

	public OperationResult<PullRequest> prApprove(String actor, int id) {
		return write(() -> pullRequests.approve(actor, id, now()));
	}

	public OperationResult<PullRequest> prReject(String actor, int id) {
		return prReject(actor, id, "");
	}

	public OperationResult<PullRequest> prReject(String actor, int id, String reason) {
		return write(() -> pullRequests.reject(actor, id, reason, now()));
	}

	public OperationResult<PullRequest> prNext(String actor) {
		return write(() -> pullRequests.next(actor));
	}

	public OperationResult<Integer> prClear(String actor) {
		return write(() -> pullRequests.clear(actor));
	}

	public PullRequestListing prList() {
		return read(pullRequests::list);
	}

	public OperationResult<PullRequest> prStatus(int id) {
		return read(() -> pullRequests.status(id));
	}

	public QueueSummary prStatus() {
		return read(pullRequests::summary);
	}

	private @Nullable String tipOf(String branchName) {
		return graph.branch(branchName).map(Branch::tipId).orElse(null);
	}

	private LocalDateTime now() {
		return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
	}

	private <T> T read(Supplier<T> action) {
		ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
		readLock.lock();
		try {
			return action.get();
		}
		finally {
			readLock.unlock();
		}
	}

	private <T> T write(Supplier<T> action) {
		ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
		writeLock.lock();
		try {
			return action.get();
		}
		finally {
			writeLock.unlock();
		}
	}

}
