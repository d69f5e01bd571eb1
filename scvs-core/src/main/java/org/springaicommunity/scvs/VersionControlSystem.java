package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Entry point to SCVS: tracks the loaded repositories, the active one and the acting
 * user, and exposes one operation per user-facing command.
 *
 * <p>
 * Every operation runs against the active repository as the configured user. Without an
 * active repository they fail with {@link ErrorKind#NO_ACTIVE_REPOSITORY}. When autosave
 * is enabled, each successful change is written through the {@link RepositoryStore};
 * storage failures surface as {@link RepositoryStoreException}.
 */
public class VersionControlSystem {

	private static final Logger logger = LoggerFactory.getLogger(VersionControlSystem.class);

	private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9._-]+");

	private final ScvsProperties properties;

	private final RoleCatalog catalog;

	private final RepositoryStore store;

	private final Clock clock;

	private final Map<String, Repository> repositories = new LinkedHashMap<>();

	@Nullable
	private Repository current;

	public VersionControlSystem(ScvsProperties properties, RoleCatalog catalog, RepositoryStore store, Clock clock) {
		this.properties = properties;
		this.catalog = catalog;
		this.store = store;
		this.clock = clock;
	}

	/**
	 * Make a repository active, loading it from the store or creating it when it does
	 * not exist. A new repository grants the acting user the owner role.
	 * @param name repository name (letters, digits, {@code . _ -})
	 * @return the active repository and its origin, or {@code InvalidName}
	 */
	public OperationResult<RepositoryOpened> init(String name) {
		if (!isValidName(name)) {
			return invalidName(name);
		}

		Repository loaded = repositories.get(name);
		if (loaded != null) {
			current = loaded;
			logger.info("Repository '{}' is already open", name);
			return OperationResult.success(new RepositoryOpened(loaded, RepositoryOpened.Origin.ALREADY_OPEN));
		}

		Optional<RepositorySnapshot> snapshot = store.load(name);
		if (snapshot.isPresent()) {
			Repository repository = Repository.fromSnapshot(snapshot.get(), properties, catalog, clock);
			activate(repository);
			return OperationResult.success(new RepositoryOpened(repository, RepositoryOpened.Origin.LOADED));
		}

		Repository repository = Repository.initialize(name, properties.getUser(), properties, catalog, clock);
		activate(repository);
		persist(repository);
		return OperationResult.success(new RepositoryOpened(repository, RepositoryOpened.Origin.CREATED));
	}

	/**
	 * Switch to a repository that is loaded or saved, without creating one.
	 * @param name repository name
	 * @return the active repository, or {@code NoActiveRepository} if it is unknown
	 */
	public OperationResult<Repository> switchRepository(String name) {
		if (!isValidName(name)) {
			return invalidName(name);
		}
		if (!repositories.containsKey(name) && !store.exists(name)) {
			return OperationResult.failure(ErrorKind.NO_ACTIVE_REPOSITORY,
					"Repository '" + name + "' not found. Use 'init " + name + "' to create it");
		}
		return init(name).map(RepositoryOpened::repository);
	}

	private static boolean isValidName(String name) {
		// keeps snapshot files inside the data directory
		return VALID_NAME.matcher(name).matches() && !name.startsWith(".");
	}

	private static <T> OperationResult<T> invalidName(String name) {
		return OperationResult.failure(ErrorKind.INVALID_NAME, "Invalid repository name: '" + name + "'");
	}

	private void activate(Repository repository) {
		repositories.put(repository.name(), repository);
		current = repository;
	}

	public Optional<Repository> current() {
		return Optional.ofNullable(current);
	}

	/**
	 * Names of the saved repositories and of those opened in this process but not yet
	 * saved.
	 * @return sorted repository names
	 */
	public List<String> repositories() {
		Set<String> names = new TreeSet<>(store.names());
		names.addAll(repositories.keySet());
		return List.copyOf(names);
	}

	public String user() {
		return properties.getUser();
	}

	public ScvsProperties properties() {
		return properties;
	}

	/**
	 * Write the active repository to the store regardless of the autosave setting.
	 * @return the saved repository's name, or {@code NoActiveRepository}
	 */
	public OperationResult<String> save() {
		Repository repository = current;
		if (repository == null) {
			return noActiveRepository();
		}
		store.save(repository.snapshot());
		return OperationResult.success(repository.name());
	}

	// Branches

	public OperationResult<Branch> createBranch(String name) {
		return mutate(repository -> repository.createBranch(user(), name));
	}

	public OperationResult<Branch> createBranch(String name, String from) {
		return mutate(repository -> repository.createBranch(user(), name, from));
	}

	public OperationResult<Branch> deleteBranch(String name) {
		return mutate(repository -> repository.deleteBranch(user(), name));
	}

	public OperationResult<BranchListing> listBranches() {
		return query(Repository::listBranches);
	}

	public OperationResult<Branch> checkout(String name) {
		return mutate(repository -> repository.checkout(user(), name));
	}

	// Staging

	public OperationResult<List<StagingEntry>> stageAdd(String... paths) {
		return mutate(repository -> repository.stageAdd(List.of(paths)));
	}

	public OperationResult<StagingEntry> stageRemove(String path) {
		return mutate(repository -> repository.stageRemove(path));
	}

	public OperationResult<List<StagingEntry>> stageList() {
		return query(Repository::stageList);
	}

	public OperationResult<StagingEntry> stageToggle(String path) {
		return mutate(repository -> repository.stageToggle(path));
	}

	public OperationResult<Integer> stageClear() {
		return mutate(repository -> OperationResult.success(repository.stageClear()));
	}

	public OperationResult<Integer> stageClearSelected() {
		return mutate(repository -> OperationResult.success(repository.stageClearSelected()));
	}

	public OperationResult<RepositoryStatus> status() {
		return query(Repository::status);
	}

	// Commits

	public OperationResult<Commit> commit(String message) {
		return mutate(repository -> repository.commit(user(), message));
	}

	public OperationResult<CommitLog> log() {
		return query(Repository::log);
	}

	public OperationResult<CommitLog> log(String branch) {
		return withRepository(repository -> repository.log(branch));
	}

	public OperationResult<Commit> merge(String source, String destination) {
		return mutate(repository -> repository.merge(user(), source, destination));
	}

	// Collaborators

	public OperationResult<List<Collaborator>> listContributors() {
		return query(Repository::listContributors);
	}

	public OperationResult<Collaborator> addContributor(String name) {
		return mutate(repository -> repository.addContributor(name));
	}

	public OperationResult<Collaborator> removeContributor(String name) {
		return mutate(repository -> repository.removeContributor(name));
	}

	public OperationResult<Collaborator> findContributor(String name) {
		return withRepository(repository -> repository.findContributor(name));
	}

	// Roles

	public OperationResult<Collaborator> roleAdd(String email, String role, String... permissions) {
		return mutate(repository -> repository.roleAdd(email, role, List.of(permissions)));
	}

	public OperationResult<Collaborator> roleUpdate(String email, String role, String... permissions) {
		return mutate(repository -> repository.roleUpdate(email, role, List.of(permissions)));
	}

	public OperationResult<Boolean> roleCheck(String email, String permission) {
		return query(repository -> repository.roleCheck(email, permission));
	}

	public OperationResult<Collaborator> roleRemove(String email) {
		return mutate(repository -> repository.roleRemove(email));
	}

	public OperationResult<Collaborator> roleShow(String email) {
		return withRepository(repository -> repository.roleShow(email));
	}

	public OperationResult<List<Collaborator>> roleList() {
		return query(Repository::roleList);
	}

	// Pull requests

	public OperationResult<PullRequest> prCreate(String source, String destination) {
		return mutate(repository -> repository.prCreate(user(), source, destination));
	}

	public OperationResult<PullRequest> prReview(int id, String comment) {
		return mutate(repository -> repository.prReview(user(), id, comment));
	}

	public OperationResult<QueueSummary> prStatus() {
		return query(Repository::prStatus);
	}

	public OperationResult<PullRequest> prStatus(int id) {
		return withRepository(repository -> repository.prStatus(id));
	}

	public OperationResult<PullRequest> prTag(int id, String label) {
		return mutate(repository -> repository.prTag(user(), id, label));
	}

	public OperationResult<PullRequest> prApprove(int id) {
		return mutate(repository -> repository.prApprove(user(), id));
	}

	public OperationResult<PullRequest> prReject(int id) {
		return mutate(repository -> repository.prReject(user(), id));
	}

	public OperationResult<PullRequest> prReject(int id, String reason) {
		return mutate(repository -> repository.prReject(user(), id, reason));
	}

	public OperationResult<PullRequestListing> prList() {
		return query(Repository::prList);
	}

	public OperationResult<PullRequest> prNext() {
		return mutate(repository -> repository.prNext(user()));
	}

	public OperationResult<Integer> prClear() {
		return mutate(repository -> repository.prClear(user()));
	}

	private <T> OperationResult<T> mutate(Function<Repository, OperationResult<T>> operation) {
		Repository repository = current;
		if (repository == null) {
			return noActiveRepository();
		}
		OperationResult<T> result = operation.apply(repository);
		if (result.isSuccess()) {
			persist(repository);
		}
		return result;
	}

	private <T> OperationResult<T> withRepository(Function<Repository, OperationResult<T>> operation) {
		Repository repository = current;
		if (repository == null) {
			return noActiveRepository();
		}
		return operation.apply(repository);
	}

	private <T> OperationResult<T> query(Function<Repository, T> operation) {
		return withRepository(repository -> OperationResult.success(operation.apply(repository)));
	}

	private void persist(Repository repository) {
		if (properties.isAutosave()) {
			store.save(repository.snapshot());
		}
	}

	private static <T> OperationResult<T> noActiveRepository() {
		return OperationResult.failure(ErrorKind.NO_ACTIVE_REPOSITORY,
				"No active repository. Use 'init <name>' first");
	}

}
