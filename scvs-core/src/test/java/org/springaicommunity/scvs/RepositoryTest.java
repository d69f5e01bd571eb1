package org.springaicommunity.scvs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Repository Tests")
class RepositoryTest {

	private static final String OWNER = "owner@example.com";

	private MutableClock clock;

	private Repository repository;

	@BeforeEach
	void setUp() {
		clock = MutableClock.at("2024-05-01T09:00:00Z");
		repository = Repository.initialize("proyect", OWNER, new ScvsProperties(), RoleCatalog.defaults(), clock);
	}

	private Commit commitFiles(String message, String... paths) {
		repository.stageAdd(List.of(paths));
		for (String path : paths) {
			repository.stageToggle(path);
		}
		clock.advance(Duration.ofSeconds(1));
		return repository.commit(OWNER, message).orElseThrow();
	}

	@Nested
	@DisplayName("Initialization")
	class InitializationTest {

		@Test
		@DisplayName("Should start on an empty default branch owned by the creator")
		void shouldInitialize() {
			assertThat(repository.head()).isEqualTo("main");
			assertThat(repository.listBranches().branches()).extracting(Branch::name).containsExactly("main");
			assertThat(repository.status().tipId()).isNull();
			assertThat(repository.roleShow(OWNER).orElseThrow().role()).isEqualTo("admin");
		}

		@Test
		@DisplayName("Should refuse an owner role missing from the catalog")
		void shouldRefuseUnknownOwnerRole() {
			ScvsProperties properties = new ScvsProperties();
			properties.setOwnerRole("emperor");

			assertThatThrownBy(() -> Repository.initialize("x", OWNER, properties, RoleCatalog.defaults(), clock))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("emperor");
		}

	}

	@Nested
	@DisplayName("Branch and Commit Workflow")
	class WorkflowTest {

		@Test
		@DisplayName("Should commit a toggled file on a new branch")
		void shouldCommitOnNewBranch() {
			// Given
			repository.createBranch(OWNER, "nuevaRama");
			repository.checkout(OWNER, "nuevaRama");
			repository.stageAdd(List.of("test.js"));
			repository.stageToggle("test.js");

			// When
			OperationResult<Commit> result = repository.commit(OWNER, "test prueba");

			// Then
			Commit commit = result.orElseThrow();
			assertThat(commit.id()).hasSize(CommitHasher.ID_LENGTH).matches("[0-9a-f]+");
			assertThat(commit.kind()).isEqualTo(CommitKind.ROOT);
			assertThat(repository.status().tipId()).isEqualTo(commit.id());
			assertThat(repository.stageList()).extracting(StagingEntry::path).doesNotContain("test.js");
		}

		@Test
		@DisplayName("Should keep unselected entries staged after a commit")
		void shouldKeepUnselectedEntries() {
			repository.stageAdd(List.of("a.txt", "b.txt"));
			repository.stageToggle("b.txt");

			Commit commit = repository.commit(OWNER, "only b").orElseThrow();

			assertThat(commit.files()).containsExactly("b.txt");
			assertThat(repository.stageList()).extracting(StagingEntry::path).containsExactly("a.txt");
		}

		@Test
		@DisplayName("Should refuse a commit with nothing included")
		void shouldRefuseEmptyCommit() {
			repository.stageAdd(List.of("a.txt"));

			assertThat(repository.commit(OWNER, "nothing").errorKind()).contains(ErrorKind.EMPTY_COMMIT);
			assertThat(repository.status().commitCount()).isZero();
		}

		@Test
		@DisplayName("Should stage a modification for a committed path")
		void shouldInferModification() {
			commitFiles("first", "a.txt");

			StagingEntry entry = repository.stageAdd(List.of("a.txt")).orElseThrow().get(0);

			assertThat(entry.kind()).isEqualTo(ChangeKind.MODIFIED);
			assertThat(repository.stageRemove("a.txt").orElseThrow().kind()).isEqualTo(ChangeKind.DELETED);
		}

		@Test
		@DisplayName("Should report blank path lists")
		void shouldReportBlankPaths() {
			assertThat(repository.stageAdd(List.of(" ", "")).errorKind()).contains(ErrorKind.STAGING_ENTRY_NOT_FOUND);
		}

		@Test
		@DisplayName("Should guard the default and checked-out branches from deletion")
		void shouldGuardDeletion() {
			repository.createBranch(OWNER, "feature");
			repository.checkout(OWNER, "feature");

			assertThat(repository.deleteBranch(OWNER, "main").errorKind()).contains(ErrorKind.PROTECTED_BRANCH);
			assertThat(repository.deleteBranch(OWNER, "feature").errorKind()).contains(ErrorKind.ACTIVE_BRANCH);
		}

		@Test
		@DisplayName("Should drop the staging area of a deleted branch")
		void shouldDiscardStagingOfDeletedBranch() {
			repository.createBranch(OWNER, "feature");
			repository.checkout(OWNER, "feature");
			repository.stageAdd(List.of("x.txt"));
			repository.checkout(OWNER, "main");

			repository.deleteBranch(OWNER, "feature");
			repository.createBranch(OWNER, "feature");
			repository.checkout(OWNER, "feature");

			assertThat(repository.stageList()).isEmpty();
		}

		@Test
		@DisplayName("Should fail the log of an unknown branch")
		void shouldFailLogOfUnknownBranch() {
			assertThat(repository.log("ghost").errorKind()).contains(ErrorKind.BRANCH_NOT_FOUND);
			assertThat(repository.log("main").orElseThrow().take(0)).isEmpty();
		}

		@Test
		@DisplayName("Should list every branch in the global log")
		void shouldLogAllBranches() {
			Commit first = commitFiles("first", "a.txt");
			repository.createBranch(OWNER, "feature");
			repository.checkout(OWNER, "feature");
			Commit second = commitFiles("second", "b.txt");

			assertThat(repository.log().take(0)).containsExactly(second, first);
			assertThat(repository.log().take(1)).containsExactly(second);
		}

	}

	@Nested
	@DisplayName("Permissions")
	class PermissionTest {

		@Test
		@DisplayName("Should refuse protected actions without mutating state")
		void shouldDenyWithoutMutation() {
			repository.roleAdd("guest@example.com", "guest", List.of());
			repository.stageAdd(List.of("a.txt"));
			repository.stageToggle("a.txt");

			assertThat(repository.commit("guest@example.com", "sneaky").errorKind())
				.contains(ErrorKind.PERMISSION_DENIED);
			assertThat(repository.createBranch("guest@example.com", "x").errorKind())
				.contains(ErrorKind.PERMISSION_DENIED);
			assertThat(repository.status().commitCount()).isZero();
			assertThat(repository.stageList()).hasSize(1);
			assertThat(repository.listBranches().branches()).hasSize(1);
		}

		@Test
		@DisplayName("Should let every actor through when enforcement is off")
		void shouldSkipEnforcement() {
			ScvsProperties properties = new ScvsProperties();
			properties.setEnforcePermissions(false);
			Repository open = Repository.initialize("open", OWNER, properties, RoleCatalog.defaults(), clock);

			assertThat(open.createBranch("stranger", "feature").isSuccess()).isTrue();
		}

		@Test
		@DisplayName("Should register contributors without permissions")
		void shouldRegisterContributors() {
			repository.addContributor("Luis");

			assertThat(repository.findContributor("Luis").orElseThrow().role()).isEqualTo(RoleCatalog.CONTRIBUTOR);
			assertThat(repository.findContributor("luis").errorKind()).contains(ErrorKind.NOT_FOUND);
			assertThat(repository.roleCheck("Luis", Permissions.PULL)).isFalse();
			assertThat(repository.listContributors()).extracting(Collaborator::identity).containsExactly("Luis", OWNER);
		}

	}

	@Nested
	@DisplayName("Pull Requests")
	class PullRequestTest {

		@Test
		@DisplayName("Should fail to open a request from a missing branch")
		void shouldFailMissingBranch() {
			OperationResult<PullRequest> result = repository.prCreate(OWNER, "no-existo", "main");

			assertThat(result.errorKind()).contains(ErrorKind.BRANCH_NOT_FOUND);
			assertThat(result.toString()).contains("no-existo");
		}

		@Test
		@DisplayName("Should archive an approved request as merged")
		void shouldArchiveApproved() {
			commitFiles("init", "readme.md");
			repository.createBranch(OWNER, "feature");
			repository.checkout(OWNER, "feature");
			commitFiles("feature", "app.js");
			repository.prCreate(OWNER, "feature", "main");

			repository.prApprove(OWNER, 1);

			PullRequestListing listing = repository.prList();
			assertThat(listing.active()).extracting(PullRequest::id).doesNotContain(1);
			assertThat(listing.closed()).singleElement()
				.extracting(PullRequest::state)
				.isEqualTo(PullRequestState.MERGED);
			assertThat(repository.log("main").orElseThrow().take(1).get(0).kind()).isEqualTo(CommitKind.MERGE);
		}

	}

	@Nested
	@DisplayName("Snapshots")
	class SnapshotTest {

		@Test
		@DisplayName("Should rebuild an equivalent repository from a snapshot")
		void shouldRoundTrip() {
			commitFiles("init", "readme.md");
			repository.createBranch(OWNER, "feature");
			repository.checkout(OWNER, "feature");
			repository.stageAdd(List.of("pending.txt"));
			repository.prCreate(OWNER, "feature", "main");
			repository.addContributor("Luis");

			RepositorySnapshot snapshot = repository.snapshot();
			Repository restored = Repository.fromSnapshot(snapshot, new ScvsProperties(), RoleCatalog.defaults(),
					clock);

			assertThat(restored.snapshot()).isEqualTo(snapshot);
			assertThat(restored.head()).isEqualTo("feature");
			assertThat(restored.prCreate(OWNER, "feature", "main").orElseThrow().id()).isEqualTo(2);
			assertThat(restored.log("main").orElseThrow().take(1)).extracting(Commit::message).containsExactly("init");
		}

	}

	@Test
	@DisplayName("Should keep commits consistent under concurrent staging and committing")
	void shouldStayConsistentUnderConcurrency() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(8);
		int workers = 40;
		try {
			List<Future<OperationResult<Commit>>> futures = new ArrayList<>();
			for (int i = 0; i < workers; i++) {
				String path = "file-" + i + ".txt";
				String message = "change " + i;
				futures.add(executor.submit(() -> {
					repository.stageAdd(List.of(path));
					repository.stageToggle(path);
					return repository.commit(OWNER, message);
				}));
			}

			List<String> committed = new ArrayList<>();
			for (Future<OperationResult<Commit>> future : futures) {
				OperationResult<Commit> result = future.get(30, TimeUnit.SECONDS);
				if (result.isSuccess()) {
					committed.addAll(result.orElseThrow().files());
				}
				else {
					assertThat(result.errorKind()).contains(ErrorKind.EMPTY_COMMIT);
				}
			}

			assertThat(committed).hasSize(workers).doesNotHaveDuplicates();
			assertThat(repository.stageList()).isEmpty();
			assertThat(repository.log("main").orElseThrow().take(0)).hasSize(repository.status().commitCount());
		}
		finally {
			executor.shutdownNow();
		}
	}

}
