package org.springaicommunity.scvs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StagingArea Tests")
class StagingAreaTest {

	private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 10, 0);

	private StagingArea staging;

	@BeforeEach
	void setUp() {
		staging = new StagingArea();
	}

	@Test
	@DisplayName("Should stage new paths as added and excluded")
	void shouldStageNewPathAsAdded() {
		StagingEntry entry = staging.add("main", "app.js", Set.of(), NOW);

		assertThat(entry.kind()).isEqualTo(ChangeKind.ADDED);
		assertThat(entry.included()).isFalse();
	}

	@Test
	@DisplayName("Should stage committed paths as modified")
	void shouldStageTrackedPathAsModified() {
		StagingEntry entry = staging.add("main", "app.js", Set.of("app.js"), NOW);

		assertThat(entry.kind()).isEqualTo(ChangeKind.MODIFIED);
	}

	@Test
	@DisplayName("Should consume only included entries in insertion order")
	void shouldConsumeIncludedInInsertionOrder() {
		// Given
		staging.add("main", "a.txt", Set.of(), NOW);
		staging.add("main", "b.txt", Set.of(), NOW);
		staging.add("main", "c.txt", Set.of(), NOW);
		staging.toggle("main", "c.txt");
		staging.toggle("main", "a.txt");

		// When
		List<StagingEntry> consumed = staging.consumeIncluded("main");

		// Then
		assertThat(consumed).extracting(StagingEntry::path).containsExactly("a.txt", "c.txt");
		assertThat(staging.list("main")).extracting(StagingEntry::path).containsExactly("b.txt");
	}

	@Test
	@DisplayName("Should keep position and selection but refresh kind and time when a path is added again")
	void shouldKeepPositionOnReAdd() {
		staging.add("main", "a.txt", Set.of(), NOW);
		staging.add("main", "b.txt", Set.of(), NOW);
		staging.toggle("main", "a.txt");

		staging.add("main", "a.txt", Set.of("a.txt"), NOW.plusMinutes(1));

		List<StagingEntry> entries = staging.list("main");
		assertThat(entries).extracting(StagingEntry::path).containsExactly("a.txt", "b.txt");
		assertThat(entries.get(0).included()).isTrue();
		assertThat(entries.get(0).kind()).isEqualTo(ChangeKind.MODIFIED);
		assertThat(entries.get(0).stagedAt()).isEqualTo(NOW.plusMinutes(1));
		assertThat(entries.get(1).stagedAt()).isEqualTo(NOW);
	}

	@Test
	@DisplayName("Should report toggling an unknown path")
	void shouldReportUnknownToggle() {
		OperationResult<StagingEntry> result = staging.toggle("main", "missing.txt");

		assertThat(result.errorKind()).contains(ErrorKind.STAGING_ENTRY_NOT_FOUND);
	}

	@Test
	@DisplayName("Should flip inclusion on every toggle")
	void shouldFlipInclusion() {
		staging.add("main", "a.txt", Set.of(), NOW);

		assertThat(staging.toggle("main", "a.txt").orElseThrow().included()).isTrue();
		assertThat(staging.toggle("main", "a.txt").orElseThrow().included()).isFalse();
		assertThat(staging.consumeIncluded("main")).isEmpty();
	}

	@Test
	@DisplayName("Should stage deletions of tracked paths only")
	void shouldStageDeletionOfTrackedPath() {
		assertThat(staging.markDeleted("main", "ghost.txt", Set.of(), NOW).errorKind())
			.contains(ErrorKind.STAGING_ENTRY_NOT_FOUND);

		StagingEntry deleted = staging.markDeleted("main", "old.txt", Set.of("old.txt"), NOW).orElseThrow();

		assertThat(deleted.kind()).isEqualTo(ChangeKind.DELETED);
	}

	@Test
	@DisplayName("Should keep branches separate")
	void shouldKeepBranchesSeparate() {
		staging.add("main", "a.txt", Set.of(), NOW);
		staging.add("feature", "b.txt", Set.of(), NOW);

		assertThat(staging.list("main")).extracting(StagingEntry::path).containsExactly("a.txt");
		assertThat(staging.list("feature")).extracting(StagingEntry::path).containsExactly("b.txt");
		assertThat(staging.toggle("feature", "a.txt").isSuccess()).isFalse();
	}

	@Test
	@DisplayName("Should clear all or only selected entries")
	void shouldClear() {
		staging.add("main", "a.txt", Set.of(), NOW);
		staging.add("main", "b.txt", Set.of(), NOW);
		staging.toggle("main", "b.txt");

		assertThat(staging.clearIncluded("main")).isEqualTo(1);
		assertThat(staging.list("main")).extracting(StagingEntry::path).containsExactly("a.txt");
		assertThat(staging.clear("main")).isEqualTo(1);
		assertThat(staging.list("main")).isEmpty();
		assertThat(staging.clear("main")).isZero();
	}

}
