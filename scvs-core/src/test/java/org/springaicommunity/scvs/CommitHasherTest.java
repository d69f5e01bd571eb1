package org.springaicommunity.scvs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CommitHasher Tests")
class CommitHasherTest {

	private static final LocalDateTime TIME = LocalDateTime.of(2024, 5, 1, 10, 30, 15, 123_000_000);

	@Test
	@DisplayName("Should produce a ten character hex identifier")
	void shouldProduceTenHexCharacters() {
		String id = CommitHasher.hash(null, "ana@example.com", TIME, "test prueba", List.of("test.js"));

		assertThat(id).hasSize(CommitHasher.ID_LENGTH).matches("[0-9a-f]{10}");
	}

	@Test
	@DisplayName("Should be a pure function of its inputs")
	void shouldBeDeterministic() {
		String first = CommitHasher.hash("abc123def0", "ana", TIME, "msg", List.of("a", "b"));
		String second = CommitHasher.hash("abc123def0", "ana", TIME, "msg", List.of("a", "b"));

		assertThat(first).isEqualTo(second);
	}

	@Test
	@DisplayName("Should change when any field changes")
	void shouldChangeWithInputs() {
		String base = CommitHasher.hash("abc123def0", "ana", TIME, "msg", List.of("a", "b"));

		assertThat(CommitHasher.hash(null, "ana", TIME, "msg", List.of("a", "b"))).isNotEqualTo(base);
		assertThat(CommitHasher.hash("abc123def0", "bob", TIME, "msg", List.of("a", "b"))).isNotEqualTo(base);
		assertThat(CommitHasher.hash("abc123def0", "ana", TIME.plusSeconds(1), "msg", List.of("a", "b")))
			.isNotEqualTo(base);
		assertThat(CommitHasher.hash("abc123def0", "ana", TIME, "other", List.of("a", "b"))).isNotEqualTo(base);
		assertThat(CommitHasher.hash("abc123def0", "ana", TIME, "msg", List.of("b", "a"))).isNotEqualTo(base);
	}

	@Test
	@DisplayName("Should not confuse shifted field boundaries")
	void shouldSeparateFields() {
		String left = CommitHasher.hash(null, "ab", TIME, "c", List.of());
		String right = CommitHasher.hash(null, "a", TIME, "bc", List.of());

		assertThat(left).isNotEqualTo(right);
	}

}
