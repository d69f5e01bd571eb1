package org.springaicommunity.scvs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AccessControl Tests")
class AccessControlTest {

	private AccessControl accessControl;

	@BeforeEach
	void setUp() {
		accessControl = new AccessControl(RoleCatalog.defaults(), true);
	}

	@Nested
	@DisplayName("Granting Roles")
	class GrantRoleTest {

		@Test
		@DisplayName("Should return false for a collaborator that was never granted a role")
		void shouldReturnFalseForUnknownCollaborator() {
			assertThat(accessControl.check("ghost@example.com", Permissions.PUSH)).isFalse();
		}

		@Test
		@DisplayName("Should authorize immediately after a grant")
		void shouldAuthorizeAfterGrant() {
			OperationResult<Collaborator> result = accessControl.grantRole("ana@example.com", "developer",
					List.of(Permissions.PUSH));

			assertThat(result.isSuccess()).isTrue();
			assertThat(accessControl.check("ana@example.com", Permissions.PUSH)).isTrue();
			assertThat(accessControl.check("ana@example.com", Permissions.MERGE)).isFalse();
		}

		@Test
		@DisplayName("Should grant the full role set when no permissions are given")
		void shouldGrantFullRoleSetByDefault() {
			Collaborator admin = accessControl.grantRole("root@example.com", "admin", List.of()).orElseThrow();

			assertThat(admin.permissions()).containsExactly("merge", "pull", "push");
		}

		@Test
		@DisplayName("Should accept comma separated permissions and normalize role case")
		void shouldAcceptCommaSeparatedPermissions() {
			Collaborator collaborator = accessControl.grantRole("ana@example.com", "Maintainer", List.of("push,merge"))
				.orElseThrow();

			assertThat(collaborator.role()).isEqualTo("maintainer");
			assertThat(collaborator.permissions()).containsExactly("merge", "push");
		}

		@Test
		@DisplayName("Should reject an unknown role")
		void shouldRejectUnknownRole() {
			OperationResult<Collaborator> result = accessControl.grantRole("ana@example.com", "superuser", List.of());

			assertThat(result.errorKind()).contains(ErrorKind.INVALID_ROLE);
			assertThat(accessControl.list()).isEmpty();
		}

		@ParameterizedTest
		@CsvSource({ "guest, push", "developer, merge", "maintainer, pull", "contributor, pull" })
		@DisplayName("Should reject permissions the role does not allow")
		void shouldRejectDisallowedPermissions(String role, String permission) {
			OperationResult<Collaborator> result = accessControl.grantRole("ana@example.com", role,
					List.of(permission));

			assertThat(result.errorKind()).contains(ErrorKind.INVALID_PERMISSION);
			assertThat(accessControl.check("ana@example.com", permission)).isFalse();
		}

		@Test
		@DisplayName("Should replace the previous role record")
		void shouldReplacePreviousRole() {
			accessControl.grantRole("ana@example.com", "admin", List.of());
			accessControl.grantRole("ana@example.com", "guest", List.of());

			assertThat(accessControl.show("ana@example.com").orElseThrow().role()).isEqualTo("guest");
			assertThat(accessControl.check("ana@example.com", Permissions.PUSH)).isFalse();
			assertThat(accessControl.list()).hasSize(1);
		}

	}

	@Nested
	@DisplayName("Updating Roles")
	class UpdateRoleTest {

		@Test
		@DisplayName("Should fail for an unknown collaborator")
		void shouldFailForUnknownCollaborator() {
			OperationResult<Collaborator> result = accessControl.updateRole("ghost@example.com", "admin", List.of());

			assertThat(result.errorKind()).contains(ErrorKind.COLLABORATOR_NOT_FOUND);
		}

		@Test
		@DisplayName("Should add permissions without removing existing ones")
		void shouldAddPermissions() {
			accessControl.grantRole("ana@example.com", "developer", List.of(Permissions.PUSH));

			Collaborator updated = accessControl.updateRole("ana@example.com", "maintainer", List.of(Permissions.MERGE))
				.orElseThrow();

			assertThat(updated.role()).isEqualTo("maintainer");
			assertThat(updated.permissions()).containsExactly("merge", "push");
			assertThat(accessControl.check("ana@example.com", Permissions.MERGE)).isTrue();
		}

		@Test
		@DisplayName("Should resolve checks through the current role after a downgrade")
		void shouldResolveThroughCurrentRole() {
			accessControl.grantRole("ana@example.com", "admin", List.of());

			accessControl.updateRole("ana@example.com", "guest", List.of());

			assertThat(accessControl.show("ana@example.com").orElseThrow().permissions()).contains(Permissions.PUSH);
			assertThat(accessControl.check("ana@example.com", Permissions.PUSH)).isFalse();
			assertThat(accessControl.check("ana@example.com", Permissions.PULL)).isTrue();
		}

		@Test
		@DisplayName("Should validate added permissions against the new role")
		void shouldValidateAgainstNewRole() {
			accessControl.grantRole("ana@example.com", "admin", List.of());

			OperationResult<Collaborator> result = accessControl.updateRole("ana@example.com", "guest",
					List.of(Permissions.MERGE));

			assertThat(result.errorKind()).contains(ErrorKind.INVALID_PERMISSION);
			assertThat(accessControl.show("ana@example.com").orElseThrow().role()).isEqualTo("admin");
		}

	}

	@Nested
	@DisplayName("Lookup and Removal")
	class LookupTest {

		@Test
		@DisplayName("Should list collaborators alphabetically")
		void shouldListAlphabetically() {
			accessControl.grantRole("zoe@example.com", "guest", List.of());
			accessControl.addContributor("ana");
			accessControl.grantRole("mia@example.com", "developer", List.of());

			assertThat(accessControl.list()).extracting(Collaborator::identity)
				.containsExactly("ana", "mia@example.com", "zoe@example.com");
		}

		@Test
		@DisplayName("Should report a missing name as an informational outcome")
		void shouldFindCaseSensitively() {
			accessControl.addContributor("Ana");

			OperationResult<Collaborator> missing = accessControl.find("ana");

			assertThat(accessControl.find("Ana").isSuccess()).isTrue();
			assertThat(missing.errorKind()).contains(ErrorKind.NOT_FOUND);
			assertThat(ErrorKind.NOT_FOUND.isInformational()).isTrue();
		}

		@Test
		@DisplayName("Should keep the existing record when a contributor is added twice")
		void shouldKeepExistingContributor() {
			accessControl.grantRole("ana", "developer", List.of());

			Collaborator again = accessControl.addContributor("ana").orElseThrow();

			assertThat(again.role()).isEqualTo("developer");
		}

		@Test
		@DisplayName("Should revoke every permission on removal")
		void shouldRevoke() {
			accessControl.grantRole("ana@example.com", "admin", List.of());

			assertThat(accessControl.revoke("ana@example.com").isSuccess()).isTrue();
			assertThat(accessControl.check("ana@example.com", Permissions.PULL)).isFalse();
			assertThat(accessControl.revoke("ana@example.com").errorKind())
				.contains(ErrorKind.COLLABORATOR_NOT_FOUND);
		}

	}

	@Nested
	@DisplayName("Authorization")
	class AuthorizeTest {

		@Test
		@DisplayName("Should deny an actor without the permission")
		void shouldDeny() {
			accessControl.grantRole("guest@example.com", "guest", List.of());

			OperationResult<String> result = accessControl.authorize("guest@example.com", Permissions.MERGE,
					"merge into 'main'");

			assertThat(result.errorKind()).contains(ErrorKind.PERMISSION_DENIED);
		}

		@Test
		@DisplayName("Should let everyone through when enforcement is disabled")
		void shouldAllowWhenNotEnforced() {
			AccessControl open = new AccessControl(RoleCatalog.defaults(), false);

			assertThat(open.authorize("anyone", Permissions.MERGE, "merge").isSuccess()).isTrue();
			assertThat(open.check("anyone", Permissions.MERGE)).isFalse();
		}

	}

}
