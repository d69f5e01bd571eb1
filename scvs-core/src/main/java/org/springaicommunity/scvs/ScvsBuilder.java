package org.springaicommunity.scvs;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Builder for wiring a {@link VersionControlSystem} without a container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults, user taken from SCVS_USER
 * VersionControlSystem scvs = ScvsBuilder.create()
 *     .userFromEnv()
 *     .buildVersionControlSystem();
 *
 * // For tests: fixed clock and a mock store
 * VersionControlSystem testScvs = ScvsBuilder.create()
 *     .clock(Clock.fixed(instant, ZoneOffset.UTC))
 *     .repositoryStore(mock(RepositoryStore.class))
 *     .buildVersionControlSystem();
 * }
 * </pre>
 */
public class ScvsBuilder {

	private ScvsProperties properties;

	@Nullable
	private Clock clock;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private RepositoryStore repositoryStore;

	@Nullable
	private RoleCatalog roleCatalog;

	private ScvsBuilder() {
		this.properties = new ScvsProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ScvsBuilder
	 */
	public static ScvsBuilder create() {
		return new ScvsBuilder();
	}

	/**
	 * Set the properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ScvsBuilder properties(@Nullable ScvsProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set the acting user.
	 * @param user collaborator identity
	 * @return this builder
	 */
	public ScvsBuilder user(String user) {
		this.properties.setUser(user);
		return this;
	}

	/**
	 * Apply {@code SCVS_USER} and {@code SCVS_DATA_DIR} from the environment, when set.
	 * @return this builder
	 */
	public ScvsBuilder userFromEnv() {
		EnvironmentSupport.applyTo(this.properties);
		return this;
	}

	/**
	 * Set the time source for commit and review timestamps.
	 * @param clock the clock (null to use the system clock)
	 * @return this builder
	 */
	public ScvsBuilder clock(@Nullable Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Set a custom ObjectMapper for snapshot files.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ScvsBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom RepositoryStore implementation. Useful for testing with mocks or for
	 * alternative storage backends.
	 * @param repositoryStore custom store (null to use the file system store)
	 * @return this builder
	 */
	public ScvsBuilder repositoryStore(@Nullable RepositoryStore repositoryStore) {
		this.repositoryStore = repositoryStore;
		return this;
	}

	/**
	 * Set a custom role catalog.
	 * @param roleCatalog the catalog (null to use {@link RoleCatalog#defaults()})
	 * @return this builder
	 */
	public ScvsBuilder roleCatalog(@Nullable RoleCatalog roleCatalog) {
		this.roleCatalog = roleCatalog;
		return this;
	}

	/**
	 * Build a VersionControlSystem.
	 * @return configured VersionControlSystem
	 */
	public VersionControlSystem buildVersionControlSystem() {
		return new VersionControlSystem(properties, roleCatalog != null ? roleCatalog : RoleCatalog.defaults(),
				buildRepositoryStore(), clock != null ? clock : Clock.systemDefaultZone());
	}

	/**
	 * Build the RepositoryStore directly.
	 * @return configured RepositoryStore
	 */
	public RepositoryStore buildRepositoryStore() {
		if (repositoryStore != null) {
			return repositoryStore;
		}
		ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();
		return new FileSystemRepositoryStore(mapper, Paths.get(properties.getDataDirectory()));
	}

	public ScvsProperties getProperties() {
		return properties;
	}

}
