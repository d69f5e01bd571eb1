package org.springaicommunity.scvs;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File system implementation of {@link RepositoryStore}.
 *
 * <p>
 * Each repository is one pretty-printed JSON file, {@code <data-dir>/<name>.json}. Files
 * are written to a temporary sibling first and then moved into place.
 */
public class FileSystemRepositoryStore implements RepositoryStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemRepositoryStore.class);

	private static final String EXTENSION = ".json";

	private final ObjectMapper objectMapper;

	private final Path dataDirectory;

	public FileSystemRepositoryStore(ObjectMapper objectMapper, Path dataDirectory) {
		this.objectMapper = objectMapper;
		this.dataDirectory = dataDirectory;
	}

	@Override
	public void save(RepositorySnapshot snapshot) {
		Path target = pathOf(snapshot.name());
		try {
			Files.createDirectories(dataDirectory);
			Path temporary = target.resolveSibling(target.getFileName() + ".tmp");
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temporary.toFile(), snapshot);
			Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
			logger.debug("Saved repository '{}' to {}", snapshot.name(), target);
		}
		catch (IOException e) {
			throw new RepositoryStoreException("Failed to save repository '" + snapshot.name() + "'", target, e);
		}
	}

	@Override
	public Optional<RepositorySnapshot> load(String name) {
		Path source = pathOf(name);
		if (!Files.exists(source)) {
			return Optional.empty();
		}
		try {
			RepositorySnapshot snapshot = objectMapper.readValue(source.toFile(), RepositorySnapshot.class);
			logger.info("Loaded repository '{}' from {}", name, source);
			return Optional.of(snapshot);
		}
		catch (IOException e) {
			throw new RepositoryStoreException("Failed to load repository '" + name + "'", source, e);
		}
	}

	@Override
	public boolean exists(String name) {
		return Files.exists(pathOf(name));
	}

	@Override
	public List<String> names() {
		if (!Files.isDirectory(dataDirectory)) {
			return List.of();
		}
		try (Stream<Path> files = Files.list(dataDirectory)) {
			return files.map(path -> path.getFileName().toString())
				.filter(file -> file.endsWith(EXTENSION))
				.map(file -> file.substring(0, file.length() - EXTENSION.length()))
				.sorted()
				.toList();
		}
		catch (IOException e) {
			throw new RepositoryStoreException("Failed to list repositories", dataDirectory, e);
		}
	}

	public Path getDataDirectory() {
		return dataDirectory;
	}

	Path pathOf(String name) {
		return dataDirectory.resolve(name + EXTENSION);
	}

}
