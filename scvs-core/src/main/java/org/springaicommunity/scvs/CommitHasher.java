package org.springaicommunity.scvs;

import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.List;

/**
 * Computes deterministic commit identifiers.
 *
 * <p>
 * The identifier is the first {@value #ID_LENGTH} hex characters of a SHA-1 digest over
 * the parent id, author, ISO timestamp, message and ordered file paths. Each field is
 * length-prefixed so that field boundaries cannot be shifted to produce the same input.
 * The hash is an identifier only.
 */
public final class CommitHasher {

	public static final int ID_LENGTH = 10;

	private static final String ALGORITHM = "SHA-1";

	private CommitHasher() {
	}

	public static String hash(@Nullable String parentId, String author, LocalDateTime timestamp, String message,
			List<String> files) {
		MessageDigest digest = newDigest();
		update(digest, parentId == null ? "" : parentId);
		update(digest, author);
		update(digest, timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
		update(digest, message);
		update(digest, Integer.toString(files.size()));
		for (String file : files) {
			update(digest, file);
		}
		return HexFormat.of().formatHex(digest.digest()).substring(0, ID_LENGTH);
	}

	private static void update(MessageDigest digest, String value) {
		byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
		digest.update((bytes.length + ":").getBytes(StandardCharsets.US_ASCII));
		digest.update(bytes);
	}

	private static MessageDigest newDigest() {
		try {
			return MessageDigest.getInstance(ALGORITHM);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException(ALGORITHM + " not available", e);
		}
	}

}
