package org.springaicommunity.scvs;

/**
 * A file path recorded in a commit together with its change kind.
 *
 * @param path file path
 * @param kind change kind
 */
public record FileChange(String path, ChangeKind kind) {
}
