/**
 * SCVS core package: commit graph, branch store, staging area, pull request workflow and
 * access control of a simulated version control repository.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.scvs;

import org.jspecify.annotations.NullMarked;
