/**
 * Interactive shell and one-shot command runner for SCVS.
 */
@NullMarked
package org.springaicommunity.scvs.cli;

import org.jspecify.annotations.NullMarked;
