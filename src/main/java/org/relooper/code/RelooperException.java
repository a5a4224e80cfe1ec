/*
 * Copyright 2025 The Relooper Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.relooper.code;

import com.google.errorprone.annotations.FormatMethod;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a Relooper cannot structure its graph. Structuring is deterministic, so retrying with
 * the same input will always fail the same way; code generation for the offending function should
 * be abandoned.
 */
public class RelooperException extends RuntimeException {

  /** The two ways that structuring can fail. */
  public enum Kind {
    /**
     * The caller's graph is not well formed (e.g. a branch to an unknown block id). Detected before
     * any Shape is built.
     */
    MALFORMED_INPUT,

    /**
     * The Relooper was unable to maintain one of its own invariants; this indicates a bug in the
     * Relooper rather than in its input.
     */
    INTERNAL_INVARIANT
  }

  public final Kind kind;

  /** The id of the block at fault, if there is one. */
  public final @Nullable Integer blockId;

  /** The branch at fault, if there is one. */
  public final @Nullable Branch branch;

  private RelooperException(
      Kind kind, @Nullable Integer blockId, @Nullable Branch branch, String message) {
    super(message);
    this.kind = kind;
    this.blockId = blockId;
    this.branch = branch;
  }

  @FormatMethod
  static RelooperException malformedBlock(int blockId, String format, Object... args) {
    return new RelooperException(
        Kind.MALFORMED_INPUT,
        blockId,
        null,
        "Block " + blockId + ": " + String.format(format, args));
  }

  @FormatMethod
  static RelooperException malformedBranch(Branch branch, String format, Object... args) {
    return new RelooperException(
        Kind.MALFORMED_INPUT,
        branch.origin.id,
        branch,
        "Branch " + branch + ": " + String.format(format, args));
  }

  @FormatMethod
  static RelooperException internal(@Nullable Branch branch, String format, Object... args) {
    String message = String.format(format, args);
    return new RelooperException(
        Kind.INTERNAL_INVARIANT,
        (branch == null) ? null : branch.origin.id,
        branch,
        (branch == null) ? message : "Branch " + branch + ": " + message);
  }
}
