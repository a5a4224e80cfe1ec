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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A Branch is a directed edge from one {@link Block} (its origin) to another (its target). Each
 * Branch belongs to exactly one origin block; branches are never shared or duplicated.
 *
 * <p>The caller supplies the target id and the opaque {@link #condition} and {@link #code}
 * payloads. The remaining state is filled in by {@link Relooper#calculate}: the target block itself
 * (once the graph has been validated), whether taking this branch must first set the dispatch
 * variable, and how the emitter should transfer control ({@link #kind}).
 */
public final class Branch {

  /** The block this branch leaves from. */
  final Block origin;

  /** The id of the block this branch goes to, as given by the caller. */
  final int targetId;

  /** If null, this branch is unconditional (or the default case of a switch). */
  private final @Nullable Object condition;

  /** Optional code to be executed when this branch is taken, e.g. phi copies. */
  private final @Nullable Object code;

  /** The target block; null until the graph has been validated. */
  private Block target;

  /** True if taking this branch must set the dispatch variable to {@link #dispatchValue}. */
  private boolean setsDispatch;

  /** Null until the branch has been resolved. */
  private Kind kind;

  /**
   * For BREAK and CONTINUE branches (with or without setting the dispatch variable), the Loop or
   * Multiple shape that the branch leaves or continues; null for DIRECT branches.
   */
  private Shape exited;

  /** True if the emitter must name {@link #exited}'s label when rendering this branch. */
  private boolean labeled;

  /**
   * How a resolved Branch transfers control. BREAK and CONTINUE refer to the shape returned by
   * {@link #exited}; the SET_AND_ variants also assign the dispatch variable first.
   *
   * <p>A DIRECT branch for which {@link #setsDispatch} is true assigns the dispatch variable and
   * then falls through.
   */
  public enum Kind {
    /** The target is the next thing executed; no jump needs to be emitted. */
    DIRECT,
    /** Leave the enclosing Loop or Multiple; the target follows it. */
    BREAK,
    /** Start the next iteration of the enclosing Loop, which begins with the target. */
    CONTINUE,
    SET_AND_BREAK,
    SET_AND_CONTINUE;

    boolean isContinue() {
      return this == CONTINUE || this == SET_AND_CONTINUE;
    }
  }

  Branch(Block origin, int targetId, @Nullable Object condition, @Nullable Object code) {
    this.origin = origin;
    this.targetId = targetId;
    this.condition = condition;
    this.code = code;
  }

  public Block origin() {
    return origin;
  }

  public int targetId() {
    return targetId;
  }

  /** Returns the target block; only valid after the graph has been validated. */
  public Block target() {
    Preconditions.checkState(target != null, "Branch has not been linked");
    return target;
  }

  public @Nullable Object condition() {
    return condition;
  }

  public @Nullable Object code() {
    return code;
  }

  /** Returns true if taking this branch must assign the dispatch variable. */
  public boolean setsDispatch() {
    return setsDispatch;
  }

  /**
   * The value that this branch assigns to the dispatch variable. Dispatch values are target block
   * ids, so every branch to a given block assigns the same value.
   */
  public int dispatchValue() {
    Preconditions.checkState(setsDispatch, "Branch does not set the dispatch variable");
    return targetId;
  }

  /** Returns true if {@link #kind} has been determined. */
  public boolean isResolved() {
    return kind != null;
  }

  /** Returns how this branch transfers control; only valid after it has been resolved. */
  public Kind kind() {
    Preconditions.checkState(kind != null, "Branch has not been resolved");
    return kind;
  }

  /**
   * For BREAK and CONTINUE branches, returns the Loop or Multiple being exited or continued;
   * returns null for DIRECT branches.
   */
  public @Nullable Shape exited() {
    return exited;
  }

  /**
   * Returns the label that the emitter must use when rendering this branch, or null if the branch
   * is DIRECT or refers to the innermost enclosing Loop or Multiple.
   */
  public @Nullable String label() {
    return labeled ? exited.label() : null;
  }

  void link(Block target) {
    assert target.id == targetId;
    this.target = target;
  }

  void setSetsDispatch() {
    setsDispatch = true;
  }

  /** Called by BranchResolver. */
  void resolve(Kind kind, @Nullable Shape exited, boolean labeled) {
    assert this.kind == null && (kind == Kind.DIRECT) == (exited == null);
    if (setsDispatch) {
      if (kind == Kind.BREAK) {
        kind = Kind.SET_AND_BREAK;
      } else if (kind == Kind.CONTINUE) {
        kind = Kind.SET_AND_CONTINUE;
      }
    }
    this.kind = kind;
    this.exited = exited;
    this.labeled = labeled;
  }

  /** Returns a printable description of how this branch was resolved. */
  String resolutionToString() {
    if (kind == null) {
      return "?";
    }
    StringBuilder sb = new StringBuilder(Ascii.toLowerCase(kind.name()));
    if (labeled) {
      sb.append(" ").append(exited.label());
    }
    if (kind == Kind.DIRECT && setsDispatch) {
      sb.append(" set");
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return origin.id + " -> " + targetId + (condition == null ? "" : " [" + condition + "]");
  }
}
