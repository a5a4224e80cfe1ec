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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A Block represents one straight-line piece of the function being structured; when the program is
 * emitted each Block will contribute its {@link #code} unchanged. Blocks are connected to other
 * Blocks by {@link Branch}es, forming a directed graph; each Branch represents a possible flow of
 * control.
 *
 * <p>Blocks are created by {@link Relooper#addBlock} and are owned by that Relooper. The Relooper
 * never creates, duplicates, or destroys a Block; structuring only decides where in the resulting
 * {@link Shape} tree each one is placed.
 */
public final class Block {

  /** The caller-assigned identifier; unique within a Relooper and used for deterministic order. */
  final int id;

  /** An opaque code payload; never examined by the Relooper. */
  private final @Nullable Object code;

  /**
   * If non-null, this block ends with a multi-way switch on this (opaque) value; the condition of
   * each of its branches is then a case value, and its unconditional branch (if any) is the
   * default.
   */
  private final @Nullable Object switchOn;

  /** The outgoing branches, in the order they were added. */
  final List<Branch> branches = new ArrayList<>();

  /**
   * The index of this block in its {@link Graph}'s arena, or -1 if the graph has not been built.
   * Arena indices follow id order.
   */
  private int index = -1;

  Block(int id, @Nullable Object code, @Nullable Object switchOn) {
    this.id = id;
    this.code = code;
    this.switchOn = switchOn;
  }

  public int id() {
    return id;
  }

  public @Nullable Object code() {
    return code;
  }

  public @Nullable Object switchOn() {
    return switchOn;
  }

  /** Returns this block's outgoing branches, in the order they were added. */
  public ImmutableList<Branch> branches() {
    return ImmutableList.copyOf(branches);
  }

  public int numBranches() {
    return branches.size();
  }

  public Branch branch(int i) {
    return branches.get(i);
  }

  /**
   * A Block with no branches ends the function; its code is expected to return (or throw) without
   * any help from the emitter.
   */
  public boolean isExit() {
    return branches.isEmpty();
  }

  /** The index of this block in its Graph's arena; negative if the graph has not yet been built. */
  final int index() {
    return index;
  }

  /** Enables Graph to set {@link #index}; not for general use. */
  final void setIndex(int index) {
    this.index = index;
  }

  /** Returns a printable description of the links from this block (e.g. {@code " -> 2, 3"}). */
  String linksToString() {
    if (branches.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(" ->");
    for (int i = 0; i < branches.size(); i++) {
      Branch branch = branches.get(i);
      sb.append(i == 0 ? " " : ", ").append(branch.targetId);
      if (branch.condition() != null) {
        sb.append(" [").append(branch.condition()).append("]");
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return (code == null) ? String.valueOf(id) : id + ": " + code;
  }
}
