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
import java.util.Comparator;
import java.util.Map;
import java.util.stream.IntStream;
import org.relooper.util.Bits;

/**
 * The validated, frozen form of a Relooper's blocks: an arena of Blocks sorted by id, with each
 * Branch linked to its target and adjacency recorded as arena indices. Block sets used during
 * structuring are {@link Bits} over these indices, so iterating one visits blocks in id order.
 *
 * <p>A Graph never changes after it is created; all the state that changes during structuring is
 * either passed explicitly (block sets) or recorded on the Branches themselves (their resolution).
 */
final class Graph {

  /** All blocks, sorted by id ({@code blocks.get(i).index() == i}). */
  private final ImmutableList<Block> blocks;

  /** The entry block. */
  final Block entry;

  /**
   * {@code successors[i]} are the indices of the targets of block i's branches, in branch order
   * (with duplicates if block i has more than one branch to the same target).
   */
  private final int[][] successors;

  /** {@code predecessors[i]} are the indices of the blocks with a branch to block i. */
  private final int[][] predecessors;

  private Graph(
      ImmutableList<Block> blocks, Block entry, int[][] successors, int[][] predecessors) {
    this.blocks = blocks;
    this.entry = entry;
    this.successors = successors;
    this.predecessors = predecessors;
  }

  /**
   * Validates the given blocks, links each branch to its target, and returns the resulting Graph.
   * Throws a {@link RelooperException} if {@code entryId} is not one of the blocks or if any branch
   * targets an unknown id.
   */
  static Graph create(Map<Integer, Block> blocksById, int entryId) {
    Block entry = blocksById.get(entryId);
    if (entry == null) {
      throw RelooperException.malformedBlock(entryId, "entry block was never added");
    }
    ImmutableList<Block> blocks =
        blocksById.values().stream()
            .sorted(Comparator.comparingInt(Block::id))
            .collect(ImmutableList.toImmutableList());
    for (int i = 0; i < blocks.size(); i++) {
      blocks.get(i).setIndex(i);
    }
    int[][] successors = new int[blocks.size()][];
    int[] numPredecessors = new int[blocks.size()];
    for (Block block : blocks) {
      int[] targets = new int[block.branches.size()];
      for (int i = 0; i < targets.length; i++) {
        Branch branch = block.branches.get(i);
        Block target = blocksById.get(branch.targetId);
        if (target == null) {
          throw RelooperException.malformedBranch(branch, "target block was never added");
        }
        branch.link(target);
        targets[i] = target.index();
        ++numPredecessors[target.index()];
      }
      successors[block.index()] = targets;
    }
    int[][] predecessors = new int[blocks.size()][];
    for (int i = 0; i < blocks.size(); i++) {
      predecessors[i] = new int[numPredecessors[i]];
    }
    // Fill each predecessors array from the back, reusing numPredecessors as a cursor.
    for (int i = blocks.size() - 1; i >= 0; i--) {
      for (int target : successors[i]) {
        predecessors[target][--numPredecessors[target]] = i;
      }
    }
    return new Graph(blocks, entry, successors, predecessors);
  }

  /** Returns the number of blocks in the arena, whether or not they are reachable. */
  int numBlocks() {
    return blocks.size();
  }

  /** Returns the block with the given arena index. */
  Block block(int index) {
    Block result = blocks.get(index);
    assert result.index() == index;
    return result;
  }

  /** Returns the set of all arena indices. */
  Bits all() {
    return Bits.forRange(0, blocks.size() - 1);
  }

  int[] successors(int index) {
    return successors[index];
  }

  int[] predecessors(int index) {
    return predecessors[index];
  }

  /** Returns the blocks corresponding to the given set of arena indices, in id order. */
  ImmutableList<Block> blocks(Bits indices) {
    return indices.stream().mapToObj(this::block).collect(ImmutableList.toImmutableList());
  }

  /** Returns a listing of the graph, one block per line, in id order. */
  String printBlocks() {
    StringBuilder sb = new StringBuilder();
    IntStream.range(0, blocks.size())
        .mapToObj(this::block)
        .forEach(
            b -> {
              sb.append(b.id).append(b == entry ? " (entry)" : "").append(b.linksToString());
              if (b.switchOn() != null) {
                sb.append(" switch ").append(b.switchOn());
              }
              sb.append("\n");
            });
    return sb.toString();
  }
}
