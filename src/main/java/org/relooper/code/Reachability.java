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

import java.util.ArrayDeque;
import org.relooper.util.Bits;

/**
 * Reachability queries over a {@link Graph}, restricted to a <i>live</i> set of blocks (the blocks
 * that have not yet been placed in a Shape).
 *
 * <p>Every query follows only the edges whose target is live; an edge leaving the live set is an
 * exit, handled by whichever enclosing shape is already in progress. Queries also take a set of
 * <i>headers</i>: blocks whose incoming edges are continues of a loop that is being built, and so
 * are never followed (although a header may still be a starting point).
 *
 * <p>All methods are pure functions of their arguments and the (immutable) Graph. Nothing is cached
 * between calls, since the live set shrinks with each recursive step of structuring.
 */
final class Reachability {

  private final Graph graph;

  Reachability(Graph graph) {
    this.graph = graph;
  }

  /** Returns true if an edge to {@code target} should be followed. */
  private static boolean follow(int target, Bits live, Bits headers) {
    return live.test(target) && !headers.test(target);
  }

  /**
   * Returns the live blocks reachable from {@code starts}, including {@code starts} themselves
   * (which must be live).
   */
  Bits reachableFrom(Bits starts, Bits live, Bits headers) {
    assert live.containsAll(starts);
    Bits.Builder result = new Bits.Builder().setAll(starts);
    ArrayDeque<Integer> queue = new ArrayDeque<>();
    starts.forEach(queue::add);
    forwardClosure(queue, result, live, headers);
    return result.build();
  }

  /**
   * Returns the live blocks reachable from {@code starts} by following at least one edge. A start
   * block is only included if it is on a path from one of the starts.
   */
  Bits reachableAfter(Bits starts, Bits live, Bits headers) {
    Bits.Builder result = new Bits.Builder();
    ArrayDeque<Integer> queue = new ArrayDeque<>();
    starts.forEach(
        s -> {
          for (int t : graph.successors(s)) {
            if (follow(t, live, headers) && !result.test(t)) {
              result.set(t);
              queue.add(t);
            }
          }
        });
    forwardClosure(queue, result, live, headers);
    return result.build();
  }

  /**
   * Adds to {@code result} every block reachable from the blocks in {@code queue}, each of which
   * must already be in {@code result}.
   */
  private void forwardClosure(
      ArrayDeque<Integer> queue, Bits.Builder result, Bits live, Bits headers) {
    while (!queue.isEmpty()) {
      int b = queue.removeFirst();
      for (int t : graph.successors(b)) {
        if (follow(t, live, headers) && !result.test(t)) {
          result.set(t);
          queue.add(t);
        }
      }
    }
  }

  /**
   * Returns the live blocks that have a path of at least one edge into {@code targets}, staying
   * within the live set. Targets that are headers can never be reached.
   */
  Bits canReach(Bits targets, Bits live, Bits headers) {
    Bits.Builder result = new Bits.Builder();
    ArrayDeque<Integer> queue = new ArrayDeque<>();
    targets.forEach(
        t -> {
          if (follow(t, live, headers)) {
            addPredecessors(t, queue, result, live);
          }
        });
    while (!queue.isEmpty()) {
      int b = queue.removeFirst();
      // b is itself live and not a header (or it would not have been added), so edges into it are
      // followed.
      if (!headers.test(b)) {
        addPredecessors(b, queue, result, live);
      }
    }
    return result.build();
  }

  private void addPredecessors(int b, ArrayDeque<Integer> queue, Bits.Builder result, Bits live) {
    for (int p : graph.predecessors(b)) {
      if (live.test(p) && !result.test(p)) {
        result.set(p);
        queue.add(p);
      }
    }
  }

  /**
   * The cycle test: returns true if some entry can be reached from itself by a path of at least one
   * edge that stays within the live set. A path from one entry to another is not a cycle.
   */
  boolean canReachBack(Bits live, Bits entries, Bits headers) {
    for (int e = entries.min(); e >= 0; e = entries.nextSetBit(e + 1)) {
      if (reachableAfter(Bits.of(e), live, headers).test(e)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the blocks in {@code live} that are the direct target of a branch from {@code block}.
   */
  Bits successors(int block, Bits live) {
    Bits.Builder result = new Bits.Builder();
    for (int t : graph.successors(block)) {
      if (live.test(t)) {
        result.set(t);
      }
    }
    return result.build();
  }

  /**
   * Returns the blocks in {@code into} that are the direct target of a branch from {@code from}.
   */
  Bits exitTargets(Bits from, Bits into) {
    Bits.Builder result = new Bits.Builder();
    from.forEach(
        b -> {
          for (int t : graph.successors(b)) {
            if (into.test(t)) {
              result.set(t);
            }
          }
        });
    return result.build();
  }
}
