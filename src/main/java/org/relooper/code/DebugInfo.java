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

/**
 * A DebugInfo aggregates information from a single Relooper instance that may be useful for
 * understanding its results (e.g. when an emitter produces unexpected output).
 */
public class DebugInfo {
  /**
   * A listing of the input graph, one block per line in id order. Only created if {@link
   * Relooper#verbose} is set.
   */
  public String graph;

  /**
   * A listing of the resolved Shape tree, as produced by {@link ShapePrinter#print}. Only created if
   * {@link Relooper#verbose} is set.
   */
  public String shapes;

  /** The number of Shapes created. */
  public int numShapes;

  public int numLoops;

  public int numMultiples;

  /** The number of branches resolved, i.e. all branches of reachable blocks. */
  public int numBranches;

  /** The ids of blocks that were not reachable from the entry and so were not placed. */
  public String unreachable;

  /** The maximum depth of build levels reached while building Shapes. */
  public int maxDepth;

  /** Returns a one-line summary of the counters. */
  public String counters() {
    return String.format(
        "%s shapes (%s loops, %s multiples), %s branches, max depth %s",
        numShapes, numLoops, numMultiples, numBranches, maxDepth);
  }
}
