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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.relooper.util.Bits;
import org.relooper.util.StringUtil;

/**
 * A Relooper converts the control-flow graph of a single function into a tree of {@link Shape}s
 * that can be emitted using only nested blocks, labeled loops, and labeled break/continue. The
 * lifecycle of a Relooper is <nl>
 * <li>Call {@link #addBlock} once for each block of the function, and {@link #addBranch} for each
 *     possible transfer of control between them.
 * <li>Call {@link #calculate} with the id of the entry block to build the Shape tree and resolve
 *     every branch.
 * <li>Walk the tree returned by {@link #root}, using each Branch's {@link Branch#kind}, {@link
 *     Branch#label}, and {@link Branch#setsDispatch} to decide how to render it. If {@link
 *     #needsDispatchVariable} returns true, the emitter must declare an integer variable
 *     initialized to {@link #initialDispatchValue}. </nl>
 *
 * <p>A Relooper can only be used once, and is not thread-safe; separate Relooper instances are
 * independent.
 */
public class Relooper {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public final DebugInfo debugInfo = new DebugInfo();

  /**
   * If true, the Relooper will add additional information to {@link #debugInfo} that is only likely
   * to be useful if you are testing or debugging the Relooper.
   */
  public boolean verbose;

  /**
   * If true, {@link #calculate} will not try to find any structure; the result will be a single
   * Loop containing a Multiple with one arm for each block, selected by the dispatch variable.
   */
  public boolean emulate;

  /** Each Relooper goes through three phases. */
  public enum Phase {
    BUILDING,
    CALCULATING,
    DONE
  }

  /** The Relooper's current phase. */
  private Phase phase = Phase.BUILDING;

  /** All blocks, in the order they were added. */
  private final Map<Integer, Block> blocks = new LinkedHashMap<>();

  /** Set by {@link #calculate}. */
  private Graph graph;

  private @Nullable Shape root;

  /** The arena indices of blocks reachable from the entry; set by {@link #calculate}. */
  private Bits reachable;

  private Bits dispatchTargets;

  private int maxDepth;

  public final Phase phase() {
    return phase;
  }

  /** Adds a block with the given id and code payload. */
  @CanIgnoreReturnValue
  public Block addBlock(int id, @Nullable Object code) {
    return addBlock(id, code, null);
  }

  /**
   * Adds a block with the given id and code payload that ends with a multi-way switch on {@code
   * switchOn}. The conditions of its branches are case values; an unconditional branch is the
   * default.
   */
  @CanIgnoreReturnValue
  public Block addBlock(int id, @Nullable Object code, @Nullable Object switchOn) {
    Preconditions.checkState(phase == Phase.BUILDING, "Cannot add blocks after calculate()");
    Block block = new Block(id, code, switchOn);
    if (blocks.putIfAbsent(id, block) != null) {
      throw RelooperException.malformedBlock(id, "duplicate block id");
    }
    return block;
  }

  /**
   * Adds a branch from block {@code from} (which must already have been added) to block {@code to}
   * (which need not have been added until {@link #calculate} is called).
   *
   * @param condition if null, the branch is taken when no earlier branch's condition was
   */
  @CanIgnoreReturnValue
  public Branch addBranch(int from, int to, @Nullable Object condition) {
    return addBranch(from, to, condition, null);
  }

  /**
   * Adds a branch from block {@code from} to block {@code to}, as {@link #addBranch(int, int,
   * Object)}, with code to be executed when it is taken.
   */
  @CanIgnoreReturnValue
  public Branch addBranch(int from, int to, @Nullable Object condition, @Nullable Object code) {
    Preconditions.checkState(phase == Phase.BUILDING, "Cannot add branches after calculate()");
    Block origin = blocks.get(from);
    if (origin == null) {
      throw RelooperException.malformedBlock(from, "branch to %s from unknown block", to);
    }
    Branch branch = new Branch(origin, to, condition, code);
    origin.branches.add(branch);
    return branch;
  }

  /**
   * Builds the Shape tree for the blocks reachable from {@code entryId} and resolves each of their
   * branches. Blocks that are not reachable from the entry are ignored, and their branches are left
   * unresolved.
   *
   * @throws RelooperException if the graph is malformed, or if the Relooper failed to maintain one
   *     of its invariants
   */
  public void calculate(int entryId) {
    Preconditions.checkState(phase == Phase.BUILDING, "calculate() may only be called once");
    phase = Phase.CALCULATING;
    graph = Graph.create(blocks, entryId);
    if (verbose) {
      debugInfo.graph = graph.printBlocks();
    }
    Reachability reachability = new Reachability(graph);
    reachable = reachability.reachableFrom(Bits.of(graph.entry.index()), graph.all(), Bits.EMPTY);
    if (reachable.count() != graph.numBlocks()) {
      Bits unreachable = Bits.Op.DIFFERENCE.apply(graph.all(), reachable);
      debugInfo.unreachable = StringUtil.joinBits(unreachable, ", ", i -> graph.block(i).id);
      logger.atFine().log("Ignoring unreachable blocks %s", debugInfo.unreachable);
    }
    ShapeBuilder builder = new ShapeBuilder(graph, reachability);
    if (emulate) {
      root = builder.emulate(reachable);
    } else {
      root = builder.build(reachable, Bits.of(graph.entry.index()), Bits.EMPTY, false);
    }
    dispatchTargets = builder.dispatchTargets();
    maxDepth = builder.maxDepth();
    BranchResolver resolver = new BranchResolver(dispatchTargets);
    resolver.resolve(root);
    phase = Phase.DONE;
    debugInfo.numShapes = builder.numShapes();
    debugInfo.numLoops = builder.numLoops;
    debugInfo.numMultiples = builder.numMultiples;
    debugInfo.numBranches = resolver.numResolved;
    debugInfo.maxDepth = maxDepth;
    if (verbose) {
      debugInfo.shapes = ShapePrinter.print(root);
    }
    logger.atFine().log("Calculated %s", lazy(debugInfo::counters));
    logger.atFinest().log("Shapes:\n%s", lazy(() -> ShapePrinter.print(root)));
  }

  private void checkDone() {
    Preconditions.checkState(phase == Phase.DONE, "calculate() has not completed");
  }

  /** Returns the root of the Shape tree. Never null, since at least the entry block is placed. */
  public Shape root() {
    checkDone();
    return root;
  }

  /** Returns the entry block. */
  public Block entry() {
    checkDone();
    return graph.entry;
  }

  /** Returns the block with the given id, or null if there is none. */
  public @Nullable Block block(int id) {
    return blocks.get(id);
  }

  /** Returns the number of blocks that have been added, whether or not they are reachable. */
  public int numBlocks() {
    return blocks.size();
  }

  /** Returns the blocks that could not be reached from the entry, in id order. */
  public ImmutableList<Block> unreachableBlocks() {
    checkDone();
    return graph.blocks(Bits.Op.DIFFERENCE.apply(graph.all(), reachable));
  }

  /** Returns true if any branch sets the dispatch variable. */
  public boolean needsDispatchVariable() {
    checkDone();
    return !dispatchTargets.isEmpty();
  }

  /**
   * Returns the value the dispatch variable must have when the function starts, i.e. the id of the
   * entry block.
   */
  public int initialDispatchValue() {
    checkDone();
    return graph.entry.id;
  }

  /**
   * The maximum depth of build levels reached while building Shapes; never more than the number of
   * reachable blocks.
   */
  public int maxDepth() {
    checkDone();
    return maxDepth;
  }
}
