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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.relooper.code.Shape.Arm;
import org.relooper.code.Shape.Multiple;
import org.relooper.code.Shape.Simple;
import org.relooper.util.Bits;

/**
 * Recursively partitions a set of live blocks into a tree of Shapes.
 *
 * <p>Each call to {@link #build} is given the blocks that have not yet been placed (the live set),
 * the subset of them through which control can enter (the entries), and the loop headers that are
 * still live. Each level removes at least one block from the live set before the next level begins,
 * so {@link #maxDepth} is bounded by the number of blocks. The rules, in order:
 *
 * <ul>
 *   <li>A single entry that cannot be reached again from itself becomes a {@link Simple}.
 *   <li>If any entry can be reached again from itself, the blocks that are both reachable from the
 *       entries and able to reach them form the body of a {@link Shape.Loop}, and the rest follow
 *       the loop.
 *   <li>Otherwise the entries are split into a {@link Multiple}, with one arm for each entry that
 *       has blocks reachable from it alone. Blocks reachable from more than one entry follow the
 *       Multiple rather than being duplicated.
 * </ul>
 *
 * <p>A loop body with more than one entry (an irreducible region) is a dispatching Multiple with
 * one arm per entry; branches into it assign the dispatch variable.
 */
final class ShapeBuilder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Graph graph;
  private final Reachability reachability;

  /**
   * The arena indices of blocks that are entries of a dispatching Multiple; every branch to one of
   * these must set the dispatch variable.
   */
  private final Bits.Builder dispatchTargets = new Bits.Builder();

  /** Shape ids are allocated sequentially, starting from 1, in the order shapes are begun. */
  private int nextShapeId = 1;

  /** The current depth of {@link #build} levels; each link of a {@code next} chain is a level. */
  private int depth;

  /** The maximum value of {@link #depth}. */
  private int maxDepth;

  /** Counters for {@link DebugInfo}. */
  int numLoops;

  int numMultiples;

  ShapeBuilder(Graph graph, Reachability reachability) {
    this.graph = graph;
    this.reachability = reachability;
  }

  /** Returns the blocks that must be targeted by branches that set the dispatch variable. */
  Bits dispatchTargets() {
    return dispatchTargets.build();
  }

  /** The maximum depth of {@link #build} levels reached. */
  int maxDepth() {
    return maxDepth;
  }

  /** The number of shapes created so far. */
  int numShapes() {
    return nextShapeId - 1;
  }

  /**
   * One link of a {@code next} chain: a shape whose {@code next} has not yet been set, and the live
   * blocks (with their entries) that remain to be placed after it.
   */
  private record Link(Shape shape, Bits rest, Bits nextEntries) {}

  /**
   * Returns a Shape for the given live blocks, or null if there are none.
   *
   * <p>The {@code next} chain is built iteratively; only the inner shapes of Loops and Multiples
   * recurse. Each link of the chain still counts as one level of {@link #depth}.
   *
   * @param live the blocks that have not yet been placed in a shape
   * @param entries the live blocks that may be entered from outside {@code live}; every live block
   *     must be reachable from them
   * @param headers loop entries whose incoming edges are continues; must be a subset of entries
   * @param afterSimple true if the resulting shape will be the {@code next} of a Simple shape, in
   *     which case that Simple's block is the only way to enter it
   */
  @Nullable Shape build(Bits live, Bits entries, Bits headers, boolean afterSimple) {
    int savedDepth = depth;
    @Nullable Shape first = null;
    @Nullable Shape last = null;
    try {
      while (!live.isEmpty()) {
        assert live.containsAll(entries) && entries.containsAll(headers);
        if (entries.isEmpty()) {
          // Should be impossible, since every live block is reachable from an entry.
          throw RelooperException.internal(null, "No entries for blocks %s", ids(live));
        }
        ++depth;
        maxDepth = Math.max(maxDepth, depth);
        Link link = makeLink(live, entries, headers, afterSimple);
        if (last == null) {
          first = link.shape;
        } else {
          last.setNext(link.shape);
        }
        last = link.shape;
        live = link.rest;
        entries = link.nextEntries;
        headers = Bits.EMPTY;
        afterSimple = link.shape instanceof Simple;
      }
      if (last != null) {
        last.setNext(null);
      }
      return first;
    } finally {
      depth = savedDepth;
    }
  }

  private Link makeLink(Bits live, Bits entries, Bits headers, boolean afterSimple) {
    boolean cycle = reachability.canReachBack(live, entries, headers);
    if (entries.count() == 1 && !cycle) {
      return makeSimple(live, entries.min());
    } else if (cycle) {
      return makeLoop(live, entries, headers);
    } else {
      return makeMultiple(live, entries, headers, !afterSimple);
    }
  }

  /**
   * Returns a Simple for the given block. Any branch from {@code block} to another live block makes
   * that block an entry of the remainder; branches to blocks that are no longer live are handled by
   * enclosing shapes.
   */
  private Link makeSimple(Bits live, int block) {
    int id = nextShapeId++;
    Bits rest = Bits.Op.DIFFERENCE.apply(live, Bits.of(block));
    Bits nextEntries = reachability.successors(block, rest);
    return new Link(new Simple(id, graph.block(block)), rest, nextEntries);
  }

  /**
   * Returns a Loop whose body is the blocks that are reachable from the entries and can reach an
   * entry. The remaining live blocks are entered through the loop's exits.
   */
  private Link makeLoop(Bits live, Bits entries, Bits headers) {
    int id = nextShapeId++;
    ++numLoops;
    Bits loopTargets = Bits.Op.DIFFERENCE.apply(entries, headers);
    Bits inner =
        Bits.Op.UNION.apply(
            entries,
            Bits.Op.INTERSECTION.apply(
                reachability.reachableFrom(entries, live, headers),
                reachability.canReach(loopTargets, live, headers)));
    Bits rest = Bits.Op.DIFFERENCE.apply(live, inner);
    logger.atFinest().log(
        "Loop L%s: entries %s, body %s, rest %s",
        id, lazy(() -> ids(entries)), lazy(() -> ids(inner)), lazy(() -> ids(rest)));
    Shape body = makeBody(inner, entries);
    Bits exits = reachability.exitTargets(inner, rest);
    return new Link(new Shape.Loop(id, entries, body), rest, exits);
  }

  /**
   * Returns the body of a loop. The loop's entries become headers, so the cycle test is not
   * repeated: a single entry becomes a Simple, and multiple entries become a dispatching Multiple
   * with one arm per entry.
   *
   * <p>The first shape of the body is not a separate level of {@link #build}, since the body may
   * contain all of the blocks that were live when the loop was begun.
   */
  private Shape makeBody(Bits inner, Bits entries) {
    Link link;
    if (entries.count() == 1) {
      link = makeSimple(inner, entries.min());
    } else {
      link = makeMultiple(inner, entries, entries, true);
      assert ((Multiple) link.shape).arms.size() == entries.count();
    }
    link.shape.setNext(
        build(link.rest, link.nextEntries, Bits.EMPTY, link.shape instanceof Simple));
    return link.shape;
  }

  /**
   * Returns a Multiple with one arm for each entry that has blocks reachable from it alone. Blocks
   * that are in no arm remain live.
   *
   * @param dispatches true if the arm must be chosen using the dispatch variable
   */
  private Link makeMultiple(Bits live, Bits entries, Bits headers, boolean dispatches) {
    int id = nextShapeId++;
    ++numMultiples;
    // Find the blocks reachable from more than one entry.
    Bits.Builder seen = new Bits.Builder();
    Bits.Builder shared = new Bits.Builder();
    Bits[] reachable = new Bits[graph.numBlocks()];
    entries.forEach(
        e -> {
          Bits fromEntry = reachability.reachableFrom(Bits.of(e), live, headers);
          reachable[e] = fromEntry;
          fromEntry.forEach(
              b -> {
                if (seen.test(b)) {
                  shared.set(b);
                } else {
                  seen.set(b);
                }
              });
        });
    Bits sharedBlocks = shared.build();
    if (dispatches) {
      dispatchTargets.setAll(entries);
    }
    // Each entry that is not itself shared gets an arm with its exclusive blocks; arms are built in
    // entry order so that shape ids are deterministic.
    ImmutableList.Builder<Arm> arms = ImmutableList.builder();
    Bits.Builder inArms = new Bits.Builder();
    Set<Integer> dispatchValues = new HashSet<>();
    int[] entryIndices = entries.stream().toArray();
    for (int e : entryIndices) {
      Bits exclusive = Bits.Op.DIFFERENCE.apply(reachable[e], sharedBlocks);
      if (!exclusive.test(e)) {
        continue;
      }
      Block entry = graph.block(e);
      if (dispatches && !dispatchValues.add(entry.id)) {
        throw RelooperException.internal(
            null, "Dispatch value %s used by more than one arm of L%s", entry.id, id);
      }
      inArms.setAll(exclusive);
      Bits armHeaders = Bits.Op.INTERSECTION.apply(headers, Bits.of(e));
      Shape inner = build(exclusive, Bits.of(e), armHeaders, false);
      arms.add(new Arm(entry, inner, exclusive));
    }
    ImmutableList<Arm> armList = arms.build();
    if (armList.isEmpty()) {
      throw RelooperException.internal(null, "No independent entries in %s", ids(entries));
    }
    Bits armBlocks = inArms.build();
    Bits rest = Bits.Op.DIFFERENCE.apply(live, armBlocks);
    assert !rest.intersects(headers);
    // The remainder is entered through branches out of the arms, or directly through entries that
    // did not get an arm.
    Bits nextEntries =
        Bits.Op.UNION.apply(
            Bits.Op.INTERSECTION.apply(entries, rest), reachability.exitTargets(armBlocks, rest));
    logger.atFinest().log(
        "Multiple L%s: arms %s, rest %s",
        id,
        lazy(() -> armList.stream().map(arm -> ids(arm.blocks())).toList()),
        lazy(() -> ids(rest)));
    return new Link(new Multiple(id, entries, armList, dispatches), rest, nextEntries);
  }

  /**
   * Returns a single Loop containing a dispatching Multiple with a Simple arm for each of the given
   * blocks. Every branch between them sets the dispatch variable and continues the loop; no attempt
   * is made to find any structure.
   */
  Shape emulate(Bits live) {
    int loopId = nextShapeId++;
    int multipleId = nextShapeId++;
    ++numLoops;
    ++numMultiples;
    depth = maxDepth = 1;
    ImmutableList<Arm> arms =
        live.stream()
            .mapToObj(
                b -> {
                  Block block = graph.block(b);
                  return new Arm(block, leaf(new Simple(nextShapeId++, block)), Bits.of(b));
                })
            .collect(ImmutableList.toImmutableList());
    dispatchTargets.setAll(live);
    Multiple body = leaf(new Multiple(multipleId, live, arms, true));
    return leaf(new Shape.Loop(loopId, live, body));
  }

  /** Marks {@code shape} as having no {@code next}. */
  private static <T extends Shape> T leaf(T shape) {
    shape.setNext(null);
    return shape;
  }

  /** Returns the ids of the given blocks, for logging. */
  private String ids(Bits blocks) {
    return blocks.stream()
        .mapToObj(i -> String.valueOf(graph.block(i).id))
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
