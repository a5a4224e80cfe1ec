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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.relooper.util.Bits;

/**
 * A Shape is a node of the structured output tree. There are exactly three kinds, distinguished by
 * {@link #type}: a {@link Simple} (one block), a {@link Loop} (a body that may be repeated), and a
 * {@link Multiple} (a choice between disjoint arms). Code that handles Shapes should switch on
 * {@link #type} so that the compiler checks that every kind is handled.
 *
 * <p>Every Shape has an optional {@link #next}, the Shape that runs after it completes normally;
 * the chain of {@code next} links never forms a cycle (cycles are only expressed by Loops).
 *
 * <p>The structure of a Shape tree is fixed when it is built; {@link #next} is linked once, after
 * the shape itself is complete. The only state set afterwards is whether a Loop or Multiple needs a
 * label, which is determined when the branches are resolved.
 */
public abstract sealed class Shape {

  /** The three kinds of Shape. */
  public enum Type {
    SIMPLE,
    LOOP,
    MULTIPLE
  }

  /** Unique within a Relooper; used to generate labels. */
  final int id;

  /**
   * The arena indices of the blocks through which control may enter this shape. For a Simple this
   * is just its block.
   */
  final Bits entries;

  /** The shape that runs after this one completes normally; null if nothing follows. */
  @Nullable Shape next;

  private boolean linked;

  private Shape(int id, Bits entries) {
    this.id = id;
    this.entries = entries;
  }

  /** Sets {@link #next}; may only be called once. */
  final void setNext(@Nullable Shape next) {
    Preconditions.checkState(!linked, "next of %s already set", id);
    this.next = next;
    linked = true;
  }

  public abstract Type type();

  public final int id() {
    return id;
  }

  public final @Nullable Shape next() {
    return next;
  }

  /** The label the emitter should use for this shape, if it needs one. */
  public final String label() {
    return "L" + id;
  }

  /** Returns the entries of {@code shape}, or an empty set if it is null. */
  static Bits entries(@Nullable Shape shape) {
    return (shape == null) ? Bits.EMPTY : shape.entries;
  }

  @Override
  public String toString() {
    return ShapePrinter.summarize(this);
  }

  /** A Shape that executes a single Block. */
  public static final class Simple extends Shape {
    final Block block;

    Simple(int id, Block block) {
      super(id, Bits.of(block.index()));
      this.block = block;
    }

    @Override
    public Type type() {
      return Type.SIMPLE;
    }

    public Block block() {
      return block;
    }
  }

  /**
   * A Shape that executes its {@link #inner} shape repeatedly. A branch to one of the loop's
   * entries starts another iteration; when the inner shape completes normally control leaves the
   * loop and continues with {@link #next}.
   */
  public static final class Loop extends Shape {
    final Shape inner;

    /** Set if at least one branch must name this loop's label. */
    boolean labeled;

    Loop(int id, Bits entries, Shape inner) {
      super(id, entries);
      this.inner = inner;
    }

    @Override
    public Type type() {
      return Type.LOOP;
    }

    public Shape inner() {
      return inner;
    }

    public boolean isLabeled() {
      return labeled;
    }
  }

  /**
   * A Shape that executes at most one of its {@link #arms}, chosen by the block through which it
   * was entered, and then continues with {@link #next}. If it is entered through a block that is
   * not the entry of any arm it executes no arm at all, and the entry block will be found in {@link
   * #next}.
   *
   * <p>A dispatching Multiple chooses its arm by comparing the dispatch variable with each arm's
   * {@link Arm#dispatchValue}. A Multiple that does not dispatch (a "fused" Multiple) immediately
   * follows a Simple shape whose branches are the only way to enter it, so the emitter can render
   * the arms inside that block's conditional branches.
   */
  public static final class Multiple extends Shape {
    final ImmutableList<Arm> arms;
    final boolean dispatches;

    /** Set if at least one branch must name this shape's label. */
    boolean labeled;

    Multiple(int id, Bits entries, ImmutableList<Arm> arms, boolean dispatches) {
      super(id, entries);
      this.arms = arms;
      this.dispatches = dispatches;
    }

    @Override
    public Type type() {
      return Type.MULTIPLE;
    }

    /** Returns this shape's arms, ordered by entry block id. */
    public ImmutableList<Arm> arms() {
      return arms;
    }

    /** Returns the arm entered through the block with the given id, or null if there is none. */
    public @Nullable Arm arm(int entryId) {
      for (Arm arm : arms) {
        if (arm.entry.id == entryId) {
          return arm;
        }
      }
      return null;
    }

    public boolean dispatches() {
      return dispatches;
    }

    public boolean isLabeled() {
      return labeled;
    }
  }

  /**
   * One choice of a Multiple: the shape that is run when the Multiple is entered through {@code
   * entry}, and the set of blocks (as arena indices) placed in that shape. The arms of a Multiple
   * are pairwise disjoint and no branch goes directly from one arm to another.
   */
  public record Arm(Block entry, Shape inner, Bits blocks) {
    /** The value of the dispatch variable that selects this arm. */
    public int dispatchValue() {
      return entry.id;
    }
  }
}
