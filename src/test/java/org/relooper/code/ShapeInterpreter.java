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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.ToIntFunction;
import org.jspecify.annotations.Nullable;
import org.relooper.code.Shape.Arm;
import org.relooper.code.Shape.Loop;
import org.relooper.code.Shape.Multiple;
import org.relooper.code.Shape.Simple;

/**
 * Executes a resolved Shape tree the way an emitter's output would, recording the sequence of block
 * ids visited. The branch taken from each block is chosen by a caller-supplied function, so the
 * trace can be compared with a walk of the original graph that makes the same choices.
 *
 * <p>While executing, the interpreter checks that control only ever enters a shape through one of
 * its entries, that a dispatching Multiple is never entered with a stale dispatch variable, and
 * that unlabeled breaks and continues refer to the innermost enclosing construct.
 */
final class ShapeInterpreter {

  /** How execution of a shape ended. */
  private enum Outcome {
    /** Completed normally; continue with the follower. */
    NORMAL,
    /** Left {@link #jumpTarget} with a break. */
    BREAK,
    /** Continued {@link #jumpTarget}. */
    CONTINUE,
    /** Reached a block with no branches, or the step limit. */
    END
  }

  private final ToIntFunction<Block> chooseBranch;
  private final int maxSteps;
  private final List<Integer> trace = new ArrayList<>();
  private final List<Shape> enclosing = new ArrayList<>();

  /** The block that must be executed next. */
  private Block pending;

  private int dispatch;

  /** The shape named by the last BREAK or CONTINUE outcome. */
  private Shape jumpTarget;

  /**
   * @param chooseBranch given a block with at least one branch, returns the index of the branch to
   *     take
   */
  ShapeInterpreter(ToIntFunction<Block> chooseBranch, int maxSteps) {
    this.chooseBranch = chooseBranch;
    this.maxSteps = maxSteps;
  }

  /** Runs the given Relooper's result and returns the ids of the blocks visited. */
  List<Integer> run(Relooper relooper) {
    pending = relooper.entry();
    dispatch = relooper.initialDispatchValue();
    Outcome outcome = execChain(relooper.root());
    assertThat(outcome).isEqualTo(Outcome.END);
    assertThat(enclosing).isEmpty();
    return trace;
  }

  /**
   * Walks the original graph from {@code entry}, making the same choices, and returns the ids of
   * the blocks visited.
   */
  static List<Integer> walk(Block entry, ToIntFunction<Block> chooseBranch, int maxSteps) {
    List<Integer> result = new ArrayList<>();
    for (Block block = entry; ; ) {
      result.add(block.id);
      if (block.isExit() || result.size() >= maxSteps) {
        return result;
      }
      block = block.branch(chooseBranch.applyAsInt(block)).target();
    }
  }

  /** Returns a branch chooser that picks uniformly at random using the given seed. */
  static ToIntFunction<Block> randomChoices(long seed) {
    Random random = new Random(seed);
    return block -> random.nextInt(block.numBranches());
  }

  private Outcome execChain(@Nullable Shape shape) {
    for (Shape s = shape; s != null; s = s.next) {
      Outcome outcome = exec(s);
      if (outcome != Outcome.NORMAL) {
        return outcome;
      }
    }
    return Outcome.NORMAL;
  }

  private Outcome exec(Shape shape) {
    assertWithMessage("Entered %s at block %s", shape, pending.id)
        .that(shape.entries.test(pending.index()))
        .isTrue();
    return switch (shape.type()) {
      case SIMPLE -> execSimple((Simple) shape);
      case LOOP -> execLoop((Loop) shape);
      case MULTIPLE -> execMultiple((Multiple) shape);
    };
  }

  private Outcome execSimple(Simple simple) {
    Block block = simple.block;
    assertThat(block).isSameInstanceAs(pending);
    trace.add(block.id);
    if (block.isExit() || trace.size() >= maxSteps) {
      return Outcome.END;
    }
    Branch branch = block.branch(chooseBranch.applyAsInt(block));
    if (branch.setsDispatch()) {
      dispatch = branch.dispatchValue();
    }
    pending = branch.target();
    if (branch.kind() == Branch.Kind.DIRECT) {
      return Outcome.NORMAL;
    }
    jumpTarget = branch.exited();
    if (branch.label() == null) {
      assertWithMessage("Unlabeled %s", branch)
          .that(jumpTarget)
          .isSameInstanceAs(enclosing.get(enclosing.size() - 1));
    }
    return branch.kind().isContinue() ? Outcome.CONTINUE : Outcome.BREAK;
  }

  private Outcome execLoop(Loop loop) {
    enclosing.add(loop);
    try {
      for (; ; ) {
        Outcome outcome = execChain(loop.inner);
        if (outcome == Outcome.CONTINUE && jumpTarget == loop) {
          continue;
        } else if (outcome == Outcome.BREAK && jumpTarget == loop) {
          return Outcome.NORMAL;
        }
        return outcome;
      }
    } finally {
      enclosing.remove(enclosing.size() - 1);
    }
  }

  private Outcome execMultiple(Multiple multiple) {
    Arm arm;
    if (multiple.dispatches) {
      assertWithMessage("Stale dispatch variable entering %s", multiple)
          .that(dispatch)
          .isEqualTo(pending.id);
      arm = null;
      for (Arm a : multiple.arms) {
        if (a.dispatchValue() == dispatch) {
          arm = a;
        }
      }
    } else {
      arm = multiple.arm(pending.id);
    }
    if (arm == null) {
      return Outcome.NORMAL;
    }
    enclosing.add(multiple);
    try {
      Outcome outcome = execChain(arm.inner());
      if (outcome == Outcome.BREAK && jumpTarget == multiple) {
        return Outcome.NORMAL;
      }
      return outcome;
    } finally {
      enclosing.remove(enclosing.size() - 1);
    }
  }
}
