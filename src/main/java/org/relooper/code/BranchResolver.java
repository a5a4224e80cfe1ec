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

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.relooper.code.Shape.Arm;
import org.relooper.code.Shape.Loop;
import org.relooper.code.Shape.Multiple;
import org.relooper.code.Shape.Simple;
import org.relooper.util.Bits;

/**
 * Determines how each branch of a completed Shape tree transfers control.
 *
 * <p>The tree is walked once, keeping a stack of the Loops and Multiples that enclose the current
 * shape. Each enclosing construct is paired with its <i>follower</i>, the shape that control
 * reaches when the construct completes normally. A branch whose target begins the follower of its
 * own Simple is DIRECT; otherwise the enclosing constructs are searched from the innermost outward
 * for a Loop that the target continues or a construct whose follower the target begins.
 */
final class BranchResolver {

  /** An enclosing Loop or Multiple, and the shape that follows it. */
  private record Frame(Shape construct, @Nullable Shape follower) {}

  private final Bits dispatchTargets;

  /** The enclosing constructs, innermost last. */
  private final List<Frame> frames = new ArrayList<>();

  /** The number of branches resolved so far. */
  int numResolved;

  /**
   * @param dispatchTargets the arena indices of blocks that are entries of a dispatching Multiple;
   *     branches to them must set the dispatch variable
   */
  BranchResolver(Bits dispatchTargets) {
    this.dispatchTargets = dispatchTargets;
  }

  /** Resolves every branch of every block in the given tree. */
  void resolve(@Nullable Shape root) {
    resolveChain(root, null);
    assert frames.isEmpty();
  }

  /**
   * Resolves the branches of {@code shape}, its {@code next}, and so on. {@code follower} is the
   * shape that control reaches when the last shape in the chain completes.
   */
  private void resolveChain(@Nullable Shape shape, @Nullable Shape follower) {
    for (Shape s = shape; s != null; s = s.next) {
      Shape sFollower = (s.next != null) ? s.next : follower;
      switch (s.type()) {
        case SIMPLE -> resolveBlock(((Simple) s).block, sFollower);
        case LOOP -> {
          Loop loop = (Loop) s;
          frames.add(new Frame(loop, sFollower));
          // Falling off the end of a loop body leaves the loop.
          resolveChain(loop.inner, sFollower);
          frames.remove(frames.size() - 1);
        }
        case MULTIPLE -> {
          Multiple multiple = (Multiple) s;
          frames.add(new Frame(multiple, sFollower));
          for (Arm arm : multiple.arms) {
            resolveChain(arm.inner(), sFollower);
          }
          frames.remove(frames.size() - 1);
        }
      }
    }
  }

  private void resolveBlock(Block block, @Nullable Shape follower) {
    for (Branch branch : block.branches) {
      int target = branch.target().index();
      if (dispatchTargets.test(target)) {
        branch.setSetsDispatch();
      }
      if (Shape.entries(follower).test(target)) {
        branch.resolve(Branch.Kind.DIRECT, null, false);
      } else {
        resolveJump(branch, target);
      }
      ++numResolved;
    }
  }

  /** Resolves a branch that must break out of or continue one of the enclosing constructs. */
  private void resolveJump(Branch branch, int target) {
    int innermost = frames.size() - 1;
    for (int i = innermost; i >= 0; i--) {
      Frame frame = frames.get(i);
      Branch.Kind kind;
      if (frame.construct instanceof Loop && frame.construct.entries.test(target)) {
        kind = Branch.Kind.CONTINUE;
      } else if (Shape.entries(frame.follower).test(target)) {
        kind = Branch.Kind.BREAK;
      } else {
        continue;
      }
      boolean labeled = (i != innermost);
      if (labeled) {
        if (frame.construct instanceof Loop loop) {
          loop.labeled = true;
        } else {
          ((Multiple) frame.construct).labeled = true;
        }
      }
      branch.resolve(kind, frame.construct, labeled);
      return;
    }
    throw RelooperException.internal(branch, "no enclosing shape is entered at its target");
  }
}
