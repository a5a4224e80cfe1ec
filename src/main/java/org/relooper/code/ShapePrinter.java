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

import org.jspecify.annotations.Nullable;
import org.relooper.code.Shape.Loop;
import org.relooper.code.Shape.Multiple;
import org.relooper.code.Shape.Simple;
import org.relooper.util.StringUtil;

/**
 * Static-only class that renders Shape trees as text.
 *
 * <p>{@link #print} produces a structured pseudocode listing with one line per block, branch, and
 * construct, e.g.
 *
 * <pre>
 * block 1
 *   if c -> 2 direct
 *   -> 3 direct
 * multiple {
 *   case 2:
 *     block 2
 *       -> 4 direct
 *   case 3:
 *     block 3
 *       -> 4 direct
 * }
 * block 4
 * </pre>
 *
 * <p>{@link #summarize} produces a one-line description of the structure alone, e.g. {@code "1 ;
 * multiple{2: 2 | 3: 3} ; 4"}.
 */
public class ShapePrinter {

  private ShapePrinter() {}

  /** Returns a multi-line listing of {@code shape} and the shapes that follow it. */
  public static String print(@Nullable Shape shape) {
    StringBuilder sb = new StringBuilder();
    printChain(sb, shape, 0);
    return sb.toString();
  }

  private static void printChain(StringBuilder sb, @Nullable Shape shape, int depth) {
    for (Shape s = shape; s != null; s = s.next) {
      String indent = StringUtil.indent(depth);
      switch (s.type()) {
        case SIMPLE -> {
          Block block = ((Simple) s).block;
          sb.append(indent).append("block ").append(block.id);
          if (block.code() != null) {
            sb.append(": ").append(block.code());
          }
          if (block.switchOn() != null) {
            sb.append(" switch ").append(block.switchOn());
          }
          sb.append("\n");
          for (Branch branch : block.branches) {
            sb.append(indent).append("  ");
            printBranch(sb, branch, block.switchOn() != null);
            sb.append("\n");
          }
        }
        case LOOP -> {
          Loop loop = (Loop) s;
          sb.append(indent).append(loop.labeled ? loop.label() + ": " : "").append("loop {\n");
          printChain(sb, loop.inner, depth + 1);
          sb.append(indent).append("}\n");
        }
        case MULTIPLE -> {
          Multiple multiple = (Multiple) s;
          sb.append(indent)
              .append(multiple.labeled ? multiple.label() + ": " : "")
              .append(multiple.dispatches ? "dispatch {\n" : "multiple {\n");
          for (Shape.Arm arm : multiple.arms) {
            sb.append(indent).append("  case ").append(arm.entry().id).append(":\n");
            printChain(sb, arm.inner(), depth + 2);
          }
          sb.append(indent).append("}\n");
        }
      }
    }
  }

  private static void printBranch(StringBuilder sb, Branch branch, boolean inSwitch) {
    Object condition = branch.condition();
    if (inSwitch) {
      sb.append(condition == null ? "default " : "case " + condition + " ");
    } else if (condition != null) {
      sb.append("if ").append(condition).append(" ");
    }
    sb.append("-> ").append(branch.targetId).append(" ").append(branch.resolutionToString());
    if (branch.code() != null) {
      sb.append(" with ").append(branch.code());
    }
  }

  /**
   * Returns a one-line summary of the structure of {@code shape} and the shapes that follow it,
   * identifying each Simple by its block id.
   */
  public static String summarize(@Nullable Shape shape) {
    StringBuilder sb = new StringBuilder();
    for (Shape s = shape; s != null; s = s.next) {
      if (s != shape) {
        sb.append(" ; ");
      }
      switch (s.type()) {
        case SIMPLE -> sb.append(((Simple) s).block.id);
        case LOOP -> sb.append("loop{").append(summarize(((Loop) s).inner)).append("}");
        case MULTIPLE -> {
          Multiple multiple = (Multiple) s;
          sb.append(
              StringUtil.joinElements(
                  multiple.dispatches ? "dispatch{" : "multiple{",
                  " | ",
                  "}",
                  multiple.arms.size(),
                  i -> {
                    Shape.Arm arm = multiple.arms.get(i);
                    return arm.entry().id + ": " + summarize(arm.inner());
                  }));
        }
      }
    }
    return sb.toString();
  }
}
