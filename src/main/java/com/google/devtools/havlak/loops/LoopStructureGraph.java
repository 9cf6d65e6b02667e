// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package com.google.devtools.havlak.loops;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * The loop forest of one control-flow graph, rooted at a synthetic loop that stands for the whole
 * procedure.
 *
 * <p>Two levels are kept per loop once {@link #calculateNestingLevels()} has run. The nesting level
 * is the height of the loop's subtree, the depth level its distance from the root:
 *
 * <pre>
 * loop        nesting level    depth
 * ----------------------------------------
 * root        3                0
 *   loop-1    2                1
 *     loop-2  1                2
 *       loop-3  0              3
 *     loop-4  0                2
 * </pre>
 *
 * <p>Loop discovery only links nested loops to their enclosing loop. Top-level loops get the root
 * as parent, and the root its children, when {@link #calculateNestingLevels()} runs; do that
 * before walking the forest down from {@link #getRoot()}.
 *
 * <p>The root is always the first element of {@link #getLoops()}; the others follow in the order
 * they were discovered.
 */
public final class LoopStructureGraph {
  private final List<Loop> loops = new ArrayList<>();
  private final Loop root = new Loop(0);
  private int loopCounter = 1;

  public LoopStructureGraph() {
    root.setNestingLevel(0);
    loops.add(root);
  }

  /** Returns a fresh loop with the next serial id. The loop is not registered until added. */
  public Loop createNewLoop() {
    return new Loop(loopCounter++);
  }

  public void addLoop(Loop loop) {
    checkNotNull(loop);
    checkArgument(!loop.isRoot(), "The root loop is registered at construction");
    loops.add(loop);
  }

  public int getNumLoops() {
    return loops.size();
  }

  public Loop getRoot() {
    return root;
  }

  /** All loops, root first. */
  public List<Loop> getLoops() {
    return Collections.unmodifiableList(loops);
  }

  /**
   * Deterministic checksum of the whole forest: the loop count, every loop's checksum in storage
   * order, then the root's checksum once more.
   */
  public int checksum() {
    int result = loops.size();
    for (Loop loop : loops) {
      result = mix(result, loop.checksum());
    }
    return mix(result, root.checksum());
  }

  /**
   * Links every top-level loop under the root and assigns nesting and depth levels to all loops.
   *
   * <p>Loop discovery leaves these levels at zero. Running this pass changes the checksum.
   */
  public void calculateNestingLevels() {
    for (Loop loop : loops) {
      if (!loop.isRoot() && loop.getParent() == null) {
        loop.setParent(root);
      }
    }

    // Post-order walk with an explicit stack; depths are assigned on the way down.
    Deque<Loop> stack = new ArrayDeque<>();
    List<Loop> postOrder = new ArrayList<>(loops.size());
    root.setDepthLevel(0);
    stack.push(root);
    while (!stack.isEmpty()) {
      Loop loop = stack.pop();
      postOrder.add(loop);
      for (Loop child : loop.getChildren()) {
        child.setDepthLevel(loop.getDepthLevel() + 1);
        stack.push(child);
      }
    }
    for (int i = postOrder.size() - 1; i >= 0; i--) {
      Loop loop = postOrder.get(i);
      int height = 0;
      for (Loop child : loop.getChildren()) {
        height = Math.max(height, child.getNestingLevel() + 1);
      }
      loop.setNestingLevel(height);
    }
  }

  @VisibleForTesting
  static int mix(int existing, int value) {
    return ((existing & 0x0fffffff) << 1) + value;
  }
}
