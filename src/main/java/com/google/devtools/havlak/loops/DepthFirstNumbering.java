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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.devtools.havlak.cfg.BasicBlock;
import com.google.devtools.havlak.cfg.ControlFlowGraph;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Preorder numbering of the depth-first spanning tree of a control-flow graph, starting at its
 * start node and following successors in edge order.
 *
 * <p>Besides the number of every reached block, the numbering records for each number {@code w}
 * the largest number in its subtree, {@code last[w]}. The descendants of {@code w} are then exactly
 * the numbers in {@code [w, last[w]]}, which makes {@link #isAncestor} constant time.
 *
 * <p>Blocks that cannot be reached from the start node get no number.
 */
final class DepthFirstNumbering {
  static final int UNVISITED = -1;

  private final Map<BasicBlock, Integer> numbers;
  private final BasicBlock[] blocks;
  private final int[] last;
  private final int size;

  private DepthFirstNumbering(Map<BasicBlock, Integer> numbers, BasicBlock[] blocks, int[] last) {
    this.numbers = numbers;
    this.blocks = blocks;
    this.last = last;
    this.size = numbers.size();
  }

  /** Numbers every block of {@code cfg} reachable from its start node. */
  static DepthFirstNumbering number(ControlFlowGraph cfg) {
    BasicBlock start = cfg.getStartNode();
    checkArgument(start != null, "Cannot number an empty graph");

    int capacity = cfg.getNumNodes();
    Map<BasicBlock, Integer> numbers = new HashMap<>();
    BasicBlock[] blocks = new BasicBlock[capacity];
    int[] last = new int[capacity];

    // Each frame is a block and the index of the next successor to look at. A block is numbered
    // when pushed and its subtree is complete when popped.
    Deque<Frame> stack = new ArrayDeque<>();
    int current = 0;
    numbers.put(start, current);
    blocks[current] = start;
    current++;
    stack.push(new Frame(start));

    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      List<BasicBlock> successors = frame.block.getOutEdges();
      if (frame.nextSuccessor < successors.size()) {
        BasicBlock target = successors.get(frame.nextSuccessor++);
        if (!numbers.containsKey(target)) {
          numbers.put(target, current);
          blocks[current] = target;
          current++;
          stack.push(new Frame(target));
        }
      } else {
        stack.pop();
        last[numbers.get(frame.block)] = current - 1;
      }
    }
    return new DepthFirstNumbering(numbers, blocks, last);
  }

  /** The number of blocks reached from the start node. */
  int size() {
    return size;
  }

  /** The preorder number of {@code block}, or {@link #UNVISITED} if it was not reached. */
  int getNumber(BasicBlock block) {
    Integer number = numbers.get(checkNotNull(block));
    return number == null ? UNVISITED : number;
  }

  BasicBlock getBlock(int number) {
    checkElementIndex(number, size);
    return blocks[number];
  }

  /** The largest number in the subtree rooted at {@code number}. */
  int getLast(int number) {
    checkElementIndex(number, size);
    return last[number];
  }

  /** Whether {@code w} is {@code v} or one of its ancestors in the depth-first spanning tree. */
  boolean isAncestor(int w, int v) {
    return w <= v && v <= last[w];
  }

  private static final class Frame {
    final BasicBlock block;
    int nextSuccessor = 0;

    Frame(BasicBlock block) {
      this.block = block;
    }
  }
}
