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
package com.google.devtools.havlak.cfg;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * An immutable directed edge between two blocks of the same {@link ControlFlowGraph}.
 *
 * <p>Creating an edge is what links the blocks: the target is appended to the source's successors,
 * the source to the target's predecessors, and the edge is registered with the graph.
 */
public final class BasicBlockEdge {
  private final BasicBlock from;
  private final BasicBlock to;

  private BasicBlockEdge(BasicBlock from, BasicBlock to) {
    this.from = from;
    this.to = to;
  }

  /**
   * Creates the edge {@code from -> to} in {@code cfg}.
   *
   * @throws IllegalArgumentException if either endpoint was not created by {@code cfg}
   */
  @CanIgnoreReturnValue
  public static BasicBlockEdge create(ControlFlowGraph cfg, BasicBlock from, BasicBlock to) {
    checkNotNull(cfg, "cfg");
    checkNotNull(from, "from");
    checkNotNull(to, "to");
    checkArgument(cfg.containsBlock(from), "Source block %s is not part of this graph", from);
    checkArgument(cfg.containsBlock(to), "Target block %s is not part of this graph", to);

    BasicBlockEdge edge = new BasicBlockEdge(from, to);
    from.addOutEdge(to);
    to.addInEdge(from);
    cfg.addEdge(edge);
    return edge;
  }

  public BasicBlock getFrom() {
    return from;
  }

  public BasicBlock getTo() {
    return to;
  }

  @Override
  public String toString() {
    return from.getId() + " -> " + to.getId();
  }
}
