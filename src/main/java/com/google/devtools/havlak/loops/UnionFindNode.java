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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.devtools.havlak.cfg.BasicBlock;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Disjoint-set element wrapping one numbered block. The loop finder uses these to collapse every
 * loop it has already discovered into the representative of its header.
 */
final class UnionFindNode {
  private final BasicBlock bb;
  private final int dfsNumber;
  private UnionFindNode parent;
  @Nullable private Loop loop;

  UnionFindNode(BasicBlock bb, int dfsNumber) {
    this.bb = checkNotNull(bb);
    this.dfsNumber = dfsNumber;
    this.parent = this;
  }

  /**
   * Returns the representative of this node's set.
   *
   * <p>Path compression is one-pass and selective: only nodes whose parent is not already a direct
   * child of the representative are repointed. Inner loops are collapsed once, deep nests still
   * cost a walk.
   */
  UnionFindNode find() {
    List<UnionFindNode> nodeList = new ArrayList<>();

    UnionFindNode node = this;
    while (node != node.parent) {
      if (node.parent != node.parent.parent) {
        nodeList.add(node);
      }
      node = node.parent;
    }

    for (UnionFindNode visited : nodeList) {
      visited.parent = node.parent;
    }
    return node;
  }

  /** Makes {@code other} the parent of this node. No ranking; the caller picks the direction. */
  void union(UnionFindNode other) {
    parent = checkNotNull(other);
  }

  BasicBlock getBasicBlock() {
    return bb;
  }

  int getDfsNumber() {
    return dfsNumber;
  }

  @Nullable
  Loop getLoop() {
    return loop;
  }

  void setLoop(Loop loop) {
    checkState(this.loop == null, "Block %s already heads %s", bb, this.loop);
    this.loop = checkNotNull(loop);
  }

  @Override
  public String toString() {
    return "UnionFindNode(" + dfsNumber + ", " + bb.getId() + ")";
  }
}
