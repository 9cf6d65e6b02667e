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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a {@link ControlFlowGraph}. A block only knows its label, its numeric id and the
 * ordered lists of its predecessors and successors.
 *
 * <p>Blocks are created by {@link ControlFlowGraph#createNode} and compare by identity: two blocks
 * with the same id that belong to different graphs are different blocks.
 */
public final class BasicBlock {
  private final String name;
  private final int id;
  private final List<BasicBlock> inEdges = new ArrayList<>();
  private final List<BasicBlock> outEdges = new ArrayList<>();

  BasicBlock(String name, int id) {
    this.name = checkNotNull(name, "name");
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public int getId() {
    return id;
  }

  /** Predecessors, in the order the incoming edges were created. */
  public List<BasicBlock> getInEdges() {
    return Collections.unmodifiableList(inEdges);
  }

  /** Successors, in the order the outgoing edges were created. */
  public List<BasicBlock> getOutEdges() {
    return Collections.unmodifiableList(outEdges);
  }

  public int getNumPred() {
    return inEdges.size();
  }

  public int getNumSucc() {
    return outEdges.size();
  }

  void addInEdge(BasicBlock from) {
    inEdges.add(from);
  }

  void addOutEdge(BasicBlock to) {
    outEdges.add(to);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("id", id)
        .add("preds", inEdges.size())
        .add("succs", outEdges.size())
        .toString();
  }
}
