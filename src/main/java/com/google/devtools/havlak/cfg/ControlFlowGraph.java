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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A minimal control-flow graph: the blocks keyed by id in registration order, the edges in
 * creation order, and a start node.
 *
 * <p>The graph is append-only. The start node is the first block ever registered, whatever its id,
 * and never changes afterwards.
 */
public final class ControlFlowGraph {
  private final Map<Integer, BasicBlock> basicBlockMap = new LinkedHashMap<>();
  private final List<BasicBlockEdge> edgeList = new ArrayList<>();
  @Nullable private BasicBlock startNode;

  /**
   * Returns the block registered under {@code id}, creating it with label {@code name} if it does
   * not exist yet. The label of the first registration wins.
   */
  @CanIgnoreReturnValue
  public BasicBlock createNode(String name, int id) {
    checkNotNull(name, "name");
    BasicBlock node = basicBlockMap.get(id);
    if (node == null) {
      node = new BasicBlock(name, id);
      basicBlockMap.put(id, node);
      if (startNode == null) {
        startNode = node;
      }
    }
    return node;
  }

  /** Creates the edge between the already registered blocks {@code fromId} and {@code toId}. */
  @CanIgnoreReturnValue
  public BasicBlockEdge createEdge(int fromId, int toId) {
    BasicBlock from = basicBlockMap.get(fromId);
    BasicBlock to = basicBlockMap.get(toId);
    checkArgument(from != null, "No block with id %s", fromId);
    checkArgument(to != null, "No block with id %s", toId);
    return BasicBlockEdge.create(this, from, to);
  }

  /**
   * Registers an edge. Called by {@link BasicBlockEdge#create}, which has already linked the
   * endpoints.
   */
  void addEdge(BasicBlockEdge edge) {
    checkArgument(
        containsBlock(edge.getFrom()) && containsBlock(edge.getTo()),
        "Edge %s connects blocks outside of this graph",
        edge);
    edgeList.add(edge);
  }

  public int getNumNodes() {
    return basicBlockMap.size();
  }

  /** The first registered block, or null while the graph is empty. */
  @Nullable
  public BasicBlock getStartNode() {
    return startNode;
  }

  @Nullable
  public BasicBlock getBasicBlock(int id) {
    return basicBlockMap.get(id);
  }

  /** All blocks, in registration order. */
  public Collection<BasicBlock> getBasicBlocks() {
    return Collections.unmodifiableCollection(basicBlockMap.values());
  }

  /** All edges, in creation order. */
  public List<BasicBlockEdge> getEdges() {
    return Collections.unmodifiableList(edgeList);
  }

  public boolean containsBlock(BasicBlock block) {
    return basicBlockMap.get(block.getId()) == block;
  }

  public BasicBlock getSrc(BasicBlockEdge edge) {
    return edge.getFrom();
  }

  public BasicBlock getDst(BasicBlockEdge edge) {
    return edge.getTo();
  }
}
