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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Lists;
import com.google.devtools.havlak.cfg.BasicBlock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * One loop of a {@link LoopStructureGraph}: a header, the blocks that belong to this loop and to
 * no nested loop, the nested loops, and an optional enclosing loop.
 *
 * <p>Blocks of nested loops are not repeated here; walk {@link #getChildren()} to collect them.
 */
public final class Loop {
  private final int counter;
  private final List<BasicBlock> basicBlocks = new ArrayList<>();
  private final List<Loop> children = new ArrayList<>();

  @Nullable private Loop parent;
  @Nullable private BasicBlock header;

  private boolean isRoot = false;
  private boolean isReducible = true;
  private int nestingLevel = 0;
  private int depthLevel = 0;

  Loop(int counter) {
    this.counter = counter;
  }

  /** The serial id handed out by the owning {@link LoopStructureGraph}; the root is 0. */
  public int getCounter() {
    return counter;
  }

  /** The entry block, or null for the root. */
  @Nullable
  public BasicBlock getHeader() {
    return header;
  }

  /** Member blocks in insertion order. The header, when set, comes first. */
  public List<BasicBlock> getBasicBlocks() {
    return Collections.unmodifiableList(basicBlocks);
  }

  public List<Loop> getChildren() {
    return Collections.unmodifiableList(children);
  }

  @Nullable
  public Loop getParent() {
    return parent;
  }

  public boolean isRoot() {
    return isRoot;
  }

  public boolean isReducible() {
    return isReducible;
  }

  public int getNestingLevel() {
    return nestingLevel;
  }

  public int getDepthLevel() {
    return depthLevel;
  }

  void addNode(BasicBlock bb) {
    basicBlocks.add(checkNotNull(bb));
  }

  void setHeader(BasicBlock bb) {
    checkState(header == null, "Header of loop %s is already set", counter);
    basicBlocks.add(checkNotNull(bb));
    header = bb;
  }

  void setParent(Loop newParent) {
    checkNotNull(newParent);
    checkArgument(!isRoot, "The root loop cannot be nested");
    checkArgument(newParent != this, "Loop %s cannot contain itself", counter);
    checkState(parent == null, "Loop %s already nested in loop %s", counter, counter(parent));
    parent = newParent;
    newParent.children.add(this);
  }

  void setReducible(boolean isReducible) {
    this.isReducible = isReducible;
  }

  void setNestingLevel(int level) {
    nestingLevel = level;
    if (level == 0 && parent == null && header == null) {
      isRoot = true;
    }
  }

  void setDepthLevel(int level) {
    depthLevel = level;
  }

  /**
   * Structural checksum over the counter, flags, levels, header, members and, recursively, the
   * children. Arithmetic wraps at 32 bits.
   */
  public int checksum() {
    int result = counter;
    result = LoopStructureGraph.mix(result, isRoot ? 1 : 0);
    result = LoopStructureGraph.mix(result, isReducible ? 1 : 0);
    result = LoopStructureGraph.mix(result, nestingLevel);
    result = LoopStructureGraph.mix(result, depthLevel);
    if (header != null) {
      result = LoopStructureGraph.mix(result, header.getId());
    }
    for (BasicBlock bb : basicBlocks) {
      result = LoopStructureGraph.mix(result, bb.getId());
    }
    for (Loop child : children) {
      result = LoopStructureGraph.mix(result, child.checksum());
    }
    return result;
  }

  private static String counter(@Nullable Loop loop) {
    return loop == null ? "null" : String.valueOf(loop.counter);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("counter", counter)
        .add("header", header == null ? null : header.getId())
        .add("blocks", Lists.transform(basicBlocks, BasicBlock::getId))
        .add("children", Lists.transform(children, Loop::getCounter))
        .add("root", isRoot)
        .add("reducible", isReducible)
        .add("nesting", nestingLevel)
        .add("depth", depthLevel)
        .toString();
  }
}
