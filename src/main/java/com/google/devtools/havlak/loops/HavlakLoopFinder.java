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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.havlak.cfg.BasicBlock;
import com.google.devtools.havlak.cfg.ControlFlowGraph;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the loops of a {@link ControlFlowGraph} and builds its loop forest in a {@link
 * LoopStructureGraph}, using Havlak's algorithm.
 *
 * <p>The algorithm is derived from Tarjan's interval finding: one depth-first numbering, one
 * classification of every incoming edge as backedge or not, then a single pass over the headers in
 * reverse preorder that collapses each loop body into its header with union-find. Inner headers
 * come later in preorder than the headers that enclose them, so inner loops always exist by the
 * time their parent is built. A loop is irreducible when its body can be entered from a block that
 * is not a descendant of the header.
 *
 * <p>Variable names follow the paper: {@code w} is the candidate header, {@code x} a block taken
 * from the work list, {@code y'} the representative of one of its predecessors.
 *
 * <p>See Paul Havlak, "Nesting of reducible and irreducible loops", ACM TOPLAS 19(4), 1997.
 *
 * <p>A finder only reads the graph. It is bound to one forest and runs at most once.
 */
public final class HavlakLoopFinder {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Safeguard against pathological algorithm behavior. */
  public static final int MAX_NON_BACK_PREDS = 32 * 1024;

  /** How a numbered block relates to the loops headed by it. */
  enum BlockType {
    /** A regular block. */
    NONHEADER,
    /** Header of a reducible loop. */
    REDUCIBLE,
    /** A block whose only loop is its own self edge. */
    SELF,
    /** Header of an irreducible loop. */
    IRREDUCIBLE
  }

  private final ControlFlowGraph cfg;
  private final LoopStructureGraph lsg;
  private final int maxNonBackPreds;

  private boolean done = false;
  private boolean degenerated = false;

  public HavlakLoopFinder(ControlFlowGraph cfg, LoopStructureGraph lsg) {
    this(cfg, lsg, MAX_NON_BACK_PREDS);
  }

  @VisibleForTesting
  HavlakLoopFinder(ControlFlowGraph cfg, LoopStructureGraph lsg, int maxNonBackPreds) {
    checkArgument(maxNonBackPreds > 0, "maxNonBackPreds must be positive: %s", maxNonBackPreds);
    this.cfg = checkNotNull(cfg, "cfg");
    this.lsg = checkNotNull(lsg, "lsg");
    this.maxNonBackPreds = maxNonBackPreds;
  }

  /** Convenience for {@code new HavlakLoopFinder(cfg, lsg).findLoops()}. */
  @CanIgnoreReturnValue
  public static int findLoops(ControlFlowGraph cfg, LoopStructureGraph lsg) {
    return new HavlakLoopFinder(cfg, lsg).findLoops();
  }

  /** Whether the run gave up because some block had too many non-backedge predecessors. */
  public boolean hasDegenerated() {
    return degenerated;
  }

  /**
   * Finds all loops and records them in the bound forest.
   *
   * <p>Top-level loops are left without a parent and the root without children; call {@link
   * LoopStructureGraph#calculateNestingLevels()} before walking the forest from its root.
   *
   * @return the number of loops in the forest, root included; 0 if the graph is empty or the
   *     analysis degenerated (see {@link #hasDegenerated()})
   */
  @CanIgnoreReturnValue
  public int findLoops() {
    checkState(!done, "Loops were already computed into this forest");
    done = true;

    if (cfg.getStartNode() == null) {
      return 0;
    }

    // Step a: depth-first traversal and numbering. Unreached blocks get no number and take no
    // further part.
    DepthFirstNumbering dfs = DepthFirstNumbering.number(cfg);
    int size = dfs.size();

    UnionFindNode[] nodes = new UnionFindNode[size];
    List<List<Integer>> nonBackPreds = new ArrayList<>(size);
    List<List<Integer>> backPreds = new ArrayList<>(size);
    BlockType[] types = new BlockType[size];
    Arrays.fill(types, BlockType.NONHEADER);
    for (int w = 0; w < size; w++) {
      nodes[w] = new UnionFindNode(dfs.getBlock(w), w);
      nonBackPreds.add(new ArrayList<>());
      backPreds.add(new ArrayList<>());
    }

    // Step b: a backedge comes from a descendant in the DFS tree, a non-backedge from a
    // non-descendant (following Tarjan).
    for (int w = 0; w < size; w++) {
      for (BasicBlock nodeV : nodes[w].getBasicBlock().getInEdges()) {
        int v = dfs.getNumber(nodeV);
        if (v == DepthFirstNumbering.UNVISITED) {
          continue;
        }
        if (dfs.isAncestor(w, v)) {
          backPreds.get(w).add(v);
        } else {
          nonBackPreds.get(w).add(v);
        }
      }
    }

    // Step c: visit candidate headers in reverse preorder. For a header w, chase backward from the
    // sources of its backedges, collecting the body of the loop in the pool (P in the paper).
    int irreducibleLoops = 0;
    for (int w = size - 1; w >= 0; w--) {
      Set<UnionFindNode> nodePool = new LinkedHashSet<>();

      // Step d
      for (int v : backPreds.get(w)) {
        if (v != w) {
          nodePool.add(nodes[v].find());
        } else {
          types[w] = BlockType.SELF;
        }
      }

      Deque<UnionFindNode> workList = new ArrayDeque<>(nodePool);
      if (!nodePool.isEmpty()) {
        types[w] = BlockType.REDUCIBLE;
      }

      while (!workList.isEmpty()) {
        UnionFindNode x = workList.poll();

        // Step e: the main difference from Tarjan's method. A predecessor y' of the body that is
        // not a descendant of w is another entry into the loop that avoids w, so the loop is
        // irreducible. The entry is passed on to w so that enclosing headers see it as well.
        List<Integer> xPreds = nonBackPreds.get(x.getDfsNumber());
        if (xPreds.size() > maxNonBackPreds) {
          logger.atWarning().log(
              "Loop analysis degenerated at block %s: %d non-backedge predecessors exceed %d",
              x.getBasicBlock().getId(), xPreds.size(), maxNonBackPreds);
          degenerated = true;
          return 0;
        }

        for (int i = 0; i < xPreds.size(); i++) {
          UnionFindNode ydash = nodes[xPreds.get(i)].find();

          if (!dfs.isAncestor(w, ydash.getDfsNumber())) {
            types[w] = BlockType.IRREDUCIBLE;
            nonBackPreds.get(w).add(ydash.getDfsNumber());
          } else if (ydash.getDfsNumber() != w && nodePool.add(ydash)) {
            workList.add(ydash);
          }
        }
      }

      // Collapse the body into w and link the loop descriptor in.
      if (!nodePool.isEmpty() || types[w] == BlockType.SELF) {
        Loop loop = lsg.createNewLoop();
        loop.setHeader(nodes[w].getBasicBlock());
        loop.setReducible(types[w] != BlockType.IRREDUCIBLE);
        if (types[w] == BlockType.IRREDUCIBLE) {
          irreducibleLoops++;
        }
        nodes[w].setLoop(loop);

        for (UnionFindNode node : nodePool) {
          node.union(nodes[w]);

          // Nested loops are linked, not flattened.
          if (node.getLoop() != null) {
            node.getLoop().setParent(loop);
          } else {
            loop.addNode(node.getBasicBlock());
          }
        }
        lsg.addLoop(loop);
      }
    }

    logger.atFine().log(
        "Found %d loops (%d irreducible) in %d of %d blocks",
        lsg.getNumLoops() - 1, irreducibleLoops, size, cfg.getNumNodes());
    return lsg.getNumLoops();
  }
}
