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

import static com.google.common.truth.Truth.assertThat;
import static com.google.devtools.havlak.loops.LoopSubject.assertThatLoop;
import static org.junit.Assert.assertThrows;

import com.google.devtools.havlak.cfg.ControlFlowGraph;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LoopStructureGraph} and {@link Loop}. */
@RunWith(JUnit4.class)
public class LoopStructureGraphTest {

  @Test
  public void mix_masksTo28BitsBeforeShifting() {
    assertThat(LoopStructureGraph.mix(0, 0)).isEqualTo(0);
    assertThat(LoopStructureGraph.mix(1, 1)).isEqualTo(3);
    assertThat(LoopStructureGraph.mix(-1, 0)).isEqualTo(0x1ffffffe);
    assertThat(LoopStructureGraph.mix(0x10000000, 5)).isEqualTo(5);
  }

  @Test
  public void mix_wrapsAround32Bits() {
    assertThat(LoopStructureGraph.mix(0x0fffffff, Integer.MAX_VALUE)).isEqualTo(-1610612739);
  }

  @Test
  public void newGraph_containsOnlyTheRoot() {
    LoopStructureGraph lsg = new LoopStructureGraph();
    Loop root = lsg.getRoot();

    assertThat(lsg.getNumLoops()).isEqualTo(1);
    assertThat(lsg.getLoops()).containsExactly(root);
    assertThat(root.isRoot()).isTrue();
    assertThat(root.isReducible()).isTrue();
    assertThat(root.getCounter()).isEqualTo(0);
    assertThat(root.getHeader()).isNull();
    assertThat(root.getParent()).isNull();
    assertThatLoop(root).hasLevels(0, 0);
  }

  @Test
  public void checksum_rootOnlyBaseline() {
    LoopStructureGraph lsg = new LoopStructureGraph();

    assertThat(lsg.getRoot().checksum()).isEqualTo(12);
    assertThat(lsg.checksum()).isEqualTo(40);
    assertThat(new LoopStructureGraph().checksum()).isEqualTo(lsg.checksum());
  }

  @Test
  public void createNewLoop_handsOutIncreasingCountersWithoutRegistering() {
    LoopStructureGraph lsg = new LoopStructureGraph();
    Loop first = lsg.createNewLoop();
    Loop second = lsg.createNewLoop();

    assertThat(first.getCounter()).isEqualTo(1);
    assertThat(second.getCounter()).isEqualTo(2);
    assertThat(first.isRoot()).isFalse();
    assertThat(lsg.getNumLoops()).isEqualTo(1);

    lsg.addLoop(second);
    lsg.addLoop(first);
    assertThat(lsg.getLoops()).containsExactly(lsg.getRoot(), second, first).inOrder();
  }

  @Test
  public void addLoop_rejectsTheRoot() {
    LoopStructureGraph lsg = new LoopStructureGraph();

    assertThrows(IllegalArgumentException.class, () -> lsg.addLoop(lsg.getRoot()));
  }

  @Test
  public void setHeader_addsHeaderAsFirstMember() {
    ControlFlowGraph cfg = new ControlFlowGraph();
    LoopStructureGraph lsg = new LoopStructureGraph();
    Loop loop = lsg.createNewLoop();

    loop.setHeader(cfg.createNode("h", 4));
    loop.addNode(cfg.createNode("b", 9));

    assertThatLoop(loop).hasHeaderId(4);
    assertThatLoop(loop).hasBlockIdsThat().containsExactly(4, 9).inOrder();
    assertThrows(IllegalStateException.class, () -> loop.setHeader(cfg.createNode("x", 1)));
  }

  @Test
  public void setParent_linksBothWaysOnce() {
    LoopStructureGraph lsg = new LoopStructureGraph();
    Loop outer = lsg.createNewLoop();
    Loop inner = lsg.createNewLoop();

    inner.setParent(outer);

    assertThatLoop(inner).hasParent(outer);
    assertThatLoop(outer).hasChildCountersThat().containsExactly(2);
    assertThrows(IllegalStateException.class, () -> inner.setParent(lsg.createNewLoop()));
    assertThrows(IllegalArgumentException.class, () -> outer.setParent(outer));
    assertThrows(IllegalArgumentException.class, () -> lsg.getRoot().setParent(outer));
  }

  @Test
  public void checksum_coversHeaderMembersAndChildren() {
    ControlFlowGraph cfg = new ControlFlowGraph();
    LoopStructureGraph lsg = new LoopStructureGraph();
    Loop outer = lsg.createNewLoop();
    outer.setHeader(cfg.createNode("a", 0));
    outer.addNode(cfg.createNode("d", 3));
    Loop inner = lsg.createNewLoop();
    inner.setHeader(cfg.createNode("b", 1));
    inner.addNode(cfg.createNode("c", 2));
    inner.setParent(outer);

    // 2, then root 0, reducible 1, levels 0 0, header 1, members 1 2.
    assertThat(inner.checksum()).isEqualTo(296);
    // 1, then 0 1 0 0, header 0, members 0 3, child 296.
    assertThat(outer.checksum()).isEqualTo(622);

    inner.setReducible(false);
    assertThat(inner.checksum()).isEqualTo(264);
  }

  @Test
  public void calculateNestingLevels_linksTopLevelLoopsAndAssignsLevels() {
    ControlFlowGraph cfg = new ControlFlowGraph();
    LoopStructureGraph lsg = new LoopStructureGraph();
    Loop l1 = newLoop(lsg, cfg, 1);
    Loop l2 = newLoop(lsg, cfg, 2);
    Loop l3 = newLoop(lsg, cfg, 3);
    Loop l4 = newLoop(lsg, cfg, 4);
    l3.setParent(l2);
    l2.setParent(l1);

    lsg.calculateNestingLevels();

    Loop root = lsg.getRoot();
    assertThatLoop(root).hasChildCountersThat().containsExactly(1, 4).inOrder();
    assertThatLoop(l1).hasParent(root);
    assertThatLoop(l4).hasParent(root);
    assertThatLoop(root).hasLevels(3, 0);
    assertThatLoop(l1).hasLevels(2, 1);
    assertThatLoop(l2).hasLevels(1, 2);
    assertThatLoop(l3).hasLevels(0, 3);
    assertThatLoop(l4).hasLevels(0, 1);
    assertThat(root.isRoot()).isTrue();
    assertThat(l3.isRoot()).isFalse();
    assertThat(l4.isRoot()).isFalse();
  }

  @Test
  public void calculateNestingLevels_isIdempotent() {
    ControlFlowGraph cfg = new ControlFlowGraph();
    LoopStructureGraph lsg = new LoopStructureGraph();
    Loop l1 = newLoop(lsg, cfg, 1);
    newLoop(lsg, cfg, 2).setParent(l1);

    lsg.calculateNestingLevels();
    int checksum = lsg.checksum();
    lsg.calculateNestingLevels();

    assertThat(lsg.checksum()).isEqualTo(checksum);
    assertThatLoop(lsg.getRoot()).hasChildCountersThat().containsExactly(1);
  }

  @Test
  public void calculateNestingLevels_rootOnly() {
    LoopStructureGraph lsg = new LoopStructureGraph();

    lsg.calculateNestingLevels();

    assertThatLoop(lsg.getRoot()).hasLevels(0, 0);
    assertThat(lsg.checksum()).isEqualTo(40);
  }

  private static Loop newLoop(LoopStructureGraph lsg, ControlFlowGraph cfg, int headerId) {
    Loop loop = lsg.createNewLoop();
    loop.setHeader(cfg.createNode("bb" + headerId, headerId));
    lsg.addLoop(loop);
    return loop;
  }
}
