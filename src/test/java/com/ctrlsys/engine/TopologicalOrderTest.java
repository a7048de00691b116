package com.ctrlsys.engine;

import com.ctrlsys.api.Block;
import com.ctrlsys.api.ControlSystemException;
import com.ctrlsys.block.Constant;
import org.junit.Test;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    // Only the name matters for ordering
    private Block block(String name) {
        return Constant.of(name, 0.0);
    }

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.builder().build();
        assertEquals(0, order.blockCount());
    }

    @Test
    public void testSingleBlock() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addBlock(block("A"))
                .build();

        assertEquals(1, order.blockCount());
        assertEquals("A", order.block(0).name());
        assertEquals(0, order.topoIndex("A"));
        assertEquals(0, order.childCount(0));
        assertEquals(0, order.parentCount(0));
    }

    @Test
    public void testLinearGraphRegisteredBackwards() {
        // A -> B -> C, registered C, B, A
        TopologicalOrder order = TopologicalOrder.builder()
                .addBlock(block("C")).addBlock(block("B")).addBlock(block("A"))
                .addEdge("A", "B")
                .addEdge("B", "C")
                .build();

        assertEquals(3, order.blockCount());
        assertEquals("A", order.block(0).name());
        assertEquals("B", order.block(1).name());
        assertEquals("C", order.block(2).name());

        // CSR edges
        assertEquals(1, order.childCount(0));
        assertEquals(1, order.childCount(1));
        assertEquals(0, order.childCount(2));
        assertEquals(1, order.child(0, 0));
        assertEquals(2, order.child(1, 0));
        assertEquals(order.childrenStart(1), order.childrenEnd(0));
        assertEquals(2, order.childAt(order.childrenStart(1)));

        assertEquals(0, order.parentCount(0));
        assertEquals(1, order.parentCount(1));
        assertEquals(1, order.parentCount(2));
    }

    @Test
    public void testDiamondGraph() {
        // A -> B, A -> C, B -> D, C -> D
        TopologicalOrder order = TopologicalOrder.builder()
                .addBlock(block("D")).addBlock(block("C")).addBlock(block("B")).addBlock(block("A"))
                .addEdge("A", "B")
                .addEdge("A", "C")
                .addEdge("B", "D")
                .addEdge("C", "D")
                .build();

        int idxA = order.topoIndex("A");
        int idxB = order.topoIndex("B");
        int idxC = order.topoIndex("C");
        int idxD = order.topoIndex("D");

        assertEquals(0, idxA);
        assertTrue(idxD > idxB);
        assertTrue(idxD > idxC);
        assertEquals(2, order.childCount(idxA));
        assertEquals(idxD, order.child(idxB, 0));
        assertEquals(idxD, order.child(idxC, 0));
        assertEquals(2, order.parentCount(idxD));
    }

    @Test
    public void testIndependentBlocksKeepRegistrationOrder() {
        TopologicalOrder order = TopologicalOrder.builder()
                .addBlock(block("x")).addBlock(block("y")).addBlock(block("z"))
                .build();
        assertEquals(java.util.List.of("x", "y", "z"), order.names());
    }

    @Test
    public void testDisjointGraphs() {
        // A -> B, C -> D
        TopologicalOrder order = TopologicalOrder.builder()
                .addBlock(block("B")).addBlock(block("A")).addBlock(block("D")).addBlock(block("C"))
                .addEdge("A", "B")
                .addEdge("C", "D")
                .build();

        assertTrue(order.topoIndex("B") > order.topoIndex("A"));
        assertTrue(order.topoIndex("D") > order.topoIndex("C"));
        assertTrue(order.contains("A"));
        assertFalse(order.contains("E"));
    }

    @Test
    public void testCycleDetectionNamesMember() {
        // A -> B -> C -> A
        try {
            TopologicalOrder.builder()
                    .addBlock(block("A")).addBlock(block("B")).addBlock(block("C"))
                    .addEdge("A", "B")
                    .addEdge("B", "C")
                    .addEdge("C", "A")
                    .build();
            fail("Expected cycle");
        } catch (ControlSystemException e) {
            assertEquals(ControlSystemException.Kind.CYCLE_DETECTED, e.getKind());
            assertTrue(java.util.Set.of("A", "B", "C").contains(e.getBlockName()));
        }
    }

    @Test
    public void testCycleDetectionIgnoresDownstreamBlocks() {
        // S -> P <-> Q -> R ; R and its descendants are blocked but not on the cycle
        try {
            TopologicalOrder.builder()
                    .addBlock(block("R")).addBlock(block("S")).addBlock(block("P")).addBlock(block("Q"))
                    .addEdge("S", "P")
                    .addEdge("P", "Q")
                    .addEdge("Q", "P")
                    .addEdge("Q", "R")
                    .build();
            fail("Expected cycle");
        } catch (ControlSystemException e) {
            assertEquals(ControlSystemException.Kind.CYCLE_DETECTED, e.getKind());
            assertTrue(e.getBlockName().equals("P") || e.getBlockName().equals("Q"));
        }
    }

    @Test
    public void testSelfLoopDetection() {
        try {
            TopologicalOrder.builder()
                    .addBlock(block("A"))
                    .addEdge("A", "A")
                    .build();
            fail("Expected cycle");
        } catch (ControlSystemException e) {
            assertEquals(ControlSystemException.Kind.CYCLE_DETECTED, e.getKind());
            assertEquals("A", e.getBlockName());
        }
    }

    @Test
    public void testDuplicateBlock() {
        try {
            TopologicalOrder.builder()
                    .addBlock(block("A"))
                    .addBlock(block("A"));
            fail("Expected duplicate");
        } catch (ControlSystemException e) {
            assertEquals(ControlSystemException.Kind.DUPLICATE_BLOCK_NAME, e.getKind());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeSourceException() {
        TopologicalOrder.builder()
                .addBlock(block("B"))
                .addEdge("A", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownEdgeTargetException() {
        TopologicalOrder.builder()
                .addBlock(block("A"))
                .addEdge("A", "B");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTopoIndexLookup() {
        TopologicalOrder order = TopologicalOrder.builder().addBlock(block("A")).build();
        order.topoIndex("UNKNOWN");
    }
}
