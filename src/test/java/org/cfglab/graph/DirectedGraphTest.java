package org.cfglab.graph;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class DirectedGraphTest {

    private DirectedGraph<String> graphOf(String... vertices) {
        DirectedGraph<String> g = new DirectedGraph<>();
        for (String v : vertices) {
            g.addVertex(v);
        }
        return g;
    }

    @Test
    public void emptyGraphHasNoVerticesOrEdges() {
        DirectedGraph<String> g = new DirectedGraph<>();
        assertEquals(0, g.vertexCount());
        assertEquals(0, g.edgeCount());
        assertFalse(g.vertices().iterator().hasNext());
    }

    @Test
    public void addVertexIsIdempotent() {
        DirectedGraph<String> g = new DirectedGraph<>();
        assertTrue(g.addVertex("A"));
        assertFalse(g.addVertex("A"));
        assertEquals(1, g.vertexCount());
    }

    @Test(expected = NullPointerException.class)
    public void addNullVertexIsRejected() {
        new DirectedGraph<String>().addVertex(null);
    }

    @Test
    public void addEdgeRejectsDuplicates() {
        DirectedGraph<String> g = graphOf("A", "B");
        assertTrue(g.addEdge("A", "B"));
        assertFalse(g.addEdge("A", "B"));
        assertEquals(1, g.edgeCount());
        assertTrue(g.hasEdge("A", "B"));
        assertFalse(g.hasEdge("B", "A"));
    }

    @Test
    public void addEdgeToMissingVertexNamesTheVertex() {
        DirectedGraph<String> g = graphOf("A");
        try {
            g.addEdge("A", "Z");
            fail("expected VertexNotFoundException");
        } catch (VertexNotFoundException e) {
            assertEquals("Z", e.getVertex());
            assertTrue(e.getMessage().contains("Z"));
        }
    }

    @Test(expected = VertexNotFoundException.class)
    public void addEdgeFromMissingVertexFails() {
        graphOf("B").addEdge("A", "B");
    }

    @Test
    public void selfLoopIsAddedExactlyOnce() {
        DirectedGraph<String> g = graphOf("A");
        assertTrue(g.addEdge("A", "A"));
        assertFalse(g.addEdge("A", "A"));
        assertTrue(g.hasEdge("A", "A"));
        assertEquals(1, g.edgeCount());
        assertEquals(List.of("A"), g.neighbors("A"));
    }

    @Test
    public void hasEdgeNeverThrows() {
        DirectedGraph<String> g = graphOf("A");
        assertFalse(g.hasEdge("missing", "A"));
        assertFalse(g.hasEdge("A", "missing"));
        assertFalse(g.hasEdge(null, "A"));
    }

    @Test
    public void removeVertexCascadesToIncidentEdges() {
        DirectedGraph<String> g = graphOf("A", "B", "C");
        g.addEdge("A", "B");
        g.addEdge("B", "C");
        g.addEdge("C", "B");
        g.addEdge("B", "B");
        g.addEdge("A", "C");

        assertTrue(g.removeVertex("B"));
        assertEquals(2, g.vertexCount());
        assertEquals(1, g.edgeCount());
        assertTrue(g.hasEdge("A", "C"));
        assertEquals(List.of("C"), g.neighbors("A"));
        assertTrue(g.neighbors("C").isEmpty());
    }

    @Test
    public void removeMissingVertexReturnsFalse() {
        DirectedGraph<String> g = graphOf("A");
        assertFalse(g.removeVertex("B"));
        assertEquals(1, g.vertexCount());
    }

    @Test
    public void removeEdge() {
        DirectedGraph<String> g = graphOf("A", "B");
        g.addEdge("A", "B");
        assertTrue(g.removeEdge("A", "B"));
        assertFalse(g.removeEdge("A", "B"));
        assertFalse(g.hasEdge("A", "B"));
        assertEquals(0, g.edgeCount());
    }

    @Test(expected = VertexNotFoundException.class)
    public void removeEdgeWithMissingEndpointFails() {
        graphOf("A").removeEdge("A", "B");
    }

    @Test(expected = VertexNotFoundException.class)
    public void neighborsOfMissingVertexFails() {
        graphOf("A").neighbors("B");
    }

    @Test
    public void neighborsKeepInsertionOrderAndAreSnapshots() {
        DirectedGraph<String> g = graphOf("A", "B", "C", "D");
        g.addEdge("A", "C");
        g.addEdge("A", "B");
        g.addEdge("A", "D");

        List<String> neighbors = g.neighbors("A");
        assertEquals(List.of("C", "B", "D"), neighbors);

        neighbors.clear();
        assertEquals(3, g.neighbors("A").size());
    }

    @Test
    public void verticesCanBeIteratedRepeatedly() {
        DirectedGraph<String> g = graphOf("A", "B", "C");
        List<String> first = new ArrayList<>();
        g.vertices().forEach(first::add);
        List<String> second = new ArrayList<>();
        g.vertices().forEach(second::add);

        assertEquals(List.of("A", "B", "C"), first);
        assertEquals(first, second);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void verticesViewIsReadOnly() {
        DirectedGraph<String> g = graphOf("A");
        g.vertices().iterator().remove();
    }

    @Test
    public void edgeCountIsSumOfOutDegrees() {
        DirectedGraph<Integer> g = new DirectedGraph<>();
        for (int i = 0; i < 5; i++) {
            g.addVertex(i);
        }
        int expected = 0;
        for (int i = 0; i < 5; i++) {
            for (int j = 0; j < 5; j++) {
                if ((i + j) % 2 == 0) {
                    g.addEdge(i, j);
                    expected++;
                }
            }
        }
        int sum = 0;
        for (Integer v : g.vertices()) {
            sum += g.neighbors(v).size();
        }
        assertEquals(expected, g.edgeCount());
        assertEquals(sum, g.edgeCount());
    }

    @Test
    public void toStringSummarizesCounts() {
        DirectedGraph<String> g = graphOf("A", "B");
        g.addEdge("A", "B");
        assertTrue(g.toString().startsWith("Vertices: 2 Edges: 1"));
    }
}
