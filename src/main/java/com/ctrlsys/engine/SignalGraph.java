package com.ctrlsys.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * The complete wiring of a control system, for diagnostics and visualisation.
 *
 * Unlike {@link TopologicalOrder} this graph keeps every producer -> consumer
 * edge, including those into blocks that declare a delay, and may therefore
 * contain cycles. It is a read-only projection and is never consulted when
 * ordering blocks.
 */
public final class SignalGraph {
    private final List<String> blocks;
    private final List<Edge> edges;

    public SignalGraph(List<String> blocks, List<Edge> edges) {
        this.blocks = List.copyOf(blocks);
        this.edges = List.copyOf(edges);
    }

    /** Block names in registration order. */
    public List<String> blocks() {
        return blocks;
    }

    public List<Edge> edges() {
        return edges;
    }

    /** Edges leaving the given block. */
    public List<Edge> edgesFrom(String producer) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges)
            if (e.producer().equals(producer))
                out.add(e);
        return out;
    }

    /** Edges entering the given block. */
    public List<Edge> edgesTo(String consumer) {
        List<Edge> out = new ArrayList<>();
        for (Edge e : edges)
            if (e.consumer().equals(consumer))
                out.add(e);
        return out;
    }

    /**
     * Renders the graph in Graphviz DOT. Edges are labelled with the signal
     * name; edges broken by a delay are dashed.
     */
    public String toDot() {
        StringBuilder sb = new StringBuilder(256 + edges.size() * 48);
        sb.append("digraph {\n");
        for (int i = 0; i < blocks.size(); i++)
            sb.append("    ").append(i).append(" [ label = \"").append(escape(blocks.get(i))).append("\" ]\n");
        for (Edge e : edges) {
            sb.append("    ").append(blocks.indexOf(e.producer())).append(" -> ")
                    .append(blocks.indexOf(e.consumer()))
                    .append(" [ label = \"").append(escape(e.signal())).append('"');
            if (e.delayed())
                sb.append(", style = dashed");
            sb.append(" ]\n");
        }
        return sb.append("}\n").toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * A producer -> consumer connection through one signal.
     *
     * @param delayed true when the consumer declares a delay, i.e. the edge is
     *                not part of the scheduling graph.
     */
    public record Edge(String producer, String consumer, String signal, boolean delayed) {
    }
}
