package com.ctrlsys.util;

import com.ctrlsys.api.Block;
import com.ctrlsys.engine.ControlSystem;
import com.ctrlsys.engine.SignalGraph;
import com.ctrlsys.engine.TopologicalOrder;
import com.ctrlsys.signal.InputPort;
import com.ctrlsys.signal.OutputPort;

/**
 * Diagnostic utility for inspecting a built control system.
 *
 * <p>
 * Generates human-readable renderings of the execution order, the full
 * signal graph and the current state of individual blocks.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error reports.
 * Do <b>not</b> call from inside the stepping loop (allocates strings).
 */
public final class GraphExplain {
    private final ControlSystem system;
    private final TopologicalOrder topology;
    private final SignalGraph graph;

    public GraphExplain(ControlSystem system) {
        this.system = system;
        this.topology = system.topology();
        this.graph = system.signalGraph();
    }

    /**
     * Dumps detailed state of a single block.
     */
    public String explainBlock(String blockName) {
        int idx = topology.topoIndex(blockName);
        Block block = topology.block(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Block: ").append(blockName).append('\n')
                .append("  Execution index: ").append(idx).append('\n')
                .append("  Type: ").append(block.getClass().getSimpleName()).append('\n')
                .append("  Delay: ").append(block.delay()).append('\n');
        for (InputPort<?> in : block.inputPorts().values()) {
            sb.append("  In  ").append(in.name()).append(" <- ");
            if (in.isConnected())
                sb.append(in.signalName()).append(" = ").append(in.tryGet().map(String::valueOf).orElse("<unset>"));
            else
                sb.append("<unbound>");
            sb.append('\n');
        }
        for (OutputPort<?> out : block.outputPorts().values()) {
            sb.append("  Out ").append(out.name()).append(" -> ").append(out.signalName()).append(" = ")
                    .append(out.signal().isSet() ? String.valueOf(out.signal().get(out.type()).orElse(null)) : "<unset>")
                    .append('\n');
        }
        int cc = topology.childCount(idx);
        sb.append("  Zero-delay consumers (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(topology.block(topology.child(idx, i)).name());
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    /**
     * One-line summary of the step state.
     */
    public String explainStepState() {
        return "System: " + system.name() + ", next k: " + system.k() + ", t: " + system.t() + ", blocks: "
                + topology.blockCount() + ", signals: " + system.signals().size();
    }

    /**
     * Dumps the execution order with each block's zero-delay consumers.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Control system '").append(system.name()).append("' (").append(topology.blockCount())
                .append(" blocks):\n");
        for (int i = 0; i < topology.blockCount(); i++) {
            Block block = topology.block(i);
            sb.append("  [").append(i).append("] ").append(block.name());
            if (block.delay() > 0)
                sb.append(" (DELAY ").append(block.delay()).append(')');
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.block(topology.child(i, j)).name());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /** The full signal graph in Graphviz DOT. */
    public String toDot() {
        return graph.toDot();
    }

    /**
     * Generates a Mermaid JS diagram of the full signal graph.
     * <p>
     * Edges are labelled with the signal name; edges into delayed blocks are
     * drawn dotted.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        for (String name : graph.blocks()) {
            Block block = topology.block(topology.topoIndex(name));
            sb.append("  ").append(sanitize(name)).append("[\"").append(name).append("<br/>")
                    .append(block.getClass().getSimpleName()).append("\"];\n");
        }
        for (SignalGraph.Edge e : graph.edges()) {
            sb.append("  ").append(sanitize(e.producer()))
                    .append(e.delayed() ? " -. \"" : " -- \"").append(e.signal())
                    .append(e.delayed() ? "\" .-> " : "\" --> ")
                    .append(sanitize(e.consumer())).append(";\n");
        }
        return sb.toString();
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
