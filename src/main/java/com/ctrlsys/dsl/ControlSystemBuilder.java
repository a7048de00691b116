package com.ctrlsys.dsl;

import com.ctrlsys.api.Block;
import com.ctrlsys.api.ControlSystemException;
import com.ctrlsys.engine.ControlSystem;
import com.ctrlsys.engine.ControlSystemParameters;
import com.ctrlsys.engine.SignalGraph;
import com.ctrlsys.engine.TopologicalOrder;
import com.ctrlsys.io.ParameterStore;
import com.ctrlsys.signal.InputPort;
import com.ctrlsys.signal.OutputPort;
import com.ctrlsys.signal.Signal;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Control System Builder -- the wiring API.
 *
 * Blocks are registered together with two maps, local port name -> global
 * signal name, one for the inputs and one for the outputs. Every declared port
 * must be wired, and every signal must have exactly one producing output.
 *
 * Usage Pattern:
 * 1. Create a builder: var b = ControlSystemBuilder.create();
 * 2. Add blocks: b.addBlock(new Constant<>("c", Double.class, 3.0), Map.of(), Map.of("y", "c1"));
 * 3. Build: ControlSystem cs = b.build("demo", ControlSystemParameters.of(0.01));
 * 4. Step: while (cs.step() == StepResult.CONTINUE) { ... }
 *
 * A consumer may be added before its producer: inputs are only bound to their
 * signals in build(). build() is a one-way transition, successful or not; after
 * it the builder rejects every further call, and since blocks are bound in place
 * a failed build needs fresh block instances.
 */
@Log4j2
public final class ControlSystemBuilder {

    // Insertion ordered so that unrelated blocks keep registration order
    private final Map<String, Wiring> blocks = new LinkedHashMap<>();
    private final Map<String, Signal<?>> signals = new LinkedHashMap<>();
    private final Map<String, String> producers = new HashMap<>();

    private boolean built;

    private ControlSystemBuilder() {
    }

    public static ControlSystemBuilder create() {
        return new ControlSystemBuilder();
    }

    /**
     * Registers a block and its wiring.
     *
     * Validation happens before anything is recorded, so a rejected block
     * leaves the builder unchanged.
     *
     * @param block             The block; its name must be unique.
     * @param inputConnections  Input port name -> signal name, one entry per input port.
     * @param outputConnections Output port name -> signal name, one entry per output port.
     * @return this builder.
     * @throws ControlSystemException DUPLICATE_BLOCK_NAME, UNKNOWN_PORT, MULTIPLE_PRODUCERS or
     *                                UNCONNECTED_PORTS.
     */
    public ControlSystemBuilder addBlock(Block block, Map<String, String> inputConnections,
            Map<String, String> outputConnections) {
        checkNotBuilt();
        String name = block.name();
        if (blocks.containsKey(name))
            throw ControlSystemException.duplicateBlockName(name);
        if (block.delay() < 0)
            throw new IllegalArgumentException("Block '" + name + "' declares a negative delay: " + block.delay());

        checkInputs(block, inputConnections);
        checkOutputs(block, outputConnections);

        Map<String, OutputPort<?>> outputs = block.outputPorts();
        for (var entry : outputConnections.entrySet()) {
            OutputPort<?> port = outputs.get(entry.getKey());
            port.connect(entry.getValue());
            signals.put(entry.getValue(), port.signal());
            producers.put(entry.getValue(), name);
        }
        blocks.put(name, new Wiring(block, new LinkedHashMap<>(inputConnections),
                new LinkedHashMap<>(outputConnections)));
        log.debug("Added block '{}' inputs={} outputs={}", name, inputConnections, outputConnections);
        return this;
    }

    /** Registers a block without inputs. */
    public ControlSystemBuilder addSource(Block block, Map<String, String> outputConnections) {
        return addBlock(block, Map.of(), outputConnections);
    }

    /** Registers a block without outputs. */
    public ControlSystemBuilder addSink(Block block, Map<String, String> inputConnections) {
        return addBlock(block, inputConnections, Map.of());
    }

    private void checkInputs(Block block, Map<String, String> connections) {
        Set<String> declared = block.inputPorts().keySet();
        for (String port : connections.keySet())
            if (!declared.contains(port))
                throw ControlSystemException.unknownPort(block.name(), port);

        List<String> missing = new ArrayList<>();
        for (String port : declared)
            if (!connections.containsKey(port))
                missing.add(port);
        if (!missing.isEmpty()) {
            Collections.sort(missing);
            throw ControlSystemException.unconnectedPorts(block.name(), missing);
        }
    }

    private void checkOutputs(Block block, Map<String, String> connections) {
        Map<String, OutputPort<?>> declared = block.outputPorts();
        Set<String> claimed = new HashSet<>();
        for (var entry : connections.entrySet()) {
            String port = entry.getKey(), signal = entry.getValue();
            if (signals.containsKey(signal) || !claimed.add(signal))
                throw ControlSystemException.multipleProducers(block.name(), port, signal);
            OutputPort<?> out = declared.get(port);
            if (out == null)
                throw ControlSystemException.unknownPort(block.name(), port);
            if (out.isConnected())
                throw new IllegalStateException("Output '" + port + "' of block '" + block.name()
                        + "' is already connected to signal '" + out.signalName() + "'");
        }

        List<String> missing = new ArrayList<>();
        for (String port : declared.keySet())
            if (!connections.containsKey(port))
                missing.add(port);
        if (!missing.isEmpty()) {
            Collections.sort(missing);
            throw ControlSystemException.unconnectedPorts(block.name(), missing);
        }
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Resolves parameters through the store, then builds.
     */
    public ControlSystem buildFromStore(String name, ParameterStore store, ControlSystemParameters defaults) {
        return build(name, store.getSystemParams(defaults));
    }

    /**
     * Compiles the wiring into an executable {@link ControlSystem}.
     * This process involves:
     * <ol>
     * <li>Binding every input port to its signal, checking the payload type.</li>
     * <li>Building the zero-delay scheduling graph and the full diagnostic graph.</li>
     * <li>Topological sort with cycle detection.</li>
     * </ol>
     *
     * @throws ControlSystemException UNKNOWN_SIGNAL, TYPE_ERROR or CYCLE_DETECTED.
     */
    public ControlSystem build(String name, ControlSystemParameters parameters) {
        checkNotBuilt();
        built = true;

        bindInputs();

        SignalGraph full = signalGraph();
        var topo = TopologicalOrder.builder();
        for (Wiring w : blocks.values())
            topo.addBlock(w.block());
        for (SignalGraph.Edge edge : full.edges())
            if (!edge.delayed())
                topo.addEdge(edge.producer(), edge.consumer());
        TopologicalOrder order = topo.build();

        log.info("Built control system '{}': {} blocks, {} signals", name, blocks.size(), signals.size());
        if (log.isDebugEnabled()) {
            log.debug("Execution order: {}", order.names());
            log.debug("Signal graph:\n{}", full.toDot());
        }
        return new ControlSystem(name, order, full, signals, parameters);
    }

    private void bindInputs() {
        for (Wiring w : blocks.values()) {
            Block block = w.block();
            Map<String, InputPort<?>> ports = block.inputPorts();
            for (var entry : w.inputs().entrySet()) {
                String port = entry.getKey(), signalName = entry.getValue();
                Signal<?> signal = signals.get(signalName);
                if (signal == null)
                    throw ControlSystemException.unknownSignal(block.name(), port, signalName);
                InputPort<?> input = ports.get(port);
                if (!input.type().equals(signal.type()))
                    throw ControlSystemException.typeError(block.name(), port, signalName, input.type(),
                            signal.type());
                input.connect(signal);
            }
        }
    }

    /**
     * The full wiring graph as currently registered, including edges into
     * delayed blocks and edges that would close a cycle. Inputs naming a signal
     * without producer contribute no edge.
     */
    public SignalGraph signalGraph() {
        List<SignalGraph.Edge> edges = new ArrayList<>();
        for (Wiring consumer : blocks.values()) {
            boolean delayed = consumer.block().delay() > 0;
            // One edge per signal even if it feeds several ports of the consumer
            for (String signal : new LinkedHashSet<>(consumer.inputs().values())) {
                String producer = producers.get(signal);
                if (producer != null)
                    edges.add(new SignalGraph.Edge(producer, consumer.block().name(), signal, delayed));
            }
        }
        return new SignalGraph(new ArrayList<>(blocks.keySet()), edges);
    }

    /** Names of the registered blocks in registration order. */
    public Set<String> blockNames() {
        return Collections.unmodifiableSet(blocks.keySet());
    }

    /** Names of the produced signals in registration order. */
    public Set<String> signalNames() {
        return Collections.unmodifiableSet(signals.keySet());
    }

    /** The block producing the given signal, or null. */
    public String producerOf(String signal) {
        return producers.get(signal);
    }

    public boolean isBuilt() {
        return built;
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Control system already built");
    }

    /** The wiring record of one block. */
    public record Wiring(Block block, Map<String, String> inputs, Map<String, String> outputs) {
    }
}
