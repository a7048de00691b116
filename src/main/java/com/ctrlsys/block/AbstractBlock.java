package com.ctrlsys.block;

import com.ctrlsys.api.Block;
import com.ctrlsys.signal.InputPort;
import com.ctrlsys.signal.OutputPort;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for blocks that declare their ports in the constructor.
 *
 * Subclasses call {@link #input}, {@link #inputArray} and {@link #output} to
 * create their ports; the port maps the builder needs are derived from those
 * calls. Array ports expand to {@code name1 .. nameN}.
 *
 * <pre>
 * public Gain(String name, double k) {
 *     super(name);
 *     this.u = input("u", Double.class);
 *     this.y = output("y", Double.class);
 * }
 * </pre>
 */
public abstract class AbstractBlock implements Block {
    private final String name;
    private final Map<String, InputPort<?>> inputs = new LinkedHashMap<>();
    private final Map<String, OutputPort<?>> outputs = new LinkedHashMap<>();

    protected AbstractBlock(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final Map<String, InputPort<?>> inputPorts() {
        return Collections.unmodifiableMap(inputs);
    }

    @Override
    public final Map<String, OutputPort<?>> outputPorts() {
        return Collections.unmodifiableMap(outputs);
    }

    protected final <T> InputPort<T> input(String portName, Class<T> type) {
        var port = new InputPort<>(portName, type);
        if (inputs.putIfAbsent(portName, port) != null)
            throw new IllegalArgumentException("Duplicate input '" + portName + "' in block '" + name + "'");
        return port;
    }

    /** Declares inputs {@code portName1 .. portNameN} of the same type. */
    @SuppressWarnings("unchecked")
    protected final <T> InputPort<T>[] inputArray(String portName, Class<T> type, int size) {
        if (size < 1)
            throw new IllegalArgumentException("Input array '" + portName + "' needs at least one port");
        InputPort<T>[] ports = new InputPort[size];
        for (int i = 0; i < size; i++)
            ports[i] = input(portName + (i + 1), type);
        return ports;
    }

    protected final <T> OutputPort<T> output(String portName, Class<T> type) {
        var port = new OutputPort<>(portName, type);
        if (outputs.putIfAbsent(portName, port) != null)
            throw new IllegalArgumentException("Duplicate output '" + portName + "' in block '" + name + "'");
        return port;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
