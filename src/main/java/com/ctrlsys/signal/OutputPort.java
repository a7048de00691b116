package com.ctrlsys.signal;

import java.util.Objects;

/**
 * Write-capable connection point of a block.
 *
 * Each output port owns its signal from construction, so the payload type is
 * known before any wiring takes place. Connecting the port gives the signal its
 * global name; that happens once, when the block is added to a builder.
 *
 * @param <T> payload type
 */
public final class OutputPort<T> {
    private final String name;
    private final Signal<T> signal;
    private boolean connected;

    public OutputPort(String name, Class<T> type) {
        this.name = Objects.requireNonNull(name, "name");
        this.signal = Signal.of(type);
    }

    /** Local port name within the owning block. */
    public String name() {
        return name;
    }

    public Class<T> type() {
        return signal.type();
    }

    public Signal<T> signal() {
        return signal;
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * Publishes the owned signal under a global name.
     *
     * @throws IllegalStateException if the port is already connected.
     */
    public void connect(String signalName) {
        if (connected)
            throw new IllegalStateException(
                    "Output '" + name + "' is already connected to signal '" + signal.name() + "'");
        signal.assignName(Objects.requireNonNull(signalName, "signalName"));
        connected = true;
    }

    /**
     * Writes a value to the owned signal.
     *
     * @throws IllegalStateException if the port has not been connected.
     */
    public void set(T value) {
        if (!connected)
            throw new IllegalStateException("Output '" + name + "' is not connected");
        signal.write(value);
    }

    public String signalName() {
        return signal.name();
    }
}
