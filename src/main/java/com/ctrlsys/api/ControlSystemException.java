package com.ctrlsys.api;

import java.util.List;

import lombok.Getter;

/**
 * A structural error in the wiring of a control system.
 *
 * All kinds are raised while blocks are added or while the system is built.
 * None of them is retryable: the wiring has to be fixed and the system rebuilt.
 * The offending names are available as fields and embedded in the message.
 */
@Getter
public final class ControlSystemException extends RuntimeException {

    /** The kind of wiring error. */
    public enum Kind {
        DUPLICATE_BLOCK_NAME,
        UNKNOWN_PORT,
        UNKNOWN_SIGNAL,
        MULTIPLE_PRODUCERS,
        UNCONNECTED_PORTS,
        TYPE_ERROR,
        CYCLE_DETECTED
    }

    private final Kind kind;
    private final String blockName;
    private final List<String> ports;
    private final String signal;

    private ControlSystemException(Kind kind, String message, String blockName, List<String> ports,
            String signal) {
        super(message);
        this.kind = kind;
        this.blockName = blockName;
        this.ports = ports;
        this.signal = signal;
    }

    public static ControlSystemException duplicateBlockName(String blockName) {
        return new ControlSystemException(Kind.DUPLICATE_BLOCK_NAME,
                "A block named '" + blockName + "' is already present in the control system",
                blockName, List.of(), null);
    }

    public static ControlSystemException unknownPort(String blockName, String port) {
        return new ControlSystemException(Kind.UNKNOWN_PORT,
                "No port named '" + port + "' in block '" + blockName + "'",
                blockName, List.of(port), null);
    }

    public static ControlSystemException unknownSignal(String blockName, String port, String signal) {
        return new ControlSystemException(Kind.UNKNOWN_SIGNAL,
                "Could not connect port '" + port + "' of block '" + blockName + "': No signal named '"
                        + signal + "'",
                blockName, List.of(port), signal);
    }

    public static ControlSystemException multipleProducers(String blockName, String port, String signal) {
        return new ControlSystemException(Kind.MULTIPLE_PRODUCERS,
                "Cannot connect output '" + port + "' of block '" + blockName + "' to signal '" + signal
                        + "': The signal is already connected to another output",
                blockName, List.of(port), signal);
    }

    public static ControlSystemException unconnectedPorts(String blockName, List<String> ports) {
        return new ControlSystemException(Kind.UNCONNECTED_PORTS,
                "Ports " + ports + " in block '" + blockName + "' have not been connected",
                blockName, List.copyOf(ports), null);
    }

    /**
     * A payload type mismatch on a signal. The block and port are null when the
     * mismatch is detected on the signal itself rather than while binding a port.
     */
    public static ControlSystemException typeError(String blockName, String port, String signal,
            Class<?> expected, Class<?> actual) {
        String where = blockName == null ? "" : " (port '" + port + "' of block '" + blockName + "')";
        return new ControlSystemException(Kind.TYPE_ERROR,
                "Expected signal '" + signal + "' to be a '" + expected.getName() + "', but is a '"
                        + actual.getName() + "'" + where,
                blockName, port == null ? List.of() : List.of(port), signal);
    }

    public static ControlSystemException cycleDetected(String blockName) {
        return new ControlSystemException(Kind.CYCLE_DETECTED,
                "Control system presents a cycle containing block '" + blockName
                        + "'. Break the cycle by adding a block with a delay",
                blockName, List.of(), null);
    }
}
