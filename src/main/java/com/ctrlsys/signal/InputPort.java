package com.ctrlsys.signal;

import com.ctrlsys.api.ControlSystemException;

import java.util.Objects;
import java.util.Optional;

/**
 * Read-only connection point of a block.
 *
 * An input port starts unbound. The builder binds it to exactly one signal
 * when the system is built; from then on get() reads whatever the producer
 * last wrote. The type is checked once at bind time so reads are a plain
 * field access.
 *
 * @param <T> payload type
 */
public final class InputPort<T> {
    private final String name;
    private final Class<T> type;
    private Signal<T> signal;

    public InputPort(String name, Class<T> type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    /** Local port name within the owning block. */
    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    public boolean isConnected() {
        return signal != null;
    }

    /**
     * Binds this port to a signal.
     *
     * @throws IllegalStateException  if the port is already bound.
     * @throws ControlSystemException TYPE_ERROR if the signal carries another type.
     */
    @SuppressWarnings("unchecked")
    public void connect(Signal<?> target) {
        if (signal != null)
            throw new IllegalStateException(
                    "Input '" + name + "' is already connected to signal '" + signal.name() + "'");
        if (!type.equals(target.type()))
            throw ControlSystemException.typeError(null, name, target.name(), type, target.type());
        this.signal = (Signal<T>) target;
    }

    /**
     * Returns the current value of the bound signal.
     *
     * @throws IllegalStateException if the port is unbound or the signal was never written.
     */
    public T get() {
        T value = requireSignal().value();
        if (value == null)
            throw new IllegalStateException(
                    "Signal '" + signal.name() + "' read by input '" + name + "' has not been written yet");
        return value;
    }

    /** Like get(), but empty instead of failing when nothing has been written. */
    public Optional<T> tryGet() {
        return Optional.ofNullable(requireSignal().value());
    }

    /** Name of the bound signal. */
    public String signalName() {
        return requireSignal().name();
    }

    private Signal<T> requireSignal() {
        if (signal == null)
            throw new IllegalStateException("Input '" + name + "' is not connected");
        return signal;
    }
}
