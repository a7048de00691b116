package com.ctrlsys.signal;

import com.ctrlsys.api.ControlSystemException;

import java.util.Objects;
import java.util.Optional;

/**
 * A named, typed value slot shared between one producer and any number of
 * consumers.
 *
 * The payload type is fixed at creation by a class token, which stands in for
 * the static type that ports erase. The typed accessors re-validate the
 * requested type against that token; ports validate once when they are bound
 * and then use the unchecked accessors on the hot path.
 *
 * A signal is empty until the producer writes it for the first time. All
 * holders share this one instance, so a write is visible to every consumer
 * without copying.
 *
 * @param <T> payload type
 */
public final class Signal<T> {
    private final Class<T> type;
    private String name;
    private T value;

    private Signal(Class<T> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    /** Creates an empty, unnamed signal carrying values of the given type. */
    public static <T> Signal<T> of(Class<T> type) {
        return new Signal<>(type);
    }

    /** The global signal name, or null while the producing output is unconnected. */
    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    public boolean isSet() {
        return value != null;
    }

    /**
     * Reads the current value as the requested type.
     *
     * @throws ControlSystemException TYPE_ERROR if the type is not this signal's type.
     */
    public <U> Optional<U> get(Class<U> requested) {
        checkType(requested);
        return Optional.ofNullable(requested.cast(value));
    }

    /**
     * Writes a value of the requested type.
     *
     * @throws ControlSystemException TYPE_ERROR if the type is not this signal's type.
     */
    public <U> void set(Class<U> requested, U newValue) {
        checkType(requested);
        write(type.cast(newValue));
    }

    /** Reads without a type check. Null if never written. */
    T value() {
        return value;
    }

    /** Writes without a type check. */
    void write(T newValue) {
        this.value = Objects.requireNonNull(newValue, () -> "Cannot write null to signal '" + name + "'");
    }

    void assignName(String signalName) {
        this.name = signalName;
    }

    private void checkType(Class<?> requested) {
        if (!type.equals(requested))
            throw ControlSystemException.typeError(null, null, name, requested, type);
    }

    @Override
    public String toString() {
        return "Signal[" + name + ": " + type.getSimpleName() + " = " + value + "]";
    }
}
