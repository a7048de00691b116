package com.ctrlsys.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Runtime parameters of a control system.
 *
 * Persisted in the parameter store under {@code <system>.params}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ControlSystemParameters {
    /** Fixed time increment per step. */
    private double dt;
    /** Maximum number of steps, 0 for unlimited. */
    @JsonProperty("max_iter")
    private long maxIter;

    /** Unbounded parameters with the given time step. */
    public static ControlSystemParameters of(double dt) {
        return new ControlSystemParameters(dt, 0);
    }
}
