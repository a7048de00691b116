package com.ctrlsys.block;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Initial outputs of a {@link Delay} of doubles; the size is the delay. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public final class DelayParams {
    @JsonProperty("initial_values")
    private List<Double> initialValues;

    public static DelayParams of(Double... initialValues) {
        return new DelayParams(List.of(initialValues));
    }
}
