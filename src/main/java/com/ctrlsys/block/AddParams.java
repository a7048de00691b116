package com.ctrlsys.block;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-input gains of an {@link Add} block. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public final class AddParams {
    private double[] gains;

    public static AddParams of(double... gains) {
        return new AddParams(gains);
    }
}
