package com.ctrlsys.block;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Parameters of a {@link Constant} producing doubles. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public final class ConstantParams {
    private double c;
}
