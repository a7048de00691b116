package com.ctrlsys.block;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Gains and initial integrator state of a {@link Pid}. All zero by default. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public final class PidParams {
    private double kp;
    private double ki;
    private double kd;
    private double acc0;
}
