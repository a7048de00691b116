package com.ctrlsys;

import com.ctrlsys.api.StepInfo;
import com.ctrlsys.api.StepResult;
import com.ctrlsys.block.AbstractBlock;
import com.ctrlsys.block.Add;
import com.ctrlsys.block.AddParams;
import com.ctrlsys.block.Constant;
import com.ctrlsys.block.ConstantParams;
import com.ctrlsys.block.Delay;
import com.ctrlsys.block.DelayParams;
import com.ctrlsys.block.Pid;
import com.ctrlsys.block.PidParams;
import com.ctrlsys.block.Probe;
import com.ctrlsys.engine.ControlSystem;
import com.ctrlsys.engine.ControlSystemParameters;
import com.ctrlsys.io.ParameterStore;
import com.ctrlsys.numeric.OdeSolver;
import com.ctrlsys.numeric.RungeKutta4;
import com.ctrlsys.signal.InputPort;
import com.ctrlsys.signal.OutputPort;
import com.ctrlsys.util.BlockProfileListener;
import com.ctrlsys.util.CompositeStepListener;
import com.ctrlsys.util.GraphExplain;
import com.ctrlsys.util.LatencyTrackingListener;
import com.ctrlsys.wiring.SignalRecording;

import java.nio.file.Path;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;

/**
 * Position control of a cart with two cascaded PID loops.
 *
 * Outer loop: position reference -> position error -> velocity reference.
 * Inner loop: velocity reference -> velocity error -> force on the cart.
 * Both loops are closed through a one-step delay. Parameters are read from
 * (and written back to) cart.toml; selected signals are recorded off the
 * simulation thread.
 */
@Log4j2
public class CartDemo {

    public static void main(String[] args) {
        Path paramFile = Path.of(args.length > 0 ? args[0] : "cart.toml");
        var store = new ParameterStore(paramFile, "cart");

        try (var recording = SignalRecording.start(4096)) {
            var b = ControlSystems.builder();

            b.addBlock(Cart.fromStore(store, new CartParams(1.0, 0.0, 0.0)),
                    Map.of("u_force", "/force"),
                    Map.of("y_pos", "/cart/pos", "y_vel", "/cart/vel", "y_acc", "/cart/acc"));

            // Inner loop
            b.addBlock(Delay.fromStore("vel_delay", store, DelayParams.of(0.0)),
                    Map.of("u", "/cart/vel"), Map.of("y", "/cart/vel_delayed"));
            b.addBlock(new Add("vel_err", AddParams.of(1.0, -1.0)),
                    Map.of("u1", "/ref/vel", "u2", "/cart/vel_delayed"), Map.of("y", "/err/vel"));
            b.addBlock(Pid.fromStore("pid_vel", store, PidParams.builder().kp(4.0).build()),
                    Map.of("u", "/err/vel"), Map.of("y", "/force"));

            // Outer loop
            b.addBlock(Delay.fromStore("pos_delay", store, DelayParams.of(0.0)),
                    Map.of("u", "/cart/pos"), Map.of("y", "/cart/pos_delayed"));
            b.addBlock(new Add("pos_err", AddParams.of(1.0, -1.0)),
                    Map.of("u1", "/ref/pos", "u2", "/cart/pos_delayed"), Map.of("y", "/err/pos"));
            b.addBlock(Pid.fromStore("pid_pos", store, PidParams.builder().kp(1.0).build()),
                    Map.of("u", "/err/pos"), Map.of("y", "/ref/vel"));

            b.addSource(Constant.fromStore("pos_ref", store, new ConstantParams(15.0)), Map.of("y", "/ref/pos"));

            for (String signal : new String[] { "/cart/pos", "/cart/vel", "/force", "/err/pos" })
                b.addSink(new Probe("probe" + signal.replace('/', '_'), recording.publisher()),
                        Map.of("u", signal));

            ControlSystem cs = b.buildFromStore("cart", store, new ControlSystemParameters(0.01, 1000));
            store.save();

            var latency = new LatencyTrackingListener();
            var profile = new BlockProfileListener();
            cs.setListener(new CompositeStepListener().add(latency).add(profile));
            log.info("\n{}", new GraphExplain(cs).dumpTopology());

            while (cs.step() == StepResult.CONTINUE) {
                // run until max_iter
            }

            log.info("Final position {} after t={}", cs.value("/cart/pos", Double.class).orElse(Double.NaN),
                    cs.t());
            log.info("\n{}", latency.dump());
            log.info("\n{}", profile.dump());
            recording.recorder().series("/cart/pos")
                    .ifPresent(s -> log.info("Recorded {} samples of {}", s.size(), s.signal()));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CartParams {
        private double mass;
        private double pos0;
        private double vel0;
    }

    /** Point mass on a line, driven by a force. State: [position, velocity]. */
    public static final class Cart extends AbstractBlock {
        private final InputPort<Double> uForce;
        private final OutputPort<Double> yPos;
        private final OutputPort<Double> yVel;
        private final OutputPort<Double> yAcc;

        private final CartParams params;
        private final OdeSolver solver = RungeKutta4.INSTANCE;
        private double[] state;

        public Cart(CartParams params) {
            super("cart");
            this.params = params;
            this.state = new double[] { params.getPos0(), params.getVel0() };
            this.uForce = input("u_force", Double.class);
            this.yPos = output("y_pos", Double.class);
            this.yVel = output("y_vel", Double.class);
            this.yAcc = output("y_acc", Double.class);
        }

        public static Cart fromStore(ParameterStore store, CartParams defaults) {
            return new Cart(store.getBlockParams("cart", defaults));
        }

        @Override
        public StepResult step(StepInfo info) {
            double acc = uForce.get() / params.getMass();
            state = solver.solve((t, x) -> new double[] { x[1], acc }, info.t(), info.dt(), state);

            yPos.set(state[0]);
            yVel.set(state[1]);
            yAcc.set(acc);
            return StepResult.CONTINUE;
        }
    }
}
