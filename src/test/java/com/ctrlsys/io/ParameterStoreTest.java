package com.ctrlsys.io;

import com.ctrlsys.block.AddParams;
import com.ctrlsys.block.DelayParams;
import com.ctrlsys.block.PidParams;
import com.ctrlsys.engine.ControlSystemParameters;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class ParameterStoreTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path write(String toml) throws Exception {
        Path file = tmp.getRoot().toPath().resolve("system.toml");
        Files.write(file, toml.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testMissingFileYieldsDefaults() {
        ParameterStore store = new ParameterStore(tmp.getRoot().toPath().resolve("none.toml"), "cart");
        PidParams defaults = PidParams.builder().kp(4.0).ki(0.1).build();
        assertEquals(defaults, store.getBlockParams("pid", defaults));
        assertEquals(new ControlSystemParameters(0.01, 0), store.getSystemParams(ControlSystemParameters.of(0.01)));
    }

    @Test
    public void testFileOverridesFieldByField() throws Exception {
        Path file = write("[cart.params]\n"
                + "max_iter = 250\n"
                + "\n"
                + "[cart.blocks.pid]\n"
                + "kp = 7.5\n"
                + "unused = true\n"
                + "\n"
                + "[cart.blocks.delay]\n"
                + "initial_values = [1.0, 2.0]\n");
        ParameterStore store = new ParameterStore(file, "cart");

        PidParams pid = store.getBlockParams("pid", PidParams.builder().kp(4.0).kd(0.3).build());
        assertEquals(7.5, pid.getKp(), 0.0);
        assertEquals(0.3, pid.getKd(), 0.0);

        DelayParams delay = store.getBlockParams("delay", DelayParams.of(0.0));
        assertEquals(List.of(1.0, 2.0), delay.getInitialValues());

        ControlSystemParameters params = store.getSystemParams(ControlSystemParameters.of(0.01));
        assertEquals(0.01, params.getDt(), 0.0);
        assertEquals(250, params.getMaxIter());
    }

    @Test
    public void testOtherSystemsIgnored() throws Exception {
        Path file = write("[other.blocks.add]\ngains = [5.0, 5.0]\n");
        ParameterStore store = new ParameterStore(file, "cart");
        AddParams add = store.getBlockParams("add", AddParams.of(1.0, -1.0));
        assertArrayEquals(new double[] { 1.0, -1.0 }, add.getGains(), 0.0);
    }

    @Test
    public void testSaveWritesEffectiveValues() throws Exception {
        Path file = tmp.getRoot().toPath().resolve("nested/dir/cart.toml");
        ParameterStore store = new ParameterStore(file, "cart");
        store.getSystemParams(new ControlSystemParameters(0.02, 100));
        store.getBlockParams("pid", PidParams.builder().kp(4.0).build());
        store.save();
        assertTrue(Files.exists(file));

        // A second run reads back what the first one wrote
        ParameterStore reread = new ParameterStore(file, "cart");
        assertEquals(new ControlSystemParameters(0.02, 100), reread.getSystemParams(ControlSystemParameters.of(1.0)));
        assertEquals(4.0, reread.getBlockParams("pid", new PidParams()).getKp(), 0.0);
        assertTrue(store.toToml().contains("max_iter"));
    }

    @Test(expected = ParameterStoreException.class)
    public void testInvalidValue() throws Exception {
        Path file = write("[cart.blocks.pid]\nkp = \"fast\"\n");
        new ParameterStore(file, "cart").getBlockParams("pid", new PidParams());
    }

    @Test(expected = ParameterStoreException.class)
    public void testUnparsableFile() throws Exception {
        new ParameterStore(write("[cart\nkp = = 1"), "cart");
    }
}
