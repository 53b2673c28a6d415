package io.github.eutro.mdsl2ir.test;

import io.github.eutro.mdsl2ir.passes.IRPass;
import io.github.eutro.mdsl2ir.passes.InPlaceIRPass;
import io.github.eutro.mdsl2ir.passes.misc.ForPass;
import io.github.eutro.mdsl2ir.ssa.Function;
import io.github.eutro.mdsl2ir.ssa.Module;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    @Test
    void testChainRunsInOrder() {
        List<String> seen = new ArrayList<>();
        IRPass<String, Integer> length = s -> {
            seen.add("length");
            return s.length();
        };
        IRPass<String, String> chain = length
                .then(n -> {
                    seen.add("double");
                    return n * 2;
                })
                .then(n -> Integer.toString(n));
        assertEquals("8", chain.run("four"));
        assertEquals(Arrays.asList("length", "double"), seen);
    }

    @Test
    void testChainReportsFailingPass() {
        IRPass<String, String> chain = ((IRPass<String, String>) s -> s)
                .then(s -> {
                    throw new IllegalStateException(s);
                });
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run("boom"));
        assertEquals("boom", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
    }

    @Test
    void testLiftFunctions() {
        Module module = new Module();
        module.newFunction("f");
        module.newFunction("g");
        List<String> names = new ArrayList<>();
        InPlaceIRPass<Function> record = func -> names.add(func.name);

        assertSame(module, ForPass.liftFunctions(record).run(module));
        assertEquals(module.getFunctions().size(), names.size());
        assertTrue(names.containsAll(Arrays.asList("f", "g")));

        names.clear();
        ForPass.liftMain(record).runInPlace(module);
        assertEquals(Arrays.asList(module.getMain().name), names);
    }
}
