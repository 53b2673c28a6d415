package io.github.eutro.mdsl2ir.test;

import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ops.CommonOps;
import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.ops.ScfOps;
import io.github.eutro.mdsl2ir.ssa.*;
import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.types.ScalarType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClonerTest {
    private static final SourceLocation LOC = new SourceLocation("x.daph", 3, 7);

    private Function func;
    private IRBuilder ib;
    private Var param;

    @BeforeEach
    void setUp() {
        func = new Module().newFunction("f");
        param = func.newParam("p", ScalarType.SI64);
        ib = new IRBuilder(func);
        ib.setLocation(LOC);
    }

    @Test
    void testRemapsDefinedVariables() {
        Var k = ib.constant(1L, ScalarType.SI64);
        Effect add = ib.insert(DslOps.EW_ADD.insn(k, param).assignTo(func.newVar("sum", ScalarType.SI64)));
        add.attachExt(CommonExts.KERNEL_HINT, "fast");

        Cloner cloner = new Cloner(func);
        Effect kCopy = cloner.clone(k.getExtOrThrow(CommonExts.ASSIGNED_AT));
        Effect addCopy = cloner.clone(add);

        Var newK = kCopy.getAssignsTo().get(0);
        assertNotSame(k, newK);
        assertSame(newK, cloner.map(k));
        assertSame(newK, addCopy.insn().args().get(0));
        assertSame(param, addCopy.insn().args().get(1));
        assertEquals("sum", addCopy.getAssignsTo().get(0).name);
        assertEquals(LOC, addCopy.getNullable(CommonExts.LOCATION));
        assertEquals("fast", addCopy.getNullable(CommonExts.KERNEL_HINT));
        assertNull(addCopy.getRegion());
    }

    @Test
    void testClonesRegions() {
        Var cond = ib.constant(true, ScalarType.BOOL);
        Region then = new Region();
        IRBuilder inner = new IRBuilder(func, then);
        Var doubled = inner.insert(DslOps.EW_ADD.insn(param, param), "d", ScalarType.SI64);
        inner.insert(ScfOps.YIELD.insn(doubled));
        Region otherwise = new Region();
        new IRBuilder(func, otherwise).insert(ScfOps.YIELD.insn(param));
        Var result = func.newVar("r", ScalarType.SI64);
        Effect ifFx = ib.insert(ScfOps.IF.create(then, otherwise).insn(cond).assignTo(result));

        Effect copy = new Cloner(func).clone(ifFx);
        assertEquals(2, copy.getRegions().size());
        Region thenCopy = copy.getRegions().get(0);
        assertNotSame(then, thenCopy);
        assertSame(copy, thenCopy.getOwner());
        Var doubledCopy = thenCopy.getEffects().get(0).getAssignsTo().get(0);
        assertNotSame(doubled, doubledCopy);
        assertSame(doubledCopy, thenCopy.getTerminator().insn().args().get(0));
        assertSame(param, copy.getRegions().get(1).getTerminator().insn().args().get(0));
        assertSame(cond, copy.insn().args().get(0));
        assertNotSame(result, copy.getAssignsTo().get(0));

        // the original is untouched
        assertSame(doubled, then.getTerminator().insn().args().get(0));
    }

    @Test
    void testClonesRegionArguments() {
        Region body = new Region();
        Var iv = func.newVar("i", ScalarType.INDEX);
        body.getArgs().add(iv);
        new IRBuilder(func, body).insert(ScfOps.YIELD.insn(iv));

        Cloner cloner = new Cloner(func);
        Region copy = cloner.cloneRegion(body);
        Var ivCopy = copy.getArgs().get(0);
        assertNotSame(iv, ivCopy);
        assertSame(ivCopy, copy.getTerminator().insn().args().get(0));
        assertSame(ivCopy, cloner.getVarMap().get(iv));
        assertSame(param, cloner.map(param));
        assertTrue(CommonExts.isTerminator(copy.getEffects().get(0)));
        assertNull(CommonOps.constantValue(ivCopy));
    }
}
