package io.github.eutro.mdsl2ir.test;

import io.github.eutro.mdsl2ir.ast.Stmt;
import io.github.eutro.mdsl2ir.ops.CommonOps;
import io.github.eutro.mdsl2ir.ops.ScfOps;
import io.github.eutro.mdsl2ir.ssa.Effect;
import io.github.eutro.mdsl2ir.ssa.Function;
import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.ssa.Region;
import io.github.eutro.mdsl2ir.translate.Diagnostic;
import io.github.eutro.mdsl2ir.translate.TranslationError;
import io.github.eutro.mdsl2ir.translate.TranslationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.mdsl2ir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class RectifyEarlyReturnsTest {
    private static List<String> run(Stmt... stmts) {
        ScalarInterpreter interp = new ScalarInterpreter(translate(stmts));
        interp.runMain();
        return interp.printed;
    }

    private static void assertSingleReturn(Function func) {
        List<Effect> returns = effectsOf(func, CommonOps.RETURN.key);
        assertEquals(1, returns.size(), func::toString);
        assertSame(func.body.getTerminator(), returns.get(0));
    }

    private static Stmt.Function simpleEarlyReturn() {
        return func("f", Collections.singletonList(param("a")),
                ifThen(bin(">", id("a"), i(10)), block(ret(i(1)))),
                print(s("x")),
                ret(i(2)));
    }

    @Test
    void testEarlyReturn() {
        Module module = translate(simpleEarlyReturn());
        assertSingleReturn(functionNamed(module, "f"));
        assertEquals(Arrays.asList("1", "x", "2"), run(
                simpleEarlyReturn(),
                print(call("f", i(20))),
                print(call("f", i(5)))));
    }

    @Test
    void testRebuiltConditionalYieldsResults() {
        Function f = functionNamed(translate(simpleEarlyReturn()), "f");
        List<Effect> ifs = effectsOf(f, ScfOps.IF);
        assertEquals(1, ifs.size());
        Effect rebuilt = ifs.get(0);
        assertEquals(2, rebuilt.getRegions().size());
        assertEquals(1, rebuilt.getAssignsTo().size());
        assertEquals(rebuilt.getAssignsTo(), f.body.getTerminator().insn().args());
    }

    @Test
    void testNestedEarlyReturn() {
        Stmt.Function g = func("g", Collections.singletonList(param("a")),
                ifThen(bin(">", id("a"), i(0)), block(
                        ifThen(bin(">", id("a"), i(10)), block(ret(i(2)))),
                        print(s("mid")))),
                ret(i(0)));
        List<String> printed = run(g,
                print(call("g", i(20))),
                print(call("g", i(5))),
                print(call("g", neg(1))));
        assertEquals(Arrays.asList("2", "mid", "0", "0"), printed);
    }

    @Test
    void testEarlyReturnInElse() {
        Stmt.Function f = func("f", Collections.singletonList(param("a")),
                ifElse(bin(">", id("a"), i(0)),
                        block(print(s("pos"))),
                        block(ret(neg(1)))),
                ret(id("a")));
        assertEquals(Arrays.asList("pos", "3", "-1"), run(f,
                print(call("f", i(3))),
                print(call("f", neg(4)))));
    }

    @Test
    void testEarlyReturnCarriesAssignments() {
        Stmt.Function f = func("f", Collections.singletonList(param("a")),
                assign("b", bin("*", id("a"), i(2))),
                ifThen(bin(">", id("b"), i(10)), block(ret(id("b")))),
                assign("b", bin("+", id("b"), i(1))),
                ret(id("b")));
        assertEquals(Arrays.asList("12", "5"), run(f,
                print(call("f", i(6))),
                print(call("f", i(2)))));
    }

    @Test
    void testBothBranchesReturn() {
        Stmt.Function h = func("h", Collections.singletonList(param("a")),
                ifElse(bin(">", id("a"), i(0)),
                        block(ret(i(1))),
                        block(ret(i(2)))),
                print(s("dead")),
                ret(i(3)));
        TranslationResult result = translator().translate(script(h,
                print(call("h", i(1))),
                print(call("h", neg(1)))));
        assertTrue(result.isSuccess());
        Module module = result.getModule().orElseThrow(AssertionError::new);

        assertFalse(result.getWarnings().isEmpty());
        for (Diagnostic warning : result.getWarnings()) {
            assertTrue(warning.message.contains("is ignored"), warning.message);
        }

        ScalarInterpreter interp = new ScalarInterpreter(module);
        interp.runMain();
        assertEquals(Arrays.asList("1", "2"), interp.printed);
        assertSingleReturn(functionNamed(module, "h"));
    }

    @Test
    void testArityMismatchAcrossPaths() {
        TranslationError error = translateError(func("f", Collections.singletonList(param("a")),
                ifThen(bin(">", id("a"), i(0)), block(ret(i(1), i(2)))),
                ret(i(3))));
        assertEquals(TranslationError.Kind.ARITY_MISMATCH, error.kind);
        assertTrue(error.message.contains("`f`"), error.message);
    }

    @Test
    void testTypeMismatchAcrossPaths() {
        assertEquals(TranslationError.Kind.TYPE_AMBIGUITY, translateError(
                func("f", Collections.singletonList(param("a")),
                        ifThen(bin(">", id("a"), i(0)), block(ret(s("one")))),
                        ret(i(3)))).kind);
    }

    @Test
    void testReturnInLoop() {
        TranslationError error = translateError(func("f", Collections.emptyList(),
                forLoop("i", i(1), i(3), block(ret(id("i")))),
                ret(i(0))));
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, error.kind);
        assertTrue(error.message.contains("early return"), error.message);
    }

    @Test
    void testReturnInConditionalInLoop() {
        TranslationError error = translateError(func("f", Collections.emptyList(),
                assign("n", i(0)),
                new Stmt.While(LOC, bin("<", id("n"), i(3)), block(
                        ifThen(bin(">", id("n"), i(1)), block(ret(id("n")))),
                        assign("n", bin("+", id("n"), i(1)))), false),
                ret(i(0))));
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, error.kind);
    }

    @Test
    void testImplicitReturn() {
        Function f = functionNamed(translate(func("f", Collections.emptyList(), print(s("hi")))), "f");
        assertSingleReturn(f);
        assertTrue(f.body.getTerminator().insn().args().isEmpty());
        assertTrue(f.resultTypes.isEmpty());
    }

    @Test
    void testTopLevelReturn() {
        assertEquals(Collections.emptyList(), run(
                ifThen(bool(true), block(ret())),
                print(s("after"))));
        assertEquals(Collections.singletonList("after"), run(
                ifThen(bool(false), block(ret())),
                print(s("after"))));
    }

    @Test
    void testUnreachableTopLevel() {
        TranslationResult result = translator().translate(script(
                ret(),
                print(s("never"))));
        Module module = result.orElseThrow();
        assertSingleReturn(module.getMain());
        assertTrue(effectsOf(module.getMain(), io.github.eutro.mdsl2ir.ops.DslOps.BUILTIN).isEmpty());
        assertFalse(result.getWarnings().isEmpty());
    }

    @Test
    void testUnreachablePureCodeIsDroppedSilently() {
        TranslationResult result = translator().translate(script(
                ret(),
                assign("x", bin("+", i(1), i(2)))));
        Module module = result.orElseThrow();
        assertTrue(effectsOf(module.getMain(), io.github.eutro.mdsl2ir.ops.DslOps.EW_ADD.key).isEmpty());
        assertTrue(result.getWarnings().isEmpty(), result.getWarnings()::toString);
    }

    private static Stmt.For parFor(String var, Stmt body) {
        return new Stmt.For(LOC, true, var, i(1), i(3), null, body);
    }

    @Test
    void testReturnInParForBody() {
        TranslationResult result = translator().translate(script(
                func("f", Collections.emptyList(),
                        parFor("i", block(ret(i(1)))),
                        ret(i(0))),
                print(call("f"))));
        Function f = functionNamed(result.orElseThrow(), "f");
        // the parfor body's return is its own, not the function's
        assertEquals(2, effectsOf(f, CommonOps.RETURN.key).size());
        assertSame(CommonOps.RETURN, f.body.getTerminator().insn().op);

        Effect parfor = effectsOf(f, ScfOps.PARFOR).get(0);
        Region body = parfor.getRegions().get(0);
        assertSame(CommonOps.RETURN, body.getTerminator().insn().op);
        assertEquals(1, body.getTerminator().insn().args().size());
        assertTrue(parfor.getAssignsTo().isEmpty());
    }

    @Test
    void testParForBodyReturnDropsTrailingCode() {
        TranslationResult result = translator().translate(script(
                assign("x", i(0)),
                parFor("i", block(
                        ret(),
                        assign("x", bin("+", id("x"), i(1))),
                        print(s("never")))),
                print(id("x"))));
        Module module = result.orElseThrow();
        Effect parfor = effectsOf(module.getMain(), ScfOps.PARFOR).get(0);
        Region body = parfor.getRegions().get(0);
        assertEquals(1, body.getEffects().size());
        assertTrue(parfor.getAssignsTo().isEmpty());

        List<String> messages = new ArrayList<>();
        for (Diagnostic warning : result.getWarnings()) {
            messages.add(warning.message);
        }
        assertTrue(messages.stream().anyMatch(m -> m.contains("is ignored")), messages::toString);
        assertTrue(messages.stream().anyMatch(m -> m.contains("not visible after the loop")), messages::toString);
    }
}
