package io.github.eutro.mdsl2ir.test;

import io.github.eutro.mdsl2ir.ast.Stmt;
import io.github.eutro.mdsl2ir.ast.TypeDef;
import io.github.eutro.mdsl2ir.ops.CommonOps;
import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.ssa.Effect;
import io.github.eutro.mdsl2ir.ssa.Function;
import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.translate.TranslationError;
import io.github.eutro.mdsl2ir.types.ScalarType;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.mdsl2ir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class UdfTest {
    private static Stmt.Function overload(String valueType, long result) {
        return func("f", Collections.singletonList(param("m", "matrix", valueType)), ret(i(result)));
    }

    private static String calleeOf(Effect call) {
        return DslOps.CALL.cast(call.insn().op).arg;
    }

    @Test
    void testCallRuns() {
        ScalarInterpreter interp = new ScalarInterpreter(translate(
                func("add", Arrays.asList(param("a"), param("b")), ret(bin("+", id("a"), id("b")))),
                print(call("add", i(2), i(3)))));
        interp.runMain();
        assertEquals(Collections.singletonList("5"), interp.printed);
    }

    @Test
    void testUniqueSymbols() {
        Module module = translate(overload("f64", 1), overload("si64", 2));
        Set<String> symbols = new HashSet<>();
        for (Function func : module.getFunctions()) {
            assertTrue(symbols.add(func.symbol), func.symbol);
        }
        assertEquals(3, symbols.size());
    }

    @Test
    void testOverloadResolution() {
        Module module = translate(
                overload("f64", 1),
                overload("si64", 2),
                assign("x", call("f", matrix(f("1.5")))),
                assign("y", call("f", matrix(i(1)))));
        List<Function> fs = new ArrayList<>();
        for (Function func : module.getFunctions()) {
            if (func.name.equals("f")) fs.add(func);
        }
        List<Effect> calls = effectsOf(module.getMain(), DslOps.CALL);
        assertEquals(fs.get(0).symbol, calleeOf(calls.get(0)));
        assertEquals(fs.get(1).symbol, calleeOf(calls.get(1)));
        assertEquals(ScalarType.SI64, calls.get(0).getAssignsTo().get(0).type);
    }

    @Test
    void testUnknownElementTypeResolves() {
        Module module = translate(
                overload("f64", 1),
                overload("si64", 2),
                func("g", Collections.singletonList(param("m", "matrix", null)),
                        ret(call("f", id("m")))));
        List<Effect> calls = effectsOf(functionNamed(module, "g"), DslOps.CALL);
        assertEquals(1, calls.size());
    }

    @Test
    void testNoMatchingOverload() {
        TranslationError error = translateError(
                overload("f64", 1),
                overload("si64", 2),
                assign("x", call("f", matrix(s("a")))));
        assertEquals(TranslationError.Kind.OVERLOAD_RESOLUTION, error.kind);
        assertTrue(error.message.contains("f(matrix<f64>)"), error.message);
        assertTrue(error.message.contains("f(matrix<si64>)"), error.message);
    }

    @Test
    void testUnknownFunction() {
        TranslationError error = translateError(print(call("frobnicate", i(1))));
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, error.kind);
        assertTrue(error.message.contains("frobnicate"), error.message);
    }

    @Test
    void testBuiltinArity() {
        assertEquals(TranslationError.Kind.ARITY_MISMATCH,
                translateError(assign("x", call("sum"))).kind);
    }

    @Test
    void testDeclaredArityMismatch() {
        TranslationError error = translateError(new Stmt.Function(LOC, "f",
                Collections.emptyList(),
                Arrays.asList(new TypeDef(null, "si64"), new TypeDef(null, "si64")),
                block(ret(i(1)))));
        assertEquals(TranslationError.Kind.ARITY_MISMATCH, error.kind);
        assertTrue(error.message.contains("`f`"), error.message);
    }

    @Test
    void testDeclaredTypeMismatch() {
        assertEquals(TranslationError.Kind.TYPE_AMBIGUITY, translateError(new Stmt.Function(LOC, "f",
                Collections.emptyList(),
                Collections.singletonList(new TypeDef(null, "f64")),
                block(ret(s("no"))))).kind);
    }

    @Test
    void testRecursionWithDeclaredTypes() {
        Module module = translate(new Stmt.Function(LOC, "fact",
                Collections.singletonList(param("n", null, "si64")),
                Collections.singletonList(new TypeDef(null, "si64")),
                block(
                        ifThen(bin("<=", id("n"), i(1)), block(ret(i(1)))),
                        ret(bin("*", id("n"), call("fact", bin("-", id("n"), i(1))))))),
                print(call("fact", i(5))));
        ScalarInterpreter interp = new ScalarInterpreter(module);
        interp.runMain();
        assertEquals(Collections.singletonList("120"), interp.printed);
    }

    @Test
    void testFunctionScopeIsIsolated() {
        TranslationError error = translateError(
                assign("outer", i(1)),
                func("f", Collections.emptyList(), ret(id("outer"))));
        assertEquals(TranslationError.Kind.UNDEFINED_VARIABLE, error.kind);
    }

    @Test
    void testNestedDefinition() {
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, translateError(
                ifThen(bool(true), block(func("f", Collections.emptyList(), ret())))).kind);
    }

    @Test
    void testDuplicateParameter() {
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, translateError(
                func("f", Arrays.asList(param("a"), param("a")), ret())).kind);
    }

    @Test
    void testKernelHintOnUdf() {
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, translateError(
                func("f", Collections.emptyList(), ret(i(1))),
                assign("x", new io.github.eutro.mdsl2ir.ast.Expr.Call(LOC, "f", Collections.emptyList(), "k"))).kind);
    }

    @Test
    void testMap() {
        Module module = translate(
                func("inc", Collections.singletonList(param("x")), ret(bin("+", id("x"), i(1)))),
                assign("m", matrix(i(1), i(2))),
                assign("n", call("map", id("m"), id("inc"))));
        Effect map = effectsOf(module.getMain(), DslOps.BUILTIN).get(0);
        assertEquals("map", DslOps.BUILTIN.cast(map.insn().op).arg);
        Object symbol = CommonOps.constantValue(map.insn().args().get(1));
        assertEquals(functionNamed(module, "inc").symbol, symbol);
    }

    @Test
    void testMapWithoutFunction() {
        assertEquals(TranslationError.Kind.OVERLOAD_RESOLUTION, translateError(
                assign("m", matrix(i(1), i(2))),
                assign("n", call("map", id("m"), id("nothing")))).kind);
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, translateError(
                assign("n", call("map", i(1), id("nothing")))).kind);
    }
}
