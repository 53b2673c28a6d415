package io.github.eutro.mdsl2ir.test;

import io.github.eutro.mdsl2ir.ast.Expr;
import io.github.eutro.mdsl2ir.translate.LiteralParser;
import io.github.eutro.mdsl2ir.translate.TranslationError;
import io.github.eutro.mdsl2ir.translate.TranslationException;
import io.github.eutro.mdsl2ir.types.ScalarType;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.stream.Stream;

import static io.github.eutro.mdsl2ir.test.Utils.LOC;
import static org.junit.jupiter.api.Assertions.*;

public class LiteralParserTest {
    private static LiteralParser.Constant parse(Expr.LiteralKind kind, String text) {
        return LiteralParser.parse(kind, text, LOC);
    }

    private static void assertConstant(Object value, ScalarType type, LiteralParser.Constant constant) {
        assertEquals(value, constant.value);
        assertEquals(type, constant.type);
    }

    private static void assertInvalid(Expr.LiteralKind kind, String text) {
        TranslationException e = assertThrows(TranslationException.class, () -> parse(kind, text));
        assertEquals(TranslationError.Kind.INVALID_LITERAL, e.error.kind);
    }

    @Test
    void testIntegers() {
        assertConstant(42L, ScalarType.SI64, parse(Expr.LiteralKind.INT, "42"));
        assertConstant(1000000L, ScalarType.SI64, parse(Expr.LiteralKind.INT, "1_000'000"));
        assertConstant(7L, ScalarType.SI64, parse(Expr.LiteralKind.INT, "7l"));
        assertConstant(7L, ScalarType.UI64, parse(Expr.LiteralKind.INT, "7u"));
        assertConstant(-1L, ScalarType.UI64, parse(Expr.LiteralKind.INT, "18446744073709551615ull"));
        assertConstant(3L, ScalarType.SIZE, parse(Expr.LiteralKind.INT, "3z"));
        assertConstant(Long.MIN_VALUE, ScalarType.SI64, parse(Expr.LiteralKind.INT, "9223372036854775808"));
    }

    @Test
    void testIntegerOutOfRange() {
        assertInvalid(Expr.LiteralKind.INT, "9223372036854775809");
        assertInvalid(Expr.LiteralKind.INT, "99999999999999999999");
        assertInvalid(Expr.LiteralKind.INT, "12ab");
    }

    @Test
    void testFloats() {
        assertConstant(2.5, ScalarType.F64, parse(Expr.LiteralKind.FLOAT, "2.5"));
        assertConstant(1e3, ScalarType.F64, parse(Expr.LiteralKind.FLOAT, "1e3"));
        assertConstant(0.5f, ScalarType.F32, parse(Expr.LiteralKind.FLOAT, "0.5f"));
        assertConstant(1234.5, ScalarType.F64, parse(Expr.LiteralKind.FLOAT, "1_234.5"));
        assertConstant(Double.POSITIVE_INFINITY, ScalarType.F64, parse(Expr.LiteralKind.FLOAT, "inff"));
        assertConstant(Double.NEGATIVE_INFINITY, ScalarType.F64, parse(Expr.LiteralKind.FLOAT, "-inf"));
        assertTrue(Double.isNaN((Double) parse(Expr.LiteralKind.FLOAT, "nanf").value));
    }

    @Test
    void testBooleans() {
        assertConstant(true, ScalarType.BOOL, parse(Expr.LiteralKind.BOOL, "true"));
        assertConstant(false, ScalarType.BOOL, parse(Expr.LiteralKind.BOOL, "false"));
        assertInvalid(Expr.LiteralKind.BOOL, "True");
    }

    @Test
    void testStrings() {
        assertConstant("a\tb\n\"c\"\\", ScalarType.STR,
                parse(Expr.LiteralKind.STRING, "\"a\\tb\\n\\\"c\\\"\\\\\""));
        assertConstant("\\q", ScalarType.STR, parse(Expr.LiteralKind.STRING, "\"\\q\""));
        assertConstant("", ScalarType.STR, parse(Expr.LiteralKind.STRING, "\"\""));
        assertInvalid(Expr.LiteralKind.STRING, "\"open");
    }

    @Test
    void testArguments() {
        assertConstant(3L, ScalarType.SI64, LiteralParser.parseArgument("n", " 3 ", LOC));
        assertConstant(0.25, ScalarType.F64, LiteralParser.parseArgument("n", "0.25", LOC));
        assertConstant("x y", ScalarType.STR, LiteralParser.parseArgument("s", "\"x y\"", LOC));
        assertConstant(true, ScalarType.BOOL, LiteralParser.parseArgument("b", "true", LOC));
    }

    @TestFactory
    Stream<DynamicTest> testInvalidArguments() {
        return Stream.of("3 4", "abc", "\"a\" \"b\"", "\"a\\\"", "")
                .map(text -> DynamicTest.dynamicTest("$arg=" + text, () -> {
                    TranslationException e = assertThrows(TranslationException.class,
                            () -> LiteralParser.parseArgument("arg", text, LOC));
                    assertEquals(TranslationError.Kind.INVALID_LITERAL, e.error.kind);
                    assertTrue(e.error.message.contains("'arg'"), e.error.message);
                }));
    }
}
