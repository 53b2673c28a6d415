package io.github.eutro.mdsl2ir.test;

import io.github.eutro.mdsl2ir.ast.*;
import io.github.eutro.mdsl2ir.ops.CommonOps;
import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.ops.Op;
import io.github.eutro.mdsl2ir.ssa.Effect;
import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.translate.TranslationError;
import io.github.eutro.mdsl2ir.types.MatrixType;
import io.github.eutro.mdsl2ir.types.ScalarType;
import io.github.eutro.mdsl2ir.types.UnknownType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.mdsl2ir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class IndexingTest {
    private static final MatrixType SI64_MATRIX = new MatrixType(ScalarType.SI64);

    private static Stmt.Assign defineMatrix() {
        return assign("m", matrix(i(1), i(2), i(3), i(4)));
    }

    private static Stmt.Assign defineFrame() {
        return assign("fr", new Expr.ColMajorFrame(LOC,
                Arrays.asList(s("a"), s("b")),
                Arrays.asList(matrix(i(1), i(2)), matrix(f("1.5"), f("2.5")))));
    }

    private static Expr index(Expr obj, Range rows, Range cols) {
        return new Expr.RightIndex(LOC, obj, new Indexing(rows, cols));
    }

    private static Stmt.Assign assignAt(String name, Range rows, Range cols, Expr value) {
        return new Stmt.Assign(LOC,
                Collections.singletonList(new Stmt.Target(name, new Indexing(rows, cols))),
                value);
    }

    private static List<Effect> effects(Module module, Op op) {
        return effectsOf(module.getMain(), op.key);
    }

    @Test
    void testSinglePosition() {
        Module module = translate(defineMatrix(), assign("r", index(id("m"), Range.at(i(1)), null)));
        List<Effect> slices = effects(module, DslOps.SLICE_ROW);
        assertEquals(1, slices.size());
        Effect slice = slices.get(0);
        assertEquals(SI64_MATRIX, slice.getAssignsTo().get(0).type);
        assertEquals(1L, CommonOps.constantValue(slice.insn().args().get(1)));
        assertEquals(1, effects(module, DslOps.EW_ADD).size());
    }

    @Test
    void testOpenRanges() {
        Module module = translate(defineMatrix(), assign("r", index(id("m"),
                Range.between(null, i(2)),
                Range.between(i(1), null))));
        Effect rows = effects(module, DslOps.SLICE_ROW).get(0);
        assertEquals(0L, CommonOps.constantValue(rows.insn().args().get(1)));
        assertEquals(2L, CommonOps.constantValue(rows.insn().args().get(2)));

        Effect cols = effects(module, DslOps.SLICE_COL).get(0);
        assertSame(rows.getAssignsTo().get(0), cols.insn().args().get(0));
        assertEquals(1, effects(module, DslOps.NUM_COLS).size());
        // the extent is a size, and is cast to si64
        assertEquals(1, effects(module, DslOps.CAST).size());
    }

    @Test
    void testFullRangeSelectsEverything() {
        Module module = translate(defineMatrix(), assign("r", index(id("m"),
                Range.between(null, null),
                Range.between(null, null))));
        assertTrue(effects(module, DslOps.SLICE_ROW).isEmpty());
        assertTrue(effects(module, DslOps.SLICE_COL).isEmpty());
        assertEquals(1, effects(module, CommonOps.RENAME).size());
    }

    @Test
    void testPositionsAsMatrix() {
        Module module = translate(defineMatrix(), assign("r", index(id("m"), Range.at(matrix(i(0), i(2))), null)));
        assertEquals(1, effects(module, DslOps.EXTRACT_ROW).size());
    }

    @Test
    void testFrameColumnLabel() {
        Module module = translate(defineFrame(), assign("c", index(id("fr"), null, Range.at(s("a")))));
        Effect extract = effects(module, DslOps.EXTRACT_COL).get(0);
        assertSame(UnknownType.INSTANCE, extract.getAssignsTo().get(0).type);
    }

    @Test
    void testLabelsOnlyForFrameColumns() {
        TranslationError error = translateError(defineMatrix(),
                assign("c", index(id("m"), null, Range.at(s("a")))));
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, error.kind);
        assertTrue(error.message.contains("label"), error.message);

        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, translateError(defineFrame(),
                assign("c", index(id("fr"), Range.at(s("a")), null))).kind);
    }

    @Test
    void testLeftIndexRow() {
        Module module = translate(defineMatrix(),
                assignAt("m", Range.at(i(0)), null, matrix(i(9))),
                print(id("m")));
        List<Effect> inserts = effects(module, DslOps.INSERT_ROW);
        assertEquals(1, inserts.size());
        Effect insert = inserts.get(0);
        assertEquals("m", insert.getAssignsTo().get(0).name);
        assertEquals(SI64_MATRIX, insert.getAssignsTo().get(0).type);

        Effect print = effectsOf(module.getMain(), DslOps.BUILTIN).get(0);
        assertSame(insert.getAssignsTo().get(0), print.insn().args().get(0));
    }

    @Test
    void testLeftIndexCell() {
        Module module = translate(defineMatrix(), assignAt("m", Range.at(i(0)), Range.at(i(1)), i(5)));
        assertEquals(1, effects(module, DslOps.SLICE_ROW).size());
        Effect col = effects(module, DslOps.INSERT_COL).get(0);
        Effect row = effects(module, DslOps.INSERT_ROW).get(0);
        assertSame(col.getAssignsTo().get(0), row.insn().args().get(1));
    }

    @Test
    void testLeftIndexLimits() {
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, translateError(defineFrame(),
                assignAt("fr", null, Range.at(s("a")), matrix(i(1), i(2)))).kind);
        assertEquals(TranslationError.Kind.UNSUPPORTED_CONSTRUCT, translateError(defineMatrix(),
                assignAt("m", Range.at(matrix(i(0))), null, matrix(i(1)))).kind);
    }

    @Test
    void testFilter() {
        Module module = translate(defineMatrix(), assign("r", new Expr.RightFilter(LOC, id("m"),
                matrix(bool(true), bool(false), bool(true), bool(false)), null)));
        Effect filter = effects(module, DslOps.FILTER_ROW).get(0);
        assertEquals(SI64_MATRIX, filter.getAssignsTo().get(0).type);
        assertTrue(effects(module, DslOps.FILTER_COL).isEmpty());
    }

    @Test
    void testTernary() {
        Module module = translate(assign("t", new Expr.Ternary(LOC, bool(true), i(1), f("2.5"))));
        Effect cond = effects(module, DslOps.COND).get(0);
        assertEquals(ScalarType.F64, cond.getAssignsTo().get(0).type);
    }

    @Test
    void testMatrixMultiplication() {
        Module module = translate(defineMatrix(), assign("p", bin("@", id("m"), id("m"))));
        Effect matmul = effects(module, DslOps.MAT_MUL).get(0);
        assertEquals(4, matmul.insn().args().size());
        assertEquals(false, CommonOps.constantValue(matmul.insn().args().get(2)));
        assertEquals(SI64_MATRIX, matmul.getAssignsTo().get(0).type);
    }

    @Test
    void testElementWiseTypes() {
        Module module = translate(defineMatrix(),
                assign("a", bin("*", id("m"), f("0.5"))),
                assign("b", bin("<", i(1), i(2))),
                assign("c", bin("<", id("m"), i(2))));
        assertEquals(new MatrixType(ScalarType.F64), effects(module, DslOps.EW_MUL).get(0).getAssignsTo().get(0).type);
        assertEquals(ScalarType.BOOL, effects(module, DslOps.EW_LT).get(0).getAssignsTo().get(0).type);
        assertEquals(SI64_MATRIX, effects(module, DslOps.EW_LT).get(1).getAssignsTo().get(0).type);
    }
}
