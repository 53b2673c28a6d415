package io.github.eutro.mdsl2ir.test;

import io.github.eutro.mdsl2ir.ssa.Function;
import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.ssa.Var;
import io.github.eutro.mdsl2ir.translate.SymbolTable;
import io.github.eutro.mdsl2ir.types.ScalarType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {
    private Function func;
    private SymbolTable symbols;

    @BeforeEach
    void setUp() {
        func = new Module().getMain();
        symbols = new SymbolTable();
    }

    private SymbolTable.SymbolInfo info(String name) {
        return new SymbolTable.SymbolInfo(func.newVar(name, ScalarType.SI64), false);
    }

    @Test
    void testShadowing() {
        SymbolTable.SymbolInfo outer = info("x");
        symbols.put("x", outer);
        symbols.pushScope();
        SymbolTable.SymbolInfo inner = info("x");
        symbols.put("x", inner);
        assertSame(inner, symbols.get("x"));
        symbols.popScope();
        assertSame(outer, symbols.get("x"));
    }

    @Test
    void testPopReturnsWriteSet() {
        symbols.put("b", info("b"));
        symbols.put("a", info("a"));
        symbols.pushScope();
        SymbolTable.SymbolInfo newA = info("a");
        SymbolTable.SymbolInfo newB = info("b");
        symbols.put("local", info("local"));
        symbols.put("b", newB);
        symbols.put("a", newA);
        SymbolTable.Scope written = symbols.popScope();
        assertEquals(Arrays.asList("a", "b"), new ArrayList<>(written.keySet()));
        assertSame(newA, written.get("a"));
        assertFalse(symbols.has("local"));
    }

    @Test
    void testLookupPrefersGivenScope() {
        SymbolTable.SymbolInfo outer = info("x");
        symbols.put("x", outer);
        SymbolTable.Scope scope = new SymbolTable.Scope();
        SymbolTable.SymbolInfo override = info("x");
        scope.put("x", override);
        assertSame(override, symbols.get("x", scope));
        assertSame(outer, symbols.get("x", new SymbolTable.Scope()));
        assertNull(symbols.get("y", scope));
    }

    @Test
    void testHasValue() {
        SymbolTable.SymbolInfo x = info("x");
        symbols.put("x", x);
        symbols.pushScope();
        assertTrue(symbols.has(x.value));
        Var unbound = func.newVar("u", ScalarType.SI64);
        assertFalse(symbols.has(unbound));
    }

    @Test
    void testOutermostScope() {
        assertEquals(1, symbols.getNumScopes());
        assertThrows(IllegalStateException.class, symbols::popScope);
        symbols.put("x", info("x"));
        assertEquals(1, symbols.topScope().size());
        symbols.topScope().clear();
        assertTrue(symbols.has("x"));
    }
}
