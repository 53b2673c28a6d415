package io.github.eutro.mdsl2ir.test;

import io.github.eutro.mdsl2ir.ast.*;
import io.github.eutro.mdsl2ir.ops.OpKey;
import io.github.eutro.mdsl2ir.ssa.Effect;
import io.github.eutro.mdsl2ir.ssa.Function;
import io.github.eutro.mdsl2ir.ssa.Module;
import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import io.github.eutro.mdsl2ir.translate.DslTranslator;
import io.github.eutro.mdsl2ir.translate.TranslationConfig;
import io.github.eutro.mdsl2ir.translate.TranslationError;
import io.github.eutro.mdsl2ir.translate.TranslationResult;

import java.io.FileNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Utils {
    public static final Path SCRIPT_PATH = Paths.get("test.daph");
    public static final SourceLocation LOC = new SourceLocation("test.daph", 1, 1);

    public static SourceLocation line(int line) {
        return new SourceLocation("test.daph", line, 1);
    }

    public static Expr.Literal i(long value) {
        return new Expr.Literal(LOC, Expr.LiteralKind.INT, Long.toString(value));
    }

    public static Expr.Unary neg(long value) {
        return new Expr.Unary(LOC, "-", i(value));
    }

    public static Expr.Literal f(String text) {
        return new Expr.Literal(LOC, Expr.LiteralKind.FLOAT, text);
    }

    public static Expr.Literal s(String value) {
        return new Expr.Literal(LOC, Expr.LiteralKind.STRING, "\"" + value + "\"");
    }

    public static Expr.Literal bool(boolean value) {
        return new Expr.Literal(LOC, Expr.LiteralKind.BOOL, Boolean.toString(value));
    }

    public static Expr.Identifier id(String name) {
        return new Expr.Identifier(LOC, name);
    }

    public static Expr.Binary bin(String op, Expr lhs, Expr rhs) {
        return new Expr.Binary(LOC, op, lhs, rhs, null);
    }

    public static Expr.Call call(String name, Expr... args) {
        return new Expr.Call(LOC, name, Arrays.asList(args), null);
    }

    public static Expr.MatrixLiteral matrix(Expr... elements) {
        return new Expr.MatrixLiteral(LOC, Arrays.asList(elements), null, null);
    }

    public static Stmt.Assign assign(String name, Expr value) {
        return new Stmt.Assign(LOC, Collections.singletonList(new Stmt.Target(name, null)), value);
    }

    public static Stmt.ExprStmt expr(Expr expr) {
        return new Stmt.ExprStmt(LOC, expr);
    }

    public static Stmt.ExprStmt print(Expr value) {
        return expr(call("print", value));
    }

    public static Stmt.Block block(Stmt... stmts) {
        return new Stmt.Block(LOC, Arrays.asList(stmts));
    }

    public static Stmt.If ifThen(Expr cond, Stmt thenStmt) {
        return new Stmt.If(LOC, cond, thenStmt, null);
    }

    public static Stmt.If ifElse(Expr cond, Stmt thenStmt, Stmt elseStmt) {
        return new Stmt.If(LOC, cond, thenStmt, elseStmt);
    }

    public static Stmt.For forLoop(String var, Expr from, Expr to, Stmt body) {
        return new Stmt.For(LOC, false, var, from, to, null, body);
    }

    public static Stmt.Return ret(Expr... values) {
        return new Stmt.Return(LOC, Arrays.asList(values));
    }

    public static Stmt.Param param(String name) {
        return new Stmt.Param(name, null);
    }

    public static Stmt.Param param(String name, String dataType, String valueType) {
        return new Stmt.Param(name, new TypeDef(dataType, valueType));
    }

    public static Stmt.Function func(String name, List<Stmt.Param> params, Stmt... body) {
        return new Stmt.Function(LOC, name, params, null, block(body));
    }

    public static Script script(Stmt... stmts) {
        return new Script(SCRIPT_PATH, Arrays.asList(stmts));
    }

    public static DslTranslator translator() {
        return new DslTranslator(TranslationConfig.DEFAULT, path -> {
            throw new FileNotFoundException(path.toString());
        });
    }

    public static Module translate(Stmt... stmts) {
        return translator().run(script(stmts));
    }

    public static TranslationError translateError(Stmt... stmts) {
        TranslationResult result = translator().translate(script(stmts));
        return result.getError().orElseThrow(() -> new AssertionError("translation succeeded:\n" + result.orElseThrow()));
    }

    public static List<Effect> effectsOf(Function func, OpKey key) {
        List<Effect> found = new ArrayList<>();
        func.body.walk(fx -> {
            if (fx.insn().op.key == key) found.add(fx);
        });
        return found;
    }

    public static Function functionNamed(Module module, String name) {
        for (Function func : module.getFunctions()) {
            if (func.name.equals(name)) return func;
        }
        throw new AssertionError("no function named " + name);
    }
}
