package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ast.Expr;
import io.github.eutro.mdsl2ir.ast.Stmt;
import io.github.eutro.mdsl2ir.ast.TypeDef;
import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.passes.form.RectifyEarlyReturns;
import io.github.eutro.mdsl2ir.ssa.*;
import io.github.eutro.mdsl2ir.types.*;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Translates user-defined functions, and calls to them or to built-ins.
 */
final class UdfResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(UdfResolver.class);

    private final ScriptTranslator t;

    UdfResolver(ScriptTranslator t) {
        this.t = t;
    }

    void visitFunction(Stmt.Function stmt) {
        if (t.symbols.getNumScopes() > 1) {
            throw TranslationException.of(
                    TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                    stmt.location,
                    "functions can only be defined at top-level");
        }
        Set<String> paramNames = new HashSet<>();
        List<Type> paramTypes = new ArrayList<>();
        for (Stmt.Param param : stmt.params) {
            if (!paramNames.add(param.name)) {
                throw TranslationException.of(
                        TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                        stmt.location,
                        "function argument name `%s` is used twice",
                        param.name);
            }
            paramTypes.add(resolveType(param.type, stmt.location));
        }

        Function func = t.session.module.newFunction(stmt.name);
        for (int i = 0; i < paramTypes.size(); i++) {
            func.newParam(stmt.params.get(i).name, paramTypes.get(i));
        }
        List<Type> declared = null;
        if (stmt.returnTypes != null) {
            declared = new ArrayList<>();
            for (TypeDef returnType : stmt.returnTypes) {
                declared.add(resolveType(returnType, stmt.location));
            }
            func.resultTypes.addAll(declared);
            // visible to the body, for recursion
            register(stmt.name, func);
        }

        SymbolTable callerSymbols = t.symbols;
        IRBuilder callerBuilder = t.builder;
        t.symbols = new SymbolTable();
        t.builder = new IRBuilder(func);
        t.builder.setLocation(stmt.location);
        try {
            for (Var param : func.getParams()) {
                t.symbols.put(param.name, new SymbolTable.SymbolInfo(param, false));
            }
            if (stmt.body.kind == Stmt.Kind.BLOCK) {
                t.visitBlock((Stmt.Block) stmt.body);
            } else {
                t.visitStmt(stmt.body);
            }
            new RectifyEarlyReturns(t.session::warn).runInPlace(func);
        } finally {
            t.symbols = callerSymbols;
            t.builder = callerBuilder;
        }

        Effect terminator = Objects.requireNonNull(func.body.getTerminator());
        List<Var> returned = terminator.insn().args();
        SourceLocation returnLocation = terminator.getNullable(CommonExts.LOCATION);
        if (returnLocation == null) returnLocation = stmt.location;
        if (declared == null) {
            for (Var value : returned) {
                func.resultTypes.add(value.type);
            }
            register(stmt.name, func);
        } else {
            if (returned.size() != declared.size()) {
                throw TranslationException.of(
                        TranslationError.Kind.ARITY_MISMATCH,
                        returnLocation,
                        "function `%s` returns a different number of values than specified in the definition (%d vs. %d)",
                        stmt.name,
                        returned.size(),
                        declared.size());
            }
            for (int i = 0; i < declared.size(); i++) {
                if (!Types.equalUnknownAware(returned.get(i).type, declared.get(i))) {
                    throw TranslationException.of(
                            TranslationError.Kind.TYPE_AMBIGUITY,
                            returnLocation,
                            "function `%s` returns a different type for return value #%d than specified in the definition (%s vs. %s)",
                            stmt.name,
                            i,
                            returned.get(i).type,
                            declared.get(i));
                }
            }
        }
    }

    private void register(String name, Function func) {
        LOGGER.debug("registered function {} as {}", name, func.symbol);
        t.functions.register(name, func);
    }

    private static Type resolveType(@Nullable TypeDef def, SourceLocation location) {
        if (def == null) return UnknownType.INSTANCE;
        Type vt = UnknownType.INSTANCE;
        if (def.valueType != null) {
            vt = Types.byName(def.valueType);
            if (vt == null) {
                throw TranslationException.of(
                        TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                        location,
                        "unsupported value type for function argument: %s",
                        def.valueType);
            }
        }
        if (def.dataType == null) return vt;
        if ("matrix".equals(def.dataType)) return new MatrixType(vt);
        throw TranslationException.of(
                TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                location,
                "unsupported data type for function argument: %s",
                def.dataType);
    }

    List<Var> visitCall(Expr.Call call) {
        if ("map".equals(call.name)) {
            return visitMap(call);
        }
        List<Var> args = new ArrayList<>(call.args.size());
        for (Expr arg : call.args) {
            args.add(t.visitValue(arg));
        }

        Function udf = t.functions.findMatching(call.name, args, call.location);
        if (udf != null) {
            if (call.kernelHint != null) {
                throw TranslationException.of(
                        TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                        call.location,
                        "kernel hints are not supported for calls to user-defined functions");
            }
            return t.builder.insertMulti(
                    DslOps.CALL.create(udf.symbol).insn(args),
                    udf.name,
                    udf.resultTypes);
        }

        Effect fx = Builtins.build(t.builder, call.name, args, call.location);
        if (call.kernelHint != null) {
            fx.attachExt(CommonExts.KERNEL_HINT, call.kernelHint);
        }
        return fx.getAssignsTo();
    }

    private List<Var> visitMap(Expr.Call call) {
        if (call.args.size() != 2) {
            throw TranslationException.of(
                    TranslationError.Kind.ARITY_MISMATCH,
                    call.location,
                    "built-in function 'map' expects exactly 2 argument(s), but got %d",
                    call.args.size());
        }
        Var matrix = t.visitValue(call.args.get(0));
        if (!(matrix.type instanceof MatrixType)) {
            throw TranslationException.of(
                    TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                    call.location,
                    "built-in function 'map' expects a matrix as its first argument, but got %s",
                    matrix.type);
        }
        Expr funcExpr = call.args.get(1);
        if (funcExpr.kind != Expr.Kind.IDENTIFIER) {
            throw TranslationException.of(
                    TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                    funcExpr.location,
                    "built-in function 'map' expects the name of a function as its second argument");
        }
        String name = ((Expr.Identifier) funcExpr).name;
        Function udf = t.functions.findMatchingUnary(name, ((MatrixType) matrix.type).elementType, call.location);
        if (udf == null) {
            throw TranslationException.of(
                    TranslationError.Kind.OVERLOAD_RESOLUTION,
                    funcExpr.location,
                    "no function definition of `%s` found",
                    name);
        }
        Var symbol = t.builder.constant(udf.symbol, ScalarType.STR);
        Effect fx = Builtins.build(t.builder, "map", Arrays.asList(matrix, symbol), call.location);
        if (call.kernelHint != null) {
            fx.attachExt(CommonExts.KERNEL_HINT, call.kernelHint);
        }
        return fx.getAssignsTo();
    }
}
