package io.github.eutro.mdsl2ir.translate;

import io.github.eutro.mdsl2ir.ast.Expr;
import io.github.eutro.mdsl2ir.ast.Script;
import io.github.eutro.mdsl2ir.ast.Stmt;
import io.github.eutro.mdsl2ir.ext.CommonExts;
import io.github.eutro.mdsl2ir.ops.CommonOps;
import io.github.eutro.mdsl2ir.ops.DslOps;
import io.github.eutro.mdsl2ir.ops.Op;
import io.github.eutro.mdsl2ir.ssa.*;
import io.github.eutro.mdsl2ir.types.*;

import java.nio.file.Path;
import java.util.*;

/**
 * Walks the statements of one script, emitting IR at the position of its builder.
 * <p>
 * Each script, including each imported one, is translated by its own instance, with its own
 * symbol table and function registry.
 */
final class ScriptTranslator {
    private static final Map<String, Op> BINARY_OPS = new HashMap<>();

    static {
        BINARY_OPS.put("^", DslOps.EW_POW);
        BINARY_OPS.put("%", DslOps.EW_MOD);
        BINARY_OPS.put("*", DslOps.EW_MUL);
        BINARY_OPS.put("/", DslOps.EW_DIV);
        BINARY_OPS.put("+", DslOps.EW_ADD);
        BINARY_OPS.put("-", DslOps.EW_SUB);
        BINARY_OPS.put("==", DslOps.EW_EQ);
        BINARY_OPS.put("!=", DslOps.EW_NEQ);
        BINARY_OPS.put("<", DslOps.EW_LT);
        BINARY_OPS.put("<=", DslOps.EW_LE);
        BINARY_OPS.put(">", DslOps.EW_GT);
        BINARY_OPS.put(">=", DslOps.EW_GE);
        BINARY_OPS.put("&&", DslOps.EW_AND);
        BINARY_OPS.put("||", DslOps.EW_OR);
    }

    private static final Set<String> HINTABLE_OPS = new HashSet<>(Arrays.asList("*", "/", "+", "-"));

    final TranslationSession session;
    final Path scriptPath;
    IRBuilder builder;
    SymbolTable symbols = new SymbolTable();
    final FunctionRegistry functions = new FunctionRegistry();
    // canonical paths of the files this script has imported
    final List<Path> importedFiles = new ArrayList<>();

    final LiteralBuilder literals = new LiteralBuilder(this);
    final IndexingLowering indexing = new IndexingLowering(this);
    final ControlFlowLowering controlFlow = new ControlFlowLowering(this);
    final UdfResolver udfs = new UdfResolver(this);
    final ImportResolver imports = new ImportResolver(this);

    ScriptTranslator(TranslationSession session, IRBuilder builder, Path scriptPath) {
        this.session = session;
        this.builder = builder;
        this.scriptPath = scriptPath;
    }

    void translateScript(Script script) {
        session.enterScript(scriptPath);
        try {
            for (Stmt stmt : script.statements) {
                visitStmt(stmt);
            }
        } finally {
            session.exitScript();
        }
    }

    void visitStmt(Stmt stmt) {
        SourceLocation saved = builder.getLocation();
        builder.setLocation(stmt.location);
        try {
            switch (stmt.kind) {
                case BLOCK:
                    visitBlock((Stmt.Block) stmt);
                    break;
                case EXPR:
                    visitExpr(((Stmt.ExprStmt) stmt).expr);
                    break;
                case ASSIGN:
                    visitAssign((Stmt.Assign) stmt);
                    break;
                case IF:
                    controlFlow.visitIf((Stmt.If) stmt);
                    break;
                case WHILE:
                    controlFlow.visitWhile((Stmt.While) stmt);
                    break;
                case FOR:
                    controlFlow.visitFor((Stmt.For) stmt);
                    break;
                case PARFOR:
                    controlFlow.visitParFor((Stmt.For) stmt);
                    break;
                case FUNCTION:
                    udfs.visitFunction((Stmt.Function) stmt);
                    break;
                case RETURN:
                    visitReturn((Stmt.Return) stmt);
                    break;
                case IMPORT:
                    imports.visitImport((Stmt.Import) stmt);
                    break;
                default:
                    throw new IllegalArgumentException("unknown statement kind " + stmt.kind);
            }
        } finally {
            builder.setLocation(saved);
        }
    }

    void visitBlock(Stmt.Block block) {
        symbols.pushScope();
        for (Stmt stmt : block.statements) {
            visitStmt(stmt);
        }
        symbols.put(symbols.popScope());
    }

    private void visitReturn(Stmt.Return ret) {
        List<Var> values = new ArrayList<>(ret.values.size());
        for (Expr value : ret.values) {
            values.add(visitValue(value));
        }
        builder.insert(CommonOps.RETURN.insn(values));
    }

    private void visitAssign(Stmt.Assign assign) {
        List<Var> values = visitExpr(assign.value);
        if (assign.targets.size() == 1) {
            if (values.size() != 1) {
                throw TranslationException.of(
                        TranslationError.Kind.ARITY_MISMATCH,
                        assign.location,
                        values.isEmpty()
                                ? "trying to assign the result of an expression that has no results"
                                : "trying to assign multiple results to a single variable");
            }
            handleAssignmentPart(assign.targets.get(0), values.get(0), assign.location);
            return;
        }
        if (assign.targets.size() != values.size()) {
            throw TranslationException.of(
                    TranslationError.Kind.ARITY_MISMATCH,
                    assign.location,
                    "trying to assign %d results to %d variables",
                    values.size(),
                    assign.targets.size());
        }
        for (int i = 0; i < values.size(); i++) {
            handleAssignmentPart(assign.targets.get(i), values.get(i), assign.location);
        }
    }

    private void handleAssignmentPart(Stmt.Target target, Var value, SourceLocation location) {
        SymbolTable.SymbolInfo info = symbols.get(target.name);
        if (info != null && info.readOnly) {
            throw TranslationException.of(
                    TranslationError.Kind.READ_ONLY_ASSIGNMENT,
                    location,
                    "trying to assign read-only variable %s",
                    target.name);
        }
        Var bound;
        if (target.indexing != null) {
            if (info == null) {
                throw TranslationException.of(
                        TranslationError.Kind.UNDEFINED_VARIABLE,
                        location,
                        "cannot use left indexing on variable %s before a value has been assigned to it",
                        target.name);
            }
            bound = indexing.leftIndex(target.name, info.value, target.indexing, value, location);
        } else {
            bound = renameIf(value, target.name);
        }
        symbols.put(target.name, new SymbolTable.SymbolInfo(bound, false));
    }

    /**
     * Visit an expression, returning its results.
     *
     * @param expr The expression.
     * @return The results, one for most expressions.
     */
    List<Var> visitExpr(Expr expr) {
        SourceLocation saved = builder.getLocation();
        builder.setLocation(expr.location);
        try {
            switch (expr.kind) {
                case LITERAL: {
                    LiteralParser.Constant k = LiteralParser.parse((Expr.Literal) expr);
                    return Collections.singletonList(builder.constant(k.value, k.type));
                }
                case ARG:
                    return Collections.singletonList(visitArg((Expr.Arg) expr));
                case IDENTIFIER:
                    return Collections.singletonList(lookup((Expr.Identifier) expr));
                case CALL:
                    return udfs.visitCall((Expr.Call) expr);
                case CAST:
                    return Collections.singletonList(visitCast((Expr.Cast) expr));
                case RIGHT_INDEX:
                    return Collections.singletonList(indexing.rightIndex((Expr.RightIndex) expr));
                case RIGHT_FILTER:
                    return Collections.singletonList(indexing.rightFilter((Expr.RightFilter) expr));
                case UNARY:
                    return Collections.singletonList(visitUnary((Expr.Unary) expr));
                case BINARY:
                    return Collections.singletonList(visitBinary((Expr.Binary) expr));
                case TERNARY:
                    return Collections.singletonList(visitTernary((Expr.Ternary) expr));
                case MATRIX_LITERAL:
                    return Collections.singletonList(literals.matrix((Expr.MatrixLiteral) expr));
                case COL_MAJOR_FRAME:
                    return Collections.singletonList(literals.colMajorFrame((Expr.ColMajorFrame) expr));
                case ROW_MAJOR_FRAME:
                    return Collections.singletonList(literals.rowMajorFrame((Expr.RowMajorFrame) expr));
                default:
                    throw new IllegalArgumentException("unknown expression kind " + expr.kind);
            }
        } finally {
            builder.setLocation(saved);
        }
    }

    /**
     * Visit an expression that must have exactly one result.
     *
     * @param expr The expression.
     * @return The result.
     */
    Var visitValue(Expr expr) {
        List<Var> results = visitExpr(expr);
        if (results.size() != 1) {
            throw TranslationException.of(
                    TranslationError.Kind.ARITY_MISMATCH,
                    expr.location,
                    "expected an expression with a single result, but got %d results",
                    results.size());
        }
        return results.get(0);
    }

    private Var lookup(Expr.Identifier id) {
        SymbolTable.SymbolInfo info = symbols.get(id.name);
        if (info == null) {
            throw TranslationException.of(
                    TranslationError.Kind.UNDEFINED_VARIABLE,
                    id.location,
                    "variable `%s` referenced before assignment",
                    id.name);
        }
        return info.value;
    }

    private Var visitArg(Expr.Arg arg) {
        String text = session.args.get(arg.name);
        if (text == null) {
            throw TranslationException.of(
                    TranslationError.Kind.UNDEFINED_VARIABLE,
                    arg.location,
                    "argument %s referenced, but not provided as a command line argument",
                    arg.name);
        }
        String trimmed = text.trim();
        boolean negate = trimmed.startsWith("-");
        LiteralParser.Constant k = LiteralParser.parseArgument(
                arg.name,
                negate ? trimmed.substring(1) : trimmed,
                arg.location);
        Var value = builder.constant(k.value, k.type);
        if (negate) {
            value = builder.insert(DslOps.EW_MINUS.insn(value), arg.name, value.type);
        }
        return value;
    }

    private Var visitUnary(Expr.Unary unary) {
        Var arg = visitValue(unary.arg);
        switch (unary.op) {
            case "-":
                return builder.insert(DslOps.EW_MINUS.insn(arg), "neg", arg.type);
            case "+":
                return arg;
            default:
                throw TranslationException.of(
                        TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                        unary.location,
                        "unknown unary operator `%s`",
                        unary.op);
        }
    }

    private Var visitBinary(Expr.Binary binary) {
        Var lhs = visitValue(binary.lhs);
        Var rhs = visitValue(binary.rhs);
        if (binary.kernelHint != null && !HINTABLE_OPS.contains(binary.op)) {
            throw TranslationException.of(
                    TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                    binary.location,
                    "kernel hints are not supported for the operator `%s`",
                    binary.op);
        }
        if ("@".equals(binary.op)) {
            Var noTranspose = builder.constant(false, ScalarType.BOOL);
            return builder.insert(
                    DslOps.MAT_MUL.insn(lhs, rhs, noTranspose, noTranspose),
                    "matmul",
                    lhs.type);
        }
        Op op = BINARY_OPS.get(binary.op);
        if (op == null) {
            throw TranslationException.of(
                    TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                    binary.location,
                    "unknown binary operator `%s`",
                    binary.op);
        }
        Var result = builder.func.newVar(op.key.mnemonic, TypeInference.elementWise(op, lhs.type, rhs.type));
        Effect fx = builder.insert(op.insn(lhs, rhs).assignTo(result));
        if (binary.kernelHint != null) {
            fx.attachExt(CommonExts.KERNEL_HINT, binary.kernelHint);
        }
        return result;
    }

    private Var visitTernary(Expr.Ternary ternary) {
        Var cond = visitValue(ternary.cond);
        Var thenVal = visitValue(ternary.thenExpr);
        Var elseVal = visitValue(ternary.elseExpr);
        return builder.insert(
                DslOps.COND.insn(cond, thenVal, elseVal),
                "cond",
                TypeInference.conditional(cond.type, thenVal.type, elseVal.type));
    }

    private Var visitCast(Expr.Cast cast) {
        Var arg = visitValue(cast.arg);
        Type vt = null;
        if (cast.valueType != null) {
            vt = Types.byName(cast.valueType);
            if (vt == null) {
                throw TranslationException.of(
                        TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                        cast.location,
                        "unsupported value type in cast: `%s`",
                        cast.valueType);
            }
        }
        Type target;
        if (cast.dataType == null) {
            if (vt == null) {
                throw new IllegalArgumentException("cast without a data type or a value type");
            }
            if (arg.type instanceof MatrixType) {
                target = new MatrixType(vt);
            } else if (arg.type instanceof FrameType) {
                throw TranslationException.of(
                        TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                        cast.location,
                        "casting a frame to a value type is not supported");
            } else if (arg.type.isUnknown()) {
                target = UnknownType.INSTANCE;
            } else {
                target = vt;
            }
        } else {
            switch (cast.dataType) {
                case "matrix":
                    target = vt == null ? Types.matrixOf(arg.type) : new MatrixType(vt);
                    break;
                case "frame":
                    if (vt != null) {
                        throw TranslationException.of(
                                TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                                cast.location,
                                "casting to a frame with a particular column type is not supported yet");
                    }
                    target = arg.type instanceof FrameType
                            ? arg.type
                            : new FrameType(Collections.singletonList(Types.valueTypeOf(arg.type)));
                    break;
                case "scalar":
                    target = vt == null ? Types.valueTypeOf(arg.type) : vt;
                    break;
                default:
                    throw TranslationException.of(
                            TranslationError.Kind.UNSUPPORTED_CONSTRUCT,
                            cast.location,
                            "unsupported data type in cast: `%s`",
                            cast.dataType);
            }
        }
        return builder.insert(DslOps.CAST.insn(arg), "cast", target);
    }

    /**
     * If a value is already bound to a name, insert a rename of it so the new binding
     * gets its own variable.
     *
     * @param value The value.
     * @param name  The name being bound.
     * @return The value to bind.
     */
    Var renameIf(Var value, String name) {
        if (symbols.has(value)) {
            return builder.insert(CommonOps.RENAME.insn(value), name, value.type);
        }
        return value;
    }

    /**
     * Insert a cast of a value to a type, unless it already has that type.
     *
     * @param type  The type.
     * @param value The value.
     * @return The cast value.
     */
    Var castIf(Type type, Var value) {
        if (value.type.equals(type)) return value;
        return builder.insert(DslOps.CAST.insn(value), value.name, type);
    }
}
