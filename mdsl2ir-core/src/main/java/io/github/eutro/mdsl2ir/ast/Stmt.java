package io.github.eutro.mdsl2ir.ast;

import io.github.eutro.mdsl2ir.ssa.SourceLocation;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A statement node. The {@link #kind} determines which subclass a node is.
 */
public abstract class Stmt {
    public enum Kind {
        BLOCK,
        EXPR,
        ASSIGN,
        IF,
        WHILE,
        FOR,
        PARFOR,
        FUNCTION,
        RETURN,
        IMPORT,
    }

    public final Kind kind;
    public final SourceLocation location;

    Stmt(Kind kind, SourceLocation location) {
        this.kind = kind;
        this.location = location;
    }

    private static <T> List<T> copy(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    public static final class Block extends Stmt {
        public final List<Stmt> statements;

        public Block(SourceLocation location, List<Stmt> statements) {
            super(Kind.BLOCK, location);
            this.statements = copy(statements);
        }
    }

    public static final class ExprStmt extends Stmt {
        public final Expr expr;

        public ExprStmt(SourceLocation location, Expr expr) {
            super(Kind.EXPR, location);
            this.expr = expr;
        }
    }

    /**
     * One target of an assignment, {@code name} or {@code name[rows, cols]}.
     */
    public static final class Target {
        public final String name;
        public final @Nullable Indexing indexing;

        public Target(String name, @Nullable Indexing indexing) {
            this.name = name;
            this.indexing = indexing;
        }
    }

    public static final class Assign extends Stmt {
        public final List<Target> targets;
        public final Expr value;

        public Assign(SourceLocation location, List<Target> targets, Expr value) {
            super(Kind.ASSIGN, location);
            this.targets = copy(targets);
            this.value = value;
        }
    }

    public static final class If extends Stmt {
        public final Expr cond;
        public final Stmt thenStmt;
        public final @Nullable Stmt elseStmt;

        public If(SourceLocation location, Expr cond, Stmt thenStmt, @Nullable Stmt elseStmt) {
            super(Kind.IF, location);
            this.cond = cond;
            this.thenStmt = thenStmt;
            this.elseStmt = elseStmt;
        }
    }

    /**
     * A {@code while} loop, or a {@code do ... while} loop if {@link #doWhile} is set.
     */
    public static final class While extends Stmt {
        public final Expr cond;
        public final Stmt body;
        public final boolean doWhile;

        public While(SourceLocation location, Expr cond, Stmt body, boolean doWhile) {
            super(Kind.WHILE, location);
            this.cond = cond;
            this.body = body;
            this.doWhile = doWhile;
        }
    }

    /**
     * {@code for (var in from:to:step) body}, or a {@code parfor} with the same shape.
     * Both bounds are inclusive.
     */
    public static final class For extends Stmt {
        public final String var;
        public final Expr from;
        public final Expr to;
        public final @Nullable Expr step;
        public final Stmt body;

        public For(SourceLocation location, boolean parallel, String var, Expr from, Expr to, @Nullable Expr step, Stmt body) {
            super(parallel ? Kind.PARFOR : Kind.FOR, location);
            this.var = var;
            this.from = from;
            this.to = to;
            this.step = step;
            this.body = body;
        }
    }

    public static final class Param {
        public final String name;
        public final @Nullable TypeDef type;

        public Param(String name, @Nullable TypeDef type) {
            this.name = name;
            this.type = type;
        }
    }

    /**
     * A function definition. {@link #returnTypes} is null if the result types are not declared.
     */
    public static final class Function extends Stmt {
        public final String name;
        public final List<Param> params;
        public final @Nullable List<TypeDef> returnTypes;
        public final Stmt body;

        public Function(SourceLocation location, String name, List<Param> params, @Nullable List<TypeDef> returnTypes, Stmt body) {
            super(Kind.FUNCTION, location);
            this.name = name;
            this.params = copy(params);
            this.returnTypes = returnTypes == null ? null : copy(returnTypes);
            this.body = body;
        }
    }

    public static final class Return extends Stmt {
        public final List<Expr> values;

        public Return(SourceLocation location, List<Expr> values) {
            super(Kind.RETURN, location);
            this.values = copy(values);
        }
    }

    /**
     * {@code import "path" as "alias";}. The path and alias are unquoted.
     */
    public static final class Import extends Stmt {
        public final String path;
        public final @Nullable String alias;

        public Import(SourceLocation location, String path, @Nullable String alias) {
            super(Kind.IMPORT, location);
            this.path = path;
            this.alias = alias;
        }
    }
}
