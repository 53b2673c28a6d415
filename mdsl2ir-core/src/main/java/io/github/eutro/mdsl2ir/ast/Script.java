package io.github.eutro.mdsl2ir.ast;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed script: its top-level statements and the file it was read from.
 */
public final class Script {
    public final Path path;
    public final List<Stmt> statements;

    public Script(Path path, List<Stmt> statements) {
        this.path = path;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }
}
