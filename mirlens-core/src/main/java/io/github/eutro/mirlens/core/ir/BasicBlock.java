package io.github.eutro.mirlens.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A straight-line sequence of statements, ended by exactly one terminator.
 */
public final class BasicBlock {
    public final List<Statement> statements;
    public final Terminator terminator;

    public BasicBlock(List<Statement> statements, Terminator terminator) {
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.terminator = terminator;
    }

    /**
     * Get the offset that denotes this block's terminator in a {@link Location}.
     *
     * @return The number of statements.
     */
    public int terminatorOffset() {
        return statements.size();
    }
}
