package io.github.eutro.mirlens.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A body builder, which encapsulates a position in a function body
 * where statements are being inserted.
 * <p>
 * Statements inserted through the helpers are stamped with the builder's current span.
 */
public class BodyBuilder {
    private final List<List<Statement>> statements = new ArrayList<>();
    private final List<Terminator> terminators = new ArrayList<>();
    private final List<LocalDecl> locals = new ArrayList<>();
    private @Nullable Long functionSpan;
    private int block = -1;
    private long span;

    /**
     * Create a new block. The builder does not move to it.
     *
     * @return The index of the new block.
     */
    public int newBlock() {
        statements.add(new ArrayList<>());
        terminators.add(null);
        if (block == -1) block = 0;
        return statements.size() - 1;
    }

    /**
     * Declare a new local.
     *
     * @param typeId     The type of the local.
     * @param mutable    Whether it is declared mutable.
     * @param sourceName The user-facing name, or null.
     * @return The local index.
     */
    public int newLocal(long typeId, boolean mutable, @Nullable String sourceName) {
        locals.add(new LocalDecl(typeId, mutable, sourceName));
        return locals.size() - 1;
    }

    /**
     * Get the block this builder is inserting at the end of.
     *
     * @return The block index.
     */
    public int getBlock() {
        return block;
    }

    /**
     * Set the block this builder should insert at the end of.
     *
     * @param block The block index.
     */
    public BodyBuilder setBlock(int block) {
        if (block < 0 || block >= statements.size()) {
            throw new MalformedIrException("no block bb" + block);
        }
        this.block = block;
        return this;
    }

    /**
     * Set the span that subsequent helper-built statements are stamped with.
     *
     * @param span The span id.
     */
    public BodyBuilder setSpan(long span) {
        this.span = span;
        return this;
    }

    public BodyBuilder setFunctionSpan(@Nullable Long functionSpan) {
        this.functionSpan = functionSpan;
        return this;
    }

    public long getSpan() {
        return span;
    }

    /**
     * Insert a statement at the end of the current block.
     *
     * @param stmt The statement.
     */
    public BodyBuilder insert(Statement stmt) {
        current().add(stmt);
        return this;
    }

    public BodyBuilder assign(Place place, Rvalue rvalue) {
        return insert(new Statement.Assign(span, place, rvalue));
    }

    public BodyBuilder storageLive(int local) {
        return insert(new Statement.StorageLive(span, local));
    }

    public BodyBuilder storageDead(int local) {
        return insert(new Statement.StorageDead(span, local));
    }

    /**
     * Set the terminator of the current block.
     *
     * @param terminator The terminator.
     */
    public BodyBuilder insertTerminator(Terminator terminator) {
        current();
        terminators.set(block, terminator);
        return this;
    }

    public BodyBuilder goTo(int target) {
        return insertTerminator(new Terminator.Goto(span, target));
    }

    public BodyBuilder ret() {
        return insertTerminator(new Terminator.Return(span));
    }

    /**
     * Build the body. Every block must have been given a terminator.
     *
     * @return The body.
     * @throws MalformedIrException If a block has no terminator.
     */
    public FunctionBody build() {
        List<BasicBlock> blocks = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            Terminator terminator = terminators.get(i);
            if (terminator == null) {
                throw new MalformedIrException("block bb" + i + " has no terminator");
            }
            blocks.add(new BasicBlock(statements.get(i), terminator));
        }
        return new FunctionBody(blocks, locals, functionSpan);
    }

    private List<Statement> current() {
        if (block == -1) throw new IllegalStateException("no block to insert into");
        return statements.get(block);
    }
}
