package io.github.eutro.mirlens.core.cfg;

import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ext.Ext;
import io.github.eutro.mirlens.core.ext.ExtHolder;
import io.github.eutro.mirlens.core.ext.MetadataState;
import io.github.eutro.mirlens.core.index.FunctionIndex;
import io.github.eutro.mirlens.core.index.Indices;
import io.github.eutro.mirlens.core.ir.FunctionBody;
import org.jetbrains.annotations.Nullable;

/**
 * A function under analysis: its name, its immutable body, and the indices of the program
 * it belongs to.
 * <p>
 * Analysis results are attached to the function as exts, see {@link CommonExts}.
 * The body itself is never modified.
 */
public final class Function extends ExtHolder {
    public final String name;
    public final FunctionBody body;
    public final Indices indices;

    public Function(String name, FunctionBody body, Indices indices) {
        this.name = name;
        this.body = body;
        this.indices = indices;
    }

    /**
     * Get the name of this function without its module path.
     *
     * @return The short name.
     */
    public String shortName() {
        return FunctionIndex.shortName(name);
    }

    public int blockCount() {
        return body.blocks.size();
    }

    @Override
    public String toString() {
        return "fn " + name + " (" + body.blocks.size() + " blocks)";
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
