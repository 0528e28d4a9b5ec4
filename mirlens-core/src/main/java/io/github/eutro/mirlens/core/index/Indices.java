package io.github.eutro.mirlens.core.index;

import io.github.eutro.mirlens.core.conf.RenderOptions;
import io.github.eutro.mirlens.core.ir.Operand;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * The four resolution indices of a program, built once from its metadata tables.
 * <p>
 * Indices are read-only after construction, and may be shared freely, across threads too.
 */
public final class Indices {
    private static final Logger logger = LogManager.getLogger(Indices.class);

    public final TypeIndex types;
    public final AllocIndex allocs;
    public final SpanIndex spans;
    public final FunctionIndex functions;

    public Indices(TypeIndex types, AllocIndex allocs, SpanIndex spans, FunctionIndex functions) {
        this.types = types;
        this.allocs = allocs;
        this.spans = spans;
        this.functions = functions;
    }

    /**
     * Build the indices from metadata tables.
     *
     * @param types     The type table.
     * @param allocs    The allocation table.
     * @param spans     The span table.
     * @param functions The function symbol table.
     * @param sources   Debug function sources, possibly empty.
     * @param options   Options for describing allocations.
     * @return The indices.
     */
    public static Indices build(Iterable<TypeEntry> types,
                                Iterable<? extends AllocInfo> allocs,
                                Iterable<SpanInfo> spans,
                                Iterable<FunctionSymbol> functions,
                                Map<FunctionKey, String> sources,
                                RenderOptions options) {
        TypeIndex typeIndex = new TypeIndex(types);
        Indices indices = new Indices(
                typeIndex,
                new AllocIndex(allocs, typeIndex, options),
                new SpanIndex(spans),
                new FunctionIndex(functions, sources)
        );
        logger.debug("built indices: {} types, {} allocs, {} spans, {} functions",
                typeIndex.size(), indices.allocs.size(), indices.spans.size(), indices.functions.size());
        return indices;
    }

    public static Indices build(Iterable<TypeEntry> types,
                                Iterable<? extends AllocInfo> allocs,
                                Iterable<SpanInfo> spans,
                                Iterable<FunctionSymbol> functions) {
        return build(types, allocs, spans, functions, Collections.emptyMap(), RenderOptions.DEFAULT);
    }

    /**
     * Indices with no entries, where every lookup falls back.
     *
     * @return The indices.
     */
    public static Indices empty() {
        return build(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    /**
     * Resolve the function a call operand refers to, if it is a constant function.
     *
     * @param func The callee operand.
     * @return The function's display name, or empty for indirect or unknown callees.
     */
    public Optional<String> resolveCallTarget(Operand func) {
        if (!(func instanceof Operand.Constant)) return Optional.empty();
        return functions.lookupByType(((Operand.Constant) func).value.typeId);
    }
}
