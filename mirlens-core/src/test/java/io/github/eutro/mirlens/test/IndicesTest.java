package io.github.eutro.mirlens.test;

import io.github.eutro.mirlens.core.conf.RenderOptions;
import io.github.eutro.mirlens.core.index.FunctionIndex;
import io.github.eutro.mirlens.core.index.FunctionKey;
import io.github.eutro.mirlens.core.index.FunctionSymbol;
import io.github.eutro.mirlens.core.index.Indices;
import io.github.eutro.mirlens.core.index.SpanInfo;
import io.github.eutro.mirlens.core.index.TypeIndex;
import io.github.eutro.mirlens.core.ir.ConstOperand;
import io.github.eutro.mirlens.core.ir.Operand;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static io.github.eutro.mirlens.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class IndicesTest {
    final Indices indices = Utils.indices();

    @Test
    void testTypes() {
        assertEquals("i32", indices.types.getName(TY_I32));
        assertEquals("()", indices.types.getName(TY_UNIT));
        assertEquals("ty77", indices.types.getName(77));
        assertEquals("ty77", TypeIndex.label(77));
        assertTrue(indices.types.isFunction(TY_FOO));
        assertFalse(indices.types.isFunction(TY_I32));
        assertFalse(indices.types.isFunction(77));
    }

    @Test
    void testSpans() {
        Optional<SpanInfo> span = indices.spans.get(SPAN_BORROW);
        assertTrue(span.isPresent());
        assertEquals("src/main.rs:5:9", span.get().shortForm());
        assertEquals("src/main.rs:5:9", indices.spans.describe(SPAN_BORROW));
        assertEquals("span42", indices.spans.describe(42));
        assertFalse(indices.spans.get(42).isPresent());
        assertNull(indices.spans.getNullable(42));
    }

    @Test
    void testShortName() {
        assertEquals("foo", FunctionIndex.shortName("demo::foo::h0123abcd"));
        assertEquals("foo", FunctionIndex.shortName("demo::foo"));
        assertEquals("main", FunctionIndex.shortName("main"));
        assertEquals("hash", FunctionIndex.shortName("std::hash"));
    }

    @Test
    void testFunctionLookup() {
        assertEquals(Optional.of("demo::foo::h0123abcd"), indices.functions.lookup(new FunctionKey(TY_FOO, null)));
        // falls back to the type alone
        assertEquals(Optional.of("demo::foo::h0123abcd"), indices.functions.lookup(new FunctionKey(TY_FOO, "Instance(3)")));
        assertEquals(Optional.empty(), indices.functions.lookup(new FunctionKey(77, null)));
        assertEquals(Optional.of("Intr: copy_nonoverlapping"), indices.functions.lookupByType(TY_MEMCPY));
        assertEquals("src/main.rs:5", indices.functions.sourceOf(TY_FOO));
        assertNull(indices.functions.sourceOf(TY_MAIN));
    }

    @Test
    void testInstanceKeys() {
        Map<FunctionKey, String> sources = new HashMap<>();
        FunctionIndex index = new FunctionIndex(Arrays.asList(
                new FunctionSymbol(new FunctionKey(1, "a"),
                        FunctionSymbol.Kind.NORMAL, "first"),
                new FunctionSymbol(new FunctionKey(1, "b"),
                        FunctionSymbol.Kind.NO_OP, "second")
        ), sources);
        assertEquals(Optional.of("first"), index.lookup(new FunctionKey(1, "a")));
        assertEquals(Optional.of("NoOp: second"), index.lookup(new FunctionKey(1, "b")));
        assertEquals(2, index.size());
    }

    @Test
    void testInstanceSources() {
        Map<FunctionKey, String> sources = new HashMap<>();
        sources.put(new FunctionKey(1, "a"), "src/lib.rs:10");
        sources.put(new FunctionKey(1, "b"), "src/lib.rs:20");
        sources.put(new FunctionKey(2, null), "src/lib.rs:30");
        FunctionIndex index = new FunctionIndex(Arrays.asList(
                new FunctionSymbol(new FunctionKey(1, "a"), FunctionSymbol.Kind.NORMAL, "first"),
                new FunctionSymbol(new FunctionKey(2, null), FunctionSymbol.Kind.NORMAL, "third")
        ), sources);
        assertEquals("src/lib.rs:10", index.sourceOf(new FunctionKey(1, "a")));
        assertEquals("src/lib.rs:20", index.sourceOf(new FunctionKey(1, "b")));
        // instances only: the type falls back to one of them
        assertTrue(Arrays.asList("src/lib.rs:10", "src/lib.rs:20").contains(index.sourceOf(1)));
        assertEquals("src/lib.rs:30", index.sourceOf(new FunctionKey(2, "c")));
        assertNull(index.sourceOf(new FunctionKey(3, "a")));
    }

    @Test
    void testResolveCallTarget() {
        assertEquals(Optional.of("demo::foo::h0123abcd"), indices.resolveCallTarget(fn(TY_FOO)));
        assertEquals(Optional.empty(), indices.resolveCallTarget(copy(1)));
        assertEquals(Optional.empty(), indices.resolveCallTarget(Operand.constant(new ConstOperand.ZeroSized(77))));
    }

    @Test
    void testEmpty() {
        Indices empty = Indices.empty();
        assertEquals("ty1", empty.types.getName(1));
        assertEquals("alloc1", empty.allocs.describe(1));
        assertEquals("span1", empty.spans.describe(1));
        assertEquals(Optional.empty(), empty.functions.lookupByType(1));
    }

    @Test
    void testOptionsFromEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("SHOW_SPANS", "1");
        RenderOptions options = RenderOptions.fromEnvironment(env);
        assertTrue(options.showSpans());
        assertFalse(options.showDebug());
        assertEquals(2, options.allocRefDepth());
        assertEquals(RenderOptions.DEFAULT.maxStringPreview(), options.maxStringPreview());
    }
}
