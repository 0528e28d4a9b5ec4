package io.github.eutro.mirlens.test;

import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.conf.RenderOptions;
import io.github.eutro.mirlens.core.index.*;
import io.github.eutro.mirlens.core.ir.*;
import io.github.eutro.mirlens.core.passes.Passes;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Utils {
    public static final long TY_UNIT = 0;
    public static final long TY_I32 = 1;
    public static final long TY_REF = 2;
    public static final long TY_STR = 3;
    public static final long TY_BOOL = 4;
    public static final long TY_FOO = 10;
    public static final long TY_PANIC = 11;
    public static final long TY_MAIN = 12;
    public static final long TY_MEMCPY = 13;

    public static final long SPAN_BORROW = 1;
    public static final long SPAN_USE = 2;
    public static final long SPAN_END = 3;
    public static final long SPAN_OTHER_FILE = 4;

    public static final long ALLOC_STR = 100;
    public static final long ALLOC_INT = 101;
    public static final long ALLOC_STATIC = 102;
    public static final long ALLOC_VTABLE = 103;
    public static final long ALLOC_FN = 104;
    public static final long ALLOC_PTR = 105;
    public static final long ALLOC_CYCLE_A = 200;
    public static final long ALLOC_CYCLE_B = 201;

    public static List<TypeEntry> types() {
        return Arrays.asList(
                new TypeEntry(TY_UNIT, TypeKind.VOID, "void"),
                new TypeEntry(TY_I32, TypeKind.PRIMITIVE, "i32"),
                new TypeEntry(TY_REF, TypeKind.REFERENCE, "&i32"),
                new TypeEntry(TY_STR, TypeKind.REFERENCE, "&str"),
                new TypeEntry(TY_BOOL, TypeKind.PRIMITIVE, "bool"),
                new TypeEntry(TY_FOO, TypeKind.FUNCTION, "fn() -> i32"),
                new TypeEntry(TY_PANIC, TypeKind.FUNCTION, "fn(&str) -> !"),
                new TypeEntry(TY_MAIN, TypeKind.FUNCTION, "fn()"),
                new TypeEntry(TY_MEMCPY, TypeKind.FUNCTION, "fn(*mut u8, *const u8, usize)")
        );
    }

    public static List<AllocInfo> allocs() {
        return Arrays.asList(
                new AllocInfo.Memory(ALLOC_STR, TY_STR, bytes("hello\n".getBytes(StandardCharsets.US_ASCII)), Collections.emptyList()),
                new AllocInfo.Memory(ALLOC_INT, TY_I32, bytes(new byte[]{42, 1, 0, 0}), Collections.emptyList()),
                new AllocInfo.Static(ALLOC_STATIC, TY_I32, "COUNTER"),
                new AllocInfo.VTable(ALLOC_VTABLE, TY_I32, "i32", "Debug"),
                new AllocInfo.Function(ALLOC_FN, TY_FOO, "demo::foo"),
                new AllocInfo.Memory(ALLOC_PTR, TY_REF, bytes(new byte[16]), Arrays.asList(ALLOC_INT, ALLOC_STR)),
                new AllocInfo.Memory(ALLOC_CYCLE_A, TY_REF, bytes(new byte[16]), Collections.singletonList(ALLOC_CYCLE_B)),
                new AllocInfo.Memory(ALLOC_CYCLE_B, TY_REF, bytes(new byte[16]), Collections.singletonList(ALLOC_CYCLE_A))
        );
    }

    public static List<SpanInfo> spans() {
        return Arrays.asList(
                new SpanInfo(SPAN_BORROW, "src/main.rs", 5, 9, 5, 20),
                new SpanInfo(SPAN_USE, "src/main.rs", 6, 5, 6, 10),
                new SpanInfo(SPAN_END, "src/main.rs", 7, 1, 7, 2),
                new SpanInfo(SPAN_OTHER_FILE, "src/other.rs", 1, 1, 1, 2)
        );
    }

    public static List<FunctionSymbol> functions() {
        return Arrays.asList(
                new FunctionSymbol(new FunctionKey(TY_FOO, null), FunctionSymbol.Kind.NORMAL, "demo::foo::h0123abcd"),
                new FunctionSymbol(new FunctionKey(TY_PANIC, null), FunctionSymbol.Kind.NORMAL, "core::panicking::panic"),
                new FunctionSymbol(new FunctionKey(TY_MAIN, null), FunctionSymbol.Kind.NORMAL, "demo::main"),
                new FunctionSymbol(new FunctionKey(TY_MEMCPY, null), FunctionSymbol.Kind.INTRINSIC, "copy_nonoverlapping")
        );
    }

    @NotNull
    public static Indices indices(RenderOptions options) {
        Map<FunctionKey, String> sources = new HashMap<>();
        sources.put(new FunctionKey(TY_FOO, null), "src/main.rs:5");
        return Indices.build(types(), allocs(), spans(), functions(), sources, options);
    }

    @NotNull
    public static Indices indices() {
        return indices(RenderOptions.DEFAULT);
    }

    public static Function function(String name, FunctionBody body) {
        return new Function(name, body, indices());
    }

    public static Function analyzed(String name, FunctionBody body) {
        Function func = function(name, body);
        Passes.ANALYZE.run(func);
        return func;
    }

    public static List<Byte> bytes(byte[] bs) {
        List<Byte> ls = new ArrayList<>(bs.length);
        for (byte b : bs) ls.add(b);
        return ls;
    }

    public static Place place(int local) {
        return Place.local(local);
    }

    public static Operand copy(int local) {
        return Operand.copy(Place.local(local));
    }

    public static Operand fn(long typeId) {
        return Operand.constant(new ConstOperand.ZeroSized(typeId));
    }

    public static Rvalue ref(int local) {
        return new Rvalue.Ref(BorrowKind.SHARED, Place.local(local));
    }

    public static Terminator.SwitchInt switchInt(int discr, int otherwise, long value, int target) {
        return new Terminator.SwitchInt(0, copy(discr),
                Collections.singletonList(new Terminator.SwitchInt.Branch(value, target)),
                otherwise);
    }

    /**
     * bb0 -> bb1, bb1 switches to bb2, back to bb0, or bb3; bb2 and bb3 return.
     */
    public static FunctionBody loopingSwitch() {
        BodyBuilder bb = new BodyBuilder();
        bb.newLocal(TY_UNIT, false, null);
        bb.newLocal(TY_I32, false, "x");
        int b0 = bb.newBlock(), b1 = bb.newBlock(), b2 = bb.newBlock(), b3 = bb.newBlock();
        bb.setBlock(b0).goTo(b1);
        bb.setBlock(b1).insertTerminator(new Terminator.SwitchInt(0, copy(1),
                Arrays.asList(
                        new Terminator.SwitchInt.Branch(0, b2),
                        new Terminator.SwitchInt.Branch(1, b0)),
                b3));
        bb.setBlock(b2).ret();
        bb.setBlock(b3).ret();
        return bb.build();
    }

    /**
     * {@code _2 = &_1} then {@code StorageDead(_2)}, all in bb0.
     */
    public static FunctionBody borrowThenDead() {
        BodyBuilder bb = new BodyBuilder();
        bb.newLocal(TY_UNIT, false, null);
        bb.newLocal(TY_I32, false, "x");
        bb.newLocal(TY_REF, false, "r");
        bb.newBlock();
        bb.setSpan(SPAN_BORROW).assign(place(2), ref(1))
                .setSpan(SPAN_END).storageDead(2)
                .ret();
        return bb.build();
    }
}
