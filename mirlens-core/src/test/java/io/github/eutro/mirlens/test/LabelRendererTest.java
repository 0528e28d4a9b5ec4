package io.github.eutro.mirlens.test;

import io.github.eutro.mirlens.core.conf.RenderOptions;
import io.github.eutro.mirlens.core.display.Annotations;
import io.github.eutro.mirlens.core.display.LabelRenderer;
import io.github.eutro.mirlens.core.ir.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.mirlens.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class LabelRendererTest {
    final LabelRenderer renderer = new LabelRenderer(Utils.indices(), RenderOptions.DEFAULT);
    final Annotations annotations = new Annotations(renderer);

    @Test
    void testPlaces() {
        assertEquals("_1", renderer.renderPlace(place(1)));
        assertEquals("(*_1)", renderer.renderPlace(place(1).project(ProjectionElem.DEREF)));
        assertEquals("(*_1).0", renderer.renderPlace(place(1).project(ProjectionElem.DEREF, new ProjectionElem.Field(0, TY_I32))));
        assertEquals("_1[_2]", renderer.renderPlace(place(1).project(new ProjectionElem.Index(2))));
        assertEquals("_1[3]", renderer.renderPlace(place(1).project(new ProjectionElem.ConstantIndex(3, 4, false))));
        assertEquals("_1[-3]", renderer.renderPlace(place(1).project(new ProjectionElem.ConstantIndex(3, 4, true))));
        assertEquals("_1[1..-2]", renderer.renderPlace(place(1).project(new ProjectionElem.Subslice(1, 2, true))));
        assertEquals("(_1 as variant 1)", renderer.renderPlace(place(1).project(new ProjectionElem.Downcast(1))));
        assertEquals("_1 as type i32", renderer.renderPlace(place(1).project(new ProjectionElem.OpaqueCast(TY_I32))));
        assertEquals("_1 :> ty77", renderer.renderPlace(place(1).project(new ProjectionElem.Subtype(77))));
    }

    @Test
    void testConstants() {
        assertEquals("const 298_i32", renderer.renderConst(new ConstOperand.Allocated(TY_I32,
                bytes(new byte[]{42, 1, 0, 0}), Collections.emptyList())));
        assertEquals("const i32", renderer.renderConst(new ConstOperand.Allocated(TY_I32,
                Collections.emptyList(), Collections.emptyList())));
        assertEquals("const [alloc105: &i32 (16 bytes) -> [alloc101: i32 = 298, alloc100: \"hello\\n\"]]",
                renderer.renderConst(new ConstOperand.Allocated(TY_REF, bytes(new byte[8]),
                        Collections.singletonList(ALLOC_PTR))));
        assertEquals("const fn foo", renderer.renderConst(new ConstOperand.ZeroSized(TY_FOO)));
        assertEquals("const ()", renderer.renderConst(new ConstOperand.ZeroSized(TY_UNIT)));
        assertEquals("const bool", renderer.renderConst(new ConstOperand.TyConst(TY_BOOL)));
        assertEquals("const N", renderer.renderConst(new ConstOperand.Unevaluated(TY_I32, "N")));
        assertEquals("const unevaluated i32", renderer.renderConst(new ConstOperand.Unevaluated(TY_I32, null)));
        assertEquals("const param i32", renderer.renderConst(new ConstOperand.Param(TY_I32)));
    }

    @Test
    void testAllocRefDepth() {
        LabelRenderer shallow = new LabelRenderer(Utils.indices(),
                RenderOptions.builder().allocRefDepth(0).build());
        assertEquals("const [alloc105: &i32 (16 bytes)]",
                shallow.renderConst(new ConstOperand.Allocated(TY_REF, bytes(new byte[8]),
                        Collections.singletonList(ALLOC_PTR))));
    }

    @Test
    void testRvalues() {
        assertEquals("&_1", renderer.renderRvalue(ref(1)));
        assertEquals("&mut _1", renderer.renderRvalue(new Rvalue.Ref(BorrowKind.MUTABLE, place(1))));
        assertEquals("&raw mut _1", renderer.renderRvalue(new Rvalue.AddressOf(true, place(1))));
        assertEquals("Add(cp(_1), cp(_2))", renderer.renderRvalue(new Rvalue.BinaryOp(BinOp.ADD, copy(1), copy(2))));
        assertEquals("chkd-AddUnchecked(cp(_1), mv(_2))", renderer.renderRvalue(
                new Rvalue.CheckedBinaryOp(BinOp.ADD_UNCHECKED, copy(1), Operand.move(place(2)))));
        assertEquals("Tuple (cp(_1), cp(_2))", renderer.renderRvalue(
                new Rvalue.Aggregate(AggregateKind.TUPLE, Arrays.asList(copy(1), copy(2)))));
        assertEquals("Adt{2} ()", renderer.renderRvalue(
                new Rvalue.Aggregate(AggregateKind.adt(2), Collections.emptyList())));
        assertEquals("*mut (i32) (cp(_1))", renderer.renderRvalue(
                new Rvalue.Aggregate(AggregateKind.rawPtr(TY_I32, true), Collections.singletonList(copy(1)))));
        assertEquals("Cast-IntToInt cp(_1)", renderer.renderRvalue(new Rvalue.Cast("IntToInt", copy(1), TY_I32)));
        assertEquals("Discriminant(_1)", renderer.renderRvalue(new Rvalue.Discriminant(place(1))));
        assertEquals("SizeOf :: i32", renderer.renderRvalue(new Rvalue.NullaryOp("SizeOf", TY_I32)));
        assertEquals("Use(const fn foo)", renderer.renderRvalue(new Rvalue.Use(fn(TY_FOO))));
    }

    @Test
    void testStatements() {
        assertEquals("_2 <- &_1", renderer.renderStatement(new Statement.Assign(SPAN_BORROW, place(2), ref(1))));
        assertEquals("Storage Dead _2", renderer.renderStatement(new Statement.StorageDead(0, 2)));
        assertEquals("Fake-Read _1", renderer.renderStatement(new Statement.FakeRead(0, place(1))));
        assertEquals("set discriminant _1(3)", renderer.renderStatement(new Statement.SetDiscriminant(0, place(1), 3)));
        assertEquals("Nop", renderer.renderStatement(new Statement.Nop(0)));
    }

    @Test
    void testSpanAndDebugSuffixes() {
        LabelRenderer verbose = new LabelRenderer(Utils.indices(),
                RenderOptions.builder().showSpans(true).showDebug(true).build());
        assertEquals("_2 <- &_1 @ src/main.rs:5:9",
                verbose.renderStatement(new Statement.Assign(SPAN_BORROW, place(2), ref(1))));
        assertEquals("Nop", verbose.renderStatement(new Statement.Nop(42)));
        Terminator call = new Terminator.Call(SPAN_USE, fn(TY_FOO), Collections.singletonList(copy(1)),
                place(0), 1, UnwindAction.CONTINUE);
        assertEquals("_0 = foo(cp(_1)) [src/main.rs:5] @ src/main.rs:6:5", verbose.renderTerminator(call));
        assertEquals("_0 = foo(cp(_1))", renderer.renderTerminator(call));
    }

    @Test
    void testTerminators() {
        assertEquals("_0 = fn?()", renderer.renderTerminator(new Terminator.Call(0, copy(3),
                Collections.emptyList(), place(0), null, UnwindAction.CONTINUE)));
        assertEquals("Drop _1", renderer.renderTerminator(new Terminator.Drop(0, place(1), 1, UnwindAction.CONTINUE)));
        assertEquals("SwitchInt cp(_1)", renderer.renderTerminator(switchInt(1, 2, 0, 1)));
        assertEquals("Assert cp(_1) == true", renderer.renderTerminator(
                new Terminator.Assert(0, copy(1), true, 1, UnwindAction.cleanup(2))));
    }

    @Test
    void testLocals() {
        assertEquals("_1: mut i32 (x)", renderer.renderLocal(1, new LocalDecl(TY_I32, true, "x")));
        assertEquals("_0: ()", renderer.renderLocal(0, new LocalDecl(TY_UNIT, false, null)));
    }

    @Test
    void testAnnotations() {
        assertEquals("Shared borrow", annotations.statement(new Statement.Assign(0, place(2), ref(1))));
        assertEquals("Checked Add (may panic)", annotations.rvalue(
                new Rvalue.CheckedBinaryOp(BinOp.ADD, copy(1), copy(2))));
        assertEquals("Load constant", annotations.rvalue(new Rvalue.Use(fn(TY_FOO))));
        assertEquals("Deallocate stack space for _2", annotations.statement(new Statement.StorageDead(0, 2)));
        assertEquals("", annotations.statement(new Statement.Retag(0, place(1))));

        Terminator assertion = new Terminator.Assert(0, copy(3), true, 1, UnwindAction.cleanup(2));
        assertEquals("Panic if cp(_3) is false", annotations.terminator(assertion, "main"));
        assertEquals("Assertion passed", annotations.edge(assertion, assertion.edges().get(0)));
        assertEquals("Assertion failed (panic)", annotations.edge(assertion, assertion.edges().get(1)));

        Terminator call = new Terminator.Call(0, fn(TY_FOO), Collections.emptyList(),
                place(0), 1, UnwindAction.cleanup(2));
        assertEquals("RECURSIVE call to foo", annotations.terminator(call, "foo"));
        assertEquals("Call foo", annotations.terminator(call, "main"));
        assertEquals("After foo returns", annotations.edge(call, call.edges().get(0)));
        assertEquals("If call panics (cleanup)", annotations.edge(call, call.edges().get(1)));

        Terminator sw = switchInt(1, 2, 7, 1);
        assertEquals("If cp(_1) == 7", annotations.edge(sw, sw.edges().get(0)));
        assertEquals("Otherwise (no match)", annotations.edge(sw, sw.edges().get(1)));
    }
}
