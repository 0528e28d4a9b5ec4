package io.github.eutro.mirlens.test;

import io.github.eutro.mirlens.core.cfg.BlockRole;
import io.github.eutro.mirlens.core.cfg.Program;
import io.github.eutro.mirlens.core.explore.*;
import io.github.eutro.mirlens.core.ir.BodyBuilder;
import io.github.eutro.mirlens.core.ir.BorrowKind;
import io.github.eutro.mirlens.core.ir.Rvalue;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.mirlens.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExplorerJsonTest {
    static ExplorerData data;

    @BeforeAll
    static void build() {
        Program program = new Program("demo", Utils.indices());
        program.addFunction("demo::looping", loopingSwitch());
        program.addFunction("core::ptr::drop_in_place", loopingSwitch());
        program.addFunction("demo::main::h00ff", borrowThenDead());
        data = new ExplorerBuilder().build(program);
    }

    static List<String> roles(ExplorerFunction func) {
        List<String> roles = new ArrayList<>();
        for (ExplorerBlock block : func.blocks) {
            roles.add(block.role);
        }
        return roles;
    }

    @Test
    void testSkipsLibraryFunctions() {
        assertEquals(2, data.functions.size());
        assertEquals("looping", data.functions.get(0).shortName);
        assertEquals("main", data.functions.get(1).shortName);
        assertTrue(ExplorerBuilder.isLibraryFunction("std::io::print"));
        assertFalse(ExplorerBuilder.isLibraryFunction("demo::stdout"));
    }

    @Test
    void testBlocks() {
        ExplorerFunction looping = data.functions.get(0);
        assertEquals(Arrays.asList("entry", "loop", "return", "return"), roles(looping));
        ExplorerBlock header = looping.getBlock(1);
        assertEquals("switch", header.terminator.kind);
        assertEquals("SwitchInt cp(_1)", header.terminator.mir);
        assertEquals(Collections.singletonList(0), header.predecessors);
        assertEquals("In loop: Branch based on value of cp(_1)", header.summary);
        assertEquals(3, header.terminator.edges.size());
        ExplorerEdge otherwise = header.terminator.edges.get(2);
        assertEquals(3, otherwise.target);
        assertEquals("else", otherwise.label);
        assertEquals("otherwise", otherwise.kind);
        assertEquals("Otherwise (no match)", otherwise.annotation);
        assertEquals("Entry point", looping.getBlock(0).summary);
        assertEquals("Function returns", looping.getBlock(2).summary);
    }

    @Test
    void testBorrowsAndLocals() {
        ExplorerFunction main = data.functions.get(1);
        assertEquals(1, main.borrows.size());
        ExplorerBorrow borrow = main.borrows.get(0);
        assertEquals("bb0[0]", borrow.start);
        assertEquals("bb0[1]", borrow.end);
        assertEquals("'b0: lines 5-7", borrow.lifetime);
        assertEquals(Collections.singletonList("bb0[0]"), borrow.live);
        assertFalse(borrow.mutable);
        assertEquals("shared", borrow.kind);
        assertEquals("src/main.rs:5:9", borrow.span);
        assertEquals(SPAN_BORROW, borrow.spanId);

        ExplorerStmt first = main.getBlock(0).statements.get(0);
        assertEquals("_2 <- &_1", first.mir);
        assertEquals("Shared borrow", first.annotation);
        assertEquals(Collections.singletonList(0), first.liveBorrows);
        assertTrue(main.getBlock(0).statements.get(1).liveBorrows.isEmpty());

        assertEquals(3, main.locals.size());
        ExplorerLocal r = main.locals.get(2);
        assertEquals("&i32", r.type);
        assertEquals("r", r.sourceName);
        assertEquals("'_2: <unknown>", r.lifetime);
        assertEquals(Collections.singletonList("Introduces borrows"), main.properties);
    }

    @Test
    void testBorrowKinds() {
        BodyBuilder bb = new BodyBuilder();
        bb.newLocal(TY_UNIT, false, null);
        bb.newLocal(TY_I32, true, "x");
        bb.newLocal(TY_REF, false, null);
        bb.newLocal(TY_REF, false, null);
        bb.newBlock();
        bb.setSpan(SPAN_USE).assign(place(2), new Rvalue.Ref(BorrowKind.SHALLOW, place(1)))
                .setSpan(SPAN_END).assign(place(3), new Rvalue.Ref(BorrowKind.MUTABLE, place(1)))
                .ret();
        ExplorerFunction guard = new ExplorerBuilder().buildFunction(function("demo::guard", bb.build()));
        assertEquals(2, guard.borrows.size());

        ExplorerBorrow shallow = guard.borrows.get(0);
        assertEquals("shallow", shallow.kind);
        assertFalse(shallow.mutable);
        assertEquals("src/main.rs:6:5", shallow.span);
        ExplorerBorrow mutable = guard.borrows.get(1);
        assertEquals("mutable", mutable.kind);
        assertTrue(mutable.mutable);
        assertEquals(SPAN_END, mutable.spanId);

        ExplorerBorrow parsed = Json.fromJson(Json.toJson(shallow), ExplorerBorrow.class);
        assertEquals("shallow", parsed.kind);
        assertEquals(SPAN_USE, parsed.spanId);
        assertTrue(Json.toJson(shallow).contains("\"span_id\""));
    }

    @Test
    void testRoundTrip() {
        String json = Json.toJson(data);
        assertTrue(json.contains("\"short_name\""));
        assertTrue(json.contains("\"entry_block\""));
        ExplorerData parsed = Json.fromJson(json, ExplorerData.class);
        assertEquals(data.name, parsed.name);
        assertEquals(data.functions.size(), parsed.functions.size());
        assertEquals(roles(data.functions.get(0)), roles(parsed.functions.get(0)));
        assertEquals(BlockRole.LOOP, BlockRole.fromId(parsed.functions.get(0).getBlock(1).role));
        assertEquals(data.functions.get(1).borrows.get(0).live, parsed.functions.get(1).borrows.get(0).live);
        assertEquals(json, Json.toJson(parsed));
    }

    @Test
    void testSnapshotJson() {
        PathNavigator nav = new PathNavigator(data);
        nav.followSelected();
        nav.jumpToEdgeButton(3);
        NavigatorSnapshot snapshot = nav.snapshot();
        String json = Json.toJson(snapshot);
        assertTrue(json.contains("\"selected_edge\""));
        assertEquals(snapshot, Json.fromJson(json, NavigatorSnapshot.class));
    }

    @Test
    void testMalformedJson() {
        assertThrows(UncheckedIOException.class, () -> Json.fromJson("{\"name\": [", ExplorerData.class));
    }
}
