package io.github.eutro.mirlens.test;

import io.github.eutro.mirlens.core.analysis.LifetimeIndex;
import io.github.eutro.mirlens.core.analysis.LocalLifetime;
import io.github.eutro.mirlens.core.analysis.SourceRange;
import io.github.eutro.mirlens.core.cfg.Function;
import io.github.eutro.mirlens.core.ext.CommonExts;
import io.github.eutro.mirlens.core.ir.BodyBuilder;
import io.github.eutro.mirlens.core.ir.FunctionBody;
import io.github.eutro.mirlens.core.ir.Location;
import io.github.eutro.mirlens.core.ir.MalformedIrException;
import io.github.eutro.mirlens.core.ir.Statement;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static io.github.eutro.mirlens.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class LifetimeTest {
    static LifetimeIndex lifetimes;

    static FunctionBody scopes() {
        BodyBuilder bb = new BodyBuilder();
        for (int i = 0; i < 5; i++) {
            bb.newLocal(i == 0 ? TY_UNIT : TY_I32, false, null);
        }
        int b0 = bb.newBlock(), b1 = bb.newBlock();
        bb.setBlock(b0)
                .setSpan(SPAN_BORROW).storageLive(1)
                .setSpan(SPAN_USE).storageLive(2)
                .storageDead(2)
                .setSpan(SPAN_OTHER_FILE).storageLive(3)
                .goTo(b1);
        bb.setBlock(b1)
                .setSpan(SPAN_USE).storageLive(1)
                .setSpan(SPAN_END).storageDead(1)
                .storageDead(3)
                .storageDead(9)
                .ret();
        return bb.build();
    }

    @BeforeAll
    static void analyze() {
        Function func = analyzed("demo::scopes", scopes());
        lifetimes = func.getExtOrThrow(CommonExts.LIFETIMES);
    }

    @Test
    void testWidestRange() {
        LocalLifetime x = lifetimes.get(1);
        assertNotNull(x);
        assertEquals(Location.of(0, 0), x.storageLive);
        assertEquals(Location.of(1, 1), x.storageDead);
        assertEquals(new SourceRange(5, 9, 7, 2), x.sourceRange);
        assertEquals("'_1: lines 5-7", x.formatRange());
        assertEquals("5-7", x.rangeString());
    }

    @Test
    void testSingleLine() {
        LocalLifetime y = lifetimes.get(2);
        assertNotNull(y);
        assertNotNull(y.sourceRange);
        assertTrue(y.sourceRange.isSingleLine());
        assertEquals("6:5-10", y.rangeString());
        assertEquals("'_2: line 6:5-10", y.formatRange());
    }

    @Test
    void testDifferentFiles() {
        LocalLifetime z = lifetimes.get(3);
        assertNotNull(z);
        assertFalse(z.hasSourceInfo());
        assertEquals("'_3: bb0[3] → bb1[2]", z.formatRange());
        assertEquals("<unknown>", z.rangeString());
    }

    @Test
    void testNoMarkers() {
        LocalLifetime w = lifetimes.get(4);
        assertNotNull(w);
        assertNull(w.storageLive);
        assertNull(w.storageDead);
        assertEquals("'_4: <unknown>", w.formatRange());
        assertNull(lifetimes.get(9));
        assertEquals(5, lifetimes.all().size());
    }

    @Test
    void testWithSourceRanges() {
        assertEquals(2, lifetimes.withSourceRanges().size());
        assertEquals(1, lifetimes.withSourceRanges().get(0).local);
        assertEquals(2, lifetimes.withSourceRanges().get(1).local);
    }

    @Test
    void testNegativeLocalMarker() {
        BodyBuilder bb = new BodyBuilder();
        bb.newLocal(TY_UNIT, false, null);
        bb.newBlock();
        assertThrows(MalformedIrException.class, () -> bb.storageLive(-1));
        assertThrows(MalformedIrException.class, () -> bb.storageDead(-1));
        assertThrows(MalformedIrException.class, () -> new Statement.StorageDead(SPAN_END, -2));

        Function func = analyzed("demo::empty", bb.ret().build());
        assertEquals("'_0: <unknown>", func.getExtOrThrow(CommonExts.LIFETIMES).get(0).formatRange());
    }
}
