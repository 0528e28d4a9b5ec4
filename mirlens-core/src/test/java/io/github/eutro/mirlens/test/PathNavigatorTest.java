package io.github.eutro.mirlens.test;

import io.github.eutro.mirlens.core.cfg.Program;
import io.github.eutro.mirlens.core.explore.ExplorerBuilder;
import io.github.eutro.mirlens.core.explore.ExplorerData;
import io.github.eutro.mirlens.core.explore.NavigatorSnapshot;
import io.github.eutro.mirlens.core.explore.PathNavigator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Random;

import static io.github.eutro.mirlens.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PathNavigatorTest {
    static ExplorerData data;

    @BeforeAll
    static void build() {
        Program program = new Program("demo", Utils.indices());
        program.addFunction("demo::looping", loopingSwitch());
        program.addFunction("std::fmt::write", borrowThenDead());
        program.addFunction("demo::main", borrowThenDead());
        data = new ExplorerBuilder().build(program);
    }

    static NavigatorSnapshot initial(int function, int edgeCount) {
        return new NavigatorSnapshot(function, 0,
                Collections.singletonList(0),
                Collections.singletonList(0),
                0, edgeCount);
    }

    @Test
    void testInitialState() {
        PathNavigator nav = new PathNavigator(data);
        assertEquals(initial(0, 1), nav.snapshot());
        assertEquals(2, data.functions.size());
    }

    @Test
    void testWalk() {
        PathNavigator nav = new PathNavigator(data);
        assertTrue(nav.followSelected());
        assertEquals(new NavigatorSnapshot(0, 1,
                Collections.singletonList(0),
                Arrays.asList(0, 1),
                0, 3), nav.snapshot());

        assertTrue(nav.nextEdge());
        assertTrue(nav.nextEdge());
        assertTrue(nav.nextEdge());
        assertEquals(0, nav.getSelectedEdge());
        assertTrue(nav.previousEdge());
        assertEquals(2, nav.getSelectedEdge());

        assertFalse(nav.jumpToEdge(5));
        assertFalse(nav.jumpToEdgeButton(0));
        assertEquals(2, nav.getSelectedEdge());
        assertTrue(nav.jumpToEdgeButton(2));
        assertEquals(1, nav.getSelectedEdge());

        assertTrue(nav.followSelected());
        assertEquals(0, nav.getCurrentBlock());
        assertEquals(Arrays.asList(0, 1), nav.getHistory());
        assertEquals(Arrays.asList(0, 1, 0), nav.path());

        assertTrue(nav.stepBack());
        assertEquals(1, nav.getCurrentBlock());
        assertEquals(Collections.singletonList(0), nav.getHistory());
        assertTrue(nav.stepBack());
        assertEquals(initial(0, 1), nav.snapshot());
        assertFalse(nav.stepBack());
        assertEquals(initial(0, 1), nav.snapshot());
    }

    @Test
    void testDeadEnd() {
        PathNavigator nav = new PathNavigator(data);
        nav.followSelected();
        nav.jumpToEdge(0);
        assertTrue(nav.followSelected());
        assertEquals(2, nav.getCurrentBlock());
        assertEquals(0, nav.getEdgeCount());
        NavigatorSnapshot before = nav.snapshot();
        assertFalse(nav.followSelected());
        assertFalse(nav.nextEdge());
        assertFalse(nav.previousEdge());
        assertFalse(nav.jumpToEdge(0));
        assertEquals(before, nav.snapshot());
    }

    @Test
    void testResetAndInverse() {
        Random random = new Random(1234);
        PathNavigator nav = new PathNavigator(data);
        for (int i = 0; i < 200; i++) {
            switch (random.nextInt(4)) {
                case 0: {
                    int before = nav.getCurrentBlock();
                    if (nav.followSelected()) {
                        assertTrue(nav.stepBack());
                        assertEquals(before, nav.getCurrentBlock());
                        assertEquals(0, nav.getSelectedEdge());
                        nav.followSelected();
                    }
                    break;
                }
                case 1:
                    nav.nextEdge();
                    break;
                case 2:
                    nav.stepBack();
                    break;
                default:
                    nav.jumpToEdge(random.nextInt(4));
            }
            assertEquals(0, (int) nav.getHistory().get(0));
        }
        nav.reset();
        assertEquals(initial(0, 1), nav.snapshot());
    }

    @Test
    void testSwitchFunction() {
        PathNavigator nav = new PathNavigator(data);
        nav.followSelected();
        assertTrue(nav.switchFunction(1));
        assertEquals("main", nav.getFunction().shortName);
        assertEquals(initial(1, 0), nav.snapshot());
        assertFalse(nav.switchFunction(2));
        assertEquals(1, nav.getFunctionIndex());

        nav.nextFunction();
        assertEquals(0, nav.getFunctionIndex());
        nav.previousFunction();
        assertEquals(1, nav.getFunctionIndex());
    }

    @Test
    void testNoFunctions() {
        ExplorerData empty = new ExplorerData("empty", Collections.emptyList());
        assertThrows(IllegalArgumentException.class, () -> new PathNavigator(empty));
    }
}
