package io.github.eutro.mirlens.core.explore;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Walks the blocks of the functions in an {@link ExplorerData} one edge at a time,
 * remembering the path taken.
 * <p>
 * The state is the current block, a history of previously visited blocks, and the index of
 * the selected outgoing edge of the current block. The history always keeps the entry block
 * at its bottom.
 * <p>
 * Transitions never fail. A transition that does not apply to the current state leaves it
 * unchanged, and returns false.
 * <p>
 * Instances are not thread-safe; use one per interactive session.
 */
public class PathNavigator {
    private static final Logger logger = LogManager.getLogger(PathNavigator.class);

    private final ExplorerData data;
    private int functionIndex;
    private int current;
    private final List<Integer> history = new ArrayList<>();
    private int selected;

    /**
     * Open a navigator on the first function.
     *
     * @param data The explorer data.
     * @throws IllegalArgumentException If there are no functions.
     */
    public PathNavigator(ExplorerData data) {
        this(data, 0);
    }

    public PathNavigator(ExplorerData data, int functionIndex) {
        if (functionIndex < 0 || functionIndex >= data.functions.size()) {
            throw new IllegalArgumentException("no function " + functionIndex
                    + " among " + data.functions.size());
        }
        this.data = data;
        open(functionIndex);
    }

    private void open(int functionIndex) {
        this.functionIndex = functionIndex;
        reset();
    }

    public ExplorerData getData() {
        return data;
    }

    public int getFunctionIndex() {
        return functionIndex;
    }

    public ExplorerFunction getFunction() {
        return data.functions.get(functionIndex);
    }

    public int getCurrentBlock() {
        return current;
    }

    public ExplorerBlock getBlock() {
        return getFunction().getBlock(current);
    }

    public List<Integer> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public int getSelectedEdge() {
        return selected;
    }

    public List<ExplorerEdge> getEdges() {
        return getBlock().terminator.edges;
    }

    public int getEdgeCount() {
        return getEdges().size();
    }

    /**
     * Get the breadcrumb of blocks visited to get to the current block.
     *
     * @return The history, followed by the current block unless it is already on top.
     */
    public List<Integer> path() {
        List<Integer> path = new ArrayList<>(history);
        if (path.isEmpty() || path.get(path.size() - 1) != current) {
            path.add(current);
        }
        return path;
    }

    /**
     * Go back to the entry block of the current function, forgetting the history.
     */
    public void reset() {
        int entry = getFunction().entryBlock;
        current = entry;
        history.clear();
        history.add(entry);
        selected = 0;
    }

    /**
     * Follow the selected edge of the current block.
     *
     * @return Whether there was an edge to follow.
     */
    public boolean followSelected() {
        List<ExplorerEdge> edges = getEdges();
        if (selected >= edges.size()) {
            logger.trace("no edge {} to follow from bb{}", selected, current);
            return false;
        }
        if (history.get(history.size() - 1) != current) {
            history.add(current);
        }
        current = edges.get(selected).target;
        selected = 0;
        return true;
    }

    /**
     * Go back to the most recently visited block. The entry block is never removed from the
     * history, so stepping back onto it leaves it there.
     *
     * @return Whether there was anywhere to go back to.
     */
    public boolean stepBack() {
        if (history.size() > 1) {
            current = history.remove(history.size() - 1);
        } else if (history.get(0) != current) {
            current = history.get(0);
        } else {
            logger.trace("already at the start of the path");
            return false;
        }
        selected = 0;
        return true;
    }

    public boolean nextEdge() {
        return cycleEdge(1);
    }

    public boolean previousEdge() {
        return cycleEdge(-1);
    }

    private boolean cycleEdge(int delta) {
        int count = getEdgeCount();
        if (count == 0) return false;
        selected = Math.floorMod(selected + delta, count);
        return true;
    }

    /**
     * Select an edge by index.
     *
     * @param index The index into {@link #getEdges()}.
     * @return Whether the index was in range.
     */
    public boolean jumpToEdge(int index) {
        if (index < 0 || index >= getEdgeCount()) {
            logger.trace("no edge {} on bb{}", index, current);
            return false;
        }
        selected = index;
        return true;
    }

    /**
     * Select an edge by its button number, counting from 1.
     *
     * @param button The button number.
     * @return Whether there is such a button.
     */
    public boolean jumpToEdgeButton(int button) {
        return jumpToEdge(button - 1);
    }

    /**
     * Open another function, as if freshly opened on its entry block.
     *
     * @param index The function index.
     * @return Whether there is such a function.
     */
    public boolean switchFunction(int index) {
        if (index < 0 || index >= data.functions.size()) {
            logger.trace("no function {}", index);
            return false;
        }
        open(index);
        return true;
    }

    public void nextFunction() {
        open(Math.floorMod(functionIndex + 1, data.functions.size()));
    }

    public void previousFunction() {
        open(Math.floorMod(functionIndex - 1, data.functions.size()));
    }

    public NavigatorSnapshot snapshot() {
        return new NavigatorSnapshot(functionIndex,
                current,
                new ArrayList<>(history),
                path(),
                selected,
                getEdgeCount());
    }
}
