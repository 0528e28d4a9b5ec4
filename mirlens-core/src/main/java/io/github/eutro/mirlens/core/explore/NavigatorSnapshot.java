package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The serializable state of a {@link PathNavigator}, for UIs to render.
 */
public final class NavigatorSnapshot {
    @JsonProperty("function_index")
    public final int functionIndex;
    @JsonProperty("current_block")
    public final int currentBlock;
    public final List<Integer> history;
    /**
     * The breadcrumb: the history, followed by the current block if it is not on top.
     */
    public final List<Integer> path;
    @JsonProperty("selected_edge")
    public final int selectedEdge;
    /**
     * The number of edge buttons, numbered from 1.
     */
    @JsonProperty("edge_count")
    public final int edgeCount;

    @JsonCreator
    public NavigatorSnapshot(@JsonProperty("function_index") int functionIndex,
                             @JsonProperty("current_block") int currentBlock,
                             @JsonProperty("history") List<Integer> history,
                             @JsonProperty("path") List<Integer> path,
                             @JsonProperty("selected_edge") int selectedEdge,
                             @JsonProperty("edge_count") int edgeCount) {
        this.functionIndex = functionIndex;
        this.currentBlock = currentBlock;
        this.history = history;
        this.path = path;
        this.selectedEdge = selectedEdge;
        this.edgeCount = edgeCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NavigatorSnapshot that = (NavigatorSnapshot) o;
        return functionIndex == that.functionIndex
                && currentBlock == that.currentBlock
                && selectedEdge == that.selectedEdge
                && edgeCount == that.edgeCount
                && history.equals(that.history)
                && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        int result = functionIndex;
        result = 31 * result + currentBlock;
        result = 31 * result + history.hashCode();
        result = 31 * result + path.hashCode();
        result = 31 * result + selectedEdge;
        result = 31 * result + edgeCount;
        return result;
    }

    @Override
    public String toString() {
        return "bb" + currentBlock + " via " + path + " [" + selectedEdge + "/" + edgeCount + "]";
    }
}
