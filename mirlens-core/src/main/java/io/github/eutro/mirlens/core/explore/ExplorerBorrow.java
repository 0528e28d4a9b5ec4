package io.github.eutro.mirlens.core.explore;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A borrow with its liveness.
 */
public final class ExplorerBorrow {
    public final int index;
    public final int borrower;
    public final int borrowed;
    /**
     * {@code shared}, {@code mutable} or {@code shallow}.
     */
    public final String kind;
    public final boolean mutable;
    /**
     * Where the borrow is created, e.g. {@code bb0[1]}.
     */
    public final String start;
    /**
     * The first kill point reachable from the start, if any.
     */
    public final @Nullable String end;
    /**
     * The source location of the borrowing expression, {@code file:line:col} or {@code span<N>}.
     */
    public final String span;
    @JsonProperty("span_id")
    public final long spanId;
    public final String lifetime;
    /**
     * Every location the borrow is live at, in program order.
     */
    public final List<String> live;

    @JsonCreator
    public ExplorerBorrow(@JsonProperty("index") int index,
                          @JsonProperty("borrower") int borrower,
                          @JsonProperty("borrowed") int borrowed,
                          @JsonProperty("kind") String kind,
                          @JsonProperty("mutable") boolean mutable,
                          @JsonProperty("start") String start,
                          @JsonProperty("end") @Nullable String end,
                          @JsonProperty("span") String span,
                          @JsonProperty("span_id") long spanId,
                          @JsonProperty("lifetime") String lifetime,
                          @JsonProperty("live") List<String> live) {
        this.index = index;
        this.borrower = borrower;
        this.borrowed = borrowed;
        this.kind = kind;
        this.mutable = mutable;
        this.start = start;
        this.end = end;
        this.span = span;
        this.spanId = spanId;
        this.lifetime = lifetime;
        this.live = live;
    }
}
