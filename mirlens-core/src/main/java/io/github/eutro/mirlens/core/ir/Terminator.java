package io.github.eutro.mirlens.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The single control-transfer instruction that ends a {@link BasicBlock}.
 * <p>
 * Outgoing {@link Edge edges} are derived from the terminator, see {@link #edges()}.
 */
public abstract class Terminator {
    /**
     * The source span id of this terminator.
     */
    public final long spanId;

    Terminator(long spanId) {
        this.spanId = spanId;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitGoto(Goto t);

        R visitSwitchInt(SwitchInt t);

        R visitResume(Resume t);

        R visitAbort(Abort t);

        R visitReturn(Return t);

        R visitUnreachable(Unreachable t);

        R visitDrop(Drop t);

        R visitCall(Call t);

        R visitAssert(Assert t);

        R visitInlineAsm(InlineAsm t);
    }

    /**
     * Get the outgoing edges of this terminator, in order.
     *
     * @return The edges.
     */
    public List<Edge> edges() {
        return accept(EdgeCollector.INSTANCE);
    }

    /**
     * Get the targets of the outgoing edges, unwind targets included.
     *
     * @return The successor block indices, in edge order.
     */
    public List<Integer> successors() {
        List<Edge> edges = edges();
        List<Integer> succs = new ArrayList<>(edges.size());
        for (Edge edge : edges) {
            succs.add(edge.target);
        }
        return succs;
    }

    public static final class Goto extends Terminator {
        public final int target;

        public Goto(long spanId, int target) {
            super(spanId);
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGoto(this);
        }
    }

    /**
     * Branch on the integer value of {@link #discr}.
     */
    public static final class SwitchInt extends Terminator {
        public final Operand discr;
        public final List<Branch> branches;
        public final int otherwise;

        public SwitchInt(long spanId, Operand discr, List<Branch> branches, int otherwise) {
            super(spanId);
            this.discr = discr;
            this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
            this.otherwise = otherwise;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSwitchInt(this);
        }

        public static final class Branch {
            public final long value;
            public final int target;

            public Branch(long value, int target) {
                this.value = value;
                this.target = target;
            }
        }
    }

    public static final class Resume extends Terminator {
        public Resume(long spanId) {
            super(spanId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitResume(this);
        }
    }

    public static final class Abort extends Terminator {
        public Abort(long spanId) {
            super(spanId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAbort(this);
        }
    }

    public static final class Return extends Terminator {
        public Return(long spanId) {
            super(spanId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    public static final class Unreachable extends Terminator {
        public Unreachable(long spanId) {
            super(spanId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnreachable(this);
        }
    }

    public static final class Drop extends Terminator {
        public final Place place;
        public final int target;
        public final UnwindAction unwind;

        public Drop(long spanId, Place place, int target, UnwindAction unwind) {
            super(spanId);
            this.place = place;
            this.target = target;
            this.unwind = unwind;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDrop(this);
        }
    }

    public static final class Call extends Terminator {
        public final Operand func;
        public final List<Operand> args;
        public final Place destination;
        /**
         * The block to return to, or null if the callee never returns.
         */
        public final @Nullable Integer target;
        public final UnwindAction unwind;

        public Call(long spanId,
                    Operand func,
                    List<Operand> args,
                    Place destination,
                    @Nullable Integer target,
                    UnwindAction unwind) {
            super(spanId);
            this.func = func;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
            this.destination = destination;
            this.target = target;
            this.unwind = unwind;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    /**
     * Panic unless {@link #cond} equals {@link #expected}.
     */
    public static final class Assert extends Terminator {
        public final Operand cond;
        public final boolean expected;
        public final int target;
        public final UnwindAction unwind;

        public Assert(long spanId, Operand cond, boolean expected, int target, UnwindAction unwind) {
            super(spanId);
            this.cond = cond;
            this.expected = expected;
            this.target = target;
            this.unwind = unwind;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssert(this);
        }
    }

    public static final class InlineAsm extends Terminator {
        public final @Nullable Integer destination;
        public final UnwindAction unwind;

        public InlineAsm(long spanId, @Nullable Integer destination, UnwindAction unwind) {
            super(spanId);
            this.destination = destination;
            this.unwind = unwind;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInlineAsm(this);
        }
    }

    private static final class EdgeCollector implements Visitor<List<Edge>> {
        static final EdgeCollector INSTANCE = new EdgeCollector();

        private static List<Edge> withUnwind(List<Edge> edges, UnwindAction unwind, String label) {
            Integer cleanup = unwind.getTarget();
            if (cleanup != null) {
                edges.add(new Edge(cleanup, EdgeKind.CLEANUP, label));
            }
            return edges;
        }

        @Override
        public List<Edge> visitGoto(Goto t) {
            return Collections.singletonList(new Edge(t.target, EdgeKind.NORMAL, ""));
        }

        @Override
        public List<Edge> visitSwitchInt(SwitchInt t) {
            List<Edge> edges = new ArrayList<>(t.branches.size() + 1);
            for (SwitchInt.Branch branch : t.branches) {
                edges.add(new Edge(branch.target, EdgeKind.BRANCH, Long.toString(branch.value)));
            }
            edges.add(new Edge(t.otherwise, EdgeKind.OTHERWISE, "else"));
            return edges;
        }

        @Override
        public List<Edge> visitResume(Resume t) {
            return Collections.emptyList();
        }

        @Override
        public List<Edge> visitAbort(Abort t) {
            return Collections.emptyList();
        }

        @Override
        public List<Edge> visitReturn(Return t) {
            return Collections.emptyList();
        }

        @Override
        public List<Edge> visitUnreachable(Unreachable t) {
            return Collections.emptyList();
        }

        @Override
        public List<Edge> visitDrop(Drop t) {
            List<Edge> edges = new ArrayList<>(2);
            edges.add(new Edge(t.target, EdgeKind.NORMAL, ""));
            return withUnwind(edges, t.unwind, "unwind");
        }

        @Override
        public List<Edge> visitCall(Call t) {
            List<Edge> edges = new ArrayList<>(2);
            if (t.target != null) {
                edges.add(new Edge(t.target, EdgeKind.NORMAL, "return"));
            }
            return withUnwind(edges, t.unwind, "unwind");
        }

        @Override
        public List<Edge> visitAssert(Assert t) {
            List<Edge> edges = new ArrayList<>(2);
            edges.add(new Edge(t.target, EdgeKind.NORMAL, "ok"));
            return withUnwind(edges, t.unwind, "panic");
        }

        @Override
        public List<Edge> visitInlineAsm(InlineAsm t) {
            List<Edge> edges = new ArrayList<>(2);
            if (t.destination != null) {
                edges.add(new Edge(t.destination, EdgeKind.NORMAL, ""));
            }
            return withUnwind(edges, t.unwind, "unwind");
        }
    }
}
