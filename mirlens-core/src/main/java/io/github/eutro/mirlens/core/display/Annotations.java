package io.github.eutro.mirlens.core.display;

import io.github.eutro.mirlens.core.ir.*;

/**
 * Short human-readable explanations of statements, terminators and edges.
 * <p>
 * Anything without a useful explanation is annotated with the empty string.
 */
public class Annotations {
    private final LabelRenderer renderer;

    public Annotations(LabelRenderer renderer) {
        this.renderer = renderer;
    }

    public String statement(Statement stmt) {
        if (stmt instanceof Statement.Assign) {
            return rvalue(((Statement.Assign) stmt).rvalue);
        } else if (stmt instanceof Statement.StorageLive) {
            return "Allocate stack space for _" + ((Statement.StorageLive) stmt).local;
        } else if (stmt instanceof Statement.StorageDead) {
            return "Deallocate stack space for _" + ((Statement.StorageDead) stmt).local;
        } else if (stmt instanceof Statement.Nop) {
            return "No operation";
        }
        return "";
    }

    public String rvalue(Rvalue rvalue) {
        if (rvalue instanceof Rvalue.Use) {
            Operand op = ((Rvalue.Use) rvalue).operand;
            if (op instanceof Operand.Constant) return "Load constant";
            if (op instanceof Operand.Copy) return "Copy value";
            return "Move value";
        } else if (rvalue instanceof Rvalue.BinaryOp) {
            return ((Rvalue.BinaryOp) rvalue).op.getDescription() + " operation";
        } else if (rvalue instanceof Rvalue.CheckedBinaryOp) {
            return "Checked " + ((Rvalue.CheckedBinaryOp) rvalue).op.getDescription() + " (may panic)";
        } else if (rvalue instanceof Rvalue.Ref) {
            switch (((Rvalue.Ref) rvalue).kind) {
                case SHARED:
                    return "Shared borrow";
                case MUTABLE:
                    return "Mutable borrow";
                default:
                    return "Fake borrow";
            }
        } else if (rvalue instanceof Rvalue.AddressOf) {
            return "Raw pointer";
        } else if (rvalue instanceof Rvalue.Len) {
            return "Get length";
        } else if (rvalue instanceof Rvalue.Discriminant) {
            return "Get enum discriminant";
        } else if (rvalue instanceof Rvalue.Cast) {
            return "Type cast";
        } else if (rvalue instanceof Rvalue.Aggregate) {
            return "Construct value";
        }
        return "";
    }

    /**
     * Explain a terminator.
     *
     * @param terminator The terminator.
     * @param currentFn  The short name of the function containing it, to spot recursion.
     * @return The annotation.
     */
    public String terminator(Terminator terminator, String currentFn) {
        return terminator.accept(new Terminator.Visitor<String>() {
            @Override
            public String visitGoto(Terminator.Goto t) {
                return "Continue to next block";
            }

            @Override
            public String visitSwitchInt(Terminator.SwitchInt t) {
                return "Branch based on value of " + renderer.renderOperand(t.discr);
            }

            @Override
            public String visitResume(Terminator.Resume t) {
                return "Resume unwinding (propagate panic)";
            }

            @Override
            public String visitAbort(Terminator.Abort t) {
                return "Abort the program";
            }

            @Override
            public String visitReturn(Terminator.Return t) {
                return "Return from function";
            }

            @Override
            public String visitUnreachable(Terminator.Unreachable t) {
                return "Unreachable code (compiler optimization)";
            }

            @Override
            public String visitDrop(Terminator.Drop t) {
                return "Drop " + renderer.renderPlace(t.place);
            }

            @Override
            public String visitCall(Terminator.Call t) {
                String callee = renderer.calleeName(t.func);
                return callee.equals(currentFn) ? "RECURSIVE call to " + callee : "Call " + callee;
            }

            @Override
            public String visitAssert(Terminator.Assert t) {
                return "Panic if " + renderer.renderOperand(t.cond) + (t.expected ? " is false" : " is true");
            }

            @Override
            public String visitInlineAsm(Terminator.InlineAsm t) {
                return "Inline assembly";
            }
        });
    }

    /**
     * Explain one of a terminator's outgoing edges.
     *
     * @param terminator The terminator.
     * @param edge       One of {@link Terminator#edges()}.
     * @return The annotation.
     */
    public String edge(Terminator terminator, Edge edge) {
        boolean unwind = edge.isUnwind();
        return terminator.accept(new Terminator.Visitor<String>() {
            @Override
            public String visitGoto(Terminator.Goto t) {
                return "Continue";
            }

            @Override
            public String visitSwitchInt(Terminator.SwitchInt t) {
                if (edge.kind == EdgeKind.OTHERWISE) return "Otherwise (no match)";
                return "If " + renderer.renderOperand(t.discr) + " == " + edge.label;
            }

            @Override
            public String visitResume(Terminator.Resume t) {
                return "";
            }

            @Override
            public String visitAbort(Terminator.Abort t) {
                return "";
            }

            @Override
            public String visitReturn(Terminator.Return t) {
                return "";
            }

            @Override
            public String visitUnreachable(Terminator.Unreachable t) {
                return "";
            }

            @Override
            public String visitDrop(Terminator.Drop t) {
                return unwind ? "If drop panics" : "After drop completes";
            }

            @Override
            public String visitCall(Terminator.Call t) {
                return unwind ? "If call panics (cleanup)" : "After " + renderer.calleeName(t.func) + " returns";
            }

            @Override
            public String visitAssert(Terminator.Assert t) {
                return unwind ? "Assertion failed (panic)" : "Assertion passed";
            }

            @Override
            public String visitInlineAsm(Terminator.InlineAsm t) {
                return unwind ? "If inline assembly panics" : "After inline assembly";
            }
        });
    }
}
