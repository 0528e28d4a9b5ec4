package io.github.eutro.mirlens.core.display;

import io.github.eutro.mirlens.core.conf.RenderOptions;
import io.github.eutro.mirlens.core.index.FunctionIndex;
import io.github.eutro.mirlens.core.index.Indices;
import io.github.eutro.mirlens.core.index.SpanInfo;
import io.github.eutro.mirlens.core.ir.*;
import io.github.eutro.mirlens.core.util.Bytes;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders IR values as compact labels, resolving ids through the {@link Indices}.
 * <p>
 * Every method is total: unknown ids are rendered with their fallback labels.
 */
public class LabelRenderer {
    private final Indices indices;
    private final RenderOptions options;

    public LabelRenderer(Indices indices, RenderOptions options) {
        this.indices = indices;
        this.options = options;
    }

    public Indices getIndices() {
        return indices;
    }

    public RenderOptions getOptions() {
        return options;
    }

    public String renderPlace(Place place) {
        String label = "_" + place.local;
        for (ProjectionElem elem : place.projection) {
            label = decorate(label, elem);
        }
        return label;
    }

    private String decorate(String thing, ProjectionElem elem) {
        return elem.accept(new ProjectionElem.Visitor<String>() {
            @Override
            public String visitDeref(ProjectionElem.Deref p) {
                return "(*" + thing + ")";
            }

            @Override
            public String visitField(ProjectionElem.Field p) {
                return thing + "." + p.field;
            }

            @Override
            public String visitIndex(ProjectionElem.Index p) {
                return thing + "[_" + p.local + "]";
            }

            @Override
            public String visitConstantIndex(ProjectionElem.ConstantIndex p) {
                return thing + "[" + (p.fromEnd ? "-" : "") + p.offset + "]";
            }

            @Override
            public String visitSubslice(ProjectionElem.Subslice p) {
                return thing + "[" + p.from + ".." + (p.fromEnd ? "-" : "") + p.to + "]";
            }

            @Override
            public String visitDowncast(ProjectionElem.Downcast p) {
                return "(" + thing + " as variant " + p.variant + ")";
            }

            @Override
            public String visitOpaqueCast(ProjectionElem.OpaqueCast p) {
                return thing + " as type " + indices.types.getName(p.typeId);
            }

            @Override
            public String visitSubtype(ProjectionElem.Subtype p) {
                return thing + " :> " + indices.types.getName(p.typeId);
            }
        });
    }

    public String renderOperand(Operand op) {
        return op.accept(new Operand.Visitor<String>() {
            @Override
            public String visitCopy(Operand.Copy op) {
                return "cp(" + renderPlace(op.place) + ")";
            }

            @Override
            public String visitMove(Operand.Move op) {
                return "mv(" + renderPlace(op.place) + ")";
            }

            @Override
            public String visitConstant(Operand.Constant op) {
                return renderConst(op.value);
            }
        });
    }

    /**
     * Render a constant. Constants pointing into other allocations are rendered
     * with those allocations, to {@link RenderOptions#allocRefDepth()}.
     *
     * @param value The constant.
     * @return The label.
     */
    public String renderConst(ConstOperand value) {
        String tyName = indices.types.getName(value.typeId);
        return value.accept(new ConstOperand.Visitor<String>() {
            @Override
            public String visitAllocated(ConstOperand.Allocated c) {
                if (!c.provenance.isEmpty()) {
                    List<String> refs = new ArrayList<>(c.provenance.size());
                    for (long alloc : c.provenance) {
                        refs.add(indices.allocs.describeWithRefs(alloc, options.allocRefDepth()));
                    }
                    return "const [" + String.join(", ", refs) + "]";
                }
                List<Byte> concrete = Bytes.concrete(c.bytes);
                if (!concrete.isEmpty() && concrete.size() <= options.maxNumericBytes()) {
                    return "const " + Bytes.unsignedLittleEndian(concrete) + "_" + tyName;
                }
                return "const " + tyName;
            }

            @Override
            public String visitZeroSized(ConstOperand.ZeroSized c) {
                return indices.functions.lookupByType(c.typeId)
                        .map(name -> "const fn " + FunctionIndex.shortName(name))
                        .orElse("const " + tyName);
            }

            @Override
            public String visitTyConst(ConstOperand.TyConst c) {
                return "const " + tyName;
            }

            @Override
            public String visitUnevaluated(ConstOperand.Unevaluated c) {
                return c.name == null ? "const unevaluated " + tyName : "const " + c.name;
            }

            @Override
            public String visitParam(ConstOperand.Param c) {
                return "const param " + tyName;
            }
        });
    }

    private String renderOperands(List<Operand> operands) {
        List<String> parts = new ArrayList<>(operands.size());
        for (Operand op : operands) {
            parts.add(renderOperand(op));
        }
        return String.join(", ", parts);
    }

    public String renderAggregateKind(AggregateKind kind) {
        switch (kind.kind) {
            case ARRAY:
                return "Array";
            case TUPLE:
                return "Tuple";
            case ADT:
                return "Adt{" + kind.variant + "}";
            case CLOSURE:
                return "Closure";
            case COROUTINE:
                return "Coroutine";
            case RAW_PTR:
                return (kind.mutable ? "*mut (" : "*(") + indices.types.getName(kind.typeId) + ")";
            default:
                throw new IllegalStateException("unknown aggregate kind " + kind.kind);
        }
    }

    public String renderRvalue(Rvalue rvalue) {
        return rvalue.accept(new Rvalue.Visitor<String>() {
            @Override
            public String visitAddressOf(Rvalue.AddressOf rv) {
                return (rv.mutable ? "&raw mut " : "&raw ") + renderPlace(rv.place);
            }

            @Override
            public String visitAggregate(Rvalue.Aggregate rv) {
                return renderAggregateKind(rv.kind) + " (" + renderOperands(rv.operands) + ")";
            }

            @Override
            public String visitBinaryOp(Rvalue.BinaryOp rv) {
                return rv.op.debugName() + "(" + renderOperand(rv.lhs) + ", " + renderOperand(rv.rhs) + ")";
            }

            @Override
            public String visitCheckedBinaryOp(Rvalue.CheckedBinaryOp rv) {
                return "chkd-" + rv.op.debugName() + "(" + renderOperand(rv.lhs) + ", " + renderOperand(rv.rhs) + ")";
            }

            @Override
            public String visitCast(Rvalue.Cast rv) {
                return "Cast-" + rv.castKind + " " + renderOperand(rv.operand);
            }

            @Override
            public String visitCopyForDeref(Rvalue.CopyForDeref rv) {
                return "CopyForDeref(" + renderPlace(rv.place) + ")";
            }

            @Override
            public String visitDiscriminant(Rvalue.Discriminant rv) {
                return "Discriminant(" + renderPlace(rv.place) + ")";
            }

            @Override
            public String visitLen(Rvalue.Len rv) {
                return "Len(" + renderPlace(rv.place) + ")";
            }

            @Override
            public String visitRef(Rvalue.Ref rv) {
                switch (rv.kind) {
                    case MUTABLE:
                        return "&mut " + renderPlace(rv.place);
                    case SHALLOW:
                        return "&fake " + renderPlace(rv.place);
                    default:
                        return "&" + renderPlace(rv.place);
                }
            }

            @Override
            public String visitRepeat(Rvalue.Repeat rv) {
                return "Repeat " + renderOperand(rv.operand) + "; " + rv.count;
            }

            @Override
            public String visitShallowInitBox(Rvalue.ShallowInitBox rv) {
                return "ShallowInitBox(" + renderOperand(rv.operand) + ")";
            }

            @Override
            public String visitThreadLocalRef(Rvalue.ThreadLocalRef rv) {
                return "ThreadLocalRef(" + rv.item + ")";
            }

            @Override
            public String visitNullaryOp(Rvalue.NullaryOp rv) {
                return rv.op + " :: " + indices.types.getName(rv.typeId);
            }

            @Override
            public String visitUnaryOp(Rvalue.UnaryOp rv) {
                return rv.op.debugName() + "(" + renderOperand(rv.operand) + ")";
            }

            @Override
            public String visitUse(Rvalue.Use rv) {
                return "Use(" + renderOperand(rv.operand) + ")";
            }
        });
    }

    public String renderIntrinsic(NonDivergingIntrinsic intrinsic) {
        return intrinsic.accept(new NonDivergingIntrinsic.Visitor<String>() {
            @Override
            public String visitAssume(NonDivergingIntrinsic.Assume intr) {
                return "Assume " + renderOperand(intr.operand);
            }

            @Override
            public String visitCopyNonOverlapping(NonDivergingIntrinsic.CopyNonOverlapping intr) {
                return "CopyNonOverlapping: " + renderOperand(intr.dst)
                        + " <- " + renderOperand(intr.src)
                        + "(" + renderOperand(intr.count) + ")";
            }
        });
    }

    public String renderStatement(Statement stmt) {
        return stmt.accept(new Statement.Visitor<String>() {
            @Override
            public String visitAssign(Statement.Assign s) {
                return renderPlace(s.place) + " <- " + renderRvalue(s.rvalue);
            }

            @Override
            public String visitFakeRead(Statement.FakeRead s) {
                return "Fake-Read " + renderPlace(s.place);
            }

            @Override
            public String visitSetDiscriminant(Statement.SetDiscriminant s) {
                return "set discriminant " + renderPlace(s.place) + "(" + s.variant + ")";
            }

            @Override
            public String visitDeinit(Statement.Deinit s) {
                return "Deinit " + renderPlace(s.place);
            }

            @Override
            public String visitStorageLive(Statement.StorageLive s) {
                return "Storage Live _" + s.local;
            }

            @Override
            public String visitStorageDead(Statement.StorageDead s) {
                return "Storage Dead _" + s.local;
            }

            @Override
            public String visitRetag(Statement.Retag s) {
                return "Retag " + renderPlace(s.place);
            }

            @Override
            public String visitPlaceMention(Statement.PlaceMention s) {
                return "Mention " + renderPlace(s.place);
            }

            @Override
            public String visitAscribeUserType(Statement.AscribeUserType s) {
                return "Ascribe " + renderPlace(s.place) + "." + s.projections;
            }

            @Override
            public String visitCoverage(Statement.Coverage s) {
                return "Coverage";
            }

            @Override
            public String visitIntrinsic(Statement.Intrinsic s) {
                return "Intr: " + renderIntrinsic(s.intrinsic);
            }

            @Override
            public String visitConstEvalCounter(Statement.ConstEvalCounter s) {
                return "ConstEvalCounter";
            }

            @Override
            public String visitNop(Statement.Nop s) {
                return "Nop";
            }
        }) + spanSuffix(stmt.spanId);
    }

    public String renderTerminator(Terminator terminator) {
        return terminator.accept(new Terminator.Visitor<String>() {
            @Override
            public String visitGoto(Terminator.Goto t) {
                return "Goto";
            }

            @Override
            public String visitSwitchInt(Terminator.SwitchInt t) {
                return "SwitchInt " + renderOperand(t.discr);
            }

            @Override
            public String visitResume(Terminator.Resume t) {
                return "Resume";
            }

            @Override
            public String visitAbort(Terminator.Abort t) {
                return "Abort";
            }

            @Override
            public String visitReturn(Terminator.Return t) {
                return "Return";
            }

            @Override
            public String visitUnreachable(Terminator.Unreachable t) {
                return "Unreachable";
            }

            @Override
            public String visitDrop(Terminator.Drop t) {
                return "Drop " + renderPlace(t.place);
            }

            @Override
            public String visitCall(Terminator.Call t) {
                return renderPlace(t.destination) + " = " + calleeName(t.func)
                        + "(" + renderOperands(t.args) + ")" + debugSuffix(t.func);
            }

            @Override
            public String visitAssert(Terminator.Assert t) {
                return "Assert " + renderOperand(t.cond) + " == " + t.expected;
            }

            @Override
            public String visitInlineAsm(Terminator.InlineAsm t) {
                return "InlineAsm";
            }
        }) + spanSuffix(terminator.spanId);
    }

    /**
     * Get the short name of a callee, or {@code fn?} if it is not a known function.
     *
     * @param func The callee operand.
     * @return The name.
     */
    public String calleeName(Operand func) {
        return indices.resolveCallTarget(func).map(FunctionIndex::shortName).orElse("fn?");
    }

    public String renderLocal(int local, LocalDecl decl) {
        String label = "_" + local + ": " + (decl.mutable ? "mut " : "") + indices.types.getName(decl.typeId);
        return decl.sourceName == null ? label : label + " (" + decl.sourceName + ")";
    }

    private String spanSuffix(long spanId) {
        if (!options.showSpans()) return "";
        SpanInfo info = indices.spans.getNullable(spanId);
        return info == null ? "" : " @ " + info.shortForm();
    }

    private String debugSuffix(Operand func) {
        if (!options.showDebug() || !(func instanceof Operand.Constant)) return "";
        String source = indices.functions.sourceOf(((Operand.Constant) func).value.typeId);
        return source == null ? "" : " [" + source + "]";
    }
}
