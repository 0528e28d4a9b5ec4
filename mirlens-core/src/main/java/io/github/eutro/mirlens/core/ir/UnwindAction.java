package io.github.eutro.mirlens.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * What happens when a terminator unwinds.
 */
public final class UnwindAction {
    public enum Kind {
        CONTINUE,
        UNREACHABLE,
        TERMINATE,
        CLEANUP,
    }

    public static final UnwindAction CONTINUE = new UnwindAction(Kind.CONTINUE, -1);
    public static final UnwindAction UNREACHABLE = new UnwindAction(Kind.UNREACHABLE, -1);
    public static final UnwindAction TERMINATE = new UnwindAction(Kind.TERMINATE, -1);

    public final Kind kind;
    private final int target;

    private UnwindAction(Kind kind, int target) {
        this.kind = kind;
        this.target = target;
    }

    /**
     * Unwind into a cleanup block.
     *
     * @param target The cleanup block.
     * @return The action.
     */
    public static UnwindAction cleanup(int target) {
        if (target < 0) throw new MalformedIrException("negative unwind target bb" + target);
        return new UnwindAction(Kind.CLEANUP, target);
    }

    /**
     * Get the cleanup block, if this unwinds into one.
     *
     * @return The block, or null.
     */
    public @Nullable Integer getTarget() {
        return kind == Kind.CLEANUP ? target : null;
    }

    @Override
    public String toString() {
        switch (kind) {
            case CONTINUE:
                return "continue";
            case UNREACHABLE:
                return "unreachable";
            case TERMINATE:
                return "terminate";
            default:
                return "cleanup(bb" + target + ")";
        }
    }
}
