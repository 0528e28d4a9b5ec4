package io.github.eutro.mirlens.core.index;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A row of the allocation table: an allocation id, its type, and what the allocation is.
 */
public abstract class AllocInfo {
    public final long id;
    public final long typeId;

    AllocInfo(long id, long typeId) {
        this.id = id;
        this.typeId = typeId;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitMemory(Memory alloc);

        R visitStatic(Static alloc);

        R visitVTable(VTable alloc);

        R visitFunction(Function alloc);
    }

    /**
     * Raw memory, possibly containing pointers to other allocations.
     */
    public static final class Memory extends AllocInfo {
        /**
         * The bytes, with null for uninitialised bytes.
         */
        public final List<Byte> bytes;
        /**
         * The ids of the allocations pointed to from these bytes, in offset order.
         */
        public final List<Long> provenance;

        public Memory(long id, long typeId, List<Byte> bytes, List<Long> provenance) {
            super(id, typeId);
            this.bytes = Collections.unmodifiableList(new ArrayList<>(bytes));
            this.provenance = Collections.unmodifiableList(new ArrayList<>(provenance));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMemory(this);
        }
    }

    public static final class Static extends AllocInfo {
        public final String name;

        public Static(long id, long typeId, String name) {
            super(id, typeId);
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStatic(this);
        }
    }

    public static final class VTable extends AllocInfo {
        public final String tyDesc;
        public final @Nullable String traitName;

        public VTable(long id, long typeId, String tyDesc, @Nullable String traitName) {
            super(id, typeId);
            this.tyDesc = tyDesc;
            this.traitName = traitName;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVTable(this);
        }
    }

    public static final class Function extends AllocInfo {
        public final String name;

        public Function(long id, long typeId, String name) {
            super(id, typeId);
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }
}
