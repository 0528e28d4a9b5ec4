package io.github.eutro.mirlens.core.index;

import io.github.eutro.mirlens.core.conf.RenderOptions;
import io.github.eutro.mirlens.core.util.Bytes;

import java.util.Collections;
import java.util.List;

/**
 * An allocation, resolved to a human-readable description.
 */
public final class AllocEntry {
    public final long id;
    public final long typeId;
    public final String description;
    /**
     * The allocations this one points to. This may form a cyclic graph.
     */
    public final List<Long> referencedAllocs;

    AllocEntry(long id, long typeId, String description, List<Long> referencedAllocs) {
        this.id = id;
        this.typeId = typeId;
        this.description = description;
        this.referencedAllocs = referencedAllocs;
    }

    static AllocEntry resolve(AllocInfo info, TypeIndex types, RenderOptions options) {
        String tyName = types.getName(info.typeId);
        return info.accept(new AllocInfo.Visitor<AllocEntry>() {
            @Override
            public AllocEntry visitMemory(AllocInfo.Memory alloc) {
                List<Byte> concrete = Bytes.concrete(alloc.bytes);
                String desc;
                if (tyName.contains("str") && Bytes.isAscii(concrete)) {
                    StringBuilder preview = new StringBuilder();
                    for (int i = 0; i < concrete.size() && i < options.maxStringPreview(); i++) {
                        preview.append((char) (byte) concrete.get(i));
                    }
                    String escaped = Bytes.escape(preview);
                    if (concrete.size() > options.maxStringPreview()) {
                        desc = "\"" + escaped + "...\" (" + concrete.size() + " bytes)";
                    } else {
                        desc = "\"" + escaped + "\"";
                    }
                } else if (!concrete.isEmpty() && concrete.size() <= options.maxNumericBytes()) {
                    desc = tyName + " = " + Bytes.unsignedLittleEndian(concrete);
                } else {
                    desc = tyName + " (" + alloc.bytes.size() + " bytes)";
                }
                return new AllocEntry(alloc.id, alloc.typeId, desc, alloc.provenance);
            }

            @Override
            public AllocEntry visitStatic(AllocInfo.Static alloc) {
                return leaf(alloc, "static " + alloc.name);
            }

            @Override
            public AllocEntry visitVTable(AllocInfo.VTable alloc) {
                String desc = alloc.traitName == null
                        ? alloc.tyDesc
                        : alloc.tyDesc + " as " + alloc.traitName;
                return leaf(alloc, "vtable<" + desc + ">");
            }

            @Override
            public AllocEntry visitFunction(AllocInfo.Function alloc) {
                return leaf(alloc, "fn " + alloc.name);
            }
        });
    }

    private static AllocEntry leaf(AllocInfo info, String description) {
        return new AllocEntry(info.id, info.typeId, description, Collections.emptyList());
    }

    /**
     * Get the description of this allocation prefixed with its label.
     *
     * @return {@code alloc<N>: <description>}.
     */
    public String shortDescription() {
        return AllocIndex.label(id) + ": " + description;
    }

    @Override
    public String toString() {
        return shortDescription();
    }
}
