package io.github.eutro.mirlens.core.index;

import io.github.eutro.mirlens.core.conf.RenderOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolves allocation ids to descriptions, following references between allocations.
 * <p>
 * Allocations may point to each other in cycles, so reference-following descriptions
 * are always depth-bounded and never revisit an allocation on the current path.
 */
public final class AllocIndex {
    private static final Logger logger = LogManager.getLogger(AllocIndex.class);

    private final Map<Long, AllocEntry> byId = new TreeMap<>();

    public AllocIndex(Iterable<? extends AllocInfo> allocs, TypeIndex types, RenderOptions options) {
        for (AllocInfo info : allocs) {
            AllocEntry entry = AllocEntry.resolve(info, types, options);
            byId.put(entry.id, entry);
        }
    }

    /**
     * Get the fallback label of an allocation id.
     *
     * @param id The allocation id.
     * @return {@code alloc<N>}.
     */
    public static String label(long id) {
        return "alloc" + id;
    }

    public @Nullable AllocEntry get(long id) {
        return byId.get(id);
    }

    /**
     * Get all entries, in id order.
     *
     * @return The entries.
     */
    public Collection<AllocEntry> entries() {
        return Collections.unmodifiableCollection(byId.values());
    }

    /**
     * Describe an allocation, without following its references.
     *
     * @param id The allocation id.
     * @return The short description, or the fallback label if the id is unknown.
     */
    public String describe(long id) {
        AllocEntry entry = byId.get(id);
        if (entry == null) {
            logger.trace("unknown alloc {}", id);
            return label(id);
        }
        return entry.shortDescription();
    }

    /**
     * Describe an allocation along with the allocations it references, up to a depth.
     * <p>
     * At depth 0 this is exactly {@link #describe(long)}. An allocation that is already
     * being described further up the current path is also described without its references.
     *
     * @param id       The allocation id.
     * @param maxDepth How many levels of references to follow.
     * @return The description, as {@code <short> -> [<ref>, ...]} when there are references.
     */
    public String describeWithRefs(long id, int maxDepth) {
        return describeRecursive(id, maxDepth, new HashSet<>());
    }

    private String describeRecursive(long id, int depth, Set<Long> onPath) {
        if (depth <= 0 || onPath.contains(id)) {
            return describe(id);
        }
        AllocEntry entry = byId.get(id);
        if (entry == null) {
            logger.trace("unknown alloc {}", id);
            return label(id);
        }
        if (entry.referencedAllocs.isEmpty()) {
            return entry.shortDescription();
        }
        onPath.add(id);
        List<String> refs = new ArrayList<>(entry.referencedAllocs.size());
        for (long ref : entry.referencedAllocs) {
            refs.add(describeRecursive(ref, depth - 1, onPath));
        }
        onPath.remove(id);
        return entry.shortDescription() + " -> [" + String.join(", ", refs) + "]";
    }

    /**
     * Get a legend of every known allocation, in id order.
     *
     * @return An {@code ALLOCS} header line, then one line per allocation.
     */
    public List<String> legendLines() {
        List<String> lines = new ArrayList<>(byId.size() + 1);
        lines.add("ALLOCS");
        for (AllocEntry entry : byId.values()) {
            lines.add(entry.shortDescription());
        }
        return lines;
    }

    public int size() {
        return byId.size();
    }
}
