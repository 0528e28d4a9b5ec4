package io.github.eutro.mirlens.core.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A memory location: a local, followed by zero or more projections.
 */
public final class Place {
    /**
     * The local this place is rooted at.
     */
    public final int local;
    /**
     * The projections applied to the local, outermost last.
     */
    public final List<ProjectionElem> projection;

    private Place(int local, List<ProjectionElem> projection) {
        if (local < 0) throw new MalformedIrException("negative local _" + local);
        this.local = local;
        this.projection = projection;
    }

    /**
     * The place that is exactly a local.
     *
     * @param local The local.
     * @return The place.
     */
    public static Place local(int local) {
        return new Place(local, Collections.emptyList());
    }

    /**
     * Extend this place with more projections.
     *
     * @param elems The projections to apply.
     * @return The new place.
     */
    public Place project(ProjectionElem... elems) {
        List<ProjectionElem> ps = new ArrayList<>(projection);
        ps.addAll(Arrays.asList(elems));
        return new Place(local, Collections.unmodifiableList(ps));
    }

    /**
     * Get whether this place is a whole local, with no projections.
     *
     * @return Whether there are no projections.
     */
    public boolean isWholeLocal() {
        return projection.isEmpty();
    }

    /**
     * Get whether this place is exactly the given local.
     *
     * @param local The local.
     * @return Whether this is {@code local} with no projections.
     */
    public boolean isWholeLocal(int local) {
        return this.local == local && projection.isEmpty();
    }
}
